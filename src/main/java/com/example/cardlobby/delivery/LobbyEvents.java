package com.example.cardlobby.delivery;

import java.util.Set;

/** Event names of the real-time catalogue. */
public final class LobbyEvents {

    private LobbyEvents() { }

    // client -> server
    public static final String JOIN_ROOM = "join-room";
    public static final String LEAVE_ROOM = "leave-room";
    public static final String SET_READY = "set-ready";
    public static final String FORM_TEAMS = "form-teams";
    public static final String START_GAME = "start-game";
    public static final String CONFIRM_DELIVERY = "confirm-delivery";
    public static final String PING = "ping";

    // server -> client
    public static final String ROOM_JOINED = "room-joined";
    public static final String PLAYER_JOINED = "player-joined";
    public static final String PLAYER_LEFT = "player-left";
    public static final String PLAYER_DISCONNECTED = "player-disconnected";
    public static final String PLAYER_RECONNECTED = "player-reconnected";
    public static final String PLAYER_REMOVED = "player-removed";
    public static final String PLAYER_READY_CHANGED = "player-ready-changed";
    public static final String TEAMS_FORMED = "teams-formed";
    public static final String GAME_STARTING = "game-starting";
    public static final String HOST_TRANSFERRED = "host-transferred";
    public static final String STATE_SYNCHRONIZED = "state-synchronized";
    public static final String FALLBACK_ACTIVE = "websocket-fallback-active";
    public static final String ERROR = "error";
    public static final String WARNING = "warning";
    public static final String PONG = "pong";

    /** Events whose loss desynchronizes clients; eligible for HTTP fallback. */
    public static final Set<String> DEFAULT_CRITICAL = Set.of(
            PLAYER_READY_CHANGED,
            TEAMS_FORMED,
            GAME_STARTING,
            PLAYER_JOINED,
            PLAYER_LEFT,
            STATE_SYNCHRONIZED
    );
}
