package com.example.cardlobby.session;

import com.example.cardlobby.model.PlayerStateView;
import com.example.cardlobby.model.RoomSession;
import com.example.cardlobby.model.RoomStateView;
import com.example.cardlobby.model.TeamAssignment;
import com.example.cardlobby.model.Teams;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** JSON-ready maps for event payloads and REST bodies. Null values are kept. */
public final class RoomPayloads {

    private RoomPayloads() { }

    public static Map<String, Object> player(PlayerStateView p) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("userId", p.userId());
        m.put("username", p.username());
        m.put("isReady", p.ready());
        m.put("teamAssignment", TeamAssignment.toNumber(p.teamAssignment()));
        m.put("isConnected", p.connected());
        m.put("joinedAt", p.joinedAt() == null ? null : p.joinedAt().toString());
        return m;
    }

    public static List<Map<String, Object>> players(RoomStateView view) {
        List<Map<String, Object>> out = new ArrayList<>();
        for (PlayerStateView p : view.players().values()) out.add(player(p));
        return out;
    }

    public static Map<String, Object> teams(Teams teams) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("team1", teams.team1());
        m.put("team2", teams.team2());
        return m;
    }

    /** Full room snapshot as sent in room-joined and returned by GET /api/rooms/{id}. */
    public static Map<String, Object> room(RoomStateView view, boolean dbSynced) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("gameId", view.gameId());
        m.put("status", view.status().wireName());
        m.put("hostId", view.hostId());
        m.put("players", players(view));
        m.put("teams", teams(view.teams()));
        m.put("playerCount", view.playerCount());
        m.put("maxPlayers", RoomSession.MAX_PLAYERS);
        m.put("version", view.version());
        m.put("dbSynced", dbSynced);
        return m;
    }

    public static Map<String, Object> readiness(Readiness r) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("readyCount", r.readyCount());
        m.put("connectedPlayers", r.connectedPlayers());
        m.put("totalPlayers", r.totalPlayers());
        m.put("allReady", r.allReady());
        m.put("canStartGame", r.canStart());
        m.put("gameStartReason", r.reason());
        m.put("gameMode", r.gameMode().label());
        return m;
    }
}
