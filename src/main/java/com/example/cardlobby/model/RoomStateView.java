package com.example.cardlobby.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable room snapshot. The live store and the persisted store both render into this
 * shape so reconciliation can compare them field by field.
 */
public record RoomStateView(
        String gameId,
        RoomStatus status,
        String hostId,
        Map<String, PlayerStateView> players,
        long version
) {

    public RoomStateView {
        players = (players == null)
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(players));
    }

    public PlayerStateView player(String userId) {
        return players.get(userId);
    }

    public int playerCount() {
        return players.size();
    }

    /** Teams derived from per-player assignments (insertion order kept). */
    public Teams teams() {
        List<String> t1 = new ArrayList<>();
        List<String> t2 = new ArrayList<>();
        for (PlayerStateView p : players.values()) {
            if (p.teamAssignment() == TeamAssignment.TEAM_1) t1.add(p.userId());
            else if (p.teamAssignment() == TeamAssignment.TEAM_2) t2.add(p.userId());
        }
        return new Teams(t1, t2);
    }

    public RoomStateView withHost(String newHostId) {
        return new RoomStateView(gameId, status, newHostId, players, version);
    }

    public RoomStateView withPlayer(PlayerStateView player) {
        Map<String, PlayerStateView> next = new LinkedHashMap<>(players);
        next.put(player.userId(), player);
        return new RoomStateView(gameId, status, hostId, next, version);
    }

    public RoomStateView withoutPlayer(String userId) {
        Map<String, PlayerStateView> next = new LinkedHashMap<>(players);
        next.remove(userId);
        return new RoomStateView(gameId, status, hostId, next, version);
    }
}
