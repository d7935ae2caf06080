package com.example.cardlobby.model;

import java.time.Instant;

/** Immutable per-player snapshot; used for live and persisted sides alike. */
public record PlayerStateView(
        String userId,
        String username,
        boolean ready,
        TeamAssignment teamAssignment,
        boolean connected,
        Instant joinedAt
) {

    public PlayerStateView withReady(boolean value) {
        return new PlayerStateView(userId, username, value, teamAssignment, connected, joinedAt);
    }

    public PlayerStateView withTeam(TeamAssignment value) {
        return new PlayerStateView(userId, username, ready, value, connected, joinedAt);
    }

    public PlayerStateView withConnected(boolean value) {
        return new PlayerStateView(userId, username, ready, teamAssignment, value, joinedAt);
    }
}
