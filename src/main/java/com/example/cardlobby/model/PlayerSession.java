package com.example.cardlobby.model;

import java.time.Instant;
import java.util.Objects;

/** Live player state inside a RoomSession. Mutated only under the room's lock. */
public class PlayerSession {

    private final String userId;
    private String username;
    private String connectionId;          // null while disconnected
    private boolean ready = false;
    private TeamAssignment teamAssignment; // null until teams are formed
    private boolean connected = true;
    private final Instant joinedAt;
    private Instant disconnectedAt;
    private Instant reconnectedAt;

    public PlayerSession(String userId, String username, Instant joinedAt) {
        this.userId = Objects.requireNonNull(userId, "userId");
        this.username = (username == null || username.isBlank()) ? userId : username;
        this.joinedAt = Objects.requireNonNull(joinedAt, "joinedAt");
    }

    // identity
    public String getUserId() { return userId; }
    public String getUsername() { return username; }
    public void setUsername(String username) { if (username != null && !username.isBlank()) this.username = username; }

    // connection
    public String getConnectionId() { return connectionId; }
    public void setConnectionId(String connectionId) { this.connectionId = connectionId; }

    public boolean isConnected() { return connected; }

    public void markDisconnected(Instant at) {
        this.connected = false;
        this.connectionId = null;
        this.disconnectedAt = at;
    }

    public void markReconnected(String connectionId, Instant at) {
        this.connected = true;
        this.connectionId = connectionId;
        this.reconnectedAt = at;
    }

    /** Used by reconciliation, which only flips the flag. */
    public void setConnected(boolean connected) { this.connected = connected; }

    public Instant getDisconnectedAt() { return disconnectedAt; }
    public Instant getReconnectedAt() { return reconnectedAt; }
    public Instant getJoinedAt() { return joinedAt; }

    // lobby state
    public boolean isReady() { return ready; }
    public void setReady(boolean ready) { this.ready = ready; }

    public TeamAssignment getTeamAssignment() { return teamAssignment; }
    public void setTeamAssignment(TeamAssignment teamAssignment) { this.teamAssignment = teamAssignment; }

    public PlayerStateView toView() {
        return new PlayerStateView(userId, username, ready, teamAssignment, connected, joinedAt);
    }

    @Override
    public String toString() {
        return "PlayerSession{" +
                "userId='" + userId + '\'' +
                ", username='" + username + '\'' +
                ", ready=" + ready +
                ", team=" + teamAssignment +
                ", connected=" + connected +
                ", joinedAt=" + joinedAt +
                '}';
    }
}
