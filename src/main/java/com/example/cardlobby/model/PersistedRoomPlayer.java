package com.example.cardlobby.model;

import jakarta.persistence.*;

import java.time.Instant;

@Entity
@Table(
    name = "room_players",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_room_players_room_user", columnNames = {"room_id", "user_id"})
    }
)
public class PersistedRoomPlayer {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "room_id", nullable = false)
    private PersistedRoom room;

    @Column(name = "user_id", nullable = false, length = 64)
    private String userId;

    @Column(length = 100)
    private String username;

    @Column(nullable = false)
    private boolean ready;

    /** 1 or 2; null while teams are not formed. */
    private Integer teamAssignment;

    @Column(nullable = false)
    private boolean connected = true;

    @Column(nullable = false)
    private Instant joinedAt;

    protected PersistedRoomPlayer() {}

    public PersistedRoomPlayer(String userId, String username, Instant joinedAt) {
        this.userId = userId;
        this.username = username;
        this.joinedAt = joinedAt != null ? joinedAt : Instant.now();
    }

    public static PersistedRoomPlayer from(PlayerStateView v) {
        PersistedRoomPlayer p = new PersistedRoomPlayer(v.userId(), v.username(), v.joinedAt());
        p.ready = v.ready();
        p.connected = v.connected();
        p.teamAssignment = TeamAssignment.toNumber(v.teamAssignment());
        return p;
    }

    public PlayerStateView toView() {
        return new PlayerStateView(userId, username, ready, TeamAssignment.fromNumber(teamAssignment), connected, joinedAt);
    }

    public Long getId() { return id; }

    PersistedRoom getRoom() { return room; }
    void setRoom(PersistedRoom room) { this.room = room; }

    public String getUserId() { return userId; }

    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }

    public boolean isReady() { return ready; }
    public void setReady(boolean ready) { this.ready = ready; }

    public TeamAssignment getTeamAssignment() { return TeamAssignment.fromNumber(teamAssignment); }
    public void setTeamAssignment(TeamAssignment team) { this.teamAssignment = TeamAssignment.toNumber(team); }

    public boolean isConnected() { return connected; }
    public void setConnected(boolean connected) { this.connected = connected; }

    public Instant getJoinedAt() { return joinedAt; }
}
