package com.example.cardlobby.model;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Entity
@Table(
    name = "rooms",
    indexes = {
        @Index(name = "idx_rooms_status", columnList = "status"),
        @Index(name = "idx_rooms_updated_at", columnList = "updatedAt")
    }
)
public class PersistedRoom {

    @Id
    @Column(length = 64, nullable = false, updatable = false)
    private String id;

    @NotBlank
    @Size(max = 64)
    @Column(nullable = false, length = 64)
    private String ownerId;

    @Column(nullable = false, length = 16)
    private String status = RoomStatus.WAITING.wireName();

    /** Bumped on every write; mirrors the live version counter. */
    @Column(nullable = false)
    private long revision;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    @OneToMany(mappedBy = "room", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("joinedAt ASC, userId ASC")
    private List<PersistedRoomPlayer> players = new ArrayList<>();

    protected PersistedRoom() {}

    public PersistedRoom(String id, String ownerId) {
        this.id = id;
        this.ownerId = ownerId;
    }

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        if (updatedAt == null) updatedAt = now;
    }

    public void touch() {
        this.updatedAt = Instant.now();
        this.revision++;
    }

    public Optional<PersistedRoomPlayer> player(String userId) {
        return players.stream().filter(p -> p.getUserId().equals(userId)).findFirst();
    }

    public PersistedRoomPlayer addPlayer(PersistedRoomPlayer p) {
        p.setRoom(this);
        players.add(p);
        return p;
    }

    public boolean removePlayer(String userId) {
        return players.removeIf(p -> p.getUserId().equals(userId));
    }

    public RoomStateView toView() {
        Map<String, PlayerStateView> views = new LinkedHashMap<>();
        for (PersistedRoomPlayer p : players) views.put(p.getUserId(), p.toView());
        return new RoomStateView(id, RoomStatus.fromWire(status), ownerId, views, revision);
    }

    public String getId() { return id; }

    public String getOwnerId() { return ownerId; }
    public void setOwnerId(String ownerId) { this.ownerId = ownerId; }

    public RoomStatus getStatus() { return RoomStatus.fromWire(status); }
    public void setStatus(RoomStatus status) { this.status = status.wireName(); }

    public long getRevision() { return revision; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public List<PersistedRoomPlayer> getPlayers() { return players; }

    @Override
    public String toString() {
        return "PersistedRoom{id='" + id + "', ownerId='" + ownerId + "', status=" + status
                + ", revision=" + revision + ", players=" + players.size() + '}';
    }
}
