package com.example.cardlobby.model;

import java.time.Instant;
import java.util.*;

/**
 * Ephemeral room state: players, teams, host, status and version.
 * RoomSessionStore synchronizes on RoomSession instances, so this class itself does not add extra locking.
 */
public class RoomSession {

    public static final int MAX_PLAYERS = 4;

    // ---------------------------------------------------------------------
    // Core identity
    // ---------------------------------------------------------------------

    private final String gameId;
    private final Instant createdAt;

    /** Players by userId (insertion order preserved to keep a stable roster order). */
    private final Map<String, PlayerSession> players = new LinkedHashMap<>();

    // ---------------------------------------------------------------------
    // Lobby state
    // ---------------------------------------------------------------------

    private RoomStatus status = RoomStatus.WAITING;
    private String hostId;
    private long version = 0L;

    /** False while live and persisted state are known to differ. */
    private boolean dbSynced = true;

    /** Live holds changes a failed write never stored; cleared once they are written back. */
    private boolean unsavedChanges;

    // ---------------------------------------------------------------------
    // Construction
    // ---------------------------------------------------------------------

    public RoomSession(String gameId, Instant createdAt) {
        if (gameId == null || gameId.isBlank()) throw new IllegalArgumentException("gameId must not be blank");
        this.gameId = gameId.trim();
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
    }

    // ---------------------------------------------------------------------
    // Basic accessors
    // ---------------------------------------------------------------------

    public String getGameId() { return gameId; }
    public Instant getCreatedAt() { return createdAt; }

    public RoomStatus getStatus() { return status; }

    /** Moves along the state machine; returns false (no change) for an illegal transition. */
    public boolean transitionTo(RoomStatus next) {
        if (!status.canTransitionTo(next)) return false;
        status = next;
        return true;
    }

    public String getHostId() { return hostId; }
    public void setHostId(String hostId) { this.hostId = hostId; }

    public boolean isHost(String userId) {
        return userId != null && userId.equals(hostId);
    }

    public long getVersion() { return version; }

    /** Called once per committed mutation. */
    public long bumpVersion() { return ++version; }

    public boolean isDbSynced() { return dbSynced; }
    public void setDbSynced(boolean dbSynced) { this.dbSynced = dbSynced; }

    public boolean hasUnsavedChanges() { return unsavedChanges; }
    public void setUnsavedChanges(boolean unsavedChanges) { this.unsavedChanges = unsavedChanges; }

    // ---------------------------------------------------------------------
    // Players
    // ---------------------------------------------------------------------

    public List<PlayerSession> getPlayers() {
        return new ArrayList<>(players.values());
    }

    public PlayerSession getPlayer(String userId) {
        if (userId == null) return null;
        return players.get(userId);
    }

    public boolean hasPlayer(String userId) {
        return userId != null && players.containsKey(userId);
    }

    public int playerCount() {
        return players.size();
    }

    public boolean isEmpty() {
        return players.isEmpty();
    }

    public boolean isFull() {
        return players.size() >= MAX_PLAYERS;
    }

    public void addPlayer(PlayerSession p) {
        if (p == null) return;
        players.put(p.getUserId(), p);
    }

    /** Removes the player; its team slot disappears with it. */
    public PlayerSession removePlayer(String userId) {
        if (userId == null) return null;
        return players.remove(userId);
    }

    public List<PlayerSession> getConnectedPlayers() {
        List<PlayerSession> out = new ArrayList<>();
        for (PlayerSession p : players.values()) {
            if (p.isConnected()) out.add(p);
        }
        return out;
    }

    public Set<String> playerIds() {
        return new LinkedHashSet<>(players.keySet());
    }

    // ---------------------------------------------------------------------
    // Host failover
    // ---------------------------------------------------------------------

    /**
     * Assigns a new host if the current host is missing from the roster.
     * The candidate is the remaining player with the earliest joinedAt (userId breaks ties),
     * whether or not they are currently connected.
     * Returns the new host id, or null if nothing changed.
     */
    public String assignNewHostIfNecessary() {
        if (hostId != null && players.containsKey(hostId)) return null;

        Comparator<PlayerSession> byJoin = Comparator
                .comparing(PlayerSession::getJoinedAt)
                .thenComparing(PlayerSession::getUserId);

        PlayerSession candidate = players.values().stream().min(byJoin).orElse(null);

        hostId = (candidate == null) ? null : candidate.getUserId();
        return hostId;
    }

    // ---------------------------------------------------------------------
    // Teams
    // ---------------------------------------------------------------------

    public Teams getTeams() {
        List<String> t1 = new ArrayList<>();
        List<String> t2 = new ArrayList<>();
        for (PlayerSession p : players.values()) {
            if (p.getTeamAssignment() == TeamAssignment.TEAM_1) t1.add(p.getUserId());
            else if (p.getTeamAssignment() == TeamAssignment.TEAM_2) t2.add(p.getUserId());
        }
        return new Teams(t1, t2);
    }

    /** Overwrites every player's slot; players not named in {@code teams} end up unassigned. */
    public void applyTeams(Teams teams) {
        for (PlayerSession p : players.values()) {
            p.setTeamAssignment(teams.assignmentOf(p.getUserId()));
        }
    }

    public void clearTeams() {
        for (PlayerSession p : players.values()) p.setTeamAssignment(null);
    }

    // ---------------------------------------------------------------------
    // Snapshots
    // ---------------------------------------------------------------------

    public RoomStateView toView() {
        Map<String, PlayerStateView> views = new LinkedHashMap<>();
        for (PlayerSession p : players.values()) views.put(p.getUserId(), p.toView());
        return new RoomStateView(gameId, status, hostId, views, version);
    }

    @Override
    public String toString() {
        return "RoomSession{" +
                "gameId='" + gameId + '\'' +
                ", status=" + status +
                ", hostId='" + hostId + '\'' +
                ", players=" + players.keySet() +
                ", version=" + version +
                '}';
    }
}
