package com.example.cardlobby.persistence;

import com.example.cardlobby.model.PlayerStateView;
import com.example.cardlobby.model.RoomStateView;
import com.example.cardlobby.model.RoomStatus;
import com.example.cardlobby.model.TeamAssignment;

import java.util.*;

/**
 * Field-level changes to apply to one persisted room in a single transaction.
 * Built either fluently or as the difference between two views.
 */
public final class StateUpdate {

    private String hostId;
    private RoomStatus status;
    private final Map<String, PlayerChange> playerChanges = new LinkedHashMap<>();
    private final Map<String, PlayerStateView> added = new LinkedHashMap<>();
    private final Set<String> removed = new LinkedHashSet<>();

    public static StateUpdate create() {
        return new StateUpdate();
    }

    /** Changes that turn {@code from} into {@code to}. */
    public static StateUpdate diff(RoomStateView from, RoomStateView to) {
        StateUpdate u = new StateUpdate();
        if (!Objects.equals(from.hostId(), to.hostId())) u.host(to.hostId());
        if (from.status() != to.status()) u.status(to.status());

        for (PlayerStateView target : to.players().values()) {
            PlayerStateView current = from.player(target.userId());
            if (current == null) {
                u.addPlayer(target);
                continue;
            }
            if (current.ready() != target.ready()) u.ready(target.userId(), target.ready());
            if (current.teamAssignment() != target.teamAssignment()) u.team(target.userId(), target.teamAssignment());
            if (current.connected() != target.connected()) u.connected(target.userId(), target.connected());
        }
        for (String userId : from.players().keySet()) {
            if (!to.players().containsKey(userId)) u.removePlayer(userId);
        }
        return u;
    }

    public StateUpdate host(String hostId) {
        this.hostId = hostId;
        return this;
    }

    public StateUpdate status(RoomStatus status) {
        this.status = status;
        return this;
    }

    public StateUpdate ready(String userId, boolean ready) {
        change(userId).ready = ready;
        return this;
    }

    /** {@code null} clears the assignment. */
    public StateUpdate team(String userId, TeamAssignment team) {
        PlayerChange c = change(userId);
        c.teamChanged = true;
        c.team = team;
        return this;
    }

    public StateUpdate connected(String userId, boolean connected) {
        change(userId).connected = connected;
        return this;
    }

    public StateUpdate addPlayer(PlayerStateView player) {
        removed.remove(player.userId());
        added.put(player.userId(), player);
        return this;
    }

    public StateUpdate removePlayer(String userId) {
        added.remove(userId);
        playerChanges.remove(userId);
        removed.add(userId);
        return this;
    }

    public Optional<String> hostId() { return Optional.ofNullable(hostId); }
    public Optional<RoomStatus> status() { return Optional.ofNullable(status); }
    public Map<String, PlayerChange> playerChanges() { return Collections.unmodifiableMap(playerChanges); }
    public Collection<PlayerStateView> addedPlayers() { return Collections.unmodifiableCollection(added.values()); }
    public Set<String> removedPlayers() { return Collections.unmodifiableSet(removed); }

    public boolean isEmpty() {
        return hostId == null && status == null && playerChanges.isEmpty() && added.isEmpty() && removed.isEmpty();
    }

    private PlayerChange change(String userId) {
        return playerChanges.computeIfAbsent(Objects.requireNonNull(userId, "userId"), k -> new PlayerChange());
    }

    @Override
    public String toString() {
        return "StateUpdate{host=" + hostId + ", status=" + status + ", changes=" + playerChanges.keySet()
                + ", added=" + added.keySet() + ", removed=" + removed + "}";
    }

    /** Per-player field changes; a null field is left untouched. */
    public static final class PlayerChange {
        private Boolean ready;
        private Boolean connected;
        private boolean teamChanged;
        private TeamAssignment team;

        public Optional<Boolean> ready() { return Optional.ofNullable(ready); }
        public Optional<Boolean> connected() { return Optional.ofNullable(connected); }
        public boolean teamChanged() { return teamChanged; }
        public TeamAssignment team() { return team; }

        /** Applies this change to a view. */
        public PlayerStateView applyTo(PlayerStateView p) {
            PlayerStateView out = p;
            if (ready != null) out = out.withReady(ready);
            if (connected != null) out = out.withConnected(connected);
            if (teamChanged) out = out.withTeam(team);
            return out;
        }
    }
}
