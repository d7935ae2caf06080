package com.example.cardlobby.persistence;

import com.example.cardlobby.error.PersistenceException;
import com.example.cardlobby.model.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Process-local store for deployments without a database and for tests.
 * Each record is guarded by its own lock, the counterpart of the JPA row lock.
 */
public class InMemoryPersistentRooms implements PersistentRooms {

    private final Map<String, Record> rooms = new ConcurrentHashMap<>();

    @Override
    public Optional<RoomStateView> findById(String gameId) {
        if (gameId == null) return Optional.empty();
        Record r = rooms.get(gameId);
        if (r == null) return Optional.empty();
        synchronized (r) {
            return Optional.of(r.view);
        }
    }

    @Override
    public void updateStatus(String gameId, RoomStatus status) {
        write(gameId, v -> new RoomStateView(v.gameId(), status, v.hostId(), v.players(), v.version()));
    }

    @Override
    public void setPlayerReady(String gameId, String userId, boolean ready) {
        write(gameId, v -> v.withPlayer(requirePlayer(v, userId).withReady(ready)));
    }

    @Override
    public Teams formTeams(String gameId, List<String> team1, List<String> team2) {
        Teams teams = new Teams(team1, team2);
        write(gameId, v -> {
            Map<String, PlayerStateView> next = new LinkedHashMap<>();
            v.players().forEach((id, p) -> next.put(id, p.withTeam(teams.assignmentOf(id))));
            return new RoomStateView(v.gameId(), v.status(), v.hostId(), next, v.version());
        });
        return teams;
    }

    @Override
    public void addPlayer(String gameId, PlayerStateView player, String hostId) {
        Record fresh = new Record(new RoomStateView(gameId, RoomStatus.WAITING,
                hostId != null ? hostId : player.userId(), Map.of(), 0L));
        Record r = rooms.computeIfAbsent(gameId, k -> fresh);
        synchronized (r) {
            PlayerStateView existing = r.view.player(player.userId());
            PlayerStateView next = (existing == null)
                    ? player
                    : new PlayerStateView(existing.userId(), player.username(), existing.ready(),
                            existing.teamAssignment(), player.connected(), existing.joinedAt());
            RoomStateView v = r.view.withPlayer(next);
            if (hostId != null) v = v.withHost(hostId);
            r.view = bump(v);
        }
    }

    @Override
    public void removePlayer(String gameId, String userId) {
        write(gameId, v -> v.withoutPlayer(userId));
    }

    @Override
    public void updateOwner(String gameId, String hostId) {
        write(gameId, v -> v.withHost(hostId));
    }

    @Override
    public RoomStateView applyAtomically(String gameId, StateUpdate update) {
        return write(gameId, v -> {
            RoomStateView next = v;
            if (update.hostId().isPresent()) next = next.withHost(update.hostId().get());
            if (update.status().isPresent()) {
                next = new RoomStateView(next.gameId(), update.status().get(), next.hostId(), next.players(), next.version());
            }
            for (String userId : update.removedPlayers()) next = next.withoutPlayer(userId);
            for (PlayerStateView added : update.addedPlayers()) next = next.withPlayer(added);
            for (Map.Entry<String, StateUpdate.PlayerChange> e : update.playerChanges().entrySet()) {
                next = next.withPlayer(e.getValue().applyTo(requirePlayer(next, e.getKey())));
            }
            return next;
        });
    }

    /** Test helper: seeds or replaces a persisted record. */
    public void put(RoomStateView view) {
        rooms.put(view.gameId(), new Record(view));
    }

    public void delete(String gameId) {
        rooms.remove(gameId);
    }

    private RoomStateView write(String gameId, UnaryOperator<RoomStateView> change) {
        Record r = rooms.get(gameId);
        if (r == null) throw new PersistenceException("Room " + gameId + " is not persisted", null);
        synchronized (r) {
            // computed fully before assignment: a failure leaves the record untouched
            RoomStateView next = bump(change.apply(r.view));
            r.view = next;
            return next;
        }
    }

    private static PlayerStateView requirePlayer(RoomStateView v, String userId) {
        PlayerStateView p = v.player(userId);
        if (p == null) throw new PersistenceException("Player " + userId + " not persisted in room " + v.gameId(), null);
        return p;
    }

    private static RoomStateView bump(RoomStateView v) {
        return new RoomStateView(v.gameId(), v.status(), v.hostId(), v.players(), v.version() + 1);
    }

    private static final class Record {
        private RoomStateView view;

        private Record(RoomStateView view) {
            this.view = view;
        }
    }
}
