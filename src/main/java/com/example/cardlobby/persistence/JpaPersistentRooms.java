package com.example.cardlobby.persistence;

import com.example.cardlobby.error.PersistenceException;
import com.example.cardlobby.model.*;
import com.example.cardlobby.repository.PersistedRoomRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Adapter on the JPA repository. Active with {@code lobby.persistence.mode=jpa}.
 * Every write runs in its own transaction and locks the room row first.
 */
public class JpaPersistentRooms implements PersistentRooms {

    private static final Logger log = LoggerFactory.getLogger(JpaPersistentRooms.class);

    private final PersistedRoomRepository repo;
    private final TransactionTemplate tx;

    public JpaPersistentRooms(PersistedRoomRepository repo, TransactionTemplate tx) {
        this.repo = repo;
        this.tx = tx;
    }

    @Override
    public Optional<RoomStateView> findById(String gameId) {
        if (gameId == null || gameId.isBlank()) return Optional.empty();
        try {
            return tx.execute(status -> repo.findById(gameId).map(PersistedRoom::toView));
        } catch (DataAccessException | TransactionException e) {
            throw new PersistenceException("Loading room " + gameId + " failed", e);
        }
    }

    @Override
    public void updateStatus(String gameId, RoomStatus status) {
        write(gameId, room -> {
            room.setStatus(status);
            return null;
        });
    }

    @Override
    public void setPlayerReady(String gameId, String userId, boolean ready) {
        write(gameId, room -> {
            room.player(userId)
                .orElseThrow(() -> new PersistenceException("Player " + userId + " not persisted in room " + gameId, null))
                .setReady(ready);
            return null;
        });
    }

    @Override
    public Teams formTeams(String gameId, List<String> team1, List<String> team2) {
        Teams teams = new Teams(team1, team2);
        write(gameId, room -> {
            for (PersistedRoomPlayer p : room.getPlayers()) {
                p.setTeamAssignment(teams.assignmentOf(p.getUserId()));
            }
            return null;
        });
        return teams;
    }

    @Override
    public void addPlayer(String gameId, PlayerStateView player, String hostId) {
        try {
            tx.executeWithoutResult(status -> {
                PersistedRoom room = repo.findByIdForUpdate(gameId).orElse(null);
                if (room == null) {
                    room = new PersistedRoom(gameId, hostId != null ? hostId : player.userId());
                    room.addPlayer(PersistedRoomPlayer.from(player));
                    repo.save(room);
                    log.info("Persisted new room {} (owner={})", gameId, room.getOwnerId());
                    return;
                }
                Optional<PersistedRoomPlayer> existing = room.player(player.userId());
                if (existing.isPresent()) {
                    existing.get().setUsername(player.username());
                    existing.get().setConnected(player.connected());
                } else {
                    room.addPlayer(PersistedRoomPlayer.from(player));
                }
                if (hostId != null && !hostId.equals(room.getOwnerId())) {
                    log.info("Room {} owner {} -> {}", gameId, room.getOwnerId(), hostId);
                    room.setOwnerId(hostId);
                }
                room.touch();
            });
        } catch (DataAccessException | TransactionException e) {
            throw new PersistenceException("Adding player " + player.userId() + " to room " + gameId + " failed", e);
        }
    }

    @Override
    public void removePlayer(String gameId, String userId) {
        write(gameId, room -> {
            room.removePlayer(userId);
            return null;
        });
    }

    @Override
    public void updateOwner(String gameId, String hostId) {
        write(gameId, room -> {
            room.setOwnerId(hostId);
            return null;
        });
    }

    @Override
    public RoomStateView applyAtomically(String gameId, StateUpdate update) {
        return write(gameId, room -> {
            update.hostId().ifPresent(room::setOwnerId);
            update.status().ifPresent(room::setStatus);
            for (String userId : update.removedPlayers()) room.removePlayer(userId);
            for (PlayerStateView added : update.addedPlayers()) {
                Optional<PersistedRoomPlayer> existing = room.player(added.userId());
                if (existing.isPresent()) {
                    // flush inserts before deletes, so overwrite instead of replace
                    PersistedRoomPlayer p = existing.get();
                    p.setUsername(added.username());
                    p.setReady(added.ready());
                    p.setConnected(added.connected());
                    p.setTeamAssignment(added.teamAssignment());
                } else {
                    room.addPlayer(PersistedRoomPlayer.from(added));
                }
            }
            update.playerChanges().forEach((userId, change) -> {
                PersistedRoomPlayer p = room.player(userId)
                        .orElseThrow(() -> new PersistenceException("Player " + userId + " not persisted in room " + gameId, null));
                change.ready().ifPresent(p::setReady);
                change.connected().ifPresent(p::setConnected);
                if (change.teamChanged()) p.setTeamAssignment(change.team());
            });
            log.debug("Applied {} to room {}", update, gameId);
            return room.toView();
        });
    }

    /** Locks the row, applies, bumps the revision, commits. Any exception rolls back. */
    private <T> T write(String gameId, Function<PersistedRoom, T> change) {
        try {
            return tx.execute(status -> {
                PersistedRoom room = repo.findByIdForUpdate(gameId)
                        .orElseThrow(() -> new PersistenceException("Room " + gameId + " is not persisted", null));
                room.touch();
                return change.apply(room);
            });
        } catch (DataAccessException | TransactionException e) {
            throw new PersistenceException("Writing room " + gameId + " failed", e);
        }
    }
}
