package com.example.cardlobby.persistence;

import com.example.cardlobby.model.PlayerStateView;
import com.example.cardlobby.model.RoomStateView;
import com.example.cardlobby.model.RoomStatus;
import com.example.cardlobby.model.Teams;

import java.util.List;
import java.util.Optional;

/**
 * Port to the durable room store, the source of truth across restarts.
 * Every write may throw {@link com.example.cardlobby.error.PersistenceException};
 * writes against a room that was never persisted throw it too.
 */
public interface PersistentRooms {

    Optional<RoomStateView> findById(String gameId);

    void updateStatus(String gameId, RoomStatus status);

    void setPlayerReady(String gameId, String userId, boolean ready);

    /** Replaces every team assignment of the room; players in neither list are cleared. */
    Teams formTeams(String gameId, List<String> team1, List<String> team2);

    /**
     * Adds or refreshes a member and records {@code hostId} as the owner, so a record that
     * outlived its last member never keeps pointing at a departed owner. Creates the room
     * record on first use. A null {@code hostId} keeps the stored owner (or makes the
     * member the owner of a new record).
     */
    void addPlayer(String gameId, PlayerStateView player, String hostId);

    void removePlayer(String gameId, String userId);

    void updateOwner(String gameId, String hostId);

    /**
     * Applies all changes under the room's row lock in one transaction.
     * A failure rolls back the whole update and propagates.
     *
     * @return the persisted state after commit
     */
    RoomStateView applyAtomically(String gameId, StateUpdate update);
}
