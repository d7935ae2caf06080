package com.example.cardlobby.session;

/** Callbacks from {@link RoomSessionStore}; invoked outside any room lock. */
public interface RoomLifecycleListener {

    default void onRoomCreated(String gameId) { }

    default void onRoomTornDown(String gameId) { }

    /** A persistence write failed; live and persisted state may have drifted apart. */
    default void onPersistenceDrift(String gameId) { }
}
