package com.example.cardlobby.reconcile;

import com.example.cardlobby.model.RoomStateView;

/** Resolves one inconsistency by returning the next resolved view. */
@FunctionalInterface
public interface ResolutionStrategy {

    RoomStateView resolve(RoomStateView resolved, Inconsistency inconsistency,
                          RoomStateView persisted, RoomStateView live);
}
