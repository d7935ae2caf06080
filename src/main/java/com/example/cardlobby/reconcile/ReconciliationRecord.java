package com.example.cardlobby.reconcile;

import com.example.cardlobby.model.RoomStatus;

import java.time.Instant;
import java.util.Map;

public record ReconciliationRecord(
        String gameId,
        Instant timestamp,
        int inconsistencyCount,
        Map<InconsistencyType, Integer> resolvedByType,
        int playerCount,
        String hostId,
        RoomStatus status,
        boolean changed,
        boolean persisted
) {

    public ReconciliationRecord {
        resolvedByType = (resolvedByType == null) ? Map.of() : Map.copyOf(resolvedByType);
    }
}
