package com.example.cardlobby.reconcile;

import java.time.Instant;
import java.util.Comparator;

/**
 * One field where live and persisted state disagree.
 * {@code playerId} is null for room-level fields.
 */
public record Inconsistency(
        InconsistencyType type,
        String gameId,
        String playerId,
        Object liveValue,
        Object persistedValue,
        Severity severity,
        Instant detectedAt
) {

    /** Most severe first; detection order is kept within one severity. */
    public static final Comparator<Inconsistency> BY_SEVERITY_DESC =
            Comparator.comparing(Inconsistency::severity).reversed();

    public static Inconsistency of(InconsistencyType type, String gameId, String playerId,
                                   Object liveValue, Object persistedValue, Instant detectedAt) {
        return new Inconsistency(type, gameId, playerId, liveValue, persistedValue, type.severity(), detectedAt);
    }
}
