package com.example.cardlobby.model;

import java.util.Locale;

/** Room lifecycle: WAITING → STARTING → PLAYING → COMPLETED (terminal). */
public enum RoomStatus {
    WAITING,
    STARTING,
    PLAYING,
    COMPLETED;

    /** Lower-case name used on the wire and in persisted rows. */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Only a waiting room accepts join/leave/ready/team mutations. */
    public boolean acceptsRosterChanges() {
        return this == WAITING;
    }

    public boolean canTransitionTo(RoomStatus next) {
        if (next == null) return false;
        return switch (this) {
            case WAITING -> next == STARTING;
            case STARTING -> next == PLAYING || next == WAITING;
            case PLAYING -> next == COMPLETED;
            case COMPLETED -> false;
        };
    }

    public static RoomStatus fromWire(String raw) {
        if (raw == null || raw.isBlank()) return WAITING;
        return RoomStatus.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
