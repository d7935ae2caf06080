package com.example.cardlobby.timer;

import java.util.Objects;

/** (room, purpose, subject); the subject is the userId for evictions and empty otherwise. */
public record TimerKey(String roomId, TimerPurpose purpose, String subject) {

    public TimerKey {
        Objects.requireNonNull(roomId, "roomId");
        Objects.requireNonNull(purpose, "purpose");
        subject = (subject == null) ? "" : subject;
    }

    public static TimerKey eviction(String roomId, String userId) {
        return new TimerKey(roomId, TimerPurpose.EVICTION, userId);
    }

    public static TimerKey reconciliation(String roomId) {
        return new TimerKey(roomId, TimerPurpose.RECONCILIATION, null);
    }

    public static TimerKey teardown(String roomId) {
        return new TimerKey(roomId, TimerPurpose.TEARDOWN, null);
    }
}
