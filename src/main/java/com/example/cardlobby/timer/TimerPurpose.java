package com.example.cardlobby.timer;

public enum TimerPurpose {
    /** Removes a disconnected player once the reconnect window closes (subject = userId). */
    EVICTION,
    /** Periodic live/persisted reconciliation of one room. */
    RECONCILIATION,
    /** Tears a completed room down after its grace period. */
    TEARDOWN
}
