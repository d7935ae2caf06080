package com.example.cardlobby.delivery;

import java.util.concurrent.atomic.AtomicLong;

/** Counters of one event type. */
public class EventTypeStats {

    private final AtomicLong attempted = new AtomicLong();
    private final AtomicLong succeeded = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong fallbackSucceeded = new AtomicLong();
    private final AtomicLong fallbackFailed = new AtomicLong();

    void attempted() { attempted.incrementAndGet(); }
    void succeeded() { succeeded.incrementAndGet(); }
    void failed() { failed.incrementAndGet(); }
    void fallbackSucceeded() { fallbackSucceeded.incrementAndGet(); }
    void fallbackFailed() { fallbackFailed.incrementAndGet(); }

    public Snapshot snapshot() {
        return new Snapshot(attempted.get(), succeeded.get(), failed.get(),
                fallbackSucceeded.get(), fallbackFailed.get());
    }

    public record Snapshot(long attempted, long succeeded, long failed,
                           long fallbackSucceeded, long fallbackFailed) {

        /** Share of emissions that reached the live channel, 0..100. */
        public double successRate() {
            return attempted == 0 ? 0.0 : (succeeded * 100.0) / attempted;
        }
    }
}
