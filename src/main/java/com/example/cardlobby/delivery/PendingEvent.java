package com.example.cardlobby.delivery;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;

/**
 * One emission in flight. State transitions are guarded by the instance monitor;
 * the result future completes exactly once.
 */
public class PendingEvent {

    private final String id;
    private final EventTarget target;
    private final String eventName;
    private final Map<String, Object> payload;
    private final EmitOptions options;
    private final Instant createdAt;
    private final CompletableFuture<Boolean> result = new CompletableFuture<>();

    private int attempts;
    private DeliveryStatus status = DeliveryStatus.PENDING;
    private Instant lastAttemptAt;
    private String lastError;
    private ScheduledFuture<?> confirmationTimeout;

    public PendingEvent(String id, EventTarget target, String eventName, Map<String, Object> payload,
                        EmitOptions options, Instant createdAt) {
        this.id = id;
        this.target = target;
        this.eventName = eventName;
        this.payload = payload;
        this.options = options;
        this.createdAt = createdAt;
    }

    public String id() { return id; }
    public EventTarget target() { return target; }
    public String eventName() { return eventName; }
    public Map<String, Object> payload() { return payload; }
    public EmitOptions options() { return options; }
    public Instant createdAt() { return createdAt; }
    public CompletableFuture<Boolean> result() { return result; }

    public synchronized int attempts() { return attempts; }
    public synchronized DeliveryStatus status() { return status; }
    public synchronized Instant lastAttemptAt() { return lastAttemptAt; }
    public synchronized String lastError() { return lastError; }

    /** @return the attempt number, or -1 if the event already left PENDING */
    synchronized int beginAttempt(Instant now) {
        if (status != DeliveryStatus.PENDING) return -1;
        attempts++;
        lastAttemptAt = now;
        return attempts;
    }

    synchronized void recordError(String error) {
        this.lastError = error;
    }

    synchronized void awaitConfirmation(ScheduledFuture<?> timeout) {
        cancelConfirmationTimeout();
        this.confirmationTimeout = timeout;
    }

    /** PENDING → CONFIRMED; false if already terminal. */
    synchronized boolean markConfirmed() {
        if (status != DeliveryStatus.PENDING) return false;
        status = DeliveryStatus.CONFIRMED;
        cancelConfirmationTimeout();
        return true;
    }

    /** PENDING → FAILED; false if already terminal. */
    synchronized boolean markFailed(String error) {
        if (status != DeliveryStatus.PENDING) return false;
        status = DeliveryStatus.FAILED;
        if (error != null) lastError = error;
        cancelConfirmationTimeout();
        return true;
    }

    /** PENDING → EXPIRED; false if already terminal. */
    synchronized boolean markExpired() {
        if (status != DeliveryStatus.PENDING) return false;
        status = DeliveryStatus.EXPIRED;
        cancelConfirmationTimeout();
        return true;
    }

    private void cancelConfirmationTimeout() {
        if (confirmationTimeout != null) {
            confirmationTimeout.cancel(false);
            confirmationTimeout = null;
        }
    }

    @Override
    public String toString() {
        return "PendingEvent{" + id + " " + eventName + " -> " + target + "}";
    }
}
