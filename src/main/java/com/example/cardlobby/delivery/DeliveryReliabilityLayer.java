package com.example.cardlobby.delivery;

import com.example.cardlobby.error.DeliveryException;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * At-least-once wrapper around the real-time channel.
 *
 * Every emission gets an {@code _eventId} and {@code _timestamp}, is attempted on the
 * background scheduler and retried with exponential backoff. Critical events that exhaust
 * their retries get exactly one out-of-band HTTP call through the {@link FallbackClient};
 * the caller's future still completes {@code false} because the live leg failed.
 */
public class DeliveryReliabilityLayer {

    private static final Logger log = LoggerFactory.getLogger(DeliveryReliabilityLayer.class);

    private static final char[] ID_ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789".toCharArray();

    private final EventTransport transport;
    private final FallbackClient fallbackClient;
    private final ScheduledExecutorService scheduler;
    private final EmitOptions defaults;
    private final Duration eventTtl;
    private final Clock clock;

    private final Map<String, PendingEvent> pending = new ConcurrentHashMap<>();
    private final Map<String, EventTypeStats> stats = new ConcurrentHashMap<>();
    private final Set<String> criticalEvents = ConcurrentHashMap.newKeySet();

    public DeliveryReliabilityLayer(EventTransport transport,
                                    FallbackClient fallbackClient,
                                    ScheduledExecutorService scheduler,
                                    EmitOptions defaults,
                                    Duration eventTtl,
                                    Clock clock) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.fallbackClient = Objects.requireNonNull(fallbackClient, "fallbackClient");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.defaults = (defaults == null) ? EmitOptions.DEFAULTS : defaults;
        this.eventTtl = (eventTtl == null) ? Duration.ofMinutes(5) : eventTtl;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.criticalEvents.addAll(LobbyEvents.DEFAULT_CRITICAL);
    }

    public EmitOptions defaults() {
        return defaults;
    }

    // ========================================================================
    //  EMISSION
    // ========================================================================

    public CompletableFuture<Boolean> emitWithRetry(String target, String eventName, Map<String, Object> payload) {
        return emitWithRetry(target, eventName, payload, defaults);
    }

    public CompletableFuture<Boolean> emitWithRetry(String target, String eventName,
                                                    Map<String, Object> payload, EmitOptions options) {
        return emit(EventTarget.parse(target), eventName, payload, options);
    }

    public CompletableFuture<Boolean> emit(EventTarget target, String eventName,
                                           Map<String, Object> payload, EmitOptions options) {
        Objects.requireNonNull(target, "target");
        if (eventName == null || eventName.isBlank()) throw new IllegalArgumentException("eventName must not be blank");
        EmitOptions opts = (options == null) ? defaults : options;

        Instant now = clock.instant();
        String eventId = generateEventId(now);
        Map<String, Object> data = new LinkedHashMap<>();
        if (payload != null) data.putAll(payload);
        data.put("_eventId", eventId);
        data.put("_timestamp", now.toString());

        PendingEvent event = new PendingEvent(eventId, target, eventName, Collections.unmodifiableMap(data), opts, now);
        pending.put(eventId, event);
        statsFor(eventName).attempted();

        try {
            scheduler.execute(() -> attempt(event));
        } catch (RuntimeException e) {
            // scheduler rejected (shutting down)
            fail(event, e.toString());
        }
        return event.result();
    }

    private void attempt(PendingEvent event) {
        int attemptNo = event.beginAttempt(clock.instant());
        if (attemptNo < 0) return;

        try {
            transport.deliver(event.target(), event.eventName(), event.payload());
        } catch (UnknownConnectionException e) {
            log.debug("Emit {} aborted: {}", event, e.getMessage());
            fail(event, e.getMessage());
            return;
        } catch (IOException | RuntimeException e) {
            onAttemptFailed(event, attemptNo, e.toString());
            return;
        }

        if (!event.options().awaitConfirmation()) {
            succeed(event);
            return;
        }
        long timeoutMs = event.options().confirmationTimeout().toMillis();
        event.awaitConfirmation(scheduler.schedule(() -> {
            if (event.status() == DeliveryStatus.PENDING && event.attempts() == attemptNo) {
                onAttemptFailed(event, attemptNo, "Confirmation timeout after " + timeoutMs + "ms");
            }
        }, timeoutMs, TimeUnit.MILLISECONDS));
    }

    private void onAttemptFailed(PendingEvent event, int attemptNo, String error) {
        event.recordError(error);
        if (attemptNo < event.options().maxRetries()) {
            Duration delay = event.options().delayBeforeRetry(attemptNo);
            log.debug("Emit {} attempt {}/{} failed ({}), retrying in {}ms",
                    event, attemptNo, event.options().maxRetries(), error, delay.toMillis());
            scheduler.schedule(() -> attempt(event), delay.toMillis(), TimeUnit.MILLISECONDS);
            return;
        }
        log.warn("Emit {} failed after {} attempt(s): {}", event, attemptNo, error);
        fail(event, error);
    }

    private void succeed(PendingEvent event) {
        if (event.result().complete(true)) {
            statsFor(event.eventName()).succeeded();
        }
        // stays pending until confirmed or swept, so a late confirm-delivery still resolves
    }

    private void fail(PendingEvent event, String error) {
        if (!event.markFailed(error)) return;
        pending.remove(event.id());
        statsFor(event.eventName()).failed();

        if (isCritical(event.eventName())) {
            runFallback(event);
            notifyFallbackActive(event);
        }
        event.result().complete(false);
    }

    private void runFallback(PendingEvent event) {
        try {
            fallbackClient.execute(event.eventName(), event.payload());
            statsFor(event.eventName()).fallbackSucceeded();
            log.info("HTTP fallback succeeded for {}", event);
        } catch (DeliveryException e) {
            statsFor(event.eventName()).fallbackFailed();
            log.warn("HTTP fallback failed for {}: {}", event, e.getMessage());
        } catch (RuntimeException e) {
            statsFor(event.eventName()).fallbackFailed();
            log.error("HTTP fallback error for {}", event, e);
        }
    }

    private void notifyFallbackActive(PendingEvent event) {
        Map<String, Object> notice = new LinkedHashMap<>();
        notice.put("event", event.eventName());
        notice.put("eventId", event.id());
        Object gameId = event.payload().get("gameId");
        if (gameId != null) notice.put("gameId", gameId);
        notice.put("message", "Real-time delivery degraded; state was synchronized over HTTP");
        try {
            transport.deliver(event.target(), LobbyEvents.FALLBACK_ACTIVE, notice);
        } catch (IOException | RuntimeException e) {
            log.debug("Fallback notice for {} not delivered: {}", event, e.toString());
        }
    }

    // ========================================================================
    //  CONFIRMATION / CLEANUP
    // ========================================================================

    /** Client acknowledgement. Unknown or already terminal ids are ignored. */
    public boolean confirmEventDelivery(String eventId) {
        if (eventId == null) return false;
        PendingEvent event = pending.get(eventId);
        if (event == null) return false;
        if (!event.markConfirmed()) return false;
        pending.remove(eventId, event);
        if (event.result().complete(true)) {
            statsFor(event.eventName()).succeeded();
        }
        log.debug("Delivery confirmed {}", event);
        return true;
    }

    /** Drops pending records older than the TTL. */
    @Scheduled(fixedDelayString = "${lobby.delivery.cleanup-interval:PT30S}")
    public int cleanupExpiredEvents() {
        Instant cutoff = clock.instant().minus(eventTtl);
        int removed = 0;
        for (PendingEvent event : new ArrayList<>(pending.values())) {
            if (!event.createdAt().isBefore(cutoff)) continue;
            if (pending.remove(event.id(), event)) {
                removed++;
                if (event.result().isDone()) {
                    event.markExpired();
                } else if (event.markFailed("expired")) {
                    event.result().complete(false);
                }
            }
        }
        if (removed > 0) log.debug("Cleaned up {} expired pending event(s)", removed);
        return removed;
    }

    public Optional<PendingEvent> pendingEvent(String eventId) {
        return Optional.ofNullable(pending.get(eventId));
    }

    // ========================================================================
    //  STATS / CRITICAL EVENTS
    // ========================================================================

    public DeliveryStats getDeliveryStats() {
        Map<String, EventTypeStats.Snapshot> snap = new TreeMap<>();
        stats.forEach((name, s) -> snap.put(name, s.snapshot()));
        List<String> critical = new ArrayList<>(criticalEvents);
        Collections.sort(critical);
        return new DeliveryStats(snap, pending.size(), critical);
    }

    public void resetStats() {
        stats.clear();
        log.info("Delivery stats reset");
    }

    @Scheduled(fixedDelayString = "${lobby.delivery.stats-log-interval:PT5M}",
               initialDelayString = "${lobby.delivery.stats-log-interval:PT5M}")
    public void logStats() {
        if (stats.isEmpty()) return;
        stats.forEach((name, s) -> {
            EventTypeStats.Snapshot v = s.snapshot();
            log.info("Delivery {}: attempted={} succeeded={} failed={} fallbackOk={} fallbackFailed={} rate={}%",
                    name, v.attempted(), v.succeeded(), v.failed(), v.fallbackSucceeded(), v.fallbackFailed(),
                    String.format(Locale.ROOT, "%.1f", v.successRate()));
        });
    }

    public boolean isCritical(String eventName) {
        return eventName != null && criticalEvents.contains(eventName);
    }

    public void addCriticalEvent(String eventName) {
        if (eventName != null && !eventName.isBlank() && criticalEvents.add(eventName)) {
            log.info("Critical event added: {}", eventName);
        }
    }

    public void removeCriticalEvent(String eventName) {
        if (eventName != null && criticalEvents.remove(eventName)) {
            log.info("Critical event removed: {}", eventName);
        }
    }

    @PreDestroy
    public void shutdown() {
        for (PendingEvent event : pending.values()) {
            if (event.markFailed("shutdown")) event.result().complete(false);
        }
        pending.clear();
    }

    private EventTypeStats statsFor(String eventName) {
        return stats.computeIfAbsent(eventName, k -> new EventTypeStats());
    }

    private static String generateEventId(Instant now) {
        ThreadLocalRandom rnd = ThreadLocalRandom.current();
        StringBuilder sb = new StringBuilder("evt_").append(now.toEpochMilli()).append('_');
        for (int i = 0; i < 9; i++) sb.append(ID_ALPHABET[rnd.nextInt(ID_ALPHABET.length)]);
        return sb.toString();
    }
}
