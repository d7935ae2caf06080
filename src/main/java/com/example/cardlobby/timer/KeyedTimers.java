package com.example.cardlobby.timer;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Cancellable timers keyed by (room, purpose, subject).
 *
 * - Scheduling a key that is already scheduled cancels the previous timer first.
 * - A one-shot timer removes only its own entry when it fires, so a replacement
 *   scheduled in the meantime survives.
 * - {@link #cancelAll(String)} drops every timer of a room (teardown).
 */
public class KeyedTimers {

    private static final Logger log = LoggerFactory.getLogger(KeyedTimers.class);

    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;
    private final ConcurrentMap<TimerKey, Entry> timers = new ConcurrentHashMap<>();

    public KeyedTimers() {
        this(Executors.newScheduledThreadPool(2, new ThreadFactory() {
            private final AtomicInteger c = new AtomicInteger();
            @Override public Thread newThread(Runnable r) {
                Thread t = new Thread(r, "lobby-timer-" + c.incrementAndGet());
                t.setDaemon(true);
                return t;
            }
        }), true);
    }

    public KeyedTimers(ScheduledExecutorService scheduler) {
        this(scheduler, false);
    }

    private KeyedTimers(ScheduledExecutorService scheduler, boolean ownsScheduler) {
        this.scheduler = scheduler;
        this.ownsScheduler = ownsScheduler;
    }

    /** One-shot timer. */
    public TimerHandle schedule(TimerKey key, Duration delay, Runnable task) {
        Entry entry = new Entry(key);
        cancel(key);
        timers.put(key, entry);
        entry.future = scheduler.schedule(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("Timer {} failed", key, e);
            } finally {
                timers.remove(key, entry);
            }
        }, Math.max(0L, delay.toMillis()), TimeUnit.MILLISECONDS);
        log.debug("Timer scheduled {} in {}ms", key, delay.toMillis());
        return entry;
    }

    /** Repeating timer; stays registered until cancelled. */
    public TimerHandle scheduleAtFixedRate(TimerKey key, Duration period, Runnable task) {
        Entry entry = new Entry(key);
        cancel(key);
        timers.put(key, entry);
        long ms = Math.max(1L, period.toMillis());
        entry.future = scheduler.scheduleAtFixedRate(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                // an escaping exception would cancel the schedule
                log.error("Repeating timer {} failed", key, e);
            }
        }, ms, ms, TimeUnit.MILLISECONDS);
        log.debug("Repeating timer scheduled {} every {}ms", key, ms);
        return entry;
    }

    public boolean cancel(TimerKey key) {
        Entry prev = timers.remove(key);
        return prev != null && prev.cancelFuture();
    }

    public boolean isScheduled(TimerKey key) {
        Entry e = timers.get(key);
        return e != null && e.isActive();
    }

    /** Cancels every timer of the room; returns how many were still pending. */
    public int cancelAll(String roomId) {
        List<TimerKey> keys = new ArrayList<>();
        for (TimerKey k : timers.keySet()) {
            if (k.roomId().equals(roomId)) keys.add(k);
        }
        int cancelled = 0;
        for (TimerKey k : keys) {
            if (cancel(k)) cancelled++;
        }
        if (cancelled > 0) log.debug("Cancelled {} timer(s) for room {}", cancelled, roomId);
        return cancelled;
    }

    public int size() {
        return timers.size();
    }

    @PreDestroy
    public void shutdown() {
        for (Entry e : timers.values()) e.cancelFuture();
        timers.clear();
        if (ownsScheduler) scheduler.shutdownNow();
    }

    private final class Entry implements TimerHandle {
        private final TimerKey key;
        private volatile ScheduledFuture<?> future;

        private Entry(TimerKey key) {
            this.key = key;
        }

        @Override
        public TimerKey key() {
            return key;
        }

        @Override
        public boolean cancel() {
            timers.remove(key, this);
            return cancelFuture();
        }

        @Override
        public boolean isActive() {
            ScheduledFuture<?> f = future;
            return f != null && !f.isDone();
        }

        private boolean cancelFuture() {
            ScheduledFuture<?> f = future;
            return f != null && f.cancel(false);
        }
    }
}
