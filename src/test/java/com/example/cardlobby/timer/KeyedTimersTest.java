package com.example.cardlobby.timer;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class KeyedTimersTest {

    private final KeyedTimers timers = new KeyedTimers();

    @AfterEach
    void tearDown() {
        timers.shutdown();
    }

    @Test
    void rescheduling_sameKey_cancelsPreviousTimer() throws Exception {
        AtomicInteger first = new AtomicInteger();
        CountDownLatch second = new CountDownLatch(1);
        TimerKey key = TimerKey.eviction("g1", "alice");

        TimerHandle h1 = timers.schedule(key, Duration.ofMillis(200), first::incrementAndGet);
        timers.schedule(key, Duration.ofMillis(50), second::countDown);

        assertFalse(h1.isActive());
        assertTrue(second.await(2, TimeUnit.SECONDS));
        Thread.sleep(300);
        assertEquals(0, first.get(), "replaced timer must never fire");
        assertFalse(timers.isScheduled(key));
        assertEquals(0, timers.size());
    }

    @Test
    void cancelAll_dropsOnlyThatRoomsTimers() {
        timers.schedule(TimerKey.eviction("g1", "a"), Duration.ofMinutes(5), () -> { });
        timers.schedule(TimerKey.eviction("g1", "b"), Duration.ofMinutes(5), () -> { });
        timers.scheduleAtFixedRate(TimerKey.reconciliation("g1"), Duration.ofMinutes(1), () -> { });
        timers.schedule(TimerKey.teardown("g2"), Duration.ofMinutes(5), () -> { });

        assertEquals(3, timers.cancelAll("g1"));
        assertFalse(timers.isScheduled(TimerKey.reconciliation("g1")));
        assertTrue(timers.isScheduled(TimerKey.teardown("g2")));
        assertEquals(1, timers.size());
    }

    @Test
    void failingTask_isLoggedAndEntryRemoved() throws Exception {
        CountDownLatch ran = new CountDownLatch(1);
        TimerKey key = TimerKey.teardown("g1");
        timers.schedule(key, Duration.ZERO, () -> {
            ran.countDown();
            throw new IllegalStateException("boom");
        });
        assertTrue(ran.await(2, TimeUnit.SECONDS));
        long deadline = System.currentTimeMillis() + 2000;
        while (timers.isScheduled(key) && System.currentTimeMillis() < deadline) Thread.sleep(10);
        assertFalse(timers.isScheduled(key));
    }

    @Test
    void handleCancel_reportsWhetherItWasStillPending() {
        TimerHandle h = timers.schedule(TimerKey.eviction("g1", "a"), Duration.ofMinutes(1), () -> { });
        assertTrue(h.cancel());
        assertFalse(h.cancel());
        assertFalse(timers.cancel(TimerKey.eviction("g1", "a")));
    }
}
