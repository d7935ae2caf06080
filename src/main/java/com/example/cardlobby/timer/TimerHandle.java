package com.example.cardlobby.timer;

/** Cancellable handle returned for every scheduled timer. */
public interface TimerHandle {

    TimerKey key();

    /** Cancels the timer; returns true if it had not fired or been cancelled yet. */
    boolean cancel();

    boolean isActive();
}
