package com.example.cardlobby.support;

import java.util.concurrent.ScheduledThreadPoolExecutor;

/** Runs {@code execute} tasks on the calling thread; delayed tasks still use the pool. */
public class InlineScheduler extends ScheduledThreadPoolExecutor {

    public InlineScheduler() {
        super(1);
    }

    @Override
    public void execute(Runnable command) {
        command.run();
    }
}
