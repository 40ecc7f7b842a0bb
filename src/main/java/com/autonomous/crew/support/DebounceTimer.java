package com.autonomous.crew.support;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Trailing-edge debounce around a single action. Every {@link #schedule()} restarts the quiet period;
 * the action runs once the period passes without another call, or immediately on {@link #flushNow()}.
 * Failures of the action are logged and never reach the caller that scheduled it.
 */
@Slf4j
public class DebounceTimer {

    @FunctionalInterface
    public interface Action {
        void run() throws Exception;
    }

    private final String name;
    private final ScheduledExecutorService timer;
    private final long delayMs;
    private final Action action;

    private ScheduledFuture<?> pending;
    private long generation;

    public DebounceTimer(String name, ScheduledExecutorService timer, long delayMs, Action action) {
        this.name = name;
        this.timer = timer;
        this.delayMs = delayMs;
        this.action = action;
    }

    public synchronized void schedule() {
        if (pending != null) {
            pending.cancel(false);
        }
        long scheduledGeneration = ++generation;
        pending = timer.schedule(() -> fire(scheduledGeneration), delayMs, TimeUnit.MILLISECONDS);
    }

    public synchronized void cancel() {
        if (pending != null) {
            pending.cancel(false);
            pending = null;
        }
        generation++;
    }

    /**
     * Runs the action now if a run is pending. Returns whether it ran.
     */
    public boolean flushNow() {
        synchronized (this) {
            if (pending == null) {
                return false;
            }
            pending.cancel(false);
            pending = null;
            generation++;
        }
        runAction();
        return true;
    }

    public synchronized boolean isPending() {
        return pending != null;
    }

    private void fire(long scheduledGeneration) {
        synchronized (this) {
            if (scheduledGeneration != generation || pending == null) {
                return;
            }
            pending = null;
        }
        runAction();
    }

    private void runAction() {
        try {
            action.run();
        } catch (Exception e) {
            log.error("[{}] Debounced action failed: {}", name, e.getMessage(), e);
        }
    }
}
