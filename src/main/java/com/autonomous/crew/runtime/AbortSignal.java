package com.autonomous.crew.runtime;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Cancellation handle for one-shot executions. Listeners registered after the abort run immediately.
 */
@Slf4j
public class AbortSignal {

    private final List<Runnable> listeners = new ArrayList<>();
    private boolean aborted;

    public void abort() {
        List<Runnable> toRun;
        synchronized (this) {
            if (aborted) {
                return;
            }
            aborted = true;
            toRun = new ArrayList<>(listeners);
            listeners.clear();
        }
        toRun.forEach(AbortSignal::runSafely);
    }

    public synchronized boolean isAborted() {
        return aborted;
    }

    public void onAbort(Runnable listener) {
        synchronized (this) {
            if (!aborted) {
                listeners.add(listener);
                return;
            }
        }
        runSafely(listener);
    }

    private static void runSafely(Runnable listener) {
        try {
            listener.run();
        } catch (RuntimeException e) {
            log.error("Abort listener failed: {}", e.getMessage(), e);
        }
    }
}
