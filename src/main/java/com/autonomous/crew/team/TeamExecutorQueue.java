package com.autonomous.crew.team;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * FIFO queue in front of the shared team backend. One item runs at a time; a failed item only
 * fails its own future.
 */
@Slf4j
public class TeamExecutorQueue {

    private final TeamRuntimeBackend backend;
    private final ModelResolver models;
    private final ExecutorService worker = Executors.newSingleThreadExecutor(r -> {
        Thread thread = new Thread(r, "team-executor");
        thread.setDaemon(true);
        return thread;
    });
    private final AtomicInteger pending = new AtomicInteger();

    public TeamExecutorQueue(TeamRuntimeBackend backend, ModelResolver models) {
        this.backend = backend;
        this.models = models;
    }

    public CompletableFuture<String> enqueue(String operation, String prompt) {
        CompletableFuture<String> handle = new CompletableFuture<>();
        pending.incrementAndGet();
        worker.execute(() -> {
            String model = models.resolve(operation);
            String result;
            try {
                log.info("Running team operation {} on {}", operation, model);
                result = backend.execute(operation, model, prompt);
            } catch (Exception e) {
                log.warn("Team operation {} failed: {}", operation, e.getMessage());
                pending.decrementAndGet();
                handle.completeExceptionally(e);
                return;
            }
            pending.decrementAndGet();
            handle.complete(result);
        });
        return handle;
    }

    /** Items queued or running. */
    public int pendingCount() {
        return pending.get();
    }

    public void shutdown() {
        worker.shutdownNow();
    }
}
