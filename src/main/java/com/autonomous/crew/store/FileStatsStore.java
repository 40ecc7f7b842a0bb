package com.autonomous.crew.store;

import com.autonomous.crew.model.AgentStats;
import com.autonomous.crew.support.DebounceTimer;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Consumer;

/**
 * One {@code stats/{agentId}.json} document per agent, each with its own debounced writer.
 */
@Slf4j
public class FileStatsStore implements StatsStore {

    private final Path dir;
    private final ScheduledExecutorService timer;
    private final long debounceMs;
    private final Clock clock;
    private final JsonFileSupport json = new JsonFileSupport();
    private final Map<String, AgentStats> cache = new ConcurrentHashMap<>();
    private final Map<String, DebounceTimer> writers = new ConcurrentHashMap<>();

    public FileStatsStore(Path dataDir, ScheduledExecutorService timer, long debounceMs, Clock clock) {
        this.dir = dataDir.resolve("stats");
        this.timer = timer;
        this.debounceMs = debounceMs;
        this.clock = clock;
    }

    @Override
    public synchronized AgentStats get(String agentId) {
        return load(agentId).copy();
    }

    @Override
    public synchronized AgentStats update(String agentId, Consumer<AgentStats> changes) {
        AgentStats stats = load(agentId);
        changes.accept(stats);
        stats.setAgentId(agentId);
        writerFor(agentId).schedule();
        return stats.copy();
    }

    @Override
    public AgentStats incrementTokens(String agentId, long tokensIn, long tokensOut) {
        return update(agentId, stats -> {
            stats.setTotalTokensIn(stats.getTotalTokensIn() + tokensIn);
            stats.setTotalTokensOut(stats.getTotalTokensOut() + tokensOut);
        });
    }

    @Override
    public AgentStats recordExecution(String agentId, long durationMs, boolean success) {
        return update(agentId, stats -> {
            if (success) {
                stats.setTasksCompleted(stats.getTasksCompleted() + 1);
                AgentStats.Streaks streaks = stats.getStreaks();
                streaks.setCurrent(streaks.getCurrent() + 1);
                streaks.setBest(Math.max(streaks.getBest(), streaks.getCurrent()));
            } else {
                stats.setTasksFailed(stats.getTasksFailed() + 1);
                stats.getStreaks().setCurrent(0);
            }
            stats.setTotalExecutionMs(stats.getTotalExecutionMs() + durationMs);
            stats.setAverageResponseMs(stats.getTotalExecutionMs() / Math.max(1, stats.totalTasks()));
            stats.setLastActive(clock.instant());
        });
    }

    @Override
    public void flush() {
        writers.values().forEach(DebounceTimer::flushNow);
    }

    private AgentStats load(String agentId) {
        return cache.computeIfAbsent(agentId, id -> json.readValue(fileFor(id), AgentStats.class)
            .map(stats -> {
                if (stats.getStreaks() == null) {
                    stats.setStreaks(new AgentStats.Streaks());
                }
                return stats;
            })
            .orElseGet(() -> AgentStats.empty(id)));
    }

    private DebounceTimer writerFor(String agentId) {
        return writers.computeIfAbsent(agentId, id ->
            new DebounceTimer("stats:" + id, timer, debounceMs, () -> persist(id)));
    }

    private void persist(String agentId) throws Exception {
        AgentStats snapshot;
        synchronized (this) {
            snapshot = cache.get(agentId).copy();
        }
        json.writeAtomically(fileFor(agentId), snapshot);
    }

    private Path fileFor(String agentId) {
        return dir.resolve(agentId + ".json");
    }
}
