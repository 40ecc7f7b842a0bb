package com.autonomous.crew.store;

import com.autonomous.crew.model.AgentStats;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class FileStatsStoreTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T09:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path dataDir;

    @Mock
    private ScheduledExecutorService timer;

    @Mock
    private ScheduledFuture<Object> future;

    private FileStatsStore store;

    @BeforeEach
    void setUp() {
        lenient().doReturn(future).when(timer).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
        store = new FileStatsStore(dataDir, timer, 500, CLOCK);
    }

    @Test
    void shouldStartEmptyForUnknownAgent() {
        AgentStats stats = store.get("dev");

        assertEquals("dev", stats.getAgentId());
        assertEquals(0, stats.totalTasks());
    }

    @Test
    void shouldTrackStreaksAndAverages() {
        store.recordExecution("dev", 1000, true);
        store.recordExecution("dev", 2000, true);
        store.recordExecution("dev", 3000, true);
        AgentStats stats = store.recordExecution("dev", 6000, false);

        assertEquals(3, stats.getTasksCompleted());
        assertEquals(1, stats.getTasksFailed());
        assertEquals(12_000, stats.getTotalExecutionMs());
        assertEquals(3000, stats.getAverageResponseMs());
        assertEquals(0, stats.getStreaks().getCurrent());
        assertEquals(3, stats.getStreaks().getBest());
        assertEquals(CLOCK.instant(), stats.getLastActive());
    }

    @Test
    void shouldAccumulateTokens() {
        store.incrementTokens("dev", 100, 40);
        AgentStats stats = store.incrementTokens("dev", 50, 10);

        assertEquals(150, stats.getTotalTokensIn());
        assertEquals(50, stats.getTotalTokensOut());
    }

    @Test
    void shouldPersistPerAgentFile() {
        store.recordExecution("dev", 1000, true);
        store.flush();

        FileStatsStore reloaded = new FileStatsStore(dataDir, timer, 500, CLOCK);
        AgentStats stats = reloaded.get("dev");
        assertEquals(1, stats.getTasksCompleted());
        assertEquals(1, stats.getStreaks().getBest());
        assertTrue(dataDir.resolve("stats").resolve("dev.json").toFile().exists());
    }
}
