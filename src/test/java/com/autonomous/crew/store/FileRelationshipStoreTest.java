package com.autonomous.crew.store;

import com.autonomous.crew.model.AgentRelationship;
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
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class FileRelationshipStoreTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T09:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path dataDir;

    @Mock
    private ScheduledExecutorService timer;

    @Mock
    private ScheduledFuture<Object> future;

    private FileRelationshipStore store;

    @BeforeEach
    void setUp() {
        lenient().doReturn(future).when(timer).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
        store = new FileRelationshipStore(dataDir, timer, 500, CLOCK);
    }

    @Test
    void shouldInitializeMissingRelationshipBeforeUpdating() {
        AgentRelationship rel = store.updateTrust("lead", "dev", 1.0);

        assertEquals(0.575, rel.getTrustScore(), 1e-9);
        assertEquals(CLOCK.instant(), rel.getLastInteraction());
        assertEquals(rel, store.get("lead", "dev").orElseThrow());
    }

    @Test
    void shouldListOutgoingRelationshipsOnly() {
        store.updateTrust("lead", "dev", 1.0);
        store.updateTrust("lead", "ops", 0.0);
        store.updateTrust("dev", "lead", 1.0);

        List<AgentRelationship> outgoing = store.getAll("lead");

        assertEquals(2, outgoing.size());
        assertTrue(outgoing.stream().allMatch(r -> r.getSourceAgentId().equals("lead")));
    }

    @Test
    void shouldPersistPerSourceFile() {
        store.updateTrust("lead", "dev", 0.0);
        store.flush();

        FileRelationshipStore reloaded = new FileRelationshipStore(dataDir, timer, 500, CLOCK);

        assertEquals(0.425, reloaded.get("lead", "dev").orElseThrow().getTrustScore(), 1e-9);
    }
}
