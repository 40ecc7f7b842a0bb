package com.autonomous.crew.store;

import com.autonomous.crew.model.AgentRelationship;
import com.autonomous.crew.support.DebounceTimer;
import com.autonomous.crew.team.TrustModel;
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Outgoing relationships of each agent, stored as a JSON array in {@code relationships/{sourceAgentId}.json}.
 */
@Slf4j
public class FileRelationshipStore implements RelationshipStore {

    private final Path dir;
    private final ScheduledExecutorService timer;
    private final long debounceMs;
    private final Clock clock;
    private final JsonFileSupport json = new JsonFileSupport();
    private final Map<String, Map<String, AgentRelationship>> bySource = new ConcurrentHashMap<>();
    private final Map<String, DebounceTimer> writers = new ConcurrentHashMap<>();

    public FileRelationshipStore(Path dataDir, ScheduledExecutorService timer, long debounceMs, Clock clock) {
        this.dir = dataDir.resolve("relationships");
        this.timer = timer;
        this.debounceMs = debounceMs;
        this.clock = clock;
    }

    @Override
    public synchronized Optional<AgentRelationship> get(String sourceAgentId, String targetAgentId) {
        return Optional.ofNullable(edgesOf(sourceAgentId).get(targetAgentId)).map(r -> r.toBuilder().build());
    }

    @Override
    public synchronized void set(AgentRelationship relationship) {
        edgesOf(relationship.getSourceAgentId())
            .put(relationship.getTargetAgentId(), relationship.toBuilder().build());
        writerFor(relationship.getSourceAgentId()).schedule();
    }

    @Override
    public synchronized List<AgentRelationship> getAll(String sourceAgentId) {
        List<AgentRelationship> copies = new ArrayList<>();
        edgesOf(sourceAgentId).values().forEach(r -> copies.add(r.toBuilder().build()));
        return copies;
    }

    @Override
    public synchronized AgentRelationship updateTrust(String sourceAgentId, String targetAgentId,
                                                      double outcome, double weight) {
        AgentRelationship existing = edgesOf(sourceAgentId).get(targetAgentId);
        AgentRelationship updated = TrustModel.applyOutcome(existing, sourceAgentId, targetAgentId,
            outcome, weight, clock.instant());
        set(updated);
        log.debug("[{}] Trust in {} is now {}", sourceAgentId, targetAgentId, updated.getTrustScore());
        return updated.toBuilder().build();
    }

    @Override
    public void flush() {
        writers.values().forEach(DebounceTimer::flushNow);
    }

    private Map<String, AgentRelationship> edgesOf(String sourceAgentId) {
        return bySource.computeIfAbsent(sourceAgentId, id -> {
            Map<String, AgentRelationship> edges = new LinkedHashMap<>();
            json.readList(fileFor(id), new TypeReference<List<AgentRelationship>>() {})
                .forEach(r -> edges.put(r.getTargetAgentId(), r));
            return edges;
        });
    }

    private DebounceTimer writerFor(String sourceAgentId) {
        return writers.computeIfAbsent(sourceAgentId, id ->
            new DebounceTimer("relationships:" + id, timer, debounceMs, () -> persist(id)));
    }

    private void persist(String sourceAgentId) throws Exception {
        List<AgentRelationship> snapshot;
        synchronized (this) {
            snapshot = new ArrayList<>(edgesOf(sourceAgentId).values());
        }
        json.writeAtomically(fileFor(sourceAgentId), snapshot);
    }

    private Path fileFor(String sourceAgentId) {
        return dir.resolve(sourceAgentId + ".json");
    }
}
