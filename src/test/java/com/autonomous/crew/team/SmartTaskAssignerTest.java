package com.autonomous.crew.team;

import com.autonomous.crew.model.AgentProfile;
import com.autonomous.crew.model.AgentRelationship;
import com.autonomous.crew.model.AgentStats;
import com.autonomous.crew.model.Task;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class SmartTaskAssignerTest {

    private final Task task = Task.builder().id("t1").title("Write docs").build();
    private final AgentProfile alice = AgentProfile.builder().id("alice").build();
    private final AgentProfile bob = AgentProfile.builder().id("bob").build();

    @Test
    void shouldPreferAgentWithBetterHistory() {
        SmartTaskAssigner assigner = new SmartTaskAssigner(2, new Random(1));
        AgentStats strong = AgentStats.builder().agentId("alice").tasksCompleted(9).tasksFailed(1).build();
        AgentStats weak = AgentStats.builder().agentId("bob").tasksCompleted(1).tasksFailed(9).build();

        Optional<String> chosen = assigner.assign(task, List.of(alice, bob), Map.of(),
            Map.of("alice", strong, "bob", weak), Map.of());

        assertEquals(Optional.of("alice"), chosen);
    }

    @Test
    void shouldSkipAgentsAtCapacity() {
        SmartTaskAssigner assigner = new SmartTaskAssigner(2, new Random(1));

        Optional<String> chosen = assigner.assign(task, List.of(alice, bob), Map.of(), Map.of(),
            Map.of("alice", 2));

        assertEquals(Optional.of("bob"), chosen);
    }

    @Test
    void shouldReturnEmptyWhenEveryoneIsBusy() {
        SmartTaskAssigner assigner = new SmartTaskAssigner(2, new Random(1));

        Optional<String> chosen = assigner.assign(task, List.of(alice, bob), Map.of(), Map.of(),
            Map.of("alice", 2, "bob", 3));

        assertTrue(chosen.isEmpty());
    }

    @Test
    void shouldGiveNeutralScoreToNewAgent() {
        SmartTaskAssigner assigner = new SmartTaskAssigner(2, new Random(1));

        // 20 (no stats) + 15 (no trust) + 20 (two free slots) + 0 (no streak)
        assertEquals(55.0, assigner.score(0, null, List.of()), 1e-9);
    }

    @Test
    void shouldUseTrustAndStreakInScore() {
        SmartTaskAssigner assigner = new SmartTaskAssigner(2, new Random(1));
        AgentStats stats = AgentStats.builder().tasksCompleted(4).tasksFailed(0)
            .streaks(new AgentStats.Streaks(7, 7)).build();
        List<AgentRelationship> rels = List.of(
            AgentRelationship.builder().trustScore(1.0).build(),
            AgentRelationship.builder().trustScore(0.5).build());

        // 40 + 22.5 + 10 + min(10, 14)
        assertEquals(82.5, assigner.score(1, stats, rels), 1e-9);
    }

    @Test
    void shouldBreakTiesUniformly() {
        SmartTaskAssigner assigner = new SmartTaskAssigner(2, new Random(7));
        Map<String, Integer> counts = new HashMap<>();
        int trials = 4000;

        for (int i = 0; i < trials; i++) {
            assigner.assign(task, List.of(alice, bob), Map.of(), Map.of(), Map.of())
                .ifPresent(id -> counts.merge(id, 1, Integer::sum));
        }

        assertEquals(trials, counts.get("alice") + counts.get("bob"));
        assertTrue(Math.abs(counts.get("alice") - trials / 2) < trials / 10,
            "uneven tie-break: " + counts);
    }
}
