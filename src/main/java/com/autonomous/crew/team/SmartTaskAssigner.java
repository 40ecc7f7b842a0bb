package com.autonomous.crew.team;

import com.autonomous.crew.model.AgentProfile;
import com.autonomous.crew.model.AgentRelationship;
import com.autonomous.crew.model.AgentStats;
import com.autonomous.crew.model.Task;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

/**
 * Scores each eligible agent out of 100 and picks the best one.
 * <ul>
 *   <li>success rate: up to 40 (20 without history)</li>
 *   <li>mean outgoing trust: up to 30 (15 without relationships)</li>
 *   <li>free slots: 10 per slot below the cap</li>
 *   <li>current streak: 2 per success, up to 10</li>
 * </ul>
 * Ties are broken uniformly at random.
 */
@Slf4j
public class SmartTaskAssigner implements TaskAssigner {

    private static final double EPSILON = 1e-9;

    private final int maxConcurrent;
    private final Random random;

    public SmartTaskAssigner(int maxConcurrent, Random random) {
        this.maxConcurrent = maxConcurrent;
        this.random = random;
    }

    @Override
    public Optional<String> assign(Task task,
                                   List<AgentProfile> candidates,
                                   Map<String, List<AgentRelationship>> relationships,
                                   Map<String, AgentStats> stats,
                                   Map<String, Integer> running) {
        List<String> best = new ArrayList<>();
        double bestScore = Double.NEGATIVE_INFINITY;

        for (AgentProfile candidate : candidates) {
            int active = running.getOrDefault(candidate.getId(), 0);
            if (active >= maxConcurrent) {
                continue;
            }
            double score = score(active, stats.get(candidate.getId()),
                relationships.getOrDefault(candidate.getId(), List.of()));
            log.debug("[{}] Score {} for task {}", candidate.getId(), score, task.getId());

            if (score > bestScore + EPSILON) {
                bestScore = score;
                best.clear();
                best.add(candidate.getId());
            } else if (Math.abs(score - bestScore) <= EPSILON) {
                best.add(candidate.getId());
            }
        }

        if (best.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(best.get(random.nextInt(best.size())));
    }

    double score(int active, AgentStats stats, List<AgentRelationship> relationships) {
        double score = 0;

        if (stats != null && stats.totalTasks() > 0) {
            score += (double) stats.getTasksCompleted() / stats.totalTasks() * 40;
        } else {
            score += 20;
        }

        if (relationships.isEmpty()) {
            score += 15;
        } else {
            double meanTrust = relationships.stream()
                .mapToDouble(AgentRelationship::getTrustScore)
                .average()
                .orElse(0.5);
            score += meanTrust * 30;
        }

        score += Math.max(0, maxConcurrent - active) * 10;

        if (stats != null && stats.getStreaks() != null) {
            score += Math.min(10, stats.getStreaks().getCurrent() * 2);
        }
        return score;
    }
}
