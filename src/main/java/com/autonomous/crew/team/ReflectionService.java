package com.autonomous.crew.team;

import com.autonomous.crew.config.CrewProperties;
import com.autonomous.crew.event.TaskCompletedEvent;
import com.autonomous.crew.model.AgentProfile;
import com.autonomous.crew.model.AgentStats;
import com.autonomous.crew.model.Task;
import com.autonomous.crew.model.TaskFilter;
import com.autonomous.crew.model.TaskStatus;
import com.autonomous.crew.service.AgentProfileService;
import com.autonomous.crew.service.TaskService;
import com.autonomous.crew.store.StatsStore;
import com.autonomous.crew.support.TextUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Asks the team backend to reflect on an agent's recent work every few finished tasks.
 */
@Slf4j
@Service
public class ReflectionService {

    static final String OPERATION = "self:reflect";
    private static final int RECENT_TASKS = 10;

    private final TeamExecutorQueue queue;
    private final TaskService tasks;
    private final StatsStore stats;
    private final AgentProfileService profiles;
    private final FeedBroadcaster feed;
    private final int reflectEvery;

    private final Map<String, AtomicInteger> finishedSinceReflection = new ConcurrentHashMap<>();

    public ReflectionService(TeamExecutorQueue queue, TaskService tasks, StatsStore stats,
                             AgentProfileService profiles, FeedBroadcaster feed, CrewProperties properties) {
        this.queue = queue;
        this.tasks = tasks;
        this.stats = stats;
        this.profiles = profiles;
        this.feed = feed;
        this.reflectEvery = properties.getTeam().getReflectEvery();
    }

    @EventListener
    public void onTaskCompleted(TaskCompletedEvent event) {
        String agentId = event.getTask().getAssignedTo();
        if (agentId == null || reflectEvery <= 0 || AgentProfile.SYSTEM_AGENT_ID.equals(agentId)) {
            return;
        }
        int count = finishedSinceReflection.computeIfAbsent(agentId, id -> new AtomicInteger()).incrementAndGet();
        if (count >= reflectEvery) {
            finishedSinceReflection.get(agentId).set(0);
            reflect(agentId);
        }
    }

    public CompletableFuture<String> reflect(String agentId) {
        String name = profiles.getProfile(agentId).map(AgentProfile::displayName).orElse(agentId);
        String prompt;
        try {
            prompt = buildPrompt(name, stats.get(agentId), recentTasks(agentId));
        } catch (RuntimeException e) {
            log.error("[{}] Could not build reflection prompt: {}", agentId, e.getMessage(), e);
            return CompletableFuture.failedFuture(e);
        }
        log.info("[{}] Queued self-reflection", agentId);
        return queue.enqueue(OPERATION, prompt).whenComplete((text, error) -> {
            if (error != null) {
                log.warn("[{}] Self-reflection failed: {}", agentId, error.getMessage());
            } else if (!TextUtils.isBlank(text)) {
                feed.broadcast(agentId, "**" + name + "** reflected on recent work\n\n" + text.strip());
            }
        });
    }

    List<Task> recentTasks(String agentId) {
        return tasks.list(TaskFilter.builder().assignedTo(agentId).build()).stream()
            .filter(t -> t.getStatus() == TaskStatus.COMPLETED || t.getStatus() == TaskStatus.FAILED)
            .sorted(Comparator.comparing(ReflectionService::finishedAt).reversed())
            .limit(RECENT_TASKS)
            .collect(Collectors.toList());
    }

    static String buildPrompt(String name, AgentStats agentStats, List<Task> recent) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("You are reviewing the recent work of ").append(name).append(", an agent in a crew.\n\n");

        prompt.append("## Stats\n");
        prompt.append("- Tasks completed: ").append(agentStats.getTasksCompleted()).append('\n');
        prompt.append("- Tasks failed: ").append(agentStats.getTasksFailed()).append('\n');
        prompt.append("- Average response: ").append(agentStats.getAverageResponseMs()).append("ms\n");
        prompt.append("- Current streak: ").append(agentStats.getStreaks().getCurrent()).append('\n');
        prompt.append("- Recent success rate: ")
            .append(Math.round(calculateSuccessRate(recent) * 100)).append("%\n\n");

        prompt.append("## Recent tasks\n");
        if (recent.isEmpty()) {
            prompt.append("(none)\n");
        }
        for (Task task : recent) {
            prompt.append("- [").append(task.getStatus().wireName()).append("] ").append(task.getTitle());
            if (task.getStatus() == TaskStatus.FAILED && task.getError() != null) {
                prompt.append(": ").append(TextUtils.truncate(task.getError(), 200));
            }
            prompt.append('\n');
        }

        prompt.append("\nSummarize what went well, what went wrong and why, ")
            .append("and suggest up to three concrete improvements. Keep it short.");
        return prompt.toString();
    }

    static double calculateSuccessRate(List<Task> recent) {
        if (recent.isEmpty()) {
            return 0.5;
        }
        long successful = recent.stream().filter(t -> t.getStatus() == TaskStatus.COMPLETED).count();
        return (double) successful / recent.size();
    }

    private static Instant finishedAt(Task task) {
        if (task.getCompletedAt() != null) {
            return task.getCompletedAt();
        }
        return task.getCreatedAt() != null ? task.getCreatedAt() : Instant.EPOCH;
    }
}
