package com.autonomous.crew.service;

import com.autonomous.crew.config.CrewProperties;
import com.autonomous.crew.event.TaskCompletedEvent;
import com.autonomous.crew.event.TaskCreatedEvent;
import com.autonomous.crew.event.TaskProgressEvent;
import com.autonomous.crew.event.TaskUpdatedEvent;
import com.autonomous.crew.model.Task;
import com.autonomous.crew.model.TaskFilter;
import com.autonomous.crew.model.TaskPriority;
import com.autonomous.crew.model.TaskStatus;
import com.autonomous.crew.runtime.ExecutionProgress;
import com.autonomous.crew.runtime.ExecutionResult;
import com.autonomous.crew.runtime.OutputListener;
import com.autonomous.crew.store.StatsStore;
import com.autonomous.crew.support.TextUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Runs assigned tasks on their agents, at most {@code crew.execution.max-concurrent-per-agent}
 * at a time per agent.
 */
@Slf4j
@Service
public class TaskExecutorService {

    static final int MAX_RESULT_LENGTH = 10_000;
    static final String INTERRUPTED_BY_RESTART = "Interrupted by restart";

    private static final Comparator<Task> NEXT_TASK_ORDER = Comparator
        .comparing((Task t) -> t.getPriority() != null ? t.getPriority() : TaskPriority.NORMAL,
            Comparator.reverseOrder())
        .thenComparing(t -> t.getCreatedAt() != null ? t.getCreatedAt() : Instant.EPOCH);

    private final TaskService tasks;
    private final AgentService agents;
    private final StatsStore stats;
    private final TaskTracker tracker;
    private final ApplicationEventPublisher events;
    private final ScheduledExecutorService timer;
    private final Clock clock;
    private final int maxConcurrentPerAgent;
    private final Duration taskTimeout;

    private final Map<String, RunningTask> runningTasks = new ConcurrentHashMap<>();

    public TaskExecutorService(TaskService tasks, AgentService agents, StatsStore stats, TaskTracker tracker,
                               ApplicationEventPublisher events, ScheduledExecutorService crewTimer,
                               CrewProperties properties, Clock clock) {
        this.tasks = tasks;
        this.agents = agents;
        this.stats = stats;
        this.tracker = tracker;
        this.events = events;
        this.timer = crewTimer;
        this.clock = clock;
        this.maxConcurrentPerAgent = properties.getExecution().getMaxConcurrentPerAgent();
        this.taskTimeout = properties.getExecution().getTaskTimeout();
    }

    @EventListener
    public void onTaskCreated(TaskCreatedEvent event) {
        dispatchIfAssigned(event.getTask());
    }

    @EventListener
    public void onTaskUpdated(TaskUpdatedEvent event) {
        dispatchIfAssigned(event.getTask());
    }

    /**
     * Fails tasks left running by a previous process, then starts everything already assigned.
     */
    public void recover() {
        for (Task stale : tasks.list(TaskFilter.byStatus(TaskStatus.RUNNING))) {
            if (runningTasks.containsKey(stale.getId())) {
                continue;
            }
            Task failed = tasks.update(stale.getId(), t -> {
                t.setStatus(TaskStatus.FAILED);
                t.setError(INTERRUPTED_BY_RESTART);
                t.setCompletedAt(clock.instant());
            });
            log.warn("[{}] Task {} was interrupted by a restart", failed.getAssignedTo(), failed.getId());
        }
        tasks.list(TaskFilter.byStatus(TaskStatus.ASSIGNED)).stream()
            .map(Task::getAssignedTo)
            .filter(agentId -> agentId != null)
            .distinct()
            .forEach(this::pickNextForAgent);
    }

    /**
     * Starts an assigned task unless its agent is at capacity.
     *
     * @return whether the task was started
     */
    public synchronized boolean dispatch(Task task) {
        String agentId = task.getAssignedTo();
        if (agentId == null || task.getStatus() != TaskStatus.ASSIGNED || runningTasks.containsKey(task.getId())) {
            return false;
        }
        if (runningCount(agentId) >= maxConcurrentPerAgent) {
            log.debug("[{}] At capacity, task {} waits", agentId, task.getId());
            return false;
        }

        Instant startedAt = clock.instant();
        Task started;
        try {
            started = tasks.update(task.getId(), t -> {
                t.setStatus(TaskStatus.RUNNING);
                t.setStartedAt(startedAt);
            });
        } catch (IllegalStateException e) {
            log.debug("Task {} is no longer assignable: {}", task.getId(), e.getMessage());
            return false;
        }

        RunningTask running = new RunningTask(agentId, startedAt);
        runningTasks.put(started.getId(), running);
        running.timeout = timer.schedule(() -> onTimeout(started.getId()),
            taskTimeout.toMillis(), TimeUnit.MILLISECONDS);
        log.info("[{}] Running task {} \"{}\"", agentId, started.getId(), started.getTitle());

        try {
            agents.executeDetached(agentId, buildPrompt(started), progressListener(started.getId(), agentId))
                .whenComplete((result, error) -> finish(started.getId(), result, error));
        } catch (RuntimeException e) {
            finish(started.getId(), null, e);
        }
        return true;
    }

    /**
     * Cancels a task that has not finished yet, aborting its execution if it is running.
     *
     * Holds the dispatch monitor so a task between its RUNNING update and registration cannot slip past.
     *
     * @return false when the task had already finished
     */
    public synchronized boolean cancelTask(String taskId) {
        Task task = tasks.require(taskId);
        if (task.getStatus().isTerminal()) {
            return false;
        }
        RunningTask running = runningTasks.remove(taskId);
        tasks.update(taskId, t -> {
            t.setStatus(TaskStatus.CANCELLED);
            t.setCompletedAt(clock.instant());
        });
        log.info("[{}] Cancelled task {}", task.getAssignedTo(), taskId);
        if (running != null) {
            running.cancelTimeout();
            agents.abort(running.agentId);
            tracker.clear(taskId);
            pickNextForAgent(running.agentId);
        }
        return true;
    }

    /** Starts the agent's highest priority assigned tasks while it has free slots. */
    public void pickNextForAgent(String agentId) {
        List<Task> waiting = tasks.list(TaskFilter.builder()
                .status(TaskStatus.ASSIGNED)
                .assignedTo(agentId)
                .build()).stream()
            .sorted(NEXT_TASK_ORDER)
            .collect(Collectors.toList());
        for (Task next : waiting) {
            if (runningCount(agentId) >= maxConcurrentPerAgent) {
                return;
            }
            dispatch(next);
        }
    }

    public int runningCount(String agentId) {
        return (int) runningTasks.values().stream().filter(r -> r.agentId.equals(agentId)).count();
    }

    public boolean isRunning(String taskId) {
        return runningTasks.containsKey(taskId);
    }

    static String buildPrompt(Task task) {
        StringBuilder prompt = new StringBuilder("You have been assigned a task.\n\n");
        prompt.append("Title: ").append(task.getTitle()).append('\n');
        if (!TextUtils.isBlank(task.getDescription())) {
            prompt.append("\nDescription:\n").append(task.getDescription().strip()).append('\n');
        }
        if (task.getPriority() != null && task.getPriority() != TaskPriority.NORMAL) {
            prompt.append("\nPriority: ").append(task.getPriority().wireName()).append('\n');
        }
        if (task.getTags() != null && !task.getTags().isEmpty()) {
            prompt.append("\nTags: ").append(String.join(", ", task.getTags())).append('\n');
        }
        prompt.append("\nComplete the task, then reply with a short summary of what you did.");
        return prompt.toString();
    }

    private void dispatchIfAssigned(Task task) {
        if (task.getStatus() != TaskStatus.ASSIGNED) {
            return;
        }
        try {
            dispatch(task);
        } catch (RuntimeException e) {
            log.error("[{}] Could not start task {}: {}", task.getAssignedTo(), task.getId(), e.getMessage(), e);
        }
    }

    private OutputListener progressListener(String taskId, String agentId) {
        return new OutputListener() {
            @Override
            public void onProgress(ExecutionProgress progress) {
                tracker.record(taskId, progress);
                events.publishEvent(new TaskProgressEvent(taskId, agentId, progress));
            }
        };
    }

    private void finish(String taskId, ExecutionResult result, Throwable error) {
        RunningTask running = runningTasks.remove(taskId);
        if (running == null) {
            // cancelled or timed out
            return;
        }
        running.cancelTimeout();
        tracker.clear(taskId);
        long durationMs = Duration.between(running.startedAt, clock.instant()).toMillis();

        boolean success = error == null && result != null && result.isSuccess();
        String errorText = error != null ? error.getMessage()
            : result == null ? "No result" : result.getError();
        if (result != null && result.getUsage() != null) {
            stats.incrementTokens(running.agentId,
                result.getUsage().getInputTokens(), result.getUsage().getOutputTokens());
        }

        try {
            Task done = tasks.update(taskId, t -> {
                t.setStatus(success ? TaskStatus.COMPLETED : TaskStatus.FAILED);
                t.setCompletedAt(clock.instant());
                if (success) {
                    t.setResult(TextUtils.truncate(result.getText(), MAX_RESULT_LENGTH));
                } else {
                    t.setError(TextUtils.truncateError(errorText != null ? errorText : "Unknown error"));
                }
            });
            if (success) {
                log.info("[{}] Task {} completed in {}ms", running.agentId, taskId, durationMs);
            } else {
                log.warn("[{}] Task {} failed: {}", running.agentId, taskId, done.getError());
            }
            events.publishEvent(new TaskCompletedEvent(done, durationMs));
        } catch (RuntimeException e) {
            log.error("[{}] Could not record outcome of task {}: {}", running.agentId, taskId, e.getMessage(), e);
        }
        pickNextForAgent(running.agentId);
    }

    private void onTimeout(String taskId) {
        RunningTask running = runningTasks.remove(taskId);
        if (running == null) {
            return;
        }
        log.warn("[{}] Task {} timed out after {}", running.agentId, taskId, taskTimeout);
        agents.abort(running.agentId);
        tracker.clear(taskId);
        try {
            Task failed = tasks.update(taskId, t -> {
                t.setStatus(TaskStatus.FAILED);
                t.setCompletedAt(clock.instant());
                t.setError("Timed out after " + taskTimeout.toMinutes() + " minutes");
            });
            events.publishEvent(new TaskCompletedEvent(failed,
                Duration.between(running.startedAt, clock.instant()).toMillis()));
        } catch (RuntimeException e) {
            log.error("[{}] Could not fail timed out task {}: {}", running.agentId, taskId, e.getMessage(), e);
        }
        pickNextForAgent(running.agentId);
    }

    private static final class RunningTask {
        final String agentId;
        final Instant startedAt;
        volatile ScheduledFuture<?> timeout;

        RunningTask(String agentId, Instant startedAt) {
            this.agentId = agentId;
            this.startedAt = startedAt;
        }

        void cancelTimeout() {
            ScheduledFuture<?> pending = timeout;
            if (pending != null) {
                pending.cancel(false);
            }
        }
    }
}
