package com.autonomous.crew.service;

import com.autonomous.crew.model.Task;
import com.autonomous.crew.runtime.ExecutionProgress;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Recent progress steps of running tasks.
 */
@Component
public class TaskTracker {

    static final int MAX_STEPS = 50;

    private final Map<String, Deque<ExecutionProgress>> steps = new ConcurrentHashMap<>();

    public void record(String taskId, ExecutionProgress progress) {
        Deque<ExecutionProgress> taskSteps = steps.computeIfAbsent(taskId, id -> new ArrayDeque<>());
        synchronized (taskSteps) {
            taskSteps.addLast(progress);
            while (taskSteps.size() > MAX_STEPS) {
                taskSteps.removeFirst();
            }
        }
    }

    public List<ExecutionProgress> getSteps(String taskId) {
        Deque<ExecutionProgress> taskSteps = steps.get(taskId);
        if (taskSteps == null) {
            return List.of();
        }
        synchronized (taskSteps) {
            return new ArrayList<>(taskSteps);
        }
    }

    public void clear(String taskId) {
        steps.remove(taskId);
    }

    public String formatStatusSummary(Task task) {
        StringBuilder summary = new StringBuilder();
        summary.append("**").append(task.getTitle()).append("** (").append(task.getStatus().wireName()).append(")");
        if (task.getAssignedTo() != null) {
            summary.append(" - ").append(task.getAssignedTo());
        }
        List<ExecutionProgress> recent = getSteps(task.getId());
        int from = Math.max(0, recent.size() - 5);
        for (ExecutionProgress step : recent.subList(from, recent.size())) {
            summary.append("\n- ").append(step.getSummary());
        }
        return summary.toString();
    }
}
