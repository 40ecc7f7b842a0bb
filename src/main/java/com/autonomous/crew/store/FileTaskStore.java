package com.autonomous.crew.store;

import com.autonomous.crew.model.Task;
import com.autonomous.crew.model.TaskFilter;
import com.autonomous.crew.model.TaskStatus;
import com.autonomous.crew.support.DebounceTimer;
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Tasks kept in memory and persisted as one JSON array in {@code tasks/tasks.json}.
 */
@Slf4j
public class FileTaskStore implements TaskStore {

    private final Path file;
    private final Clock clock;
    private final JsonFileSupport json = new JsonFileSupport();
    private final Map<String, Task> tasks = new LinkedHashMap<>();
    private final DebounceTimer writer;

    public FileTaskStore(Path dataDir, ScheduledExecutorService timer, long debounceMs, Clock clock) {
        this.file = dataDir.resolve("tasks").resolve("tasks.json");
        this.clock = clock;
        this.writer = new DebounceTimer("tasks", timer, debounceMs, this::persist);
        load();
    }

    private void load() {
        for (Task task : json.readList(file, new TypeReference<List<Task>>() {})) {
            if (task.getId() != null) {
                tasks.put(task.getId(), task);
            }
        }
        log.info("Loaded {} tasks from {}", tasks.size(), file);
    }

    @Override
    public synchronized Task create(Task task) {
        Task stored = task.copy();
        if (stored.getId() == null) {
            stored.setId(UUID.randomUUID().toString());
        }
        if (stored.getCreatedAt() == null) {
            stored.setCreatedAt(clock.instant());
        }
        if (stored.getStatus() == null) {
            stored.setStatus(TaskStatus.PENDING);
        }
        tasks.put(stored.getId(), stored);
        writer.schedule();
        return stored.copy();
    }

    @Override
    public synchronized Optional<Task> get(String taskId) {
        return Optional.ofNullable(tasks.get(taskId)).map(Task::copy);
    }

    @Override
    public synchronized Task update(String taskId, Consumer<Task> changes) {
        Task current = tasks.get(taskId);
        if (current == null) {
            throw new TaskNotFoundException(taskId);
        }
        Task updated = current.copy();
        changes.accept(updated);
        updated.setId(taskId);
        TaskStatus from = current.getStatus();
        TaskStatus to = updated.getStatus();
        if (from != to && (from == null || to == null || !from.canTransitionTo(to))) {
            throw new IllegalStateException("Illegal task transition " + from + " -> " + to + " for " + taskId);
        }
        tasks.put(taskId, updated);
        writer.schedule();
        return updated.copy();
    }

    @Override
    public synchronized boolean delete(String taskId) {
        boolean removed = tasks.remove(taskId) != null;
        if (removed) {
            writer.schedule();
        }
        return removed;
    }

    @Override
    public synchronized List<Task> list(TaskFilter filter) {
        return tasks.values().stream()
            .filter(filter::matches)
            .map(Task::copy)
            .collect(Collectors.toList());
    }

    @Override
    public void flush() {
        writer.flushNow();
    }

    private void persist() throws Exception {
        List<Task> snapshot;
        synchronized (this) {
            snapshot = new ArrayList<>(tasks.values());
        }
        json.writeAtomically(file, snapshot);
    }
}
