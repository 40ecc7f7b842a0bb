package com.autonomous.crew.service;

import com.autonomous.crew.event.TaskCreatedEvent;
import com.autonomous.crew.event.TaskUpdatedEvent;
import com.autonomous.crew.model.Task;
import com.autonomous.crew.model.TaskFilter;
import com.autonomous.crew.model.TaskPriority;
import com.autonomous.crew.model.TaskSource;
import com.autonomous.crew.model.TaskStatus;
import com.autonomous.crew.store.TaskNotFoundException;
import com.autonomous.crew.store.TaskStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Task store access that announces every change on the event bus.
 */
@Slf4j
@Service
public class TaskService {

    private final TaskStore store;
    private final ApplicationEventPublisher events;

    public TaskService(TaskStore store, ApplicationEventPublisher events) {
        this.store = store;
        this.events = events;
    }

    public Task create(Task task) {
        if (task.getTitle() == null || task.getTitle().isBlank()) {
            throw new IllegalArgumentException("Task title is required");
        }
        Task draft = task.copy();
        if (draft.getPriority() == null) {
            draft.setPriority(TaskPriority.NORMAL);
        }
        if (draft.getSource() == null) {
            draft.setSource(TaskSource.USER);
        }
        if (draft.getStatus() == null) {
            draft.setStatus(draft.getAssignedTo() != null ? TaskStatus.ASSIGNED : TaskStatus.PENDING);
        }
        Task created = store.create(draft);
        log.info("Created task {} \"{}\" ({})", created.getId(), created.getTitle(), created.getStatus().wireName());
        events.publishEvent(new TaskCreatedEvent(created));
        return created;
    }

    /**
     * @throws TaskNotFoundException if no task has the id
     * @throws IllegalStateException if the change is not a legal status transition
     */
    public Task update(String taskId, Consumer<Task> changes) {
        Task updated = store.update(taskId, changes);
        events.publishEvent(new TaskUpdatedEvent(updated));
        return updated;
    }

    public Optional<Task> get(String taskId) {
        return store.get(taskId);
    }

    public Task require(String taskId) {
        return store.get(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
    }

    public List<Task> list(TaskFilter filter) {
        return store.list(filter);
    }

    public boolean delete(String taskId) {
        return store.delete(taskId);
    }
}
