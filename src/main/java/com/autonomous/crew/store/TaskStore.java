package com.autonomous.crew.store;

import com.autonomous.crew.model.Task;
import com.autonomous.crew.model.TaskFilter;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

public interface TaskStore {

    /** Stores a new task, filling in id and createdAt when absent. */
    Task create(Task task);

    Optional<Task> get(String taskId);

    /**
     * Applies {@code changes} to the stored task and returns the result.
     *
     * @throws TaskNotFoundException if no task has the id
     * @throws IllegalStateException if the change moves the status backwards
     */
    Task update(String taskId, Consumer<Task> changes);

    boolean delete(String taskId);

    List<Task> list(TaskFilter filter);

    void flush();
}
