package com.autonomous.crew.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class TaskFilter {
    private TaskStatus status;
    private String assignedTo;
    private String createdBy;
    private TaskSource source;

    public static TaskFilter all() {
        return TaskFilter.builder().build();
    }

    public static TaskFilter byStatus(TaskStatus status) {
        return TaskFilter.builder().status(status).build();
    }

    public boolean matches(Task task) {
        return (status == null || status == task.getStatus())
            && (assignedTo == null || assignedTo.equals(task.getAssignedTo()))
            && (createdBy == null || createdBy.equals(task.getCreatedBy()))
            && (source == null || source == task.getSource());
    }
}
