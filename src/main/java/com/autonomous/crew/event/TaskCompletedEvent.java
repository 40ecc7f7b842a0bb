package com.autonomous.crew.event;

import com.autonomous.crew.model.Task;
import lombok.Value;

/**
 * Published once a task reaches completed or failed.
 */
@Value
public class TaskCompletedEvent {
    Task task;
    long durationMs;
}
