package com.autonomous.crew.event;

import com.autonomous.crew.model.Task;
import lombok.Value;

@Value
public class TaskUpdatedEvent {
    Task task;
}
