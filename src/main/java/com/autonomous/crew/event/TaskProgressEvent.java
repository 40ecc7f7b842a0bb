package com.autonomous.crew.event;

import com.autonomous.crew.runtime.ExecutionProgress;
import lombok.Value;

@Value
public class TaskProgressEvent {
    String taskId;
    String agentId;
    ExecutionProgress progress;
}
