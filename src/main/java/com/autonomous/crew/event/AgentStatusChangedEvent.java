package com.autonomous.crew.event;

import com.autonomous.crew.model.AgentStatus;
import lombok.Value;

@Value
public class AgentStatusChangedEvent {
    String agentId;
    AgentStatus status;
    Integer exitCode;
    String lastOutput;
}
