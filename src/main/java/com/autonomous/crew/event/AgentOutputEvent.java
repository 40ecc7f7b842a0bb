package com.autonomous.crew.event;

import lombok.Value;

@Value
public class AgentOutputEvent {
    String agentId;
    String data;
}
