package com.autonomous.crew.event;

import com.autonomous.crew.model.AgentStats;
import lombok.Value;

@Value
public class StatsUpdatedEvent {
    String agentId;
    AgentStats stats;
}
