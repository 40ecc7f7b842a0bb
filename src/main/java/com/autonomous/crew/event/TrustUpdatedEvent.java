package com.autonomous.crew.event;

import com.autonomous.crew.model.AgentRelationship;
import lombok.Value;

@Value
public class TrustUpdatedEvent {
    AgentRelationship relationship;
}
