package com.autonomous.crew.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AgentRelationship {
    private String sourceAgentId;
    private String targetAgentId;
    private double trustScore;
    private int interactionCount;
    private int delegationCount;
    private double delegationSuccessRate;
    private Instant lastInteraction;
}
