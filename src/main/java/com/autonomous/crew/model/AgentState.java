package com.autonomous.crew.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentState {
    private String agentId;
    private AgentStatus status;
    private Long pid;
    private Instant startedAt;
    private String lastOutput;
}
