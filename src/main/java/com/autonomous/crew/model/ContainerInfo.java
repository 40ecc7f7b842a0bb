package com.autonomous.crew.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContainerInfo {
    private String agentId;
    private String containerId;
    private String containerName;
    private String status;
    /** host port -> container port; empty for containers adopted at startup */
    @Builder.Default
    private Map<Integer, Integer> portMappings = new HashMap<>();
    private Instant createdAt;
}
