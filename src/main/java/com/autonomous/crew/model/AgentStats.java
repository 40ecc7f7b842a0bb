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
public class AgentStats {
    private String agentId;
    private long tasksCompleted;
    private long tasksFailed;
    private long totalTokensIn;
    private long totalTokensOut;
    private long totalExecutionMs;
    private long averageResponseMs;
    private long uptime;
    private Instant lastActive;
    @Builder.Default
    private Streaks streaks = new Streaks();

    public static AgentStats empty(String agentId) {
        return AgentStats.builder().agentId(agentId).build();
    }

    public long totalTasks() {
        return tasksCompleted + tasksFailed;
    }

    public AgentStats copy() {
        return toBuilder().streaks(new Streaks(streaks.getCurrent(), streaks.getBest())).build();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Streaks {
        private int current;
        private int best;
    }
}
