package com.autonomous.crew.store;

import com.autonomous.crew.model.AgentStats;

import java.util.function.Consumer;

public interface StatsStore {

    AgentStats get(String agentId);

    AgentStats update(String agentId, Consumer<AgentStats> changes);

    AgentStats incrementTokens(String agentId, long tokensIn, long tokensOut);

    AgentStats recordExecution(String agentId, long durationMs, boolean success);

    void flush();
}
