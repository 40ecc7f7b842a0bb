package com.autonomous.crew.store;

import com.autonomous.crew.model.AgentRelationship;

import java.util.List;
import java.util.Optional;

public interface RelationshipStore {

    Optional<AgentRelationship> get(String sourceAgentId, String targetAgentId);

    void set(AgentRelationship relationship);

    /** All outgoing relationships of an agent. */
    List<AgentRelationship> getAll(String sourceAgentId);

    AgentRelationship updateTrust(String sourceAgentId, String targetAgentId, double outcome, double weight);

    default AgentRelationship updateTrust(String sourceAgentId, String targetAgentId, double outcome) {
        return updateTrust(sourceAgentId, targetAgentId, outcome, 1.0);
    }

    void flush();
}
