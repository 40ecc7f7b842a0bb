package com.autonomous.crew.team;

import com.autonomous.crew.model.AgentProfile;
import com.autonomous.crew.model.AgentRelationship;
import com.autonomous.crew.model.AgentStats;
import com.autonomous.crew.model.Task;

import java.util.List;
import java.util.Map;
import java.util.Optional;

public interface TaskAssigner {

    /**
     * Picks the agent that should take an unassigned task.
     *
     * @param relationships outgoing relationships keyed by agent id
     * @param stats         stats keyed by agent id
     * @param running       number of running tasks keyed by agent id
     * @return the chosen agent id, or empty when every candidate is at capacity
     */
    Optional<String> assign(Task task,
                            List<AgentProfile> candidates,
                            Map<String, List<AgentRelationship>> relationships,
                            Map<String, AgentStats> stats,
                            Map<String, Integer> running);
}
