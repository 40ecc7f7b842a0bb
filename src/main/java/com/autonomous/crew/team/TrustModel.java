package com.autonomous.crew.team;

import com.autonomous.crew.model.AgentRelationship;

import java.time.Instant;

/**
 * Exponential moving average over delegation outcomes.
 * Outcome is 1.0 for success and 0.0 for failure; trust stays within [0, 1].
 */
public final class TrustModel {

    public static final double INITIAL_TRUST = 0.5;
    public static final double BASE_ALPHA = 0.15;

    private TrustModel() {
    }

    public static double nextTrust(double trust, double outcome, double weight) {
        double alpha = BASE_ALPHA * weight;
        return clamp(alpha * outcome + (1 - alpha) * trust);
    }

    /**
     * Returns a new relationship with the outcome applied. A missing relationship starts at {@link #INITIAL_TRUST}.
     */
    public static AgentRelationship applyOutcome(AgentRelationship existing, String sourceAgentId,
                                                 String targetAgentId, double outcome, double weight, Instant at) {
        AgentRelationship base = existing != null ? existing.toBuilder().build() : AgentRelationship.builder()
            .sourceAgentId(sourceAgentId)
            .targetAgentId(targetAgentId)
            .trustScore(INITIAL_TRUST)
            .build();

        int count = base.getDelegationCount() + 1;
        long successes = Math.round(base.getDelegationSuccessRate() * (count - 1));

        base.setTrustScore(nextTrust(base.getTrustScore(), outcome, weight));
        base.setInteractionCount(base.getInteractionCount() + 1);
        base.setDelegationCount(count);
        base.setDelegationSuccessRate((successes + outcome) / count);
        base.setLastInteraction(at);
        return base;
    }

    static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
