package com.autonomous.crew.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.EnumSet;
import java.util.Set;

public enum TaskStatus {
    @JsonProperty("pending") PENDING,
    @JsonProperty("assigned") ASSIGNED,
    @JsonProperty("running") RUNNING,
    @JsonProperty("completed") COMPLETED,
    @JsonProperty("failed") FAILED,
    @JsonProperty("cancelled") CANCELLED;

    /**
     * Forward-only lifecycle. A task that has not started yet may be cancelled directly.
     */
    public boolean canTransitionTo(TaskStatus next) {
        return switch (this) {
            case PENDING -> next == ASSIGNED || next == CANCELLED;
            case ASSIGNED -> next == RUNNING || next == CANCELLED;
            case RUNNING -> next == COMPLETED || next == FAILED || next == CANCELLED;
            case COMPLETED, FAILED, CANCELLED -> false;
        };
    }

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    public String wireName() {
        return name().toLowerCase();
    }

    public static TaskStatus fromValue(String value) {
        return valueOf(value.trim().toUpperCase());
    }

    private static final Set<TaskStatus> TERMINAL = EnumSet.of(COMPLETED, FAILED, CANCELLED);
}
