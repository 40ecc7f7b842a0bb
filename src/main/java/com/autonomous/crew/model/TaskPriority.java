package com.autonomous.crew.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum TaskPriority {
    @JsonProperty("low") LOW,
    @JsonProperty("normal") NORMAL,
    @JsonProperty("high") HIGH,
    @JsonProperty("critical") CRITICAL;

    public String wireName() {
        return name().toLowerCase();
    }

    /**
     * Lenient parse used for requests written by agents. Unknown values fall back to normal.
     */
    public static TaskPriority parse(String value) {
        if (value == null || value.isBlank()) {
            return NORMAL;
        }
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return NORMAL;
        }
    }
}
