package com.autonomous.crew.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum TaskSource {
    @JsonProperty("user") USER,
    @JsonProperty("agent") AGENT,
    @JsonProperty("system") SYSTEM,
    @JsonProperty("schedule") SCHEDULE
}
