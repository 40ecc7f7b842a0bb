package com.autonomous.crew.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ScheduleSource {
    @JsonProperty("system") SYSTEM,
    @JsonProperty("user") USER,
    @JsonProperty("agent") AGENT
}
