package com.autonomous.crew.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum AgentStatus {
    @JsonProperty("stopped") STOPPED,
    @JsonProperty("starting") STARTING,
    @JsonProperty("running") RUNNING,
    @JsonProperty("error") ERROR
}
