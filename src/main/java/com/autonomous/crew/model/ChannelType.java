package com.autonomous.crew.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ChannelType {
    @JsonProperty("team") TEAM,
    @JsonProperty("direct") DIRECT,
    @JsonProperty("broadcast") BROADCAST
}
