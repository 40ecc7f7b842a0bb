package com.autonomous.crew.runtime;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ProgressKind {
    @JsonProperty("tool-use") TOOL_USE,
    @JsonProperty("thinking") THINKING,
    @JsonProperty("text") TEXT
}
