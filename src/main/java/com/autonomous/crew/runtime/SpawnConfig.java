package com.autonomous.crew.runtime;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/** Command line and extra environment for an interactive terminal session. */
@Value
@Builder
public class SpawnConfig {
    String command;
    @Builder.Default
    List<String> args = List.of();
    @Builder.Default
    Map<String, String> env = Map.of();
}
