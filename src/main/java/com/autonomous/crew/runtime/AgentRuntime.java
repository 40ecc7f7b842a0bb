package com.autonomous.crew.runtime;

import com.autonomous.crew.model.AgentProfile;
import com.autonomous.crew.runtime.output.OutputStrategy;

import java.util.List;
import java.util.Map;

/**
 * What differs between agent CLIs: command lines, environment and output handling.
 * Process management is shared and lives in {@link RuntimeExecutionDriver}.
 */
public interface AgentRuntime {

    String runtimeId();

    String displayName();

    /** Interactive terminal session. */
    SpawnConfig buildSpawnConfig(AgentProfile profile);

    /** Full argument vector of a one-shot execution, command included. */
    List<String> buildExecuteArgs(AgentProfile profile, ExecutionOptions options, String text);

    default Map<String, String> buildExecuteEnv(AgentProfile profile) {
        return Map.of();
    }

    default InputMode inputMode() {
        return InputMode.STDIN;
    }

    OutputStrategy createOutputStrategy(OutputListener listener);

    ExecutionResult parseExecutionOutput(String stdout, String stderr, int exitCode);

    default String formatInput(String text, String sharedContext) {
        if (sharedContext == null || sharedContext.isBlank()) {
            return text;
        }
        return "[Context from other agents: " + sharedContext + "]\n\n" + text;
    }
}
