package com.autonomous.crew.runtime;

import com.autonomous.crew.model.AgentProfile;
import com.autonomous.crew.runtime.output.OutputClassifier;
import com.autonomous.crew.runtime.output.OutputStrategy;
import com.autonomous.crew.runtime.output.ThrottledOutputStrategy;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Component
public class OpenCodeRuntime implements AgentRuntime {

    public static final String ID = "opencode";
    static final String COMMAND = "opencode";

    private static final OutputClassifier CLASSIFIER = OutputClassifier.keywords(List.of("executing", "running"));

    private final Clock clock;

    public OpenCodeRuntime(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String runtimeId() {
        return ID;
    }

    @Override
    public String displayName() {
        return "OpenCode";
    }

    @Override
    public SpawnConfig buildSpawnConfig(AgentProfile profile) {
        return SpawnConfig.builder()
            .command(COMMAND)
            .env(buildExecuteEnv(profile))
            .build();
    }

    @Override
    public List<String> buildExecuteArgs(AgentProfile profile, ExecutionOptions options, String text) {
        List<String> argv = new ArrayList<>(List.of(COMMAND, "run"));
        if (profile.getModel() != null && !profile.getModel().isBlank()) {
            argv.add("--model");
            argv.add(profile.getModel());
        }
        argv.add(text);
        return argv;
    }

    @Override
    public Map<String, String> buildExecuteEnv(AgentProfile profile) {
        if (profile.getModel() == null || profile.getModel().isBlank()) {
            return Map.of();
        }
        return Map.of("OPENCODE_MODEL", profile.getModel());
    }

    @Override
    public InputMode inputMode() {
        return InputMode.ARGUMENT;
    }

    @Override
    public OutputStrategy createOutputStrategy(OutputListener listener) {
        return new ThrottledOutputStrategy(listener, CLASSIFIER, clock);
    }

    @Override
    public ExecutionResult parseExecutionOutput(String stdout, String stderr, int exitCode) {
        return ExecutionOutcomes.fromPlainText(stdout, stderr, exitCode);
    }

    @Override
    public String formatInput(String text, String sharedContext) {
        if (sharedContext == null || sharedContext.isBlank()) {
            return text;
        }
        return "[Shared context: " + sharedContext + "]\n\n" + text;
    }
}
