package com.autonomous.crew.runtime;

import com.autonomous.crew.model.AgentProfile;
import com.autonomous.crew.runtime.output.OutputClassifier;
import com.autonomous.crew.runtime.output.OutputStrategy;
import com.autonomous.crew.runtime.output.ThrottledOutputStrategy;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

@Component
public class CodexRuntime implements AgentRuntime {

    public static final String ID = "codex";
    static final String COMMAND = "codex";

    private static final OutputClassifier CLASSIFIER = OutputClassifier.keywords(List.of("executing", "running", "shell"));

    private final Clock clock;

    public CodexRuntime(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String runtimeId() {
        return ID;
    }

    @Override
    public String displayName() {
        return "Codex CLI";
    }

    @Override
    public SpawnConfig buildSpawnConfig(AgentProfile profile) {
        List<String> args = new ArrayList<>();
        addModelAndAccess(profile, args);
        return SpawnConfig.builder().command(COMMAND).args(args).build();
    }

    @Override
    public List<String> buildExecuteArgs(AgentProfile profile, ExecutionOptions options, String text) {
        List<String> argv = new ArrayList<>(List.of(COMMAND, "exec"));
        addModelAndAccess(profile, argv);
        argv.add(text);
        return argv;
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

    private static void addModelAndAccess(AgentProfile profile, List<String> args) {
        if (profile.getModel() != null && !profile.getModel().isBlank()) {
            args.add("--model");
            args.add(profile.getModel());
        }
        if (profile.isAllowFullAccess()) {
            args.add("--full-auto");
        }
    }
}
