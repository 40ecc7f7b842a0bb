package com.autonomous.crew.runtime;

import com.autonomous.crew.model.AgentProfile;
import com.autonomous.crew.runtime.output.OutputStrategy;
import com.autonomous.crew.runtime.output.StreamEventParser;
import com.autonomous.crew.runtime.output.StructuredOutputStrategy;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class CursorRuntime implements AgentRuntime {

    public static final String ID = "cursor";
    static final String COMMAND = "cursor-agent";

    private final StreamEventParser parser = new StreamEventParser();

    @Override
    public String runtimeId() {
        return ID;
    }

    @Override
    public String displayName() {
        return "Cursor Agent";
    }

    @Override
    public SpawnConfig buildSpawnConfig(AgentProfile profile) {
        List<String> args = new ArrayList<>();
        if (profile.getModel() != null && !profile.getModel().isBlank()) {
            args.add("--model");
            args.add(profile.getModel());
        }
        return SpawnConfig.builder().command(COMMAND).args(args).build();
    }

    @Override
    public List<String> buildExecuteArgs(AgentProfile profile, ExecutionOptions options, String text) {
        List<String> argv = new ArrayList<>(List.of(COMMAND, "-p", "--output-format", "stream-json", "--trust"));
        if (profile.getModel() != null && !profile.getModel().isBlank()) {
            argv.add("--model");
            argv.add(profile.getModel());
        }
        if (options.getSessionId() != null) {
            argv.add("--resume");
            argv.add(options.getSessionId());
        }
        return argv;
    }

    @Override
    public OutputStrategy createOutputStrategy(OutputListener listener) {
        return new StructuredOutputStrategy(parser, listener);
    }

    @Override
    public ExecutionResult parseExecutionOutput(String stdout, String stderr, int exitCode) {
        return ExecutionOutcomes.fromStream(parser, stdout, stderr, exitCode);
    }
}
