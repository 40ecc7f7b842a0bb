package com.autonomous.crew.runtime;

import com.autonomous.crew.model.AgentProfile;
import com.autonomous.crew.runtime.output.OutputStrategy;
import com.autonomous.crew.runtime.output.StreamEventParser;
import com.autonomous.crew.runtime.output.StructuredOutputStrategy;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Component
public class ClaudeCodeRuntime implements AgentRuntime {

    public static final String ID = "claude-code";
    static final String COMMAND = "claude";

    private final StreamEventParser parser = new StreamEventParser();

    @Override
    public String runtimeId() {
        return ID;
    }

    @Override
    public String displayName() {
        return "Claude Code";
    }

    @Override
    public SpawnConfig buildSpawnConfig(AgentProfile profile) {
        List<String> args = new ArrayList<>();
        if (profile.isAllowFullAccess()) {
            args.add("--dangerously-skip-permissions");
        }
        if (profile.getModel() != null && !profile.getModel().isBlank()) {
            args.add("--model");
            args.add(profile.getModel());
        }
        args.add("--system-prompt");
        args.add(systemPrompt(profile));
        return SpawnConfig.builder()
            .command(COMMAND)
            .args(args)
            .env(buildExecuteEnv(profile))
            .build();
    }

    @Override
    public List<String> buildExecuteArgs(AgentProfile profile, ExecutionOptions options, String text) {
        List<String> argv = new ArrayList<>(List.of(COMMAND, "-p", "--output-format", "stream-json", "--verbose"));
        if (profile.isAllowFullAccess()) {
            argv.add("--dangerously-skip-permissions");
        }
        if (profile.getModel() != null && !profile.getModel().isBlank()) {
            argv.add("--model");
            argv.add(profile.getModel());
        }
        if (profile.getSystemPrompt() != null && !profile.getSystemPrompt().isBlank()) {
            argv.add("--append-system-prompt");
            argv.add(profile.getSystemPrompt());
        }
        if (options.getSessionId() != null) {
            argv.add("--resume");
            argv.add(options.getSessionId());
        }
        return argv;
    }

    @Override
    public Map<String, String> buildExecuteEnv(AgentProfile profile) {
        return Map.of("CLAUDE_CODE_DISABLE_NONESSENTIAL_TRAFFIC", "1");
    }

    @Override
    public OutputStrategy createOutputStrategy(OutputListener listener) {
        return new StructuredOutputStrategy(parser, listener);
    }

    @Override
    public ExecutionResult parseExecutionOutput(String stdout, String stderr, int exitCode) {
        return ExecutionOutcomes.fromStream(parser, stdout, stderr, exitCode);
    }

    static String systemPrompt(AgentProfile profile) {
        if (profile.getSystemPrompt() != null && !profile.getSystemPrompt().isBlank()) {
            return profile.getSystemPrompt();
        }
        return "Your name is " + profile.displayName() + ". You are an AI agent working as part of a crew. "
            + "To hand work to another agent, append a JSON line with title, description and assignedTo "
            + "to the inbox.jsonl file in their working directory.";
    }
}
