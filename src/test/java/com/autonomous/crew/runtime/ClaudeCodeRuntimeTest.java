package com.autonomous.crew.runtime;

import com.autonomous.crew.model.AgentProfile;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ClaudeCodeRuntimeTest {

    private final ClaudeCodeRuntime runtime = new ClaudeCodeRuntime();

    @Test
    void shouldBuildStreamingExecuteArgs() {
        AgentProfile profile = AgentProfile.builder().id("dev").model("opus").allowFullAccess(true)
            .systemPrompt("Be brief.").build();

        List<String> argv = runtime.buildExecuteArgs(profile,
            ExecutionOptions.builder().sessionId("sess-1").build(), "Fix the build");

        assertEquals(List.of("claude", "-p", "--output-format", "stream-json", "--verbose",
            "--dangerously-skip-permissions", "--model", "opus", "--append-system-prompt", "Be brief.",
            "--resume", "sess-1"), argv);
        assertEquals(InputMode.STDIN, runtime.inputMode());
    }

    @Test
    void shouldLeaveOutOptionalFlags() {
        List<String> argv = runtime.buildExecuteArgs(AgentProfile.builder().id("dev").build(),
            ExecutionOptions.defaults(), "hi");

        assertEquals(List.of("claude", "-p", "--output-format", "stream-json", "--verbose"), argv);
    }

    @Test
    void shouldDescribeInboxInDefaultSystemPrompt() {
        SpawnConfig config = runtime.buildSpawnConfig(AgentProfile.builder().id("dev").name("Developer").build());

        assertEquals("claude", config.getCommand());
        String prompt = config.getArgs().get(config.getArgs().indexOf("--system-prompt") + 1);
        assertTrue(prompt.startsWith("Your name is Developer."));
        assertTrue(prompt.contains("inbox.jsonl"));
    }

    @Test
    void shouldPrefixSharedContext() {
        assertEquals("[Context from other agents: ops is deploying]\n\nWait for it",
            runtime.formatInput("Wait for it", "ops is deploying"));
        assertEquals("plain", runtime.formatInput("plain", " "));
    }
}
