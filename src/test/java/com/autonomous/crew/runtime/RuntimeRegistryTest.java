package com.autonomous.crew.runtime;

import com.autonomous.crew.model.AgentProfile;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RuntimeRegistryTest {

    private final RuntimeRegistry registry = new RuntimeRegistry(List.of(
        new ClaudeCodeRuntime(), new CodexRuntime(Clock.systemUTC()), new CursorRuntime()));

    @Test
    void shouldLookUpRuntimesById() {
        assertTrue(registry.has("cursor"));
        assertTrue(registry.get("codex").isPresent());
        assertFalse(registry.has("opencode"));
        assertEquals(3, registry.list().size());
    }

    @Test
    void shouldRegisterAdditionalRuntime() {
        registry.register(new OpenCodeRuntime(Clock.systemUTC()));

        assertEquals("opencode", registry.require("opencode").runtimeId());
    }

    @Test
    void shouldRejectUnknownRuntime() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> registry.require("aider"));
        assertEquals("Unknown runtime: aider", e.getMessage());
    }

    @Test
    void shouldBuildCursorCommandLines() {
        CursorRuntime cursor = (CursorRuntime) registry.require(CursorRuntime.ID);
        AgentProfile profile = AgentProfile.builder().id("cur").model("gpt-5").build();
        ExecutionOptions options = ExecutionOptions.builder().sessionId("s-9").build();

        assertEquals(List.of("--model", "gpt-5"), cursor.buildSpawnConfig(profile).getArgs());
        assertEquals(List.of("cursor-agent", "-p", "--output-format", "stream-json", "--trust",
                "--model", "gpt-5", "--resume", "s-9"),
            cursor.buildExecuteArgs(profile, options, "ignored"));
        assertEquals(InputMode.STDIN, cursor.inputMode());
    }
}
