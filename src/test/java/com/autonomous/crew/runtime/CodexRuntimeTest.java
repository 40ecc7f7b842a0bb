package com.autonomous.crew.runtime;

import com.autonomous.crew.model.AgentProfile;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CodexRuntimeTest {

    private final CodexRuntime runtime = new CodexRuntime(Clock.systemUTC());

    @Test
    void shouldPassPromptAsLastArgument() {
        AgentProfile profile = AgentProfile.builder().id("rev").model("gpt-5").allowFullAccess(true).build();

        List<String> argv = runtime.buildExecuteArgs(profile, ExecutionOptions.defaults(), "Review the diff");

        assertEquals(List.of("codex", "exec", "--model", "gpt-5", "--full-auto", "Review the diff"), argv);
        assertEquals(InputMode.ARGUMENT, runtime.inputMode());
    }

    @Test
    void shouldTreatNonZeroExitAsFailure() {
        ExecutionResult result = runtime.parseExecutionOutput("thinking...\nerror: quota exceeded\n", "", 1);

        assertFalse(result.isSuccess());
        assertEquals("error: quota exceeded", result.getError());
    }

    @Test
    void shouldSetModelEnvironmentForOpenCode() {
        OpenCodeRuntime openCode = new OpenCodeRuntime(Clock.systemUTC());
        AgentProfile profile = AgentProfile.builder().id("oc").model("sonnet").build();

        assertEquals("sonnet", openCode.buildExecuteEnv(profile).get("OPENCODE_MODEL"));
        assertEquals(List.of("opencode", "run", "--model", "sonnet", "go"),
            openCode.buildExecuteArgs(profile, ExecutionOptions.defaults(), "go"));
    }
}
