package com.autonomous.crew.team;

import com.autonomous.crew.config.CrewProperties;
import com.autonomous.crew.model.AgentProfile;
import com.autonomous.crew.runtime.AgentRuntime;
import com.autonomous.crew.runtime.ExecutionOptions;
import com.autonomous.crew.runtime.ExecutionResult;
import com.autonomous.crew.runtime.RuntimeExecutionDriver;
import com.autonomous.crew.runtime.RuntimeRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs team operations as one-shot executions of the configured runtime.
 */
@Slf4j
@Component
public class SharedRuntimeBackend implements TeamRuntimeBackend {

    private final RuntimeRegistry runtimes;
    private final RuntimeExecutionDriver driver;
    private final CrewProperties properties;

    public SharedRuntimeBackend(RuntimeRegistry runtimes, RuntimeExecutionDriver driver, CrewProperties properties) {
        this.runtimes = runtimes;
        this.driver = driver;
        this.properties = properties;
    }

    @Override
    public String execute(String operation, String model, String prompt) throws Exception {
        CrewProperties.Team team = properties.getTeam();
        AgentRuntime runtime = runtimes.require(team.getRuntime());
        AgentProfile profile = AgentProfile.builder()
            .id(AgentProfile.SYSTEM_AGENT_ID)
            .name("Crew")
            .runtime(runtime.runtimeId())
            .model(model)
            .cwd(Path.of(properties.getStorage().getPath()).toAbsolutePath().toString())
            .system(true)
            .build();

        long timeoutMs = team.getOperationTimeout().toMillis();
        ExecutionResult result;
        try {
            result = driver.execute(runtime, profile, prompt, ExecutionOptions.defaults())
                .get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new TimeoutException(operation + " timed out after " + timeoutMs + "ms");
        }
        if (!result.isSuccess()) {
            throw new IllegalStateException(operation + " failed: " + result.getError());
        }
        return result.getText();
    }
}
