package com.autonomous.crew.service;

import com.autonomous.crew.config.CrewProperties;
import com.autonomous.crew.event.AgentOutputEvent;
import com.autonomous.crew.event.AgentStatusChangedEvent;
import com.autonomous.crew.model.AgentProfile;
import com.autonomous.crew.model.AgentState;
import com.autonomous.crew.model.AgentStatus;
import com.autonomous.crew.model.ContainerInfo;
import com.autonomous.crew.runtime.AbortSignal;
import com.autonomous.crew.runtime.AgentRuntime;
import com.autonomous.crew.runtime.CommandWrapper;
import com.autonomous.crew.runtime.ExecutionOptions;
import com.autonomous.crew.runtime.ExecutionResult;
import com.autonomous.crew.runtime.OutputListener;
import com.autonomous.crew.runtime.RuntimeExecutionDriver;
import com.autonomous.crew.runtime.RuntimeRegistry;
import com.autonomous.crew.runtime.SpawnConfig;
import com.autonomous.crew.sandbox.ContainerManager;
import com.autonomous.crew.sandbox.DockerClient;
import com.autonomous.crew.sandbox.SandboxException;
import com.autonomous.crew.support.TextUtils;
import com.autonomous.crew.terminal.DirectTerminalManager;
import com.autonomous.crew.terminal.SandboxedTerminalManager;
import com.autonomous.crew.terminal.SpawnOptions;
import com.autonomous.crew.terminal.SpawnResult;
import com.autonomous.crew.terminal.TerminalListener;
import com.autonomous.crew.terminal.TerminalManager;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs agents: interactive terminal sessions and one-shot executions, directly on the host or
 * inside each agent's container when the sandbox is enabled.
 */
@Slf4j
@Service
public class AgentService implements TerminalListener {

    static final long RESTART_PAUSE_MS = 500;
    static final String CONTAINER_WORKSPACE = "/workspace";

    private final AgentProfileService profiles;
    private final RuntimeRegistry runtimes;
    private final RuntimeExecutionDriver driver;
    private final DirectTerminalManager directTerminals;
    private final SandboxedTerminalManager sandboxedTerminals;
    private final ContainerManager containers;
    private final DockerClient docker;
    private final CrewProperties properties;
    private final ApplicationEventPublisher events;
    private final Clock clock;

    private final Map<String, AgentState> states = new ConcurrentHashMap<>();
    private final Map<String, Set<AbortSignal>> executions = new ConcurrentHashMap<>();

    public AgentService(AgentProfileService profiles, RuntimeRegistry runtimes, RuntimeExecutionDriver driver,
                        DirectTerminalManager directTerminals, SandboxedTerminalManager sandboxedTerminals,
                        ContainerManager containers, DockerClient docker, CrewProperties properties,
                        ApplicationEventPublisher events, Clock clock) {
        this.profiles = profiles;
        this.runtimes = runtimes;
        this.driver = driver;
        this.directTerminals = directTerminals;
        this.sandboxedTerminals = sandboxedTerminals;
        this.containers = containers;
        this.docker = docker;
        this.properties = properties;
        this.events = events;
        this.clock = clock;
    }

    @PostConstruct
    public void registerTerminalListener() {
        terminals().addListener(this);
    }

    public SpawnResult start(String agentId) {
        AgentProfile profile = profiles.requireProfile(agentId);
        if (terminals().isRunning(agentId)) {
            return SpawnResult.failed("Agent is already running");
        }
        AgentRuntime runtime = runtimes.require(profile.getRuntime());
        setStatus(agentId, AgentStatus.STARTING, null, null);

        try {
            prepareWorkspace(profile);
            if (sandboxed()) {
                containers.createAndStart(profile);
            }
        } catch (IOException | SandboxException e) {
            log.error("[{}] Could not prepare agent: {}", agentId, e.getMessage());
            setStatus(agentId, AgentStatus.ERROR, null, TextUtils.truncateError(e.getMessage()));
            return SpawnResult.failed(TextUtils.truncateError(e.getMessage()));
        }

        SpawnConfig spawn = runtime.buildSpawnConfig(profile);
        Map<String, String> env = new HashMap<>(profile.getEnv() != null ? profile.getEnv() : Map.of());
        env.putAll(spawn.getEnv());
        env.put("CREW_AGENT_ID", agentId);

        SpawnResult result = terminals().spawn(agentId, spawn.getCommand(), spawn.getArgs(), SpawnOptions.builder()
            .cwd(profile.getCwd())
            .env(env)
            .build());

        if (result.isSuccess()) {
            AgentState state = states.get(agentId);
            state.setPid(result.getPid());
            state.setStartedAt(clock.instant());
            setStatus(agentId, AgentStatus.RUNNING, null, null);
            log.info("[{}] Started {} session (pid {})", agentId, runtime.displayName(), result.getPid());
        } else {
            log.error("[{}] Failed to start session: {}", agentId, result.getError());
            setStatus(agentId, AgentStatus.ERROR, null, result.getError());
        }
        return result;
    }

    public boolean stop(String agentId) {
        profiles.requireProfile(agentId);
        boolean killed = terminals().kill(agentId);
        abort(agentId);
        setStatus(agentId, AgentStatus.STOPPED, null, null);
        log.info("[{}] Stopped", agentId);
        return killed;
    }

    public SpawnResult restart(String agentId) throws InterruptedException {
        stop(agentId);
        Thread.sleep(RESTART_PAUSE_MS);
        return start(agentId);
    }

    public boolean sendInput(String agentId, String text) {
        return terminals().write(agentId, text + "\r");
    }

    public boolean resize(String agentId, int cols, int rows) {
        return terminals().resize(agentId, cols, rows);
    }

    public String getScrollback(String agentId) {
        return terminals().getScrollback(agentId);
    }

    public Optional<AgentState> getState(String agentId) {
        return Optional.ofNullable(states.get(agentId));
    }

    /** States of every known profile, stopped ones included. */
    public List<AgentState> listStates() {
        List<AgentState> result = new ArrayList<>();
        for (AgentProfile profile : profiles.listProfiles()) {
            result.add(states.getOrDefault(profile.getId(), AgentState.builder()
                .agentId(profile.getId())
                .status(AgentStatus.STOPPED)
                .build()));
        }
        return result;
    }

    /**
     * Runs one prompt to completion outside the agent's interactive session.
     * {@link #abort(String)} cancels every detached execution of the agent.
     */
    public CompletableFuture<ExecutionResult> executeDetached(String agentId, String prompt, OutputListener listener) {
        AgentProfile profile = profiles.requireProfile(agentId);
        AgentRuntime runtime = runtimes.require(profile.getRuntime());

        AbortSignal signal = new AbortSignal();
        ExecutionOptions.ExecutionOptionsBuilder options = ExecutionOptions.builder()
            .cwd(profile.getCwd())
            .signal(signal)
            .listener(listener != null ? listener : OutputListener.NONE);

        try {
            prepareWorkspace(profile);
            if (sandboxed()) {
                ContainerInfo container = containers.createAndStart(profile);
                options.commandWrapper(containerWrapper(container.getContainerId()));
            }
        } catch (IOException | SandboxException e) {
            log.error("[{}] Could not prepare execution: {}", agentId, e.getMessage());
            return CompletableFuture.completedFuture(ExecutionResult.failure(e.getMessage()));
        }

        Set<AbortSignal> signals = executions.computeIfAbsent(agentId, id -> ConcurrentHashMap.newKeySet());
        signals.add(signal);
        return driver.execute(runtime, profile, prompt, options.build())
            .whenComplete((result, error) -> signals.remove(signal));
    }

    /** Aborts the agent's detached executions. */
    public boolean abort(String agentId) {
        Set<AbortSignal> signals = executions.get(agentId);
        if (signals == null || signals.isEmpty()) {
            return false;
        }
        log.info("[{}] Aborting {} execution(s)", agentId, signals.size());
        new ArrayList<>(signals).forEach(AbortSignal::abort);
        return true;
    }

    public void stopAll() {
        executions.keySet().forEach(this::abort);
        terminals().killAll();
        states.values().forEach(state -> state.setStatus(AgentStatus.STOPPED));
    }

    @Override
    public void onOutput(String agentId, String data) {
        events.publishEvent(new AgentOutputEvent(agentId, data));
    }

    @Override
    public void onExit(String agentId, int exitCode, String lastOutput) {
        AgentStatus status = exitCode == 0 ? AgentStatus.STOPPED : AgentStatus.ERROR;
        if (status == AgentStatus.ERROR) {
            log.warn("[{}] Session exited with code {}", agentId, exitCode);
        } else {
            log.info("[{}] Session exited", agentId);
        }
        AgentState state = states.computeIfAbsent(agentId, id -> AgentState.builder().agentId(id).build());
        state.setPid(null);
        state.setStatus(status);
        state.setLastOutput(lastOutput);
        events.publishEvent(new AgentStatusChangedEvent(agentId, status, exitCode, lastOutput));
    }

    private CommandWrapper containerWrapper(String containerId) {
        return (argv, env) -> docker.buildExecArgs(containerId, CONTAINER_WORKSPACE, env, false, argv);
    }

    private void prepareWorkspace(AgentProfile profile) throws IOException {
        if (profile.getCwd() != null && !profile.getCwd().isBlank()) {
            Files.createDirectories(Path.of(profile.getCwd()));
        }
    }

    private void setStatus(String agentId, AgentStatus status, Integer exitCode, String lastOutput) {
        AgentState state = states.computeIfAbsent(agentId, id -> AgentState.builder().agentId(id).build());
        state.setStatus(status);
        if (lastOutput != null) {
            state.setLastOutput(lastOutput);
        }
        events.publishEvent(new AgentStatusChangedEvent(agentId, status, exitCode, lastOutput));
    }

    private boolean sandboxed() {
        return properties.getSandbox().isEnabled();
    }

    private TerminalManager terminals() {
        return sandboxed() ? sandboxedTerminals : directTerminals;
    }
}
