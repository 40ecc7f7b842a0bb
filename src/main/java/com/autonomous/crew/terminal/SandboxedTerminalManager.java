package com.autonomous.crew.terminal;

import com.autonomous.crew.process.CleanEnvironment;
import com.autonomous.crew.process.ShellQuoting;
import com.autonomous.crew.sandbox.ContainerManager;
import com.autonomous.crew.sandbox.DockerClient;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Same contract as {@link DirectTerminalManager}, but each session is an exec into the agent's container.
 * Killing a session stops the container.
 */
@Slf4j
public class SandboxedTerminalManager implements TerminalManager, AutoCloseable {

    static final String CONTAINER_WORKDIR = "/workspace";
    static final String CONTAINER_SHELL = "/bin/bash";

    private final TerminalProcessFactory processFactory;
    private final DockerClient docker;
    private final ContainerManager containers;
    private final TerminalSessionRegistry sessions;

    public SandboxedTerminalManager(TerminalProcessFactory processFactory, ScheduledExecutorService timer,
                                    DockerClient docker, ContainerManager containers) {
        this.processFactory = processFactory;
        this.docker = docker;
        this.containers = containers;
        this.sessions = new TerminalSessionRegistry("sandbox", timer);
    }

    @Override
    public SpawnResult spawn(String agentId, String command, List<String> args, SpawnOptions options) {
        if (sessions.contains(agentId)) {
            return SpawnResult.failed("PTY already exists for this agent");
        }
        Optional<String> containerId = containers.getContainerId(agentId);
        if (containerId.isEmpty()) {
            return SpawnResult.failed("No running container for this agent");
        }

        Map<String, String> containerEnv = new HashMap<>(DirectTerminalManager.TERMINAL_ENV);
        if (options.getEnv() != null) {
            containerEnv.putAll(options.getEnv());
        }
        List<String> argv = docker.buildExecArgs(containerId.get(), CONTAINER_WORKDIR, containerEnv, true,
            List.of(CONTAINER_SHELL, "-c", ShellQuoting.join(command, args)));
        Map<String, String> hostEnv = CleanEnvironment.fromSystem(Map.of("TERM", "xterm-256color"));
        String cwd = options.getCwd() != null ? options.getCwd() : System.getProperty("user.home");

        return sessions.open(agentId, () -> processFactory.start(argv, hostEnv, cwd, options.getCols(), options.getRows()));
    }

    @Override
    public boolean write(String agentId, String data) {
        return sessions.get(agentId).map(session -> {
            try {
                session.getProcess().write(data);
                return true;
            } catch (IOException e) {
                log.warn("[{}] Write to container terminal failed: {}", agentId, e.getMessage());
                return false;
            }
        }).orElse(false);
    }

    @Override
    public boolean resize(String agentId, int cols, int rows) {
        return sessions.get(agentId).map(session -> {
            session.getProcess().resize(cols, rows);
            return true;
        }).orElse(false);
    }

    @Override
    public boolean kill(String agentId) {
        Optional<TerminalSession> session = sessions.remove(agentId);
        if (session.isEmpty()) {
            return false;
        }
        log.info("[{}] Stopping container for sandboxed session", agentId);
        containers.stop(agentId);
        TerminalSessionRegistry.killProcess(session.get().getProcess());
        return true;
    }

    @Override
    public void killAll() {
        sessions.agentIds().forEach(this::kill);
    }

    @Override
    public String getScrollback(String agentId) {
        return sessions.get(agentId).map(s -> s.getHandler().getScrollback()).orElse("");
    }

    @Override
    public boolean isRunning(String agentId) {
        return sessions.contains(agentId);
    }

    @Override
    public void addListener(TerminalListener listener) {
        sessions.channel().subscribe(listener);
    }

    @Override
    public void removeListener(TerminalListener listener) {
        sessions.channel().unsubscribe(listener);
    }

    @Override
    public void close() {
        killAll();
        sessions.close();
    }
}
