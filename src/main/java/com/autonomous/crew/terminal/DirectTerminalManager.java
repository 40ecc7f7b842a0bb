package com.autonomous.crew.terminal;

import com.autonomous.crew.process.CleanEnvironment;
import com.autonomous.crew.process.ShellQuoting;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Runs agent CLIs in local pseudo-terminals through a non-login shell.
 */
@Slf4j
public class DirectTerminalManager implements TerminalManager, AutoCloseable {

    static final Map<String, String> TERMINAL_ENV = Map.of(
        "TERM", "xterm-256color",
        "COLORTERM", "truecolor");

    private final TerminalProcessFactory processFactory;
    private final TerminalSessionRegistry sessions;
    private final String shell;

    public DirectTerminalManager(TerminalProcessFactory processFactory, ScheduledExecutorService timer, String shell) {
        this.processFactory = processFactory;
        this.shell = shell;
        this.sessions = new TerminalSessionRegistry("pty", timer);
    }

    @Override
    public SpawnResult spawn(String agentId, String command, List<String> args, SpawnOptions options) {
        String commandLine = ShellQuoting.join(command, args);
        Map<String, String> env = CleanEnvironment.fromSystem(options.getEnv(), TERMINAL_ENV);
        String cwd = options.getCwd() != null ? options.getCwd() : System.getProperty("user.home");
        log.debug("[{}] Spawning via {}: {}", agentId, shell, commandLine);
        return sessions.open(agentId, () -> processFactory.start(
            List.of(shell, "-c", commandLine), env, cwd, options.getCols(), options.getRows()));
    }

    @Override
    public boolean write(String agentId, String data) {
        return sessions.get(agentId).map(session -> {
            try {
                session.getProcess().write(data);
                return true;
            } catch (IOException e) {
                log.warn("[{}] Write to terminal failed: {}", agentId, e.getMessage());
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

    /**
     * Kills the shell and every process below it. The exit event still follows once the reader sees EOF.
     */
    @Override
    public boolean kill(String agentId) {
        return sessions.remove(agentId).map(session -> {
            log.info("[{}] Killing terminal process tree (pid {})", agentId, session.getProcess().pid());
            TerminalSessionRegistry.killProcess(session.getProcess());
            return true;
        }).orElse(false);
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
