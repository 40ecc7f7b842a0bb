package com.autonomous.crew.terminal;

import com.autonomous.crew.process.ProcessTreeKiller;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Live sessions of one terminal manager, plus the reader threads that pump their output.
 * Owned by the manager and closed with it.
 */
@Slf4j
public class TerminalSessionRegistry implements AutoCloseable {

    @FunctionalInterface
    public interface Starter {
        TerminalProcess start() throws IOException;
    }

    private final String scope;
    private final TerminalEventChannel channel;
    private final ScheduledExecutorService timer;
    private final Map<String, TerminalSession> sessions = new ConcurrentHashMap<>();
    private final ExecutorService readers = Executors.newCachedThreadPool();

    public TerminalSessionRegistry(String scope, ScheduledExecutorService timer) {
        this.scope = scope;
        this.timer = timer;
        this.channel = new TerminalEventChannel(scope, TerminalEventChannel.DEFAULT_CAPACITY);
    }

    public TerminalEventChannel channel() {
        return channel;
    }

    public SpawnResult open(String agentId, Starter starter) {
        if (sessions.containsKey(agentId)) {
            return SpawnResult.failed("PTY already exists for this agent");
        }
        TerminalProcess process;
        try {
            process = starter.start();
        } catch (IOException | RuntimeException e) {
            log.error("[{}] {} spawn failed: {}", agentId, scope, e.getMessage());
            return SpawnResult.failed(e.getMessage());
        }

        TerminalDataHandler handler = new TerminalDataHandler(agentId, process::write, channel, timer);
        TerminalSession session = new TerminalSession(agentId, process, handler);
        if (sessions.putIfAbsent(agentId, session) != null) {
            killProcess(process);
            return SpawnResult.failed("PTY already exists for this agent");
        }
        readers.execute(() -> pump(session));
        log.info("[{}] {} session started (pid {})", agentId, scope, process.pid());
        return SpawnResult.started(process.pid());
    }

    public Optional<TerminalSession> get(String agentId) {
        return Optional.ofNullable(sessions.get(agentId));
    }

    public Optional<TerminalSession> remove(String agentId) {
        return Optional.ofNullable(sessions.remove(agentId));
    }

    public boolean contains(String agentId) {
        return sessions.containsKey(agentId);
    }

    public List<String> agentIds() {
        return new ArrayList<>(sessions.keySet());
    }

    public static void killProcess(TerminalProcess process) {
        ProcessHandle handle = process.handle();
        if (handle != null) {
            ProcessTreeKiller.kill(handle);
        }
    }

    private void pump(TerminalSession session) {
        String agentId = session.getAgentId();
        char[] buffer = new char[4096];
        try (InputStream out = session.getProcess().output();
             Reader reader = new InputStreamReader(out, StandardCharsets.UTF_8)) {
            int read;
            while ((read = reader.read(buffer)) != -1) {
                session.getHandler().onData(new String(buffer, 0, read));
            }
        } catch (IOException e) {
            log.debug("[{}] Terminal output closed: {}", agentId, e.getMessage());
        }

        int exitCode;
        try {
            exitCode = session.getProcess().waitFor();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            exitCode = -1;
        }
        session.getHandler().flush();
        String lastOutput = session.getHandler().getLastOutput();
        sessions.remove(agentId, session);
        log.info("[{}] {} session exited with code {}", agentId, scope, exitCode);
        channel.publishExit(agentId, exitCode, lastOutput);
    }

    @Override
    public void close() {
        readers.shutdownNow();
        channel.close();
    }
}
