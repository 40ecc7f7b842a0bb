package com.autonomous.crew.terminal;

import java.util.List;

/**
 * Interactive terminal sessions, at most one per agent id.
 */
public interface TerminalManager {

    /** Fails without side effects when the agent already has a session. */
    SpawnResult spawn(String agentId, String command, List<String> args, SpawnOptions options);

    boolean write(String agentId, String data);

    boolean resize(String agentId, int cols, int rows);

    boolean kill(String agentId);

    void killAll();

    String getScrollback(String agentId);

    boolean isRunning(String agentId);

    void addListener(TerminalListener listener);

    void removeListener(TerminalListener listener);
}
