package com.autonomous.crew.terminal;

public interface TerminalListener {

    void onOutput(String agentId, String data);

    void onExit(String agentId, int exitCode, String lastOutput);
}
