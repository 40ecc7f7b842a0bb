package com.autonomous.crew.terminal;

import lombok.Value;

@Value
public class TerminalSession {
    String agentId;
    TerminalProcess process;
    TerminalDataHandler handler;
}
