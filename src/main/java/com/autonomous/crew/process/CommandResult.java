package com.autonomous.crew.process;

import lombok.Value;

@Value
public class CommandResult {
    int exitCode;
    String stdout;
    String stderr;

    public boolean isSuccess() {
        return exitCode == 0;
    }

    public static CommandResult failed(String reason) {
        return new CommandResult(-1, "", reason);
    }
}
