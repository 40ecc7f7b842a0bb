package com.autonomous.crew.runtime;

import lombok.Value;

@Value
public class ExecutionProgress {
    ProgressKind kind;
    String summary;

    public static ExecutionProgress toolUse(String summary) {
        return new ExecutionProgress(ProgressKind.TOOL_USE, summary);
    }

    public static ExecutionProgress thinking(String summary) {
        return new ExecutionProgress(ProgressKind.THINKING, summary);
    }

    public static ExecutionProgress text(String summary) {
        return new ExecutionProgress(ProgressKind.TEXT, summary);
    }
}
