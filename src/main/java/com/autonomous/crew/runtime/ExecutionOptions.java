package com.autonomous.crew.runtime;

import lombok.Builder;
import lombok.Data;

import java.util.HashMap;
import java.util.Map;

@Data
@Builder
public class ExecutionOptions {
    private String sessionId;
    private String cwd;
    @Builder.Default
    private Map<String, String> env = new HashMap<>();
    private String sharedContext;
    private AbortSignal signal;
    @Builder.Default
    private OutputListener listener = OutputListener.NONE;
    private CommandWrapper commandWrapper;

    public static ExecutionOptions defaults() {
        return ExecutionOptions.builder().build();
    }
}
