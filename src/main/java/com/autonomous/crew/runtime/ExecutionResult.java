package com.autonomous.crew.runtime;

import com.autonomous.crew.support.TextUtils;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of a one-shot execution. {@code usage} is null when the tool reported none.
 */
@Value
@Builder
public class ExecutionResult {
    boolean success;
    String text;
    String sessionId;
    String error;
    TokenUsage usage;

    public static ExecutionResult failure(String error) {
        return ExecutionResult.builder()
            .success(false)
            .text("")
            .error(TextUtils.truncateError(error))
            .build();
    }
}
