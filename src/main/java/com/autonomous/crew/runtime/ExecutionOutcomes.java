package com.autonomous.crew.runtime;

import com.autonomous.crew.runtime.output.StreamEventParser;
import com.autonomous.crew.runtime.output.StreamResult;
import com.autonomous.crew.support.TextUtils;

/**
 * Turns captured process output into an {@link ExecutionResult}.
 */
public final class ExecutionOutcomes {

    private ExecutionOutcomes() {
    }

    /**
     * For JSON event streams. A present result event counts as success even after a non-zero exit,
     * since some tools exit non-zero after a complete answer.
     */
    public static ExecutionResult fromStream(StreamEventParser parser, String stdout, String stderr, int exitCode) {
        StreamResult result = parser.parseResult(stdout);
        if (exitCode != 0 && !result.isResultEvent()) {
            return ExecutionResult.failure(describeFailure(stdout, stderr, exitCode));
        }
        return ExecutionResult.builder()
            .success(true)
            .text(result.getText())
            .sessionId(result.getSessionId())
            .usage(parser.extractUsage(stdout))
            .build();
    }

    public static ExecutionResult fromPlainText(String stdout, String stderr, int exitCode) {
        if (exitCode != 0) {
            return ExecutionResult.failure(describeFailure(stdout, stderr, exitCode));
        }
        return ExecutionResult.builder()
            .success(true)
            .text(TextUtils.stripAnsi(stdout).trim())
            .build();
    }

    /** stderr, else the last non-blank stdout line, else the exit code; at most 500 characters. */
    public static String describeFailure(String stdout, String stderr, int exitCode) {
        if (stderr != null && !stderr.isBlank()) {
            return TextUtils.truncateError(TextUtils.stripAnsi(stderr).trim());
        }
        if (stdout != null) {
            String[] lines = TextUtils.stripAnsi(stdout).split("\n");
            for (int i = lines.length - 1; i >= 0; i--) {
                if (!lines[i].isBlank()) {
                    return TextUtils.truncateError(lines[i].trim());
                }
            }
        }
        return "Exit code " + exitCode;
    }
}
