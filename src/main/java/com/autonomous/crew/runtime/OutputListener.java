package com.autonomous.crew.runtime;

/**
 * Receives normalized output of a running execution.
 */
public interface OutputListener {

    OutputListener NONE = new OutputListener() {
    };

    default void onProgress(ExecutionProgress progress) {
    }

    /** Markdown-ish text meant for a terminal view. */
    default void onOutput(String text) {
    }
}
