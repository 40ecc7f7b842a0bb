package com.autonomous.crew.runtime.output;

/**
 * Turns raw subprocess output chunks into events on an {@link com.autonomous.crew.runtime.OutputListener}.
 * One instance serves one execution; chunks arrive from a single reader thread.
 */
public interface OutputStrategy {

    void onChunk(String chunk);

    /** Called once after the process closed its output. */
    void flush();
}
