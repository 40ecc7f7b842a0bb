package com.autonomous.crew.terminal;

import java.io.IOException;
import java.io.InputStream;

/**
 * A running terminal-backed child process.
 */
public interface TerminalProcess {

    long pid();

    InputStream output();

    void write(String data) throws IOException;

    void resize(int cols, int rows);

    int waitFor() throws InterruptedException;

    default ProcessHandle handle() {
        return ProcessHandle.of(pid()).orElse(null);
    }
}
