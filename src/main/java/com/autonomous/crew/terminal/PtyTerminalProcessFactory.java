package com.autonomous.crew.terminal;

import com.pty4j.PtyProcess;
import com.pty4j.PtyProcessBuilder;
import com.pty4j.WinSize;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Pseudo-terminals backed by pty4j.
 */
public class PtyTerminalProcessFactory implements TerminalProcessFactory {

    @Override
    public TerminalProcess start(List<String> command, Map<String, String> env, String cwd, int cols, int rows)
        throws IOException {
        PtyProcess process = new PtyProcessBuilder(command.toArray(new String[0]))
            .setEnvironment(env)
            .setDirectory(cwd)
            .setInitialColumns(cols)
            .setInitialRows(rows)
            .setConsole(false)
            .setRedirectErrorStream(true)
            .start();
        return new PtyTerminalProcess(process);
    }

    static class PtyTerminalProcess implements TerminalProcess {

        private final PtyProcess process;
        private final OutputStream input;

        PtyTerminalProcess(PtyProcess process) {
            this.process = process;
            this.input = process.getOutputStream();
        }

        @Override
        public long pid() {
            return process.pid();
        }

        @Override
        public InputStream output() {
            return process.getInputStream();
        }

        @Override
        public synchronized void write(String data) throws IOException {
            input.write(data.getBytes(StandardCharsets.UTF_8));
            input.flush();
        }

        @Override
        public void resize(int cols, int rows) {
            process.setWinSize(new WinSize(cols, rows));
        }

        @Override
        public int waitFor() throws InterruptedException {
            return process.waitFor();
        }
    }
}
