package com.autonomous.crew.terminal;

import java.io.IOException;
import java.util.List;
import java.util.Map;

public interface TerminalProcessFactory {

    TerminalProcess start(List<String> command, Map<String, String> env, String cwd, int cols, int rows)
        throws IOException;
}
