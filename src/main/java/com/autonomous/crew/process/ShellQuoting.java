package com.autonomous.crew.process;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

public final class ShellQuoting {

    private ShellQuoting() {
    }

    public static String quote(String arg) {
        return "'" + arg.replace("'", "'\\''") + "'";
    }

    public static String join(String command, List<String> args) {
        List<String> parts = new ArrayList<>();
        parts.add(command);
        parts.addAll(args);
        return parts.stream().map(ShellQuoting::quote).collect(Collectors.joining(" "));
    }
}
