package com.autonomous.crew.process;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Child process environments: the control process environment minus nested-session markers, plus overlays.
 */
public final class CleanEnvironment {

    static final List<String> NESTED_SESSION_MARKERS = List.of("CLAUDECODE", "CLAUDE_PARENT_CLI");

    private CleanEnvironment() {
    }

    @SafeVarargs
    public static Map<String, String> build(Map<String, String> base, Map<String, String>... overlays) {
        Map<String, String> env = new HashMap<>(base);
        NESTED_SESSION_MARKERS.forEach(env::remove);
        for (Map<String, String> overlay : overlays) {
            if (overlay != null) {
                env.putAll(overlay);
            }
        }
        return env;
    }

    @SafeVarargs
    public static Map<String, String> fromSystem(Map<String, String>... overlays) {
        return build(System.getenv(), overlays);
    }
}
