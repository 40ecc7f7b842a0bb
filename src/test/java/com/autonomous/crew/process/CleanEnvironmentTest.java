package com.autonomous.crew.process;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CleanEnvironmentTest {

    @Test
    void shouldDropNestedSessionMarkers() {
        Map<String, String> base = new HashMap<>();
        base.put("PATH", "/usr/bin");
        base.put("CLAUDECODE", "1");
        base.put("CLAUDE_PARENT_CLI", "1");

        Map<String, String> env = CleanEnvironment.build(base);

        assertEquals(Map.of("PATH", "/usr/bin"), env);
        assertTrue(base.containsKey("CLAUDECODE"));
    }

    @Test
    void shouldApplyOverlaysInOrder() {
        Map<String, String> env = CleanEnvironment.build(Map.of("A", "base", "B", "base"),
            Map.of("A", "first"), null, Map.of("A", "second", "CLAUDECODE", "1"));

        assertEquals("second", env.get("A"));
        assertEquals("base", env.get("B"));
        assertEquals("1", env.get("CLAUDECODE"));
    }
}
