package com.autonomous.crew.terminal;

import lombok.Builder;
import lombok.Data;

import java.util.HashMap;
import java.util.Map;

@Data
@Builder
public class SpawnOptions {
    public static final int DEFAULT_COLS = 120;
    public static final int DEFAULT_ROWS = 30;

    private String cwd;
    @Builder.Default
    private Map<String, String> env = new HashMap<>();
    @Builder.Default
    private int cols = DEFAULT_COLS;
    @Builder.Default
    private int rows = DEFAULT_ROWS;
}
