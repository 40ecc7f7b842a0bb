package com.autonomous.crew.terminal;

import lombok.Value;

@Value
public class SpawnResult {
    boolean success;
    Long pid;
    String error;

    public static SpawnResult started(long pid) {
        return new SpawnResult(true, pid, null);
    }

    public static SpawnResult failed(String error) {
        return new SpawnResult(false, null, error);
    }
}
