package com.autonomous.crew.runtime;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
@Component
public class RuntimeRegistry {

    private final Map<String, AgentRuntime> runtimes = new ConcurrentHashMap<>();

    public RuntimeRegistry(List<AgentRuntime> available) {
        available.forEach(this::register);
    }

    public void register(AgentRuntime runtime) {
        runtimes.put(runtime.runtimeId(), runtime);
        log.debug("Registered runtime {}", runtime.runtimeId());
    }

    public Optional<AgentRuntime> get(String runtimeId) {
        return Optional.ofNullable(runtimes.get(runtimeId));
    }

    public AgentRuntime require(String runtimeId) {
        return get(runtimeId).orElseThrow(() -> new IllegalArgumentException("Unknown runtime: " + runtimeId));
    }

    public boolean has(String runtimeId) {
        return runtimes.containsKey(runtimeId);
    }

    public List<AgentRuntime> list() {
        return new ArrayList<>(runtimes.values());
    }
}
