package com.autonomous.crew.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AgentProfile {

    public static final String SYSTEM_AGENT_ID = "crew-system";

    private String id;
    private String name;
    @Builder.Default
    private String runtime = "claude-code";
    private String model;
    private String systemPrompt;
    private String color;
    private String cwd;
    @Builder.Default
    private Map<String, String> env = new HashMap<>();
    private boolean allowFullAccess;
    private boolean allowInterrupts;
    private boolean autoStart;
    private boolean system;

    public String displayName() {
        return name != null && !name.isBlank() ? name : id;
    }
}
