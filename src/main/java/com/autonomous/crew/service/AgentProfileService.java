package com.autonomous.crew.service;

import com.autonomous.crew.config.CrewProperties;
import com.autonomous.crew.model.AgentProfile;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Loads agent profiles from one YAML file per agent, e.g. {@code config/agents/reviewer.yaml}:
 * <pre>
 * id: reviewer
 * name: Reviewer
 * runtime: claude-code
 * model: sonnet
 * cwd: /work/reviewer
 * auto_start: true
 * </pre>
 * The built-in system agent is always registered.
 */
@Slf4j
@Service
public class AgentProfileService {

    private final CrewProperties properties;
    private final Map<String, AgentProfile> profiles = new ConcurrentHashMap<>();
    private final ObjectMapper yamlMapper;

    private String configPath;

    public AgentProfileService(CrewProperties properties) {
        this.properties = properties;
        this.configPath = properties.getAgents().getConfigPath();
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.yamlMapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        this.yamlMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public void setConfigPath(String path) {
        this.configPath = path;
    }

    @PostConstruct
    public void loadProfiles() {
        profiles.clear();
        AgentProfile system = systemAgent();
        profiles.put(system.getId(), system);

        File configDir = new File(configPath);
        if (!configDir.exists() || !configDir.isDirectory()) {
            log.warn("Agent config directory not found: {}", configPath);
            return;
        }

        File[] yamlFiles = configDir.listFiles((dir, name) -> name.endsWith(".yaml") || name.endsWith(".yml"));
        if (yamlFiles == null) {
            return;
        }

        for (File file : yamlFiles) {
            try {
                AgentProfile profile = yamlMapper.readValue(file, AgentProfile.class);
                if (profile.getId() == null || profile.getId().isBlank()) {
                    profile.setId(file.getName().replaceFirst("\\.ya?ml$", ""));
                }
                if (AgentProfile.SYSTEM_AGENT_ID.equals(profile.getId())) {
                    log.warn("Ignoring {}: {} is reserved", file.getName(), AgentProfile.SYSTEM_AGENT_ID);
                    continue;
                }
                profile.setSystem(false);
                profiles.put(profile.getId(), profile);
                log.info("[{}] Loaded agent profile ({} runtime)", profile.getId(), profile.getRuntime());
            } catch (IOException e) {
                log.error("Failed to load agent profile from {}: {}", file.getName(), e.getMessage());
            }
        }
    }

    public Optional<AgentProfile> getProfile(String agentId) {
        return Optional.ofNullable(agentId).map(profiles::get);
    }

    public AgentProfile requireProfile(String agentId) {
        return getProfile(agentId).orElseThrow(() -> new AgentNotFoundException(agentId));
    }

    public List<AgentProfile> listProfiles() {
        return new ArrayList<>(profiles.values());
    }

    /** Profiles that take assigned work; excludes the system agent. */
    public List<AgentProfile> listWorkers() {
        return profiles.values().stream()
            .filter(p -> !p.isSystem())
            .collect(Collectors.toList());
    }

    private AgentProfile systemAgent() {
        Path home = Path.of(properties.getStorage().getPath(), "agents", AgentProfile.SYSTEM_AGENT_ID);
        return AgentProfile.builder()
            .id(AgentProfile.SYSTEM_AGENT_ID)
            .name("Crew")
            .runtime(properties.getTeam().getRuntime())
            .model(properties.getTeam().getAnalyticalModel())
            .cwd(home.toAbsolutePath().toString())
            .system(true)
            .build();
    }
}
