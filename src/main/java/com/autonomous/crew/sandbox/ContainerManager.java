package com.autonomous.crew.sandbox;

import com.autonomous.crew.config.CrewProperties;
import com.autonomous.crew.model.AgentProfile;
import com.autonomous.crew.model.ContainerInfo;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One long-lived container per agent, created on first use and reused while it keeps running.
 */
@Slf4j
public class ContainerManager {

    static final String CONTAINER_HOME = "/home/agent";

    /** host path relative to the user's home -> path inside the container home */
    static final Map<String, String> CREDENTIAL_DIRS = Map.of(
        ".claude", ".claude",
        ".claude.json", ".claude.json",
        ".config/opencode", ".config/opencode",
        ".codex", ".codex");

    private final DockerClient docker;
    private final PortAllocator ports;
    private final ImageManager images;
    private final CrewProperties.Sandbox settings;
    private final Path workspaceRoot;
    private final Path userHome;
    private final Clock clock;
    private final Map<String, ContainerInfo> registry = new ConcurrentHashMap<>();

    public ContainerManager(DockerClient docker, PortAllocator ports, ImageManager images,
                            CrewProperties.Sandbox settings, Path workspaceRoot, Path userHome, Clock clock) {
        this.docker = docker;
        this.ports = ports;
        this.images = images;
        this.settings = settings;
        this.workspaceRoot = workspaceRoot;
        this.userHome = userHome;
        this.clock = clock;
    }

    /**
     * Returns the agent's running container, creating and starting one if needed.
     */
    public synchronized ContainerInfo createAndStart(AgentProfile profile) {
        String agentId = profile.getId();
        ContainerInfo existing = registry.get(agentId);
        if (existing != null && docker.status(existing.getContainerId()).filter("running"::equals).isPresent()) {
            return existing;
        }

        String name = DockerClient.containerName(agentId);
        if (docker.status(name).isPresent()) {
            log.info("[{}] Removing stale container {}", agentId, name);
            docker.remove(name);
        }

        String image = images.ensureImage();
        ports.allocate(agentId);
        Map<Integer, Integer> portMappings = ports.buildPortMappings(agentId);

        ContainerSpec spec = ContainerSpec.builder()
            .name(name)
            .agentId(agentId)
            .image(image)
            .cpus(settings.getCpus())
            .memoryMb(settings.getMemoryMb())
            .pidsLimit(settings.getPidsLimit())
            .mounts(buildMounts(profile))
            .volumes(List.of(
                new Mount(name + "-local", CONTAINER_HOME + "/.local", false),
                new Mount(name + "-cache", CONTAINER_HOME + "/.cache", false)))
            .ports(portMappings)
            .workdir("/workspace")
            .env(profile.getEnv() != null ? new HashMap<>(profile.getEnv()) : new HashMap<>())
            .build();

        try {
            String containerId = docker.create(spec);
            docker.start(containerId);
            ContainerInfo info = ContainerInfo.builder()
                .agentId(agentId)
                .containerId(containerId)
                .containerName(name)
                .status("running")
                .portMappings(portMappings)
                .createdAt(clock.instant())
                .build();
            registry.put(agentId, info);
            log.info("[{}] Started container {} ({})", agentId, name, containerId);
            return info;
        } catch (SandboxException e) {
            ports.release(agentId);
            throw e;
        }
    }

    public synchronized void stop(String agentId) {
        ContainerInfo info = registry.remove(agentId);
        ports.release(agentId);
        if (info == null) {
            return;
        }
        try {
            docker.stop(info.getContainerId(), settings.getStopTimeoutSec());
            docker.remove(info.getContainerId());
            log.info("[{}] Stopped container {}", agentId, info.getContainerName());
        } catch (SandboxException e) {
            log.warn("[{}] Container teardown failed: {}", agentId, e.getMessage());
        }
    }

    public void stopAll() {
        new ArrayList<>(registry.keySet()).forEach(this::stop);
    }

    /**
     * Adopts running managed containers left over from a previous run and removes all others.
     * Adopted containers keep the host port block they were created with.
     *
     * @return ids of the adopted agents
     */
    public synchronized List<String> reclaimExisting() {
        List<ContainerSummary> running = new ArrayList<>();
        for (ContainerSummary container : docker.listManaged()) {
            if (container.isUp() && container.getAgentId() != null) {
                running.add(container);
            } else {
                try {
                    docker.remove(container.getId());
                    log.info("Removed leftover container {} ({})", container.getName(), container.getStatus());
                } catch (SandboxException e) {
                    log.warn("Could not remove leftover container {}: {}", container.getName(), e.getMessage());
                }
            }
        }

        // Known blocks first so that fallback allocation cannot hand one of them out
        List<ContainerSummary> unknownPorts = new ArrayList<>();
        List<String> adopted = new ArrayList<>();
        for (ContainerSummary container : running) {
            OptionalInt hostPort = container.lowestHostPort();
            OptionalInt slot = hostPort.isPresent() ? ports.slotForHostPort(hostPort.getAsInt()) : OptionalInt.empty();
            if (slot.isEmpty()) {
                unknownPorts.add(container);
                continue;
            }
            try {
                ports.reserve(container.getAgentId(), slot.getAsInt());
            } catch (IllegalStateException e) {
                log.warn("[{}] Cannot adopt container {}: {}", container.getAgentId(), container.getName(),
                    e.getMessage());
                continue;
            }
            adopt(container);
            adopted.add(container.getAgentId());
        }
        for (ContainerSummary container : unknownPorts) {
            log.warn("[{}] Container {} publishes no managed ports, assigning a new block",
                container.getAgentId(), container.getName());
            ports.allocate(container.getAgentId());
            adopt(container);
            adopted.add(container.getAgentId());
        }
        return adopted;
    }

    private void adopt(ContainerSummary container) {
        registry.put(container.getAgentId(), ContainerInfo.builder()
            .agentId(container.getAgentId())
            .containerId(container.getId())
            .containerName(container.getName())
            .status("running")
            .portMappings(ports.buildPortMappings(container.getAgentId()))
            .createdAt(clock.instant())
            .build());
        log.info("[{}] Re-adopted running container {}", container.getAgentId(), container.getName());
    }

    public Optional<String> getContainerId(String agentId) {
        return Optional.ofNullable(registry.get(agentId)).map(ContainerInfo::getContainerId);
    }

    public boolean isRunning(String agentId) {
        return registry.containsKey(agentId);
    }

    public List<ContainerInfo> list() {
        return new ArrayList<>(registry.values());
    }

    private List<Mount> buildMounts(AgentProfile profile) {
        List<Mount> mounts = new ArrayList<>();
        mounts.add(new Mount(workspaceFor(profile).toString(), "/workspace", false));

        if (settings.getSkillsDir() != null && Files.isDirectory(Path.of(settings.getSkillsDir()))) {
            mounts.add(new Mount(settings.getSkillsDir(), "/shared-skills", true));
        }
        for (Mount credential : settings.getCredentialMounts()) {
            mounts.add(new Mount(credential.getSource(), credential.getTarget(), true));
        }
        CREDENTIAL_DIRS.forEach((hostRelative, containerRelative) -> {
            Path hostPath = userHome.resolve(hostRelative);
            if (Files.exists(hostPath)) {
                mounts.add(new Mount(hostPath.toString(), CONTAINER_HOME + "/" + containerRelative, true));
            }
        });
        return mounts;
    }

    private Path workspaceFor(AgentProfile profile) {
        Path workspace = profile.getCwd() != null ? Path.of(profile.getCwd()) : workspaceRoot.resolve(profile.getId());
        try {
            Files.createDirectories(workspace);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create workspace " + workspace, e);
        }
        return workspace.toAbsolutePath();
    }
}
