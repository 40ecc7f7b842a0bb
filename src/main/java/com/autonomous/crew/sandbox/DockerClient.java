package com.autonomous.crew.sandbox;

import com.autonomous.crew.process.CommandResult;
import com.autonomous.crew.process.CommandRunner;
import com.autonomous.crew.support.TextUtils;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Drives the docker CLI. Every operation is an argument vector handed to a {@link CommandRunner}.
 */
@Slf4j
public class DockerClient {

    public static final String NAME_PREFIX = "crew-";
    public static final String APP_LABEL = "com.autonomous.crew.app";
    public static final String AGENT_LABEL = "com.autonomous.crew.agent-id";

    static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);
    static final Duration BUILD_TIMEOUT = Duration.ofMinutes(10);

    private final CommandRunner runner;
    private final String dockerCommand;
    private final boolean linuxHost;

    public DockerClient(CommandRunner runner, String dockerCommand, boolean linuxHost) {
        this.runner = runner;
        this.dockerCommand = dockerCommand;
        this.linuxHost = linuxHost;
    }

    public static String containerName(String agentName) {
        String sanitized = agentName.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_.-]", "-");
        return NAME_PREFIX + sanitized;
    }

    public List<String> buildCreateArgs(ContainerSpec spec) {
        List<String> args = new ArrayList<>(List.of(dockerCommand, "create", "--name", spec.getName(), "--init"));
        if (linuxHost) {
            args.add("--add-host");
            args.add("host.docker.internal:host-gateway");
        }
        args.add("--label");
        args.add(APP_LABEL + "=true");
        args.add("--label");
        args.add(AGENT_LABEL + "=" + spec.getAgentId());
        if (spec.getCpus() > 0) {
            args.add("--cpus");
            args.add(String.valueOf(spec.getCpus()));
        }
        if (spec.getMemoryMb() > 0) {
            args.add("--memory");
            args.add(spec.getMemoryMb() + "m");
        }
        if (spec.getPidsLimit() > 0) {
            args.add("--pids-limit");
            args.add(String.valueOf(spec.getPidsLimit()));
        }
        for (Mount mount : spec.getMounts()) {
            args.add("-v");
            args.add(mount.toVolumeArg());
        }
        for (Mount volume : spec.getVolumes()) {
            args.add("-v");
            args.add(volume.toVolumeArg());
        }
        spec.getPorts().forEach((host, container) -> {
            args.add("-p");
            args.add(host + ":" + container);
        });
        if (spec.getWorkdir() != null) {
            args.add("-w");
            args.add(spec.getWorkdir());
        }
        spec.getEnv().forEach((key, value) -> {
            args.add("-e");
            args.add(key + "=" + value);
        });
        args.add(spec.getImage());
        args.addAll(spec.getCommand());
        return args;
    }

    /** @return the new container id */
    public String create(ContainerSpec spec) {
        return require(buildCreateArgs(spec), DEFAULT_TIMEOUT, "create " + spec.getName()).trim();
    }

    public void start(String containerId) {
        require(List.of(dockerCommand, "start", containerId), DEFAULT_TIMEOUT, "start " + containerId);
    }

    public void stop(String containerId, int timeoutSeconds) {
        Duration timeout = Duration.ofSeconds(timeoutSeconds + 30L);
        require(List.of(dockerCommand, "stop", "--time", String.valueOf(timeoutSeconds), containerId),
            timeout, "stop " + containerId);
    }

    public void remove(String containerId) {
        require(List.of(dockerCommand, "rm", "-f", containerId), DEFAULT_TIMEOUT, "rm " + containerId);
    }

    /** State such as "running" or "exited"; empty when the container does not exist. */
    public Optional<String> status(String nameOrId) {
        CommandResult result = runner.run(
            List.of(dockerCommand, "inspect", "--format", "{{.State.Status}}", nameOrId), DEFAULT_TIMEOUT);
        if (!result.isSuccess()) {
            return Optional.empty();
        }
        return Optional.of(result.getStdout().trim());
    }

    public boolean imageExists(String tag) {
        return runner.run(List.of(dockerCommand, "image", "inspect", tag), DEFAULT_TIMEOUT).isSuccess();
    }

    public void buildImage(String tag, Path contextDir) {
        log.info("Building sandbox image {}", tag);
        require(List.of(dockerCommand, "build", "-t", tag, contextDir.toString()), BUILD_TIMEOUT, "build " + tag);
    }

    public List<ContainerSummary> listManaged() {
        String format = "{{.ID}}\t{{.Names}}\t{{.Status}}\t{{.Label \"" + AGENT_LABEL + "\"}}\t{{.Ports}}";
        String out = require(List.of(dockerCommand, "ps", "-a", "--filter", "label=" + APP_LABEL + "=true",
            "--format", format), DEFAULT_TIMEOUT, "ps");
        List<ContainerSummary> containers = new ArrayList<>();
        for (String line : out.split("\n")) {
            if (line.isBlank()) {
                continue;
            }
            String[] fields = line.split("\t", -1);
            if (fields.length < 3) {
                log.warn("Unexpected container listing line: {}", line);
                continue;
            }
            containers.add(new ContainerSummary(fields[0], fields[1], fields[2],
                fields.length > 3 && !fields[3].isBlank() ? fields[3] : null,
                fields.length > 4 && !fields[4].isBlank() ? fields[4] : null));
        }
        return containers;
    }

    public List<String> buildExecArgs(String containerId, String workdir, Map<String, String> env,
                                      boolean tty, List<String> command) {
        List<String> args = new ArrayList<>(List.of(dockerCommand, "exec", tty ? "-it" : "-i"));
        if (workdir != null) {
            args.add("-w");
            args.add(workdir);
        }
        env.forEach((key, value) -> {
            args.add("-e");
            args.add(key + "=" + value);
        });
        args.add(containerId);
        args.addAll(command);
        return args;
    }

    private String require(List<String> argv, Duration timeout, String action) {
        CommandResult result = runner.run(argv, timeout);
        if (!result.isSuccess()) {
            throw new SandboxException("docker " + action + " failed: "
                + TextUtils.truncateError(result.getStderr().trim()));
        }
        return result.getStdout();
    }
}
