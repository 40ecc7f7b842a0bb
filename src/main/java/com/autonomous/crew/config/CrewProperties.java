package com.autonomous.crew.config;

import com.autonomous.crew.sandbox.Mount;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@Component
@ConfigurationProperties(prefix = "crew")
public class CrewProperties {

    private Storage storage = new Storage();
    private Agents agents = new Agents();
    private Scheduler scheduler = new Scheduler();
    private Execution execution = new Execution();
    private Team team = new Team();
    private Sandbox sandbox = new Sandbox();
    private SlackSettings slack = new SlackSettings();

    @Data
    public static class Storage {
        private String path = "data";
        private long debounceMs = 500;
    }

    @Data
    public static class Agents {
        private String configPath = "config/agents";
        private String shell = "/bin/sh";
    }

    @Data
    public static class Scheduler {
        private boolean enabled = true;
        private long checkIntervalMs = 60_000;
    }

    @Data
    public static class Execution {
        private int maxConcurrentPerAgent = 2;
        private Duration taskTimeout = Duration.ofHours(6);
    }

    @Data
    public static class Team {
        private String runtime = "claude-code";
        private Duration operationTimeout = Duration.ofMinutes(30);
        private int reflectEvery = 5;
        private String creativeModel = "opus";
        private String analyticalModel = "sonnet";
        private String routineModel = "haiku";
    }

    @Data
    public static class Sandbox {
        private boolean enabled = false;
        private String dockerCommand = "docker";
        private String imageName = "crew-agent";
        private double cpus = 2;
        private int memoryMb = 4096;
        private int pidsLimit = 256;
        private int portRangeStart = 10000;
        private int portsPerAgent = 20;
        private int containerPortStart = 3000;
        private int stopTimeoutSec = 10;
        private String skillsDir;
        private List<Mount> credentialMounts = new ArrayList<>();
    }

    @Data
    public static class SlackSettings {
        private String botToken = "";
        private String feedChannel = "";
    }
}
