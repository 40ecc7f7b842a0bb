package com.autonomous.crew.config;

import com.autonomous.crew.process.ProcessCommandRunner;
import com.autonomous.crew.sandbox.ContainerManager;
import com.autonomous.crew.sandbox.DockerClient;
import com.autonomous.crew.sandbox.ImageManager;
import com.autonomous.crew.sandbox.PortAllocator;
import com.autonomous.crew.store.CommunicationHub;
import com.autonomous.crew.store.FileCommunicationHub;
import com.autonomous.crew.store.FileRelationshipStore;
import com.autonomous.crew.store.FileScheduleStore;
import com.autonomous.crew.store.FileStatsStore;
import com.autonomous.crew.store.FileTaskStore;
import com.autonomous.crew.store.RelationshipStore;
import com.autonomous.crew.store.ScheduleStore;
import com.autonomous.crew.store.StatsStore;
import com.autonomous.crew.store.TaskStore;
import com.autonomous.crew.team.ModelResolver;
import com.autonomous.crew.team.SmartTaskAssigner;
import com.autonomous.crew.team.TaskAssigner;
import com.autonomous.crew.team.TeamExecutorQueue;
import com.autonomous.crew.team.TeamRuntimeBackend;
import com.autonomous.crew.terminal.DirectTerminalManager;
import com.autonomous.crew.terminal.PtyTerminalProcessFactory;
import com.autonomous.crew.terminal.SandboxedTerminalManager;
import com.autonomous.crew.terminal.TerminalProcessFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Random;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

@Configuration
public class CrewConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService crewTimer() {
        return Executors.newScheduledThreadPool(4);
    }

    @Bean
    public TaskStore taskStore(CrewProperties properties, ScheduledExecutorService crewTimer, Clock clock) {
        return new FileTaskStore(dataDir(properties), crewTimer, properties.getStorage().getDebounceMs(), clock);
    }

    @Bean
    public StatsStore statsStore(CrewProperties properties, ScheduledExecutorService crewTimer, Clock clock) {
        return new FileStatsStore(dataDir(properties), crewTimer, properties.getStorage().getDebounceMs(), clock);
    }

    @Bean
    public RelationshipStore relationshipStore(CrewProperties properties, ScheduledExecutorService crewTimer,
                                               Clock clock) {
        return new FileRelationshipStore(dataDir(properties), crewTimer, properties.getStorage().getDebounceMs(), clock);
    }

    @Bean
    public ScheduleStore scheduleStore(CrewProperties properties, ScheduledExecutorService crewTimer, Clock clock) {
        return new FileScheduleStore(dataDir(properties), crewTimer, properties.getStorage().getDebounceMs(), clock);
    }

    @Bean
    public CommunicationHub communicationHub(CrewProperties properties, ScheduledExecutorService crewTimer,
                                             Clock clock) {
        return new FileCommunicationHub(dataDir(properties), crewTimer, properties.getStorage().getDebounceMs(), clock);
    }

    @Bean
    public TerminalProcessFactory terminalProcessFactory() {
        return new PtyTerminalProcessFactory();
    }

    @Bean(destroyMethod = "close")
    public DirectTerminalManager directTerminalManager(TerminalProcessFactory factory,
                                                       ScheduledExecutorService crewTimer,
                                                       CrewProperties properties) {
        return new DirectTerminalManager(factory, crewTimer, properties.getAgents().getShell());
    }

    @Bean
    public DockerClient dockerClient(CrewProperties properties) {
        boolean linux = System.getProperty("os.name", "").toLowerCase().contains("linux");
        return new DockerClient(new ProcessCommandRunner(), properties.getSandbox().getDockerCommand(), linux);
    }

    @Bean
    public ContainerManager containerManager(DockerClient docker, CrewProperties properties, Clock clock)
        throws IOException {
        CrewProperties.Sandbox sandbox = properties.getSandbox();
        String dockerfile = new ClassPathResource("sandbox/Dockerfile").getContentAsString(StandardCharsets.UTF_8);
        return new ContainerManager(
            docker,
            new PortAllocator(sandbox.getPortRangeStart(), sandbox.getPortsPerAgent(), sandbox.getContainerPortStart()),
            new ImageManager(docker, sandbox.getImageName(), dockerfile),
            sandbox,
            dataDir(properties).resolve("workspaces"),
            Path.of(System.getProperty("user.home")),
            clock);
    }

    @Bean(destroyMethod = "close")
    public SandboxedTerminalManager sandboxedTerminalManager(TerminalProcessFactory factory,
                                                             ScheduledExecutorService crewTimer,
                                                             DockerClient docker, ContainerManager containers) {
        return new SandboxedTerminalManager(factory, crewTimer, docker, containers);
    }

    @Bean
    public TaskAssigner taskAssigner(CrewProperties properties) {
        return new SmartTaskAssigner(properties.getExecution().getMaxConcurrentPerAgent(), new Random());
    }

    @Bean
    public ModelResolver modelResolver(CrewProperties properties) {
        CrewProperties.Team team = properties.getTeam();
        return new ModelResolver(team.getCreativeModel(), team.getAnalyticalModel(), team.getRoutineModel());
    }

    @Bean(destroyMethod = "shutdown")
    public TeamExecutorQueue teamExecutorQueue(TeamRuntimeBackend backend, ModelResolver modelResolver) {
        return new TeamExecutorQueue(backend, modelResolver);
    }

    private static Path dataDir(CrewProperties properties) {
        return Path.of(properties.getStorage().getPath());
    }
}
