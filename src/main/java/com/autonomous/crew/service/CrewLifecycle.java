package com.autonomous.crew.service;

import com.autonomous.crew.config.CrewProperties;
import com.autonomous.crew.model.AgentProfile;
import com.autonomous.crew.sandbox.ContainerManager;
import com.autonomous.crew.sandbox.SandboxException;
import com.autonomous.crew.store.CommunicationHub;
import com.autonomous.crew.store.RelationshipStore;
import com.autonomous.crew.store.ScheduleStore;
import com.autonomous.crew.store.StatsStore;
import com.autonomous.crew.store.TaskStore;
import com.autonomous.crew.team.InboxWatcher;
import com.autonomous.crew.team.TaskSchedulerService;
import com.autonomous.crew.terminal.SpawnResult;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Startup and shutdown ordering of the crew.
 */
@Slf4j
@Component
public class CrewLifecycle {

    private final CrewProperties properties;
    private final AgentProfileService profiles;
    private final AgentService agents;
    private final TaskExecutorService executor;
    private final TaskSchedulerService scheduler;
    private final InboxWatcher inboxWatcher;
    private final ContainerManager containers;
    private final TaskStore taskStore;
    private final StatsStore statsStore;
    private final RelationshipStore relationshipStore;
    private final ScheduleStore scheduleStore;
    private final CommunicationHub communicationHub;

    public CrewLifecycle(CrewProperties properties, AgentProfileService profiles, AgentService agents,
                         TaskExecutorService executor, TaskSchedulerService scheduler, InboxWatcher inboxWatcher,
                         ContainerManager containers, TaskStore taskStore, StatsStore statsStore,
                         RelationshipStore relationshipStore, ScheduleStore scheduleStore,
                         CommunicationHub communicationHub) {
        this.properties = properties;
        this.profiles = profiles;
        this.agents = agents;
        this.executor = executor;
        this.scheduler = scheduler;
        this.inboxWatcher = inboxWatcher;
        this.containers = containers;
        this.taskStore = taskStore;
        this.statsStore = statsStore;
        this.relationshipStore = relationshipStore;
        this.scheduleStore = scheduleStore;
        this.communicationHub = communicationHub;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        if (properties.getSandbox().isEnabled()) {
            try {
                List<String> adopted = containers.reclaimExisting();
                log.info("Reclaimed {} running containers", adopted.size());
            } catch (SandboxException e) {
                log.error("Container reclaim failed: {}", e.getMessage());
            }
        }

        if (properties.getScheduler().isEnabled()) {
            scheduler.start();
        }

        for (AgentProfile profile : profiles.listWorkers()) {
            if (profile.getCwd() == null || profile.getCwd().isBlank()) {
                continue;
            }
            try {
                inboxWatcher.watchAgent(profile.getId(), Path.of(profile.getCwd()));
            } catch (IOException e) {
                log.warn("[{}] Cannot watch inbox: {}", profile.getId(), e.getMessage());
            }
        }

        executor.recover();

        for (AgentProfile profile : profiles.listWorkers()) {
            if (profile.isAutoStart()) {
                SpawnResult result = agents.start(profile.getId());
                if (!result.isSuccess()) {
                    log.warn("[{}] Auto-start failed: {}", profile.getId(), result.getError());
                }
            }
        }
        log.info("Crew ready with {} agents", profiles.listWorkers().size());
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down crew");
        scheduler.stop();
        inboxWatcher.stopAll();
        agents.stopAll();
        if (properties.getSandbox().isEnabled()) {
            containers.stopAll();
        }
        taskStore.flush();
        statsStore.flush();
        relationshipStore.flush();
        scheduleStore.flush();
        communicationHub.flush();
    }
}
