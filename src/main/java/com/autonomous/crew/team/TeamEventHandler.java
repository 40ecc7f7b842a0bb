package com.autonomous.crew.team;

import com.autonomous.crew.event.StatsUpdatedEvent;
import com.autonomous.crew.event.TaskCompletedEvent;
import com.autonomous.crew.event.TaskCreatedEvent;
import com.autonomous.crew.event.TrustUpdatedEvent;
import com.autonomous.crew.model.AgentProfile;
import com.autonomous.crew.model.AgentRelationship;
import com.autonomous.crew.model.AgentStats;
import com.autonomous.crew.model.InboxRequest;
import com.autonomous.crew.model.Task;
import com.autonomous.crew.model.TaskFilter;
import com.autonomous.crew.model.TaskSource;
import com.autonomous.crew.model.TaskStatus;
import com.autonomous.crew.service.AgentProfileService;
import com.autonomous.crew.service.TaskService;
import com.autonomous.crew.store.RelationshipStore;
import com.autonomous.crew.store.StatsStore;
import com.autonomous.crew.support.TextUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Keeps assignment, stats, trust and the team feed in sync with task events.
 */
@Slf4j
@Component
public class TeamEventHandler {

    public static final String RESULT_REPLY_TAG = "result-reply";

    private final TaskService tasks;
    private final AgentProfileService profiles;
    private final StatsStore stats;
    private final RelationshipStore relationships;
    private final TaskAssigner assigner;
    private final FeedBroadcaster feed;
    private final InboxWatcher inbox;
    private final ApplicationEventPublisher events;

    public TeamEventHandler(TaskService tasks, AgentProfileService profiles, StatsStore stats,
                            RelationshipStore relationships, TaskAssigner assigner, FeedBroadcaster feed,
                            InboxWatcher inbox, ApplicationEventPublisher events) {
        this.tasks = tasks;
        this.profiles = profiles;
        this.stats = stats;
        this.relationships = relationships;
        this.assigner = assigner;
        this.feed = feed;
        this.inbox = inbox;
        this.events = events;
    }

    @EventListener
    public void onTaskCreated(TaskCreatedEvent event) {
        Task task = event.getTask();
        if (task.getAssignedTo() != null || task.getStatus() != TaskStatus.PENDING) {
            return;
        }
        try {
            assignPending(task);
        } catch (RuntimeException e) {
            log.error("Auto-assignment of task {} failed: {}", task.getId(), e.getMessage(), e);
        }
    }

    @EventListener
    public void onTaskCompleted(TaskCompletedEvent event) {
        Task task = event.getTask();
        String assignee = task.getAssignedTo();
        if (assignee == null) {
            return;
        }
        boolean success = task.getStatus() == TaskStatus.COMPLETED;
        try {
            AgentStats updated = stats.recordExecution(assignee, event.getDurationMs(), success);
            events.publishEvent(new StatsUpdatedEvent(assignee, updated));

            if (isDelegatedByAgent(task)) {
                AgentRelationship relationship =
                    relationships.updateTrust(task.getCreatedBy(), assignee, success ? 1.0 : 0.0);
                events.publishEvent(new TrustUpdatedEvent(relationship));
            }

            feed.broadcast(assignee, completionMessage(task, success));

            if (shouldReplyToSender(task)) {
                replyToSender(task, success);
            }
        } catch (RuntimeException e) {
            log.error("[{}] Handling completion of task {} failed: {}", assignee, task.getId(), e.getMessage(), e);
        }

        // A slot just freed up
        reassignPending();
    }

    /** Assigns every pending, unassigned task that now has an eligible agent. */
    public void reassignPending() {
        for (Task pending : tasks.list(TaskFilter.byStatus(TaskStatus.PENDING))) {
            if (pending.getAssignedTo() != null) {
                continue;
            }
            try {
                if (assignPending(pending).isEmpty()) {
                    return;
                }
            } catch (RuntimeException e) {
                log.error("Auto-assignment of task {} failed: {}", pending.getId(), e.getMessage(), e);
            }
        }
    }

    private Optional<String> assignPending(Task task) {
        List<AgentProfile> candidates = profiles.listWorkers();
        Map<String, Integer> running = new HashMap<>();
        for (Task t : tasks.list(TaskFilter.byStatus(TaskStatus.RUNNING))) {
            if (t.getAssignedTo() != null) {
                running.merge(t.getAssignedTo(), 1, Integer::sum);
            }
        }
        Map<String, AgentStats> statsByAgent = new HashMap<>();
        Map<String, List<AgentRelationship>> relationshipsByAgent = new HashMap<>();
        for (AgentProfile candidate : candidates) {
            statsByAgent.put(candidate.getId(), stats.get(candidate.getId()));
            relationshipsByAgent.put(candidate.getId(), relationships.getAll(candidate.getId()));
        }

        Optional<String> assignee = assigner.assign(task, candidates, relationshipsByAgent, statsByAgent, running);
        if (assignee.isEmpty()) {
            log.info("No eligible agent for task {}, leaving it pending", task.getId());
            return assignee;
        }
        tasks.update(task.getId(), t -> {
            t.setAssignedTo(assignee.get());
            t.setStatus(TaskStatus.ASSIGNED);
        });
        log.info("[{}] Assigned task {} \"{}\"", assignee.get(), task.getId(), task.getTitle());
        return assignee;
    }

    private boolean isDelegatedByAgent(Task task) {
        return task.getCreatedBy() != null
            && !task.getCreatedBy().equals(task.getAssignedTo())
            && profiles.getProfile(task.getCreatedBy()).isPresent();
    }

    private boolean shouldReplyToSender(Task task) {
        return task.getSource() == TaskSource.AGENT
            && !AgentProfile.SYSTEM_AGENT_ID.equals(task.getCreatedBy())
            && !task.hasTag(RESULT_REPLY_TAG)
            && isDelegatedByAgent(task);
    }

    private void replyToSender(Task task, boolean success) {
        AgentProfile sender = profiles.getProfile(task.getCreatedBy()).orElseThrow();
        if (TextUtils.isBlank(sender.getCwd())) {
            log.warn("[{}] No workspace to deliver the result of task {}", sender.getId(), task.getId());
            return;
        }
        String body = success ? task.getResult() : "Failed: " + task.getError();
        InboxRequest reply = InboxRequest.builder()
            .title((success ? "Result: " : "Failed: ") + task.getTitle())
            .description(body != null ? body : "")
            .assignedTo(sender.getId())
            .from(task.getAssignedTo())
            .tags(List.of(RESULT_REPLY_TAG))
            .build();
        try {
            inbox.appendToInbox(Path.of(sender.getCwd()), reply);
        } catch (IOException e) {
            log.warn("[{}] Could not deliver result of task {}: {}", sender.getId(), task.getId(), e.getMessage());
        }
    }

    String completionMessage(Task task, boolean success) {
        String name = profiles.getProfile(task.getAssignedTo())
            .map(AgentProfile::displayName)
            .orElse(task.getAssignedTo());
        String title = task.getTitle() != null ? task.getTitle() : "Task";
        if (success) {
            String summary = task.getResult() != null ? task.getResult() : title;
            return "**" + name + "** completed: " + title + "\n\n" + summary;
        }
        String error = task.getError() != null ? task.getError() : "Unknown error";
        return "**" + name + "** failed: " + title + "\n\n" + error;
    }
}
