package com.autonomous.crew.team;

import com.autonomous.crew.model.AgentProfile;
import com.autonomous.crew.model.PersistedSchedule;
import com.autonomous.crew.model.SchedulePattern;
import com.autonomous.crew.model.ScheduleSource;
import com.autonomous.crew.model.Task;
import com.autonomous.crew.model.TaskSource;
import com.autonomous.crew.model.TaskStatus;
import com.autonomous.crew.model.TaskTemplate;
import com.autonomous.crew.service.TaskService;
import com.autonomous.crew.store.ScheduleStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

@Slf4j
@Service
public class TaskSchedulerService {

    private final ScheduleStore schedules;
    private final TaskService taskService;
    private final Clock clock;

    private volatile boolean started;

    public TaskSchedulerService(ScheduleStore schedules, TaskService taskService, Clock clock) {
        this.schedules = schedules;
        this.taskService = taskService;
        this.clock = clock;
    }

    /** Reconciles system schedules, then evaluates everything once. */
    public void start() {
        syncSystemSchedules();
        started = true;
        tick();
        log.info("Task scheduler started with {} schedules", schedules.list().size());
    }

    public void stop() {
        started = false;
    }

    @Scheduled(fixedDelayString = "${crew.scheduler.check-interval-ms:60000}",
        initialDelayString = "${crew.scheduler.check-interval-ms:60000}")
    public void scheduledTick() {
        if (started) {
            tick();
        }
    }

    /**
     * Fires every enabled schedule that is due.
     *
     * @return tasks created by this tick
     */
    public synchronized List<Task> tick() {
        Instant now = clock.instant();
        List<Task> created = new ArrayList<>();
        for (PersistedSchedule schedule : schedules.list()) {
            if (!schedule.isEnabled()
                || !ScheduleEvaluator.isDue(schedule.getPattern(), schedule.getLastRun(), now, clock.getZone())) {
                continue;
            }
            schedules.markRun(schedule.getId(), now);
            try {
                created.add(fire(schedule));
            } catch (RuntimeException e) {
                log.error("Schedule '{}' failed to create its task: {}", schedule.getName(), e.getMessage(), e);
            }
        }
        return created;
    }

    /**
     * Deletes persisted system schedules that are no longer declared and seeds missing ones.
     */
    public void syncSystemSchedules() {
        List<PersistedSchedule> declared = SystemSchedules.declared();
        Set<String> declaredNames = declared.stream().map(PersistedSchedule::getName).collect(Collectors.toSet());

        for (PersistedSchedule persisted : schedules.list()) {
            if (persisted.getSource() == ScheduleSource.SYSTEM && !declaredNames.contains(persisted.getName())) {
                schedules.forceDelete(persisted.getId());
                log.info("Removed obsolete system schedule '{}'", persisted.getName());
            }
        }
        for (PersistedSchedule schedule : declared) {
            boolean missing = schedules.findByName(schedule.getName()).isEmpty();
            schedules.create(schedule);
            if (missing) {
                log.info("Seeded system schedule '{}'", schedule.getName());
            }
        }
    }

    public PersistedSchedule createSchedule(String name, SchedulePattern pattern, TaskTemplate template,
                                            ScheduleSource source) {
        if (source == ScheduleSource.SYSTEM) {
            throw new IllegalArgumentException("System schedules are declared in code");
        }
        if (pattern == null || (!pattern.isCron() && !pattern.isInterval() && !pattern.isTimeOfDay())) {
            throw new IllegalArgumentException("Schedule needs a cron, interval or hour/minute pattern");
        }
        return schedules.create(PersistedSchedule.builder()
            .name(name)
            .pattern(pattern)
            .taskTemplate(template)
            .enabled(true)
            .source(source)
            .build());
    }

    public List<PersistedSchedule> listSchedules() {
        return schedules.list();
    }

    public boolean deleteSchedule(String scheduleId) {
        return schedules.delete(scheduleId);
    }

    public PersistedSchedule setEnabled(String scheduleId, boolean enabled) {
        return schedules.update(scheduleId, s -> s.setEnabled(enabled));
    }

    private Task fire(PersistedSchedule schedule) {
        TaskTemplate template = schedule.getTaskTemplate() != null ? schedule.getTaskTemplate() : new TaskTemplate();
        boolean system = schedule.getSource() == ScheduleSource.SYSTEM;
        String assignee = system ? AgentProfile.SYSTEM_AGENT_ID : template.getAssignedTo();

        Task task = Task.builder()
            .title(template.getTitle() != null ? template.getTitle() : schedule.getName())
            .description(template.getDescription())
            .priority(template.getPriority())
            .tags(template.getTags() != null ? new ArrayList<>(template.getTags()) : new ArrayList<>())
            .source(system ? TaskSource.SYSTEM : TaskSource.SCHEDULE)
            .createdBy(system ? AgentProfile.SYSTEM_AGENT_ID : "schedule:" + schedule.getId())
            .assignedTo(assignee)
            .status(assignee != null ? TaskStatus.ASSIGNED : TaskStatus.PENDING)
            .build();
        Task created = taskService.create(task);
        log.info("Schedule '{}' fired, created task {}", schedule.getName(), created.getId());
        return created;
    }
}
