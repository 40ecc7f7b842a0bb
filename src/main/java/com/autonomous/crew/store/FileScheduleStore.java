package com.autonomous.crew.store;

import com.autonomous.crew.model.PersistedSchedule;
import com.autonomous.crew.model.ScheduleSource;
import com.autonomous.crew.support.DebounceTimer;
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Consumer;

/**
 * Schedules persisted as one JSON array in {@code schedules/schedules.json}.
 */
@Slf4j
public class FileScheduleStore implements ScheduleStore {

    private final Path file;
    private final Clock clock;
    private final JsonFileSupport json = new JsonFileSupport();
    private final Map<String, PersistedSchedule> schedules = new LinkedHashMap<>();
    private final DebounceTimer writer;

    public FileScheduleStore(Path dataDir, ScheduledExecutorService timer, long debounceMs, Clock clock) {
        this.file = dataDir.resolve("schedules").resolve("schedules.json");
        this.clock = clock;
        this.writer = new DebounceTimer("schedules", timer, debounceMs, this::persist);
        json.readList(file, new TypeReference<List<PersistedSchedule>>() {})
            .forEach(s -> schedules.put(s.getId(), s));
    }

    @Override
    public synchronized PersistedSchedule create(PersistedSchedule schedule) {
        Optional<PersistedSchedule> sameName = findByName(schedule.getName());
        if (sameName.isPresent()) {
            PersistedSchedule existing = schedules.get(sameName.get().getId());
            if (existing.getSource() == ScheduleSource.SYSTEM && schedule.getSource() != ScheduleSource.SYSTEM) {
                throw new IllegalStateException("Schedule '" + existing.getName() + "' is a system schedule");
            }
            existing.setPattern(schedule.getPattern());
            existing.setTaskTemplate(schedule.getTaskTemplate());
            existing.setSource(schedule.getSource());
            log.debug("Reusing schedule '{}' ({})", existing.getName(), existing.getId());
            writer.schedule();
            return existing.toBuilder().build();
        }
        PersistedSchedule stored = schedule.toBuilder()
            .id(schedule.getId() != null ? schedule.getId() : UUID.randomUUID().toString())
            .createdAt(schedule.getCreatedAt() != null ? schedule.getCreatedAt() : clock.instant())
            .build();
        schedules.put(stored.getId(), stored);
        writer.schedule();
        return stored.toBuilder().build();
    }

    @Override
    public synchronized Optional<PersistedSchedule> get(String scheduleId) {
        return Optional.ofNullable(schedules.get(scheduleId)).map(s -> s.toBuilder().build());
    }

    @Override
    public synchronized Optional<PersistedSchedule> findByName(String name) {
        return schedules.values().stream()
            .filter(s -> s.getName() != null && s.getName().equals(name))
            .findFirst()
            .map(s -> s.toBuilder().build());
    }

    @Override
    public synchronized List<PersistedSchedule> list() {
        List<PersistedSchedule> copies = new ArrayList<>();
        schedules.values().forEach(s -> copies.add(s.toBuilder().build()));
        return copies;
    }

    @Override
    public synchronized PersistedSchedule update(String scheduleId, Consumer<PersistedSchedule> changes) {
        PersistedSchedule current = schedules.get(scheduleId);
        if (current == null) {
            throw new NoSuchElementException("Schedule not found: " + scheduleId);
        }
        PersistedSchedule updated = current.toBuilder().build();
        changes.accept(updated);
        updated.setId(scheduleId);
        schedules.put(scheduleId, updated);
        writer.schedule();
        return updated.toBuilder().build();
    }

    @Override
    public synchronized boolean delete(String scheduleId) {
        PersistedSchedule current = schedules.get(scheduleId);
        if (current == null) {
            return false;
        }
        if (current.getSource() == ScheduleSource.SYSTEM) {
            throw new IllegalStateException("Cannot delete system schedules, disable them instead");
        }
        return forceDelete(scheduleId);
    }

    @Override
    public synchronized boolean forceDelete(String scheduleId) {
        boolean removed = schedules.remove(scheduleId) != null;
        if (removed) {
            writer.schedule();
        }
        return removed;
    }

    @Override
    public synchronized void markRun(String scheduleId, Instant at) {
        PersistedSchedule current = schedules.get(scheduleId);
        if (current == null) {
            return;
        }
        if (current.getLastRun() == null || at.isAfter(current.getLastRun())) {
            current.setLastRun(at);
            writer.schedule();
        }
    }

    @Override
    public void flush() {
        writer.flushNow();
    }

    private void persist() throws Exception {
        List<PersistedSchedule> snapshot;
        synchronized (this) {
            snapshot = new ArrayList<>(schedules.values());
        }
        json.writeAtomically(file, snapshot);
    }
}
