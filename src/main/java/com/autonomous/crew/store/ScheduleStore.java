package com.autonomous.crew.store;

import com.autonomous.crew.model.PersistedSchedule;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

public interface ScheduleStore {

    /** Creates a schedule, or updates the existing one carrying the same name. */
    PersistedSchedule create(PersistedSchedule schedule);

    Optional<PersistedSchedule> get(String scheduleId);

    Optional<PersistedSchedule> findByName(String name);

    List<PersistedSchedule> list();

    PersistedSchedule update(String scheduleId, Consumer<PersistedSchedule> changes);

    /**
     * @throws IllegalStateException for system schedules, which can only be disabled
     */
    boolean delete(String scheduleId);

    boolean forceDelete(String scheduleId);

    /** Moves lastRun forward; an older timestamp is ignored. */
    void markRun(String scheduleId, Instant at);

    void flush();
}
