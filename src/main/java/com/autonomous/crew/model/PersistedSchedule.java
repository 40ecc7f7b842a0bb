package com.autonomous.crew.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PersistedSchedule {
    private String id;
    private String name;
    private SchedulePattern pattern;
    private TaskTemplate taskTemplate;
    @Builder.Default
    private boolean enabled = true;
    private Instant lastRun;
    private ScheduleSource source;
    private Instant createdAt;
}
