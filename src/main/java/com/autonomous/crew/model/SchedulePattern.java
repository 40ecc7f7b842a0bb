package com.autonomous.crew.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * When a schedule fires. Exactly one of the three forms is expected to be set:
 * a 5-field cron expression, a fixed interval, or an hour/minute of day with an optional day of week
 * (0 = Sunday).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SchedulePattern {
    private String cron;
    private Long intervalMs;
    private Integer hour;
    private Integer minute;
    private Integer dayOfWeek;

    public static SchedulePattern cron(String expression) {
        return SchedulePattern.builder().cron(expression).build();
    }

    public static SchedulePattern every(long intervalMs) {
        return SchedulePattern.builder().intervalMs(intervalMs).build();
    }

    public static SchedulePattern dailyAt(int hour, int minute) {
        return SchedulePattern.builder().hour(hour).minute(minute).build();
    }

    public static SchedulePattern weeklyAt(int dayOfWeek, int hour, int minute) {
        return SchedulePattern.builder().dayOfWeek(dayOfWeek).hour(hour).minute(minute).build();
    }

    @JsonIgnore
    public boolean isCron() {
        return cron != null && !cron.isBlank();
    }

    @JsonIgnore
    public boolean isInterval() {
        return !isCron() && intervalMs != null;
    }

    @JsonIgnore
    public boolean isTimeOfDay() {
        return !isCron() && !isInterval() && hour != null;
    }
}
