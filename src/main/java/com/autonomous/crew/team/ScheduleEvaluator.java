package com.autonomous.crew.team;

import com.autonomous.crew.model.SchedulePattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.support.CronExpression;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Due-time evaluation for schedule patterns. Cron and time-of-day patterns are due once their next
 * occurrence after the last run has passed, so a missed tick fires exactly once on the next check.
 */
@Slf4j
public final class ScheduleEvaluator {

    private ScheduleEvaluator() {
    }

    public static boolean isDue(SchedulePattern pattern, Instant lastRun, Instant now, ZoneId zone) {
        if (lastRun == null) {
            return true;
        }
        if (pattern == null) {
            return false;
        }
        if (pattern.isInterval()) {
            return Duration.between(lastRun, now).toMillis() >= pattern.getIntervalMs();
        }
        return nextOccurrence(pattern, lastRun, zone)
            .map(next -> !next.isAfter(now))
            .orElse(false);
    }

    public static Optional<Instant> nextOccurrence(SchedulePattern pattern, Instant after, ZoneId zone) {
        String cron = toCron(pattern);
        if (cron == null) {
            return Optional.empty();
        }
        try {
            // Spring expressions carry a leading seconds field
            ZonedDateTime next = CronExpression.parse("0 " + cron).next(after.atZone(zone));
            return Optional.ofNullable(next).map(ZonedDateTime::toInstant);
        } catch (IllegalArgumentException e) {
            log.warn("Invalid cron expression '{}': {}", cron, e.getMessage());
            return Optional.empty();
        }
    }

    /** 5-field cron form of a cron or time-of-day pattern; null for intervals. */
    public static String toCron(SchedulePattern pattern) {
        if (pattern.isCron()) {
            return pattern.getCron().trim();
        }
        if (pattern.isTimeOfDay()) {
            int minute = pattern.getMinute() != null ? pattern.getMinute() : 0;
            String dayOfWeek = pattern.getDayOfWeek() != null ? String.valueOf(pattern.getDayOfWeek()) : "*";
            return minute + " " + pattern.getHour() + " * * " + dayOfWeek;
        }
        return null;
    }
}
