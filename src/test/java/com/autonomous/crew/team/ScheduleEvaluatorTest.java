package com.autonomous.crew.team;

import com.autonomous.crew.model.SchedulePattern;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class ScheduleEvaluatorTest {

    private static final ZoneId UTC = ZoneOffset.UTC;
    private static final Instant NOW = Instant.parse("2026-03-04T10:30:00Z");

    @Test
    void shouldAlwaysBeDueWithoutLastRun() {
        assertTrue(ScheduleEvaluator.isDue(SchedulePattern.cron("0 3 * * 0"), null, NOW, UTC));
        assertTrue(ScheduleEvaluator.isDue(SchedulePattern.every(3_600_000), null, NOW, UTC));
        assertTrue(ScheduleEvaluator.isDue(SchedulePattern.dailyAt(23, 59), null, NOW, UTC));
    }

    @Test
    void shouldWaitForFullInterval() {
        SchedulePattern everyMinute = SchedulePattern.every(60_000);

        assertFalse(ScheduleEvaluator.isDue(everyMinute, NOW.minusSeconds(59), NOW, UTC));
        assertTrue(ScheduleEvaluator.isDue(everyMinute, NOW.minusSeconds(61), NOW, UTC));
    }

    @Test
    void shouldFireCronWhenNextOccurrenceHasPassed() {
        SchedulePattern everyThreeHours = SchedulePattern.cron("0 */3 * * *");

        // next occurrence after 08:59 is 09:00
        assertTrue(ScheduleEvaluator.isDue(everyThreeHours, Instant.parse("2026-03-04T08:59:00Z"), NOW, UTC));
        // next occurrence after 09:00 is 12:00
        assertFalse(ScheduleEvaluator.isDue(everyThreeHours, Instant.parse("2026-03-04T09:00:00Z"), NOW, UTC));
    }

    @Test
    void shouldFireMissedCronOnlyOnceAfterSleep() {
        SchedulePattern hourly = SchedulePattern.cron("0 * * * *");
        Instant lastRun = Instant.parse("2026-03-04T02:00:00Z");

        assertTrue(ScheduleEvaluator.isDue(hourly, lastRun, NOW, UTC));
        // after firing, lastRun moves to now and the schedule waits for 11:00
        assertFalse(ScheduleEvaluator.isDue(hourly, NOW, NOW.plusSeconds(60), UTC));
    }

    @Test
    void shouldEvaluateTimeOfDayPatterns() {
        SchedulePattern daily = SchedulePattern.dailyAt(10, 15);

        assertTrue(ScheduleEvaluator.isDue(daily, Instant.parse("2026-03-03T10:15:00Z"), NOW, UTC));
        assertFalse(ScheduleEvaluator.isDue(daily, Instant.parse("2026-03-04T10:15:00Z"), NOW, UTC));
    }

    @Test
    void shouldConvertWeeklyPatternToCron() {
        assertEquals("30 9 * * 1", ScheduleEvaluator.toCron(SchedulePattern.weeklyAt(1, 9, 30)));
        assertEquals("0 7 * * *", ScheduleEvaluator.toCron(SchedulePattern.dailyAt(7, 0)));
        assertNull(ScheduleEvaluator.toCron(SchedulePattern.every(1000)));
    }

    @Test
    void shouldTreatInvalidCronAsNeverDue() {
        assertFalse(ScheduleEvaluator.isDue(SchedulePattern.cron("not a cron"), NOW.minusSeconds(86_400), NOW, UTC));
    }
}
