package com.autonomous.crew.team;

import com.autonomous.crew.model.PersistedSchedule;
import com.autonomous.crew.model.SchedulePattern;
import com.autonomous.crew.model.ScheduleSource;
import com.autonomous.crew.model.TaskPriority;
import com.autonomous.crew.model.TaskTemplate;

import java.util.List;

/**
 * Built-in recurring schedules. Persisted system schedules not listed here are deleted at startup.
 */
public final class SystemSchedules {

    private SystemSchedules() {
    }

    public static List<PersistedSchedule> declared() {
        return List.of(
            system("Self-Reflection", SchedulePattern.cron("0 */3 * * *"), TaskTemplate.builder()
                .title("Self-reflection")
                .description("Review the crew's recently completed and failed tasks. Summarize what went well, "
                    + "what failed and why, and suggest one concrete improvement per agent.")
                .priority(TaskPriority.NORMAL)
                .tags(List.of("self-improvement"))
                .build()),
            system("Stats Aggregation", SchedulePattern.cron("0 */6 * * *"), TaskTemplate.builder()
                .title("Aggregate crew statistics")
                .description("Summarize task throughput, failure rates and response times per agent "
                    + "over the last six hours.")
                .priority(TaskPriority.LOW)
                .tags(List.of("stats"))
                .build()),
            system("Weekly Code Review", SchedulePattern.cron("0 3 * * 0"), TaskTemplate.builder()
                .title("Weekly code review")
                .description("Review the code changed in the agents' workspaces this week and list "
                    + "concrete improvements.")
                .priority(TaskPriority.NORMAL)
                .tags(List.of("code-improvement"))
                .build()));
    }

    private static PersistedSchedule system(String name, SchedulePattern pattern, TaskTemplate template) {
        return PersistedSchedule.builder()
            .name(name)
            .pattern(pattern)
            .taskTemplate(template)
            .enabled(true)
            .source(ScheduleSource.SYSTEM)
            .build();
    }
}
