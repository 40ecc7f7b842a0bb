package com.autonomous.crew.service;

import com.autonomous.crew.model.Task;
import com.autonomous.crew.model.TaskStatus;
import com.autonomous.crew.runtime.ExecutionProgress;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TaskTrackerTest {

    private final TaskTracker tracker = new TaskTracker();

    @Test
    void shouldKeepOnlyMostRecentSteps() {
        for (int i = 0; i < TaskTracker.MAX_STEPS + 10; i++) {
            tracker.record("t1", ExecutionProgress.toolUse("step " + i));
        }

        assertEquals(TaskTracker.MAX_STEPS, tracker.getSteps("t1").size());
        assertEquals("step 10", tracker.getSteps("t1").get(0).getSummary());
    }

    @Test
    void shouldFormatSummaryWithLastFiveSteps() {
        for (int i = 1; i <= 7; i++) {
            tracker.record("t1", ExecutionProgress.toolUse("step " + i));
        }
        Task task = Task.builder().id("t1").title("Build").status(TaskStatus.RUNNING).assignedTo("dev").build();

        String summary = tracker.formatStatusSummary(task);

        assertEquals("**Build** (running) - dev\n- step 3\n- step 4\n- step 5\n- step 6\n- step 7", summary);
    }

    @Test
    void shouldForgetClearedTask() {
        tracker.record("t1", ExecutionProgress.thinking("planning"));

        tracker.clear("t1");

        assertTrue(tracker.getSteps("t1").isEmpty());
    }
}
