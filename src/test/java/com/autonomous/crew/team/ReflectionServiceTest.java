package com.autonomous.crew.team;

import com.autonomous.crew.config.CrewProperties;
import com.autonomous.crew.event.TaskCompletedEvent;
import com.autonomous.crew.model.AgentProfile;
import com.autonomous.crew.model.AgentStats;
import com.autonomous.crew.model.Task;
import com.autonomous.crew.model.TaskFilter;
import com.autonomous.crew.model.TaskStatus;
import com.autonomous.crew.service.AgentProfileService;
import com.autonomous.crew.service.TaskService;
import com.autonomous.crew.store.StatsStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ReflectionServiceTest {

    @Mock
    private TeamExecutorQueue queue;

    @Mock
    private TaskService tasks;

    @Mock
    private StatsStore stats;

    @Mock
    private AgentProfileService profiles;

    @Mock
    private FeedBroadcaster feed;

    private ReflectionService reflection;

    @BeforeEach
    void setUp() {
        CrewProperties properties = new CrewProperties();
        properties.getTeam().setReflectEvery(2);
        reflection = new ReflectionService(queue, tasks, stats, profiles, feed, properties);
        lenient().when(profiles.getProfile("dev"))
            .thenReturn(Optional.of(AgentProfile.builder().id("dev").name("Developer").build()));
        lenient().when(stats.get("dev")).thenReturn(AgentStats.empty("dev"));
        lenient().when(tasks.list(any(TaskFilter.class))).thenReturn(List.of());
    }

    @Test
    void shouldReflectEveryConfiguredNumberOfTasks() {
        when(queue.enqueue(eq(ReflectionService.OPERATION), anyString()))
            .thenReturn(CompletableFuture.completedFuture("Keep commits small."));

        reflection.onTaskCompleted(finished("dev"));
        verifyNoInteractions(queue);

        reflection.onTaskCompleted(finished("dev"));

        verify(queue).enqueue(eq(ReflectionService.OPERATION), anyString());
        verify(feed).broadcast("dev", "**Developer** reflected on recent work\n\nKeep commits small.");
    }

    @Test
    void shouldNotReflectForSystemAgent() {
        reflection.onTaskCompleted(finished(AgentProfile.SYSTEM_AGENT_ID));
        reflection.onTaskCompleted(finished(AgentProfile.SYSTEM_AGENT_ID));

        verifyNoInteractions(queue);
    }

    @Test
    void shouldNotBroadcastFailedReflection() {
        when(queue.enqueue(anyString(), anyString()))
            .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("backend down")));

        CompletableFuture<String> result = reflection.reflect("dev");

        assertTrue(result.isCompletedExceptionally());
        verifyNoInteractions(feed);
    }

    @Test
    void shouldDescribeStatsAndRecentFailuresInPrompt() {
        AgentStats agentStats = AgentStats.builder().agentId("dev").tasksCompleted(4).tasksFailed(1)
            .averageResponseMs(2500).build();
        List<Task> recent = List.of(
            Task.builder().title("Ship feature").status(TaskStatus.COMPLETED).build(),
            Task.builder().title("Fix flaky test").status(TaskStatus.FAILED).error("Timeout in CI").build());

        String prompt = ReflectionService.buildPrompt("Developer", agentStats, recent);

        assertTrue(prompt.contains("- Tasks completed: 4"));
        assertTrue(prompt.contains("- Average response: 2500ms"));
        assertTrue(prompt.contains("- Recent success rate: 50%"));
        assertTrue(prompt.contains("- [failed] Fix flaky test: Timeout in CI"));
    }

    @Test
    void shouldUseNeutralSuccessRateWithoutHistory() {
        assertEquals(0.5, ReflectionService.calculateSuccessRate(List.of()));
    }

    @Test
    void shouldPickMostRecentFinishedTasks() {
        Instant base = Instant.parse("2026-03-01T00:00:00Z");
        Task old = Task.builder().title("old").status(TaskStatus.COMPLETED).completedAt(base).build();
        Task newer = Task.builder().title("newer").status(TaskStatus.FAILED).completedAt(base.plusSeconds(60)).build();
        Task running = Task.builder().title("running").status(TaskStatus.RUNNING).build();
        when(tasks.list(any(TaskFilter.class))).thenReturn(List.of(old, running, newer));

        List<Task> recent = reflection.recentTasks("dev");

        assertEquals(List.of("newer", "old"), recent.stream().map(Task::getTitle).toList());
    }

    private static TaskCompletedEvent finished(String agentId) {
        return new TaskCompletedEvent(Task.builder().id("t").title("x").status(TaskStatus.COMPLETED)
            .assignedTo(agentId).build(), 100);
    }
}
