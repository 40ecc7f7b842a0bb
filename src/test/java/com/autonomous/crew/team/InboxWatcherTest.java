package com.autonomous.crew.team;

import com.autonomous.crew.config.CrewProperties;
import com.autonomous.crew.model.InboxRequest;
import com.autonomous.crew.model.Task;
import com.autonomous.crew.model.TaskPriority;
import com.autonomous.crew.model.TaskSource;
import com.autonomous.crew.model.TaskStatus;
import com.autonomous.crew.service.TaskService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class InboxWatcherTest {

    @TempDir
    Path agentDir;

    @Mock
    private TaskService taskService;

    @Mock
    private ScheduledExecutorService timer;

    private InboxWatcher watcher;

    @BeforeEach
    void setUp() {
        watcher = new InboxWatcher(taskService, timer, new CrewProperties());
        lenient().when(taskService.create(any(Task.class))).thenAnswer(inv -> {
            Task task = inv.getArgument(0);
            return task.toBuilder().id("t-" + task.getTitle().hashCode()).build();
        });
    }

    @Test
    void shouldCreateAssignedTaskForOwnerFromInboxLine() throws Exception {
        Path inbox = InboxWatcher.inboxPath(agentDir);
        Files.writeString(inbox, "{\"title\":\"Fix login\",\"description\":\"Users get 500\",\"priority\":\"high\"}\n");

        List<Task> created = watcher.processInbox("dev", inbox);

        assertEquals(1, created.size());
        ArgumentCaptor<Task> captor = ArgumentCaptor.forClass(Task.class);
        verify(taskService).create(captor.capture());
        Task task = captor.getValue();
        assertEquals("Fix login", task.getTitle());
        assertEquals("Users get 500", task.getDescription());
        assertEquals(TaskPriority.HIGH, task.getPriority());
        assertEquals(TaskStatus.ASSIGNED, task.getStatus());
        assertEquals(TaskSource.AGENT, task.getSource());
        assertEquals("dev", task.getAssignedTo());
        assertEquals("dev", task.getCreatedBy());
        assertEquals("", Files.readString(inbox));
    }

    @Test
    void shouldDelegateToNamedAgentWithSender() throws Exception {
        Path inbox = InboxWatcher.inboxPath(agentDir);
        Files.writeString(inbox, "{\"title\":\"Review PR\",\"assignedTo\":\"reviewer\",\"from\":\"lead\"}\n");

        watcher.processInbox("lead", inbox);

        ArgumentCaptor<Task> captor = ArgumentCaptor.forClass(Task.class);
        verify(taskService).create(captor.capture());
        assertEquals("reviewer", captor.getValue().getAssignedTo());
        assertEquals("lead", captor.getValue().getCreatedBy());
    }

    @Test
    void shouldSkipMalformedLinesAndKeepGoing() throws Exception {
        Path inbox = InboxWatcher.inboxPath(agentDir);
        Files.writeString(inbox, "{\"title\":\"One\"}\nnot json at all\n{\"title\":\"Two\"}\n");

        List<Task> created = watcher.processInbox("dev", inbox);

        assertEquals(2, created.size());
        assertEquals("", Files.readString(inbox));
    }

    @Test
    void shouldKeepIncompleteTrailingLine() throws Exception {
        Path inbox = InboxWatcher.inboxPath(agentDir);
        Files.writeString(inbox, "{\"title\":\"Done\"}\n{\"title\":\"Half");

        List<Task> created = watcher.processInbox("dev", inbox);

        assertEquals(1, created.size());
        assertEquals("{\"title\":\"Half", Files.readString(inbox));
    }

    @Test
    void shouldCreateTaskWhenLineIsAppendedToWatchedInbox() throws Exception {
        CrewProperties properties = new CrewProperties();
        properties.getStorage().setDebounceMs(50);
        ScheduledExecutorService realTimer = Executors.newSingleThreadScheduledExecutor();
        InboxWatcher live = new InboxWatcher(taskService, realTimer, properties);
        try {
            live.watchAgent("dev", agentDir);

            live.appendToInbox(agentDir, InboxRequest.builder().title("Rotate keys").from("lead").build());

            ArgumentCaptor<Task> captor = ArgumentCaptor.forClass(Task.class);
            verify(taskService, timeout(10_000)).create(captor.capture());
            assertEquals("Rotate keys", captor.getValue().getTitle());
            assertEquals("lead", captor.getValue().getCreatedBy());
        } finally {
            live.stopAll();
            realTimer.shutdownNow();
        }
    }

    @Test
    void shouldIgnoreItsOwnTruncationButNotLaterAppends() throws Exception {
        Path inbox = InboxWatcher.inboxPath(agentDir);
        Files.writeString(inbox, "{\"title\":\"Written while stopped\"}\n");
        watcher.watchAgent("dev", agentDir);
        try {
            verify(timer).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
            watcher.processInbox("dev", inbox);
            clearInvocations(timer);

            verify(timer, after(1_000).never()).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
            assertEquals("", Files.readString(inbox));

            watcher.appendToInbox(agentDir, InboxRequest.builder().title("Next").build());

            verify(timer, timeout(10_000).atLeastOnce())
                .schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
        } finally {
            watcher.stopAll();
        }
    }

    @Test
    void shouldDoNothingWhenInboxIsMissing() throws Exception {
        assertTrue(watcher.processInbox("dev", InboxWatcher.inboxPath(agentDir)).isEmpty());
        verifyNoInteractions(taskService);
    }

    @Test
    void shouldAppendRequestAsSingleLine() throws Exception {
        watcher.appendToInbox(agentDir, InboxRequest.builder().title("Result: Build").from("dev").build());
        watcher.appendToInbox(agentDir, InboxRequest.builder().title("Second").build());

        List<String> lines = Files.readAllLines(InboxWatcher.inboxPath(agentDir));
        assertEquals(2, lines.size());
        assertTrue(lines.get(0).contains("\"title\":\"Result: Build\""));
    }

    @Test
    void shouldDeriveTitleFromDescriptionForPlaceholders() {
        assertEquals("Investigate flaky test", InboxWatcher.resolveTitle(InboxRequest.builder()
            .title("Untitled").description("Investigate flaky test\nIt fails on CI").build()));
        assertEquals("Investigate", InboxWatcher.resolveTitle(InboxRequest.builder()
            .title("  New Task ").description("Investigate").build()));
        assertEquals("Untitled", InboxWatcher.resolveTitle(InboxRequest.builder().title("task").build()));
        assertEquals("Ship it", InboxWatcher.resolveTitle(InboxRequest.builder().title(" Ship it ").build()));
    }

    @Test
    void shouldTruncateDerivedTitle() {
        String longLine = "x".repeat(200);

        String title = InboxWatcher.resolveTitle(InboxRequest.builder().description(longLine).build());

        assertEquals(80, title.length());
    }
}
