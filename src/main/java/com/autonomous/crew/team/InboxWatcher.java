package com.autonomous.crew.team;

import com.autonomous.crew.config.CrewProperties;
import com.autonomous.crew.model.InboxRequest;
import com.autonomous.crew.model.Task;
import com.autonomous.crew.model.TaskPriority;
import com.autonomous.crew.model.TaskSource;
import com.autonomous.crew.model.TaskStatus;
import com.autonomous.crew.service.TaskService;
import com.autonomous.crew.store.JsonFileSupport;
import com.autonomous.crew.support.DebounceTimer;
import com.autonomous.crew.support.TextUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;

import static java.nio.file.StandardWatchEventKinds.ENTRY_CREATE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_MODIFY;

/**
 * Turns lines appended to an agent's {@code inbox.jsonl} into assigned tasks.
 */
@Slf4j
@Service
public class InboxWatcher {

    public static final String INBOX_FILE = "inbox.jsonl";

    private static final Set<String> PLACEHOLDER_TITLES = Set.of("untitled", "task", "new task");

    private final TaskService taskService;
    private final ScheduledExecutorService timer;
    private final long debounceMs;
    private final JsonFileSupport json = new JsonFileSupport();

    private final Map<String, Watched> watched = new ConcurrentHashMap<>();
    private final Set<Path> selfTruncated = ConcurrentHashMap.newKeySet();

    private WatchService watchService;
    private Thread watchThread;

    public InboxWatcher(TaskService taskService, ScheduledExecutorService crewTimer, CrewProperties properties) {
        this.taskService = taskService;
        this.timer = crewTimer;
        this.debounceMs = properties.getStorage().getDebounceMs();
    }

    public static Path inboxPath(Path agentDir) {
        return agentDir.resolve(INBOX_FILE);
    }

    public synchronized void watchAgent(String agentId, Path agentDir) throws IOException {
        if (watched.containsKey(agentId)) {
            return;
        }
        Files.createDirectories(agentDir);
        ensureWatchThread();

        Path inbox = inboxPath(agentDir);
        WatchKey key = agentDir.register(watchService, ENTRY_CREATE, ENTRY_MODIFY);
        DebounceTimer debounce = new DebounceTimer("inbox:" + agentId, timer, debounceMs,
            () -> processInbox(agentId, inbox));
        watched.put(agentId, new Watched(agentId, inbox, key, debounce));
        log.info("[{}] Watching inbox {}", agentId, inbox);

        // Requests written while we were not running
        if (Files.exists(inbox) && Files.size(inbox) > 0) {
            debounce.schedule();
        }
    }

    public synchronized void unwatchAgent(String agentId) {
        Watched entry = watched.remove(agentId);
        if (entry != null) {
            entry.key.cancel();
            entry.debounce.cancel();
        }
    }

    @PreDestroy
    public synchronized void stopAll() {
        watched.keySet().forEach(this::unwatchAgent);
        if (watchService != null) {
            try {
                watchService.close();
            } catch (IOException e) {
                log.warn("Failed to close inbox watch service: {}", e.getMessage());
            }
            watchService = null;
            watchThread = null;
        }
    }

    /**
     * Creates a task for every complete line in the inbox, then removes those lines from the file.
     * Lines appended while processing are kept for the next pass.
     */
    public synchronized List<Task> processInbox(String ownerId, Path inbox) throws IOException {
        List<Task> created = new ArrayList<>();
        if (!Files.exists(inbox)) {
            return created;
        }
        String content = Files.readString(inbox, StandardCharsets.UTF_8);
        int consumed = content.lastIndexOf('\n') + 1;
        if (consumed == 0) {
            return created;
        }

        for (String line : content.substring(0, consumed).split("\n")) {
            if (line.isBlank()) {
                continue;
            }
            InboxRequest request;
            try {
                request = json.mapper().readValue(line, InboxRequest.class);
            } catch (JsonProcessingException e) {
                log.warn("[{}] Skipping malformed inbox line: {}", ownerId, e.getOriginalMessage());
                continue;
            }
            try {
                created.add(createTask(ownerId, request));
            } catch (RuntimeException e) {
                log.error("[{}] Failed to create task from inbox: {}", ownerId, e.getMessage(), e);
            }
        }

        String latest = Files.readString(inbox, StandardCharsets.UTF_8);
        String remainder = latest.startsWith(content.substring(0, consumed)) ? latest.substring(consumed) : "";
        selfTruncated.add(inbox);
        Files.writeString(inbox, remainder, StandardCharsets.UTF_8,
            StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        return created;
    }

    /** Appends one request line to an agent's inbox. */
    public void appendToInbox(Path agentDir, InboxRequest request) throws IOException {
        json.appendLine(inboxPath(agentDir), request);
    }

    private Task createTask(String ownerId, InboxRequest request) {
        String assignee = TextUtils.isBlank(request.getAssignedTo()) ? ownerId : request.getAssignedTo();
        String sender = TextUtils.isBlank(request.getFrom()) ? ownerId : request.getFrom();

        Task task = taskService.create(Task.builder()
            .title(resolveTitle(request))
            .description(request.getDescription() != null ? request.getDescription() : "")
            .priority(TaskPriority.parse(request.getPriority()))
            .status(TaskStatus.ASSIGNED)
            .source(TaskSource.AGENT)
            .createdBy(sender)
            .assignedTo(assignee)
            .tags(request.getTags() != null ? new ArrayList<>(request.getTags()) : new ArrayList<>())
            .build());
        log.info("[{}] Inbox task from {} to {}: \"{}\"", ownerId, sender, assignee, task.getTitle());
        return task;
    }

    static String resolveTitle(InboxRequest request) {
        String title = request.getTitle();
        if (TextUtils.isBlank(title) || PLACEHOLDER_TITLES.contains(title.strip().toLowerCase())) {
            String derived = TextUtils.truncate(TextUtils.firstLine(request.getDescription()), 80);
            return derived.isEmpty() ? "Untitled" : derived;
        }
        return title.strip();
    }

    private void ensureWatchThread() throws IOException {
        if (watchService != null) {
            return;
        }
        watchService = FileSystems.getDefault().newWatchService();
        WatchService service = watchService;
        watchThread = new Thread(() -> pollEvents(service), "inbox-watcher");
        watchThread.setDaemon(true);
        watchThread.start();
    }

    private void pollEvents(WatchService service) {
        while (true) {
            WatchKey key;
            try {
                key = service.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (ClosedWatchServiceException e) {
                return;
            }
            for (WatchEvent<?> event : key.pollEvents()) {
                if (event.context() instanceof Path && INBOX_FILE.equals(event.context().toString())) {
                    onInboxChanged(key);
                }
            }
            key.reset();
        }
    }

    private void onInboxChanged(WatchKey key) {
        for (Watched entry : watched.values()) {
            if (entry.key != key) {
                continue;
            }
            if (isOwnTruncation(entry.inbox)) {
                log.debug("[{}] Ignoring own inbox truncation", entry.agentId);
                continue;
            }
            entry.debounce.schedule();
        }
    }

    private boolean isOwnTruncation(Path inbox) {
        if (!selfTruncated.remove(inbox)) {
            return false;
        }
        try {
            return Files.size(inbox) == 0;
        } catch (IOException e) {
            return true;
        }
    }

    private static final class Watched {
        final String agentId;
        final Path inbox;
        final WatchKey key;
        final DebounceTimer debounce;

        Watched(String agentId, Path inbox, WatchKey key, DebounceTimer debounce) {
            this.agentId = agentId;
            this.inbox = inbox;
            this.debounce = debounce;
            this.key = key;
        }
    }
}
