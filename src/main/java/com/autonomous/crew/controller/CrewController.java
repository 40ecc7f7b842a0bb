package com.autonomous.crew.controller;

import com.autonomous.crew.model.AgentRelationship;
import com.autonomous.crew.model.AgentState;
import com.autonomous.crew.model.PersistedSchedule;
import com.autonomous.crew.model.ScheduleSource;
import com.autonomous.crew.model.Task;
import com.autonomous.crew.model.TaskFilter;
import com.autonomous.crew.model.TaskSource;
import com.autonomous.crew.model.TaskStatus;
import com.autonomous.crew.service.AgentService;
import com.autonomous.crew.service.TaskExecutorService;
import com.autonomous.crew.service.TaskService;
import com.autonomous.crew.store.RelationshipStore;
import com.autonomous.crew.team.TaskSchedulerService;
import com.autonomous.crew.terminal.SpawnResult;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
public class CrewController {

    @Autowired
    private TaskService taskService;

    @Autowired
    private TaskExecutorService taskExecutor;

    @Autowired
    private AgentService agentService;

    @Autowired
    private TaskSchedulerService scheduler;

    @Autowired
    private RelationshipStore relationships;

    @GetMapping("/health")
    public ResponseEntity<?> health() {
        return ResponseEntity.ok(Map.of("status", "healthy"));
    }

    @GetMapping("/tasks")
    public List<Task> listTasks(@RequestParam(required = false) String status,
                                @RequestParam(required = false) String assignedTo) {
        return taskService.list(TaskFilter.builder()
            .status(status != null ? TaskStatus.fromValue(status) : null)
            .assignedTo(assignedTo)
            .build());
    }

    @PostMapping("/tasks")
    public ResponseEntity<Task> createTask(@RequestBody Task request) {
        Task task = request.toBuilder()
            .id(null)
            .status(null)
            .source(TaskSource.USER)
            .createdBy(request.getCreatedBy() != null ? request.getCreatedBy() : "user")
            .build();
        return ResponseEntity.status(HttpStatus.CREATED).body(taskService.create(task));
    }

    @GetMapping("/tasks/{id}")
    public Task getTask(@PathVariable String id) {
        return taskService.require(id);
    }

    @PostMapping("/tasks/{id}/cancel")
    public ResponseEntity<?> cancelTask(@PathVariable String id) {
        boolean cancelled = taskExecutor.cancelTask(id);
        return ResponseEntity.ok(Map.of("cancelled", cancelled));
    }

    @GetMapping("/agents")
    public List<AgentState> listAgents() {
        return agentService.listStates();
    }

    @PostMapping("/agents/{id}/start")
    public ResponseEntity<SpawnResult> startAgent(@PathVariable String id) {
        SpawnResult result = agentService.start(id);
        return result.isSuccess()
            ? ResponseEntity.ok(result)
            : ResponseEntity.status(HttpStatus.CONFLICT).body(result);
    }

    @PostMapping("/agents/{id}/stop")
    public ResponseEntity<?> stopAgent(@PathVariable String id) {
        return ResponseEntity.ok(Map.of("stopped", agentService.stop(id)));
    }

    @PostMapping("/agents/{id}/input")
    public ResponseEntity<?> sendInput(@PathVariable String id, @RequestBody Map<String, String> body) {
        String text = body.get("text");
        if (text == null) {
            throw new IllegalArgumentException("text is required");
        }
        boolean written = agentService.sendInput(id, text);
        return written
            ? ResponseEntity.ok(Map.of("written", true))
            : ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("written", false));
    }

    @GetMapping("/agents/{id}/scrollback")
    public ResponseEntity<?> scrollback(@PathVariable String id) {
        return ResponseEntity.ok(Map.of("scrollback", agentService.getScrollback(id)));
    }

    @GetMapping("/schedules")
    public List<PersistedSchedule> listSchedules() {
        return scheduler.listSchedules();
    }

    @PostMapping("/schedules")
    public ResponseEntity<PersistedSchedule> createSchedule(@RequestBody PersistedSchedule request) {
        ScheduleSource source = request.getSource() == ScheduleSource.AGENT ? ScheduleSource.AGENT : ScheduleSource.USER;
        PersistedSchedule created = scheduler.createSchedule(
            request.getName(), request.getPattern(), request.getTaskTemplate(), source);
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @DeleteMapping("/schedules/{id}")
    public ResponseEntity<?> deleteSchedule(@PathVariable String id) {
        return scheduler.deleteSchedule(id)
            ? ResponseEntity.noContent().build()
            : ResponseEntity.notFound().build();
    }

    @GetMapping("/relationships/{agentId}")
    public List<AgentRelationship> relationships(@PathVariable String agentId) {
        return relationships.getAll(agentId);
    }
}
