package com.autonomous.shellagent.controller;

import com.autonomous.shellagent.exception.AgentExecutionException;
import com.autonomous.shellagent.exception.SessionNotFoundException;
import com.autonomous.shellagent.model.AgentEvent;
import com.autonomous.shellagent.model.Submission;
import com.autonomous.shellagent.model.Task;
import com.autonomous.shellagent.model.TaskPriority;
import com.autonomous.shellagent.service.AgentSessionService;
import com.autonomous.shellagent.service.event.RecentEventsBuffer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/agent")
public class AgentController {

    private final AgentSessionService sessionService;
    private final RecentEventsBuffer eventsBuffer;

    public AgentController(AgentSessionService sessionService, RecentEventsBuffer eventsBuffer) {
        this.sessionService = sessionService;
        this.eventsBuffer = eventsBuffer;
    }

    @PostMapping("/sessions/{sessionId}")
    public ResponseEntity<?> open(@PathVariable String sessionId) {
        boolean existed = sessionService.isOpen(sessionId);
        sessionService.open(sessionId);
        return ResponseEntity.status(existed ? HttpStatus.OK : HttpStatus.CREATED)
            .body(Map.of("sessionId", sessionId, "status", existed ? "already open" : "opened"));
    }

    @DeleteMapping("/sessions/{sessionId}")
    public ResponseEntity<?> close(@PathVariable String sessionId) {
        if (!sessionService.close(sessionId)) {
            throw new SessionNotFoundException(sessionId);
        }
        eventsBuffer.clear(sessionId);
        return ResponseEntity.ok(Map.of("sessionId", sessionId, "status", "closed"));
    }

    @PostMapping("/sessions/{sessionId}/actions")
    public ResponseEntity<?> submitActions(@PathVariable String sessionId, @RequestBody Map<String, String> body) {
        String text = body.get("text");
        if (text == null || text.isBlank()) {
            return badRequest("text is required");
        }
        TaskPriority priority = parsePriority(body.get("priority"));
        Submission submission = sessionService.submitModelText(sessionId, text, priority);
        return toResponse(submission, HttpStatus.BAD_REQUEST);
    }

    @PostMapping("/sessions/{sessionId}/messages")
    public ResponseEntity<?> sendMessage(@PathVariable String sessionId, @RequestBody Map<String, String> body) {
        String message = body.get("message");
        if (message == null || message.isBlank()) {
            return badRequest("message is required");
        }
        Submission submission = sessionService.handleUserMessage(sessionId, message);
        return toResponse(submission, HttpStatus.OK);
    }

    @PostMapping("/sessions/{sessionId}/stop")
    public ResponseEntity<?> stop(@PathVariable String sessionId) {
        boolean stopped = sessionService.stop(sessionId);
        return ResponseEntity.ok(Map.of(
            "stopped", stopped,
            "message", stopped ? "Stop requested." : "No task running to stop."));
    }

    @GetMapping("/sessions/{sessionId}/status")
    public ResponseEntity<?> status(@PathVariable String sessionId) {
        return ResponseEntity.ok(sessionService.status(sessionId));
    }

    @GetMapping("/sessions/{sessionId}/tasks")
    public ResponseEntity<List<Task>> tasks(@PathVariable String sessionId) {
        return ResponseEntity.ok(sessionService.tasks(sessionId));
    }

    @DeleteMapping("/sessions/{sessionId}/tasks/finished")
    public ResponseEntity<?> clearFinished(@PathVariable String sessionId) {
        return ResponseEntity.ok(Map.of("removed", sessionService.clearFinished(sessionId)));
    }

    @GetMapping("/sessions/{sessionId}/events")
    public ResponseEntity<List<AgentEvent>> events(@PathVariable String sessionId) {
        sessionService.find(sessionId);
        return ResponseEntity.ok(eventsBuffer.recent(sessionId));
    }

    @GetMapping("/health")
    public ResponseEntity<?> health() {
        return ResponseEntity.ok(Map.of("status", "healthy", "sessions", sessionService.openSessions().size()));
    }

    @ExceptionHandler(SessionNotFoundException.class)
    public ResponseEntity<?> handleSessionNotFound(SessionNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(Map.of("error", e.getMessage(), "code", e.getErrorCode()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<?> handleBadArgument(IllegalArgumentException e) {
        return badRequest(e.getMessage());
    }

    @ExceptionHandler(AgentExecutionException.class)
    public ResponseEntity<?> handleAgentFailure(AgentExecutionException e) {
        log.error("Request failed: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
            .body(Map.of("error", e.getMessage(), "code", e.getErrorCode()));
    }

    private static TaskPriority parsePriority(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return TaskPriority.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown priority: " + value);
        }
    }

    private static ResponseEntity<?> toResponse(Submission submission, HttpStatus noActionsStatus) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", submission.getStatus().name());
        body.put("message", submission.getMessage());
        if (submission.getTaskId() != null) {
            body.put("taskId", submission.getTaskId());
        }
        HttpStatus status = switch (submission.getStatus()) {
            case ACCEPTED -> HttpStatus.ACCEPTED;
            case BUSY, DUPLICATE -> HttpStatus.CONFLICT;
            case NO_ACTIONS -> noActionsStatus;
        };
        return ResponseEntity.status(status).body(body);
    }

    private static ResponseEntity<?> badRequest(String message) {
        return ResponseEntity.badRequest().body(Map.of("error", message));
    }
}
