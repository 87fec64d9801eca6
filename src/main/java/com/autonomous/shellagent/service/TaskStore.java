package com.autonomous.shellagent.service;

import com.autonomous.shellagent.model.Task;
import com.autonomous.shellagent.model.TaskPriority;
import com.autonomous.shellagent.model.TaskStatus;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Registry of tasks with a priority-ordered queue of pending ids.
 * <p>
 * Every mutating call updates the map and the queue and then writes a snapshot, all under the store's
 * monitor, so readers see either the state before a mutation or after it. A failed write is logged and the
 * in-memory state stays authoritative.
 */
@Slf4j
public class TaskStore {

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    static class Snapshot {
        private Map<String, Task> tasks = new LinkedHashMap<>();
        private List<String> queue = new ArrayList<>();
    }

    private final Path storageFile;
    private final ObjectMapper mapper;
    private final Map<String, Task> tasks = new LinkedHashMap<>();
    private final List<String> queue = new ArrayList<>();

    public TaskStore(Path storageFile) {
        this.storageFile = storageFile;
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        load();
    }

    public static TaskStore inMemory() {
        return new TaskStore(null);
    }

    public synchronized String create(String description, TaskPriority priority, List<String> actions) {
        String id = UUID.randomUUID().toString();
        Task task = Task.builder()
            .id(id)
            .description(description)
            .priority(priority == null ? TaskPriority.MEDIUM : priority)
            .actions(actions == null ? new ArrayList<>() : new ArrayList<>(actions))
            .status(TaskStatus.PENDING)
            .createdAt(Instant.now())
            .build();
        tasks.put(id, task);
        enqueue(task);
        persist();
        return id;
    }

    public synchronized boolean start(String id) {
        Task task = tasks.get(id);
        if (task == null || task.getStatus() != TaskStatus.PENDING) {
            return false;
        }
        task.setStatus(TaskStatus.RUNNING);
        task.setStartedAt(Instant.now());
        queue.remove(id);
        persist();
        return true;
    }

    public synchronized boolean complete(String id, String result) {
        Task task = tasks.get(id);
        if (task == null || task.getStatus() != TaskStatus.RUNNING) {
            return false;
        }
        finish(task, TaskStatus.COMPLETED);
        task.setResult(result);
        persist();
        return true;
    }

    public synchronized boolean fail(String id, String error) {
        Task task = tasks.get(id);
        if (task == null || task.getStatus() != TaskStatus.RUNNING) {
            return false;
        }
        finish(task, TaskStatus.FAILED);
        task.setError(error);
        persist();
        return true;
    }

    /**
     * Cancels a task that has not reached a terminal status yet.
     */
    public synchronized boolean cancel(String id, String reason) {
        Task task = tasks.get(id);
        if (task == null || task.isTerminal()) {
            return false;
        }
        finish(task, TaskStatus.CANCELLED);
        task.setResult(reason);
        persist();
        return true;
    }

    /**
     * Head of the queue. Ids whose task is gone or no longer pending are skipped, not removed.
     */
    public synchronized Optional<Task> nextPending() {
        for (String id : queue) {
            Task task = tasks.get(id);
            if (task != null && task.getStatus() == TaskStatus.PENDING) {
                return Optional.of(task.copy());
            }
        }
        return Optional.empty();
    }

    public synchronized Optional<Task> findDuplicate(String description, List<String> actions) {
        return tasks.values().stream()
            .filter(task -> matches(task, description, actions))
            .findFirst()
            .map(Task::copy);
    }

    public synchronized boolean hasPendingDuplicate(String description, List<String> actions) {
        return tasks.values().stream()
            .anyMatch(task -> task.getStatus() == TaskStatus.PENDING && matches(task, description, actions));
    }

    public synchronized Optional<Task> get(String id) {
        return Optional.ofNullable(tasks.get(id)).map(Task::copy);
    }

    public synchronized Optional<Task> current() {
        return tasks.values().stream()
            .filter(task -> task.getStatus() == TaskStatus.RUNNING)
            .findFirst()
            .map(Task::copy);
    }

    public synchronized List<Task> all() {
        return tasks.values().stream().map(Task::copy).collect(Collectors.toList());
    }

    public synchronized List<Task> pending() {
        return queue.stream()
            .map(tasks::get)
            .filter(Objects::nonNull)
            .filter(task -> task.getStatus() == TaskStatus.PENDING)
            .map(Task::copy)
            .collect(Collectors.toList());
    }

    public synchronized List<String> queuedIds() {
        return List.copyOf(queue);
    }

    /**
     * Drops completed, failed and cancelled tasks. Returns how many were removed.
     */
    public synchronized int clearFinished() {
        List<String> finished = tasks.values().stream()
            .filter(Task::isTerminal)
            .map(Task::getId)
            .collect(Collectors.toList());
        finished.forEach(id -> {
            tasks.remove(id);
            queue.remove(id);
        });
        if (!finished.isEmpty()) {
            persist();
        }
        return finished.size();
    }

    private static boolean matches(Task task, String description, List<String> actions) {
        if (!Objects.equals(task.getDescription(), description)) {
            return false;
        }
        return actions == null || Objects.equals(task.getActions(), actions);
    }

    private void enqueue(Task task) {
        int index = queue.size();
        for (int i = 0; i < queue.size(); i++) {
            Task existing = tasks.get(queue.get(i));
            if (existing != null && task.getPriority().isAheadOf(existing.getPriority())) {
                index = i;
                break;
            }
        }
        queue.add(index, task.getId());
    }

    private void finish(Task task, TaskStatus status) {
        task.setStatus(status);
        task.setCompletedAt(Instant.now());
        queue.remove(task.getId());
    }

    private void persist() {
        if (storageFile == null) {
            return;
        }
        try {
            if (storageFile.getParent() != null) {
                Files.createDirectories(storageFile.getParent());
            }
            Snapshot snapshot = new Snapshot(new LinkedHashMap<>(tasks), new ArrayList<>(queue));
            mapper.writerWithDefaultPrettyPrinter().writeValue(storageFile.toFile(), snapshot);
        } catch (IOException e) {
            log.warn("Failed to persist tasks to {}: {}", storageFile, e.getMessage());
        }
    }

    private void load() {
        if (storageFile == null || !Files.exists(storageFile)) {
            return;
        }
        try {
            Snapshot snapshot = mapper.readValue(storageFile.toFile(), Snapshot.class);
            if (snapshot.getTasks() != null) {
                tasks.putAll(snapshot.getTasks());
            }
            // a run does not survive the process
            tasks.values().stream()
                .filter(task -> task.getStatus() == TaskStatus.RUNNING)
                .forEach(task -> {
                    finish(task, TaskStatus.FAILED);
                    task.setError("Interrupted by restart");
                });
            if (snapshot.getQueue() != null) {
                snapshot.getQueue().stream()
                    .filter(tasks::containsKey)
                    .forEach(queue::add);
            }
            log.info("Loaded {} tasks ({} queued) from {}", tasks.size(), queue.size(), storageFile);
        } catch (IOException e) {
            log.warn("Failed to load tasks from {}: {}", storageFile, e.getMessage());
            tasks.clear();
            queue.clear();
        }
    }
}
