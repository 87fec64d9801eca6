package com.autonomous.shellagent.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Task {
    private String id;
    private String description;
    @Builder.Default
    private List<String> actions = new ArrayList<>();  // payloads, compared for duplicates only
    @Builder.Default
    private TaskStatus status = TaskStatus.PENDING;
    @Builder.Default
    private TaskPriority priority = TaskPriority.MEDIUM;
    private Instant createdAt;
    private Instant startedAt;
    private Instant completedAt;
    private String result;
    private String error;

    @JsonIgnore
    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }

    public Task copy() {
        return toBuilder()
            .actions(actions == null ? new ArrayList<>() : new ArrayList<>(actions))
            .build();
    }
}
