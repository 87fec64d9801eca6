package com.autonomous.shellagent.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Transient state of one executor invocation. Owned by the worker thread; only {@code stopRequested}
 * is written from outside.
 */
@Data
@Builder
public class ExecutionRun {
    private String taskId;
    private String sessionId;
    private List<AgentAction> actions;
    private int nextIndex;
    private int escalationDepth;
    private Instant startedAt;
    private volatile boolean stopRequested;
    private transient CompletableFuture<Task> future;

    public int remaining() {
        return actions.size() - nextIndex;
    }

    public void resetEscalation() {
        escalationDepth = 0;
    }

    public int nextEscalation() {
        return ++escalationDepth;
    }
}
