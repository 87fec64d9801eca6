package com.autonomous.shellagent.model;

import lombok.Value;

import java.util.concurrent.CompletableFuture;

/**
 * Outcome of handing model text to an executor. Only accepted submissions carry a task id and a completion future.
 */
@Value
public class Submission {
    SubmissionStatus status;
    String taskId;
    String message;
    CompletableFuture<Task> completion;

    public static Submission accepted(String taskId, CompletableFuture<Task> completion) {
        return new Submission(SubmissionStatus.ACCEPTED, taskId, "Task started", completion);
    }

    public static Submission rejected(SubmissionStatus status, String message) {
        return new Submission(status, null, message, null);
    }

    public boolean isAccepted() {
        return status == SubmissionStatus.ACCEPTED;
    }
}
