package com.autonomous.shellagent.exception;

/**
 * Base exception for failures inside a task run. The executor fails the task with its message.
 */
public class AgentExecutionException extends RuntimeException {

    private final String errorCode;

    public AgentExecutionException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public AgentExecutionException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
