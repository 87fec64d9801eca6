package com.autonomous.shellagent.exception;

public class ShellTransportException extends AgentExecutionException {

    public static final String ERROR_CODE = "SHELL_TRANSPORT";

    public ShellTransportException(String message) {
        super(ERROR_CODE, message);
    }

    public ShellTransportException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
