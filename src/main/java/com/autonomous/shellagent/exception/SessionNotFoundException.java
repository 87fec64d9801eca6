package com.autonomous.shellagent.exception;

public class SessionNotFoundException extends AgentExecutionException {

    public static final String ERROR_CODE = "SESSION_NOT_FOUND";

    public SessionNotFoundException(String sessionId) {
        super(ERROR_CODE, "No open session: " + sessionId);
    }
}
