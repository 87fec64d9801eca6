package com.autonomous.shellagent.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AgentEventType {
    TASK_CREATED("task_created"),
    TASK_COMPLETED("task_completed"),
    AGENT_ERROR("agent_error"),
    AGENT_MESSAGE("agent_message"),
    COMMAND_OUTPUT("command_output"),
    INTERACTION_DETECTED("interaction_detected"),
    DOWNLOAD_PROGRESS("download_progress"),
    DOWNLOAD_COMPLETE("download_complete"),
    DOWNLOAD_TIMEOUT("download_timeout");

    private final String wireName;

    AgentEventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
