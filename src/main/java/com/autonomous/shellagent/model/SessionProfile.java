package com.autonomous.shellagent.model;

import lombok.Data;

import java.util.List;
import java.util.Map;

@Data
public class SessionProfile {
    private String sessionId;
    private String name;

    // Shell
    private List<String> shellCommand;
    private String workingDirectory;
    private Map<String, String> environment;

    // Behavior
    private Boolean autoRespond;            // null falls back to shell-agent.auto-respond
    private TaskPriority defaultPriority = TaskPriority.MEDIUM;

    // Optional
    private String slackChannel;
}
