package com.autonomous.shellagent.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "shell-agent")
@Data
public class AgentProperties {

    // Executor
    private Duration interActionPause = Duration.ofMillis(500);
    private int maxEscalationDepth = 10;
    private boolean autoRespond = false;
    private int classificationTailLines = 5;
    private Duration maxWait = Duration.ofMinutes(5);

    // Terminal capture
    private Duration quiescence = Duration.ofSeconds(2);
    private Duration commandCeiling = Duration.ofSeconds(60);
    private Duration readPollInterval = Duration.ofMillis(100);
    private Duration keySettle = Duration.ofMillis(300);
    private Duration interactionSettle = Duration.ofSeconds(1);

    // Progress monitor
    private Duration progressPollInterval = Duration.ofSeconds(2);
    private Duration progressCeiling = Duration.ofSeconds(300);

    // Sessions
    private String taskStorePath = "data/tasks";
    private String sessionProfilePath = "config/sessions";
    private int conversationWindow = 20;
    private List<String> shellCommand = List.of("/bin/sh");
}
