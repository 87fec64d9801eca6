package com.autonomous.shellagent.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
public class AgentEvent {
    AgentEventType type;
    String sessionId;
    String taskId;
    @Builder.Default
    Map<String, Object> payload = Map.of();
    @Builder.Default
    Instant timestamp = Instant.now();

    public Object get(String key) {
        return payload.get(key);
    }
}
