package com.autonomous.shellagent.service.event;

import com.autonomous.shellagent.model.AgentEvent;
import com.autonomous.shellagent.model.AgentEventType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Fire-and-forget fan-out to every registered listener. A failing listener is logged and skipped.
 */
@Slf4j
@Service
public class AgentEventPublisher {

    private final List<AgentEventListener> listeners;

    public AgentEventPublisher(List<AgentEventListener> listeners) {
        this.listeners = List.copyOf(listeners);
    }

    public void publish(AgentEventType type, String sessionId, String taskId, Map<String, Object> payload) {
        publish(AgentEvent.builder()
            .type(type)
            .sessionId(sessionId)
            .taskId(taskId)
            .payload(payload == null ? Map.of() : payload)
            .build());
    }

    public void publish(AgentEvent event) {
        for (AgentEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("Listener {} failed on {}: {}", listener.getClass().getSimpleName(),
                    event.getType().getWireName(), e.getMessage(), e);
            }
        }
    }
}
