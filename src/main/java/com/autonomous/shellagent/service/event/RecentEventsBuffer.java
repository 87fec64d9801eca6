package com.autonomous.shellagent.service.event;

import com.autonomous.shellagent.model.AgentEvent;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps the latest events of each session so clients can poll for them.
 */
@Component
public class RecentEventsBuffer implements AgentEventListener {

    @Value("${shell-agent.events.capacity:200}")
    private int capacity = 200;

    private final Map<String, Deque<AgentEvent>> events = new ConcurrentHashMap<>();

    public void setCapacity(int capacity) {
        this.capacity = capacity;
    }

    @Override
    public void onEvent(AgentEvent event) {
        if (event.getSessionId() == null) {
            return;
        }
        Deque<AgentEvent> queue = events.computeIfAbsent(event.getSessionId(), k -> new ArrayDeque<>());
        synchronized (queue) {
            queue.addLast(event);
            while (queue.size() > capacity) {
                queue.removeFirst();
            }
        }
    }

    public List<AgentEvent> recent(String sessionId) {
        Deque<AgentEvent> queue = events.get(sessionId);
        if (queue == null) {
            return List.of();
        }
        synchronized (queue) {
            return List.copyOf(queue);
        }
    }

    public void clear(String sessionId) {
        events.remove(sessionId);
    }
}
