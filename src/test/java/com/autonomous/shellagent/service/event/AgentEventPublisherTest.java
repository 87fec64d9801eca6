package com.autonomous.shellagent.service.event;

import com.autonomous.shellagent.model.AgentEvent;
import com.autonomous.shellagent.model.AgentEventType;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AgentEventPublisherTest {

    @Test
    void shouldDeliverToRemainingListenersWhenOneFails() {
        List<AgentEvent> received = new ArrayList<>();
        AgentEventListener failing = event -> {
            throw new IllegalStateException("sink down");
        };
        AgentEventListener recorder = received::add;
        AgentEventPublisher publisher = new AgentEventPublisher(List.of(failing, recorder));

        publisher.publish(AgentEventType.AGENT_MESSAGE, "s1", null, Map.of("message", "hello"));

        assertEquals(1, received.size());
        assertEquals("hello", received.get(0).get("message"));
        assertEquals("s1", received.get(0).getSessionId());
    }

    @Test
    void shouldKeepBoundedHistoryPerSession() {
        RecentEventsBuffer buffer = new RecentEventsBuffer();
        buffer.setCapacity(2);
        AgentEventPublisher publisher = new AgentEventPublisher(List.of(buffer));

        publisher.publish(AgentEventType.COMMAND_OUTPUT, "s1", "t1", Map.of("output", "a"));
        publisher.publish(AgentEventType.COMMAND_OUTPUT, "s1", "t1", Map.of("output", "b"));
        publisher.publish(AgentEventType.COMMAND_OUTPUT, "s1", "t1", Map.of("output", "c"));
        publisher.publish(AgentEventType.COMMAND_OUTPUT, "s2", "t2", Map.of("output", "other"));

        List<AgentEvent> recent = buffer.recent("s1");
        assertEquals(2, recent.size());
        assertEquals("b", recent.get(0).get("output"));
        assertEquals("c", recent.get(1).get("output"));

        buffer.clear("s1");
        assertTrue(buffer.recent("s1").isEmpty());
        assertEquals(1, buffer.recent("s2").size());
    }
}
