package com.autonomous.shellagent.service.event;

import com.autonomous.shellagent.model.AgentEvent;

public interface AgentEventListener {

    void onEvent(AgentEvent event);
}
