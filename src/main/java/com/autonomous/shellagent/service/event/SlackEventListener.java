package com.autonomous.shellagent.service.event;

import com.autonomous.shellagent.model.AgentEvent;
import com.autonomous.shellagent.model.SessionProfile;
import com.autonomous.shellagent.service.SessionProfileLoader;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Mirrors task lifecycle events into Slack: one thread per task, with completion, failure, prompt and
 * busy notices posted as replies.
 */
@Component
@ConditionalOnProperty(name = "slack.notifications.enabled", havingValue = "true")
public class SlackEventListener implements AgentEventListener {

    private final SlackNotifier slackNotifier;
    private final SessionProfileLoader profileLoader;

    @Value("${slack.channel:}")
    private String defaultChannel;

    private final Map<String, String> taskThreads = new ConcurrentHashMap<>();

    public SlackEventListener(SlackNotifier slackNotifier, SessionProfileLoader profileLoader) {
        this.slackNotifier = slackNotifier;
        this.profileLoader = profileLoader;
    }

    public void setDefaultChannel(String defaultChannel) {
        this.defaultChannel = defaultChannel;
    }

    @Override
    public void onEvent(AgentEvent event) {
        String channel = channelFor(event.getSessionId());
        if (channel == null) {
            return;
        }

        switch (event.getType()) {
            case TASK_CREATED -> createThread(channel, event);
            case TASK_COMPLETED -> postCompletion(channel, event);
            case AGENT_ERROR -> postError(channel, event);
            case INTERACTION_DETECTED -> postInteraction(channel, event);
            default -> {
                // output and progress are too chatty for a channel
            }
        }
    }

    public String getThreadForTask(String taskId) {
        return taskId == null ? null : taskThreads.get(taskId);
    }

    private void createThread(String channel, AgentEvent event) {
        String message = String.format("*%s*\n\n%s", event.getSessionId(), event.get("description"));
        String threadTs = slackNotifier.postMessage(channel, message);
        if (threadTs != null && event.getTaskId() != null) {
            taskThreads.put(event.getTaskId(), threadTs);
        }
    }

    private void postCompletion(String channel, AgentEvent event) {
        StringBuilder message = new StringBuilder();
        if ("CANCELLED".equals(event.get("status"))) {
            message.append("*Task stopped*\n\n");
        } else if (event.get("escalated") != null) {
            message.append("*Waiting for input*\n\n");
        } else {
            message.append("*Task complete!*\n\n");
        }
        message.append(event.get("result"));
        postUpdate(channel, event.getTaskId(), message.toString());
        taskThreads.remove(event.getTaskId());
    }

    private void postError(String channel, AgentEvent event) {
        // a rejected submission carries the running task's id; that thread stays open
        if ("busy".equals(event.get("reason"))) {
            slackNotifier.postMessage(channel, String.format("*%s is busy*\n%s", event.getSessionId(), event.get("error")));
            return;
        }
        postFailure(channel, event);
    }

    private void postFailure(String channel, AgentEvent event) {
        String message = String.format("*Task failed*\n\n*Error:* %s", event.get("error"));
        postUpdate(channel, event.getTaskId(), message);
        if (event.getTaskId() != null) {
            taskThreads.remove(event.getTaskId());
        }
    }

    private void postInteraction(String channel, AgentEvent event) {
        String message = String.format("*Prompt detected:* %s (attempt %s)", event.get("category"), event.get("depth"));
        postUpdate(channel, event.getTaskId(), message);
    }

    private void postUpdate(String channel, String taskId, String message) {
        String threadTs = getThreadForTask(taskId);
        if (threadTs != null) {
            slackNotifier.postMessageInThread(channel, threadTs, message);
        } else {
            slackNotifier.postMessage(channel, message);
        }
    }

    private String channelFor(String sessionId) {
        String channel = sessionId == null ? null : profileLoader.getProfile(sessionId)
            .map(SessionProfile::getSlackChannel)
            .orElse(null);
        if (channel == null || channel.isBlank()) {
            channel = defaultChannel;
        }
        return channel == null || channel.isBlank() ? null : channel;
    }
}
