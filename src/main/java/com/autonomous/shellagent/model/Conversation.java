package com.autonomous.shellagent.model;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * Role-tagged message history of one session, fed back to the decision-maker as context.
 */
public class Conversation {

    public static final String SYSTEM = "system";
    public static final String USER = "user";
    public static final String ASSISTANT = "assistant";

    private final String sessionId;
    private final List<ConversationMessage> messages = new ArrayList<>();
    private Instant lastActivity = Instant.now();

    public Conversation(String sessionId) {
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }

    public synchronized void addSystemMessage(String content) {
        append(SYSTEM, content);
    }

    public synchronized void addUserMessage(String content) {
        append(USER, content);
    }

    public synchronized void addAssistantMessage(String content) {
        append(ASSISTANT, content);
    }

    public synchronized void addShellOutput(String command, String output) {
        append(SYSTEM, "[shell]\ncommand: " + command + "\noutput: " + output);
    }

    public synchronized List<ConversationMessage> getMessages() {
        return List.copyOf(messages);
    }

    /**
     * The last {@code limit} messages. When that window holds no system message the most recent one is prepended.
     */
    public synchronized List<ConversationMessage> recent(int limit) {
        if (messages.size() <= limit) {
            return List.copyOf(messages);
        }
        List<ConversationMessage> window = new ArrayList<>(messages.subList(messages.size() - limit, messages.size()));
        boolean hasSystem = window.stream().anyMatch(m -> SYSTEM.equals(m.getRole()));
        if (!hasSystem) {
            for (int i = messages.size() - limit - 1; i >= 0; i--) {
                if (SYSTEM.equals(messages.get(i).getRole())) {
                    window.add(0, messages.get(i));
                    break;
                }
            }
        }
        return window;
    }

    /**
     * Keeps system messages plus the last {@code keep} messages, dropping exact repeats.
     */
    public synchronized void trim(int keep) {
        if (messages.size() <= keep) {
            return;
        }
        List<ConversationMessage> tail = messages.subList(messages.size() - keep, messages.size());
        LinkedHashSet<ConversationMessage> kept = new LinkedHashSet<>();
        for (ConversationMessage message : messages) {
            if (SYSTEM.equals(message.getRole()) || tail.contains(message)) {
                kept.add(message);
            }
        }
        messages.clear();
        messages.addAll(kept);
    }

    public synchronized boolean isExpired(Duration idle) {
        return Duration.between(lastActivity, Instant.now()).compareTo(idle) > 0;
    }

    public synchronized int size() {
        return messages.size();
    }

    private void append(String role, String content) {
        messages.add(new ConversationMessage(role, Objects.requireNonNullElse(content, ""), Instant.now()));
        lastActivity = Instant.now();
    }
}
