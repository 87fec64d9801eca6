package com.autonomous.shellagent.service;

import com.autonomous.shellagent.config.AgentProperties;
import com.autonomous.shellagent.exception.AgentExecutionException;
import com.autonomous.shellagent.exception.SessionNotFoundException;
import com.autonomous.shellagent.model.AgentEventType;
import com.autonomous.shellagent.model.Conversation;
import com.autonomous.shellagent.model.SessionProfile;
import com.autonomous.shellagent.model.Submission;
import com.autonomous.shellagent.model.SubmissionStatus;
import com.autonomous.shellagent.model.Task;
import com.autonomous.shellagent.model.TaskPriority;
import com.autonomous.shellagent.service.decision.DecisionMaker;
import com.autonomous.shellagent.service.decision.InteractionPromptBuilder;
import com.autonomous.shellagent.service.event.AgentEventPublisher;
import com.autonomous.shellagent.service.shell.ShellTransport;
import com.autonomous.shellagent.service.shell.ShellTransportFactory;
import jakarta.annotation.PreDestroy;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of open sessions. Each session owns its shell, task store, conversation and executor, so the
 * single-flight guard applies per session.
 */
@Slf4j
@Service
public class AgentSessionService {

    @Getter
    @AllArgsConstructor
    public static class AgentSession {
        private final String sessionId;
        private final SessionProfile profile;
        private final ShellTransport transport;
        private final TerminalSession terminal;
        private final ProgressMonitor progressMonitor;
        private final AgentExecutor executor;
        private final Conversation conversation;
        private final Instant openedAt;

        public TaskStore getTaskStore() {
            return executor.getTaskStore();
        }
    }

    private final AgentProperties properties;
    private final SessionProfileLoader profileLoader;
    private final ShellTransportFactory transportFactory;
    private final ActionParser parser;
    private final InteractionClassifier classifier;
    private final KeySequenceTranslator keyTranslator;
    private final DecisionMaker decisionMaker;
    private final InteractionPromptBuilder promptBuilder;
    private final AgentEventPublisher publisher;

    private final Map<String, AgentSession> sessions = new ConcurrentHashMap<>();

    public AgentSessionService(AgentProperties properties,
                               SessionProfileLoader profileLoader,
                               ShellTransportFactory transportFactory,
                               ActionParser parser,
                               InteractionClassifier classifier,
                               KeySequenceTranslator keyTranslator,
                               DecisionMaker decisionMaker,
                               InteractionPromptBuilder promptBuilder,
                               AgentEventPublisher publisher) {
        this.properties = properties;
        this.profileLoader = profileLoader;
        this.transportFactory = transportFactory;
        this.parser = parser;
        this.classifier = classifier;
        this.keyTranslator = keyTranslator;
        this.decisionMaker = decisionMaker;
        this.promptBuilder = promptBuilder;
        this.publisher = publisher;
    }

    /**
     * Opens the session, or returns it when it is already open.
     */
    public AgentSession open(String sessionId) {
        return sessions.computeIfAbsent(sessionId, this::createSession);
    }

    public boolean close(String sessionId) {
        AgentSession session = sessions.remove(sessionId);
        if (session == null) {
            return false;
        }
        session.getExecutor().shutdown();
        session.getTerminal().close();
        log.info("Closed session {}", sessionId);
        return true;
    }

    public AgentSession find(String sessionId) {
        AgentSession session = sessions.get(sessionId);
        if (session == null) {
            throw new SessionNotFoundException(sessionId);
        }
        return session;
    }

    public boolean isOpen(String sessionId) {
        return sessions.containsKey(sessionId);
    }

    public Set<String> openSessions() {
        return Set.copyOf(sessions.keySet());
    }

    public Submission submitModelText(String sessionId, String text, TaskPriority priority) {
        AgentSession session = find(sessionId);
        TaskPriority effective = priority != null ? priority : session.getProfile().getDefaultPriority();
        session.getConversation().addAssistantMessage(text);
        return session.getExecutor().submit(text, effective);
    }

    /**
     * Sends a user message to the decision-maker with recent history, forwards its narration as an
     * {@code agent_message} event and submits any actions in the reply.
     */
    public Submission handleUserMessage(String sessionId, String message) {
        AgentSession session = find(sessionId);
        Conversation conversation = session.getConversation();
        conversation.addUserMessage(message);

        String reply;
        try {
            reply = decisionMaker.decide(
                promptBuilder.userPrompt(message, conversation.recent(properties.getConversationWindow())),
                promptBuilder.agentSystemPrompt());
        } catch (AgentExecutionException e) {
            log.error("Decision-maker failed for session {}", sessionId, e);
            publisher.publish(AgentEventType.AGENT_ERROR, sessionId, null, Map.of("error", e.getMessage()));
            throw e;
        }
        reply = reply == null ? "" : reply;
        conversation.addAssistantMessage(reply);
        conversation.trim(properties.getConversationWindow() * 4);

        String narration = parser.stripActions(reply);
        if (!narration.isEmpty()) {
            publisher.publish(AgentEventType.AGENT_MESSAGE, sessionId, null, Map.of("message", narration));
        }
        if (!parser.hasActions(reply)) {
            return Submission.rejected(SubmissionStatus.NO_ACTIONS, narration);
        }
        return session.getExecutor().submit(reply, session.getProfile().getDefaultPriority());
    }

    public boolean stop(String sessionId) {
        return find(sessionId).getExecutor().stop();
    }

    public Map<String, Object> status(String sessionId) {
        AgentSession session = find(sessionId);
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("sessionId", sessionId);
        status.put("connected", session.getTerminal().isConnected());
        status.put("openedAt", session.getOpenedAt());
        status.putAll(session.getExecutor().status());
        return status;
    }

    public List<Task> tasks(String sessionId) {
        return find(sessionId).getTaskStore().all();
    }

    public int clearFinished(String sessionId) {
        return find(sessionId).getTaskStore().clearFinished();
    }

    @PreDestroy
    public void closeAll() {
        for (String sessionId : new ArrayList<>(sessions.keySet())) {
            close(sessionId);
        }
    }

    private AgentSession createSession(String sessionId) {
        SessionProfile profile = profileLoader.resolve(sessionId);
        ShellTransport transport = transportFactory.open(profile);
        TerminalSession terminal = new TerminalSession(transport, properties);
        ProgressMonitor progressMonitor = new ProgressMonitor(terminal, classifier, publisher,
            properties.getProgressPollInterval(), properties.getProgressCeiling(), properties.getClassificationTailLines());
        Conversation conversation = new Conversation(sessionId);
        conversation.addSystemMessage(promptBuilder.agentSystemPrompt());

        AgentExecutor executor = AgentExecutor.builder()
            .sessionId(sessionId)
            .parser(parser)
            .classifier(classifier)
            .keyTranslator(keyTranslator)
            .taskStore(new TaskStore(storageFileFor(sessionId)))
            .terminal(terminal)
            .progressMonitor(progressMonitor)
            .decisionMaker(decisionMaker)
            .promptBuilder(promptBuilder)
            .publisher(publisher)
            .properties(properties)
            .conversation(conversation)
            .autoRespond(profile.getAutoRespond())
            .build();

        log.info("Opened session {} with shell {}", sessionId,
            profile.getShellCommand() != null ? profile.getShellCommand() : properties.getShellCommand());
        return new AgentSession(sessionId, profile, transport, terminal, progressMonitor, executor, conversation, Instant.now());
    }

    private Path storageFileFor(String sessionId) {
        if (properties.getTaskStorePath() == null || properties.getTaskStorePath().isBlank()) {
            return null;
        }
        String safeName = sessionId.replaceAll("[^A-Za-z0-9._-]", "_");
        return Paths.get(properties.getTaskStorePath(), safeName + ".json");
    }
}
