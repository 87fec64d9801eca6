package com.autonomous.shellagent.service;

import com.autonomous.shellagent.config.AgentProperties;
import com.autonomous.shellagent.exception.AgentExecutionException;
import com.autonomous.shellagent.exception.InteractiveLoopException;
import com.autonomous.shellagent.model.ActionKind;
import com.autonomous.shellagent.model.AgentAction;
import com.autonomous.shellagent.model.AgentEventType;
import com.autonomous.shellagent.model.Conversation;
import com.autonomous.shellagent.model.EscalationResult;
import com.autonomous.shellagent.model.ExecutionRun;
import com.autonomous.shellagent.model.InteractionCategory;
import com.autonomous.shellagent.model.ProgressReport;
import com.autonomous.shellagent.model.Submission;
import com.autonomous.shellagent.model.SubmissionStatus;
import com.autonomous.shellagent.model.Task;
import com.autonomous.shellagent.model.TaskPriority;
import com.autonomous.shellagent.service.decision.DecisionMaker;
import com.autonomous.shellagent.service.decision.InteractionPromptBuilder;
import com.autonomous.shellagent.service.event.AgentEventPublisher;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Runs the actions of one task at a time against a session's shell.
 * <p>
 * The single-flight guard is acquired in {@link #submit} and released by the worker when the run ends, so a
 * second submission is refused while a task is running or waiting on an interactive prompt. After every
 * command the output is classified; prompts are answered by the decision-maker (or with the category's
 * default response) up to {@code maxEscalationDepth} times before the task fails.
 */
@Slf4j
public class AgentExecutor {

    private enum DispatchOutcome {
        CONTINUE,
        PAUSED,
        STOPPED
    }

    private static final int SUMMARY_ACTIONS = 5;

    private final String sessionId;
    private final ActionParser parser;
    private final InteractionClassifier classifier;
    private final KeySequenceTranslator keyTranslator;
    private final TaskStore taskStore;
    private final TerminalSession terminal;
    private final ProgressMonitor progressMonitor;
    private final DecisionMaker decisionMaker;
    private final InteractionPromptBuilder promptBuilder;
    private final AgentEventPublisher publisher;
    private final AgentProperties properties;
    private final Conversation conversation;
    private final boolean autoRespond;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final ExecutorService worker;
    private volatile ExecutionRun currentRun;

    @Builder
    public AgentExecutor(String sessionId,
                         ActionParser parser,
                         InteractionClassifier classifier,
                         KeySequenceTranslator keyTranslator,
                         TaskStore taskStore,
                         TerminalSession terminal,
                         ProgressMonitor progressMonitor,
                         DecisionMaker decisionMaker,
                         InteractionPromptBuilder promptBuilder,
                         AgentEventPublisher publisher,
                         AgentProperties properties,
                         Conversation conversation,
                         Boolean autoRespond) {
        this.sessionId = sessionId;
        this.parser = parser;
        this.classifier = classifier;
        this.keyTranslator = keyTranslator;
        this.taskStore = taskStore;
        this.terminal = terminal;
        this.progressMonitor = progressMonitor;
        this.decisionMaker = decisionMaker;
        this.promptBuilder = promptBuilder;
        this.publisher = publisher;
        this.properties = properties;
        this.conversation = conversation != null ? conversation : new Conversation(sessionId);
        this.autoRespond = autoRespond != null ? autoRespond : properties.isAutoRespond();
        this.worker = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "agent-worker-" + sessionId);
            thread.setDaemon(true);
            return thread;
        });
    }

    public Submission submit(String text) {
        return submit(text, TaskPriority.MEDIUM);
    }

    public Submission submit(String text, TaskPriority priority) {
        List<AgentAction> actions = parser.parse(text);
        if (actions.isEmpty()) {
            return Submission.rejected(SubmissionStatus.NO_ACTIONS, "No actions found in message");
        }

        if (!running.compareAndSet(false, true)) {
            log.info("[{}] Rejecting new task, another task is running", sessionId);
            ExecutionRun active = currentRun;
            publisher.publish(AgentEventType.AGENT_ERROR, sessionId, active != null ? active.getTaskId() : null,
                Map.of("error", "A task is already running. Wait for it to complete.", "reason", "busy"));
            return Submission.rejected(SubmissionStatus.BUSY, "A task is already running. Wait for it to complete.");
        }

        List<String> payloads = actions.stream().map(AgentAction::payload).collect(Collectors.toList());
        if (taskStore.hasPendingDuplicate(text, payloads)) {
            running.set(false);
            log.info("[{}] Identical task already pending, not creating another", sessionId);
            return Submission.rejected(SubmissionStatus.DUPLICATE, "An identical task is already scheduled");
        }

        String taskId = taskStore.create(text, priority, payloads);
        publisher.publish(AgentEventType.TASK_CREATED, sessionId, taskId, Map.of(
            "description", text,
            "actionCount", actions.size(),
            "priority", priority == null ? TaskPriority.MEDIUM.name() : priority.name()));

        ExecutionRun run = ExecutionRun.builder()
            .taskId(taskId)
            .sessionId(sessionId)
            .actions(actions)
            .startedAt(Instant.now())
            .build();
        currentRun = run;

        try {
            CompletableFuture<Task> future = CompletableFuture.supplyAsync(() -> execute(run), worker);
            run.setFuture(future);
            return Submission.accepted(taskId, future);
        } catch (RejectedExecutionException e) {
            currentRun = null;
            running.set(false);
            taskStore.cancel(taskId, "Executor is shut down");
            log.warn("[{}] Worker rejected task {}", sessionId, taskId);
            return Submission.rejected(SubmissionStatus.BUSY, "Executor is shut down");
        }
    }

    /**
     * Interrupts the running command and asks the worker to stop at its next check point.
     */
    public boolean stop() {
        ExecutionRun run = currentRun;
        if (run == null || !running.get()) {
            return false;
        }
        run.setStopRequested(true);
        progressMonitor.stop();
        try {
            terminal.interrupt();
        } catch (RuntimeException e) {
            log.warn("[{}] Failed to send interrupt: {}", sessionId, e.getMessage());
        }
        log.info("[{}] Stop requested for task {}", sessionId, run.getTaskId());
        return true;
    }

    public boolean isBusy() {
        return running.get();
    }

    public Optional<String> currentTaskId() {
        ExecutionRun run = currentRun;
        return run == null ? Optional.empty() : Optional.of(run.getTaskId());
    }

    public TaskStore getTaskStore() {
        return taskStore;
    }

    public Conversation getConversation() {
        return conversation;
    }

    public Map<String, Object> status() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("executing", running.get());
        status.put("currentTask", taskStore.current().orElse(null));
        status.put("monitoringProgress", progressMonitor.isActive());
        status.put("pendingTasks", taskStore.pending().size());
        status.put("totalTasks", taskStore.all().size());
        return status;
    }

    public void shutdown() {
        stop();
        progressMonitor.shutdown();
        worker.shutdownNow();
    }

    private Task execute(ExecutionRun run) {
        String taskId = run.getTaskId();
        try {
            if (!taskStore.start(taskId)) {
                log.error("[{}] Could not start task {}", sessionId, taskId);
                publisher.publish(AgentEventType.AGENT_ERROR, sessionId, taskId,
                    Map.of("error", "Could not start task " + taskId));
                return taskStore.get(taskId).orElse(null);
            }
            List<AgentAction> actions = run.getActions();
            log.info("[{}] Running task {} with {} actions", sessionId, taskId, actions.size());

            for (int i = 0; i < actions.size(); i++) {
                if (run.isStopRequested()) {
                    cancel(run);
                    return taskStore.get(taskId).orElse(null);
                }
                AgentAction action = actions.get(i);
                run.setNextIndex(i + 1);
                log.info("[{}] Action {}/{}: {} {}", sessionId, i + 1, actions.size(), action.getKind(), action.describe());

                DispatchOutcome outcome = dispatch(run, action);
                if (outcome == DispatchOutcome.STOPPED) {
                    cancel(run);
                    return taskStore.get(taskId).orElse(null);
                }
                if (outcome == DispatchOutcome.PAUSED) {
                    pauseForInput(run);
                    return taskStore.get(taskId).orElse(null);
                }
                if (Pauses.pause(properties.getInterActionPause(), run::isStopRequested)) {
                    cancel(run);
                    return taskStore.get(taskId).orElse(null);
                }
            }

            if (run.isStopRequested()) {
                cancel(run);
                return taskStore.get(taskId).orElse(null);
            }
            String summary = summarize(actions);
            taskStore.complete(taskId, summary);
            publisher.publish(AgentEventType.TASK_COMPLETED, sessionId, taskId, Map.of("result", summary));
            log.info("[{}] Task {} completed", sessionId, taskId);

        } catch (AgentExecutionException e) {
            fail(run, e.getMessage(), e);
        } catch (RuntimeException e) {
            fail(run, "Unexpected failure: " + e.getMessage(), e);
        } finally {
            currentRun = null;
            running.set(false);
        }
        return taskStore.get(taskId).orElse(null);
    }

    private DispatchOutcome dispatch(ExecutionRun run, AgentAction action) {
        return switch (action.getKind()) {
            case RUN_COMMAND -> runCommand(run, action.getCommand());
            case SEND_KEYS -> {
                sendKeys(run, action.getKeys());
                yield DispatchOutcome.CONTINUE;
            }
            case WAIT -> waitFor(run, action.getWaitSeconds()) ? DispatchOutcome.STOPPED : DispatchOutcome.CONTINUE;
        };
    }

    private DispatchOutcome runCommand(ExecutionRun run, String command) {
        String output = terminal.runCommand(command, chunk -> emitOutput(run, chunk), run::isStopRequested);
        conversation.addShellOutput(command, output);
        if (run.isStopRequested()) {
            return DispatchOutcome.STOPPED;
        }

        Optional<InteractionCategory> category = classifier.classifyTail(output, properties.getClassificationTailLines());
        if (category.isEmpty() || category.get() == InteractionCategory.COMPLETION) {
            return DispatchOutcome.CONTINUE;
        }

        run.resetEscalation();
        InteractionCategory detected = category.get();
        String prompt = output;
        if (detected == InteractionCategory.PROGRESS) {
            ProgressReport report = monitorProgress(run, command);
            if (report.getOutcome() == ProgressReport.Outcome.STOPPED) {
                return DispatchOutcome.STOPPED;
            }
            if (report.getOutcome() != ProgressReport.Outcome.HANDOFF) {
                return DispatchOutcome.CONTINUE;
            }
            detected = report.getCategory();
            prompt = report.getOutput();
        }

        EscalationResult result = escalate(run, detected, prompt);
        switch (result.getOutcome()) {
            case ESCALATE:
                return DispatchOutcome.PAUSED;
            case EXHAUSTED:
                throw new InteractiveLoopException(result.getCategory(), run.getEscalationDepth());
            default:
                return run.isStopRequested() ? DispatchOutcome.STOPPED : DispatchOutcome.CONTINUE;
        }
    }

    private EscalationResult escalate(ExecutionRun run, InteractionCategory category, String output) {
        InteractionCategory current = category;
        String currentOutput = output;
        while (true) {
            if (run.isStopRequested()) {
                return EscalationResult.resolved();
            }
            if (run.getEscalationDepth() >= properties.getMaxEscalationDepth()) {
                log.warn("[{}] Escalation depth {} reached on {} prompt", sessionId, run.getEscalationDepth(), current.getLabel());
                return EscalationResult.exhausted(current);
            }
            int depth = run.nextEscalation();
            log.info("[{}] Interaction detected: {} (depth {})", sessionId, current.getLabel(), depth);
            publisher.publish(AgentEventType.INTERACTION_DETECTED, sessionId, run.getTaskId(), Map.of(
                "category", current.getLabel(),
                "output", currentOutput,
                "depth", depth));

            if (current == InteractionCategory.CREDENTIAL) {
                return EscalationResult.escalate(current);
            }

            String responseOutput = respond(run, current, currentOutput);
            if (Pauses.pause(properties.getInteractionSettle(), run::isStopRequested)) {
                return EscalationResult.resolved();
            }
            String followUp = responseOutput + terminal.readLatest();
            if (followUp.isBlank()) {
                return EscalationResult.resolved();
            }
            emitOutput(run, followUp);

            Optional<InteractionCategory> next = classifier.classifyTail(followUp, properties.getClassificationTailLines());
            if (next.isEmpty() || next.get() == InteractionCategory.COMPLETION) {
                return EscalationResult.resolved();
            }
            if (next.get() == InteractionCategory.PROGRESS) {
                ProgressReport report = monitorProgress(run, "response to " + current.getLabel() + " prompt");
                if (report.getOutcome() != ProgressReport.Outcome.HANDOFF) {
                    return EscalationResult.resolved();
                }
                current = report.getCategory();
                currentOutput = report.getOutput();
            } else {
                current = next.get();
                currentOutput = followUp;
            }
        }
    }

    /**
     * Answers a prompt and returns whatever output the answer produced. Only SEND_KEYS and WAIT are honored
     * from a decision reply; when none are present the category's default response is sent.
     */
    private String respond(ExecutionRun run, InteractionCategory category, String output) {
        if (autoRespond || decisionMaker == null) {
            return sendDefault(run, category);
        }

        String reply;
        try {
            reply = decisionMaker.decide(
                promptBuilder.interactionPrompt(category, output, conversation.recent(properties.getConversationWindow())),
                promptBuilder.interactionSystemPrompt());
        } catch (RuntimeException e) {
            log.warn("[{}] Decision-maker failed on {} prompt, using default response: {}",
                sessionId, category.getLabel(), e.getMessage());
            return sendDefault(run, category);
        }
        reply = reply == null ? "" : reply;
        conversation.addAssistantMessage(reply);

        String narration = parser.stripActions(reply);
        if (!narration.isEmpty()) {
            publisher.publish(AgentEventType.AGENT_MESSAGE, sessionId, run.getTaskId(), Map.of("message", narration));
        }

        StringBuilder produced = new StringBuilder();
        boolean applied = false;
        for (AgentAction action : parser.parse(reply)) {
            if (action.getKind() == ActionKind.RUN_COMMAND) {
                log.warn("[{}] Ignoring RUN_COMMAND in interaction reply: {}", sessionId, action.getCommand());
            } else if (action.getKind() == ActionKind.SEND_KEYS) {
                produced.append(sendKeys(run, action.getKeys()));
                applied = true;
            } else {
                applied = true;
                if (waitFor(run, action.getWaitSeconds())) {
                    break;
                }
            }
        }
        if (!applied) {
            produced.append(sendDefault(run, category));
        }
        return produced.toString();
    }

    /**
     * Waits up to {@code max-wait}, returning true when a stop request cut the wait short.
     */
    private boolean waitFor(ExecutionRun run, double seconds) {
        Duration wait = properties.getMaxWait();
        if (seconds * 1000 < wait.toMillis()) {
            wait = Duration.ofMillis(Math.round(seconds * 1000));
        } else if (seconds * 1000 > wait.toMillis()) {
            log.warn("[{}] WAIT of {}s capped at {}", sessionId, seconds, wait);
        }
        return Pauses.pause(wait, run::isStopRequested);
    }

    private String sendDefault(ExecutionRun run, InteractionCategory category) {
        String response = classifier.defaultResponse(category);
        if (response.isEmpty()) {
            return "";
        }
        log.info("[{}] Auto-responding to {} prompt with {}", sessionId, category.getLabel(), response.strip());
        emitOutput(run, "[auto response] " + response.strip() + "\n");
        return terminal.sendKeys(response);
    }

    private String sendKeys(ExecutionRun run, List<String> keys) {
        if (keys.isEmpty()) {
            return "";
        }
        String sequence = keyTranslator.translate(keys);
        log.debug("[{}] Sending keys {} as {} chars", sessionId, keys, sequence.length());
        emitOutput(run, "\n[agent keys] " + String.join(" + ", keys) + "\n");
        String output = terminal.sendKeys(sequence);
        if (!output.isEmpty()) {
            emitOutput(run, output);
        }
        return output;
    }

    private ProgressReport monitorProgress(ExecutionRun run, String command) {
        if (run.isStopRequested()) {
            return ProgressReport.stopped(-1, 0);
        }
        try {
            return progressMonitor.watch(sessionId, run.getTaskId(), command).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AgentExecutionException("INTERRUPTED", "Interrupted while monitoring progress", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof AgentExecutionException) {
                throw (AgentExecutionException) cause;
            }
            throw new AgentExecutionException("PROGRESS_FAILED", "Progress monitor failed: " + cause.getMessage(), cause);
        }
    }

    private void pauseForInput(ExecutionRun run) {
        String message = "Waiting for a password. Remaining actions were not run; send the input as a new command.";
        int skipped = run.remaining();
        taskStore.complete(run.getTaskId(), message);
        publisher.publish(AgentEventType.AGENT_MESSAGE, sessionId, run.getTaskId(), Map.of("message", message));
        publisher.publish(AgentEventType.TASK_COMPLETED, sessionId, run.getTaskId(), Map.of(
            "result", message,
            "escalated", InteractionCategory.CREDENTIAL.getLabel(),
            "skippedActions", skipped));
        log.info("[{}] Task {} handed back for credential input ({} actions skipped)", sessionId, run.getTaskId(), skipped);
    }

    private void cancel(ExecutionRun run) {
        taskStore.cancel(run.getTaskId(), "Stopped on request");
        publisher.publish(AgentEventType.TASK_COMPLETED, sessionId, run.getTaskId(), Map.of(
            "status", "CANCELLED",
            "result", "Stopped on request"));
        log.info("[{}] Task {} stopped on request", sessionId, run.getTaskId());
    }

    private void fail(ExecutionRun run, String error, Exception cause) {
        log.error("[{}] Task {} failed: {}", sessionId, run.getTaskId(), error, cause);
        taskStore.fail(run.getTaskId(), error);
        publisher.publish(AgentEventType.AGENT_ERROR, sessionId, run.getTaskId(), Map.of("error", error));
    }

    private void emitOutput(ExecutionRun run, String output) {
        publisher.publish(AgentEventType.COMMAND_OUTPUT, sessionId, run.getTaskId(), Map.of("output", output));
    }

    private static String summarize(List<AgentAction> actions) {
        StringBuilder summary = new StringBuilder();
        summary.append("Executed ").append(actions.size()).append(actions.size() == 1 ? " action:" : " actions:");
        actions.stream()
            .limit(SUMMARY_ACTIONS)
            .forEach(action -> summary.append("\n- ").append(action.describe()));
        if (actions.size() > SUMMARY_ACTIONS) {
            summary.append("\n... and ").append(actions.size() - SUMMARY_ACTIONS).append(" more");
        }
        return summary.toString();
    }
}
