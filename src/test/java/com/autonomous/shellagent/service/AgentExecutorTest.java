package com.autonomous.shellagent.service;

import com.autonomous.shellagent.config.AgentProperties;
import com.autonomous.shellagent.model.AgentEvent;
import com.autonomous.shellagent.model.AgentEventType;
import com.autonomous.shellagent.model.Submission;
import com.autonomous.shellagent.model.SubmissionStatus;
import com.autonomous.shellagent.model.Task;
import com.autonomous.shellagent.model.TaskPriority;
import com.autonomous.shellagent.model.TaskStatus;
import com.autonomous.shellagent.service.decision.DecisionMaker;
import com.autonomous.shellagent.service.decision.InteractionPromptBuilder;
import com.autonomous.shellagent.service.event.AgentEventListener;
import com.autonomous.shellagent.service.event.AgentEventPublisher;
import com.autonomous.shellagent.service.shell.FakeShellTransport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AgentExecutorTest {

    @Mock
    private DecisionMaker decisionMaker;

    private AgentProperties properties;
    private FakeShellTransport shell;
    private TaskStore taskStore;
    private List<AgentEvent> events;
    private AgentExecutor executor;

    @BeforeEach
    void setUp() {
        properties = new AgentProperties();
        properties.setInterActionPause(Duration.ZERO);
        properties.setQuiescence(Duration.ofMillis(30));
        properties.setCommandCeiling(Duration.ofSeconds(2));
        properties.setReadPollInterval(Duration.ofMillis(5));
        properties.setKeySettle(Duration.ofMillis(5));
        properties.setInteractionSettle(Duration.ofMillis(5));
        properties.setProgressPollInterval(Duration.ofMillis(10));
        properties.setProgressCeiling(Duration.ofSeconds(2));
        properties.setMaxEscalationDepth(3);

        shell = new FakeShellTransport();
        taskStore = TaskStore.inMemory();
        events = new CopyOnWriteArrayList<>();
    }

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.shutdown();
        }
    }

    private AgentExecutor newExecutor(boolean autoRespond) {
        AgentEventListener recorder = events::add;
        AgentEventPublisher publisher = new AgentEventPublisher(List.of(recorder));
        TerminalSession terminal = new TerminalSession(shell, properties);
        InteractionClassifier classifier = new InteractionClassifier();
        ProgressMonitor monitor = new ProgressMonitor(terminal, classifier, publisher,
            properties.getProgressPollInterval(), properties.getProgressCeiling(), properties.getClassificationTailLines());
        executor = AgentExecutor.builder()
            .sessionId("s1")
            .parser(new ActionParser())
            .classifier(classifier)
            .keyTranslator(new KeySequenceTranslator())
            .taskStore(taskStore)
            .terminal(terminal)
            .progressMonitor(monitor)
            .decisionMaker(decisionMaker)
            .promptBuilder(new InteractionPromptBuilder())
            .publisher(publisher)
            .properties(properties)
            .autoRespond(autoRespond)
            .build();
        return executor;
    }

    private Task await(Submission submission) throws Exception {
        assertTrue(submission.isAccepted(), submission.getMessage());
        return submission.getCompletion().get(5, TimeUnit.SECONDS);
    }

    private List<AgentEventType> eventTypes() {
        return events.stream().map(AgentEvent::getType).collect(Collectors.toList());
    }

    @Test
    void shouldAnswerConfirmationWithDecisionMakerKeys() throws Exception {
        shell.onSend("rm file.txt\n", "rm: remove regular file 'file.txt'? (y/n) ");
        when(decisionMaker.decide(anyString(), anyString())).thenReturn("Confirming the removal. SEND_KEYS{\"y\",\"enter\"}");

        Task task = await(newExecutor(false).submit("RUN_COMMAND{rm file.txt}"));

        assertEquals(TaskStatus.COMPLETED, task.getStatus());
        assertEquals(List.of("rm file.txt\n", "y\r"), shell.getSent());
        verify(decisionMaker).decide(contains("confirmation"), anyString());
        assertTrue(eventTypes().contains(AgentEventType.INTERACTION_DETECTED));
        assertTrue(eventTypes().contains(AgentEventType.AGENT_MESSAGE));
        assertEquals(AgentEventType.TASK_COMPLETED, events.get(events.size() - 1).getType());
        assertFalse(executor.isBusy());
    }

    @Test
    void shouldSendDefaultResponseWhenAutoRespondIsOn() throws Exception {
        shell.onSend("rm file.txt\n", "rm: remove regular file 'file.txt'? (y/n) ");

        Task task = await(newExecutor(true).submit("RUN_COMMAND{rm file.txt}"));

        assertEquals(TaskStatus.COMPLETED, task.getStatus());
        assertEquals(List.of("rm file.txt\n", "y\n"), shell.getSent());
        verifyNoInteractions(decisionMaker);
    }

    @Test
    void shouldFailTaskWhenPromptKeepsRepeating() throws Exception {
        shell.onSend("cp a b\n", "overwrite b? (y/n) ");
        shell.alwaysOnSend("y\n", "overwrite b? (y/n) ");

        Task task = await(newExecutor(true).submit("RUN_COMMAND{cp a b}"));

        assertEquals(TaskStatus.FAILED, task.getStatus());
        assertTrue(task.getError().contains("stuck in interactive loop"));
        assertEquals(3, shell.getSent().stream().filter("y\n"::equals).count());
        assertTrue(eventTypes().contains(AgentEventType.AGENT_ERROR));
        assertFalse(executor.isBusy());
    }

    @Test
    void shouldRejectSubmissionWhileTaskIsRunning() throws Exception {
        newExecutor(false);

        Submission first = executor.submit("WAIT{0.3}");
        Submission second = executor.submit("RUN_COMMAND{ls}");

        assertEquals(SubmissionStatus.BUSY, second.getStatus());
        assertNull(second.getTaskId());
        AgentEvent busy = events.stream()
            .filter(e -> e.getType() == AgentEventType.AGENT_ERROR)
            .findFirst()
            .orElseThrow();
        assertEquals("busy", busy.get("reason"));
        assertEquals(first.getTaskId(), busy.getTaskId());

        Task task = await(first);
        assertEquals(TaskStatus.COMPLETED, task.getStatus());
        assertEquals(1, taskStore.all().size());
        assertFalse(shell.getSent().contains("ls\n"));
    }

    @Test
    void shouldRejectTextWithoutActions() {
        Submission submission = newExecutor(false).submit("Nothing to run here.");

        assertEquals(SubmissionStatus.NO_ACTIONS, submission.getStatus());
        assertTrue(taskStore.all().isEmpty());
        assertTrue(events.isEmpty());
        assertFalse(executor.isBusy());
    }

    @Test
    void shouldRefuseDuplicateOfPendingTask() {
        taskStore.create("RUN_COMMAND{ls}", TaskPriority.MEDIUM, List.of("ls"));

        Submission submission = newExecutor(false).submit("RUN_COMMAND{ls}");

        assertEquals(SubmissionStatus.DUPLICATE, submission.getStatus());
        assertEquals(1, taskStore.all().size());
        assertFalse(executor.isBusy());
    }

    @Test
    void shouldPauseAtCredentialPromptAndSkipRemainingActions() throws Exception {
        shell.onSend("sudo apt update\n", "[sudo] password for dev: ");

        Task task = await(newExecutor(true).submit("RUN_COMMAND{sudo apt update} RUN_COMMAND{echo after}"));

        assertEquals(TaskStatus.COMPLETED, task.getStatus());
        assertTrue(task.getResult().contains("password"));
        assertEquals(List.of("sudo apt update\n"), shell.getSent());
        AgentEvent completed = events.stream()
            .filter(e -> e.getType() == AgentEventType.TASK_COMPLETED)
            .findFirst()
            .orElseThrow();
        assertEquals("credential", completed.get("escalated"));
        assertEquals(1, completed.get("skippedActions"));
        verifyNoInteractions(decisionMaker);
    }

    @Test
    void shouldIgnoreRunCommandInInteractionReply() throws Exception {
        shell.onSend("rm file.txt\n", "rm: remove regular file 'file.txt'? (y/n) ");
        when(decisionMaker.decide(anyString(), anyString()))
            .thenReturn("RUN_COMMAND{rm -rf /tmp/x} SEND_KEYS{\"n\",\"enter\"}");

        Task task = await(newExecutor(false).submit("RUN_COMMAND{rm file.txt}"));

        assertEquals(TaskStatus.COMPLETED, task.getStatus());
        assertEquals(List.of("rm file.txt\n", "n\r"), shell.getSent());
    }

    @Test
    void shouldFallBackToDefaultResponseWhenDecisionMakerFails() throws Exception {
        shell.onSend("more notes.txt\n", "line 1\n--More--");
        when(decisionMaker.decide(anyString(), anyString())).thenThrow(new RuntimeException("cli missing"));

        Task task = await(newExecutor(false).submit("RUN_COMMAND{more notes.txt}"));

        assertEquals(TaskStatus.COMPLETED, task.getStatus());
        assertEquals(List.of("more notes.txt\n", "\n"), shell.getSent());
    }

    @Test
    void shouldHandOffLongRunningCommandToProgressMonitor() throws Exception {
        shell.onSend("pip download pkg\n", "Downloading pkg 10%\n")
            .thenAfter("pip download pkg\n", 150, "Downloading pkg 55%\n")
            .thenAfter("pip download pkg\n", 300, "100% complete\n");

        Task task = await(newExecutor(false).submit("RUN_COMMAND{pip download pkg}"));

        assertEquals(TaskStatus.COMPLETED, task.getStatus());
        assertEquals(1, eventTypes().stream().filter(t -> t == AgentEventType.DOWNLOAD_COMPLETE).count());
        assertTrue(eventTypes().contains(AgentEventType.DOWNLOAD_PROGRESS));
        verifyNoInteractions(decisionMaker);
    }

    @Test
    void shouldRunActionsInOrderAndSummarize() throws Exception {
        shell.onSend("echo hi\n", "hi\n");

        Task task = await(newExecutor(false).submit("RUN_COMMAND{echo hi} SEND_KEYS{\"ctrl\",\"c\"} WAIT{0.01}"));

        assertEquals(TaskStatus.COMPLETED, task.getStatus());
        assertEquals(List.of("echo hi\n", "\u0003"), shell.getSent());
        assertTrue(task.getResult().startsWith("Executed 3 actions"));
        assertNotNull(task.getStartedAt());
        assertNotNull(task.getCompletedAt());
    }

    @Test
    void shouldCancelTaskWhenStopped() throws Exception {
        newExecutor(false);

        Submission submission = executor.submit("WAIT{0.2} RUN_COMMAND{echo late}");
        Thread.sleep(50);
        assertTrue(executor.stop());

        Task task = await(submission);
        assertEquals(TaskStatus.CANCELLED, task.getStatus());
        assertTrue(shell.getSent().contains("\u0003"));
        assertFalse(shell.getSent().contains("echo late\n"));
        assertFalse(executor.isBusy());
    }

    @Test
    void shouldEndLongWaitWhenStopped() throws Exception {
        newExecutor(false);

        Submission submission = executor.submit("WAIT{3600}");
        Thread.sleep(100);
        long stoppedAt = System.currentTimeMillis();
        assertTrue(executor.stop());

        Task task = await(submission);
        assertEquals(TaskStatus.CANCELLED, task.getStatus());
        assertTrue(System.currentTimeMillis() - stoppedAt < 2000);
        assertFalse(executor.isBusy());

        shell.onSend("ls\n", "notes.txt\n");
        Task next = await(executor.submit("RUN_COMMAND{ls}"));
        assertEquals(TaskStatus.COMPLETED, next.getStatus());
    }

    @Test
    void shouldCapWaitAtConfiguredMaximum() throws Exception {
        properties.setMaxWait(Duration.ofMillis(100));

        Task task = await(newExecutor(false).submit("WAIT{1e300}"));

        assertEquals(TaskStatus.COMPLETED, task.getStatus());
    }

    @Test
    void shouldFailTaskWhenShellIsDisconnected() throws Exception {
        shell.close();

        Task task = await(newExecutor(false).submit("RUN_COMMAND{ls}"));

        assertEquals(TaskStatus.FAILED, task.getStatus());
        assertTrue(task.getError().contains("not established"));
    }
}
