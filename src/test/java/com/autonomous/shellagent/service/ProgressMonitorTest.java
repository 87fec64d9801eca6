package com.autonomous.shellagent.service;

import com.autonomous.shellagent.config.AgentProperties;
import com.autonomous.shellagent.model.AgentEvent;
import com.autonomous.shellagent.model.AgentEventType;
import com.autonomous.shellagent.model.InteractionCategory;
import com.autonomous.shellagent.model.ProgressReport;
import com.autonomous.shellagent.service.event.AgentEventListener;
import com.autonomous.shellagent.service.event.AgentEventPublisher;
import com.autonomous.shellagent.service.shell.FakeShellTransport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.OptionalInt;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ProgressMonitorTest {

    private FakeShellTransport shell;
    private List<AgentEvent> events;
    private AgentEventPublisher publisher;
    private ProgressMonitor monitor;

    @BeforeEach
    void setUp() {
        shell = new FakeShellTransport();
        events = new CopyOnWriteArrayList<>();
        AgentEventListener recorder = events::add;
        publisher = new AgentEventPublisher(List.of(recorder));
        monitor = newMonitor(Duration.ofSeconds(2));
    }

    @AfterEach
    void tearDown() {
        monitor.shutdown();
    }

    private ProgressMonitor newMonitor(Duration ceiling) {
        TerminalSession terminal = new TerminalSession(shell, new AgentProperties());
        return new ProgressMonitor(terminal, new InteractionClassifier(), publisher, Duration.ofMillis(10), ceiling, 5);
    }

    private List<Object> progressValues() {
        return events.stream()
            .filter(e -> e.getType() == AgentEventType.DOWNLOAD_PROGRESS)
            .map(e -> e.get("progress"))
            .collect(Collectors.toList());
    }

    @Test
    void shouldReportCompletionOnceAtHundredPercent() throws Exception {
        shell.emit("Downloading 10%\n", 0)
            .emit("Downloading 55%\n", 60)
            .emit("100% complete\n", 120);

        ProgressReport report = monitor.watch("s1", "t1", "wget file").get(5, TimeUnit.SECONDS);

        assertEquals(ProgressReport.Outcome.COMPLETED, report.getOutcome());
        assertEquals(List.of(10, 55, 100), progressValues());
        assertEquals(1, events.stream().filter(e -> e.getType() == AgentEventType.DOWNLOAD_COMPLETE).count());
        assertFalse(monitor.isActive());
    }

    @Test
    void shouldHandOffWhenPromptAppears() throws Exception {
        shell.emit("Downloading 30%\n", 0)
            .emit("Disk almost full. Continue? (y/n) ", 50);

        ProgressReport report = monitor.watch("s1", "t1", "apt-get upgrade").get(5, TimeUnit.SECONDS);

        assertEquals(ProgressReport.Outcome.HANDOFF, report.getOutcome());
        assertEquals(InteractionCategory.CONFIRMATION, report.getCategory());
        assertTrue(report.getOutput().contains("Continue?"));
        assertTrue(events.stream().noneMatch(e -> e.getType() == AgentEventType.DOWNLOAD_COMPLETE));
    }

    @Test
    void shouldTimeOutWithoutCompletion() throws Exception {
        monitor.shutdown();
        monitor = newMonitor(Duration.ofMillis(100));
        shell.emit("Downloading 20%\n", 0);

        ProgressReport report = monitor.watch("s1", "t1", "slow download").get(5, TimeUnit.SECONDS);

        assertEquals(ProgressReport.Outcome.TIMED_OUT, report.getOutcome());
        assertEquals(20, report.getLastPercent());
        assertTrue(events.stream().anyMatch(e -> e.getType() == AgentEventType.DOWNLOAD_TIMEOUT));
    }

    @Test
    void shouldStopWhenRequested() throws Exception {
        shell.emit("Downloading 5%\n", 0);

        CompletableFuture<ProgressReport> future = monitor.watch("s1", "t1", "big download");
        Thread.sleep(40);
        monitor.stop();

        assertEquals(ProgressReport.Outcome.STOPPED, future.get(5, TimeUnit.SECONDS).getOutcome());
    }

    @Test
    void shouldExtractLatestPercentOrFraction() {
        assertEquals(OptionalInt.of(75), ProgressMonitor.extractPercent("50% ... 75.5%"));
        assertEquals(OptionalInt.of(100), ProgressMonitor.extractPercent("120%"));
        assertEquals(OptionalInt.of(25), ProgressMonitor.extractPercent("Receiving objects: 10/40"));
        assertTrue(ProgressMonitor.extractPercent("no numbers").isEmpty());
    }
}
