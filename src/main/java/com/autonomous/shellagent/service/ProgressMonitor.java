package com.autonomous.shellagent.service;

import com.autonomous.shellagent.model.AgentEventType;
import com.autonomous.shellagent.model.InteractionCategory;
import com.autonomous.shellagent.model.ProgressReport;
import com.autonomous.shellagent.service.event.AgentEventPublisher;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Watches the output of one long-running command on its own thread until it completes, hits a prompt,
 * is stopped, or the ceiling passes.
 */
@Slf4j
public class ProgressMonitor {

    private static final Pattern PERCENT_PATTERN = Pattern.compile("(\\d{1,3})(?:\\.\\d+)?%");
    private static final Pattern FRACTION_PATTERN = Pattern.compile("\\b(\\d+)/(\\d+)\\b");

    private final TerminalSession terminal;
    private final InteractionClassifier classifier;
    private final AgentEventPublisher publisher;
    private final Duration pollInterval;
    private final Duration ceiling;
    private final int tailLines;
    private final ExecutorService watcher;
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final AtomicBoolean active = new AtomicBoolean(false);

    public ProgressMonitor(TerminalSession terminal,
                           InteractionClassifier classifier,
                           AgentEventPublisher publisher,
                           Duration pollInterval,
                           Duration ceiling,
                           int tailLines) {
        this.terminal = terminal;
        this.classifier = classifier;
        this.publisher = publisher;
        this.pollInterval = pollInterval;
        this.ceiling = ceiling;
        this.tailLines = tailLines;
        this.watcher = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "progress-monitor");
            thread.setDaemon(true);
            return thread;
        });
    }

    public CompletableFuture<ProgressReport> watch(String sessionId, String taskId, String command) {
        stopRequested.set(false);
        return CompletableFuture.supplyAsync(() -> poll(sessionId, taskId, command), watcher);
    }

    public void stop() {
        stopRequested.set(true);
    }

    public boolean isActive() {
        return active.get();
    }

    public void shutdown() {
        stop();
        watcher.shutdownNow();
    }

    private ProgressReport poll(String sessionId, String taskId, String command) {
        active.set(true);
        log.info("Monitoring progress of: {}", command);
        long deadline = System.nanoTime() + ceiling.toNanos();
        int polls = 0;
        int lastPercent = -1;
        try {
            while (System.nanoTime() < deadline) {
                if (!sleep() || stopRequested.get()) {
                    return ProgressReport.stopped(lastPercent, polls);
                }
                polls++;
                String output = terminal.readLatest();
                if (output.isEmpty()) {
                    continue;
                }
                publisher.publish(AgentEventType.COMMAND_OUTPUT, sessionId, taskId, Map.of("output", output));

                OptionalInt percent = extractPercent(output);
                if (percent.isPresent()) {
                    lastPercent = percent.getAsInt();
                    publisher.publish(AgentEventType.DOWNLOAD_PROGRESS, sessionId, taskId,
                        Map.of("progress", lastPercent, "command", command));
                }

                Optional<InteractionCategory> category = classifier.classifyTail(output, tailLines);
                if (category.isPresent() && !category.get().isInformational()) {
                    log.info("Prompt detected while monitoring {}: {}", command, category.get().getLabel());
                    return ProgressReport.handoff(category.get(), output, lastPercent, polls);
                }
                if (category.orElse(null) == InteractionCategory.COMPLETION || lastPercent >= 100) {
                    publisher.publish(AgentEventType.DOWNLOAD_COMPLETE, sessionId, taskId,
                        Map.of("command", command, "message", "Completed (100%)"));
                    return ProgressReport.completed(Math.max(lastPercent, 100), polls);
                }
            }
            log.warn("Progress monitor timed out after {} for: {}", ceiling, command);
            publisher.publish(AgentEventType.DOWNLOAD_TIMEOUT, sessionId, taskId, Map.of(
                "command", command,
                "message", "No completion seen within " + ceiling.toSeconds() + "s; the command may still be running"));
            return ProgressReport.timedOut(lastPercent, polls);
        } finally {
            active.set(false);
        }
    }

    private boolean sleep() {
        try {
            Thread.sleep(pollInterval.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Latest percentage in the output, or a fraction converted to one. Capped at 100.
     */
    static OptionalInt extractPercent(String output) {
        Matcher percent = PERCENT_PATTERN.matcher(output);
        Integer last = null;
        while (percent.find()) {
            last = Integer.parseInt(percent.group(1));
        }
        if (last != null) {
            return OptionalInt.of(Math.min(last, 100));
        }
        Matcher fraction = FRACTION_PATTERN.matcher(output);
        Integer fromFraction = null;
        while (fraction.find()) {
            try {
                long current = Long.parseLong(fraction.group(1));
                long total = Long.parseLong(fraction.group(2));
                if (total > 0 && current <= total) {
                    fromFraction = (int) (current * 100 / total);
                }
            } catch (NumberFormatException e) {
                log.debug("Ignoring oversized fraction {}", fraction.group());
            }
        }
        return fromFraction == null ? OptionalInt.empty() : OptionalInt.of(fromFraction);
    }
}
