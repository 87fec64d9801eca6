package com.autonomous.shellagent.service.decision;

import com.autonomous.shellagent.exception.AgentExecutionException;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Asks the Claude Code CLI in print mode. The system prompt and the prompt are written to its stdin.
 */
@Slf4j
@Service
public class ClaudeCliDecisionMaker implements DecisionMaker {

    private static final long OUTPUT_GRACE_SECONDS = 5;

    private final ExecutorService outputReader = Executors.newCachedThreadPool(r -> {
        Thread thread = new Thread(r, "decision-output-reader");
        thread.setDaemon(true);
        return thread;
    });

    @Value("${claude.code.path:claude}")
    private String claudeCodePath;

    @Value("${claude.model:sonnet}")
    private String model;

    @Value("${claude.code.timeout-seconds:120}")
    private long timeoutSeconds;

    public void setClaudeCodePath(String claudeCodePath) {
        this.claudeCodePath = claudeCodePath;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public void setTimeoutSeconds(long timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    @Override
    public String decide(String prompt, String systemPrompt) {
        List<String> command = buildCommand();
        ProcessBuilder pb = new ProcessBuilder(command);
        pb.redirectErrorStream(true);

        try {
            Process process = pb.start();
            CompletableFuture<String> output = CompletableFuture.supplyAsync(() -> readAll(process), outputReader);
            try (OutputStream stdin = process.getOutputStream()) {
                StringBuilder input = new StringBuilder();
                if (systemPrompt != null && !systemPrompt.isBlank()) {
                    input.append("System: ").append(systemPrompt).append("\n\n");
                }
                input.append(prompt);
                stdin.write(input.toString().getBytes(StandardCharsets.UTF_8));
            } catch (IOException e) {
                // exit code and output below explain an early exit better than the broken pipe
                log.debug("Could not write prompt to decision-maker: {}", e.getMessage());
            }

            boolean finished = process.waitFor(timeoutSeconds, TimeUnit.SECONDS);
            if (!finished) {
                process.destroyForcibly();
                output.cancel(true);
                log.warn("Decision-maker did not answer within {} seconds", timeoutSeconds);
                throw new AgentExecutionException("DECISION_TIMEOUT",
                    "Decision-maker timed out after " + timeoutSeconds + " seconds");
            }
            String reply = awaitOutput(output).trim();
            if (process.exitValue() != 0) {
                throw new AgentExecutionException("DECISION_FAILED",
                    "Decision-maker exited with " + process.exitValue() + ": " + reply);
            }
            log.debug("Decision-maker replied with {} chars", reply.length());
            return reply;

        } catch (IOException e) {
            throw new AgentExecutionException("DECISION_FAILED", "Failed to run decision-maker: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AgentExecutionException("INTERRUPTED", "Interrupted while waiting for decision-maker", e);
        }
    }

    private String awaitOutput(CompletableFuture<String> output) throws InterruptedException {
        try {
            // the process has exited; a child still holding stdout open must not stall the worker
            return output.get(OUTPUT_GRACE_SECONDS, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            output.cancel(true);
            throw new AgentExecutionException("DECISION_TIMEOUT", "Decision-maker output did not close after exit", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new AgentExecutionException("DECISION_FAILED", "Failed to read decision-maker output: " + cause.getMessage(), cause);
        }
    }

    private static String readAll(Process process) {
        StringBuilder output = new StringBuilder();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                output.append(line).append("\n");
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return output.toString();
    }

    @PreDestroy
    public void shutdown() {
        outputReader.shutdownNow();
    }

    List<String> buildCommand() {
        List<String> command = new ArrayList<>();
        command.add(claudeCodePath);
        command.add("--print");
        command.add("--model");
        command.add(mapModelName(model));
        return command;
    }

    String mapModelName(String shortName) {
        return switch (shortName.toLowerCase()) {
            case "opus" -> "claude-3-opus-20240229";
            case "haiku" -> "claude-3-haiku-20240307";
            default -> "claude-3-5-sonnet-20241022";
        };
    }
}
