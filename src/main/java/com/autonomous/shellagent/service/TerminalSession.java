package com.autonomous.shellagent.service;

import com.autonomous.shellagent.config.AgentProperties;
import com.autonomous.shellagent.exception.ShellTransportException;
import com.autonomous.shellagent.service.shell.ShellTransport;
import lombok.extern.slf4j.Slf4j;

import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * Command-level view of a shell transport.
 * <p>
 * Command output is captured until no new output arrives for the quiescence window, or until the capture
 * ceiling passes. This is a heuristic: a slow command that pauses longer than the window is reported as
 * finished while it is still running.
 */
@Slf4j
public class TerminalSession {

    private final ShellTransport transport;
    private final AgentProperties properties;

    public TerminalSession(ShellTransport transport, AgentProperties properties) {
        this.transport = transport;
        this.properties = properties;
    }

    public String runCommand(String command, Consumer<String> onChunk, BooleanSupplier stopRequested) {
        ensureConnected();
        log.debug("Sending command: {}", command);
        transport.send(command + "\n");

        StringBuilder output = new StringBuilder();
        long quiescenceNanos = properties.getQuiescence().toNanos();
        long deadline = System.nanoTime() + properties.getCommandCeiling().toNanos();
        long lastOutput = System.nanoTime();

        while (!stopRequested.getAsBoolean()) {
            String chunk = transport.readAvailable();
            long now = System.nanoTime();
            if (!chunk.isEmpty()) {
                output.append(chunk);
                onChunk.accept(chunk);
                lastOutput = now;
            } else if (now - lastOutput >= quiescenceNanos) {
                break;
            }
            if (now >= deadline) {
                log.debug("Capture ceiling reached for: {}", command);
                break;
            }
            Pauses.pause(properties.getReadPollInterval());
        }
        return output.toString();
    }

    public String sendKeys(String sequence) {
        ensureConnected();
        transport.send(sequence);
        Pauses.pause(properties.getKeySettle());
        return transport.readAvailable();
    }

    public String readLatest() {
        if (!transport.isConnected()) {
            return "";
        }
        return transport.readAvailable();
    }

    public void interrupt() {
        if (transport.isConnected()) {
            transport.send(KeySequenceTranslator.INTERRUPT);
        }
    }

    public boolean isConnected() {
        return transport.isConnected();
    }

    public void close() {
        transport.close();
    }

    private void ensureConnected() {
        if (!transport.isConnected()) {
            throw new ShellTransportException("Shell connection is not established");
        }
    }
}
