package com.autonomous.shellagent.service.shell;

import com.autonomous.shellagent.exception.ShellTransportException;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Runs the shell as a child process. A reader thread drains its merged stdout/stderr into a buffer that
 * {@link #readAvailable()} empties.
 */
@Slf4j
public class LocalProcessShellTransport implements ShellTransport {

    private final Process process;
    private final OutputStream stdin;
    private final StringBuilder buffer = new StringBuilder();
    private final Thread reader;

    public LocalProcessShellTransport(List<String> command, String workingDirectory, Map<String, String> environment) {
        ProcessBuilder pb = new ProcessBuilder(command);
        if (workingDirectory != null && !workingDirectory.isBlank()) {
            pb.directory(new File(workingDirectory));
        }
        if (environment != null) {
            pb.environment().putAll(environment);
        }
        pb.redirectErrorStream(true);

        try {
            this.process = pb.start();
        } catch (IOException e) {
            throw new ShellTransportException("Failed to start shell " + command + ": " + e.getMessage(), e);
        }
        this.stdin = process.getOutputStream();
        this.reader = new Thread(() -> drain(process.getInputStream()), "shell-reader-" + process.pid());
        this.reader.setDaemon(true);
        this.reader.start();
        log.info("Started local shell {} (pid {})", command, process.pid());
    }

    @Override
    public synchronized void send(String data) {
        if (!isConnected()) {
            throw new ShellTransportException("Shell is not running");
        }
        try {
            stdin.write(data.getBytes(StandardCharsets.UTF_8));
            stdin.flush();
        } catch (IOException e) {
            throw new ShellTransportException("Failed to write to shell: " + e.getMessage(), e);
        }
    }

    @Override
    public String readAvailable() {
        String raw;
        synchronized (buffer) {
            raw = buffer.toString();
            buffer.setLength(0);
        }
        return AnsiCleaner.clean(raw);
    }

    @Override
    public boolean isConnected() {
        return process.isAlive();
    }

    @Override
    public void close() {
        process.destroy();
        try {
            if (!process.waitFor(1, TimeUnit.SECONDS)) {
                process.destroyForcibly().waitFor(1, TimeUnit.SECONDS);
            }
            reader.join(1000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
        }
        log.info("Closed local shell (pid {})", process.pid());
    }

    private void drain(InputStream in) {
        char[] chunk = new char[1024];
        try (Reader stream = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            int n;
            while ((n = stream.read(chunk)) != -1) {
                synchronized (buffer) {
                    buffer.append(chunk, 0, n);
                }
            }
        } catch (IOException e) {
            log.debug("Shell output stream closed: {}", e.getMessage());
        }
    }
}
