package com.autonomous.shellagent.service.decision;

import com.autonomous.shellagent.exception.AgentExecutionException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ClaudeCliDecisionMakerTest {

    @TempDir
    Path tempDir;

    private ClaudeCliDecisionMaker decisionMaker;

    @BeforeEach
    void setUp() {
        decisionMaker = new ClaudeCliDecisionMaker();
        decisionMaker.setModel("sonnet");
        decisionMaker.setTimeoutSeconds(10);
    }

    @AfterEach
    void tearDown() {
        decisionMaker.shutdown();
    }

    private Path script(String body) throws Exception {
        Path script = tempDir.resolve("fake-claude.sh");
        Files.writeString(script, "#!/bin/sh\n" + body + "\n");
        assertTrue(script.toFile().setExecutable(true));
        return script;
    }

    @Test
    void shouldMapModelNames() {
        assertEquals("claude-3-opus-20240229", decisionMaker.mapModelName("opus"));
        assertEquals("claude-3-haiku-20240307", decisionMaker.mapModelName("HAIKU"));
        assertEquals("claude-3-5-sonnet-20241022", decisionMaker.mapModelName("sonnet"));
    }

    @Test
    void shouldBuildPrintCommand() {
        decisionMaker.setClaudeCodePath("/opt/claude");
        decisionMaker.setModel("opus");

        assertEquals(List.of("/opt/claude", "--print", "--model", "claude-3-opus-20240229"), decisionMaker.buildCommand());
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void shouldPassPromptOnStdinAndReturnReply() throws Exception {
        decisionMaker.setClaudeCodePath(script("cat").toString());

        String reply = decisionMaker.decide("Answer the prompt", "Be brief");

        assertEquals("System: Be brief\n\nAnswer the prompt", reply);
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void shouldFailOnNonZeroExit() throws Exception {
        decisionMaker.setClaudeCodePath(script("echo 'rate limited'; exit 3").toString());

        AgentExecutionException e = assertThrows(AgentExecutionException.class,
            () -> decisionMaker.decide("prompt", null));

        assertEquals("DECISION_FAILED", e.getErrorCode());
        assertTrue(e.getMessage().contains("rate limited"));
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void shouldTimeOutWhileCliIsStillRunning() throws Exception {
        decisionMaker.setClaudeCodePath(script("sleep 8\necho late").toString());
        decisionMaker.setTimeoutSeconds(1);

        long started = System.currentTimeMillis();
        AgentExecutionException e = assertThrows(AgentExecutionException.class,
            () -> decisionMaker.decide("prompt", null));

        assertEquals("DECISION_TIMEOUT", e.getErrorCode());
        assertTrue(System.currentTimeMillis() - started < 5000);
    }

    @Test
    void shouldFailWhenCliIsMissing() {
        decisionMaker.setClaudeCodePath(tempDir.resolve("missing-claude").toString());

        AgentExecutionException e = assertThrows(AgentExecutionException.class,
            () -> decisionMaker.decide("prompt", "system"));

        assertEquals("DECISION_FAILED", e.getErrorCode());
    }
}
