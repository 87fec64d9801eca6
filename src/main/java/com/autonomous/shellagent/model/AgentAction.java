package com.autonomous.shellagent.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * One atomic instruction extracted from model text. Equality ignores the creation time.
 */
@Value
@Builder
public class AgentAction {
    ActionKind kind;
    String command;
    @Builder.Default
    List<String> keys = List.of();
    double waitSeconds;
    @Builder.Default
    @EqualsAndHashCode.Exclude
    Instant createdAt = Instant.now();

    public static AgentAction runCommand(String command) {
        return AgentAction.builder().kind(ActionKind.RUN_COMMAND).command(command).build();
    }

    public static AgentAction sendKeys(List<String> keys) {
        return AgentAction.builder().kind(ActionKind.SEND_KEYS).keys(List.copyOf(keys)).build();
    }

    public static AgentAction waitFor(double seconds) {
        return AgentAction.builder().kind(ActionKind.WAIT).waitSeconds(seconds).build();
    }

    /**
     * The payload as stored on a task for duplicate detection. Keys are joined on the parser's token
     * separator, which no token can contain.
     */
    public String payload() {
        return switch (kind) {
            case RUN_COMMAND -> command;
            case SEND_KEYS -> String.join(",", keys);
            case WAIT -> String.valueOf(waitSeconds);
        };
    }

    /**
     * Rebuilds the marker this action would be parsed from.
     */
    public String toMarker() {
        return switch (kind) {
            case RUN_COMMAND -> "RUN_COMMAND{" + command + "}";
            case SEND_KEYS -> keys.stream()
                .map(key -> "\"" + key + "\"")
                .collect(Collectors.joining(",", "SEND_KEYS{", "}"));
            case WAIT -> "WAIT{" + waitSeconds + "}";
        };
    }

    public String describe() {
        return switch (kind) {
            case RUN_COMMAND -> command;
            case SEND_KEYS -> "keys: " + String.join(" + ", keys);
            case WAIT -> "wait " + waitSeconds + "s";
        };
    }
}
