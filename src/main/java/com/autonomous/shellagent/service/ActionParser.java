package com.autonomous.shellagent.service;

import com.autonomous.shellagent.model.AgentAction;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Extracts actions from model text. Each marker form is scanned separately, so all RUN_COMMAND actions come
 * first, then SEND_KEYS, then WAIT; only the order within one form follows the text.
 * <p>
 * A match claims its span: a later form overlapping text an earlier form already matched is not an action,
 * so {@code RUN_COMMAND{echo WAIT{3}}} is one command. A RUN_COMMAND with blank content claims its span but
 * yields nothing.
 */
@Service
public class ActionParser {

    private static final Pattern RUN_COMMAND_PATTERN = Pattern.compile("RUN_COMMAND\\{([^}]+)\\}");
    private static final Pattern SEND_KEYS_PATTERN = Pattern.compile("SEND_KEYS\\{([^}]+)\\}");
    private static final Pattern WAIT_PATTERN = Pattern.compile("WAIT\\{([^}]+)\\}");

    private static final double DEFAULT_WAIT_SECONDS = 1.0;

    public List<AgentAction> parse(String text) {
        List<AgentAction> actions = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return actions;
        }
        List<int[]> claimed = new ArrayList<>();

        Matcher commands = RUN_COMMAND_PATTERN.matcher(text);
        while (commands.find()) {
            claimed.add(new int[]{commands.start(), commands.end()});
            String command = commands.group(1).trim();
            if (!command.isEmpty()) {
                actions.add(AgentAction.runCommand(command));
            }
        }

        List<int[]> keySpans = new ArrayList<>();
        Matcher keys = SEND_KEYS_PATTERN.matcher(text);
        while (keys.find()) {
            if (!overlaps(claimed, keys.start(), keys.end())) {
                keySpans.add(new int[]{keys.start(), keys.end()});
                actions.add(AgentAction.sendKeys(parseKeys(keys.group(1))));
            }
        }
        claimed.addAll(keySpans);

        Matcher waits = WAIT_PATTERN.matcher(text);
        while (waits.find()) {
            if (!overlaps(claimed, waits.start(), waits.end())) {
                actions.add(AgentAction.waitFor(parseSeconds(waits.group(1))));
            }
        }

        return actions;
    }

    public boolean hasActions(String text) {
        return !parse(text).isEmpty();
    }

    /**
     * Removes every marker, leaving the narration around them.
     */
    public String stripActions(String text) {
        if (text == null) {
            return "";
        }
        String stripped = RUN_COMMAND_PATTERN.matcher(text).replaceAll("");
        stripped = SEND_KEYS_PATTERN.matcher(stripped).replaceAll("");
        stripped = WAIT_PATTERN.matcher(stripped).replaceAll("");
        return stripped.trim();
    }

    private static boolean overlaps(List<int[]> spans, int start, int end) {
        for (int[] span : spans) {
            if (start < span[1] && end > span[0]) {
                return true;
            }
        }
        return false;
    }

    private List<String> parseKeys(String raw) {
        return Arrays.stream(raw.split(",", -1))
            .map(String::trim)
            .map(ActionParser::unquote)
            .collect(Collectors.toList());
    }

    private static String unquote(String token) {
        int start = 0;
        int end = token.length();
        while (start < end && isQuote(token.charAt(start))) {
            start++;
        }
        while (end > start && isQuote(token.charAt(end - 1))) {
            end--;
        }
        return token.substring(start, end);
    }

    private static boolean isQuote(char c) {
        return c == '"' || c == '\'';
    }

    private double parseSeconds(String raw) {
        try {
            double seconds = Double.parseDouble(raw.trim());
            return Double.isFinite(seconds) && seconds >= 0 ? seconds : DEFAULT_WAIT_SECONDS;
        } catch (NumberFormatException e) {
            return DEFAULT_WAIT_SECONDS;
        }
    }
}
