package com.autonomous.shellagent.service;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns key tokens into the bytes a terminal expects. A bare {@code ctrl} or {@code alt} token modifies the
 * single-character token after it. Unknown tokens are sent as typed.
 */
@Component
public class KeySequenceTranslator {

    public static final String INTERRUPT = "\u0003";

    private static final Map<String, String> KEYS = Map.ofEntries(
        Map.entry("enter", "\r"),
        Map.entry("return", "\r"),
        Map.entry("tab", "\t"),
        Map.entry("space", " "),
        Map.entry("escape", "\u001b"),
        Map.entry("esc", "\u001b"),
        Map.entry("backspace", "\b"),
        Map.entry("delete", "\u007f"),
        Map.entry("up", "\u001b[A"),
        Map.entry("down", "\u001b[B"),
        Map.entry("right", "\u001b[C"),
        Map.entry("left", "\u001b[D")
    );

    public String translate(List<String> tokens) {
        StringBuilder sequence = new StringBuilder();
        String modifier = null;
        for (String token : tokens) {
            String key = token.trim().toLowerCase(Locale.ROOT);
            if (modifier != null && token.length() == 1) {
                sequence.append(applyModifier(modifier, token.charAt(0)));
                modifier = null;
                continue;
            }
            if (modifier != null) {
                sequence.append(modifier);
                modifier = null;
            }
            if (key.equals("ctrl") || key.equals("alt")) {
                modifier = key;
            } else if (KEYS.containsKey(key)) {
                sequence.append(KEYS.get(key));
            } else if (key.length() == 6 && (key.startsWith("ctrl+") || key.startsWith("ctrl-"))) {
                sequence.append(applyModifier("ctrl", key.charAt(5)));
            } else if (key.length() == 5 && (key.startsWith("alt+") || key.startsWith("alt-"))) {
                sequence.append(applyModifier("alt", token.trim().charAt(4)));
            } else {
                sequence.append(token);
            }
        }
        if (modifier != null) {
            sequence.append(modifier);
        }
        return sequence.toString();
    }

    private static String applyModifier(String modifier, char c) {
        if (modifier.equals("alt")) {
            return "\u001b" + c;
        }
        char lower = Character.toLowerCase(c);
        if (lower >= 'a' && lower <= 'z') {
            return String.valueOf((char) (lower - 'a' + 1));
        }
        return switch (lower) {
            case '[' -> "\u001b";
            case '\\' -> "\u001c";
            case ']' -> "\u001d";
            default -> "ctrl" + c;
        };
    }
}
