package com.autonomous.shellagent.service.shell;

import java.util.regex.Pattern;

public final class AnsiCleaner {

    private static final Pattern ANSI_ESCAPE = Pattern.compile("\\x1B(?:[@-Z\\\\-_]|\\[[0-?]*[ -/]*[@-~])");
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");

    private AnsiCleaner() {
    }

    /**
     * Removes escape sequences and control characters, keeping newlines, carriage returns and tabs.
     */
    public static String clean(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String cleaned = ANSI_ESCAPE.matcher(text).replaceAll("");
        return CONTROL_CHARS.matcher(cleaned).replaceAll("");
    }
}
