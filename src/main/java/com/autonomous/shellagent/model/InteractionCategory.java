package com.autonomous.shellagent.model;

/**
 * Classification of terminal output that may need a response before the command can progress.
 * An empty default response means the caller has to escalate instead of answering.
 */
public enum InteractionCategory {
    CONFIRMATION("confirmation", "y\n"),
    CONTINUATION("continuation", "\n"),
    CREDENTIAL("credential", ""),
    INSTALL_PROMPT("install_prompt", "y\n"),
    PROGRESS("progress", ""),
    COMPLETION("completion", "");

    private final String label;
    private final String defaultResponse;

    InteractionCategory(String label, String defaultResponse) {
        this.label = label;
        this.defaultResponse = defaultResponse;
    }

    public String getLabel() {
        return label;
    }

    public String getDefaultResponse() {
        return defaultResponse;
    }

    public boolean hasDefaultResponse() {
        return !defaultResponse.isEmpty();
    }

    public boolean isInformational() {
        return this == PROGRESS || this == COMPLETION;
    }
}
