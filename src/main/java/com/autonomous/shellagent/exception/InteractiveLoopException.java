package com.autonomous.shellagent.exception;

import com.autonomous.shellagent.model.InteractionCategory;

/**
 * Thrown when the remote side keeps prompting past the configured escalation depth.
 */
public class InteractiveLoopException extends AgentExecutionException {

    public static final String ERROR_CODE = "INTERACTIVE_LOOP";

    public InteractiveLoopException(InteractionCategory category, int depth) {
        super(ERROR_CODE, String.format(
            "Task stuck in interactive loop: %s prompt still pending after %d escalations",
            category == null ? "unknown" : category.getLabel(), depth
        ));
    }
}
