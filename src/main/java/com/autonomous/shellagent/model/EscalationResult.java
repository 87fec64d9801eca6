package com.autonomous.shellagent.model;

import lombok.Value;

@Value
public class EscalationResult {

    public enum Outcome {
        RESOLVED,
        ESCALATE,
        EXHAUSTED
    }

    Outcome outcome;
    InteractionCategory category;

    public static EscalationResult resolved() {
        return new EscalationResult(Outcome.RESOLVED, null);
    }

    public static EscalationResult escalate(InteractionCategory category) {
        return new EscalationResult(Outcome.ESCALATE, category);
    }

    public static EscalationResult exhausted(InteractionCategory category) {
        return new EscalationResult(Outcome.EXHAUSTED, category);
    }
}
