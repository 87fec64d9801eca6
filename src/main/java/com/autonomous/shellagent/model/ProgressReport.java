package com.autonomous.shellagent.model;

import lombok.Value;

@Value
public class ProgressReport {

    public enum Outcome {
        COMPLETED,
        HANDOFF,
        TIMED_OUT,
        STOPPED
    }

    Outcome outcome;
    InteractionCategory category;  // set on HANDOFF
    String output;
    int lastPercent;
    int polls;

    public static ProgressReport completed(int percent, int polls) {
        return new ProgressReport(Outcome.COMPLETED, InteractionCategory.COMPLETION, null, percent, polls);
    }

    public static ProgressReport handoff(InteractionCategory category, String output, int percent, int polls) {
        return new ProgressReport(Outcome.HANDOFF, category, output, percent, polls);
    }

    public static ProgressReport timedOut(int percent, int polls) {
        return new ProgressReport(Outcome.TIMED_OUT, null, null, percent, polls);
    }

    public static ProgressReport stopped(int percent, int polls) {
        return new ProgressReport(Outcome.STOPPED, null, null, percent, polls);
    }
}
