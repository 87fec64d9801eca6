package com.autonomous.shellagent.service;

import com.autonomous.shellagent.exception.AgentExecutionException;

import java.time.Duration;
import java.util.function.BooleanSupplier;

final class Pauses {

    private static final long SLICE_MILLIS = 50;

    private Pauses() {
    }

    /**
     * Sleeps the calling worker. An interrupt is restored and surfaced as a task failure.
     */
    static void pause(Duration duration) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            return;
        }
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AgentExecutionException("INTERRUPTED", "Interrupted while waiting", e);
        }
    }

    /**
     * Sleeps in short slices, returning early once {@code stopRequested} reports true.
     *
     * @return true when the pause ended because of a stop request
     */
    static boolean pause(Duration duration, BooleanSupplier stopRequested) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            return stopRequested.getAsBoolean();
        }
        long deadline = System.nanoTime() + duration.toNanos();
        while (!stopRequested.getAsBoolean()) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return false;
            }
            pause(Duration.ofNanos(Math.min(remaining, SLICE_MILLIS * 1_000_000L)));
        }
        return true;
    }
}
