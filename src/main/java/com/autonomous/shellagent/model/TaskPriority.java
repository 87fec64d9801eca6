package com.autonomous.shellagent.model;

/**
 * Queue priority. Lower rank runs first.
 */
public enum TaskPriority {
    URGENT(0),
    HIGH(1),
    MEDIUM(2),
    LOW(3);

    private final int rank;

    TaskPriority(int rank) {
        this.rank = rank;
    }

    public int getRank() {
        return rank;
    }

    public boolean isAheadOf(TaskPriority other) {
        return rank < other.rank;
    }
}
