package com.cliniq.engine.domain;

/**
 * Priority tier. Higher rank is called first; tokens are never renumbered.
 */
public enum QueuePriority {
    NORMAL(0),
    URGENT(1),
    EMERGENCY(2);

    private final int rank;

    QueuePriority(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }
}
