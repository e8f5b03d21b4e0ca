package com.cliniq.engine.domain;

import java.util.EnumSet;
import java.util.Set;

/**
 * Queue entry lifecycle. COMPLETED, CANCELLED and NO_SHOW are terminal.
 */
public enum QueueStatus {
    QUEUED,
    WAITING,
    WITH_DOCTOR,
    COMPLETED,
    CANCELLED,
    NO_SHOW;

    public boolean canTransitionTo(QueueStatus next) {
        return allowedNext().contains(next);
    }

    public Set<QueueStatus> allowedNext() {
        return switch (this) {
            case QUEUED -> EnumSet.of(WAITING, CANCELLED);
            case WAITING -> EnumSet.of(WITH_DOCTOR, CANCELLED, NO_SHOW);
            case WITH_DOCTOR -> EnumSet.of(COMPLETED);
            case COMPLETED, CANCELLED, NO_SHOW -> EnumSet.noneOf(QueueStatus.class);
        };
    }

    public boolean isTerminal() {
        return allowedNext().isEmpty();
    }

    /** Counted when computing positions. */
    public boolean isWaiting() {
        return this == QUEUED || this == WAITING;
    }
}
