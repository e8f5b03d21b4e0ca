package com.cliniq.engine.exception;

import com.cliniq.engine.domain.SlotConflict;

import java.util.List;

/**
 * A schedule change would invalidate booked slots and cancelling them was not authorized.
 * Always carries the complete, freshly computed conflict list.
 */
public class ConflictException extends EngineException {

    private final List<SlotConflict> conflicts;

    public ConflictException(List<SlotConflict> conflicts) {
        super("SCHEDULE_CONFLICT", "Schedule change would conflict with "
                + conflicts.size() + " booked appointment(s)");
        this.conflicts = List.copyOf(conflicts);
    }

    public List<SlotConflict> getConflicts() {
        return conflicts;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
