package com.cliniq.engine.domain;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * A slot-sized interval cut from a {@link TimeWindow}, before it is persisted.
 */
public record SlotWindow(LocalDate date, ShiftType shiftType, LocalTime start, LocalTime end) {

    public boolean overlaps(LocalTime otherStart, LocalTime otherEnd) {
        return start.isBefore(otherEnd) && otherStart.isBefore(end);
    }
}
