package com.cliniq.engine.domain;

import java.time.LocalTime;

/**
 * An open interval [start, end) of a single shift on one calendar day.
 */
public record TimeWindow(ShiftType shiftType, LocalTime start, LocalTime end) {

    public boolean encloses(LocalTime from, LocalTime to) {
        return !from.isBefore(start) && !to.isAfter(end) && from.isBefore(to);
    }
}
