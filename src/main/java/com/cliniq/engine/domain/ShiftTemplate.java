package com.cliniq.engine.domain;

import java.time.LocalTime;

public record ShiftTemplate(ShiftType shiftType, LocalTime start, LocalTime end) {

    public boolean overlaps(ShiftTemplate other) {
        return start.isBefore(other.end) && other.start.isBefore(end);
    }

    public TimeWindow toWindow() {
        return new TimeWindow(shiftType, start, end);
    }
}
