package com.cliniq.engine.domain;

/**
 * One cell of the fixed weekly table: dayOfWeek 0 = Sunday .. 6 = Saturday.
 */
public record WeeklyShift(int dayOfWeek, ShiftType shiftType, boolean enabled) {
}
