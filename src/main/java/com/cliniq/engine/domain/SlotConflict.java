package com.cliniq.engine.domain;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * A booked slot that a candidate availability model would invalidate.
 */
public record SlotConflict(
        Long slotId,
        Long appointmentId,
        String patientRef,
        LocalDate date,
        LocalTime startTime,
        LocalTime endTime,
        ShiftType shiftType,
        ConflictReason reason,
        String detail
) {
}
