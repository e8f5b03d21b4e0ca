package com.cliniq.engine.dto;

import com.cliniq.engine.domain.ShiftType;
import com.cliniq.engine.domain.WeeklyShift;

import java.time.LocalTime;
import java.util.List;
import java.util.Map;

/**
 * Partial schedule change. Null fields keep their stored value; weekly cells not
 * listed keep their stored value.
 */
public record AvailabilityUpdateRequest(Integer appointmentDurationMin,
                                        Map<ShiftType, ShiftHours> shiftTemplates,
                                        List<WeeklyShift> weekly) {

    public record ShiftHours(LocalTime start, LocalTime end) {
    }
}
