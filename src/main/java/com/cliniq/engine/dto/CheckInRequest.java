package com.cliniq.engine.dto;

import com.cliniq.engine.domain.QueuePriority;
import com.cliniq.engine.domain.QueueSource;

import java.time.LocalDate;

/**
 * {@code date} defaults to the clinic-local today and {@code priority} to NORMAL.
 */
public record CheckInRequest(Long doctorId, LocalDate date, String patientRef,
                             QueueSource source, QueuePriority priority, Long slotId) {
}
