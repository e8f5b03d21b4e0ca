package com.cliniq.engine.dto;

import com.cliniq.engine.domain.QueuePriority;
import com.cliniq.engine.domain.QueueStatus;

import java.time.LocalDate;

/**
 * Pull view of one entry. Position and wait are 0 once the entry is with the
 * doctor or closed; the wait is null while the doctor has no duration configured.
 */
public record QueueStatusView(Long entryId,
                              Long doctorId,
                              LocalDate queueDate,
                              int token,
                              int position,
                              int peopleAhead,
                              Integer estimatedWaitMinutes,
                              boolean doctorAvailable,
                              QueueStatus entryStatus,
                              QueuePriority priority) {
}
