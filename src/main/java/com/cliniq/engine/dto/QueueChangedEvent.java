package com.cliniq.engine.dto;

import com.cliniq.engine.domain.QueueStatus;

import java.time.LocalDate;

/**
 * Published after a queue mutation. Listeners receive it once the transaction commits.
 */
public record QueueChangedEvent(Long doctorId, LocalDate queueDate, Long entryId, int token, QueueStatus status) {
}
