package com.cliniq.engine.dto;

import com.cliniq.engine.domain.QueuePriority;
import com.cliniq.engine.domain.QueueSource;
import com.cliniq.engine.domain.QueueStatus;
import com.cliniq.engine.entity.QueueEntry;

import java.time.Instant;
import java.time.LocalDate;

public record QueueEntryView(Long id, Long doctorId, LocalDate queueDate, int token, String patientRef,
                             QueueSource source, QueuePriority priority, QueueStatus status, Long slotId,
                             Long appointmentId, Instant checkedInAt, Instant calledAt, Instant completedAt) {

    public static QueueEntryView from(QueueEntry e) {
        return new QueueEntryView(e.getId(), e.getDoctor().getId(), e.getQueueDate(), e.getToken(),
                e.getPatientRef(), e.getSource(), e.getPriority(), e.getStatus(), e.getSlotId(),
                e.getAppointment() != null ? e.getAppointment().getId() : null,
                e.getCheckedInAt(), e.getCalledAt(), e.getCompletedAt());
    }
}
