package com.cliniq.engine.service;

import com.cliniq.engine.domain.QueuePriority;
import com.cliniq.engine.domain.QueueSource;
import com.cliniq.engine.domain.QueueStatus;
import com.cliniq.engine.dto.QueueChangedEvent;
import com.cliniq.engine.entity.Appointment;
import com.cliniq.engine.entity.AppointmentSlot;
import com.cliniq.engine.entity.QueueDay;
import com.cliniq.engine.entity.QueueEntry;
import com.cliniq.engine.exception.ConcurrencyException;
import com.cliniq.engine.exception.NotFoundException;
import com.cliniq.engine.exception.StateException;
import com.cliniq.engine.exception.ValidationException;
import com.cliniq.engine.repository.AppointmentRepository;
import com.cliniq.engine.repository.AppointmentSlotRepository;
import com.cliniq.engine.repository.DoctorRepository;
import com.cliniq.engine.repository.QueueDayRepository;
import com.cliniq.engine.repository.QueueEntryRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.EnumSet;
import java.util.List;

/**
 * Issues the next token of a queue day. The queue-day row lock is held from the
 * max-token read until the insert commits, so tokens of one day are dense and unique.
 * <p>
 * APPOINTMENT check-ins first take the doctor row with a shared lock, so they serialize
 * against schedule commits: lock order doctor, queue day, appointment, slot.
 */
@Component
@RequiredArgsConstructor
public class TokenIssuer {

    private static final Logger log = LoggerFactory.getLogger(TokenIssuer.class);

    private final DoctorRepository doctorRepository;
    private final QueueDayRepository queueDayRepository;
    private final QueueEntryRepository queueEntryRepository;
    private final AppointmentSlotRepository slotRepository;
    private final AppointmentRepository appointmentRepository;
    private final ClinicTimeService clinicTime;
    private final ApplicationEventPublisher eventPublisher;

    @Transactional
    public QueueEntry issue(Long doctorId, LocalDate date, String patientRef,
                            QueueSource source, QueuePriority priority, Long slotId) {
        if (source == QueueSource.APPOINTMENT) {
            doctorRepository.findByIdForShare(doctorId)
                    .orElseThrow(() -> NotFoundException.of("Doctor", doctorId));
        }
        QueueDay day = queueDayRepository.lock(doctorId, date)
                .orElseThrow(() -> new ConcurrencyException(
                        "Queue for doctor " + doctorId + " on " + date + " is not open yet", null));

        Appointment appointment = null;
        if (source == QueueSource.APPOINTMENT) {
            appointment = claimSlot(doctorId, date, slotId);
        }

        int token = queueEntryRepository.findMaxToken(doctorId, date) + 1;
        QueueEntry entry = QueueEntry.builder()
                .doctor(day.getDoctor())
                .queueDate(date)
                .token(token)
                .patientRef(patientRef)
                .source(source)
                .priority(priority)
                .status(QueueStatus.QUEUED)
                .slotId(source == QueueSource.APPOINTMENT ? slotId : null)
                .appointment(appointment)
                .checkedInAt(clinicTime.now())
                .build();
        try {
            entry = queueEntryRepository.saveAndFlush(entry);
        } catch (DataIntegrityViolationException e) {
            throw new ConcurrencyException("Token " + token + " for doctor " + doctorId + " on " + date
                    + " was taken concurrently", e);
        }

        log.info("Issued token {} to {} for doctor {} on {} (source={}, priority={})",
                token, patientRef, doctorId, date, source, priority);
        eventPublisher.publishEvent(new QueueChangedEvent(doctorId, date, entry.getId(), token, entry.getStatus()));
        return entry;
    }

    /**
     * Validates the slot of an APPOINTMENT check-in and moves its appointment to
     * CHECKED_IN. Locks the appointment before the slot.
     */
    private Appointment claimSlot(Long doctorId, LocalDate date, Long slotId) {
        List<Long> appointmentIds = appointmentRepository.findIdsBySlotIdAndStatusIn(slotId,
                EnumSet.of(Appointment.Status.BOOKED, Appointment.Status.CHECKED_IN));
        Appointment appointment = null;
        if (!appointmentIds.isEmpty()) {
            appointment = appointmentRepository.findByIdForUpdate(appointmentIds.get(0))
                    .orElseThrow(() -> NotFoundException.of("Appointment", appointmentIds.get(0)));
        }

        AppointmentSlot slot = slotRepository.findByIdForUpdate(slotId)
                .orElseThrow(() -> NotFoundException.of("Slot", slotId));
        if (!slot.getDoctor().getId().equals(doctorId) || !slot.getSlotDate().isEqual(date)) {
            throw new ValidationException("Slot " + slotId + " does not belong to doctor " + doctorId + " on " + date);
        }
        if (slot.getStatus() != AppointmentSlot.Status.BOOKED) {
            throw new StateException("Slot " + slotId + " is not booked");
        }
        if (queueEntryRepository.existsBySlotIdAndStatusNot(slotId, QueueStatus.CANCELLED)) {
            throw new StateException("Slot " + slotId + " is already checked in");
        }

        if (appointment != null) {
            if (appointment.getSlot() == null || !slotId.equals(appointment.getSlot().getId())
                    || (appointment.getStatus() != Appointment.Status.BOOKED
                    && appointment.getStatus() != Appointment.Status.CHECKED_IN)) {
                throw new StateException("Appointment " + appointment.getId() + " is no longer active");
            }
            appointment.setStatus(Appointment.Status.CHECKED_IN);
            appointmentRepository.save(appointment);
        }
        return appointment;
    }
}
