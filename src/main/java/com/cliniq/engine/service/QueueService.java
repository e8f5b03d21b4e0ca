package com.cliniq.engine.service;

import com.cliniq.engine.domain.QueuePriority;
import com.cliniq.engine.domain.QueueSource;
import com.cliniq.engine.domain.QueueStatus;
import com.cliniq.engine.dto.CheckInRequest;
import com.cliniq.engine.dto.QueueChangedEvent;
import com.cliniq.engine.entity.Appointment;
import com.cliniq.engine.entity.Doctor;
import com.cliniq.engine.entity.DoctorDailyCheckIn;
import com.cliniq.engine.entity.QueueEntry;
import com.cliniq.engine.exception.NotFoundException;
import com.cliniq.engine.exception.StateException;
import com.cliniq.engine.exception.ValidationException;
import com.cliniq.engine.repository.AppointmentRepository;
import com.cliniq.engine.repository.DoctorDailyCheckInRepository;
import com.cliniq.engine.repository.DoctorRepository;
import com.cliniq.engine.repository.QueueDayRepository;
import com.cliniq.engine.repository.QueueEntryRepository;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Queue writes: check-in, status transitions and doctor presence.
 */
@Service
@RequiredArgsConstructor
public class QueueService {

    private static final Logger log = LoggerFactory.getLogger(QueueService.class);

    private final DoctorRepository doctorRepository;
    private final QueueEntryRepository queueEntryRepository;
    private final QueueDayRepository queueDayRepository;
    private final AppointmentRepository appointmentRepository;
    private final DoctorDailyCheckInRepository checkInRepository;
    private final QueueDayProvisioner queueDayProvisioner;
    private final TokenIssuer tokenIssuer;
    private final ClinicTimeService clinicTime;
    private final ApplicationEventPublisher eventPublisher;

    // =========================================================
    // CHECK-IN
    // =========================================================

    /**
     * Not transactional itself: the queue-day anchor is provisioned first in its own
     * transaction, then the token is issued in another one.
     */
    public QueueEntry checkIn(CheckInRequest request) {
        if (request == null || request.doctorId() == null) {
            throw new ValidationException("doctorId is required");
        }
        if (StringUtils.isBlank(request.patientRef())) {
            throw new ValidationException("patientRef is required");
        }
        if (request.source() == null) {
            throw new ValidationException("source is required");
        }
        if (request.source() == QueueSource.APPOINTMENT && request.slotId() == null) {
            throw new ValidationException("slotId is required for APPOINTMENT check-ins");
        }
        if (request.source() == QueueSource.WALKIN && request.slotId() != null) {
            throw new ValidationException("Walk-ins cannot carry a slotId");
        }

        Doctor doctor = doctorRepository.findById(request.doctorId())
                .orElseThrow(() -> NotFoundException.of("Doctor", request.doctorId()));
        LocalDate today = clinicTime.today(doctor);
        LocalDate date = request.date() != null ? request.date() : today;
        if (date.isBefore(today)) {
            throw new ValidationException("Cannot check in for a past date: " + date);
        }
        QueuePriority priority = request.priority() != null ? request.priority() : QueuePriority.NORMAL;

        ensureQueueDay(doctor.getId(), date);
        return tokenIssuer.issue(doctor.getId(), date, request.patientRef().trim(),
                request.source(), priority, request.slotId());
    }

    private void ensureQueueDay(Long doctorId, LocalDate date) {
        if (queueDayRepository.findByDoctorIdAndQueueDate(doctorId, date).isPresent()) {
            return;
        }
        try {
            queueDayProvisioner.create(doctorId, date);
        } catch (DataIntegrityViolationException e) {
            log.debug("Queue day for doctor {} on {} was opened concurrently", doctorId, date);
        }
    }

    // =========================================================
    // STATUS TRANSITIONS
    // =========================================================
    @Transactional
    public QueueEntry transition(Long entryId, QueueStatus newStatus) {
        if (newStatus == null) {
            throw new ValidationException("status is required");
        }
        Long doctorId = queueEntryRepository.findDoctorIdById(entryId)
                .orElseThrow(() -> NotFoundException.of("Queue entry", entryId));
        if (newStatus == QueueStatus.WITH_DOCTOR) {
            doctorRepository.findByIdForUpdate(doctorId)
                    .orElseThrow(() -> NotFoundException.of("Doctor", doctorId));
        }

        QueueEntry entry = queueEntryRepository.findByIdForUpdate(entryId)
                .orElseThrow(() -> NotFoundException.of("Queue entry", entryId));
        QueueStatus current = entry.getStatus();
        if (!current.canTransitionTo(newStatus)) {
            throw new StateException("Cannot move entry " + entryId + " from " + current + " to " + newStatus
                    + "; allowed: " + current.allowedNext());
        }

        Instant now = clinicTime.now();
        if (newStatus == QueueStatus.WITH_DOCTOR) {
            queueEntryRepository.findFirstByDoctorIdAndStatus(doctorId, QueueStatus.WITH_DOCTOR)
                    .filter(other -> !other.getId().equals(entryId))
                    .ifPresent(other -> {
                        throw new StateException("Doctor " + doctorId + " is already with token "
                                + other.getToken() + " (entry " + other.getId() + ")");
                    });
            entry.setCalledAt(now);
        }
        if (newStatus.isTerminal()) {
            entry.setCompletedAt(now);
        }
        entry.setStatus(newStatus);
        queueEntryRepository.save(entry);
        cascadeToAppointment(entry, newStatus);

        log.info("Queue entry {} (doctor {}, token {}) {} -> {}",
                entryId, doctorId, entry.getToken(), current, newStatus);
        eventPublisher.publishEvent(new QueueChangedEvent(doctorId, entry.getQueueDate(), entryId,
                entry.getToken(), newStatus));
        return entry;
    }

    private void cascadeToAppointment(QueueEntry entry, QueueStatus newStatus) {
        Appointment.Status target = switch (newStatus) {
            case COMPLETED -> Appointment.Status.COMPLETED;
            case NO_SHOW -> Appointment.Status.NO_SHOW;
            default -> null;
        };
        if (target == null || entry.getAppointment() == null) {
            return;
        }
        Long appointmentId = entry.getAppointment().getId();
        Appointment appointment = appointmentRepository.findByIdForUpdate(appointmentId)
                .orElseThrow(() -> NotFoundException.of("Appointment", appointmentId));
        if (appointment.getStatus() == Appointment.Status.CHECKED_IN
                || appointment.getStatus() == Appointment.Status.BOOKED) {
            appointment.setStatus(target);
            appointmentRepository.save(appointment);
        }
    }

    // =========================================================
    // DOCTOR PRESENCE
    // =========================================================

    /** Idempotent while checked in; re-opens the day after a check-out. */
    @Transactional
    public DoctorDailyCheckIn doctorCheckIn(Long doctorId) {
        Doctor doctor = doctorRepository.findByIdForUpdate(doctorId)
                .orElseThrow(() -> NotFoundException.of("Doctor", doctorId));
        LocalDate today = clinicTime.today(doctor);
        Optional<DoctorDailyCheckIn> existing = checkInRepository.findByDoctorIdAndCheckInDate(doctorId, today);
        if (existing.isPresent() && existing.get().isActive()) {
            return existing.get();
        }
        DoctorDailyCheckIn row = existing.orElseGet(() -> DoctorDailyCheckIn.builder()
                .doctor(doctor)
                .checkInDate(today)
                .build());
        row.setCheckedInAt(clinicTime.now());
        row.setCheckedOutAt(null);
        row = checkInRepository.save(row);
        log.info("Doctor {} checked in for {}", doctorId, today);
        return row;
    }

    @Transactional
    public DoctorDailyCheckIn doctorCheckOut(Long doctorId) {
        Doctor doctor = doctorRepository.findByIdForUpdate(doctorId)
                .orElseThrow(() -> NotFoundException.of("Doctor", doctorId));
        LocalDate today = clinicTime.today(doctor);
        DoctorDailyCheckIn row = checkInRepository.findByDoctorIdAndCheckInDate(doctorId, today)
                .filter(DoctorDailyCheckIn::isActive)
                .orElseThrow(() -> new StateException("Doctor " + doctorId + " is not checked in today"));
        row.setCheckedOutAt(clinicTime.now());
        log.info("Doctor {} checked out for {}", doctorId, today);
        return checkInRepository.save(row);
    }

    @Transactional(readOnly = true)
    public boolean hasActiveCheckInToday(Long doctorId) {
        Doctor doctor = doctorRepository.findById(doctorId)
                .orElseThrow(() -> NotFoundException.of("Doctor", doctorId));
        return checkInRepository.findByDoctorIdAndCheckInDate(doctorId, clinicTime.today(doctor))
                .map(DoctorDailyCheckIn::isActive)
                .orElse(false);
    }
}
