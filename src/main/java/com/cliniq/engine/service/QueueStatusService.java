package com.cliniq.engine.service;

import com.cliniq.engine.domain.QueueStatus;
import com.cliniq.engine.dto.QueueEntryView;
import com.cliniq.engine.dto.QueueStatusView;
import com.cliniq.engine.entity.Doctor;
import com.cliniq.engine.entity.QueueEntry;
import com.cliniq.engine.exception.NotFoundException;
import com.cliniq.engine.repository.DoctorRepository;
import com.cliniq.engine.repository.QueueEntryRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;

/**
 * Pull-side queue queries. Results may be a poll interval stale.
 */
@Service
@RequiredArgsConstructor
public class QueueStatusService {

    private static final Logger log = LoggerFactory.getLogger(QueueStatusService.class);

    private final DoctorRepository doctorRepository;
    private final QueueEntryRepository queueEntryRepository;
    private final QueueService queueService;
    private final ClinicTimeService clinicTime;

    @Transactional(readOnly = true)
    public QueueStatusView queueStatus(Long entryId) {
        QueueEntry entry = queueEntryRepository.findById(entryId)
                .orElseThrow(() -> NotFoundException.of("Queue entry", entryId));
        return toStatus(entry);
    }

    @Transactional(readOnly = true)
    public QueueStatusView queueStatus(Long doctorId, LocalDate date, int token) {
        LocalDate day = date != null ? date : clinicTime.today(findDoctor(doctorId));
        QueueEntry entry = queueEntryRepository.findByDoctorIdAndQueueDateAndToken(doctorId, day, token)
                .orElseThrow(() -> new NotFoundException("Token " + token + " not found for doctor "
                        + doctorId + " on " + day));
        return toStatus(entry);
    }

    @Transactional(readOnly = true)
    public List<QueueEntryView> listQueue(Long doctorId, LocalDate date) {
        Doctor doctor = findDoctor(doctorId);
        LocalDate day = date != null ? date : clinicTime.today(doctor);
        List<QueueEntry> entries = queueEntryRepository.findByDoctorIdAndQueueDateOrderByTokenAsc(doctorId, day);
        log.debug("Listing {} queue entries for doctor {} on {}", entries.size(), doctorId, day);
        return QueuePositionCalculator.displayOrder(entries).stream()
                .map(QueueEntryView::from)
                .toList();
    }

    /** Checked in today and nobody is with the doctor. */
    @Transactional(readOnly = true)
    public boolean doctorAvailable(Long doctorId) {
        return queueService.hasActiveCheckInToday(doctorId)
                && !queueEntryRepository.existsByDoctorIdAndStatus(doctorId, QueueStatus.WITH_DOCTOR);
    }

    private QueueStatusView toStatus(QueueEntry entry) {
        Doctor doctor = entry.getDoctor();
        List<QueueEntry> sameDay = queueEntryRepository
                .findByDoctorIdAndQueueDateOrderByTokenAsc(doctor.getId(), entry.getQueueDate());
        int position = QueuePositionCalculator.position(entry, sameDay);
        int peopleAhead = QueuePositionCalculator.peopleAhead(position);
        return new QueueStatusView(
                entry.getId(),
                doctor.getId(),
                entry.getQueueDate(),
                entry.getToken(),
                position,
                peopleAhead,
                QueuePositionCalculator.estimatedWaitMinutes(entry, peopleAhead, doctor.getAppointmentDurationMin()),
                doctorAvailable(doctor.getId()),
                entry.getStatus(),
                entry.getPriority());
    }

    private Doctor findDoctor(Long doctorId) {
        return doctorRepository.findById(doctorId)
                .orElseThrow(() -> NotFoundException.of("Doctor", doctorId));
    }
}
