package com.cliniq.engine.service;

import com.cliniq.engine.domain.QueueStatus;
import com.cliniq.engine.entity.Doctor;
import com.cliniq.engine.entity.QueueEntry;
import com.cliniq.engine.exception.EngineException;
import com.cliniq.engine.repository.DoctorRepository;
import com.cliniq.engine.repository.QueueEntryRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.EnumSet;
import java.util.List;

/**
 * Closes queue entries left open on earlier days. Each entry goes through the
 * normal state machine in its own transaction; a failed entry is skipped, not retried.
 */
@Component
@RequiredArgsConstructor
public class StaleQueueSweeper {

    private static final Logger log = LoggerFactory.getLogger(StaleQueueSweeper.class);

    private final DoctorRepository doctorRepository;
    private final QueueEntryRepository queueEntryRepository;
    private final QueueService queueService;
    private final ClinicTimeService clinicTime;

    @Scheduled(cron = "${engine.queue.stale-sweep-cron:0 5 0 * * *}")
    public void scheduledSweep() {
        int closed = sweep();
        if (closed > 0) {
            log.info("Stale queue sweep closed {} entries", closed);
        }
    }

    public int sweep() {
        int closed = 0;
        for (Doctor doctor : doctorRepository.findByActiveTrue()) {
            LocalDate today = clinicTime.today(doctor);
            List<QueueEntry> stale = queueEntryRepository.findByDoctorIdAndQueueDateBeforeAndStatusIn(
                    doctor.getId(), today,
                    EnumSet.of(QueueStatus.QUEUED, QueueStatus.WAITING, QueueStatus.WITH_DOCTOR));
            for (QueueEntry entry : stale) {
                QueueStatus target = closingStatus(entry.getStatus());
                try {
                    queueService.transition(entry.getId(), target);
                    closed++;
                } catch (EngineException | ConcurrencyFailureException e) {
                    log.warn("Could not close stale queue entry {} ({} -> {}): {}",
                            entry.getId(), entry.getStatus(), target, e.getMessage());
                }
            }
        }
        return closed;
    }

    static QueueStatus closingStatus(QueueStatus status) {
        return switch (status) {
            case QUEUED -> QueueStatus.CANCELLED;
            case WAITING -> QueueStatus.NO_SHOW;
            case WITH_DOCTOR -> QueueStatus.COMPLETED;
            default -> throw new IllegalArgumentException("Entry in " + status + " is already closed");
        };
    }
}
