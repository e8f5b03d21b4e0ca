package com.cliniq.engine.service;

import com.cliniq.engine.entity.QueueDay;
import com.cliniq.engine.repository.DoctorRepository;
import com.cliniq.engine.repository.QueueDayRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;

/**
 * Creates the queue-day lock anchor in its own short transaction. Two callers may race;
 * the loser sees a unique-key violation and simply uses the winner's row.
 */
@Component
@RequiredArgsConstructor
public class QueueDayProvisioner {

    private final DoctorRepository doctorRepository;
    private final QueueDayRepository queueDayRepository;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void create(Long doctorId, LocalDate queueDate) {
        if (queueDayRepository.findByDoctorIdAndQueueDate(doctorId, queueDate).isPresent()) {
            return;
        }
        queueDayRepository.saveAndFlush(QueueDay.builder()
                .doctor(doctorRepository.getReferenceById(doctorId))
                .queueDate(queueDate)
                .build());
    }
}
