package com.cliniq.engine.repository;

import com.cliniq.engine.domain.QueueStatus;
import com.cliniq.engine.entity.QueueEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface QueueEntryRepository extends JpaRepository<QueueEntry, Long> {

    /** Only meaningful inside the transaction holding the queue-day lock. */
    @Query("SELECT COALESCE(MAX(q.token), 0) FROM QueueEntry q"
            + " WHERE q.doctor.id = :doctorId AND q.queueDate = :queueDate")
    int findMaxToken(@Param("doctorId") Long doctorId, @Param("queueDate") LocalDate queueDate);

    List<QueueEntry> findByDoctorIdAndQueueDateOrderByTokenAsc(Long doctorId, LocalDate queueDate);

    Optional<QueueEntry> findByDoctorIdAndQueueDateAndToken(Long doctorId, LocalDate queueDate, int token);

    Optional<QueueEntry> findFirstByDoctorIdAndStatus(Long doctorId, QueueStatus status);

    boolean existsByDoctorIdAndStatus(Long doctorId, QueueStatus status);

    boolean existsBySlotIdAndStatusNot(Long slotId, QueueStatus status);

    List<QueueEntry> findByDoctorIdAndQueueDateBeforeAndStatusIn(Long doctorId, LocalDate date,
                                                                 Collection<QueueStatus> statuses);

    @Query("SELECT q.doctor.id FROM QueueEntry q WHERE q.id = :id")
    Optional<Long> findDoctorIdById(@Param("id") Long id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT q FROM QueueEntry q WHERE q.id = :id")
    Optional<QueueEntry> findByIdForUpdate(@Param("id") Long id);
}
