package com.cliniq.engine.repository;

import com.cliniq.engine.entity.QueueDay;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.time.LocalDate;
import java.util.Optional;

@Repository
public interface QueueDayRepository extends JpaRepository<QueueDay, Long> {

    Optional<QueueDay> findByDoctorIdAndQueueDate(Long doctorId, LocalDate queueDate);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT d FROM QueueDay d WHERE d.doctor.id = :doctorId AND d.queueDate = :queueDate")
    Optional<QueueDay> lock(@Param("doctorId") Long doctorId, @Param("queueDate") LocalDate queueDate);
}
