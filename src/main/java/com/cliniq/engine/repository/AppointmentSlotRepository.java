package com.cliniq.engine.repository;

import com.cliniq.engine.entity.AppointmentSlot;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface AppointmentSlotRepository extends JpaRepository<AppointmentSlot, Long> {

    List<AppointmentSlot> findByDoctorIdAndSlotDateBetweenAndStatusOrderBySlotDateAscStartTimeAsc(
            Long doctorId,
            LocalDate from,
            LocalDate to,
            AppointmentSlot.Status status
    );

    List<AppointmentSlot> findByDoctorIdAndSlotDateOrderByStartTimeAsc(Long doctorId, LocalDate date);

    List<AppointmentSlot> findByDoctorIdAndStatusAndSlotDateGreaterThanEqualOrderBySlotDateAscStartTimeAsc(
            Long doctorId,
            AppointmentSlot.Status status,
            LocalDate from
    );

    long countByDoctorIdAndStatus(Long doctorId, AppointmentSlot.Status status);

    @Query("SELECT s.doctor.id FROM AppointmentSlot s WHERE s.id = :id")
    Optional<Long> findDoctorIdById(@Param("id") Long id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM AppointmentSlot s WHERE s.id = :id")
    Optional<AppointmentSlot> findByIdForUpdate(@Param("id") Long id);

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM AppointmentSlot s WHERE s.doctor.id = :doctorId AND s.status = :status"
            + " AND s.slotDate >= :from AND s.slotDate <= :to")
    int deleteByStatusBetween(@Param("doctorId") Long doctorId,
                              @Param("status") AppointmentSlot.Status status,
                              @Param("from") LocalDate from,
                              @Param("to") LocalDate to);

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM AppointmentSlot s WHERE s.doctor.id = :doctorId AND s.status = :status"
            + " AND s.slotDate >= :from")
    int deleteByStatusFrom(@Param("doctorId") Long doctorId,
                           @Param("status") AppointmentSlot.Status status,
                           @Param("from") LocalDate from);
}
