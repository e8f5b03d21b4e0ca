package com.cliniq.engine.repository;

import com.cliniq.engine.entity.Appointment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import jakarta.persistence.LockModeType;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface AppointmentRepository extends JpaRepository<Appointment, Long> {

    Optional<Appointment> findFirstBySlotIdAndStatusIn(Long slotId, Collection<Appointment.Status> statuses);

    List<Appointment> findBySlotIdInAndStatusIn(Collection<Long> slotIds, Collection<Appointment.Status> statuses);

    /** Ids only, so the row can be locked and loaded fresh afterwards. */
    @Query("SELECT a.id FROM Appointment a WHERE a.slot.id = :slotId AND a.status IN :statuses")
    List<Long> findIdsBySlotIdAndStatusIn(@Param("slotId") Long slotId,
                                          @Param("statuses") Collection<Appointment.Status> statuses);

    @Query("SELECT a.doctor.id FROM Appointment a WHERE a.id = :id")
    Optional<Long> findDoctorIdById(@Param("id") Long id);

    /** Reads the committed status, bypassing any copy already loaded in the session. */
    @Query("SELECT a.status FROM Appointment a WHERE a.id = :id")
    Optional<Appointment.Status> findStatusById(@Param("id") Long id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM Appointment a WHERE a.id = :id")
    Optional<Appointment> findByIdForUpdate(@Param("id") Long id);
}
