package com.cliniq.engine.repository;

import com.cliniq.engine.domain.ShiftType;
import com.cliniq.engine.entity.DoctorWeeklyShift;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface DoctorWeeklyShiftRepository extends JpaRepository<DoctorWeeklyShift, Long> {

    List<DoctorWeeklyShift> findByDoctorIdOrderByDayOfWeekAscShiftTypeAsc(Long doctorId);

    Optional<DoctorWeeklyShift> findByDoctorIdAndDayOfWeekAndShiftType(Long doctorId, int dayOfWeek, ShiftType shiftType);
}
