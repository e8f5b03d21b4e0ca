package com.cliniq.engine.repository;

import com.cliniq.engine.domain.ShiftType;
import com.cliniq.engine.entity.DoctorShiftTemplate;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface DoctorShiftTemplateRepository extends JpaRepository<DoctorShiftTemplate, Long> {

    List<DoctorShiftTemplate> findByDoctorId(Long doctorId);

    Optional<DoctorShiftTemplate> findByDoctorIdAndShiftType(Long doctorId, ShiftType shiftType);
}
