package com.cliniq.engine.repository;

import com.cliniq.engine.entity.DoctorTimeOff;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface DoctorTimeOffRepository extends JpaRepository<DoctorTimeOff, Long> {

    List<DoctorTimeOff> findByDoctorIdOrderByStartDateAsc(Long doctorId);

    Optional<DoctorTimeOff> findByIdAndDoctorId(Long id, Long doctorId);
}
