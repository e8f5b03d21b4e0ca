package com.cliniq.engine.repository;

import com.cliniq.engine.entity.DoctorDailyCheckIn;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDate;
import java.util.Optional;

public interface DoctorDailyCheckInRepository extends JpaRepository<DoctorDailyCheckIn, Long> {

    Optional<DoctorDailyCheckIn> findByDoctorIdAndCheckInDate(Long doctorId, LocalDate checkInDate);
}
