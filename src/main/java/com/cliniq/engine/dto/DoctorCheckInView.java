package com.cliniq.engine.dto;

import com.cliniq.engine.entity.DoctorDailyCheckIn;

import java.time.Instant;
import java.time.LocalDate;

public record DoctorCheckInView(Long doctorId, LocalDate date, boolean checkedIn,
                                Instant checkInTime, Instant checkOutTime) {

    public static DoctorCheckInView from(Long doctorId, DoctorDailyCheckIn row) {
        return new DoctorCheckInView(doctorId, row.getCheckInDate(), row.isActive(),
                row.getCheckedInAt(), row.getCheckedOutAt());
    }
}
