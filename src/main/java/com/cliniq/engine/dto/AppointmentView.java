package com.cliniq.engine.dto;

import com.cliniq.engine.entity.Appointment;

import java.time.LocalDate;
import java.time.LocalTime;

public record AppointmentView(Long id, Long doctorId, Long slotId, String patientRef,
                              LocalDate date, LocalTime startTime, LocalTime endTime,
                              Appointment.Status status) {

    public static AppointmentView from(Appointment a) {
        return new AppointmentView(a.getId(), a.getDoctor().getId(),
                a.getSlot() != null ? a.getSlot().getId() : null,
                a.getPatientRef(), a.getAppointmentDate(), a.getStartTime(), a.getEndTime(), a.getStatus());
    }
}
