package com.cliniq.engine.dto;

import com.cliniq.engine.domain.AvailabilityModel;
import com.cliniq.engine.domain.ShiftTemplate;
import com.cliniq.engine.domain.TimeOffPeriod;
import com.cliniq.engine.domain.WeeklyShift;
import com.cliniq.engine.entity.Doctor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

public record AvailabilityView(Long doctorId,
                               Integer appointmentDurationMin,
                               List<ShiftTemplate> shiftTemplates,
                               List<WeeklyShift> weekly,
                               List<TimeOffPeriod> timeOff,
                               LocalDate slotsGeneratedFrom,
                               LocalDate slotsGeneratedTo,
                               Instant scheduleConfiguredAt,
                               boolean fullyConfigured) {

    public static AvailabilityView of(Doctor doctor, AvailabilityModel model, boolean fullyConfigured) {
        return new AvailabilityView(doctor.getId(),
                model.getAppointmentDurationMin().orElse(null),
                model.getTemplates(),
                model.getWeekly(),
                model.getTimeOff(),
                doctor.getSlotsGeneratedFrom(),
                doctor.getSlotsGeneratedTo(),
                doctor.getScheduleConfiguredAt(),
                fullyConfigured);
    }
}
