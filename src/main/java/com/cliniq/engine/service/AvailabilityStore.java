package com.cliniq.engine.service;

import com.cliniq.engine.domain.AvailabilityModel;
import com.cliniq.engine.domain.ShiftTemplate;
import com.cliniq.engine.domain.TimeOffPeriod;
import com.cliniq.engine.domain.WeeklyShift;
import com.cliniq.engine.entity.Doctor;
import com.cliniq.engine.entity.DoctorShiftTemplate;
import com.cliniq.engine.entity.DoctorWeeklyShift;
import com.cliniq.engine.repository.DoctorRepository;
import com.cliniq.engine.repository.DoctorShiftTemplateRepository;
import com.cliniq.engine.repository.DoctorTimeOffRepository;
import com.cliniq.engine.repository.DoctorWeeklyShiftRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Maps the schedule tables of one doctor to and from an {@link AvailabilityModel}.
 * Callers own the transaction.
 */
@Component
@RequiredArgsConstructor
public class AvailabilityStore {

    private final DoctorRepository doctorRepository;
    private final DoctorShiftTemplateRepository templateRepository;
    private final DoctorWeeklyShiftRepository weeklyShiftRepository;
    private final DoctorTimeOffRepository timeOffRepository;

    public AvailabilityModel load(Doctor doctor) {
        List<ShiftTemplate> templates = templateRepository.findByDoctorId(doctor.getId()).stream()
                .map(t -> new ShiftTemplate(t.getShiftType(), t.getStartTime(), t.getEndTime()))
                .toList();
        List<WeeklyShift> weekly = weeklyShiftRepository
                .findByDoctorIdOrderByDayOfWeekAscShiftTypeAsc(doctor.getId()).stream()
                .map(w -> new WeeklyShift(w.getDayOfWeek(), w.getShiftType(), w.isEnabled()))
                .toList();
        List<TimeOffPeriod> timeOff = timeOffRepository.findByDoctorIdOrderByStartDateAsc(doctor.getId()).stream()
                .map(t -> new TimeOffPeriod(t.getId(), t.getStartDate(), t.getEndDate(), t.getType(), t.getReason()))
                .toList();
        return AvailabilityModel.of(doctor.getAppointmentDurationMin(), templates, weekly, timeOff);
    }

    /**
     * Upserts duration, templates and the weekly table. Time-off rows are managed separately.
     */
    public void save(Doctor doctor, AvailabilityModel model) {
        doctor.setAppointmentDurationMin(model.getAppointmentDurationMin().orElse(null));
        doctorRepository.save(doctor);

        for (ShiftTemplate template : model.getTemplates()) {
            DoctorShiftTemplate row = templateRepository
                    .findByDoctorIdAndShiftType(doctor.getId(), template.shiftType())
                    .orElseGet(() -> DoctorShiftTemplate.builder()
                            .doctor(doctor)
                            .shiftType(template.shiftType())
                            .build());
            row.setStartTime(template.start());
            row.setEndTime(template.end());
            templateRepository.save(row);
        }

        for (WeeklyShift cell : model.getWeekly()) {
            var existing = weeklyShiftRepository
                    .findByDoctorIdAndDayOfWeekAndShiftType(doctor.getId(), cell.dayOfWeek(), cell.shiftType());
            if (existing.isEmpty() && !cell.enabled()) {
                continue;
            }
            DoctorWeeklyShift row = existing.orElseGet(() -> DoctorWeeklyShift.builder()
                    .doctor(doctor)
                    .dayOfWeek(cell.dayOfWeek())
                    .shiftType(cell.shiftType())
                    .build());
            row.setEnabled(cell.enabled());
            weeklyShiftRepository.save(row);
        }
    }

    /** Duration set, at least one template and at least one enabled weekly cell. */
    public static boolean isFullyConfigured(AvailabilityModel model) {
        return model.getAppointmentDurationMin().isPresent()
                && !model.getTemplates().isEmpty()
                && model.getWeekly().stream().anyMatch(WeeklyShift::enabled);
    }
}
