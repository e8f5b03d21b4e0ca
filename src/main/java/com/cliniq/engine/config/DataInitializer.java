package com.cliniq.engine.config;

import com.cliniq.engine.domain.ShiftType;
import com.cliniq.engine.domain.WeeklyShift;
import com.cliniq.engine.dto.AvailabilityUpdateRequest;
import com.cliniq.engine.entity.Doctor;
import com.cliniq.engine.repository.DoctorRepository;
import com.cliniq.engine.service.AvailabilityService;
import com.cliniq.engine.service.ClinicTimeService;
import com.cliniq.engine.service.SlotGenerationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Demo seeder: inserts doctors with a Monday to Saturday schedule if none exist and
 * generates slots for the next 7 days. Safe to re-run.
 */
@Component
@ConditionalOnProperty(name = "engine.seed.enabled", havingValue = "true")
public class DataInitializer {

    private static final Logger log = LoggerFactory.getLogger(DataInitializer.class);

    private final DoctorRepository doctorRepository;
    private final AvailabilityService availabilityService;
    private final SlotGenerationService slotGenerationService;
    private final ClinicTimeService clinicTime;

    @Value("${engine.seed.clinic-id:demo}")
    private String clinicId;

    public DataInitializer(DoctorRepository doctorRepository,
                           AvailabilityService availabilityService,
                           SlotGenerationService slotGenerationService,
                           ClinicTimeService clinicTime) {
        this.doctorRepository = doctorRepository;
        this.availabilityService = availabilityService;
        this.slotGenerationService = slotGenerationService;
        this.clinicTime = clinicTime;
    }

    @EventListener(ApplicationReadyEvent.class)
    @Order(1)
    public void seed() {
        List<Doctor> doctors = doctorRepository.findByActiveTrue();
        if (!doctors.isEmpty()) {
            log.info("DataInitializer: {} doctors present, nothing to seed", doctors.size());
            return;
        }
        log.info("Seeding doctors...");
        doctors = List.of(
                doctorRepository.save(Doctor.builder().clinicId(clinicId).name("Dr. Sarah Johnson").specialization("General Practice").build()),
                doctorRepository.save(Doctor.builder().clinicId(clinicId).name("Dr. Michael Chen").specialization("Cardiology").build()),
                doctorRepository.save(Doctor.builder().clinicId(clinicId).name("Dr. Emily Davis").specialization("Pediatrics").build())
        );

        for (Doctor d : doctors) {
            availabilityService.updateAvailability(d.getId(), defaultSchedule());
            LocalDate today = clinicTime.today(d);
            slotGenerationService.generateSlots(d.getId(), today, today.plusDays(6));
            log.info("Added schedule and slots for {}", d.getName());
        }
        log.info("DataInitializer: doctors={}, slots ready", doctors.size());
    }

    private static AvailabilityUpdateRequest defaultSchedule() {
        List<WeeklyShift> weekly = new ArrayList<>();
        for (int day = 1; day <= 6; day++) {
            weekly.add(new WeeklyShift(day, ShiftType.MORNING, true));
            weekly.add(new WeeklyShift(day, ShiftType.EVENING, true));
        }
        return new AvailabilityUpdateRequest(15,
                Map.of(ShiftType.MORNING, new AvailabilityUpdateRequest.ShiftHours(LocalTime.of(9, 0), LocalTime.of(13, 0)),
                        ShiftType.EVENING, new AvailabilityUpdateRequest.ShiftHours(LocalTime.of(14, 0), LocalTime.of(18, 0))),
                weekly);
    }
}
