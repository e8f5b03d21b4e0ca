package com.cliniq.engine.service;

import com.cliniq.engine.dto.SlotGenerationResult;
import com.cliniq.engine.entity.Doctor;
import com.cliniq.engine.exception.EngineException;
import com.cliniq.engine.repository.DoctorRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.LocalDate;

/**
 * Keeps every active, fully configured doctor generated at least {@code horizon-days}
 * ahead. Also backfills doctors that were configured but never generated.
 * A longer recorded range is kept, never shortened.
 */
@Component
public class SlotHorizonScheduler {

    private static final Logger log = LoggerFactory.getLogger(SlotHorizonScheduler.class);

    private final DoctorRepository doctorRepository;
    private final AvailabilityService availabilityService;
    private final SlotGenerationService slotGenerationService;
    private final ClinicTimeService clinicTime;

    @Value("${engine.slots.horizon-days:90}")
    private int horizonDays;

    @Value("${engine.slots.max-range-days:366}")
    private int maxRangeDays;

    public SlotHorizonScheduler(DoctorRepository doctorRepository,
                                AvailabilityService availabilityService,
                                SlotGenerationService slotGenerationService,
                                ClinicTimeService clinicTime) {
        this.doctorRepository = doctorRepository;
        this.availabilityService = availabilityService;
        this.slotGenerationService = slotGenerationService;
        this.clinicTime = clinicTime;
    }

    @Scheduled(cron = "${engine.slots.horizon-cron:0 0 0 1 * *}")
    public void scheduledExtend() {
        log.info("Running slot horizon check ({} days)", horizonDays);
        int created = extendAll();
        if (created > 0) {
            log.info("Slot horizon check created {} slots", created);
        } else {
            log.info("Slot horizon check complete - no new slots needed");
        }
    }

    /** @return net new slots across all doctors; regenerated ones are not counted */
    public int extendAll() {
        int created = 0;
        for (Doctor doctor : doctorRepository.findByActiveTrue()) {
            try {
                if (!availabilityService.getAvailability(doctor.getId()).fullyConfigured()) {
                    log.debug("Doctor {} has no complete schedule, skipping slot horizon", doctor.getId());
                    continue;
                }
                LocalDate today = clinicTime.today(doctor);
                SlotGenerationResult result = slotGenerationService.generateSlots(
                        doctor.getId(), today, horizonEnd(doctor, today));
                created += Math.max(0, result.created() - result.deletedAvailable());
            } catch (EngineException | ConcurrencyFailureException e) {
                log.warn("Slot horizon for doctor {} failed: {}", doctor.getId(), e.getMessage());
            }
        }
        return created;
    }

    LocalDate horizonEnd(Doctor doctor, LocalDate today) {
        LocalDate end = today.plusDays(Math.max(horizonDays, 1) - 1L);
        LocalDate recorded = doctor.getSlotsGeneratedTo();
        if (recorded != null && recorded.isAfter(end)) {
            end = recorded;
        }
        LocalDate limit = today.plusDays(maxRangeDays - 1L);
        return end.isAfter(limit) ? limit : end;
    }
}
