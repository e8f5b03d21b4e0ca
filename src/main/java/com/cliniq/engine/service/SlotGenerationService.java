package com.cliniq.engine.service;

import com.cliniq.engine.domain.AvailabilityModel;
import com.cliniq.engine.domain.SlotCutter;
import com.cliniq.engine.domain.SlotWindow;
import com.cliniq.engine.dto.RegenerationResult;
import com.cliniq.engine.dto.SlotGenerationResult;
import com.cliniq.engine.entity.AppointmentSlot;
import com.cliniq.engine.entity.Doctor;
import com.cliniq.engine.exception.ConfigurationException;
import com.cliniq.engine.exception.NotFoundException;
import com.cliniq.engine.exception.ValidationException;
import com.cliniq.engine.repository.AppointmentSlotRepository;
import com.cliniq.engine.repository.DoctorRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Materializes bookable slots from a doctor's availability model.
 * BOOKED slots are never touched; AVAILABLE slots in the range are replaced.
 */
@Service
public class SlotGenerationService {

    private static final Logger log = LoggerFactory.getLogger(SlotGenerationService.class);

    private final DoctorRepository doctorRepository;
    private final AppointmentSlotRepository slotRepository;
    private final AvailabilityStore availabilityStore;
    private final ClinicTimeService clinicTime;

    @Value("${engine.slots.max-range-days:366}")
    private int maxRangeDays;

    public SlotGenerationService(DoctorRepository doctorRepository,
                                 AppointmentSlotRepository slotRepository,
                                 AvailabilityStore availabilityStore,
                                 ClinicTimeService clinicTime) {
        this.doctorRepository = doctorRepository;
        this.slotRepository = slotRepository;
        this.availabilityStore = availabilityStore;
        this.clinicTime = clinicTime;
    }

    /**
     * Replaces AVAILABLE slots in [from, to] with a fresh materialization and records
     * the range on the doctor. Idempotent for an unchanged model.
     */
    @Transactional
    public SlotGenerationResult generateSlots(Long doctorId, LocalDate from, LocalDate to) {
        validateRange(from, to);
        Doctor doctor = doctorRepository.findByIdForUpdate(doctorId)
                .orElseThrow(() -> NotFoundException.of("Doctor", doctorId));

        AvailabilityModel model = availabilityStore.load(doctor);
        RegenerationResult result = regenerate(doctor, model, from, to);

        doctor.setSlotsGeneratedFrom(from);
        doctor.setSlotsGeneratedTo(to);
        doctorRepository.save(doctor);

        log.info("Generated {} slots for doctor {} in [{}, {}] (replaced {} available)",
                result.created(), doctorId, from, to, result.deletedAvailable());
        return new SlotGenerationResult(result.created(), result.deletedAvailable(), from, to);
    }

    /**
     * Regenerates from today (clinic-local) to the end of the recorded generation range.
     * Skips when no range was ever generated or it already ended. Caller holds the doctor lock.
     */
    public RegenerationResult regenerateRecordedRange(Doctor doctor, AvailabilityModel model) {
        if (doctor.getSlotsGeneratedFrom() == null || doctor.getSlotsGeneratedTo() == null) {
            return RegenerationResult.skipped("No slots have been generated for this doctor yet");
        }
        LocalDate today = clinicTime.today(doctor);
        if (doctor.getSlotsGeneratedTo().isBefore(today)) {
            return RegenerationResult.skipped("Stored slot generation range is in the past");
        }
        LocalDate from = doctor.getSlotsGeneratedFrom().isBefore(today) ? today : doctor.getSlotsGeneratedFrom();
        return regenerate(doctor, model, from, doctor.getSlotsGeneratedTo());
    }

    /**
     * Deletes AVAILABLE slots in [from, to] and cuts new ones from the model. A cut that
     * overlaps a BOOKED slot of the same date is left out. Caller holds the doctor lock.
     */
    public RegenerationResult regenerate(Doctor doctor, AvailabilityModel model, LocalDate from, LocalDate to) {
        int duration = model.getAppointmentDurationMin()
                .orElseThrow(() -> new ConfigurationException(
                        "Doctor " + doctor.getId() + " has no appointment duration configured"));

        int deleted = slotRepository.deleteByStatusBetween(doctor.getId(), AppointmentSlot.Status.AVAILABLE, from, to);

        Map<LocalDate, List<AppointmentSlot>> bookedByDate = slotRepository
                .findByDoctorIdAndSlotDateBetweenAndStatusOrderBySlotDateAscStartTimeAsc(
                        doctor.getId(), from, to, AppointmentSlot.Status.BOOKED)
                .stream()
                .collect(Collectors.groupingBy(AppointmentSlot::getSlotDate));

        List<AppointmentSlot> slots = new ArrayList<>();
        for (LocalDate date = from; !date.isAfter(to); date = date.plusDays(1)) {
            List<AppointmentSlot> booked = bookedByDate.getOrDefault(date, List.of());
            for (SlotWindow window : SlotCutter.cut(model, date, duration)) {
                boolean taken = booked.stream()
                        .anyMatch(b -> window.overlaps(b.getStartTime(), b.getEndTime()));
                if (taken) {
                    continue;
                }
                slots.add(AppointmentSlot.builder()
                        .doctor(doctor)
                        .slotDate(date)
                        .startTime(window.start())
                        .endTime(window.end())
                        .shiftType(window.shiftType())
                        .status(AppointmentSlot.Status.AVAILABLE)
                        .build());
            }
        }
        slotRepository.saveAll(slots);
        log.debug("Regenerated doctor {} [{}, {}]: deleted={}, created={}", doctor.getId(), from, to, deleted, slots.size());
        return RegenerationResult.done(deleted, slots.size(), from, to);
    }

    private void validateRange(LocalDate from, LocalDate to) {
        if (from == null || to == null) {
            throw new ValidationException("Both from and to dates are required");
        }
        if (from.isAfter(to)) {
            throw new ValidationException("Start date must be before or equal to end date");
        }
        long days = ChronoUnit.DAYS.between(from, to) + 1;
        if (days > maxRangeDays) {
            throw new ValidationException("Range of " + days + " days exceeds the maximum of " + maxRangeDays);
        }
    }
}
