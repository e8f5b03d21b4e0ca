package com.cliniq.engine.service;

import com.cliniq.engine.domain.AvailabilityModel;
import com.cliniq.engine.domain.ShiftTemplate;
import com.cliniq.engine.domain.ShiftType;
import com.cliniq.engine.domain.SlotConflict;
import com.cliniq.engine.domain.TimeOffPeriod;
import com.cliniq.engine.dto.AvailabilityUpdateRequest;
import com.cliniq.engine.dto.AvailabilityUpdateResult;
import com.cliniq.engine.dto.AvailabilityView;
import com.cliniq.engine.dto.RegenerationResult;
import com.cliniq.engine.dto.TimeOffRequest;
import com.cliniq.engine.dto.TimeOffResult;
import com.cliniq.engine.entity.Appointment;
import com.cliniq.engine.entity.AppointmentSlot;
import com.cliniq.engine.entity.Doctor;
import com.cliniq.engine.entity.DoctorTimeOff;
import com.cliniq.engine.exception.ConflictException;
import com.cliniq.engine.exception.NotFoundException;
import com.cliniq.engine.exception.ValidationException;
import com.cliniq.engine.repository.AppointmentRepository;
import com.cliniq.engine.repository.AppointmentSlotRepository;
import com.cliniq.engine.repository.DoctorRepository;
import com.cliniq.engine.repository.DoctorTimeOffRepository;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Reads and changes a doctor's availability. Every commit locks the doctor row,
 * re-detects conflicts against what is stored at that moment and either rejects,
 * or cancels the conflicting appointments, before persisting and regenerating.
 */
@Service
@RequiredArgsConstructor
public class AvailabilityService {

    private static final Logger log = LoggerFactory.getLogger(AvailabilityService.class);

    private final DoctorRepository doctorRepository;
    private final AppointmentSlotRepository slotRepository;
    private final AppointmentRepository appointmentRepository;
    private final DoctorTimeOffRepository timeOffRepository;
    private final AvailabilityStore availabilityStore;
    private final ConflictDetector conflictDetector;
    private final SlotGenerationService slotGenerationService;
    private final SlotStoreService slotStore;
    private final AppointmentService appointmentService;
    private final ClinicTimeService clinicTime;

    @Transactional(readOnly = true)
    public AvailabilityView getAvailability(Long doctorId) {
        Doctor doctor = doctorRepository.findById(doctorId)
                .orElseThrow(() -> NotFoundException.of("Doctor", doctorId));
        AvailabilityModel model = availabilityStore.load(doctor);
        return AvailabilityView.of(doctor, model, AvailabilityStore.isFullyConfigured(model));
    }

    /**
     * Dry run of {@link #updateAvailabilityWithResolution}. Mutates nothing.
     */
    @Transactional(readOnly = true)
    public List<SlotConflict> checkConflicts(Long doctorId, AvailabilityUpdateRequest update) {
        Doctor doctor = doctorRepository.findById(doctorId)
                .orElseThrow(() -> NotFoundException.of("Doctor", doctorId));
        AvailabilityModel candidate = merge(availabilityStore.load(doctor), update).validate();
        List<SlotConflict> conflicts = detect(doctor, candidate);
        log.debug("Dry run for doctor {}: {} conflict(s)", doctorId, conflicts.size());
        return conflicts;
    }

    @Transactional
    public AvailabilityUpdateResult updateAvailability(Long doctorId, AvailabilityUpdateRequest update) {
        return updateAvailabilityWithResolution(doctorId, update, false);
    }

    @Transactional
    public AvailabilityUpdateResult updateAvailabilityWithResolution(Long doctorId,
                                                                     AvailabilityUpdateRequest update,
                                                                     boolean cancelConflicts) {
        Doctor doctor = doctorRepository.findByIdForUpdate(doctorId)
                .orElseThrow(() -> NotFoundException.of("Doctor", doctorId));
        AvailabilityModel candidate = merge(availabilityStore.load(doctor), update).validate();

        List<SlotConflict> conflicts = detect(doctor, candidate);
        List<Long> cancelled = resolve(doctorId, conflicts, cancelConflicts);

        availabilityStore.save(doctor, candidate);
        RegenerationResult regenerated = candidate.getAppointmentDurationMin().isPresent()
                ? slotGenerationService.regenerateRecordedRange(doctor, candidate)
                : RegenerationResult.skipped("Appointment duration is not configured");

        doctor.setScheduleConfiguredAt(clinicTime.now());
        doctorRepository.save(doctor);

        log.info("Availability updated for doctor {}: conflicts={}, cancelled={}, regenerated={}",
                doctorId, conflicts.size(), cancelled.size(), regenerated);
        return new AvailabilityUpdateResult(true, cancelled, conflicts, regenerated);
    }

    // =========================================================
    // TIME-OFF
    // =========================================================
    @Transactional
    public TimeOffResult addTimeOff(Long doctorId, TimeOffRequest request, boolean cancelConflicts) {
        if (request == null || request.startDate() == null || request.endDate() == null) {
            throw new ValidationException("startDate and endDate are required");
        }
        if (request.type() == null) {
            throw new ValidationException("type is required");
        }
        Doctor doctor = doctorRepository.findByIdForUpdate(doctorId)
                .orElseThrow(() -> NotFoundException.of("Doctor", doctorId));

        TimeOffPeriod period = new TimeOffPeriod(null, request.startDate(), request.endDate(),
                request.type(), StringUtils.trimToNull(request.reason()));
        AvailabilityModel candidate = availabilityStore.load(doctor).withTimeOff(period).validate();

        List<SlotConflict> conflicts = detect(doctor, candidate);
        List<Long> cancelled = resolve(doctorId, conflicts, cancelConflicts);

        DoctorTimeOff row = timeOffRepository.save(DoctorTimeOff.builder()
                .doctor(doctor)
                .startDate(period.startDate())
                .endDate(period.endDate())
                .type(period.type())
                .reason(period.reason())
                .build());
        int deleted = slotRepository.deleteByStatusBetween(doctorId, AppointmentSlot.Status.AVAILABLE,
                period.startDate(), period.endDate());

        log.info("Time-off {} added for doctor {}: {} to {} ({}), cancelled={}, deletedAvailable={}",
                row.getId(), doctorId, period.startDate(), period.endDate(), period.type(),
                cancelled.size(), deleted);
        return new TimeOffResult(
                new TimeOffPeriod(row.getId(), row.getStartDate(), row.getEndDate(), row.getType(), row.getReason()),
                cancelled, conflicts, deleted);
    }

    /**
     * Deletes the time-off and regenerates the dates it covered, clipped to the
     * recorded generation range and today.
     */
    @Transactional
    public RegenerationResult removeTimeOff(Long doctorId, Long timeOffId) {
        Doctor doctor = doctorRepository.findByIdForUpdate(doctorId)
                .orElseThrow(() -> NotFoundException.of("Doctor", doctorId));
        DoctorTimeOff row = timeOffRepository.findByIdAndDoctorId(timeOffId, doctorId)
                .orElseThrow(() -> NotFoundException.of("Time-off", timeOffId));
        timeOffRepository.delete(row);
        timeOffRepository.flush();

        RegenerationResult result = regenerateCovered(doctor, row.getStartDate(), row.getEndDate());
        log.info("Time-off {} removed for doctor {}: {}", timeOffId, doctorId, result);
        return result;
    }

    private RegenerationResult regenerateCovered(Doctor doctor, LocalDate start, LocalDate end) {
        if (doctor.getSlotsGeneratedFrom() == null || doctor.getSlotsGeneratedTo() == null) {
            return RegenerationResult.skipped("No slots have been generated for this doctor yet");
        }
        AvailabilityModel model = availabilityStore.load(doctor);
        if (model.getAppointmentDurationMin().isEmpty()) {
            return RegenerationResult.skipped("Appointment duration is not configured");
        }
        LocalDate from = latest(start, doctor.getSlotsGeneratedFrom(), clinicTime.today(doctor));
        LocalDate to = end.isAfter(doctor.getSlotsGeneratedTo()) ? doctor.getSlotsGeneratedTo() : end;
        if (from.isAfter(to)) {
            return RegenerationResult.skipped("Time-off lies outside the generated range");
        }
        return slotGenerationService.regenerate(doctor, model, from, to);
    }

    // =========================================================
    // HELPERS
    // =========================================================

    /**
     * BOOKED slots from today that are still waiting for their visit. Slots whose
     * appointment is already checked in are out of scope for rescheduling.
     */
    private List<SlotConflict> detect(Doctor doctor, AvailabilityModel candidate) {
        LocalDate today = clinicTime.today(doctor);
        List<AppointmentSlot> booked = slotRepository
                .findByDoctorIdAndStatusAndSlotDateGreaterThanEqualOrderBySlotDateAscStartTimeAsc(
                        doctor.getId(), AppointmentSlot.Status.BOOKED, today);
        if (booked.isEmpty()) {
            return List.of();
        }
        Map<Long, Appointment> bySlot = appointmentRepository
                .findBySlotIdInAndStatusIn(booked.stream().map(AppointmentSlot::getId).toList(),
                        EnumSet.of(Appointment.Status.BOOKED, Appointment.Status.CHECKED_IN))
                .stream()
                .collect(Collectors.toMap(a -> a.getSlot().getId(), Function.identity(), (a, b) -> a));
        List<AppointmentSlot> pending = booked.stream()
                .filter(s -> !bySlot.containsKey(s.getId())
                        || bySlot.get(s.getId()).getStatus() == Appointment.Status.BOOKED)
                .toList();
        return conflictDetector.detect(candidate, pending, bySlot, today, clinicTime.timeOfDay(doctor));
    }

    private List<Long> resolve(Long doctorId, List<SlotConflict> conflicts, boolean cancelConflicts) {
        if (conflicts.isEmpty()) {
            return List.of();
        }
        if (!cancelConflicts) {
            throw new ConflictException(conflicts);
        }
        List<Long> cancelled = new ArrayList<>();
        for (SlotConflict conflict : conflicts) {
            if (conflict.appointmentId() == null) {
                slotStore.release(conflict.slotId());
                continue;
            }
            Appointment appointment = appointmentRepository.findByIdForUpdate(conflict.appointmentId())
                    .orElseThrow(() -> NotFoundException.of("Appointment", conflict.appointmentId()));
            Appointment.Status current = appointmentRepository.findStatusById(appointment.getId())
                    .orElse(appointment.getStatus());
            if (current != Appointment.Status.BOOKED) {
                log.info("Appointment {} became {} before the schedule change for doctor {}; left in place",
                        appointment.getId(), current, doctorId);
                continue;
            }
            appointmentService.cancelAndRelease(appointment);
            cancelled.add(appointment.getId());
        }
        return cancelled;
    }

    private static AvailabilityModel merge(AvailabilityModel current, AvailabilityUpdateRequest update) {
        if (update == null) {
            return current;
        }
        AvailabilityModel model = current;
        if (update.appointmentDurationMin() != null) {
            model = model.withDuration(update.appointmentDurationMin());
        }
        if (update.shiftTemplates() != null) {
            for (Map.Entry<ShiftType, AvailabilityUpdateRequest.ShiftHours> e : update.shiftTemplates().entrySet()) {
                AvailabilityUpdateRequest.ShiftHours hours = e.getValue();
                if (e.getKey() == null || hours == null || hours.start() == null || hours.end() == null) {
                    throw new ValidationException("Each shift template needs a shift type, start and end");
                }
                model = model.withTemplate(new ShiftTemplate(e.getKey(), hours.start(), hours.end()));
            }
        }
        if (update.weekly() != null) {
            model = model.withWeekly(update.weekly());
        }
        return model;
    }

    private static LocalDate latest(LocalDate a, LocalDate b, LocalDate c) {
        LocalDate max = a.isAfter(b) ? a : b;
        return max.isAfter(c) ? max : c;
    }
}
