package com.cliniq.engine.service;

import com.cliniq.engine.domain.AvailabilityModel;
import com.cliniq.engine.domain.ConflictReason;
import com.cliniq.engine.domain.ShiftTemplate;
import com.cliniq.engine.domain.SlotConflict;
import com.cliniq.engine.domain.SlotCutter;
import com.cliniq.engine.domain.TimeWindow;
import com.cliniq.engine.entity.Appointment;
import com.cliniq.engine.entity.AppointmentSlot;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Classifies booked slots against a candidate availability model. Read-only.
 */
@Component
public class ConflictDetector {

    private static final String[] DAY_NAMES =
            {"Sunday", "Monday", "Tuesday", "Wednesday", "Thursday", "Friday", "Saturday"};

    /**
     * @param bookedSlots        BOOKED slots of one doctor
     * @param appointmentsBySlot live appointment per slot id, where one exists
     * @param today              clinic-local date
     * @param now                clinic-local time of day; slots of today ending at or before it are elapsed
     */
    public List<SlotConflict> detect(AvailabilityModel candidate,
                                     Collection<AppointmentSlot> bookedSlots,
                                     Map<Long, Appointment> appointmentsBySlot,
                                     LocalDate today,
                                     LocalTime now) {
        List<SlotConflict> conflicts = new ArrayList<>();
        bookedSlots.stream()
                .filter(s -> s.getStatus() == AppointmentSlot.Status.BOOKED)
                .filter(s -> !isElapsed(s, today, now))
                .sorted(Comparator.comparing(AppointmentSlot::getSlotDate).thenComparing(AppointmentSlot::getStartTime))
                .forEach(slot -> classify(candidate, slot)
                        .map(reason -> toConflict(slot, appointmentsBySlot.get(slot.getId()), reason, candidate))
                        .ifPresent(conflicts::add));
        return conflicts;
    }

    Optional<ConflictReason> classify(AvailabilityModel candidate, AppointmentSlot slot) {
        LocalDate date = slot.getSlotDate();
        if (candidate.isTimeOff(date)) {
            return Optional.of(ConflictReason.TIME_OFF);
        }
        Optional<ShiftTemplate> template = candidate.getTemplate(slot.getShiftType());
        if (template.isEmpty() || !candidate.isEnabled(AvailabilityModel.dayIndex(date), slot.getShiftType())) {
            return Optional.of(ConflictReason.SHIFT_DISABLED);
        }
        TimeWindow window = template.get().toWindow();
        if (!window.encloses(slot.getStartTime(), slot.getEndTime())) {
            return Optional.of(ConflictReason.TIME_OUTSIDE_SHIFT);
        }
        Optional<Integer> duration = candidate.getAppointmentDurationMin();
        if (duration.isPresent()
                && (slot.lengthMinutes() != duration.get()
                || !SlotCutter.onGrid(window, slot.getStartTime(), duration.get()))) {
            return Optional.of(ConflictReason.DURATION_MISMATCH);
        }
        return Optional.empty();
    }

    private static boolean isElapsed(AppointmentSlot slot, LocalDate today, LocalTime now) {
        if (slot.getSlotDate().isBefore(today)) {
            return true;
        }
        return slot.getSlotDate().isEqual(today) && !slot.getEndTime().isAfter(now);
    }

    private static SlotConflict toConflict(AppointmentSlot slot, Appointment appointment,
                                           ConflictReason reason, AvailabilityModel candidate) {
        return new SlotConflict(
                slot.getId(),
                appointment != null ? appointment.getId() : null,
                appointment != null ? appointment.getPatientRef() : null,
                slot.getSlotDate(),
                slot.getStartTime(),
                slot.getEndTime(),
                slot.getShiftType(),
                reason,
                detail(slot, reason, candidate));
    }

    private static String detail(AppointmentSlot slot, ConflictReason reason, AvailabilityModel candidate) {
        return switch (reason) {
            case TIME_OFF -> "Time-off covers " + slot.getSlotDate();
            case SHIFT_DISABLED -> slot.getShiftType() + " shift is not enabled on "
                    + DAY_NAMES[AvailabilityModel.dayIndex(slot.getSlotDate())];
            case TIME_OUTSIDE_SHIFT -> "Time " + slot.getStartTime() + "-" + slot.getEndTime()
                    + " falls outside the new " + slot.getShiftType() + " hours";
            case DURATION_MISMATCH -> "Time " + slot.getStartTime() + " doesn't align with new "
                    + candidate.getAppointmentDurationMin().orElse(0) + "-minute slot grid";
        };
    }
}
