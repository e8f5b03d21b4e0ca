package com.cliniq.engine.dto;

import com.cliniq.engine.domain.ShiftType;
import com.cliniq.engine.entity.AppointmentSlot;

import java.time.LocalDate;
import java.time.LocalTime;

public record SlotView(Long id, Long doctorId, LocalDate date, LocalTime startTime, LocalTime endTime,
                       ShiftType shiftType, AppointmentSlot.Status status) {

    public static SlotView from(AppointmentSlot slot) {
        return new SlotView(slot.getId(), slot.getDoctor().getId(), slot.getSlotDate(),
                slot.getStartTime(), slot.getEndTime(), slot.getShiftType(), slot.getStatus());
    }
}
