package com.cliniq.engine.dto;

import com.cliniq.engine.domain.SlotConflict;

import java.util.List;

/**
 * @param cancelledAppointments ids of appointments cancelled to resolve conflicts
 * @param conflicts             conflicts found at commit time, resolved when {@code applied}
 */
public record AvailabilityUpdateResult(boolean applied,
                                       List<Long> cancelledAppointments,
                                       List<SlotConflict> conflicts,
                                       RegenerationResult regenerated) {
}
