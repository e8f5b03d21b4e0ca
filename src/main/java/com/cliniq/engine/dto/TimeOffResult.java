package com.cliniq.engine.dto;

import com.cliniq.engine.domain.SlotConflict;
import com.cliniq.engine.domain.TimeOffPeriod;

import java.util.List;

public record TimeOffResult(TimeOffPeriod timeOff,
                            List<Long> cancelledAppointments,
                            List<SlotConflict> conflicts,
                            int deletedAvailable) {
}
