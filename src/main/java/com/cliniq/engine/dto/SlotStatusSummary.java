package com.cliniq.engine.dto;

import java.time.LocalDate;

public record SlotStatusSummary(long total, long available, long booked,
                                LocalDate generatedFrom, LocalDate generatedTo) {
}
