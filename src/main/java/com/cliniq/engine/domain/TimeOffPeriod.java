package com.cliniq.engine.domain;

import java.time.LocalDate;

/**
 * Inclusive date range during which the weekly pattern yields no windows at all.
 */
public record TimeOffPeriod(Long id, LocalDate startDate, LocalDate endDate, TimeOffType type, String reason) {

    public boolean covers(LocalDate date) {
        return !date.isBefore(startDate) && !date.isAfter(endDate);
    }
}
