package com.cliniq.engine.dto;

import java.time.LocalDate;

/**
 * Outcome of refreshing AVAILABLE slots after a schedule change.
 */
public record RegenerationResult(int deletedAvailable, int created, LocalDate from, LocalDate to,
                                 boolean skipped, String skipReason) {

    public static RegenerationResult skipped(String reason) {
        return new RegenerationResult(0, 0, null, null, true, reason);
    }

    public static RegenerationResult done(int deletedAvailable, int created, LocalDate from, LocalDate to) {
        return new RegenerationResult(deletedAvailable, created, from, to, false, null);
    }
}
