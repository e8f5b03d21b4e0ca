package com.cliniq.engine.domain;

/**
 * Named recurring time-of-day windows a doctor can work.
 */
public enum ShiftType {
    MORNING,
    EVENING
}
