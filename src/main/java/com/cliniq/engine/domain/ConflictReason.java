package com.cliniq.engine.domain;

public enum ConflictReason {
    TIME_OFF,
    SHIFT_DISABLED,
    TIME_OUTSIDE_SHIFT,
    DURATION_MISMATCH
}
