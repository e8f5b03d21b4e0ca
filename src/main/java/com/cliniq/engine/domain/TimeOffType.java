package com.cliniq.engine.domain;

public enum TimeOffType {
    BREAK,
    VACATION,
    OTHER
}
