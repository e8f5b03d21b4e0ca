package com.cliniq.engine.dto;

import com.cliniq.engine.domain.TimeOffType;

import java.time.LocalDate;

public record TimeOffRequest(LocalDate startDate, LocalDate endDate, TimeOffType type, String reason) {
}
