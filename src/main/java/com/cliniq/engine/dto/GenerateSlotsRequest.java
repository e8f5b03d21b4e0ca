package com.cliniq.engine.dto;

import java.time.LocalDate;

public record GenerateSlotsRequest(LocalDate from, LocalDate to) {
}
