package com.cliniq.engine.dto;

import java.time.LocalDate;

public record SlotGenerationResult(int created, int deletedAvailable, LocalDate from, LocalDate to) {
}
