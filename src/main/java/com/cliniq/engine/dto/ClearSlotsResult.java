package com.cliniq.engine.dto;

public record ClearSlotsResult(int deletedCount) {
}
