package com.cliniq.engine.dto;

public record BookAppointmentRequest(Long slotId, String patientRef) {
}
