package com.cliniq.engine.dto;

import com.cliniq.engine.domain.QueueStatus;

public record TransitionRequest(QueueStatus status) {
}
