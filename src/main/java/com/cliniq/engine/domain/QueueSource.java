package com.cliniq.engine.domain;

public enum QueueSource {
    APPOINTMENT,
    WALKIN
}
