package com.cliniq.engine.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.time.LocalDate;

@Entity
@Table(name = "doctor")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Doctor {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** Owning clinic (tenant). Resolves the clinic timezone. */
    @Column(name = "clinic_id", nullable = false, length = 50)
    private String clinicId;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(length = 100)
    private String specialization;

    /** Null until the schedule is configured. */
    @Column(name = "appointment_duration_min")
    private Integer appointmentDurationMin;

    @Column(name = "slots_generated_from")
    private LocalDate slotsGeneratedFrom;

    @Column(name = "slots_generated_to")
    private LocalDate slotsGeneratedTo;

    @Column(name = "schedule_configured_at")
    private Instant scheduleConfiguredAt;

    @Column(nullable = false)
    @Builder.Default
    private boolean active = true;
}
