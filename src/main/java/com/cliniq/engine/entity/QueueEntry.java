package com.cliniq.engine.entity;

import com.cliniq.engine.domain.QueuePriority;
import com.cliniq.engine.domain.QueueSource;
import com.cliniq.engine.domain.QueueStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.time.LocalDate;

@Entity
@Table(name = "queue_entry", uniqueConstraints = {
    @UniqueConstraint(name = "uk_queue_entry_token", columnNames = {"doctor_id", "queue_date", "token"})
}, indexes = {
    @Index(name = "idx_queue_entry_doctor_status", columnList = "doctor_id, status")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class QueueEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "doctor_id", nullable = false)
    private Doctor doctor;

    @Column(name = "queue_date", nullable = false)
    private LocalDate queueDate;

    @Column(nullable = false, updatable = false)
    private int token;

    @Column(name = "patient_ref", nullable = false, length = 100)
    private String patientRef;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private QueueSource source;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private QueuePriority priority = QueuePriority.NORMAL;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private QueueStatus status = QueueStatus.QUEUED;

    /** Reserved slot for APPOINTMENT check-ins; null for walk-ins. */
    @Column(name = "slot_id")
    private Long slotId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "appointment_id")
    private Appointment appointment;

    @Column(name = "checked_in_at", nullable = false)
    private Instant checkedInAt;

    @Column(name = "called_at")
    private Instant calledAt;

    @Column(name = "completed_at")
    private Instant completedAt;
}
