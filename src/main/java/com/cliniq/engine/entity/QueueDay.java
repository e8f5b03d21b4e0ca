package com.cliniq.engine.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;

/**
 * Lock anchor for one doctor's queue on one date. Writers that must see a stable
 * view of that queue lock this row first. It deliberately stores no counter.
 */
@Entity
@Table(name = "queue_day", uniqueConstraints = {
    @UniqueConstraint(name = "uk_queue_day", columnNames = {"doctor_id", "queue_date"})
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class QueueDay {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "doctor_id", nullable = false)
    private Doctor doctor;

    @Column(name = "queue_date", nullable = false)
    private LocalDate queueDate;
}
