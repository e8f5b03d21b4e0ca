package com.cliniq.engine.entity;

import com.cliniq.engine.domain.ShiftType;
import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "doctor_weekly_shift", uniqueConstraints = {
    @UniqueConstraint(columnNames = {"doctor_id", "day_of_week", "shift_type"})
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DoctorWeeklyShift {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "doctor_id", nullable = false)
    private Doctor doctor;

    /**
     * Day of week: 0 = Sunday, 6 = Saturday
     */
    @Column(name = "day_of_week", nullable = false)
    private int dayOfWeek;

    @Enumerated(EnumType.STRING)
    @Column(name = "shift_type", nullable = false, length = 20)
    private ShiftType shiftType;

    @Column(nullable = false)
    private boolean enabled;
}
