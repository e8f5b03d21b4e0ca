package com.cliniq.engine.service;

import com.cliniq.engine.domain.AvailabilityModel;
import com.cliniq.engine.domain.ConflictReason;
import com.cliniq.engine.domain.ShiftTemplate;
import com.cliniq.engine.domain.ShiftType;
import com.cliniq.engine.domain.SlotConflict;
import com.cliniq.engine.domain.TimeOffPeriod;
import com.cliniq.engine.domain.TimeOffType;
import com.cliniq.engine.domain.WeeklyShift;
import com.cliniq.engine.entity.Appointment;
import com.cliniq.engine.entity.AppointmentSlot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class ConflictDetectorTest {

    private static final LocalDate MONDAY = LocalDate.of(2030, 1, 7);
    private static final LocalDate WEDNESDAY = LocalDate.of(2030, 1, 9);

    private ConflictDetector detector;
    private AvailabilityModel current;

    @BeforeEach
    void setUp() {
        detector = new ConflictDetector();
        current = AvailabilityModel.of(15,
                List.of(new ShiftTemplate(ShiftType.MORNING, LocalTime.of(9, 0), LocalTime.of(13, 0)),
                        new ShiftTemplate(ShiftType.EVENING, LocalTime.of(14, 0), LocalTime.of(18, 0))),
                List.of(new WeeklyShift(1, ShiftType.MORNING, true),
                        new WeeklyShift(3, ShiftType.MORNING, true),
                        new WeeklyShift(3, ShiftType.EVENING, true)),
                List.of());
    }

    private static AppointmentSlot booked(long id, LocalDate date, ShiftType type, int h, int m, int minutes) {
        LocalTime start = LocalTime.of(h, m);
        return AppointmentSlot.builder()
                .id(id)
                .slotDate(date)
                .startTime(start)
                .endTime(start.plusMinutes(minutes))
                .shiftType(type)
                .status(AppointmentSlot.Status.BOOKED)
                .build();
    }

    private List<SlotConflict> detect(AvailabilityModel candidate, List<AppointmentSlot> slots,
                                      Map<Long, Appointment> appointments) {
        return detector.detect(candidate, slots, appointments, MONDAY.minusDays(1), LocalTime.NOON);
    }

    @Test
    void unchangedModelHasNoConflicts() {
        List<AppointmentSlot> slots = List.of(
                booked(1, MONDAY, ShiftType.MORNING, 9, 0, 15),
                booked(2, WEDNESDAY, ShiftType.EVENING, 14, 45, 15));

        assertThat(detect(current, slots, Map.of())).isEmpty();
    }

    @Test
    void disabledShiftIsReportedWithAppointment() {
        AvailabilityModel candidate = current.withWeekly(List.of(new WeeklyShift(3, ShiftType.EVENING, false)));
        Appointment appointment = Appointment.builder().id(70L).patientRef("P-9").build();

        List<SlotConflict> conflicts = detect(candidate,
                List.of(booked(2, WEDNESDAY, ShiftType.EVENING, 15, 0, 15)), Map.of(2L, appointment));

        assertThat(conflicts).singleElement().satisfies(c -> {
            assertThat(c.reason()).isEqualTo(ConflictReason.SHIFT_DISABLED);
            assertThat(c.appointmentId()).isEqualTo(70L);
            assertThat(c.patientRef()).isEqualTo("P-9");
            assertThat(c.detail()).contains("Wednesday");
        });
    }

    @Test
    void shrunkShiftIsTimeOutsideShift() {
        AvailabilityModel candidate = current.withTemplate(
                new ShiftTemplate(ShiftType.MORNING, LocalTime.of(10, 0), LocalTime.of(13, 0)));

        List<SlotConflict> conflicts = detect(candidate,
                List.of(booked(1, MONDAY, ShiftType.MORNING, 9, 30, 15), booked(3, MONDAY, ShiftType.MORNING, 10, 0, 15)),
                Map.of());

        assertThat(conflicts).extracting(SlotConflict::slotId, SlotConflict::reason)
                .containsExactly(tuple(1L, ConflictReason.TIME_OUTSIDE_SHIFT));
    }

    @Test
    void longerDurationFlagsEverySlotOfTheOldLength() {
        AvailabilityModel candidate = current.withDuration(20);

        List<SlotConflict> conflicts = detect(candidate,
                List.of(booked(1, MONDAY, ShiftType.MORNING, 9, 15, 15), booked(4, MONDAY, ShiftType.MORNING, 9, 40, 20)),
                Map.of());

        assertThat(conflicts).extracting(SlotConflict::slotId).containsExactly(1L);
        assertThat(conflicts.get(0).reason()).isEqualTo(ConflictReason.DURATION_MISMATCH);
    }

    @Test
    void offGridStartIsDurationMismatch() {
        AvailabilityModel candidate = current.withDuration(20);

        assertThat(detect(candidate, List.of(booked(5, MONDAY, ShiftType.MORNING, 9, 30, 20)), Map.of()))
                .extracting(SlotConflict::reason)
                .containsExactly(ConflictReason.DURATION_MISMATCH);
    }

    @Test
    void timeOffTakesPrecedence() {
        AvailabilityModel candidate = current
                .withTimeOff(new TimeOffPeriod(null, MONDAY, MONDAY, TimeOffType.VACATION, null))
                .withDuration(20);

        assertThat(detect(candidate, List.of(booked(1, MONDAY, ShiftType.MORNING, 9, 15, 15)), Map.of()))
                .extracting(SlotConflict::reason)
                .containsExactly(ConflictReason.TIME_OFF);
    }

    @Test
    void elapsedSlotsAreNeverFlagged() {
        AvailabilityModel candidate = current.withWeekly(List.of(new WeeklyShift(1, ShiftType.MORNING, false)));
        List<AppointmentSlot> slots = List.of(
                booked(1, MONDAY, ShiftType.MORNING, 9, 0, 15),
                booked(2, MONDAY, ShiftType.MORNING, 12, 45, 15),
                booked(3, MONDAY.minusDays(7), ShiftType.MORNING, 9, 0, 15));

        List<SlotConflict> conflicts = detector.detect(candidate, slots, Map.of(), MONDAY, LocalTime.of(11, 0));

        assertThat(conflicts).extracting(SlotConflict::slotId).containsExactly(2L);
    }

    @Test
    void conflictsComeInDateAndTimeOrder() {
        AvailabilityModel candidate = current.withDuration(30);
        List<AppointmentSlot> slots = List.of(
                booked(9, WEDNESDAY, ShiftType.MORNING, 9, 15, 15),
                booked(8, MONDAY, ShiftType.MORNING, 10, 15, 15),
                booked(7, MONDAY, ShiftType.MORNING, 9, 15, 15));

        assertThat(detect(candidate, slots, Map.of()))
                .extracting(SlotConflict::slotId)
                .containsExactly(7L, 8L, 9L);
    }
}
