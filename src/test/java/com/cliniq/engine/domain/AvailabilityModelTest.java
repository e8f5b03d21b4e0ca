package com.cliniq.engine.domain;

import com.cliniq.engine.exception.ValidationException;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AvailabilityModelTest {

    private static final LocalDate MONDAY = LocalDate.of(2030, 1, 7);
    private static final LocalDate WEDNESDAY = LocalDate.of(2030, 1, 9);
    private static final LocalDate SUNDAY = LocalDate.of(2030, 1, 6);

    private static final ShiftTemplate MORNING =
            new ShiftTemplate(ShiftType.MORNING, LocalTime.of(9, 0), LocalTime.of(13, 0));
    private static final ShiftTemplate EVENING =
            new ShiftTemplate(ShiftType.EVENING, LocalTime.of(14, 0), LocalTime.of(18, 0));

    private AvailabilityModel weekdays() {
        List<WeeklyShift> weekly = List.of(
                new WeeklyShift(1, ShiftType.MORNING, true),
                new WeeklyShift(1, ShiftType.EVENING, true),
                new WeeklyShift(3, ShiftType.MORNING, true),
                new WeeklyShift(3, ShiftType.EVENING, false));
        return AvailabilityModel.of(30, List.of(EVENING, MORNING), weekly, List.of());
    }

    @Test
    void dayIndexStartsOnSunday() {
        assertThat(AvailabilityModel.dayIndex(SUNDAY)).isZero();
        assertThat(AvailabilityModel.dayIndex(MONDAY)).isEqualTo(1);
        assertThat(AvailabilityModel.dayIndex(SUNDAY.plusDays(6))).isEqualTo(6);
    }

    @Test
    void windowsAreOrderedByStartAndFollowWeeklyTable() {
        AvailabilityModel model = weekdays();

        assertThat(model.windowsFor(MONDAY))
                .extracting(TimeWindow::shiftType)
                .containsExactly(ShiftType.MORNING, ShiftType.EVENING);
        assertThat(model.windowsFor(WEDNESDAY))
                .extracting(TimeWindow::shiftType)
                .containsExactly(ShiftType.MORNING);
        assertThat(model.windowsFor(SUNDAY)).isEmpty();
    }

    @Test
    void timeOffRemovesEveryWindowOfCoveredDates() {
        AvailabilityModel model = weekdays()
                .withTimeOff(new TimeOffPeriod(5L, MONDAY, MONDAY, TimeOffType.BREAK, null));

        assertThat(model.windowsFor(MONDAY)).isEmpty();
        assertThat(model.windowsFor(WEDNESDAY)).hasSize(1);
        assertThat(model.withoutTimeOff(5L).windowsFor(MONDAY)).hasSize(2);
    }

    @Test
    void weeklyCellsNotMentionedKeepTheirValue() {
        AvailabilityModel model = weekdays().withWeekly(List.of(new WeeklyShift(1, ShiftType.EVENING, false)));

        assertThat(model.isEnabled(1, ShiftType.MORNING)).isTrue();
        assertThat(model.isEnabled(1, ShiftType.EVENING)).isFalse();
        assertThat(model.getWeekly()).hasSize(14);
    }

    @Test
    void withCopiesLeaveOriginalUntouched() {
        AvailabilityModel original = weekdays();
        original.withDuration(20).withWeekly(List.of(new WeeklyShift(1, ShiftType.MORNING, false)));

        assertThat(original.getAppointmentDurationMin()).contains(30);
        assertThat(original.isEnabled(1, ShiftType.MORNING)).isTrue();
    }

    @Test
    void rejectsDayOutsideWeek() {
        assertThatThrownBy(() -> AvailabilityModel.empty().withWeekly(List.of(new WeeklyShift(7, ShiftType.MORNING, true))))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("dayOfWeek");
    }

    @Test
    void rejectsOverlappingTemplates() {
        AvailabilityModel model = weekdays()
                .withTemplate(new ShiftTemplate(ShiftType.EVENING, LocalTime.of(12, 30), LocalTime.of(16, 0)));

        assertThatThrownBy(model::validate)
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("overlaps");
    }

    @Test
    void rejectsInvertedTemplate() {
        AvailabilityModel model = AvailabilityModel.empty()
                .withTemplate(new ShiftTemplate(ShiftType.MORNING, LocalTime.of(13, 0), LocalTime.of(9, 0)));

        assertThatThrownBy(model::validate).isInstanceOf(ValidationException.class);
    }

    @Test
    void rejectsDurationOutOfRange() {
        assertThatThrownBy(() -> weekdays().withDuration(0).validate()).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> weekdays().withDuration(481).validate()).isInstanceOf(ValidationException.class);
        assertThat(weekdays().withDuration(480).validate().getAppointmentDurationMin()).contains(480);
    }

    @Test
    void rejectsInvertedTimeOff() {
        AvailabilityModel model = weekdays()
                .withTimeOff(new TimeOffPeriod(null, WEDNESDAY, MONDAY, TimeOffType.VACATION, "trip"));

        assertThatThrownBy(model::validate).isInstanceOf(ValidationException.class);
    }
}
