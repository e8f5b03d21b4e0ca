package com.cliniq.engine.domain;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SlotCutterTest {

    private static final LocalDate MONDAY = LocalDate.of(2030, 1, 7);

    private static AvailabilityModel morning(LocalTime start, LocalTime end) {
        return AvailabilityModel.of(null,
                List.of(new ShiftTemplate(ShiftType.MORNING, start, end)),
                List.of(new WeeklyShift(1, ShiftType.MORNING, true)),
                List.of());
    }

    @Test
    void fourHourMorningYieldsSixteenQuarterHours() {
        List<SlotWindow> slots = SlotCutter.cut(morning(LocalTime.of(9, 0), LocalTime.of(13, 0)), MONDAY, 15);

        assertThat(slots).hasSize(16);
        assertThat(slots.get(0).start()).isEqualTo(LocalTime.of(9, 0));
        assertThat(slots.get(15).end()).isEqualTo(LocalTime.of(13, 0));
    }

    @Test
    void twentyMinuteGridYieldsTwelve() {
        assertThat(SlotCutter.cut(morning(LocalTime.of(9, 0), LocalTime.of(13, 0)), MONDAY, 20)).hasSize(12);
    }

    @Test
    void dropsPartialTrailingSlot() {
        List<SlotWindow> slots = SlotCutter.cut(morning(LocalTime.of(9, 0), LocalTime.of(10, 0)), MONDAY, 25);

        assertThat(slots).extracting(SlotWindow::start)
                .containsExactly(LocalTime.of(9, 0), LocalTime.of(9, 25));
    }

    @Test
    void stopsAtMidnight() {
        List<SlotWindow> slots = SlotCutter.cut(morning(LocalTime.of(22, 0), LocalTime.of(23, 59)), MONDAY, 60);

        assertThat(slots).hasSize(1);
        assertThat(slots.get(0).end()).isEqualTo(LocalTime.of(23, 0));
    }

    @Test
    void disabledDayYieldsNothing() {
        assertThat(SlotCutter.cut(morning(LocalTime.of(9, 0), LocalTime.of(13, 0)), MONDAY.plusDays(1), 15)).isEmpty();
    }

    @Test
    void onGridMeasuresFromShiftStart() {
        TimeWindow window = new TimeWindow(ShiftType.MORNING, LocalTime.of(9, 0), LocalTime.of(13, 0));

        assertThat(SlotCutter.onGrid(window, LocalTime.of(9, 40), 20)).isTrue();
        assertThat(SlotCutter.onGrid(window, LocalTime.of(9, 15), 20)).isFalse();
        assertThat(SlotCutter.onGrid(window, LocalTime.of(8, 40), 20)).isFalse();
    }
}
