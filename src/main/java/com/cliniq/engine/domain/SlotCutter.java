package com.cliniq.engine.domain;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Cuts the windows of a model into fixed-length slots. No partial trailing slot.
 */
public final class SlotCutter {

    private SlotCutter() {
    }

    public static List<SlotWindow> cut(AvailabilityModel model, LocalDate date, int durationMinutes) {
        List<SlotWindow> slots = new ArrayList<>();
        for (TimeWindow window : model.windowsFor(date)) {
            LocalTime t = window.start();
            // plusMinutes wraps at midnight; the second check stops the loop there
            while (!t.plusMinutes(durationMinutes).isAfter(window.end())
                    && t.plusMinutes(durationMinutes).isAfter(t)) {
                LocalTime end = t.plusMinutes(durationMinutes);
                slots.add(new SlotWindow(date, window.shiftType(), t, end));
                t = end;
            }
        }
        return slots;
    }

    /** True when start lies on the grid of the window for the given duration. */
    public static boolean onGrid(TimeWindow window, LocalTime start, int durationMinutes) {
        long offset = Duration.between(window.start(), start).toMinutes();
        return offset >= 0 && offset % durationMinutes == 0;
    }
}
