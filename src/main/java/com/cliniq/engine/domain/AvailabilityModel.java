package com.cliniq.engine.domain;

import com.cliniq.engine.exception.ValidationException;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable snapshot of a doctor's availability: slot duration, one template per
 * shift type, the 7 x shift-type weekly table and the time-off list.
 * <p>
 * {@link #windowsFor(LocalDate)} is a pure function of the snapshot and the date.
 */
public final class AvailabilityModel {

    public static final int DAYS_IN_WEEK = 7;
    public static final int MAX_DURATION_MINUTES = 480;

    private final Integer appointmentDurationMin;
    private final Map<ShiftType, ShiftTemplate> templates;
    private final boolean[][] weekly;
    private final List<TimeOffPeriod> timeOff;

    private AvailabilityModel(Integer appointmentDurationMin,
                              Map<ShiftType, ShiftTemplate> templates,
                              boolean[][] weekly,
                              List<TimeOffPeriod> timeOff) {
        this.appointmentDurationMin = appointmentDurationMin;
        this.templates = templates;
        this.weekly = weekly;
        this.timeOff = timeOff;
    }

    public static AvailabilityModel empty() {
        return new AvailabilityModel(null, new EnumMap<>(ShiftType.class),
                new boolean[DAYS_IN_WEEK][ShiftType.values().length], List.of());
    }

    public static AvailabilityModel of(Integer appointmentDurationMin,
                                       Collection<ShiftTemplate> templates,
                                       Collection<WeeklyShift> weeklyShifts,
                                       Collection<TimeOffPeriod> timeOff) {
        AvailabilityModel model = empty().withDuration(appointmentDurationMin);
        for (ShiftTemplate t : templates) {
            model = model.withTemplate(t);
        }
        model = model.withWeekly(weeklyShifts);
        for (TimeOffPeriod p : timeOff) {
            model = model.withTimeOff(p);
        }
        return model;
    }

    /** Sunday = 0 .. Saturday = 6. */
    public static int dayIndex(LocalDate date) {
        return date.getDayOfWeek().getValue() % DAYS_IN_WEEK;
    }

    public Optional<Integer> getAppointmentDurationMin() {
        return Optional.ofNullable(appointmentDurationMin);
    }

    public Optional<ShiftTemplate> getTemplate(ShiftType shiftType) {
        return Optional.ofNullable(templates.get(shiftType));
    }

    public List<ShiftTemplate> getTemplates() {
        return templates.values().stream()
                .sorted(Comparator.comparing(ShiftTemplate::start))
                .toList();
    }

    public boolean isEnabled(int dayOfWeek, ShiftType shiftType) {
        return weekly[dayOfWeek][shiftType.ordinal()];
    }

    /** Full fixed table, 14 cells ordered by day then shift type. */
    public List<WeeklyShift> getWeekly() {
        List<WeeklyShift> cells = new ArrayList<>();
        for (int day = 0; day < DAYS_IN_WEEK; day++) {
            for (ShiftType type : ShiftType.values()) {
                cells.add(new WeeklyShift(day, type, weekly[day][type.ordinal()]));
            }
        }
        return cells;
    }

    public List<TimeOffPeriod> getTimeOff() {
        return timeOff;
    }

    public boolean isTimeOff(LocalDate date) {
        return timeOff.stream().anyMatch(p -> p.covers(date));
    }

    /**
     * Ordered, disjoint open windows for the date. Time-off removes everything
     * regardless of the weekly table.
     */
    public List<TimeWindow> windowsFor(LocalDate date) {
        if (isTimeOff(date)) {
            return List.of();
        }
        int day = dayIndex(date);
        return templates.values().stream()
                .filter(t -> weekly[day][t.shiftType().ordinal()])
                .map(ShiftTemplate::toWindow)
                .sorted(Comparator.comparing(TimeWindow::start))
                .toList();
    }

    public AvailabilityModel withDuration(Integer minutes) {
        return new AvailabilityModel(minutes, templates, weekly, timeOff);
    }

    public AvailabilityModel withTemplate(ShiftTemplate template) {
        Map<ShiftType, ShiftTemplate> copy = new EnumMap<>(ShiftType.class);
        copy.putAll(templates);
        copy.put(template.shiftType(), template);
        return new AvailabilityModel(appointmentDurationMin, copy, weekly, timeOff);
    }

    /** Applies only the given cells; cells not mentioned keep their value. */
    public AvailabilityModel withWeekly(Collection<WeeklyShift> cells) {
        boolean[][] copy = new boolean[DAYS_IN_WEEK][];
        for (int day = 0; day < DAYS_IN_WEEK; day++) {
            copy[day] = weekly[day].clone();
        }
        for (WeeklyShift cell : cells) {
            if (cell.dayOfWeek() < 0 || cell.dayOfWeek() >= DAYS_IN_WEEK) {
                throw new ValidationException("dayOfWeek must be between 0 and 6, got " + cell.dayOfWeek());
            }
            if (cell.shiftType() == null) {
                throw new ValidationException("shiftType is required for weekly entry on day " + cell.dayOfWeek());
            }
            copy[cell.dayOfWeek()][cell.shiftType().ordinal()] = cell.enabled();
        }
        return new AvailabilityModel(appointmentDurationMin, templates, copy, timeOff);
    }

    public AvailabilityModel withTimeOff(TimeOffPeriod period) {
        List<TimeOffPeriod> copy = new ArrayList<>(timeOff);
        copy.add(period);
        return new AvailabilityModel(appointmentDurationMin, templates, weekly, List.copyOf(copy));
    }

    public AvailabilityModel withoutTimeOff(Long timeOffId) {
        List<TimeOffPeriod> copy = timeOff.stream()
                .filter(p -> p.id() == null || !p.id().equals(timeOffId))
                .toList();
        return new AvailabilityModel(appointmentDurationMin, templates, weekly, copy);
    }

    /**
     * Rejects malformed durations, inverted or overlapping templates and inverted time-off ranges.
     */
    public AvailabilityModel validate() {
        if (appointmentDurationMin != null
                && (appointmentDurationMin <= 0 || appointmentDurationMin > MAX_DURATION_MINUTES)) {
            throw new ValidationException("appointmentDurationMin must be between 1 and "
                    + MAX_DURATION_MINUTES + ", got " + appointmentDurationMin);
        }
        for (ShiftTemplate t : templates.values()) {
            if (t.start() == null || t.end() == null || !t.start().isBefore(t.end())) {
                throw new ValidationException("Shift " + t.shiftType() + " must start before it ends");
            }
        }
        List<ShiftTemplate> ordered = getTemplates();
        for (int i = 1; i < ordered.size(); i++) {
            if (ordered.get(i - 1).overlaps(ordered.get(i))) {
                throw new ValidationException("Shift " + ordered.get(i - 1).shiftType()
                        + " overlaps shift " + ordered.get(i).shiftType());
            }
        }
        for (TimeOffPeriod p : timeOff) {
            if (p.startDate() == null || p.endDate() == null || p.endDate().isBefore(p.startDate())) {
                throw new ValidationException("Time-off end date must not be before its start date");
            }
        }
        return this;
    }
}
