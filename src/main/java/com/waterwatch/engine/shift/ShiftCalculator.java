package com.waterwatch.engine.shift;

import com.waterwatch.engine.model.ThresholdTarget;
import com.waterwatch.engine.model.TimeWindow;
import com.waterwatch.engine.model.WindowKind;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Maps an instant to the facility's enclosing shift and day windows.
 *
 * Windows are half-open [start, end) in facility local time. A shift that
 * starts late in the evening runs into the next day and belongs to the day it
 * starts on. Stateless and thread-safe.
 *
 * @author WaterWatch
 * @version 1.0.0
 */
public class ShiftCalculator {

    public static final String DAY_WINDOW_NAME = "Day";

    private final ZoneId zone;
    private final List<ShiftDefinition> shifts;
    private final LocalTime dayStart;

    /**
     * @param zone     facility time zone
     * @param shifts   shift definitions in any order; start times must be distinct
     * @param dayStart local time the calendar-day window starts
     */
    public ShiftCalculator(ZoneId zone, List<ShiftDefinition> shifts, LocalTime dayStart) {
        if (shifts == null || shifts.isEmpty()) {
            throw new IllegalArgumentException("At least one shift must be defined");
        }
        List<ShiftDefinition> sorted = new ArrayList<>(shifts);
        sorted.sort(Comparator.comparing(ShiftDefinition::getStart));
        for (int i = 1; i < sorted.size(); i++) {
            if (sorted.get(i).getStart().equals(sorted.get(i - 1).getStart())) {
                throw new IllegalArgumentException("Shifts '" + sorted.get(i - 1).getName() + "' and '"
                        + sorted.get(i).getName() + "' start at the same time " + sorted.get(i).getStart());
            }
        }
        this.zone = zone;
        this.shifts = List.copyOf(sorted);
        this.dayStart = dayStart;
    }

    /**
     * Three eight-hour shifts starting 07:00, 15:00 and 23:00, days starting at midnight
     */
    public static ShiftCalculator standard(ZoneId zone) {
        return new ShiftCalculator(zone, List.of(
                new ShiftDefinition("Day Shift", LocalTime.of(7, 0)),
                new ShiftDefinition("Afternoon Shift", LocalTime.of(15, 0)),
                new ShiftDefinition("Night Shift", LocalTime.of(23, 0))),
                LocalTime.MIDNIGHT);
    }

    public TimeWindow shiftWindow(Instant instant) {
        ZonedDateTime local = instant.atZone(zone);
        LocalTime time = local.toLocalTime();
        LocalDate startDate = local.toLocalDate();

        int index = -1;
        for (int i = 0; i < shifts.size(); i++) {
            if (!time.isBefore(shifts.get(i).getStart())) {
                index = i;
            }
        }
        if (index < 0) {
            // before the first shift of the day: still in yesterday's last shift
            index = shifts.size() - 1;
            startDate = startDate.minusDays(1);
        }

        ShiftDefinition shift = shifts.get(index);
        ZonedDateTime start = ZonedDateTime.of(startDate, shift.getStart(), zone);
        ZonedDateTime end = index + 1 < shifts.size()
                ? ZonedDateTime.of(startDate, shifts.get(index + 1).getStart(), zone)
                : ZonedDateTime.of(startDate.plusDays(1), shifts.get(0).getStart(), zone);
        return new TimeWindow(WindowKind.SHIFT, shift.getName(), start, end);
    }

    /**
     * The shift that ended when the current one started
     */
    public TimeWindow previousShiftWindow(Instant instant) {
        return shiftWindow(shiftWindow(instant).getStart().toInstant().minusSeconds(1));
    }

    /**
     * Every shift starting on the given calendar day, in start order
     */
    public List<TimeWindow> shiftsOfDay(LocalDate date) {
        List<TimeWindow> windows = new ArrayList<>();
        for (ShiftDefinition shift : shifts) {
            windows.add(shiftWindow(ZonedDateTime.of(date, shift.getStart(), zone).toInstant()));
        }
        return windows;
    }

    public TimeWindow dayWindow(Instant instant) {
        ZonedDateTime local = instant.atZone(zone);
        LocalDate date = local.toLocalDate();
        if (local.toLocalTime().isBefore(dayStart)) {
            date = date.minusDays(1);
        }
        return new TimeWindow(WindowKind.DAY, DAY_WINDOW_NAME,
                ZonedDateTime.of(date, dayStart, zone),
                ZonedDateTime.of(date.plusDays(1), dayStart, zone));
    }

    /**
     * Window a threshold target aggregates over
     */
    public TimeWindow windowFor(ThresholdTarget target, Instant instant) {
        return switch (target) {
            case SHIFT_TOTAL -> shiftWindow(instant);
            case DAY_TOTAL -> dayWindow(instant);
        };
    }

    public ZoneId getZone() {
        return zone;
    }

    public List<ShiftDefinition> getShifts() {
        return shifts;
    }
}
