package com.waterwatch.engine.model;

import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;

/**
 * A half-open operational window [start, end) in the facility's local time.
 *
 * @author WaterWatch
 * @version 1.0.0
 */
@Value
public class TimeWindow {

    private static final DateTimeFormatter KEY_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm");
    private static final DateTimeFormatter DISPLAY_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm");

    /**
     * Shift or day window
     */
    WindowKind kind;

    /**
     * Display name, e.g. "Night Shift" or "Day"
     */
    String name;

    /**
     * Inclusive start
     */
    ZonedDateTime start;

    /**
     * Exclusive end
     */
    ZonedDateTime end;

    /**
     * Calendar day the window is attributed to (the day it starts)
     */
    public LocalDate getCalendarDay() {
        return start.toLocalDate();
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(start.toInstant()) && instant.isBefore(end.toInstant());
    }

    /**
     * Stable identity of the window, used to key open alarms
     */
    public String getKey() {
        return kind + ":" + KEY_FORMAT.format(start);
    }

    /**
     * Human-readable range; the end date is only repeated when the window spans midnight
     */
    public String formatRange() {
        if (!start.toLocalDate().equals(end.toLocalDate())) {
            return DISPLAY_FORMAT.format(start) + " - " + DISPLAY_FORMAT.format(end);
        }
        return DISPLAY_FORMAT.format(start) + " - " + TIME_FORMAT.format(end);
    }
}
