package com.waterwatch.engine.shift;

import java.time.LocalTime;

/**
 * Daily time-of-day window [start, end) that may wrap past midnight.
 *
 * Contact on-call windows are evaluated with this rule.
 */
public final class ClockWindow {

    private ClockWindow() {
    }

    /**
     * @return true when {@code time} falls in [start, end); a window whose start equals its end covers the whole day
     */
    public static boolean contains(LocalTime start, LocalTime end, LocalTime time) {
        if (start.equals(end)) {
            return true;
        }
        if (start.isBefore(end)) {
            return !time.isBefore(start) && time.isBefore(end);
        }
        // wraps midnight, e.g. 23:00-06:00
        return !time.isBefore(start) || time.isBefore(end);
    }
}
