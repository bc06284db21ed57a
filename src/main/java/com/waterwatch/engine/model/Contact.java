package com.waterwatch.engine.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.Set;

/**
 * An on-call contact that may receive SMS alarms.
 *
 * @author WaterWatch
 * @version 1.0.0
 */
@Value
@Builder(toBuilder = true)
public class Contact {

    String name;

    /**
     * Phone number in E.164 format
     */
    String msisdn;

    String group;

    String role;

    /**
     * Days the contact is on call; empty means every day
     */
    @Singular("dayOfWeek")
    Set<DayOfWeek> daysOfWeek;

    /**
     * Inclusive start of the daily on-call window
     */
    LocalTime windowStart;

    /**
     * Exclusive end of the daily on-call window; may be earlier than the start when the window wraps midnight
     */
    LocalTime windowEnd;

    boolean enabled;

    public boolean isEveryDay() {
        return daysOfWeek == null || daysOfWeek.isEmpty() || daysOfWeek.size() == DayOfWeek.values().length;
    }
}
