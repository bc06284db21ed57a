package com.waterwatch.engine.delta;

import lombok.Value;

/**
 * Counter characteristics of one totalizer tag.
 *
 * Counters differ in bit width, so both values are configurable per tag.
 */
@Value
public class CounterProfile {

    /**
     * Largest value the counter can hold before wrapping to zero
     */
    double maxCapacity;

    /**
     * Fraction of maxCapacity at or above which a decrease is read as a rollover
     */
    double rolloverFraction;

    public double getRolloverThreshold() {
        return maxCapacity * rolloverFraction;
    }

    public CounterProfile withMaxCapacity(double capacity) {
        return new CounterProfile(capacity, rolloverFraction);
    }
}
