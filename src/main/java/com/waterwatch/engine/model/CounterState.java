package com.waterwatch.engine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Last known state of a totalizer, carried between poll cycles.
 *
 * Instances are immutable; the owning store replaces the whole state once a
 * window has been fully consumed.
 *
 * @author WaterWatch
 * @version 1.0.0
 */
@Value
@Builder(toBuilder = true)
@AllArgsConstructor
public class CounterState {

    String tagId;

    double lastRawValue;

    Instant lastTimestamp;

    /**
     * Raw value at the start of the most recently processed window
     */
    double windowStartValue;

    /**
     * Key of the window windowStartValue belongs to
     */
    String windowKey;

    /**
     * Highest raw value ever observed; raises the effective capacity when the configured one is too small
     */
    double suspectedMaxCapacity;
}
