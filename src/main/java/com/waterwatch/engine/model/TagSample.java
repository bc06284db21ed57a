package com.waterwatch.engine.model;

import lombok.Value;

import java.time.Instant;

/**
 * A single raw totalizer reading returned by the historian.
 *
 * Samples are immutable and are always handed to the engine ordered by timestamp.
 *
 * @author WaterWatch
 * @version 1.0.0
 */
@Value
public class TagSample {

    /**
     * Logical tag id the sample belongs to
     */
    String tagId;

    /**
     * Time the historian recorded the value
     */
    Instant timestamp;

    /**
     * Raw accumulated counter value
     */
    double rawValue;

    public static TagSample of(String tagId, Instant timestamp, double rawValue) {
        return new TagSample(tagId, timestamp, rawValue);
    }
}
