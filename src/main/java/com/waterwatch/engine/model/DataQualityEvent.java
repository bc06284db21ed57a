package com.waterwatch.engine.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A data problem recorded for operator review. Never triggers a notification.
 *
 * @author WaterWatch
 * @version 1.0.0
 */
@Value
@Builder
public class DataQualityEvent {

    String tagId;

    /**
     * Rule that observed the problem, null when raised by the delta engine for the whole tag
     */
    String thresholdRef;

    DataQualityKind kind;

    IndeterminateReason reason;

    String windowKey;

    /**
     * Offending value, null when no value was available
     */
    Double value;

    String detail;

    Instant observedAt;
}
