package com.waterwatch.engine.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A threshold violation from the moment it opened until it cleared.
 *
 * At most one event per threshold reference and window is open at a time.
 *
 * @author WaterWatch
 * @version 1.0.0
 */
@Value
@Builder(toBuilder = true)
public class AlarmEvent {

    String id;

    String thresholdRef;

    String tagId;

    double observedValue;

    double limitValue;

    /**
     * Key of the window the violation was observed in
     */
    String windowKey;

    Instant windowStart;

    Instant windowEnd;

    Severity severity;

    /**
     * Rendered notification text
     */
    String message;

    Instant openedAt;

    Instant acknowledgedAt;

    String acknowledgedBy;

    Instant closedAt;

    public boolean isOpen() {
        return closedAt == null;
    }

    public boolean isAcknowledged() {
        return acknowledgedAt != null;
    }
}
