package com.waterwatch.engine.model;

import lombok.Builder;
import lombok.Value;

/**
 * A validated threshold rule.
 *
 * Rules are immutable; enabling or disabling one publishes a new configuration
 * snapshot rather than mutating the rule in place.
 *
 * @author WaterWatch
 * @version 1.0.0
 */
@Value
@Builder(toBuilder = true)
public class ThresholdRule {

    /**
     * Unique reference, e.g. "FT5101_TotalLts_shift"
     */
    String ref;

    /**
     * Logical historian tag the rule watches
     */
    String tagId;

    double limitValue;

    ComparisonOperator comparisonOperator;

    ThresholdTarget target;

    Severity severity;

    /**
     * SMS text template, supports {value}, {unit}, {limit}, {severity}, {ref}, {tag}, {op}, {target}, {window}
     */
    String messageTemplate;

    /**
     * Contact group notified when the rule opens an alarm
     */
    String group;

    /**
     * Engineering unit used in messages
     */
    String unit;

    /**
     * Cooldown override, null to use the engine default
     */
    Integer cooldownMinutes;

    boolean enabled;

    public WindowKind getWindowKind() {
        return target.getWindowKind();
    }
}
