package com.waterwatch.engine.model;

import lombok.Builder;
import lombok.Value;

/**
 * Usage accumulated by a tag over one window, after reset/rollover correction.
 *
 * The value is never negative. A {@link DeltaConfidence#REJECTED} delta is kept
 * for diagnostics only and is never evaluated against a threshold.
 *
 * @author WaterWatch
 * @version 1.0.0
 */
@Value
@Builder
public class UsageDelta {

    String tagId;

    TimeWindow window;

    double value;

    DeltaConfidence confidence;

    /**
     * First raw value consumed for the window
     */
    double startRaw;

    /**
     * Last raw value consumed for the window
     */
    double endRaw;

    /**
     * Number of samples the delta was built from
     */
    int sampleCount;

    /**
     * Why the delta was rejected, null unless rejected
     */
    String rejectionReason;

    public boolean isAccepted() {
        return confidence != DeltaConfidence.REJECTED;
    }

    public WindowKind getWindowKind() {
        return window.getKind();
    }
}
