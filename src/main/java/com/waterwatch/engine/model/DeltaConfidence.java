package com.waterwatch.engine.model;

/**
 * How much a usage delta had to be corrected before it could be trusted.
 *
 * Ordered from least to most severe; a window built from several sample pairs
 * carries the most severe confidence of its pairs.
 */
public enum DeltaConfidence {
    NORMAL,
    RESET_CORRECTED,
    OVERFLOW_CORRECTED,
    REJECTED;

    public DeltaConfidence worst(DeltaConfidence other) {
        return other != null && other.ordinal() > ordinal() ? other : this;
    }
}
