package com.waterwatch.engine.model;

/**
 * Outcome of comparing a usage delta with a threshold rule
 */
public enum Verdict {
    OK,
    VIOLATED,
    INDETERMINATE
}
