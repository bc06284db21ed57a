package com.waterwatch.engine.model;

/**
 * Kind of aggregation window a usage delta was computed over.
 */
public enum WindowKind {
    SHIFT,
    DAY
}
