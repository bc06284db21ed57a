package com.waterwatch.engine.model;

/**
 * Outcome of one notification attempt
 */
public enum DeliveryResult {
    SENT,
    FAILED,
    SKIPPED
}
