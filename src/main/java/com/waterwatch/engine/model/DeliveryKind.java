package com.waterwatch.engine.model;

/**
 * Why a notification was sent
 */
public enum DeliveryKind {
    ALARM,
    CLEARED,
    TEST
}
