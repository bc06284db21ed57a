package com.waterwatch.engine.model;

public enum DataQualityKind {
    DATA_UNAVAILABLE,
    DATA_IMPLAUSIBLE
}
