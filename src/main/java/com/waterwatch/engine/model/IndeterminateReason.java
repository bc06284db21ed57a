package com.waterwatch.engine.model;

/**
 * Why a rule could not be decided in a cycle.
 *
 * The first three are data-unavailable conditions, the last two are data-implausible.
 */
public enum IndeterminateReason {
    NO_DATA(DataQualityKind.DATA_UNAVAILABLE),
    STALE_DATA(DataQualityKind.DATA_UNAVAILABLE),
    HISTORIAN_UNAVAILABLE(DataQualityKind.DATA_UNAVAILABLE),
    TIMED_OUT(DataQualityKind.DATA_UNAVAILABLE),
    DELTA_REJECTED(DataQualityKind.DATA_IMPLAUSIBLE),
    SANITY_GATE(DataQualityKind.DATA_IMPLAUSIBLE);

    private final DataQualityKind kind;

    IndeterminateReason(DataQualityKind kind) {
        this.kind = kind;
    }

    public DataQualityKind getKind() {
        return kind;
    }
}
