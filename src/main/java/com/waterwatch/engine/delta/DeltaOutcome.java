package com.waterwatch.engine.delta;

import com.waterwatch.engine.model.IndeterminateReason;
import com.waterwatch.engine.model.UsageDelta;
import lombok.Value;

/**
 * Result of computing a window delta: either a delta (possibly rejected) or the
 * reason no delta could be built.
 */
@Value
public class DeltaOutcome {

    UsageDelta delta;

    IndeterminateReason missingReason;

    String detail;

    public static DeltaOutcome of(UsageDelta delta) {
        return new DeltaOutcome(delta, null, null);
    }

    public static DeltaOutcome missing(IndeterminateReason reason, String detail) {
        return new DeltaOutcome(null, reason, detail);
    }

    public boolean hasDelta() {
        return delta != null;
    }
}
