package com.waterwatch.engine.engine;

import com.waterwatch.engine.model.DeltaConfidence;
import com.waterwatch.engine.model.IndeterminateReason;
import com.waterwatch.engine.model.Severity;
import com.waterwatch.engine.model.Verdict;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Latest known state of one threshold, as shown on the dashboard.
 *
 * @author WaterWatch
 * @version 1.0.0
 */
@Value
@Builder(toBuilder = true)
public class ThresholdStatus {

    String ref;

    String tagId;

    boolean enabled;

    Severity severity;

    double limitValue;

    String operator;

    Verdict verdict;

    /**
     * Why the last verdict was indeterminate, null otherwise
     */
    IndeterminateReason reason;

    /**
     * True when the last cycle had no usable data (missing, stale or historian down)
     */
    boolean stale;

    /**
     * Value of the last delta, null when none could be built
     */
    Double lastValue;

    DeltaConfidence confidence;

    String windowKey;

    String windowRange;

    /**
     * Id of the open alarm, null when the threshold is not in alarm
     */
    String openAlarmId;

    String detail;

    Instant evaluatedAt;

    public boolean isInAlarm() {
        return openAlarmId != null;
    }
}
