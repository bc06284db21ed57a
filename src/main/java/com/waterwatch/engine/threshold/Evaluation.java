package com.waterwatch.engine.threshold;

import com.waterwatch.engine.model.IndeterminateReason;
import com.waterwatch.engine.model.ThresholdRule;
import com.waterwatch.engine.model.UsageDelta;
import com.waterwatch.engine.model.Verdict;
import lombok.Builder;
import lombok.Value;

/**
 * Result of evaluating one threshold rule against one usage delta.
 *
 * @author WaterWatch
 * @version 1.0.0
 */
@Value
@Builder
public class Evaluation {

    String ruleRef;

    Verdict verdict;

    /**
     * Why the rule could not be decided, null unless indeterminate
     */
    IndeterminateReason reason;

    /**
     * Delta the verdict was based on, null when no delta could be built
     */
    UsageDelta delta;

    /**
     * Human-readable description of the outcome
     */
    String detail;

    public boolean isViolated() {
        return verdict == Verdict.VIOLATED;
    }

    public boolean isIndeterminate() {
        return verdict == Verdict.INDETERMINATE;
    }

    /**
     * Observed value, null when no delta could be built
     */
    public Double getObservedValue() {
        return delta != null ? delta.getValue() : null;
    }

    public static Evaluation of(ThresholdRule rule, UsageDelta delta, boolean violated, String detail) {
        return Evaluation.builder()
                .ruleRef(rule.getRef())
                .verdict(violated ? Verdict.VIOLATED : Verdict.OK)
                .delta(delta)
                .detail(detail)
                .build();
    }

    public static Evaluation indeterminate(ThresholdRule rule, UsageDelta delta, IndeterminateReason reason,
                                           String detail) {
        return Evaluation.builder()
                .ruleRef(rule.getRef())
                .verdict(Verdict.INDETERMINATE)
                .reason(reason)
                .delta(delta)
                .detail(detail)
                .build();
    }
}
