package com.waterwatch.engine.threshold;

import com.waterwatch.engine.config.EngineConfig;
import com.waterwatch.engine.model.IndeterminateReason;
import com.waterwatch.engine.model.ThresholdRule;
import com.waterwatch.engine.model.UsageDelta;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;

/**
 * Decides whether a usage delta violates a threshold rule.
 *
 * Rejected deltas and values beyond the sanity gate ({@code limit * sanityFactor})
 * are indeterminate: they are reported for operator review and never open or
 * close an alarm.
 *
 * @author WaterWatch
 * @version 1.0.0
 */
@Component
@Slf4j
public class ThresholdEvaluator {

    private final EngineConfig engineConfig;

    public ThresholdEvaluator(EngineConfig engineConfig) {
        this.engineConfig = engineConfig;
    }

    /**
     * Evaluate a rule against the delta of its window
     */
    public Evaluation evaluate(UsageDelta delta, ThresholdRule rule) {
        if (!delta.isAccepted()) {
            return Evaluation.indeterminate(rule, delta, IndeterminateReason.DELTA_REJECTED,
                    "delta rejected: " + delta.getRejectionReason());
        }

        double value = delta.getValue();
        double limit = rule.getLimitValue();
        double sanityFactor = engineConfig.getSanityFactor();

        // a non-positive limit has no meaningful multiple
        if (limit > 0 && value > limit * sanityFactor) {
            String detail = String.format("observed %.2f is more than %.0fx the limit %.2f, treated as a data artifact",
                    value, sanityFactor, limit);
            log.warn("SANITY GATE on threshold {} (tag {}, window {}): {} [confidence={}, startRaw={}, endRaw={}]",
                    rule.getRef(), delta.getTagId(), delta.getWindow().getKey(), detail,
                    delta.getConfidence(), delta.getStartRaw(), delta.getEndRaw());
            return Evaluation.indeterminate(rule, delta, IndeterminateReason.SANITY_GATE, detail);
        }

        boolean violated = rule.getComparisonOperator().test(value, limit);
        String detail = String.format("%.2f %s %s %.2f", value,
                violated ? "is" : "is not", rule.getComparisonOperator().getDescription(), limit);
        if (violated) {
            log.debug("Threshold {} violated: {}", rule.getRef(), detail);
        }
        return Evaluation.of(rule, delta, violated, detail);
    }

    /**
     * Largest believable delta for a tag, derived from the limits of the rules watching it.
     *
     * @return the ceiling, or 0 (no ceiling) when a rule has a non-positive limit or there are no rules
     */
    public double plausibilityCeiling(Collection<ThresholdRule> rulesForTag) {
        if (rulesForTag.isEmpty()) {
            return 0;
        }
        double maxLimit = 0;
        for (ThresholdRule rule : rulesForTag) {
            if (rule.getLimitValue() <= 0) {
                return 0;
            }
            maxLimit = Math.max(maxLimit, rule.getLimitValue());
        }
        return maxLimit * engineConfig.getSanityFactor();
    }
}
