package com.waterwatch.engine.delta;

import com.waterwatch.engine.model.CounterState;
import com.waterwatch.engine.model.DeltaConfidence;
import com.waterwatch.engine.model.IndeterminateReason;
import com.waterwatch.engine.model.TagSample;
import com.waterwatch.engine.model.TimeWindow;
import com.waterwatch.engine.model.UsageDelta;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Turns raw totalizer readings into non-negative usage deltas.
 *
 * A decrease between two readings is either a rollover (the counter wrapped at
 * its capacity) or a hard reset (device restart). The two cannot be told apart
 * reliably; a decrease from at or above {@code maxCapacity * rolloverFraction}
 * is treated as a rollover, anything else as a reset. Every correction is
 * logged with its confidence so it can be audited.
 *
 * @author WaterWatch
 * @version 1.0.0
 */
@Component
@Slf4j
public class DeltaEngine {

    private final CounterStateStore counterStates;
    private final MeterRegistry meterRegistry;

    public DeltaEngine(CounterStateStore counterStates, MeterRegistry meterRegistry) {
        this.counterStates = counterStates;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Compute the delta between two observations bracketing a window
     */
    public UsageDelta computeDelta(String tagId, TimeWindow window, TagSample start, TagSample end,
                                   CounterProfile profile) {
        PairDelta pair = correct(start.getRawValue(), end.getRawValue(), profile);
        if (pair.confidence != DeltaConfidence.NORMAL) {
            logCorrection(tagId, window, pair, start.getRawValue(), end.getRawValue(), profile);
        }
        return UsageDelta.builder()
                .tagId(tagId)
                .window(window)
                .value(pair.value)
                .confidence(pair.confidence)
                .startRaw(start.getRawValue())
                .endRaw(end.getRawValue())
                .sampleCount(2)
                .build();
    }

    /**
     * Compute the delta between two observations and reject it when it exceeds the plausibility ceiling
     *
     * @param plausibilityCeiling largest believable delta for the tag; zero or less disables the check
     */
    public UsageDelta computeDelta(String tagId, TimeWindow window, TagSample start, TagSample end,
                                   CounterProfile profile, double plausibilityCeiling) {
        UsageDelta delta = computeDelta(tagId, window, start, end, profile);
        return checkPlausibility(delta, plausibilityCeiling);
    }

    /**
     * Compute the usage of a whole window from its ordered samples.
     *
     * The window delta is the raw span between the first and last sample plus
     * whatever the rollover and reset corrections of consecutive samples add,
     * so a reset in the middle of a window keeps the usage recorded before it.
     * Without corrections it is exactly {@code end - start}. The tag's counter
     * state is updated only once the whole window has been consumed.
     *
     * @param samples             samples inside the window, ordered by timestamp
     * @param plausibilityCeiling largest believable delta for the tag; zero or less disables the check
     * @param now                 evaluation time, used for the staleness check
     * @param staleAfter          newest sample must be younger than this
     */
    public DeltaOutcome computeWindowDelta(String tagId, TimeWindow window, List<TagSample> samples,
                                           CounterProfile profile, double plausibilityCeiling,
                                           Instant now, Duration staleAfter) {
        List<TagSample> usable = samples.stream()
                .filter(s -> Double.isFinite(s.getRawValue()))
                .toList();

        if (usable.size() < 2) {
            return DeltaOutcome.missing(IndeterminateReason.NO_DATA,
                    String.format("%d usable sample(s) for %s in %s", usable.size(), tagId, window.formatRange()));
        }

        TagSample first = usable.get(0);
        TagSample last = usable.get(usable.size() - 1);
        if (last.getTimestamp().isBefore(now.minus(staleAfter))) {
            return DeltaOutcome.missing(IndeterminateReason.STALE_DATA,
                    String.format("newest sample for %s is from %s", tagId, last.getTimestamp()));
        }

        return counterStates.withTagLock(tagId, () -> {
            CounterState previous = counterStates.get(tagId).orElse(null);
            double suspectedCapacity = previous != null ? previous.getSuspectedMaxCapacity() : 0;
            CounterProfile effective = profile.withMaxCapacity(Math.max(profile.getMaxCapacity(), suspectedCapacity));

            // raw span of the window plus whatever the corrections add back
            double corrections = 0;
            double maxObserved = sanitize(first.getRawValue());
            DeltaConfidence confidence = DeltaConfidence.NORMAL;
            for (int i = 1; i < usable.size(); i++) {
                double from = usable.get(i - 1).getRawValue();
                double to = usable.get(i).getRawValue();
                PairDelta pair = correct(from, to, effective);
                if (pair.confidence != DeltaConfidence.NORMAL) {
                    logCorrection(tagId, window, pair, from, to, effective);
                    corrections += pair.value - (sanitize(to) - sanitize(from));
                }
                confidence = confidence.worst(pair.confidence);
                maxObserved = Math.max(maxObserved, sanitize(to));
            }

            double total = sanitize(last.getRawValue()) - sanitize(first.getRawValue()) + corrections;

            UsageDelta delta = checkPlausibility(UsageDelta.builder()
                    .tagId(tagId)
                    .window(window)
                    .value(Math.max(0, total))
                    .confidence(confidence)
                    .startRaw(first.getRawValue())
                    .endRaw(last.getRawValue())
                    .sampleCount(usable.size())
                    .build(), plausibilityCeiling);

            if (Thread.currentThread().isInterrupted()) {
                // cycle was cancelled; leave the counter state as it was
                log.debug("Delta for tag {} computed after cancellation, counter state not updated", tagId);
                return DeltaOutcome.of(delta);
            }

            if (maxObserved > profile.getMaxCapacity() && maxObserved > suspectedCapacity) {
                log.warn("Tag {} reported {} which exceeds its configured capacity {}; using the observed value as capacity",
                        tagId, maxObserved, profile.getMaxCapacity());
            }
            counterStates.apply(CounterState.builder()
                    .tagId(tagId)
                    .lastRawValue(last.getRawValue())
                    .lastTimestamp(last.getTimestamp())
                    .windowStartValue(first.getRawValue())
                    .windowKey(window.getKey())
                    .suspectedMaxCapacity(Math.max(suspectedCapacity, maxObserved))
                    .build());

            meterRegistry.counter("waterwatch_delta_computations_total",
                    "confidence", delta.getConfidence().name()).increment();
            return DeltaOutcome.of(delta);
        });
    }

    /**
     * Mark a delta rejected when it is larger than any believable usage for the tag
     */
    private UsageDelta checkPlausibility(UsageDelta delta, double plausibilityCeiling) {
        if (plausibilityCeiling <= 0 || delta.getValue() <= plausibilityCeiling) {
            return delta;
        }
        String reason = String.format("delta %.1f exceeds plausibility ceiling %.1f", delta.getValue(), plausibilityCeiling);
        log.warn("Rejected delta for tag {} in {}: {} (start={}, end={}, confidence={})",
                delta.getTagId(), delta.getWindow().getKey(), reason,
                delta.getStartRaw(), delta.getEndRaw(), delta.getConfidence());
        return UsageDelta.builder()
                .tagId(delta.getTagId())
                .window(delta.getWindow())
                .value(delta.getValue())
                .confidence(DeltaConfidence.REJECTED)
                .startRaw(delta.getStartRaw())
                .endRaw(delta.getEndRaw())
                .sampleCount(delta.getSampleCount())
                .rejectionReason(reason)
                .build();
    }

    /**
     * Corrected delta between two raw readings, never negative
     */
    static PairDelta correct(double startRaw, double endRaw, CounterProfile profile) {
        double start = sanitize(startRaw);
        double end = sanitize(endRaw);

        if (end >= start) {
            return new PairDelta(end - start, DeltaConfidence.NORMAL);
        }

        double capacity = profile.getMaxCapacity();
        if (start <= capacity && start >= profile.getRolloverThreshold()) {
            return new PairDelta(Math.max(0, (capacity - start) + end), DeltaConfidence.OVERFLOW_CORRECTED);
        }

        // hard reset: the post-reset reading is the usage since the reset
        return new PairDelta(Math.max(0, end), DeltaConfidence.RESET_CORRECTED);
    }

    private static double sanitize(double raw) {
        return raw < 0 ? 0 : raw;
    }

    private void logCorrection(String tagId, TimeWindow window, PairDelta pair, double from, double to,
                               CounterProfile profile) {
        log.info("Counter correction on tag {} in {}: {} -> {} read as {} (capacity={}, delta={})",
                tagId, window.getKey(), from, to, pair.confidence, profile.getMaxCapacity(), pair.value);
    }

    @Value
    static class PairDelta {
        double value;
        DeltaConfidence confidence;
    }
}
