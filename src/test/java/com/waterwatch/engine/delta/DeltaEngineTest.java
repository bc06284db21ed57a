package com.waterwatch.engine.delta;

import com.waterwatch.engine.model.CounterState;
import com.waterwatch.engine.model.DeltaConfidence;
import com.waterwatch.engine.model.IndeterminateReason;
import com.waterwatch.engine.model.TagSample;
import com.waterwatch.engine.model.TimeWindow;
import com.waterwatch.engine.model.UsageDelta;
import com.waterwatch.engine.shift.ShiftCalculator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link DeltaEngine}.
 */
class DeltaEngineTest {

    private static final String TAG = "FT5101_TotalLts";
    private static final Instant NOW = Instant.parse("2024-03-12T10:00:00Z");
    private static final Duration STALE_AFTER = Duration.ofMinutes(30);
    private static final CounterProfile UINT32 = new CounterProfile(4_294_967_295.0, 0.9);

    private CounterStateStore counterStates;
    private DeltaEngine deltaEngine;
    private TimeWindow window;

    @BeforeEach
    void setUp() {
        counterStates = new CounterStateStore();
        deltaEngine = new DeltaEngine(counterStates, new SimpleMeterRegistry());
        window = ShiftCalculator.standard(ZoneOffset.UTC).shiftWindow(NOW);
    }

    @Test
    @DisplayName("Decrease from near capacity is corrected as a rollover")
    void rolloverNearCapacity() {
        DeltaEngine.PairDelta pair = DeltaEngine.correct(0.95, 0.05, new CounterProfile(1.0, 0.9));

        assertThat(pair.getConfidence()).isEqualTo(DeltaConfidence.OVERFLOW_CORRECTED);
        assertThat(pair.getValue()).isCloseTo(0.1, within(1e-9));
    }

    @Test
    @DisplayName("Decrease from far below capacity is read as a hard reset")
    void hardResetFarBelowCapacity() {
        DeltaEngine.PairDelta pair = DeltaEngine.correct(300_000_000, 500_000, UINT32);

        assertThat(pair.getConfidence()).isEqualTo(DeltaConfidence.RESET_CORRECTED);
        assertThat(pair.getValue()).isEqualTo(500_000);
    }

    @Test
    @DisplayName("Start value above the configured capacity is treated as a reset")
    void startAboveCapacityIsReset() {
        DeltaEngine.PairDelta pair = DeltaEngine.correct(20_000_000, 100, new CounterProfile(16_777_215, 0.9));

        assertThat(pair.getConfidence()).isEqualTo(DeltaConfidence.RESET_CORRECTED);
        assertThat(pair.getValue()).isEqualTo(100);
    }

    @Test
    @DisplayName("Corrected deltas are never negative")
    void neverNegative() {
        double[][] pairs = {{10, -5}, {-3, -8}, {0.99, 0}, {5000, 0}, {4_000_000_000.0, 1}};
        for (double[] p : pairs) {
            assertThat(DeltaEngine.correct(p[0], p[1], UINT32).getValue())
                    .as("delta %s -> %s", p[0], p[1])
                    .isGreaterThanOrEqualTo(0);
        }
    }

    @Test
    @DisplayName("Normal increase gives the exact difference")
    void normalWindowDelta() {
        DeltaOutcome outcome = compute(samples(1_000, 1_500, 2_500), 0);

        UsageDelta delta = outcome.getDelta();
        assertThat(outcome.hasDelta()).isTrue();
        assertThat(delta.getValue()).isEqualTo(1_500);
        assertThat(delta.getConfidence()).isEqualTo(DeltaConfidence.NORMAL);
        assertThat(delta.getSampleCount()).isEqualTo(3);
        assertThat(delta.getStartRaw()).isEqualTo(1_000);
        assertThat(delta.getEndRaw()).isEqualTo(2_500);
    }

    @Test
    @DisplayName("Window delta without corrections is exactly end minus start")
    void uncorrectedWindowIsExactSpan() {
        // summing the pairs gives 9999.999999999998
        DeltaOutcome outcome = compute(samples(5_827.8, 7_343.2, 15_827.8), 0);

        assertThat(outcome.getDelta().getValue()).isEqualTo(15_827.8 - 5_827.8);
        assertThat(outcome.getDelta().getValue()).isEqualTo(10_000.0);
        assertThat(outcome.getDelta().getConfidence()).isEqualTo(DeltaConfidence.NORMAL);
    }

    @Test
    @DisplayName("Reset inside a window keeps the usage recorded before it")
    void resetMidWindow() {
        DeltaOutcome outcome = compute(samples(1_000, 5_000, 200, 700), 0);

        assertThat(outcome.getDelta().getValue()).isEqualTo(4_700);
        assertThat(outcome.getDelta().getConfidence()).isEqualTo(DeltaConfidence.RESET_CORRECTED);
    }

    @Test
    @DisplayName("Fewer than two samples is NO_DATA")
    void singleSampleIsNoData() {
        DeltaOutcome outcome = compute(samples(1_000), 0);

        assertThat(outcome.hasDelta()).isFalse();
        assertThat(outcome.getMissingReason()).isEqualTo(IndeterminateReason.NO_DATA);
    }

    @Test
    @DisplayName("Non-finite readings are ignored")
    void nonFiniteSamplesIgnored() {
        DeltaOutcome outcome = compute(samples(1_000, Double.NaN, 1_400), 0);

        assertThat(outcome.getDelta().getValue()).isEqualTo(400);
        assertThat(outcome.getDelta().getSampleCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Newest sample older than the staleness limit is STALE_DATA")
    void staleSamples() {
        Instant start = window.getStart().toInstant();
        List<TagSample> old = List.of(
                TagSample.of(TAG, start, 1_000),
                TagSample.of(TAG, start.plusSeconds(60), 1_200));

        DeltaOutcome outcome = deltaEngine.computeWindowDelta(TAG, window, old, UINT32, 0,
                start.plus(Duration.ofHours(2)), STALE_AFTER);

        assertThat(outcome.getMissingReason()).isEqualTo(IndeterminateReason.STALE_DATA);
        assertThat(counterStates.get(TAG)).isEmpty();
    }

    @Test
    @DisplayName("Delta above the plausibility ceiling is REJECTED")
    void plausibilityCeilingRejects() {
        DeltaOutcome outcome = compute(samples(0, 50_000), 10_000);

        assertThat(outcome.getDelta().getConfidence()).isEqualTo(DeltaConfidence.REJECTED);
        assertThat(outcome.getDelta().isAccepted()).isFalse();
        assertThat(outcome.getDelta().getRejectionReason()).contains("plausibility ceiling");
    }

    @Test
    @DisplayName("Counter state is updated once the window is consumed")
    void counterStateUpdated() {
        compute(samples(1_000, 1_500, 2_500), 0);

        CounterState state = counterStates.get(TAG).orElseThrow();
        assertThat(state.getLastRawValue()).isEqualTo(2_500);
        assertThat(state.getWindowStartValue()).isEqualTo(1_000);
        assertThat(state.getWindowKey()).isEqualTo(window.getKey());
        assertThat(state.getSuspectedMaxCapacity()).isEqualTo(2_500);
    }

    @Test
    @DisplayName("Values above the configured capacity raise the suspected capacity")
    void suspectedCapacityRaised() {
        CounterProfile small = new CounterProfile(16_777_215, 0.9);
        Instant start = window.getStart().toInstant();
        List<TagSample> first = List.of(
                TagSample.of(TAG, start, 17_000_000),
                TagSample.of(TAG, NOW.minusSeconds(120), 19_000_000));
        deltaEngine.computeWindowDelta(TAG, window, first, small, 0, NOW, STALE_AFTER);

        // 19.5M read against the suspected 19M capacity wraps instead of resetting
        List<TagSample> second = List.of(
                TagSample.of(TAG, NOW.minusSeconds(60), 18_500_000),
                TagSample.of(TAG, NOW, 100));
        DeltaOutcome outcome = deltaEngine.computeWindowDelta(TAG, window, second, small, 0, NOW, STALE_AFTER);

        assertThat(counterStates.get(TAG).orElseThrow().getSuspectedMaxCapacity()).isEqualTo(19_000_000);
        assertThat(outcome.getDelta().getConfidence()).isEqualTo(DeltaConfidence.OVERFLOW_CORRECTED);
        assertThat(outcome.getDelta().getValue()).isEqualTo(500_100);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private DeltaOutcome compute(List<TagSample> samples, double ceiling) {
        return deltaEngine.computeWindowDelta(TAG, window, samples, UINT32, ceiling, NOW, STALE_AFTER);
    }

    /**
     * Samples spaced one minute apart, the last one taken at NOW
     */
    private static List<TagSample> samples(double... values) {
        List<TagSample> samples = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            samples.add(TagSample.of(TAG, NOW.minusSeconds(60L * (values.length - 1 - i)), values[i]));
        }
        return samples;
    }
}
