package com.waterwatch.engine.engine;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Outcome counts of one poll cycle.
 *
 * @author WaterWatch
 * @version 1.0.0
 */
@Value
@Builder
public class CycleReport {

    Instant startedAt;

    Instant finishedAt;

    long snapshotVersion;

    int rulesEvaluated;

    int violated;

    int ok;

    int indeterminate;

    int timedOut;

    int alarmsOpened;

    int alarmsClosed;

    int suppressed;

    int storageFailures;

    /**
     * Completes when every notification queued by the cycle finished, or fails
     * with a timeout at the dispatch deadline
     */
    CompletableFuture<Void> dispatchCompletion;

    public String summary() {
        return String.format("%d rules: %d ok, %d violated, %d indeterminate (%d timed out); "
                        + "%d opened, %d closed, %d suppressed, %d storage failures",
                rulesEvaluated, ok, violated, indeterminate, timedOut,
                alarmsOpened, alarmsClosed, suppressed, storageFailures);
    }
}
