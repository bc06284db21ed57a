package com.waterwatch.engine.engine;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Availability of the engine's collaborators and timing of the last poll cycle.
 *
 * @author WaterWatch
 * @version 1.0.0
 */
@Component
@Slf4j
public class EngineHealth {

    private volatile boolean storageAvailable = true;
    private volatile String storageError;

    private volatile boolean historianAvailable = true;
    private volatile String historianError;

    private volatile Instant lastCycleAt;
    private volatile Duration lastCycleDuration;
    private volatile long cycleCount;

    public void storageFailed(String error) {
        if (storageAvailable) {
            log.error("Record store unavailable, running degraded: {}", error);
        }
        storageAvailable = false;
        storageError = error;
    }

    public void storageRecovered() {
        if (!storageAvailable) {
            log.info("Record store available again");
        }
        storageAvailable = true;
        storageError = null;
    }

    public void historianFailed(String error) {
        if (historianAvailable) {
            log.error("Historian unavailable: {}", error);
        }
        historianAvailable = false;
        historianError = error;
    }

    public void historianRecovered() {
        if (!historianAvailable) {
            log.info("Historian available again");
        }
        historianAvailable = true;
        historianError = null;
    }

    public synchronized void cycleCompleted(Instant at, Duration duration) {
        lastCycleAt = at;
        lastCycleDuration = duration;
        cycleCount++;
    }

    public boolean isStorageAvailable() {
        return storageAvailable;
    }

    public String getStorageError() {
        return storageError;
    }

    public boolean isHistorianAvailable() {
        return historianAvailable;
    }

    public String getHistorianError() {
        return historianError;
    }

    public Instant getLastCycleAt() {
        return lastCycleAt;
    }

    public Duration getLastCycleDuration() {
        return lastCycleDuration;
    }

    public long getCycleCount() {
        return cycleCount;
    }

    public boolean isDegraded() {
        return !storageAvailable || !historianAvailable;
    }
}
