package com.waterwatch.engine.health;

import com.waterwatch.engine.alarm.AlarmDeduper;
import com.waterwatch.engine.config.EngineConfig;
import com.waterwatch.engine.config.SnapshotHolder;
import com.waterwatch.engine.engine.EngineHealth;
import com.waterwatch.engine.historian.TagMapping;
import com.waterwatch.engine.notification.SmsTransport;
import com.waterwatch.engine.store.RecordStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health indicator for the alarm engine.
 *
 * This component reports:
 * - DOWN when the poll loop has stopped producing cycles
 * - OUT_OF_SERVICE (degraded) when the record store or historian is unavailable
 * - UP otherwise
 *
 * The health check results are exposed via /actuator/health
 */
@Component
@Slf4j
public class EngineHealthIndicator implements HealthIndicator {

    /**
     * Number of missed poll intervals after which the loop is considered stalled
     */
    private static final int STALLED_AFTER_INTERVALS = 3;

    private final EngineHealth engineHealth;
    private final EngineConfig engineConfig;
    private final SnapshotHolder snapshotHolder;
    private final AlarmDeduper alarmDeduper;
    private final RecordStore recordStore;
    private final SmsTransport smsTransport;
    private final TagMapping tagMapping;
    private final Clock clock;
    private final Instant startedAt;

    public EngineHealthIndicator(EngineHealth engineHealth, EngineConfig engineConfig, SnapshotHolder snapshotHolder,
                                 AlarmDeduper alarmDeduper, RecordStore recordStore, SmsTransport smsTransport,
                                 TagMapping tagMapping, Clock clock) {
        this.engineHealth = engineHealth;
        this.engineConfig = engineConfig;
        this.snapshotHolder = snapshotHolder;
        this.alarmDeduper = alarmDeduper;
        this.recordStore = recordStore;
        this.smsTransport = smsTransport;
        this.tagMapping = tagMapping;
        this.clock = clock;
        this.startedAt = clock.instant();

        log.info("Initialized EngineHealthIndicator");
    }

    @Override
    public Health health() {
        Map<String, Object> details = getBaseDetails();

        if (engineConfig.isEnabled() && isStalled()) {
            return Health.down()
                    .withDetail("reason", "No poll cycle completed in the last "
                            + STALLED_AFTER_INTERVALS + " poll intervals")
                    .withDetails(details)
                    .build();
        }

        if (engineHealth.isDegraded()) {
            Health.Builder builder = Health.outOfService()
                    .withDetail("status", "degraded")
                    .withDetails(details);
            if (!engineHealth.isStorageAvailable()) {
                builder.withDetail("storageError", String.valueOf(engineHealth.getStorageError()));
            }
            if (!engineHealth.isHistorianAvailable()) {
                builder.withDetail("historianError", String.valueOf(engineHealth.getHistorianError()));
            }
            return builder.build();
        }

        return Health.up()
                .withDetails(details)
                .build();
    }

    private boolean isStalled() {
        Duration allowed = Duration.ofSeconds((long) engineConfig.getPollIntervalSeconds() * STALLED_AFTER_INTERVALS);
        Instant lastCycle = engineHealth.getLastCycleAt() != null ? engineHealth.getLastCycleAt() : startedAt;
        return lastCycle.plus(allowed).isBefore(clock.instant());
    }

    /**
     * Get base details about the engine
     */
    private Map<String, Object> getBaseDetails() {
        Map<String, Object> details = new LinkedHashMap<>();

        details.put("engineEnabled", engineConfig.isEnabled());
        details.put("pollIntervalSeconds", engineConfig.getPollIntervalSeconds());
        details.put("cycles", engineHealth.getCycleCount());
        details.put("lastCycleAt", engineHealth.getLastCycleAt() != null ? engineHealth.getLastCycleAt().toString() : "never");
        if (engineHealth.getLastCycleDuration() != null) {
            details.put("lastCycleMillis", engineHealth.getLastCycleDuration().toMillis());
        }
        details.put("storage", engineHealth.isStorageAvailable() ? "available" : "unavailable");
        details.put("storeType", recordStore.getType());
        details.put("historian", engineHealth.isHistorianAvailable() ? "available" : "unavailable");
        details.put("tagMappingVersion", tagMapping.getVersion());
        details.put("smsTransport", smsTransport.getType());
        details.put("configVersion", snapshotHolder.get().getVersion());
        details.put("enabledThresholds", snapshotHolder.get().getEnabledRules().size());
        details.put("openAlarms", alarmDeduper.getOpenAlarmCount());

        return details;
    }
}
