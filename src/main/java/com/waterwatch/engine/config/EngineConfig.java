package com.waterwatch.engine.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

/**
 * Configuration properties for the polling engine.
 *
 * Controls the poll loop, worker pools, deadlines, the sanity gate and
 * cooldown defaults.
 *
 * @author WaterWatch
 * @version 1.0.0
 */
@Configuration
@ConfigurationProperties(prefix = "waterwatch.engine")
@Data
@Validated
public class EngineConfig {

    /**
     * Whether the scheduled poll loop runs
     */
    private boolean enabled = true;

    /**
     * Delay between the end of one poll cycle and the start of the next
     */
    @Min(10)
    private int pollIntervalSeconds = 60;

    /**
     * Delay before the first poll cycle after startup
     */
    @Min(0)
    private int initialDelaySeconds = 10;

    /**
     * Size of the rule evaluation pool
     */
    @Min(1)
    private int workerThreads = 4;

    /**
     * Maximum time a cycle waits for rule evaluations; late rules become indeterminate
     */
    @Min(1)
    private int cycleTimeoutSeconds = 45;

    /**
     * Size of the SMS dispatch pool
     */
    @Min(1)
    private int dispatchThreads = 4;

    /**
     * Deadline for the notifications queued by one cycle
     */
    @Min(1)
    private int dispatchDeadlineSeconds = 120;

    /**
     * Observed values above limit * sanityFactor are treated as data artifacts
     */
    @DecimalMin("1.0")
    private double sanityFactor = 1000.0;

    /**
     * Minimum time between an alarm clearing and the same threshold re-opening
     */
    @Min(0)
    private int defaultCooldownMinutes = 15;

    /**
     * Send a "cleared" SMS when an alarm closes
     */
    private boolean notifyOnClear = false;

    /**
     * A window whose newest sample is older than this is treated as missing data
     */
    @Min(1)
    private int staleAfterMinutes = 30;

    /**
     * Counter defaults applied to tags without their own settings
     */
    @Valid
    @NotNull
    private Counter counter = new Counter();

    @Data
    public static class Counter {
        /**
         * Largest value the counter can hold before wrapping (32-bit unsigned by default)
         */
        @DecimalMin("1.0")
        private double maxCapacity = 4_294_967_295.0;

        /**
         * Start values at or above maxCapacity * rolloverFraction are read as rollovers
         */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double rolloverFraction = 0.9;
    }
}
