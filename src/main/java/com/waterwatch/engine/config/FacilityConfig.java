package com.waterwatch.engine.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties describing the facility: time zone, shifts, tags,
 * threshold rules and the contact roster.
 *
 * Threshold and contact records are deliberately loose here. They are parsed
 * into the engine snapshot by {@link SnapshotFactory}, which skips and logs a
 * malformed record instead of refusing to start.
 *
 * @author WaterWatch
 * @version 1.0.0
 */
@Configuration
@ConfigurationProperties(prefix = "waterwatch.facility")
@Data
@Validated
public class FacilityConfig {

    /**
     * Facility time zone used for shift, day and contact windows
     */
    @NotEmpty
    private String timezone = "Pacific/Auckland";

    /**
     * Local time the calendar-day window starts (HH:mm)
     */
    @NotEmpty
    private String dayStart = "00:00";

    /**
     * Shift start times; each shift ends where the next one starts
     */
    @Valid
    @NotEmpty
    private List<ShiftConfig> shifts = new ArrayList<>(List.of(
            new ShiftConfig("Day Shift", "07:00"),
            new ShiftConfig("Afternoon Shift", "15:00"),
            new ShiftConfig("Night Shift", "23:00")));

    /**
     * Version label of the tag mapping, reported in logs and health
     */
    private String tagMappingVersion = "1";

    @Valid
    private List<TagConfig> tags = new ArrayList<>();

    private List<ThresholdConfig> thresholds = new ArrayList<>();

    private List<ContactConfig> contacts = new ArrayList<>();

    @Data
    public static class ShiftConfig {
        @NotEmpty
        private String name;

        /**
         * Start time (HH:mm)
         */
        @NotEmpty
        private String start;

        public ShiftConfig() {
        }

        public ShiftConfig(String name, String start) {
            this.name = name;
            this.start = start;
        }
    }

    @Data
    public static class TagConfig {
        /**
         * Logical tag id used by threshold rules
         */
        @NotEmpty
        private String id;

        /**
         * Actual tag name in the historian database, defaults to the id
         */
        private String historianTag;

        private String description;

        /**
         * Production line the tag belongs to
         */
        private String line;

        /**
         * Counter capacity override
         */
        private Double maxCapacity;

        /**
         * Rollover fraction override
         */
        private Double rolloverFraction;
    }

    @Data
    public static class ThresholdConfig {
        private String ref;
        private String tag;
        private Double limitValue;
        private String comparisonOperator;
        private String target;
        private String severity;
        private String messageTemplate;
        private String group;
        private String unit;
        private Integer cooldownMinutes;
        private boolean enabled = true;
    }

    @Data
    public static class ContactConfig {
        private String name;
        private String msisdn;
        private String group;
        private String role;

        /**
         * "ALL" or a comma separated list such as "MON,TUE,WED"
         */
        private String daysOfWeek = "ALL";

        private String windowStart = "00:00";
        private String windowEnd = "00:00";
        private boolean enabled = true;
    }
}
