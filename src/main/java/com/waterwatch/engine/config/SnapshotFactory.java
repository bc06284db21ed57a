package com.waterwatch.engine.config;

import com.waterwatch.engine.delta.CounterProfile;
import com.waterwatch.engine.model.ComparisonOperator;
import com.waterwatch.engine.model.Contact;
import com.waterwatch.engine.model.Severity;
import com.waterwatch.engine.model.ThresholdRule;
import com.waterwatch.engine.model.ThresholdTarget;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Builds an {@link EngineSnapshot} from the facility configuration.
 *
 * A malformed threshold or contact is logged and left out; the rest of the
 * configuration is still used.
 *
 * @author WaterWatch
 * @version 1.0.0
 */
@Component
@Slf4j
public class SnapshotFactory {

    public static final String DEFAULT_GROUP = "operations";
    public static final String DEFAULT_UNIT = "L";

    private static final Map<String, DayOfWeek> DAY_NAMES = Map.of(
            "MON", DayOfWeek.MONDAY,
            "TUE", DayOfWeek.TUESDAY,
            "WED", DayOfWeek.WEDNESDAY,
            "THU", DayOfWeek.THURSDAY,
            "FRI", DayOfWeek.FRIDAY,
            "SAT", DayOfWeek.SATURDAY,
            "SUN", DayOfWeek.SUNDAY);

    private final EngineConfig engineConfig;

    public SnapshotFactory(EngineConfig engineConfig) {
        this.engineConfig = engineConfig;
    }

    public EngineSnapshot build(FacilityConfig facility, long version, Instant now) {
        CounterProfile defaultProfile = new CounterProfile(
                engineConfig.getCounter().getMaxCapacity(), engineConfig.getCounter().getRolloverFraction());

        Map<String, CounterProfile> profiles = new HashMap<>();
        for (FacilityConfig.TagConfig tag : facility.getTags()) {
            if (tag.getMaxCapacity() != null || tag.getRolloverFraction() != null) {
                profiles.put(tag.getId(), new CounterProfile(
                        tag.getMaxCapacity() != null ? tag.getMaxCapacity() : defaultProfile.getMaxCapacity(),
                        tag.getRolloverFraction() != null ? tag.getRolloverFraction() : defaultProfile.getRolloverFraction()));
            }
        }

        List<ThresholdRule> rules = new ArrayList<>();
        Set<String> refs = new HashSet<>();
        for (FacilityConfig.ThresholdConfig config : facility.getThresholds()) {
            try {
                ThresholdRule rule = parseRule(config);
                if (!refs.add(rule.getRef())) {
                    log.warn("Skipping threshold {}: duplicate reference", rule.getRef());
                    continue;
                }
                rules.add(rule);
            } catch (IllegalArgumentException e) {
                log.warn("Skipping malformed threshold '{}': {}", config.getRef(), e.getMessage());
            }
        }

        List<Contact> contacts = new ArrayList<>();
        for (FacilityConfig.ContactConfig config : facility.getContacts()) {
            try {
                contacts.add(parseContact(config));
            } catch (IllegalArgumentException e) {
                log.warn("Skipping malformed contact '{}': {}", config.getName(), e.getMessage());
            }
        }

        log.info("Built configuration snapshot v{}: {} of {} thresholds, {} of {} contacts, {} tag profiles",
                version, rules.size(), facility.getThresholds().size(),
                contacts.size(), facility.getContacts().size(), profiles.size());

        return EngineSnapshot.builder()
                .version(version)
                .rules(List.copyOf(rules))
                .contacts(List.copyOf(contacts))
                .tagProfiles(Map.copyOf(profiles))
                .defaultProfile(defaultProfile)
                .createdAt(now)
                .build();
    }

    ThresholdRule parseRule(FacilityConfig.ThresholdConfig config) {
        String ref = required(config.getRef(), "ref");
        if (config.getLimitValue() == null || !Double.isFinite(config.getLimitValue())) {
            throw new IllegalArgumentException("limit-value is missing or not a number");
        }
        if (config.getCooldownMinutes() != null && config.getCooldownMinutes() < 0) {
            throw new IllegalArgumentException("cooldown-minutes must not be negative");
        }
        String tag = config.getTag() != null && !config.getTag().isBlank() ? config.getTag().trim() : tagFromRef(ref);

        return ThresholdRule.builder()
                .ref(ref)
                .tagId(tag)
                .limitValue(config.getLimitValue())
                .comparisonOperator(ComparisonOperator.parse(config.getComparisonOperator()))
                .target(ThresholdTarget.parse(config.getTarget()))
                .severity(Severity.parse(config.getSeverity()))
                .messageTemplate(config.getMessageTemplate())
                .group(config.getGroup() != null && !config.getGroup().isBlank() ? config.getGroup().trim() : DEFAULT_GROUP)
                .unit(config.getUnit() != null ? config.getUnit() : DEFAULT_UNIT)
                .cooldownMinutes(config.getCooldownMinutes())
                .enabled(config.isEnabled())
                .build();
    }

    Contact parseContact(FacilityConfig.ContactConfig config) {
        String name = required(config.getName(), "name");
        String msisdn = required(config.getMsisdn(), "msisdn");
        return Contact.builder()
                .name(name)
                .msisdn(msisdn.replace(" ", ""))
                .group(config.getGroup() != null && !config.getGroup().isBlank() ? config.getGroup().trim() : DEFAULT_GROUP)
                .role(config.getRole())
                .daysOfWeek(parseDays(config.getDaysOfWeek()))
                .windowStart(parseTime(config.getWindowStart(), "window-start"))
                .windowEnd(parseTime(config.getWindowEnd(), "window-end"))
                .enabled(config.isEnabled())
                .build();
    }

    /**
     * "ALL" (or empty) means every day, otherwise a comma separated list of MON..SUN
     */
    static Set<DayOfWeek> parseDays(String text) {
        if (text == null || text.isBlank() || "ALL".equalsIgnoreCase(text.trim())) {
            return Set.of();
        }
        Set<DayOfWeek> days = new LinkedHashSet<>();
        for (String part : text.split(",")) {
            String token = part.trim().toUpperCase(Locale.ROOT);
            if (token.isEmpty()) {
                continue;
            }
            if ("ALL".equals(token)) {
                return Set.of();
            }
            DayOfWeek day = DAY_NAMES.get(token.length() > 3 ? token.substring(0, 3) : token);
            if (day == null) {
                throw new IllegalArgumentException("unknown day '" + part.trim() + "'");
            }
            days.add(day);
        }
        return days;
    }

    static LocalTime parseTime(String text, String field) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException(field + " is missing");
        }
        try {
            return LocalTime.parse(text.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException(field + " '" + text + "' is not HH:mm", e);
        }
    }

    /**
     * "FT5101_TotalLts_day" watches tag "FT5101_TotalLts"
     */
    static String tagFromRef(String ref) {
        String lower = ref.toLowerCase(Locale.ROOT);
        if (lower.endsWith("_shift")) {
            return ref.substring(0, ref.length() - "_shift".length());
        }
        if (lower.endsWith("_day")) {
            return ref.substring(0, ref.length() - "_day".length());
        }
        return ref;
    }

    private static String required(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is missing");
        }
        return value.trim();
    }
}
