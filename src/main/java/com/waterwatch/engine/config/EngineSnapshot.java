package com.waterwatch.engine.config;

import com.waterwatch.engine.delta.CounterProfile;
import com.waterwatch.engine.model.Contact;
import com.waterwatch.engine.model.ThresholdRule;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable view of the rules, contacts and counter profiles a poll cycle works with.
 *
 * A cycle reads the snapshot once and keeps using it even if a newer one is
 * published meanwhile. Changes never mutate a snapshot; they build a new one.
 *
 * @author WaterWatch
 * @version 1.0.0
 */
@Value
@Builder(toBuilder = true)
public class EngineSnapshot {

    /**
     * Increases with every published snapshot
     */
    long version;

    List<ThresholdRule> rules;

    List<Contact> contacts;

    /**
     * Counter profile per tag id, for tags with their own settings
     */
    Map<String, CounterProfile> tagProfiles;

    CounterProfile defaultProfile;

    Instant createdAt;

    public List<ThresholdRule> getEnabledRules() {
        return rules.stream().filter(ThresholdRule::isEnabled).toList();
    }

    public Optional<ThresholdRule> findRule(String ref) {
        return rules.stream().filter(rule -> rule.getRef().equals(ref)).findFirst();
    }

    /**
     * Enabled rules watching a tag
     */
    public List<ThresholdRule> rulesForTag(String tagId) {
        return rules.stream()
                .filter(ThresholdRule::isEnabled)
                .filter(rule -> rule.getTagId().equals(tagId))
                .toList();
    }

    public CounterProfile counterProfile(String tagId) {
        return tagProfiles.getOrDefault(tagId, defaultProfile);
    }

    /**
     * Copy of this snapshot with one rule enabled or disabled
     */
    public EngineSnapshot withRuleEnabled(String ref, boolean enabled, Instant now) {
        List<ThresholdRule> updated = rules.stream()
                .map(rule -> rule.getRef().equals(ref) ? rule.toBuilder().enabled(enabled).build() : rule)
                .toList();
        return toBuilder()
                .version(version + 1)
                .rules(updated)
                .createdAt(now)
                .build();
    }
}
