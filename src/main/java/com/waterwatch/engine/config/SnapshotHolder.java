package com.waterwatch.engine.config;

import com.waterwatch.engine.model.ThresholdRule;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the current {@link EngineSnapshot} and swaps it atomically.
 *
 * @author WaterWatch
 * @version 1.0.0
 */
@Slf4j
public class SnapshotHolder {

    private final AtomicReference<EngineSnapshot> current;
    private final Clock clock;

    public SnapshotHolder(EngineSnapshot initial, Clock clock) {
        this.current = new AtomicReference<>(initial);
        this.clock = clock;
    }

    public EngineSnapshot get() {
        return current.get();
    }

    /**
     * Replace the current snapshot with a fully built one
     */
    public void publish(EngineSnapshot snapshot) {
        EngineSnapshot previous = current.getAndSet(snapshot);
        log.info("Published configuration snapshot v{} ({} rules, {} contacts), replacing v{}",
                snapshot.getVersion(), snapshot.getRules().size(), snapshot.getContacts().size(), previous.getVersion());
    }

    /**
     * Enable or disable a rule by publishing a new snapshot
     *
     * @return the updated rule, or empty when no rule has this reference
     */
    public Optional<ThresholdRule> setRuleEnabled(String ref, boolean enabled) {
        if (current.get().findRule(ref).isEmpty()) {
            return Optional.empty();
        }
        EngineSnapshot updated = current.updateAndGet(snapshot -> snapshot.withRuleEnabled(ref, enabled, clock.instant()));
        log.info("Threshold {} {} (snapshot v{})", ref, enabled ? "enabled" : "disabled", updated.getVersion());
        return updated.findRule(ref);
    }
}
