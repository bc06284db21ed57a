package com.waterwatch.engine.alarm;

import com.waterwatch.engine.config.EngineConfig;
import com.waterwatch.engine.model.AlarmEvent;
import com.waterwatch.engine.model.ThresholdRule;
import com.waterwatch.engine.model.UsageDelta;
import com.waterwatch.engine.store.RecordStore;
import com.waterwatch.engine.store.StorageException;
import com.waterwatch.engine.support.KeyedLocks;
import com.waterwatch.engine.threshold.Evaluation;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Open/closed alarm state per threshold reference.
 *
 * <ul>
 *   <li>closed + violated: opens an alarm, unless the threshold closed within its cooldown</li>
 *   <li>open + violated in the same window: no change</li>
 *   <li>open + violated in a new window: closes the old alarm and opens one for the new window</li>
 *   <li>open + ok: closes the alarm and starts the cooldown</li>
 *   <li>indeterminate: no change</li>
 * </ul>
 *
 * An alarm is only considered open once the record store has accepted it. When
 * the store fails, the transition is dropped and the in-memory state is
 * rebuilt from the store on the next {@link #reconcile}.
 *
 * @author WaterWatch
 * @version 1.0.0
 */
@Component
@Slf4j
public class AlarmDeduper {

    private final RecordStore recordStore;
    private final EngineConfig engineConfig;
    private final MeterRegistry meterRegistry;

    private final KeyedLocks locks = new KeyedLocks();
    private final Map<String, AlarmSlot> slots = new ConcurrentHashMap<>();
    private final AtomicBoolean reconciliationNeeded = new AtomicBoolean(true);

    public AlarmDeduper(RecordStore recordStore, EngineConfig engineConfig, MeterRegistry meterRegistry) {
        this.recordStore = recordStore;
        this.engineConfig = engineConfig;
        this.meterRegistry = meterRegistry;

        Gauge.builder("waterwatch_alarms_open", slots, s -> s.values().stream().filter(AlarmSlot::isOpen).count())
                .description("Alarms currently open")
                .register(meterRegistry);
    }

    /**
     * Apply an evaluation to the threshold's alarm state
     *
     * @param message rendered notification text, stored on a newly opened alarm
     */
    public AlarmTransition apply(ThresholdRule rule, Evaluation evaluation, String message, Instant now) {
        if (evaluation.isIndeterminate()) {
            return AlarmTransition.none();
        }
        return locks.withLock(rule.getRef(), () -> {
            AlarmSlot slot = slots.computeIfAbsent(rule.getRef(), ref -> new AlarmSlot());
            if (evaluation.isViolated()) {
                return onViolated(rule, evaluation.getDelta(), message, slot, now);
            }
            return onOk(rule, slot, now);
        });
    }

    private AlarmTransition onViolated(ThresholdRule rule, UsageDelta delta, String message, AlarmSlot slot,
                                       Instant now) {
        String windowKey = delta.getWindow().getKey();
        AlarmEvent current = slot.getOpen();

        if (current != null && current.getWindowKey().equals(windowKey)) {
            return new AlarmTransition(AlarmTransition.Type.STILL_OPEN, current, null, null);
        }

        AlarmEvent replaced = null;
        if (current != null) {
            // the violation continues into a new window; the old window's alarm is finished
            try {
                recordStore.closeAlarm(current.getId(), now);
            } catch (StorageException e) {
                return storageFailed(rule, "close alarm " + current.getId(), e);
            }
            replaced = current.toBuilder().closedAt(now).build();
            slot.setOpen(null);
            countClosed(rule);
            log.info("Alarm {} for threshold {} closed: window {} ended while still violated",
                    current.getId(), rule.getRef(), current.getWindowKey());
        } else if (isInCooldown(rule, slot, now)) {
            String detail = String.format("closed at %s, cooldown %d min", slot.getLastClosedAt(), cooldownMinutes(rule));
            log.info("Violation of threshold {} suppressed by cooldown ({})", rule.getRef(), detail);
            meterRegistry.counter("waterwatch_alarms_suppressed_total", "threshold", rule.getRef()).increment();
            return new AlarmTransition(AlarmTransition.Type.SUPPRESSED_COOLDOWN, null, null, detail);
        }

        AlarmEvent event = AlarmEvent.builder()
                .id(UUID.randomUUID().toString())
                .thresholdRef(rule.getRef())
                .tagId(rule.getTagId())
                .observedValue(delta.getValue())
                .limitValue(rule.getLimitValue())
                .windowKey(windowKey)
                .windowStart(delta.getWindow().getStart().toInstant())
                .windowEnd(delta.getWindow().getEnd().toInstant())
                .severity(rule.getSeverity())
                .message(message)
                .openedAt(now)
                .build();
        try {
            recordStore.openAlarm(event);
        } catch (StorageException e) {
            AlarmTransition failed = storageFailed(rule, "open alarm", e);
            return replaced == null ? failed
                    : new AlarmTransition(AlarmTransition.Type.STORAGE_FAILED, null, replaced, failed.getDetail());
        }

        slot.setOpen(event);
        meterRegistry.counter("waterwatch_alarms_opened_total", "severity", rule.getSeverity().name()).increment();
        log.warn("ALARM OPENED {} for threshold {}: {} {} {} in {} (severity {})",
                event.getId(), rule.getRef(), delta.getValue(), rule.getComparisonOperator().getSymbol(),
                rule.getLimitValue(), delta.getWindow().formatRange(), rule.getSeverity());
        return new AlarmTransition(AlarmTransition.Type.OPENED, event, replaced, null);
    }

    private AlarmTransition onOk(ThresholdRule rule, AlarmSlot slot, Instant now) {
        AlarmEvent current = slot.getOpen();
        if (current == null) {
            return AlarmTransition.none();
        }
        try {
            recordStore.closeAlarm(current.getId(), now);
        } catch (StorageException e) {
            return storageFailed(rule, "close alarm " + current.getId(), e);
        }
        AlarmEvent closed = current.toBuilder().closedAt(now).build();
        slot.setOpen(null);
        slot.setLastClosedAt(now);
        countClosed(rule);
        log.info("Alarm {} for threshold {} cleared", current.getId(), rule.getRef());
        return new AlarmTransition(AlarmTransition.Type.CLOSED, null, closed, null);
    }

    private AlarmTransition storageFailed(ThresholdRule rule, String operation, StorageException e) {
        reconciliationNeeded.set(true);
        log.error("Record store unavailable, could not {} for threshold {}: {}", operation, rule.getRef(), e.getMessage());
        return new AlarmTransition(AlarmTransition.Type.STORAGE_FAILED, null, null, e.getMessage());
    }

    private void countClosed(ThresholdRule rule) {
        meterRegistry.counter("waterwatch_alarms_closed_total", "severity", rule.getSeverity().name()).increment();
    }

    private boolean isInCooldown(ThresholdRule rule, AlarmSlot slot, Instant now) {
        Instant lastClosedAt = slot.getLastClosedAt();
        return lastClosedAt != null && lastClosedAt.plus(Duration.ofMinutes(cooldownMinutes(rule))).isAfter(now);
    }

    private int cooldownMinutes(ThresholdRule rule) {
        return rule.getCooldownMinutes() != null ? rule.getCooldownMinutes() : engineConfig.getDefaultCooldownMinutes();
    }

    /**
     * Record an operator acknowledgement of an alarm
     *
     * @return the acknowledged alarm, or empty when no alarm has this id
     */
    public Optional<AlarmEvent> acknowledge(String alarmId, String acknowledgedBy, Instant now) {
        Optional<AlarmEvent> acknowledged = recordStore.acknowledgeAlarm(alarmId, acknowledgedBy, now);
        acknowledged.filter(AlarmEvent::isOpen).ifPresent(event ->
                locks.withLock(event.getThresholdRef(), () -> {
                    AlarmSlot slot = slots.get(event.getThresholdRef());
                    if (slot != null && slot.getOpen() != null && slot.getOpen().getId().equals(alarmId)) {
                        slot.setOpen(event);
                    }
                }));
        acknowledged.ifPresent(event -> log.info("Alarm {} acknowledged by {}", alarmId, acknowledgedBy));
        return acknowledged;
    }

    /**
     * Replace the in-memory state with what the record store holds
     *
     * @param openAlarms     alarms the store reports as open
     * @param recentlyClosed alarms closed recently enough to still be in cooldown
     */
    public void reconcile(Collection<AlarmEvent> openAlarms, Collection<AlarmEvent> recentlyClosed) {
        Map<String, AlarmSlot> rebuilt = new ConcurrentHashMap<>();
        for (AlarmEvent closed : recentlyClosed) {
            AlarmSlot slot = rebuilt.computeIfAbsent(closed.getThresholdRef(), ref -> new AlarmSlot());
            if (slot.getLastClosedAt() == null || closed.getClosedAt().isAfter(slot.getLastClosedAt())) {
                slot.setLastClosedAt(closed.getClosedAt());
            }
        }
        for (AlarmEvent open : openAlarms) {
            AlarmSlot slot = rebuilt.computeIfAbsent(open.getThresholdRef(), ref -> new AlarmSlot());
            if (slot.getOpen() == null || open.getOpenedAt().isAfter(slot.getOpen().getOpenedAt())) {
                slot.setOpen(open);
            }
        }
        slots.keySet().removeIf(ref -> !rebuilt.containsKey(ref));
        rebuilt.forEach((ref, slot) -> locks.withLock(ref, () -> slots.put(ref, slot)));
        reconciliationNeeded.set(false);
        log.info("Alarm state reconciled from record store: {} open, {} in cooldown", openAlarms.size(), recentlyClosed.size());
    }

    /**
     * Force the next cycle to reload alarm state from the record store
     */
    public void requestReconciliation() {
        reconciliationNeeded.set(true);
    }

    public boolean isReconciliationNeeded() {
        return reconciliationNeeded.get();
    }

    public Optional<AlarmEvent> getOpenAlarm(String thresholdRef) {
        AlarmSlot slot = slots.get(thresholdRef);
        return slot != null ? Optional.ofNullable(slot.getOpen()) : Optional.empty();
    }

    public long getOpenAlarmCount() {
        return slots.values().stream().filter(AlarmSlot::isOpen).count();
    }

    @Data
    static class AlarmSlot {
        private AlarmEvent open;
        private Instant lastClosedAt;

        boolean isOpen() {
            return open != null;
        }
    }
}
