package com.waterwatch.engine.engine;

import com.waterwatch.engine.alarm.AlarmDeduper;
import com.waterwatch.engine.alarm.AlarmTransition;
import com.waterwatch.engine.config.EngineConfig;
import com.waterwatch.engine.config.EngineSnapshot;
import com.waterwatch.engine.config.SnapshotHolder;
import com.waterwatch.engine.delta.DeltaEngine;
import com.waterwatch.engine.delta.DeltaOutcome;
import com.waterwatch.engine.historian.HistorianClient;
import com.waterwatch.engine.historian.HistorianUnavailableException;
import com.waterwatch.engine.model.AlarmEvent;
import com.waterwatch.engine.model.Contact;
import com.waterwatch.engine.model.DataQualityEvent;
import com.waterwatch.engine.model.DataQualityKind;
import com.waterwatch.engine.model.DeliveryKind;
import com.waterwatch.engine.model.IndeterminateReason;
import com.waterwatch.engine.model.TagSample;
import com.waterwatch.engine.model.ThresholdRule;
import com.waterwatch.engine.model.TimeWindow;
import com.waterwatch.engine.model.UsageDelta;
import com.waterwatch.engine.model.Verdict;
import com.waterwatch.engine.notification.AlarmMessageFormatter;
import com.waterwatch.engine.notification.AlarmNotifier;
import com.waterwatch.engine.routing.ContactRouter;
import com.waterwatch.engine.shift.ShiftCalculator;
import com.waterwatch.engine.store.RecordStore;
import com.waterwatch.engine.store.StorageException;
import com.waterwatch.engine.threshold.Evaluation;
import com.waterwatch.engine.threshold.ThresholdEvaluator;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one poll cycle over every enabled threshold rule.
 *
 * Per rule: fetch the window's samples, build the usage delta, evaluate the
 * rule, then apply the verdict to the alarm state. Rules are evaluated in
 * parallel on the evaluation pool and the cycle waits at most
 * {@code cycle-timeout-seconds} for them; rules that do not finish in time are
 * indeterminate. Alarm transitions are applied by the cycle thread once the
 * evaluations are in, and notifications are handed to the dispatch pool so a
 * slow SMS provider never delays the next cycle.
 *
 * @author WaterWatch
 * @version 1.0.0
 */
@Component
@Slf4j
public class AlarmDispatcher {

    private final SnapshotHolder snapshotHolder;
    private final ShiftCalculator shiftCalculator;
    private final HistorianClient historianClient;
    private final DeltaEngine deltaEngine;
    private final ThresholdEvaluator thresholdEvaluator;
    private final AlarmDeduper alarmDeduper;
    private final ContactRouter contactRouter;
    private final AlarmNotifier alarmNotifier;
    private final AlarmMessageFormatter messageFormatter;
    private final RecordStore recordStore;
    private final LiveStatusRegistry liveStatus;
    private final EngineHealth engineHealth;
    private final EngineConfig engineConfig;
    private final MeterRegistry meterRegistry;
    private final ExecutorService evaluationExecutor;
    private final ExecutorService dispatchExecutor;

    public AlarmDispatcher(SnapshotHolder snapshotHolder,
                           ShiftCalculator shiftCalculator,
                           HistorianClient historianClient,
                           DeltaEngine deltaEngine,
                           ThresholdEvaluator thresholdEvaluator,
                           AlarmDeduper alarmDeduper,
                           ContactRouter contactRouter,
                           AlarmNotifier alarmNotifier,
                           AlarmMessageFormatter messageFormatter,
                           RecordStore recordStore,
                           LiveStatusRegistry liveStatus,
                           EngineHealth engineHealth,
                           EngineConfig engineConfig,
                           MeterRegistry meterRegistry,
                           @Qualifier("evaluationExecutor") ExecutorService evaluationExecutor,
                           @Qualifier("dispatchExecutor") ExecutorService dispatchExecutor) {
        this.snapshotHolder = snapshotHolder;
        this.shiftCalculator = shiftCalculator;
        this.historianClient = historianClient;
        this.deltaEngine = deltaEngine;
        this.thresholdEvaluator = thresholdEvaluator;
        this.alarmDeduper = alarmDeduper;
        this.contactRouter = contactRouter;
        this.alarmNotifier = alarmNotifier;
        this.messageFormatter = messageFormatter;
        this.recordStore = recordStore;
        this.liveStatus = liveStatus;
        this.engineHealth = engineHealth;
        this.engineConfig = engineConfig;
        this.meterRegistry = meterRegistry;
        this.evaluationExecutor = evaluationExecutor;
        this.dispatchExecutor = dispatchExecutor;
    }

    /**
     * Reload open alarms and recent closures from the record store
     *
     * @throws StorageException if the store is unavailable
     */
    public void reconcile(Instant now) {
        EngineSnapshot snapshot = snapshotHolder.get();
        int longestCooldown = snapshot.getRules().stream()
                .filter(rule -> rule.getCooldownMinutes() != null)
                .mapToInt(ThresholdRule::getCooldownMinutes)
                .max()
                .orElse(0);
        longestCooldown = Math.max(longestCooldown, engineConfig.getDefaultCooldownMinutes());

        List<AlarmEvent> open = recordStore.listOpenAlarms();
        List<AlarmEvent> recentlyClosed = recordStore.listAlarmsClosedSince(now.minus(Duration.ofMinutes(longestCooldown)));
        alarmDeduper.reconcile(open, recentlyClosed);
        engineHealth.storageRecovered();
    }

    /**
     * Run one poll cycle
     *
     * @param now evaluation time; windows are evaluated from their start up to this instant
     */
    public CycleReport runCycle(Instant now) {
        Instant startedAt = Instant.now();

        if (alarmDeduper.isReconciliationNeeded()) {
            try {
                reconcile(now);
            } catch (StorageException e) {
                engineHealth.storageFailed(e.getMessage());
                log.error("Reconciliation with the record store failed, alarms cannot be confirmed this cycle: {}",
                        e.getMessage());
            }
        }

        EngineSnapshot snapshot = snapshotHolder.get();
        List<ThresholdRule> rules = snapshot.getEnabledRules();
        List<RuleResult> results = evaluateAll(rules, snapshot, now);

        CycleReport.CycleReportBuilder report = CycleReport.builder()
                .startedAt(startedAt)
                .snapshotVersion(snapshot.getVersion())
                .rulesEvaluated(rules.size());

        int ok = 0;
        int violated = 0;
        int indeterminate = 0;
        int timedOut = 0;
        int opened = 0;
        int closed = 0;
        int suppressed = 0;
        int storageFailures = 0;
        int historianFailures = 0;
        int historianReads = 0;
        List<CompletableFuture<Void>> dispatches = new ArrayList<>();

        for (RuleResult result : results) {
            ThresholdRule rule = result.getRule();
            Evaluation evaluation = result.getEvaluation();

            if (result.isHistorianRead()) {
                historianReads++;
            }
            if (evaluation.getReason() == IndeterminateReason.HISTORIAN_UNAVAILABLE) {
                historianFailures++;
            }
            if (evaluation.getReason() == IndeterminateReason.TIMED_OUT) {
                timedOut++;
            }
            meterRegistry.counter("waterwatch_rule_evaluations_total", "verdict", evaluation.getVerdict().name()).increment();

            switch (evaluation.getVerdict()) {
                case OK -> ok++;
                case VIOLATED -> violated++;
                case INDETERMINATE -> indeterminate++;
            }

            String message = evaluation.isViolated()
                    ? messageFormatter.format(rule, evaluation.getDelta().getValue(), result.getWindow())
                    : null;
            AlarmTransition transition = alarmDeduper.apply(rule, evaluation, message, now);

            switch (transition.getType()) {
                case OPENED -> {
                    opened++;
                    if (transition.getClosed() != null) {
                        // window rolled while still violated: no cleared notice
                        closed++;
                    }
                    dispatches.add(dispatchAlarm(transition.getOpened(), rule, snapshot, now));
                }
                case CLOSED -> {
                    closed++;
                    dispatchCleared(transition.getClosed(), dispatches);
                }
                case SUPPRESSED_COOLDOWN -> suppressed++;
                case STORAGE_FAILED -> {
                    storageFailures++;
                    engineHealth.storageFailed(transition.getDetail());
                    if (transition.getClosed() != null) {
                        closed++;
                    }
                }
                default -> {
                    // STILL_OPEN and NONE need no action
                }
            }

            if (evaluation.isIndeterminate() && !recordDataQuality(rule, result, now)) {
                storageFailures++;
            }
            updateStatus(rule, result, now);
        }

        if (historianFailures > 0 && historianReads == 0) {
            engineHealth.historianFailed(historianFailures + " rule(s) could not read the historian");
        } else if (historianReads > 0) {
            engineHealth.historianRecovered();
        }

        CompletableFuture<Void> dispatchCompletion = CompletableFuture
                .allOf(dispatches.toArray(new CompletableFuture[0]))
                .orTimeout(engineConfig.getDispatchDeadlineSeconds(), TimeUnit.SECONDS);
        dispatchCompletion.whenComplete((ignored, error) -> {
            if (error instanceof TimeoutException) {
                log.error("Notifications of the cycle at {} did not finish within {}s",
                        now, engineConfig.getDispatchDeadlineSeconds());
            }
        });

        Instant finishedAt = Instant.now();
        engineHealth.cycleCompleted(finishedAt, Duration.between(startedAt, finishedAt));

        return report.finishedAt(finishedAt)
                .ok(ok)
                .violated(violated)
                .indeterminate(indeterminate)
                .timedOut(timedOut)
                .alarmsOpened(opened)
                .alarmsClosed(closed)
                .suppressed(suppressed)
                .storageFailures(storageFailures)
                .dispatchCompletion(dispatchCompletion)
                .build();
    }

    /**
     * Evaluate all rules on the evaluation pool, bounded by the cycle timeout
     */
    private List<RuleResult> evaluateAll(List<ThresholdRule> rules, EngineSnapshot snapshot, Instant now) {
        List<Callable<RuleResult>> tasks = rules.stream()
                .map(rule -> (Callable<RuleResult>) () -> evaluateRule(rule, snapshot, now))
                .toList();

        List<Future<RuleResult>> futures = List.of();
        try {
            futures = evaluationExecutor.invokeAll(tasks, engineConfig.getCycleTimeoutSeconds(), TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Poll cycle interrupted while evaluating rules");
        }

        List<RuleResult> results = new ArrayList<>();
        for (int i = 0; i < rules.size(); i++) {
            ThresholdRule rule = rules.get(i);
            TimeWindow window = shiftCalculator.windowFor(rule.getTarget(), now);
            if (i >= futures.size() || futures.get(i).isCancelled()) {
                log.warn("Evaluation of threshold {} did not finish within {}s", rule.getRef(),
                        engineConfig.getCycleTimeoutSeconds());
                results.add(new RuleResult(rule, window, Evaluation.indeterminate(rule, null,
                        IndeterminateReason.TIMED_OUT, "evaluation did not finish within the cycle timeout"), false));
                continue;
            }
            try {
                results.add(futures.get(i).get());
            } catch (ExecutionException e) {
                log.error("Evaluation of threshold {} failed: {}", rule.getRef(), e.getCause().getMessage(), e.getCause());
                results.add(new RuleResult(rule, window, Evaluation.indeterminate(rule, null,
                        IndeterminateReason.NO_DATA, "evaluation failed: " + e.getCause().getMessage()), false));
            } catch (InterruptedException | CancellationException e) {
                if (e instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                }
                results.add(new RuleResult(rule, window, Evaluation.indeterminate(rule, null,
                        IndeterminateReason.TIMED_OUT, "evaluation was cancelled"), false));
            }
        }
        return results;
    }

    /**
     * Historian read, delta and verdict for one rule. Runs on the evaluation pool.
     */
    RuleResult evaluateRule(ThresholdRule rule, EngineSnapshot snapshot, Instant now) {
        TimeWindow window = shiftCalculator.windowFor(rule.getTarget(), now);
        Instant windowStart = window.getStart().toInstant();
        Instant readEnd = now.isBefore(window.getEnd().toInstant()) ? now : window.getEnd().toInstant();

        List<TagSample> samples;
        try {
            samples = historianClient.fetchSamples(rule.getTagId(), windowStart, readEnd);
        } catch (HistorianUnavailableException e) {
            return new RuleResult(rule, window, Evaluation.indeterminate(rule, null,
                    IndeterminateReason.HISTORIAN_UNAVAILABLE, e.getMessage()), false);
        }

        double ceiling = thresholdEvaluator.plausibilityCeiling(snapshot.rulesForTag(rule.getTagId()));
        DeltaOutcome outcome = deltaEngine.computeWindowDelta(rule.getTagId(), window, samples,
                snapshot.counterProfile(rule.getTagId()), ceiling, now,
                Duration.ofMinutes(engineConfig.getStaleAfterMinutes()));

        if (!outcome.hasDelta()) {
            return new RuleResult(rule, window,
                    Evaluation.indeterminate(rule, null, outcome.getMissingReason(), outcome.getDetail()), true);
        }
        return new RuleResult(rule, window, thresholdEvaluator.evaluate(outcome.getDelta(), rule), true);
    }

    private CompletableFuture<Void> dispatchAlarm(AlarmEvent alarm, ThresholdRule rule, EngineSnapshot snapshot,
                                                  Instant now) {
        List<Contact> recipients = contactRouter.route(alarm, rule, snapshot.getContacts(), now,
                shiftCalculator.getZone());
        return CompletableFuture
                .runAsync(() -> alarmNotifier.notify(alarm, recipients, DeliveryKind.ALARM, alarm.getMessage()),
                        dispatchExecutor)
                .exceptionally(error -> {
                    log.error("Dispatch of alarm {} failed: {}", alarm.getId(), error.getMessage(), error);
                    return null;
                });
    }

    private void dispatchCleared(AlarmEvent alarm, List<CompletableFuture<Void>> dispatches) {
        if (!engineConfig.isNotifyOnClear()) {
            return;
        }
        EngineSnapshot snapshot = snapshotHolder.get();
        snapshot.findRule(alarm.getThresholdRef()).ifPresent(rule -> {
            List<Contact> recipients = contactRouter.route(alarm, rule, snapshot.getContacts(),
                    alarm.getClosedAt(), shiftCalculator.getZone());
            String message = messageFormatter.formatCleared(alarm);
            dispatches.add(CompletableFuture
                    .runAsync(() -> alarmNotifier.notify(alarm, recipients, DeliveryKind.CLEARED, message),
                            dispatchExecutor)
                    .exceptionally(error -> {
                        log.error("Cleared notification of alarm {} failed: {}", alarm.getId(), error.getMessage());
                        return null;
                    }));
        });
    }

    /**
     * Record an indeterminate outcome for operator review, once per reason and window
     *
     * @return false when the record store refused the event
     */
    private boolean recordDataQuality(ThresholdRule rule, RuleResult result, Instant now) {
        Evaluation evaluation = result.getEvaluation();
        String windowKey = result.getWindow().getKey();
        boolean alreadyReported = liveStatus.get(rule.getRef())
                .map(previous -> previous.getVerdict() == Verdict.INDETERMINATE
                        && previous.getReason() == evaluation.getReason()
                        && windowKey.equals(previous.getWindowKey()))
                .orElse(false);
        if (alreadyReported) {
            return true;
        }

        log.warn("Threshold {} indeterminate ({}, {}): {}", rule.getRef(), evaluation.getReason(),
                evaluation.getReason().getKind(), evaluation.getDetail());
        try {
            recordStore.appendDataQualityEvent(DataQualityEvent.builder()
                    .tagId(rule.getTagId())
                    .thresholdRef(rule.getRef())
                    .kind(evaluation.getReason().getKind())
                    .reason(evaluation.getReason())
                    .windowKey(windowKey)
                    .value(evaluation.getObservedValue())
                    .detail(evaluation.getDetail())
                    .observedAt(now)
                    .build());
            return true;
        } catch (StorageException e) {
            engineHealth.storageFailed(e.getMessage());
            alarmDeduper.requestReconciliation();
            return false;
        }
    }

    private void updateStatus(ThresholdRule rule, RuleResult result, Instant now) {
        Evaluation evaluation = result.getEvaluation();
        UsageDelta delta = evaluation.getDelta();
        IndeterminateReason reason = evaluation.getReason();
        liveStatus.update(ThresholdStatus.builder()
                .ref(rule.getRef())
                .tagId(rule.getTagId())
                .enabled(rule.isEnabled())
                .severity(rule.getSeverity())
                .limitValue(rule.getLimitValue())
                .operator(rule.getComparisonOperator().getSymbol())
                .verdict(evaluation.getVerdict())
                .reason(reason)
                .stale(reason != null && reason.getKind() == DataQualityKind.DATA_UNAVAILABLE)
                .lastValue(delta != null ? delta.getValue() : null)
                .confidence(delta != null ? delta.getConfidence() : null)
                .windowKey(result.getWindow().getKey())
                .windowRange(result.getWindow().formatRange())
                .openAlarmId(alarmDeduper.getOpenAlarm(rule.getRef()).map(AlarmEvent::getId).orElse(null))
                .detail(evaluation.getDetail())
                .evaluatedAt(now)
                .build());
    }

    @Value
    static class RuleResult {
        ThresholdRule rule;
        TimeWindow window;
        Evaluation evaluation;

        /**
         * True when the historian answered for this rule
         */
        boolean historianRead;
    }
}
