package com.waterwatch.engine.engine;

import com.waterwatch.engine.alarm.AlarmDeduper;
import com.waterwatch.engine.config.EngineConfig;
import com.waterwatch.engine.config.EngineSnapshot;
import com.waterwatch.engine.config.SmsConfig;
import com.waterwatch.engine.config.SnapshotHolder;
import com.waterwatch.engine.delta.CounterProfile;
import com.waterwatch.engine.delta.CounterStateStore;
import com.waterwatch.engine.delta.DeltaEngine;
import com.waterwatch.engine.historian.HistorianClient;
import com.waterwatch.engine.historian.HistorianUnavailableException;
import com.waterwatch.engine.model.AlarmEvent;
import com.waterwatch.engine.model.ComparisonOperator;
import com.waterwatch.engine.model.Contact;
import com.waterwatch.engine.model.DataQualityEvent;
import com.waterwatch.engine.model.DataQualityKind;
import com.waterwatch.engine.model.DeliveryKind;
import com.waterwatch.engine.model.DeliveryRecord;
import com.waterwatch.engine.model.IndeterminateReason;
import com.waterwatch.engine.model.Severity;
import com.waterwatch.engine.model.TagSample;
import com.waterwatch.engine.model.ThresholdRule;
import com.waterwatch.engine.model.ThresholdTarget;
import com.waterwatch.engine.model.Verdict;
import com.waterwatch.engine.notification.AlarmMessageFormatter;
import com.waterwatch.engine.notification.AlarmNotifier;
import com.waterwatch.engine.notification.SmsSendResult;
import com.waterwatch.engine.notification.SmsTransport;
import com.waterwatch.engine.routing.ContactRouter;
import com.waterwatch.engine.shift.ShiftCalculator;
import com.waterwatch.engine.store.InMemoryRecordStore;
import com.waterwatch.engine.store.StorageException;
import com.waterwatch.engine.threshold.ThresholdEvaluator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end poll cycles with an in-memory historian, record store and SMS transport.
 */
class AlarmDispatcherTest {

    private static final Instant T0 = Instant.parse("2024-03-12T08:00:00Z");
    private static final String TAG = "FT5101_TotalLts";
    private static final String REF = "FT5101_TotalLts_shift";
    private static final String SUPERVISOR = "+64211234567";

    private FakeHistorian historian;
    private FlakyRecordStore store;
    private RecordingTransport transport;
    private EngineConfig engineConfig;
    private SmsConfig smsConfig;
    private SnapshotHolder snapshotHolder;
    private ExecutorService evaluationExecutor;
    private ExecutorService dispatchExecutor;
    private EngineHealth engineHealth;
    private LiveStatusRegistry liveStatus;

    @BeforeEach
    void setUp() {
        historian = new FakeHistorian();
        store = new FlakyRecordStore();
        transport = new RecordingTransport();

        engineConfig = new EngineConfig();
        engineConfig.setCycleTimeoutSeconds(5);
        engineConfig.setDispatchDeadlineSeconds(10);

        smsConfig = new SmsConfig();
        smsConfig.setTestMode(false);
        smsConfig.setInitialBackoffMillis(1);

        ThresholdRule rule = ThresholdRule.builder()
                .ref(REF)
                .tagId(TAG)
                .limitValue(10_000)
                .comparisonOperator(ComparisonOperator.GTE)
                .target(ThresholdTarget.SHIFT_TOTAL)
                .severity(Severity.WARN)
                .group("operations")
                .unit("L")
                .enabled(true)
                .build();
        Contact supervisor = Contact.builder()
                .name("Shift Supervisor")
                .msisdn(SUPERVISOR)
                .group("operations")
                .windowStart(LocalTime.MIDNIGHT)
                .windowEnd(LocalTime.MIDNIGHT)
                .enabled(true)
                .build();
        snapshotHolder = new SnapshotHolder(EngineSnapshot.builder()
                .version(1)
                .rules(List.of(rule))
                .contacts(List.of(supervisor))
                .tagProfiles(Map.of())
                .defaultProfile(new CounterProfile(4_294_967_295.0, 0.9))
                .createdAt(T0)
                .build(), Clock.fixed(T0, ZoneOffset.UTC));

        evaluationExecutor = Executors.newFixedThreadPool(2);
        dispatchExecutor = Executors.newFixedThreadPool(2);
        engineHealth = new EngineHealth();
        liveStatus = new LiveStatusRegistry();
    }

    @AfterEach
    void tearDown() {
        evaluationExecutor.shutdownNow();
        dispatchExecutor.shutdownNow();
    }

    @Test
    @DisplayName("Repeated violations in one shift send exactly one SMS")
    void repeatedViolationsNotifyOnce() {
        AlarmDispatcher dispatcher = dispatcher(deduper());
        historian.usage.put(TAG, 12_000.0);

        for (int i = 0; i < 5; i++) {
            CycleReport report = dispatcher.runCycle(T0.plus(Duration.ofMinutes(i)));
            report.getDispatchCompletion().join();
            assertThat(report.getViolated()).isEqualTo(1);
        }

        assertThat(transport.sent).singleElement().satisfies(sms -> assertThat(sms).startsWith(SUPERVISOR + ":"));
        assertThat(store.listOpenAlarms()).hasSize(1);
        List<DeliveryRecord> deliveries = store.listDeliveries(store.listOpenAlarms().get(0).getId());
        assertThat(deliveries).extracting(DeliveryRecord::getKind).containsExactly(DeliveryKind.ALARM);
        assertThat(liveStatus.get(REF).orElseThrow().isInAlarm()).isTrue();
    }

    @Test
    @DisplayName("Usage far beyond the limit is held back and reported as a data-quality event once")
    void implausibleUsageNeverNotifies() {
        AlarmDispatcher dispatcher = dispatcher(deduper());
        historian.usage.put(TAG, 20_000_000.0);

        for (int i = 0; i < 3; i++) {
            CycleReport report = dispatcher.runCycle(T0.plus(Duration.ofMinutes(i)));
            report.getDispatchCompletion().join();
            assertThat(report.getIndeterminate()).isEqualTo(1);
        }

        assertThat(transport.sent).isEmpty();
        assertThat(store.listOpenAlarms()).isEmpty();
        assertThat(store.listDataQualityEvents(T0.minusSeconds(1), 10)).singleElement()
                .satisfies(event -> assertThat(event.getKind()).isEqualTo(DataQualityKind.DATA_IMPLAUSIBLE));
    }

    @Test
    @DisplayName("Restart with an open alarm in the store does not notify again")
    void restartDoesNotDuplicate() {
        historian.usage.put(TAG, 12_000.0);
        dispatcher(deduper()).runCycle(T0).getDispatchCompletion().join();
        assertThat(transport.sent).hasSize(1);

        AlarmDispatcher restarted = dispatcher(deduper());
        CycleReport report = restarted.runCycle(T0.plus(Duration.ofMinutes(1)));
        report.getDispatchCompletion().join();

        assertThat(report.getAlarmsOpened()).isZero();
        assertThat(transport.sent).hasSize(1);
        assertThat(store.listOpenAlarms()).hasSize(1);
    }

    @Test
    @DisplayName("Return below the limit closes the alarm and sends a cleared notice when enabled")
    void clearedNotice() {
        engineConfig.setNotifyOnClear(true);
        AlarmDispatcher dispatcher = dispatcher(deduper());
        historian.usage.put(TAG, 12_000.0);
        dispatcher.runCycle(T0).getDispatchCompletion().join();

        historian.usage.put(TAG, 8_000.0);
        CycleReport report = dispatcher.runCycle(T0.plus(Duration.ofMinutes(1)));
        report.getDispatchCompletion().join();

        assertThat(report.getAlarmsClosed()).isEqualTo(1);
        assertThat(store.listOpenAlarms()).isEmpty();
        assertThat(transport.sent).hasSize(2);
        assertThat(transport.sent.get(1)).contains("[CLEARED]");
    }

    @Test
    @DisplayName("Shift change while still violated opens the next alarm without a cleared notice")
    void windowRollSendsNoClearedNotice() {
        engineConfig.setNotifyOnClear(true);
        AlarmDispatcher dispatcher = dispatcher(deduper());
        historian.usage.put(TAG, 12_000.0);
        dispatcher.runCycle(T0).getDispatchCompletion().join();

        CycleReport report = dispatcher.runCycle(Instant.parse("2024-03-12T15:30:00Z"));
        report.getDispatchCompletion().join();

        assertThat(report.getAlarmsOpened()).isEqualTo(1);
        assertThat(report.getAlarmsClosed()).isEqualTo(1);
        assertThat(transport.sent).hasSize(2).noneMatch(sms -> sms.contains("[CLEARED]"));
        assertThat(transport.sent.get(1)).contains("Afternoon Shift");
        assertThat(store.listOpenAlarms()).singleElement()
                .satisfies(alarm -> assertThat(alarm.getWindowKey()).startsWith("SHIFT:2024-03-12T15:00"));
    }

    @Test
    @DisplayName("Historian outage makes rules indeterminate and degrades health")
    void historianOutage() {
        AlarmDispatcher dispatcher = dispatcher(deduper());
        historian.down = true;

        CycleReport report = dispatcher.runCycle(T0);
        report.getDispatchCompletion().join();

        assertThat(report.getIndeterminate()).isEqualTo(1);
        assertThat(liveStatus.get(REF).orElseThrow().getReason()).isEqualTo(IndeterminateReason.HISTORIAN_UNAVAILABLE);
        assertThat(liveStatus.get(REF).orElseThrow().isStale()).isTrue();
        assertThat(engineHealth.isHistorianAvailable()).isFalse();
        assertThat(transport.sent).isEmpty();

        historian.down = false;
        dispatcher.runCycle(T0.plus(Duration.ofMinutes(1))).getDispatchCompletion().join();
        assertThat(engineHealth.isHistorianAvailable()).isTrue();
    }

    @Test
    @DisplayName("Storage outage sends nothing; the alarm opens once the store is back")
    void storageOutage() {
        AlarmDispatcher dispatcher = dispatcher(deduper());
        historian.usage.put(TAG, 12_000.0);
        store.failing = true;

        CycleReport failed = dispatcher.runCycle(T0);
        failed.getDispatchCompletion().join();

        assertThat(failed.getStorageFailures()).isEqualTo(1);
        assertThat(transport.sent).isEmpty();
        assertThat(engineHealth.isStorageAvailable()).isFalse();

        store.failing = false;
        CycleReport recovered = dispatcher.runCycle(T0.plus(Duration.ofMinutes(1)));
        recovered.getDispatchCompletion().join();

        assertThat(recovered.getAlarmsOpened()).isEqualTo(1);
        assertThat(transport.sent).hasSize(1);
        assertThat(engineHealth.isStorageAvailable()).isTrue();
    }

    @Test
    @DisplayName("Rule that misses the cycle timeout is indeterminate and opens nothing")
    void slowRuleTimesOut() {
        engineConfig.setCycleTimeoutSeconds(1);
        AlarmDispatcher dispatcher = dispatcher(deduper());
        historian.usage.put(TAG, 12_000.0);
        historian.delayMillis = 5_000;

        CycleReport report = dispatcher.runCycle(T0);
        report.getDispatchCompletion().join();

        assertThat(report.getTimedOut()).isEqualTo(1);
        assertThat(liveStatus.get(REF).orElseThrow().getVerdict()).isEqualTo(Verdict.INDETERMINATE);
        assertThat(store.listOpenAlarms()).isEmpty();
        assertThat(transport.sent).isEmpty();
    }

    @Test
    @DisplayName("Disabled rules are not evaluated")
    void disabledRuleSkipped() {
        AlarmDispatcher dispatcher = dispatcher(deduper());
        historian.usage.put(TAG, 12_000.0);
        snapshotHolder.setRuleEnabled(REF, false);

        CycleReport report = dispatcher.runCycle(T0);

        assertThat(report.getRulesEvaluated()).isZero();
        assertThat(historian.calls).isZero();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private AlarmDeduper deduper() {
        return new AlarmDeduper(store, engineConfig, new SimpleMeterRegistry());
    }

    private AlarmDispatcher dispatcher(AlarmDeduper deduper) {
        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        Clock clock = Clock.fixed(T0, ZoneOffset.UTC);
        return new AlarmDispatcher(
                snapshotHolder,
                ShiftCalculator.standard(ZoneOffset.UTC),
                historian,
                new DeltaEngine(new CounterStateStore(), meterRegistry),
                new ThresholdEvaluator(engineConfig),
                deduper,
                new ContactRouter(),
                new AlarmNotifier(transport, store, smsConfig, meterRegistry, clock),
                new AlarmMessageFormatter(),
                store,
                liveStatus,
                engineHealth,
                engineConfig,
                meterRegistry,
                evaluationExecutor,
                dispatchExecutor);
    }

    /**
     * Reports the configured usage as two readings: one at the window start and one just before the read end
     */
    private static class FakeHistorian implements HistorianClient {
        final Map<String, Double> usage = new ConcurrentHashMap<>();
        volatile boolean down;
        volatile long delayMillis;
        volatile int calls;

        @Override
        public List<TagSample> fetchSamples(String tagId, Instant start, Instant end) {
            calls++;
            if (delayMillis > 0) {
                try {
                    Thread.sleep(delayMillis);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new HistorianUnavailableException("read interrupted", e);
                }
            }
            if (down) {
                throw new HistorianUnavailableException("connection refused", null);
            }
            double used = usage.getOrDefault(tagId, 0.0);
            return List.of(
                    TagSample.of(tagId, start, 1_000),
                    TagSample.of(tagId, end.minusSeconds(1), 1_000 + used));
        }
    }

    private static class RecordingTransport implements SmsTransport {
        final List<String> sent = new CopyOnWriteArrayList<>();

        @Override
        public SmsSendResult send(String msisdn, String message) {
            sent.add(msisdn + ": " + message);
            return SmsSendResult.accepted("SM" + sent.size());
        }

        @Override
        public String getType() {
            return "recording";
        }
    }

    private static class FlakyRecordStore extends InMemoryRecordStore {
        volatile boolean failing;

        @Override
        public synchronized void openAlarm(AlarmEvent event) {
            check();
            super.openAlarm(event);
        }

        @Override
        public synchronized List<AlarmEvent> listOpenAlarms() {
            check();
            return super.listOpenAlarms();
        }

        @Override
        public synchronized void appendDataQualityEvent(DataQualityEvent event) {
            check();
            super.appendDataQualityEvent(event);
        }

        private void check() {
            if (failing) {
                throw new StorageException("record store is down");
            }
        }
    }
}
