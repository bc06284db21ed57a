package com.waterwatch.engine.web;

import com.waterwatch.engine.alarm.AlarmDeduper;
import com.waterwatch.engine.config.SmsConfig;
import com.waterwatch.engine.config.SnapshotHolder;
import com.waterwatch.engine.engine.LiveStatusRegistry;
import com.waterwatch.engine.engine.ThresholdStatus;
import com.waterwatch.engine.model.AlarmEvent;
import com.waterwatch.engine.model.DeliveryRecord;
import com.waterwatch.engine.model.Severity;
import com.waterwatch.engine.model.ThresholdRule;
import com.waterwatch.engine.notification.AlarmNotifier;
import com.waterwatch.engine.store.RecordStore;
import com.waterwatch.engine.store.StorageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * REST API for the dashboard.
 *
 * Read-only views of threshold status and alarm history. The only mutations
 * are enabling or disabling a threshold, acknowledging an alarm and sending a
 * test SMS.
 *
 * @author WaterWatch
 * @version 1.0.0
 */
@RestController
@RequestMapping("/api")
@Slf4j
public class StatusController {

    static final int ALARM_HISTORY_LIMIT = 200;

    private final LiveStatusRegistry liveStatus;
    private final SnapshotHolder snapshotHolder;
    private final AlarmDeduper alarmDeduper;
    private final RecordStore recordStore;
    private final AlarmNotifier alarmNotifier;
    private final SmsConfig smsConfig;
    private final Clock clock;

    public StatusController(LiveStatusRegistry liveStatus,
                            SnapshotHolder snapshotHolder,
                            AlarmDeduper alarmDeduper,
                            RecordStore recordStore,
                            AlarmNotifier alarmNotifier,
                            SmsConfig smsConfig,
                            Clock clock) {
        this.liveStatus = liveStatus;
        this.snapshotHolder = snapshotHolder;
        this.alarmDeduper = alarmDeduper;
        this.recordStore = recordStore;
        this.alarmNotifier = alarmNotifier;
        this.smsConfig = smsConfig;
        this.clock = clock;
    }

    /**
     * Current status of every threshold
     */
    @GetMapping("/status")
    public ResponseEntity<?> getStatus() {
        Map<String, Object> response = new HashMap<>();
        response.put("configVersion", snapshotHolder.get().getVersion());
        response.put("thresholds", liveStatus.all());
        response.put("openAlarms", alarmDeduper.getOpenAlarmCount());
        response.put("timestamp", clock.instant());
        return ResponseEntity.ok(response);
    }

    /**
     * Rule definition and current status of one threshold
     */
    @GetMapping("/status/{ref}")
    public ResponseEntity<?> getThresholdStatus(@PathVariable String ref) {
        Optional<ThresholdRule> rule = snapshotHolder.get().findRule(ref);
        if (rule.isEmpty()) {
            return ResponseEntity.notFound().build();
        }

        Map<String, Object> response = new HashMap<>();
        response.put("rule", rule.get());
        response.put("status", liveStatus.get(ref).orElse(null));
        response.put("openAlarm", alarmDeduper.getOpenAlarm(ref).orElse(null));
        response.put("timestamp", clock.instant());
        return ResponseEntity.ok(response);
    }

    @PostMapping("/thresholds/{ref}/enable")
    public ResponseEntity<?> enableThreshold(@PathVariable String ref) {
        return setEnabled(ref, true);
    }

    @PostMapping("/thresholds/{ref}/disable")
    public ResponseEntity<?> disableThreshold(@PathVariable String ref) {
        return setEnabled(ref, false);
    }

    private ResponseEntity<?> setEnabled(String ref, boolean enabled) {
        Optional<ThresholdRule> updated = snapshotHolder.setRuleEnabled(ref, enabled);
        if (updated.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        liveStatus.get(ref).ifPresent(status -> liveStatus.update(status.toBuilder().enabled(enabled).build()));

        Map<String, Object> response = new HashMap<>();
        response.put("ref", ref);
        response.put("enabled", updated.get().isEnabled());
        response.put("configVersion", snapshotHolder.get().getVersion());
        response.put("timestamp", clock.instant());
        return ResponseEntity.ok(response);
    }

    @PostMapping("/alarms/{id}/acknowledge")
    public ResponseEntity<?> acknowledgeAlarm(@PathVariable String id,
                                              @RequestParam(defaultValue = "operator") String by) {
        Optional<AlarmEvent> acknowledged = alarmDeduper.acknowledge(id, by, clock.instant());
        if (acknowledged.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(acknowledged.get());
    }

    /**
     * Alarm history, newest first
     */
    @GetMapping("/alarms")
    public ResponseEntity<?> getAlarms(@RequestParam(defaultValue = "7") int days,
                                       @RequestParam(required = false) String severity) {
        if (days < 1) {
            return ResponseEntity.badRequest().body(Map.of("error", "days must be at least 1"));
        }
        Severity severityFilter;
        try {
            severityFilter = severity == null || severity.isBlank() || "all".equalsIgnoreCase(severity)
                    ? null
                    : Severity.parse(severity);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }

        Instant since = clock.instant().minus(Duration.ofDays(days));
        List<AlarmEvent> alarms = recordStore.listAlarms(since, severityFilter, ALARM_HISTORY_LIMIT);

        Map<String, Object> response = new HashMap<>();
        response.put("alarms", alarms);
        response.put("count", alarms.size());
        response.put("days", days);
        response.put("timestamp", clock.instant());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/alarms/{id}/deliveries")
    public ResponseEntity<?> getDeliveries(@PathVariable String id) {
        if (recordStore.findAlarm(id).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(recordStore.listDeliveries(id));
    }

    /**
     * Recent data-quality events for operator review
     */
    @GetMapping("/data-quality")
    public ResponseEntity<?> getDataQualityEvents(@RequestParam(defaultValue = "1") int days) {
        Instant since = clock.instant().minus(Duration.ofDays(Math.max(1, days)));
        return ResponseEntity.ok(recordStore.listDataQualityEvents(since, ALARM_HISTORY_LIMIT));
    }

    /**
     * Send a test SMS to the configured test numbers
     */
    @PostMapping("/sms/test")
    public ResponseEntity<?> sendTestSms(@RequestParam(required = false) String message) {
        if (smsConfig.getTestNumbers().isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "No test numbers configured"));
        }
        String text = message != null && !message.isBlank()
                ? message
                : "WaterWatch test message sent at " + clock.instant();
        List<DeliveryRecord> records = alarmNotifier.sendTest(text);
        log.info("Test SMS sent to {} number(s)", records.size());

        Map<String, Object> response = new HashMap<>();
        response.put("deliveries", records);
        response.put("timestamp", clock.instant());
        return ResponseEntity.ok(response);
    }

    @ExceptionHandler(StorageException.class)
    public ResponseEntity<?> handleStorageFailure(StorageException e) {
        log.error("Record store unavailable while serving a request: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(Map.of("error", "Record store unavailable", "message", e.getMessage()));
    }
}
