package com.waterwatch.engine.store;

import com.waterwatch.engine.model.AlarmEvent;
import com.waterwatch.engine.model.DataQualityEvent;
import com.waterwatch.engine.model.DeliveryRecord;
import com.waterwatch.engine.model.Severity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Record store kept in process memory. Nothing survives a restart; meant for
 * tests and demo installations.
 *
 * @author WaterWatch
 * @version 1.0.0
 */
@Component
@ConditionalOnProperty(prefix = "waterwatch.store", name = "type", havingValue = "memory")
@Slf4j
public class InMemoryRecordStore implements RecordStore {

    private final Map<String, AlarmEvent> alarms = new LinkedHashMap<>();
    private final List<DeliveryRecord> deliveries = new ArrayList<>();
    private final List<DataQualityEvent> dataQualityEvents = new ArrayList<>();

    public InMemoryRecordStore() {
        log.info("Using in-memory record store; alarm history is lost on restart");
    }

    @Override
    public synchronized void openAlarm(AlarmEvent event) {
        boolean alreadyOpen = alarms.values().stream()
                .anyMatch(a -> a.isOpen() && a.getThresholdRef().equals(event.getThresholdRef()));
        if (alreadyOpen) {
            throw new StorageException("Threshold " + event.getThresholdRef() + " already has an open alarm");
        }
        alarms.put(event.getId(), event);
    }

    @Override
    public synchronized void closeAlarm(String alarmId, Instant closedAt) {
        AlarmEvent event = alarms.get(alarmId);
        if (event != null && event.isOpen()) {
            alarms.put(alarmId, event.toBuilder().closedAt(closedAt).build());
        }
    }

    @Override
    public synchronized Optional<AlarmEvent> acknowledgeAlarm(String alarmId, String acknowledgedBy,
                                                              Instant acknowledgedAt) {
        AlarmEvent event = alarms.get(alarmId);
        if (event == null) {
            return Optional.empty();
        }
        AlarmEvent acknowledged = event.toBuilder()
                .acknowledgedAt(acknowledgedAt)
                .acknowledgedBy(acknowledgedBy)
                .build();
        alarms.put(alarmId, acknowledged);
        return Optional.of(acknowledged);
    }

    @Override
    public synchronized Optional<AlarmEvent> findAlarm(String alarmId) {
        return Optional.ofNullable(alarms.get(alarmId));
    }

    @Override
    public synchronized List<AlarmEvent> listOpenAlarms() {
        return alarms.values().stream()
                .filter(AlarmEvent::isOpen)
                .toList();
    }

    @Override
    public synchronized List<AlarmEvent> listAlarms(Instant since, Severity severity, int limit) {
        return alarms.values().stream()
                .filter(a -> !a.getOpenedAt().isBefore(since))
                .filter(a -> severity == null || a.getSeverity() == severity)
                .sorted(Comparator.comparing(AlarmEvent::getOpenedAt).reversed())
                .limit(limit)
                .toList();
    }

    @Override
    public synchronized List<AlarmEvent> listAlarmsClosedSince(Instant since) {
        return alarms.values().stream()
                .filter(a -> a.getClosedAt() != null && !a.getClosedAt().isBefore(since))
                .toList();
    }

    @Override
    public synchronized void appendDelivery(DeliveryRecord record) {
        deliveries.add(record);
    }

    @Override
    public synchronized List<DeliveryRecord> listDeliveries(String alarmId) {
        return deliveries.stream()
                .filter(d -> alarmId.equals(d.getAlarmEventId()))
                .toList();
    }

    @Override
    public synchronized void appendDataQualityEvent(DataQualityEvent event) {
        dataQualityEvents.add(event);
    }

    @Override
    public synchronized List<DataQualityEvent> listDataQualityEvents(Instant since, int limit) {
        return dataQualityEvents.stream()
                .filter(e -> !e.getObservedAt().isBefore(since))
                .sorted(Comparator.comparing(DataQualityEvent::getObservedAt).reversed())
                .limit(limit)
                .toList();
    }

    @Override
    public void ping() {
        // always reachable
    }

    @Override
    public String getType() {
        return "memory";
    }
}
