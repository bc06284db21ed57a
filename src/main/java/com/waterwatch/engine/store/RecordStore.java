package com.waterwatch.engine.store;

import com.waterwatch.engine.model.AlarmEvent;
import com.waterwatch.engine.model.DataQualityEvent;
import com.waterwatch.engine.model.DeliveryRecord;
import com.waterwatch.engine.model.Severity;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable log of alarm events, delivery attempts and data-quality events.
 *
 * The store is the source of truth for which alarms are open; the engine
 * reloads that state from here on startup and after a storage outage. Every
 * method throws {@link StorageException} when the store is unavailable.
 *
 * @author WaterWatch
 * @version 1.0.0
 */
public interface RecordStore {

    /**
     * Persist a newly opened alarm. Fails when the threshold already has an open alarm.
     */
    void openAlarm(AlarmEvent event);

    /**
     * Set closed_at on an open alarm; closing an already closed alarm has no effect
     */
    void closeAlarm(String alarmId, Instant closedAt);

    /**
     * Record an acknowledgement
     *
     * @return the updated alarm, or empty when no alarm has this id
     */
    Optional<AlarmEvent> acknowledgeAlarm(String alarmId, String acknowledgedBy, Instant acknowledgedAt);

    Optional<AlarmEvent> findAlarm(String alarmId);

    /**
     * All alarms that have not been closed, used for startup reconciliation
     */
    List<AlarmEvent> listOpenAlarms();

    /**
     * Alarms opened at or after {@code since}, newest first
     *
     * @param severity only this severity, or null for all
     */
    List<AlarmEvent> listAlarms(Instant since, Severity severity, int limit);

    /**
     * Alarms closed at or after {@code since}, used to restore cooldowns
     */
    List<AlarmEvent> listAlarmsClosedSince(Instant since);

    void appendDelivery(DeliveryRecord record);

    /**
     * Delivery attempts of one alarm in the order they were made
     */
    List<DeliveryRecord> listDeliveries(String alarmId);

    void appendDataQualityEvent(DataQualityEvent event);

    /**
     * Data-quality events observed at or after {@code since}, newest first
     */
    List<DataQualityEvent> listDataQualityEvents(Instant since, int limit);

    /**
     * Check the store is reachable
     */
    void ping();

    String getType();
}
