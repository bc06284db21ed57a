package com.waterwatch.engine.store;

import com.waterwatch.engine.model.AlarmEvent;
import com.waterwatch.engine.model.DataQualityEvent;
import com.waterwatch.engine.model.DataQualityKind;
import com.waterwatch.engine.model.DeliveryKind;
import com.waterwatch.engine.model.DeliveryRecord;
import com.waterwatch.engine.model.DeliveryResult;
import com.waterwatch.engine.model.IndeterminateReason;
import com.waterwatch.engine.model.Severity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Record store backed by a relational database through {@link JdbcTemplate}.
 *
 * Tables are created from {@code schema.sql}. An open alarm carries its
 * threshold reference in {@code open_ref}, which has a unique index, so the
 * database itself refuses a second open alarm for the same threshold.
 *
 * @author WaterWatch
 * @version 1.0.0
 */
@Component
@ConditionalOnProperty(prefix = "waterwatch.store", name = "type", havingValue = "jdbc", matchIfMissing = true)
@Slf4j
public class JdbcRecordStore implements RecordStore {

    private static final String ALARM_COLUMNS = "id, threshold_ref, tag_id, observed_value, limit_value, window_key,"
            + " window_start, window_end, severity, message, opened_at, acknowledged_at, acknowledged_by, closed_at";

    private static final RowMapper<AlarmEvent> ALARM_MAPPER = (rs, rowNum) -> AlarmEvent.builder()
            .id(rs.getString("id"))
            .thresholdRef(rs.getString("threshold_ref"))
            .tagId(rs.getString("tag_id"))
            .observedValue(rs.getDouble("observed_value"))
            .limitValue(rs.getDouble("limit_value"))
            .windowKey(rs.getString("window_key"))
            .windowStart(instant(rs, "window_start"))
            .windowEnd(instant(rs, "window_end"))
            .severity(Severity.valueOf(rs.getString("severity")))
            .message(rs.getString("message"))
            .openedAt(instant(rs, "opened_at"))
            .acknowledgedAt(instant(rs, "acknowledged_at"))
            .acknowledgedBy(rs.getString("acknowledged_by"))
            .closedAt(instant(rs, "closed_at"))
            .build();

    private static final RowMapper<DeliveryRecord> DELIVERY_MAPPER = (rs, rowNum) -> DeliveryRecord.builder()
            .alarmEventId(rs.getString("alarm_event_id"))
            .contactName(rs.getString("contact_name"))
            .contactMsisdn(rs.getString("contact_msisdn"))
            .kind(DeliveryKind.valueOf(rs.getString("delivery_kind")))
            .sentAt(instant(rs, "sent_at"))
            .result(DeliveryResult.valueOf(rs.getString("delivery_result")))
            .providerMessageId(rs.getString("provider_message_id"))
            .attempts(rs.getInt("attempts"))
            .error(rs.getString("error_message"))
            .build();

    private static final RowMapper<DataQualityEvent> DATA_QUALITY_MAPPER = (rs, rowNum) ->
        DataQualityEvent.builder()
                .tagId(rs.getString("tag_id"))
                .thresholdRef(rs.getString("threshold_ref"))
                .kind(DataQualityKind.valueOf(rs.getString("quality_kind")))
                .reason(IndeterminateReason.valueOf(rs.getString("reason")))
                .windowKey(rs.getString("window_key"))
                .value(rs.getObject("observed_value", Double.class))
                .detail(rs.getString("detail"))
                .observedAt(instant(rs, "observed_at"))
                .build();

    private final JdbcTemplate jdbcTemplate;

    public JdbcRecordStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        log.info("Using JDBC record store");
    }

    @Override
    public void openAlarm(AlarmEvent event) {
        execute("open alarm " + event.getId(), () -> {
            try {
                return jdbcTemplate.update(
                        "INSERT INTO alarm_event (" + ALARM_COLUMNS + ", open_ref)"
                                + " VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                        event.getId(),
                        event.getThresholdRef(),
                        event.getTagId(),
                        event.getObservedValue(),
                        event.getLimitValue(),
                        event.getWindowKey(),
                        timestamp(event.getWindowStart()),
                        timestamp(event.getWindowEnd()),
                        event.getSeverity().name(),
                        event.getMessage(),
                        timestamp(event.getOpenedAt()),
                        timestamp(event.getAcknowledgedAt()),
                        event.getAcknowledgedBy(),
                        timestamp(event.getClosedAt()),
                        event.isOpen() ? event.getThresholdRef() : null);
            } catch (DuplicateKeyException e) {
                throw new StorageException("Threshold " + event.getThresholdRef() + " already has an open alarm", e);
            }
        });
    }

    @Override
    public void closeAlarm(String alarmId, Instant closedAt) {
        execute("close alarm " + alarmId, () -> jdbcTemplate.update(
                "UPDATE alarm_event SET closed_at = ?, open_ref = NULL WHERE id = ? AND closed_at IS NULL",
                timestamp(closedAt), alarmId));
    }

    @Override
    public Optional<AlarmEvent> acknowledgeAlarm(String alarmId, String acknowledgedBy, Instant acknowledgedAt) {
        int updated = execute("acknowledge alarm " + alarmId, () -> jdbcTemplate.update(
                "UPDATE alarm_event SET acknowledged_at = ?, acknowledged_by = ? WHERE id = ?",
                timestamp(acknowledgedAt), acknowledgedBy, alarmId));
        return updated == 0 ? Optional.empty() : findAlarm(alarmId);
    }

    @Override
    public Optional<AlarmEvent> findAlarm(String alarmId) {
        List<AlarmEvent> found = execute("find alarm " + alarmId, () -> jdbcTemplate.query(
                "SELECT " + ALARM_COLUMNS + " FROM alarm_event WHERE id = ?", ALARM_MAPPER, alarmId));
        return found.stream().findFirst();
    }

    @Override
    public List<AlarmEvent> listOpenAlarms() {
        return execute("list open alarms", () -> jdbcTemplate.query(
                "SELECT " + ALARM_COLUMNS + " FROM alarm_event WHERE closed_at IS NULL ORDER BY opened_at",
                ALARM_MAPPER));
    }

    @Override
    public List<AlarmEvent> listAlarms(Instant since, Severity severity, int limit) {
        if (severity == null) {
            return execute("list alarms", () -> jdbcTemplate.query(
                    "SELECT " + ALARM_COLUMNS + " FROM alarm_event WHERE opened_at >= ?"
                            + " ORDER BY opened_at DESC LIMIT ?",
                    ALARM_MAPPER, timestamp(since), limit));
        }
        return execute("list alarms", () -> jdbcTemplate.query(
                "SELECT " + ALARM_COLUMNS + " FROM alarm_event WHERE opened_at >= ? AND severity = ?"
                        + " ORDER BY opened_at DESC LIMIT ?",
                ALARM_MAPPER, timestamp(since), severity.name(), limit));
    }

    @Override
    public List<AlarmEvent> listAlarmsClosedSince(Instant since) {
        return execute("list closed alarms", () -> jdbcTemplate.query(
                "SELECT " + ALARM_COLUMNS + " FROM alarm_event WHERE closed_at >= ? ORDER BY closed_at",
                ALARM_MAPPER, timestamp(since)));
    }

    @Override
    public void appendDelivery(DeliveryRecord record) {
        execute("append delivery", () -> jdbcTemplate.update(
                "INSERT INTO delivery_record (alarm_event_id, contact_name, contact_msisdn, delivery_kind, sent_at,"
                        + " delivery_result, provider_message_id, attempts, error_message)"
                        + " VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)",
                record.getAlarmEventId(),
                record.getContactName(),
                record.getContactMsisdn(),
                record.getKind().name(),
                timestamp(record.getSentAt()),
                record.getResult().name(),
                record.getProviderMessageId(),
                record.getAttempts(),
                record.getError()));
    }

    @Override
    public List<DeliveryRecord> listDeliveries(String alarmId) {
        return execute("list deliveries", () -> jdbcTemplate.query(
                "SELECT * FROM delivery_record WHERE alarm_event_id = ? ORDER BY id",
                DELIVERY_MAPPER, alarmId));
    }

    @Override
    public void appendDataQualityEvent(DataQualityEvent event) {
        execute("append data quality event", () -> jdbcTemplate.update(
                "INSERT INTO data_quality_event (tag_id, threshold_ref, quality_kind, reason, window_key,"
                        + " observed_value, detail, observed_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?)",
                event.getTagId(),
                event.getThresholdRef(),
                event.getKind().name(),
                event.getReason().name(),
                event.getWindowKey(),
                event.getValue(),
                event.getDetail(),
                timestamp(event.getObservedAt())));
    }

    @Override
    public List<DataQualityEvent> listDataQualityEvents(Instant since, int limit) {
        return execute("list data quality events", () -> jdbcTemplate.query(
                "SELECT * FROM data_quality_event WHERE observed_at >= ? ORDER BY observed_at DESC, id DESC LIMIT ?",
                DATA_QUALITY_MAPPER, timestamp(since), limit));
    }

    @Override
    public void ping() {
        execute("ping", () -> jdbcTemplate.queryForObject("SELECT COUNT(*) FROM alarm_event", Integer.class));
    }

    @Override
    public String getType() {
        return "jdbc";
    }

    private <T> T execute(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            log.error("Record store failed to {}: {}", operation, e.getMessage());
            throw new StorageException("Record store failed to " + operation, e);
        }
    }

    private static Timestamp timestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static Instant instant(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column);
        return ts != null ? ts.toInstant() : null;
    }
}
