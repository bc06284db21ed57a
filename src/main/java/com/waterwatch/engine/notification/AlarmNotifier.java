package com.waterwatch.engine.notification;

import com.waterwatch.engine.config.SmsConfig;
import com.waterwatch.engine.model.AlarmEvent;
import com.waterwatch.engine.model.Contact;
import com.waterwatch.engine.model.DeliveryKind;
import com.waterwatch.engine.model.DeliveryRecord;
import com.waterwatch.engine.model.DeliveryResult;
import com.waterwatch.engine.store.RecordStore;
import com.waterwatch.engine.store.StorageException;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;

/**
 * Sends an alarm to its recipients and records one delivery record per recipient.
 *
 * Transient transport failures are retried with exponential backoff up to
 * {@code waterwatch.sms.max-attempts} calls. A failure for one recipient never
 * stops delivery to the others. In test mode the configured test numbers
 * replace the routed recipients.
 *
 * @author WaterWatch
 * @version 1.0.0
 */
@Component
@Slf4j
public class AlarmNotifier {

    private static final Pattern E164 = Pattern.compile("^\\+[1-9]\\d{6,14}$");

    private final SmsTransport transport;
    private final RecordStore recordStore;
    private final SmsConfig smsConfig;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public AlarmNotifier(SmsTransport transport, RecordStore recordStore, SmsConfig smsConfig,
                         MeterRegistry meterRegistry, Clock clock) {
        this.transport = transport;
        this.recordStore = recordStore;
        this.smsConfig = smsConfig;
        this.meterRegistry = meterRegistry;
        this.clock = clock;

        log.info("AlarmNotifier initialized with {} transport (test mode: {}, max attempts: {})",
                transport.getType(), smsConfig.isTestMode(), smsConfig.getMaxAttempts());
    }

    /**
     * Deliver a message to each recipient
     *
     * @param alarm      alarm the message belongs to, null for a test message
     * @param recipients routed contacts; ignored in test mode
     * @return the delivery records, one per recipient
     */
    public List<DeliveryRecord> notify(AlarmEvent alarm, List<Contact> recipients, DeliveryKind kind, String message) {
        List<Contact> targets = smsConfig.isTestMode() ? testContacts() : recipients;
        String alarmId = alarm != null ? alarm.getId() : null;

        if (smsConfig.isTestMode()) {
            log.info("TEST MODE: routing {} for alarm {} to test numbers {}", kind, alarmId, smsConfig.getTestNumbers());
        }
        if (targets.isEmpty()) {
            log.warn("No recipients for {} of alarm {}", kind, alarmId);
            return List.of();
        }

        List<DeliveryRecord> records = new ArrayList<>();
        int sent = 0;
        int failed = 0;
        for (Contact contact : targets) {
            DeliveryRecord record = deliver(alarmId, contact, kind, message);
            records.add(record);
            if (record.getResult() == DeliveryResult.SENT) {
                sent++;
            } else {
                failed++;
            }
            meterRegistry.counter("waterwatch_sms_deliveries_total",
                    "kind", kind.name(), "result", record.getResult().name()).increment();
            try {
                recordStore.appendDelivery(record);
            } catch (StorageException e) {
                log.error("Could not record delivery of alarm {} to {}: {}", alarmId, contact.getMsisdn(), e.getMessage());
            }
        }

        log.info("Notification for alarm {} completed: {} sent, {} failed or skipped", alarmId, sent, failed);
        return records;
    }

    /**
     * Send a test message to the configured test numbers
     */
    public List<DeliveryRecord> sendTest(String message) {
        List<DeliveryRecord> records = new ArrayList<>();
        for (Contact contact : testContacts()) {
            DeliveryRecord record = deliver(null, contact, DeliveryKind.TEST, message);
            records.add(record);
            try {
                recordStore.appendDelivery(record);
            } catch (StorageException e) {
                log.error("Could not record test delivery to {}: {}", contact.getMsisdn(), e.getMessage());
            }
        }
        return records;
    }

    private DeliveryRecord deliver(String alarmId, Contact contact, DeliveryKind kind, String message) {
        DeliveryRecord.DeliveryRecordBuilder record = DeliveryRecord.builder()
                .alarmEventId(alarmId)
                .contactName(contact.getName())
                .contactMsisdn(contact.getMsisdn())
                .kind(kind);

        if (contact.getMsisdn() == null || !E164.matcher(contact.getMsisdn()).matches()) {
            log.warn("Skipping contact {}: '{}' is not an E.164 number", contact.getName(), contact.getMsisdn());
            return record.sentAt(clock.instant())
                    .result(DeliveryResult.SKIPPED)
                    .error("invalid msisdn")
                    .build();
        }
        if (!transport.isConfigured()) {
            return record.sentAt(clock.instant())
                    .result(DeliveryResult.FAILED)
                    .error(transport.getType() + " transport is not configured")
                    .build();
        }

        AtomicInteger attempts = new AtomicInteger();
        try {
            SmsSendResult result = Mono.fromCallable(() -> {
                        attempts.incrementAndGet();
                        return transport.send(contact.getMsisdn(), message);
                    })
                    .retryWhen(Retry.backoff(smsConfig.getMaxAttempts() - 1L,
                                    Duration.ofMillis(smsConfig.getInitialBackoffMillis()))
                            .filter(AlarmNotifier::isTransient)
                            .doBeforeRetry(signal -> log.warn("Retrying SMS to {}, attempt {}: {}",
                                    contact.getMsisdn(), signal.totalRetries() + 2, signal.failure().getMessage()))
                            .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                    .block();

            if (result != null && result.isAccepted()) {
                log.info("SMS for alarm {} sent to {} ({}), provider id {}",
                        alarmId, contact.getName(), contact.getMsisdn(), result.getProviderMessageId());
                return record.sentAt(clock.instant())
                        .result(DeliveryResult.SENT)
                        .providerMessageId(result.getProviderMessageId())
                        .attempts(attempts.get())
                        .build();
            }
            String error = result != null ? result.getError() : "no answer from provider";
            log.error("SMS for alarm {} to {} rejected: {}", alarmId, contact.getMsisdn(), error);
            return record.sentAt(clock.instant())
                    .result(DeliveryResult.FAILED)
                    .attempts(attempts.get())
                    .error(error)
                    .build();

        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            log.error("SMS for alarm {} to {} failed after {} attempt(s): {}",
                    alarmId, contact.getMsisdn(), attempts.get(), cause.getMessage());
            return record.sentAt(clock.instant())
                    .result(DeliveryResult.FAILED)
                    .attempts(attempts.get())
                    .error(cause.getMessage())
                    .build();
        }
    }

    private List<Contact> testContacts() {
        return smsConfig.getTestNumbers().stream()
                .map(number -> Contact.builder()
                        .name("test")
                        .msisdn(number.trim())
                        .enabled(true)
                        .build())
                .toList();
    }

    private static boolean isTransient(Throwable throwable) {
        return throwable instanceof SmsTransport.SmsTransportException e && e.isTransient();
    }
}
