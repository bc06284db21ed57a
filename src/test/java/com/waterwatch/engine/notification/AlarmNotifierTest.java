package com.waterwatch.engine.notification;

import com.waterwatch.engine.config.SmsConfig;
import com.waterwatch.engine.model.AlarmEvent;
import com.waterwatch.engine.model.Contact;
import com.waterwatch.engine.model.DeliveryKind;
import com.waterwatch.engine.model.DeliveryRecord;
import com.waterwatch.engine.model.DeliveryResult;
import com.waterwatch.engine.store.InMemoryRecordStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link AlarmNotifier}.
 */
class AlarmNotifierTest {

    private static final String SUPERVISOR = "+64211234567";
    private static final String OPERATOR = "+64217654321";

    private SmsTransport transport;
    private InMemoryRecordStore store;
    private SmsConfig smsConfig;
    private AlarmNotifier notifier;
    private AlarmEvent alarm;

    @BeforeEach
    void setUp() {
        transport = mock(SmsTransport.class);
        when(transport.getType()).thenReturn("mock");
        when(transport.isConfigured()).thenReturn(true);

        store = new InMemoryRecordStore();
        smsConfig = new SmsConfig();
        smsConfig.setTestMode(false);
        smsConfig.setMaxAttempts(3);
        smsConfig.setInitialBackoffMillis(1);

        notifier = new AlarmNotifier(transport, store, smsConfig, new SimpleMeterRegistry(),
                Clock.fixed(Instant.parse("2024-03-12T10:00:00Z"), ZoneOffset.UTC));
        alarm = AlarmEvent.builder().id("alarm-1").thresholdRef("FT5101_TotalLts_shift").build();
    }

    @Test
    @DisplayName("Should send to every recipient and record each delivery")
    void sendsToEveryRecipient() throws Exception {
        when(transport.send(anyString(), eq("msg"))).thenReturn(SmsSendResult.accepted("SM1"));

        List<DeliveryRecord> records = notifier.notify(alarm,
                List.of(contact("Supervisor", SUPERVISOR), contact("Operator", OPERATOR)), DeliveryKind.ALARM, "msg");

        assertThat(records).extracting(DeliveryRecord::getResult).containsOnly(DeliveryResult.SENT);
        assertThat(records).extracting(DeliveryRecord::getContactMsisdn).containsExactly(SUPERVISOR, OPERATOR);
        assertThat(store.listDeliveries("alarm-1")).hasSize(2);
    }

    @Test
    @DisplayName("Transient failure is retried and succeeds")
    void retriesTransientFailure() throws Exception {
        when(transport.send(SUPERVISOR, "msg"))
                .thenThrow(new SmsTransport.SmsTransportException("HTTP 503", true))
                .thenReturn(SmsSendResult.accepted("SM2"));

        DeliveryRecord record = notifier.notify(alarm, List.of(contact("Supervisor", SUPERVISOR)),
                DeliveryKind.ALARM, "msg").get(0);

        assertThat(record.getResult()).isEqualTo(DeliveryResult.SENT);
        assertThat(record.getProviderMessageId()).isEqualTo("SM2");
        assertThat(record.getAttempts()).isEqualTo(2);
    }

    @Test
    @DisplayName("Retries stop after max attempts")
    void retriesExhausted() throws Exception {
        when(transport.send(SUPERVISOR, "msg")).thenThrow(new SmsTransport.SmsTransportException("timeout", true));

        DeliveryRecord record = notifier.notify(alarm, List.of(contact("Supervisor", SUPERVISOR)),
                DeliveryKind.ALARM, "msg").get(0);

        assertThat(record.getResult()).isEqualTo(DeliveryResult.FAILED);
        assertThat(record.getAttempts()).isEqualTo(3);
        assertThat(record.getError()).isEqualTo("timeout");
        verify(transport, times(3)).send(SUPERVISOR, "msg");
    }

    @Test
    @DisplayName("Permanent rejection is not retried and does not stop other recipients")
    void rejectionIsolatedPerRecipient() throws Exception {
        when(transport.send(SUPERVISOR, "msg")).thenReturn(SmsSendResult.rejected("HTTP 400: unverified number"));
        when(transport.send(OPERATOR, "msg")).thenReturn(SmsSendResult.accepted("SM3"));

        List<DeliveryRecord> records = notifier.notify(alarm,
                List.of(contact("Supervisor", SUPERVISOR), contact("Operator", OPERATOR)), DeliveryKind.ALARM, "msg");

        assertThat(records).extracting(DeliveryRecord::getResult)
                .containsExactly(DeliveryResult.FAILED, DeliveryResult.SENT);
        assertThat(records.get(0).getAttempts()).isEqualTo(1);
        verify(transport, times(1)).send(SUPERVISOR, "msg");
    }

    @Test
    @DisplayName("Invalid phone numbers are skipped without calling the provider")
    void invalidMsisdnSkipped() throws Exception {
        DeliveryRecord record = notifier.notify(alarm, List.of(contact("Typo", "021 123")),
                DeliveryKind.ALARM, "msg").get(0);

        assertThat(record.getResult()).isEqualTo(DeliveryResult.SKIPPED);
        verify(transport, never()).send(anyString(), anyString());
    }

    @Test
    @DisplayName("Test mode sends to the test numbers instead of the routed contacts")
    void testModeRedirects() throws Exception {
        smsConfig.setTestMode(true);
        smsConfig.setTestNumbers(List.of("+64210000001"));
        when(transport.send("+64210000001", "msg")).thenReturn(SmsSendResult.accepted("SM4"));

        List<DeliveryRecord> records = notifier.notify(alarm, List.of(contact("Supervisor", SUPERVISOR)),
                DeliveryKind.ALARM, "msg");

        assertThat(records).singleElement().satisfies(record -> {
            assertThat(record.getContactMsisdn()).isEqualTo("+64210000001");
            assertThat(record.getResult()).isEqualTo(DeliveryResult.SENT);
        });
        verify(transport, never()).send(eq(SUPERVISOR), anyString());
    }

    @Test
    @DisplayName("Unconfigured transport records a failed delivery")
    void unconfiguredTransport() {
        when(transport.isConfigured()).thenReturn(false);

        DeliveryRecord record = notifier.notify(alarm, List.of(contact("Supervisor", SUPERVISOR)),
                DeliveryKind.ALARM, "msg").get(0);

        assertThat(record.getResult()).isEqualTo(DeliveryResult.FAILED);
        assertThat(record.getError()).contains("not configured");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static Contact contact(String name, String msisdn) {
        return Contact.builder().name(name).msisdn(msisdn).group("operations").enabled(true).build();
    }
}
