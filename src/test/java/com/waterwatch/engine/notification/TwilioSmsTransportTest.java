package com.waterwatch.engine.notification;

import com.waterwatch.engine.config.SmsConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link TwilioSmsTransport}.
 */
class TwilioSmsTransportTest {

    private SmsConfig smsConfig;
    private final AtomicReference<ClientRequest> lastRequest = new AtomicReference<>();

    @BeforeEach
    void setUp() {
        smsConfig = new SmsConfig();
        smsConfig.setBaseUrl("https://sms.example.test");
        smsConfig.setAccountSid("AC123");
        smsConfig.setAuthToken("secret");
        smsConfig.setFrom("+6421000000");
        smsConfig.setTimeoutSeconds(5);
    }

    @Test
    @DisplayName("Should post to the account's Messages resource and return the message sid")
    void acceptedMessage() throws Exception {
        TwilioSmsTransport transport = transport(HttpStatus.CREATED, "{\"sid\":\"SM123\",\"status\":\"queued\"}");

        SmsSendResult result = transport.send("+64211234567", "hello");

        assertThat(result.isAccepted()).isTrue();
        assertThat(result.getProviderMessageId()).isEqualTo("SM123");
        ClientRequest request = lastRequest.get();
        assertThat(request.method()).isEqualTo(HttpMethod.POST);
        assertThat(request.url().toString()).isEqualTo("https://sms.example.test/2010-04-01/Accounts/AC123/Messages.json");
        assertThat(request.headers().getFirst(HttpHeaders.AUTHORIZATION)).startsWith("Basic ");
    }

    @Test
    @DisplayName("Client error is a permanent rejection")
    void clientErrorRejected() throws Exception {
        TwilioSmsTransport transport = transport(HttpStatus.BAD_REQUEST, "{\"code\":21211,\"message\":\"Invalid 'To' Phone Number\"}");

        SmsSendResult result = transport.send("+64211234567", "hello");

        assertThat(result.isAccepted()).isFalse();
        assertThat(result.getError()).startsWith("HTTP 400").contains("Invalid 'To' Phone Number");
    }

    @Test
    @DisplayName("Server error is thrown as a transient failure")
    void serverErrorTransient() {
        TwilioSmsTransport transport = transport(HttpStatus.SERVICE_UNAVAILABLE, "{}");

        assertThatThrownBy(() -> transport.send("+64211234567", "hello"))
                .isInstanceOf(SmsTransport.SmsTransportException.class)
                .satisfies(e -> assertThat(((SmsTransport.SmsTransportException) e).isTransient()).isTrue());
    }

    @Test
    @DisplayName("Throttling is thrown as a transient failure")
    void throttlingTransient() {
        TwilioSmsTransport transport = transport(HttpStatus.TOO_MANY_REQUESTS, "{}");

        assertThatThrownBy(() -> transport.send("+64211234567", "hello"))
                .isInstanceOf(SmsTransport.SmsTransportException.class)
                .satisfies(e -> assertThat(((SmsTransport.SmsTransportException) e).isTransient()).isTrue());
    }

    @Test
    @DisplayName("Missing credentials means the transport is not configured")
    void notConfigured() {
        smsConfig.setAuthToken(null);
        TwilioSmsTransport transport = transport(HttpStatus.CREATED, "{}");

        assertThat(transport.isConfigured()).isFalse();
        assertThatThrownBy(() -> transport.send("+64211234567", "hello"))
                .isInstanceOf(SmsTransport.SmsTransportException.class)
                .satisfies(e -> assertThat(((SmsTransport.SmsTransportException) e).isTransient()).isFalse());
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private TwilioSmsTransport transport(HttpStatus status, String body) {
        WebClient webClient = WebClient.builder()
                .exchangeFunction(request -> {
                    lastRequest.set(request);
                    return Mono.just(ClientResponse.create(status)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                            .body(body)
                            .build());
                })
                .build();
        return new TwilioSmsTransport(webClient, smsConfig);
    }
}
