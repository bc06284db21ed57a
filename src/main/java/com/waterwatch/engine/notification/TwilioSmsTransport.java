package com.waterwatch.engine.notification;

import com.waterwatch.engine.config.SmsConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Sends SMS through the Twilio Messages REST API.
 *
 * 4xx answers other than 429 are permanent rejections (bad number, unverified
 * sender). 429, 5xx, connection failures and timeouts are transient.
 *
 * @author WaterWatch
 * @version 1.0.0
 */
@Slf4j
public class TwilioSmsTransport implements SmsTransport {

    private final WebClient webClient;
    private final SmsConfig smsConfig;

    public TwilioSmsTransport(WebClient webClient, SmsConfig smsConfig) {
        this.webClient = webClient;
        this.smsConfig = smsConfig;
        log.info("Initialized Twilio SMS transport for account {} sending from {}",
                smsConfig.getAccountSid(), smsConfig.getFrom());
    }

    @Override
    public SmsSendResult send(String msisdn, String message) throws SmsTransportException {
        if (!isConfigured()) {
            throw new SmsTransportException("Twilio transport is not configured", false);
        }

        String url = String.format("%s/2010-04-01/Accounts/%s/Messages.json",
                smsConfig.getBaseUrl(), smsConfig.getAccountSid());

        try {
            Map<String, Object> response = webClient.post()
                    .uri(url)
                    .headers(headers -> headers.setBasicAuth(smsConfig.getAccountSid(), smsConfig.getAuthToken()))
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .body(BodyInserters.fromFormData("To", msisdn)
                            .with("From", smsConfig.getFrom())
                            .with("Body", message))
                    .retrieve()
                    .bodyToMono(new ParameterizedTypeReference<Map<String, Object>>() {})
                    .timeout(Duration.ofSeconds(smsConfig.getTimeoutSeconds()))
                    .block();

            Object sid = response != null ? response.get("sid") : null;
            log.debug("Twilio accepted message to {}: sid={}", msisdn, sid);
            return SmsSendResult.accepted(sid != null ? sid.toString() : null);

        } catch (WebClientResponseException e) {
            HttpStatusCode status = e.getStatusCode();
            String detail = String.format("HTTP %d: %s", status.value(), e.getResponseBodyAsString());
            if (status.is5xxServerError() || status.value() == 429) {
                throw new SmsTransportException("Twilio temporarily unavailable, " + detail, true, e);
            }
            log.warn("Twilio rejected message to {}: {}", msisdn, detail);
            return SmsSendResult.rejected(detail);
        } catch (WebClientRequestException e) {
            throw new SmsTransportException("Could not reach Twilio: " + e.getMessage(), true, e);
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof TimeoutException) {
                throw new SmsTransportException("Twilio did not answer within "
                        + smsConfig.getTimeoutSeconds() + "s", true, cause);
            }
            throw new SmsTransportException("Unexpected error sending SMS: " + e.getMessage(), false, e);
        }
    }

    @Override
    public String getType() {
        return "twilio";
    }

    @Override
    public boolean isConfigured() {
        return smsConfig.hasCredentials();
    }
}
