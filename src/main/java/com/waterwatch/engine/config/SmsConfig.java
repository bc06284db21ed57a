package com.waterwatch.engine.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the SMS provider.
 *
 * @author WaterWatch
 * @version 1.0.0
 */
@Configuration
@ConfigurationProperties(prefix = "waterwatch.sms")
@Data
@Validated
public class SmsConfig {

    /**
     * Provider API base URL
     */
    @NotEmpty
    private String baseUrl = "https://api.twilio.com";

    /**
     * Provider credentials; without them messages are only logged
     */
    private String accountSid;

    private String authToken;

    /**
     * Sender number (E.164)
     */
    private String from;

    /**
     * In test mode every alarm goes to the test numbers instead of the routed contacts
     */
    private boolean testMode = true;

    private List<String> testNumbers = new ArrayList<>();

    /**
     * Total transport calls per recipient, including the first
     */
    @Min(1)
    private int maxAttempts = 3;

    @Min(1)
    private long initialBackoffMillis = 1000;

    @Min(1)
    private int connectTimeoutSeconds = 10;

    @Min(1)
    private int timeoutSeconds = 15;

    public boolean hasCredentials() {
        return accountSid != null && !accountSid.isBlank()
                && authToken != null && !authToken.isBlank()
                && from != null && !from.isBlank();
    }
}
