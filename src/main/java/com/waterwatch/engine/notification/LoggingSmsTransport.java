package com.waterwatch.engine.notification;

import lombok.extern.slf4j.Slf4j;

import java.util.UUID;

/**
 * Transport used when no SMS provider credentials are configured. Messages are
 * written to the log and reported as accepted.
 *
 * @author WaterWatch
 * @version 1.0.0
 */
@Slf4j
public class LoggingSmsTransport implements SmsTransport {

    @Override
    public SmsSendResult send(String msisdn, String message) {
        String id = "log-" + UUID.randomUUID();
        log.info("SMS (not sent, no provider configured) to {}: {}", msisdn, message);
        return SmsSendResult.accepted(id);
    }

    @Override
    public String getType() {
        return "log";
    }
}
