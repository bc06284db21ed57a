package com.waterwatch.engine.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One notification attempt to one contact. Append-only.
 *
 * @author WaterWatch
 * @version 1.0.0
 */
@Value
@Builder
public class DeliveryRecord {

    String alarmEventId;

    String contactName;

    String contactMsisdn;

    DeliveryKind kind;

    Instant sentAt;

    DeliveryResult result;

    /**
     * Provider message id when the provider accepted the message
     */
    String providerMessageId;

    /**
     * Number of transport calls made, including retries
     */
    int attempts;

    String error;
}
