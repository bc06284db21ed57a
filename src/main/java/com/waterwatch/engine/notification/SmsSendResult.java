package com.waterwatch.engine.notification;

import lombok.Value;

/**
 * Provider answer for one message
 */
@Value
public class SmsSendResult {

    public enum Status {
        ACCEPTED,
        REJECTED
    }

    Status status;

    String providerMessageId;

    String error;

    public static SmsSendResult accepted(String providerMessageId) {
        return new SmsSendResult(Status.ACCEPTED, providerMessageId, null);
    }

    public static SmsSendResult rejected(String error) {
        return new SmsSendResult(Status.REJECTED, null, error);
    }

    public boolean isAccepted() {
        return status == Status.ACCEPTED;
    }
}
