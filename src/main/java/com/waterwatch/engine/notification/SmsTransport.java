package com.waterwatch.engine.notification;

/**
 * Interface for SMS providers.
 *
 * A call is synchronous from the engine's point of view. A message the
 * provider refuses is returned as a rejected result; a failure that may
 * succeed when retried (timeout, throttling, provider outage) is thrown as a
 * transient {@link SmsTransportException}.
 *
 * @author WaterWatch
 * @version 1.0.0
 */
public interface SmsTransport {

    /**
     * Send one message to one phone number
     *
     * @param msisdn  recipient in E.164 format
     * @param message message text
     * @return accepted or rejected outcome
     * @throws SmsTransportException if the provider could not be reached or did not answer
     */
    SmsSendResult send(String msisdn, String message) throws SmsTransportException;

    /**
     * @return transport type (e.g., "twilio", "log")
     */
    String getType();

    /**
     * Check if this transport has what it needs to send
     */
    default boolean isConfigured() {
        return true;
    }

    /**
     * Exception thrown when a message could not be handed to the provider
     */
    class SmsTransportException extends Exception {

        private final boolean transientFailure;

        public SmsTransportException(String message, boolean transientFailure) {
            super(message);
            this.transientFailure = transientFailure;
        }

        public SmsTransportException(String message, boolean transientFailure, Throwable cause) {
            super(message, cause);
            this.transientFailure = transientFailure;
        }

        /**
         * @return true when the same send may succeed if retried
         */
        public boolean isTransient() {
            return transientFailure;
        }
    }
}
