package com.waterwatch.engine.historian;

/**
 * The historian could not be queried. Distinct from a tag with no data, which
 * is an empty result.
 */
public class HistorianUnavailableException extends RuntimeException {

    public HistorianUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
