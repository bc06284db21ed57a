package com.waterwatch.engine.model;

import java.util.Locale;

/**
 * Alarm severity levels
 */
public enum Severity {
    INFO,
    WARN,
    MEDIUM,
    CRITICAL;

    /**
     * Accepts any case; "warning" is read as WARN
     *
     * @throws IllegalArgumentException for unknown values
     */
    public static Severity parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("severity is missing");
        }
        String normalized = text.trim().toUpperCase(Locale.ROOT);
        if ("WARNING".equals(normalized)) {
            return WARN;
        }
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown severity '" + text + "'", e);
        }
    }
}
