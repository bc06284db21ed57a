package com.waterwatch.engine.model;

import java.util.Locale;

/**
 * Which aggregate a threshold is compared against.
 */
public enum ThresholdTarget {
    DAY_TOTAL(WindowKind.DAY),
    SHIFT_TOTAL(WindowKind.SHIFT);

    private final WindowKind windowKind;

    ThresholdTarget(WindowKind windowKind) {
        this.windowKind = windowKind;
    }

    public WindowKind getWindowKind() {
        return windowKind;
    }

    /**
     * Accepts "day_total", "DAY_TOTAL", "shift_total", ...
     *
     * @throws IllegalArgumentException for anything else
     */
    public static ThresholdTarget parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("target is missing");
        }
        try {
            return valueOf(text.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unsupported target '" + text + "'", e);
        }
    }

    public String toConfigValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
