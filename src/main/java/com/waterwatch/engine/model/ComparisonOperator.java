package com.waterwatch.engine.model;

import java.util.Arrays;

/**
 * Comparison applied between an observed value and a threshold limit.
 */
public enum ComparisonOperator {
    GTE(">=", "at or above"),
    LTE("<=", "at or below"),
    GT(">", "above"),
    LT("<", "below"),
    EQ("==", "equal to");

    /**
     * Tolerance used for equality on doubles
     */
    public static final double EPSILON = 0.001;

    private final String symbol;
    private final String description;

    ComparisonOperator(String symbol, String description) {
        this.symbol = symbol;
        this.description = description;
    }

    public String getSymbol() {
        return symbol;
    }

    public String getDescription() {
        return description;
    }

    public boolean test(double value, double limit) {
        return switch (this) {
            case GTE -> value >= limit;
            case LTE -> value <= limit;
            case GT -> value > limit;
            case LT -> value < limit;
            case EQ -> Math.abs(value - limit) < EPSILON;
        };
    }

    /**
     * Parse either the symbol (">=") or the enum name ("GTE")
     *
     * @throws IllegalArgumentException for anything else
     */
    public static ComparisonOperator parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("comparison operator is missing");
        }
        String trimmed = text.trim();
        return Arrays.stream(values())
                .filter(op -> op.symbol.equals(trimmed) || op.name().equalsIgnoreCase(trimmed))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("unknown comparison operator '" + text + "'"));
    }
}
