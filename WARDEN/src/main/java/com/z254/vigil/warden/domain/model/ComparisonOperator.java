package com.z254.vigil.warden.domain.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Comparison operators available to policy conditions.
 */
public enum ComparisonOperator {
    GREATER_THAN(">"),
    LESS_THAN("<"),
    GREATER_OR_EQUAL(">="),
    LESS_OR_EQUAL("<="),
    EQUAL("==");

    private static final double EQUALITY_TOLERANCE = 1e-9;

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public boolean test(double value, double threshold) {
        return switch (this) {
            case GREATER_THAN -> value > threshold;
            case LESS_THAN -> value < threshold;
            case GREATER_OR_EQUAL -> value >= threshold;
            case LESS_OR_EQUAL -> value <= threshold;
            case EQUAL -> Math.abs(value - threshold) < EQUALITY_TOLERANCE;
        };
    }

    public static Optional<ComparisonOperator> fromSymbol(String symbol) {
        if (symbol == null) {
            return Optional.empty();
        }
        String trimmed = symbol.trim();
        return Arrays.stream(values())
                .filter(op -> op.symbol.equals(trimmed) || op.name().equalsIgnoreCase(trimmed))
                .findFirst();
    }
}
