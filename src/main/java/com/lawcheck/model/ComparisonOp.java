package com.lawcheck.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum ComparisonOp {
    EQUAL("=="),
    NOT_EQUAL("!="),
    LESS_THAN("<"),
    LESS_OR_EQUAL("<="),
    GREATER_THAN(">"),
    GREATER_OR_EQUAL(">=");

    private final String symbol;

    ComparisonOp(String symbol) {
        this.symbol = symbol;
    }

    @JsonValue
    public String getSymbol() {
        return symbol;
    }

    /** The operator that holds exactly when this one does not. */
    public ComparisonOp negate() {
        return switch (this) {
            case EQUAL -> NOT_EQUAL;
            case NOT_EQUAL -> EQUAL;
            case LESS_THAN -> GREATER_OR_EQUAL;
            case LESS_OR_EQUAL -> GREATER_THAN;
            case GREATER_THAN -> LESS_OR_EQUAL;
            case GREATER_OR_EQUAL -> LESS_THAN;
        };
    }

    public boolean test(long actual, long expected) {
        return test(Long.compare(actual, expected));
    }

    public boolean test(double actual, double expected) {
        return test(Double.compare(actual, expected));
    }

    private boolean test(int cmp) {
        return switch (this) {
            case EQUAL -> cmp == 0;
            case NOT_EQUAL -> cmp != 0;
            case LESS_THAN -> cmp < 0;
            case LESS_OR_EQUAL -> cmp <= 0;
            case GREATER_THAN -> cmp > 0;
            case GREATER_OR_EQUAL -> cmp >= 0;
        };
    }

    @JsonCreator
    public static ComparisonOp fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        String trimmed = raw.trim();
        if ("=".equals(trimmed)) {
            return EQUAL;
        }
        return Arrays.stream(values())
            .filter(v -> v.symbol.equals(trimmed) || v.name().equalsIgnoreCase(trimmed))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown comparison operator: " + raw));
    }

    @Override
    public String toString() {
        return symbol;
    }
}
