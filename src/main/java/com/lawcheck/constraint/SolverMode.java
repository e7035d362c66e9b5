package com.lawcheck.constraint;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which constraint backend to use. {@code AUTO} and {@code Z3} both fall back
 * to the structural backend when Z3 cannot be loaded; {@code Z3} logs the
 * fallback as a warning. {@code HEURISTIC} never loads Z3.
 */
public enum SolverMode {
    AUTO("auto"),
    Z3("z3"),
    HEURISTIC("heuristic");

    private final String value;

    SolverMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static SolverMode fromValue(String raw) {
        for (SolverMode mode : values()) {
            if (mode.value.equalsIgnoreCase(raw) || mode.name().equalsIgnoreCase(raw)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("unknown solver mode: " + raw);
    }
}
