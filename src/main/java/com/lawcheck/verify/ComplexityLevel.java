package com.lawcheck.verify;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ComplexityLevel {
    SIMPLE("simple", "Simple"),
    MODERATE("moderate", "Moderate"),
    COMPLEX("complex", "Complex"),
    VERY_COMPLEX("very_complex", "Very Complex");

    private final String value;
    private final String label;

    ComplexityLevel(String value, String label) {
        this.value = value;
        this.label = label;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getLabel() {
        return label;
    }

    /** Bands: 0-25 simple, 26-50 moderate, 51-75 complex, above that very complex. */
    public static ComplexityLevel forScore(int score) {
        if (score <= 25) {
            return SIMPLE;
        }
        if (score <= 50) {
            return MODERATE;
        }
        if (score <= 75) {
            return COMPLEX;
        }
        return VERY_COMPLEX;
    }
}
