package com.lawcheck.verify;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Finding severities, least severe first. */
public enum Severity {
    INFO("info"),
    WARNING("warning"),
    ERROR("error"),
    CRITICAL("critical");

    private final String value;

    Severity(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }

    @JsonCreator
    public static Severity fromValue(String raw) {
        for (Severity severity : values()) {
            if (severity.value.equalsIgnoreCase(raw)) {
                return severity;
            }
        }
        throw new IllegalArgumentException("unknown severity: " + raw);
    }
}
