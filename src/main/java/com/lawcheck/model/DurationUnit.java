package com.lawcheck.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;

public enum DurationUnit {
    DAYS,
    WEEKS,
    MONTHS,
    YEARS;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static DurationUnit fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.name().equalsIgnoreCase(raw.trim()))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown duration unit: " + raw));
    }
}
