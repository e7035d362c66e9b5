package com.lawcheck.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;

public enum EffectType {
    GRANT,
    REVOKE,
    OBLIGATION,
    PROHIBITION,
    MONETARY_TRANSFER,
    STATUS_CHANGE,
    COMPOUND,
    CONDITIONAL,
    DELAYED,
    CUSTOM;

    /**
     * Whether an effect of this type cannot coexist with an effect of
     * {@code other} on the same resource (grant/revoke, obligation/prohibition).
     */
    public boolean excludes(EffectType other) {
        return switch (this) {
            case GRANT -> other == REVOKE;
            case REVOKE -> other == GRANT;
            case OBLIGATION -> other == PROHIBITION;
            case PROHIBITION -> other == OBLIGATION;
            default -> false;
        };
    }

    /** Effects that take something away from the addressee. */
    public boolean isAdverse() {
        return this == REVOKE || this == PROHIBITION || this == STATUS_CHANGE;
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static EffectType fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        String normalized = raw.trim().replace('-', '_');
        return Arrays.stream(values())
            .filter(v -> v.name().equalsIgnoreCase(normalized)
                || v.name().replace("_", "").equalsIgnoreCase(normalized))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown effect type: " + raw));
    }
}
