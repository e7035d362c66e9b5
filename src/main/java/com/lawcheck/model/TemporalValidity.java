package com.lawcheck.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.time.LocalDate;

/**
 * When a statute is in force. Any field may be absent; an absent effective
 * date means "since forever" and an absent expiry date means "open ended".
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TemporalValidity(
    @JsonProperty("effective_date") LocalDate effectiveDate,
    @JsonProperty("expiry_date") LocalDate expiryDate,
    @JsonProperty("enacted_at") Instant enactedAt,
    @JsonProperty("amended_at") Instant amendedAt
) {

    public static TemporalValidity between(LocalDate effectiveDate, LocalDate expiryDate) {
        return new TemporalValidity(effectiveDate, expiryDate, null, null);
    }

    public boolean isActive(LocalDate asOf) {
        boolean started = effectiveDate == null || !asOf.isBefore(effectiveDate);
        boolean notExpired = expiryDate == null || !asOf.isAfter(expiryDate);
        return started && notExpired;
    }

    /** Closed-interval overlap of the two validity windows. */
    public boolean overlaps(TemporalValidity other) {
        LocalDate start = later(effectiveDate, other.effectiveDate);
        LocalDate end = earlier(expiryDate, other.expiryDate);
        return start == null || end == null || !start.isAfter(end);
    }

    private static LocalDate later(LocalDate a, LocalDate b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return a.isAfter(b) ? a : b;
    }

    private static LocalDate earlier(LocalDate a, LocalDate b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return a.isBefore(b) ? a : b;
    }
}
