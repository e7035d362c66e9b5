package com.lawcheck.conflict;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * A conflict between two statutes. The pair is unordered: detection always
 * reports it with {@code firstId <= secondId}.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record StatuteConflict(
    @JsonProperty("conflict_type") ConflictType conflictType,
    @JsonProperty("first_id") String firstId,
    @JsonProperty("second_id") String secondId,
    @JsonProperty("description") String description
) {
}
