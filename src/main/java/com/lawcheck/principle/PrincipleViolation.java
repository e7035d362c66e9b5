package com.lawcheck.principle;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PrincipleViolation(
    @JsonProperty("principle_id") String principleId,
    @JsonProperty("principle") String principle,
    @JsonProperty("statute_id") String statuteId,
    @JsonProperty("detail") String detail
) {
}
