package com.lawcheck.verify;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ComplexityMetrics(
    @JsonProperty("statute_id") String statuteId,
    @JsonProperty("condition_count") int conditionCount,
    @JsonProperty("condition_depth") int conditionDepth,
    @JsonProperty("logical_operator_count") int logicalOperatorCount,
    @JsonProperty("condition_type_count") int conditionTypeCount,
    @JsonProperty("has_discretion") boolean hasDiscretion,
    @JsonProperty("cyclomatic_complexity") int cyclomaticComplexity,
    @JsonProperty("complexity_score") int complexityScore,
    @JsonProperty("complexity_level") ComplexityLevel complexityLevel
) {
}
