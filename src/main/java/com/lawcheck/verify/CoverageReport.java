package com.lawcheck.verify;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;
import java.util.Map;

/**
 * Which preconditions can be satisfied at all. Indices are 0-based per statute;
 * a precondition the backend could not decide is neither covered nor
 * unsatisfiable but counted in {@code undecided}.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CoverageReport(
    @JsonProperty("total_conditions") int totalConditions,
    @JsonProperty("satisfiable_conditions") int satisfiableConditions,
    @JsonProperty("unsatisfiable_conditions") int unsatisfiableConditions,
    @JsonProperty("undecided") int undecided,
    @JsonProperty("covered_conditions") Map<String, List<Integer>> coveredConditions,
    @JsonProperty("uncovered_conditions") Map<String, List<Integer>> uncoveredConditions
) {

    @JsonProperty("coverage_percentage")
    public double coveragePercentage() {
        return totalConditions == 0 ? 0.0 : satisfiableConditions * 100.0 / totalConditions;
    }

    public boolean isComplete() {
        return totalConditions > 0 && satisfiableConditions == totalConditions;
    }
}
