package com.lawcheck.graph;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Summary of a statute reference graph. {@code diameter} is {@code null} when
 * the graph is empty or not weakly connected.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record GraphMetrics(
    @JsonProperty("node_count") int nodeCount,
    @JsonProperty("edge_count") int edgeCount,
    @JsonProperty("density") double density,
    @JsonProperty("scc_count") int sccCount,
    @JsonProperty("cycles") List<List<String>> cycles,
    @JsonProperty("diameter") Integer diameter,
    @JsonProperty("page_rank") Map<String, Double> pageRank,
    @JsonProperty("betweenness") Map<String, Double> betweenness,
    @JsonProperty("most_referenced") List<String> mostReferenced,
    @JsonProperty("isolated") List<String> isolated,
    @JsonProperty("max_in_degree") int maxInDegree,
    @JsonProperty("max_out_degree") int maxOutDegree,
    @JsonProperty("dangling_references") Map<String, Set<String>> danglingReferences
) {
}
