package io.docgraph.processing.dto.graph;

import com.fasterxml.jackson.annotation.JsonProperty;

public record GraphStatistics(
        @JsonProperty("nodeCount") int nodeCount,
        @JsonProperty("edgeCount") int edgeCount,
        @JsonProperty("density") double density,
        @JsonProperty("averageDegree") double averageDegree,
        @JsonProperty("componentCount") int componentCount,
        @JsonProperty("isolatedNodeCount") int isolatedNodeCount,
        @JsonProperty("truncated") boolean truncated
) {}
