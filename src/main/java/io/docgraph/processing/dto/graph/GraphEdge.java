package io.docgraph.processing.dto.graph;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Connection between two nodes. For undirected graphs {@code source} is the lexicographically
 * smaller id. {@code weight} is the number of relation triples folded into the edge.
 */
public record GraphEdge(
        @JsonProperty("source") String source,
        @JsonProperty("target") String target,
        @JsonProperty("weight") int weight,
        @JsonProperty("predicates") SortedSet<String> predicates
) {
    public GraphEdge {
        predicates = Collections.unmodifiableSortedSet(new TreeSet<>(predicates));
    }

    public static GraphEdge of(String source, String target, int weight, Set<String> predicates) {
        return new GraphEdge(source, target, weight, new TreeSet<>(predicates));
    }
}
