package io.docgraph.processing.dto.graph;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Optional;

/**
 * Assembled entity graph. Read-only once built.
 */
public record KnowledgeGraph(
        @JsonProperty("directed") boolean directed,
        @JsonProperty("nodes") List<GraphNode> nodes,
        @JsonProperty("edges") List<GraphEdge> edges,
        @JsonProperty("statistics") GraphStatistics statistics
) {
    public KnowledgeGraph {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }

    public static KnowledgeGraph empty(boolean directed) {
        return new KnowledgeGraph(directed, List.of(), List.of(),
                new GraphStatistics(0, 0, 0.0, 0.0, 0, 0, false));
    }

    @JsonIgnore
    public Optional<GraphNode> node(String id) {
        return nodes.stream().filter(node -> node.id().equals(id)).findFirst();
    }

    @JsonIgnore
    public Optional<GraphEdge> edge(String source, String target) {
        return edges.stream()
                .filter(edge -> (edge.source().equals(source) && edge.target().equals(target))
                        || (!directed && edge.source().equals(target) && edge.target().equals(source)))
                .findFirst();
    }
}
