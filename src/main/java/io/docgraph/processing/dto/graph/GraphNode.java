package io.docgraph.processing.dto.graph;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.docgraph.processing.dto.nlp.EntityType;

/**
 * Graph vertex for one canonical entity. {@code id} equals the entity id.
 */
public record GraphNode(
        @JsonProperty("id") String id,
        @JsonProperty("label") String label,
        @JsonProperty("type") EntityType type,
        @JsonProperty("mentionCount") int mentionCount,
        @JsonProperty("degree") int degree,
        @JsonProperty("degreeCentrality") double degreeCentrality
) {}
