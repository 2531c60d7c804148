package io.docgraph.processing.dto.nlp;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record RelationExtractionResult(
        @JsonProperty("triples") List<RelationTriple> triples,
        @JsonProperty("candidates") int candidates,
        @JsonProperty("unresolved") int unresolved,
        @JsonProperty("selfLoopsDropped") int selfLoopsDropped
) {
    public RelationExtractionResult {
        triples = List.copyOf(triples);
    }

    public static RelationExtractionResult empty() {
        return new RelationExtractionResult(List.of(), 0, 0, 0);
    }
}
