package io.docgraph.processing.dto.nlp;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.docgraph.processing.dto.text.TextSpan;

/**
 * A (subject, predicate, object) fact extracted from one sentence.
 * Subject and object are always different entities.
 */
public record RelationTriple(
        @JsonProperty("subjectId") String subjectId,
        @JsonProperty("predicate") String predicate,
        @JsonProperty("objectId") String objectId,
        @JsonProperty("sentenceSpan") TextSpan sentenceSpan,
        @JsonProperty("confidence") RelationConfidence confidence
) {
    public RelationTriple {
        if (subjectId.equals(objectId)) {
            throw new IllegalArgumentException("Relation would be a self-loop on " + subjectId);
        }
    }
}
