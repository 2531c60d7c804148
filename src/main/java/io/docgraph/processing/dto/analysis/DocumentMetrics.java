package io.docgraph.processing.dto.analysis;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Document-level scalars. {@code sentiment}, {@code subjectivity} and {@code readability} are null
 * when their scorer failed.
 */
public record DocumentMetrics(
        @JsonProperty("wordCount") int wordCount,
        @JsonProperty("charCount") int charCount,
        @JsonProperty("sentenceCount") int sentenceCount,
        @JsonProperty("averageWordLength") double averageWordLength,
        @JsonProperty("sentiment") Double sentiment,
        @JsonProperty("subjectivity") Double subjectivity,
        @JsonProperty("readability") Double readability
) {
    @JsonIgnore
    public boolean isComplete() {
        return sentiment != null && subjectivity != null && readability != null;
    }
}
