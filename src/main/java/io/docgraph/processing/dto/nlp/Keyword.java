package io.docgraph.processing.dto.nlp;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Comparator;

/**
 * A salient term of the document. {@code documentFrequency} counts the sentences containing it.
 */
public record Keyword(
        @JsonProperty("term") String term,
        @JsonProperty("score") double score,
        @JsonProperty("frequency") int frequency,
        @JsonProperty("documentFrequency") int documentFrequency
) {

    /** Descending score, then descending raw frequency, then term ascending. */
    public static final Comparator<Keyword> RANKING = Comparator
            .comparingDouble(Keyword::score).reversed()
            .thenComparing(Comparator.comparingInt(Keyword::frequency).reversed())
            .thenComparing(Keyword::term);
}
