package io.docgraph.processing.dto.text;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Cleaned document text with its sentence boundaries.
 * Sentence spans are ordered, non-overlapping and lie inside the text.
 */
public record NormalizedText(
        @JsonProperty("text") String text,
        @JsonProperty("sentences") List<TextSpan> sentences
) {

    public NormalizedText {
        sentences = List.copyOf(sentences);
        int previousEnd = 0;
        for (TextSpan span : sentences) {
            if (span.begin() < previousEnd || span.end() > text.length()) {
                throw new IllegalArgumentException("Sentence span " + span + " is out of order or out of bounds");
            }
            previousEnd = span.end();
        }
    }

    public String slice(TextSpan span) {
        return text.substring(span.begin(), span.end());
    }

    @JsonIgnore
    public List<String> sentenceTexts() {
        return sentences.stream().map(this::slice).toList();
    }

    @JsonIgnore
    public int sentenceCount() {
        return sentences.size();
    }
}
