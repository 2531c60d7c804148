package io.docgraph.processing.dto.nlp;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.docgraph.processing.dto.text.TextSpan;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Deduplicated identity behind one or more mentions.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CanonicalEntity(
        @JsonProperty("id") String id,
        @JsonProperty("label") String label,
        @JsonProperty("type") EntityType type,
        @JsonProperty("mentionSpans") List<TextSpan> mentionSpans,
        @JsonProperty("surfaceForms") Set<String> surfaceForms
) {

    public CanonicalEntity {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Canonical label must not be empty for entity " + id);
        }
        mentionSpans = List.copyOf(mentionSpans);
        surfaceForms = Collections.unmodifiableSortedSet(new TreeSet<>(surfaceForms));
    }

    @JsonProperty("mentionCount")
    public int mentionCount() {
        return mentionSpans.size();
    }
}
