package io.docgraph.processing.dto.nlp;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.docgraph.processing.dto.text.TextSpan;

/**
 * One occurrence of a named entity in the normalized text.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EntityMention(
        @JsonProperty("text") String text,
        @JsonProperty("span") TextSpan span,
        @JsonProperty("type") EntityType type
) {}
