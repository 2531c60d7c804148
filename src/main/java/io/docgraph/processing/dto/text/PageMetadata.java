package io.docgraph.processing.dto.text;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PageMetadata(
        @JsonProperty("pageNumber") int pageNumber,
        @JsonProperty("charCount") int charCount
) {}
