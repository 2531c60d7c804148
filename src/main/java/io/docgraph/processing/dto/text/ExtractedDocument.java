package io.docgraph.processing.dto.text;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Plain text produced by a document-to-text extractor, with per-page metadata.
 */
public record ExtractedDocument(
        @JsonProperty("text") String text,
        @JsonProperty("pages") List<PageMetadata> pages
) {
    public ExtractedDocument {
        pages = List.copyOf(pages);
    }
}
