package io.docgraph.processing.service.document;

import io.docgraph.processing.dto.text.ExtractedDocument;

/**
 * Document-to-text collaborator.
 */
public interface DocumentTextExtractor {

    ExtractedDocument extract(byte[] documentBytes);
}
