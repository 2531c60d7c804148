package io.docgraph.processing.service.document;

import io.docgraph.processing.dto.text.ExtractedDocument;
import io.docgraph.processing.dto.text.PageMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Decodes UTF-8 text; form feeds mark page breaks and are kept in the text.
 */
@Component
public class PlainTextDocumentExtractor implements DocumentTextExtractor {

    private static final Logger logger = LoggerFactory.getLogger(PlainTextDocumentExtractor.class);

    private static final String BYTE_ORDER_MARK = "\uFEFF";

    @Override
    public ExtractedDocument extract(byte[] documentBytes) {
        if (documentBytes == null || documentBytes.length == 0) {
            return new ExtractedDocument("", List.of());
        }

        String text = new String(documentBytes, StandardCharsets.UTF_8);
        if (text.startsWith(BYTE_ORDER_MARK)) {
            text = text.substring(BYTE_ORDER_MARK.length());
        }

        List<PageMetadata> pages = new ArrayList<>();
        String[] pageTexts = text.split("\f", -1);
        for (int i = 0; i < pageTexts.length; i++) {
            pages.add(new PageMetadata(i + 1, pageTexts[i].length()));
        }

        logger.debug("Extracted {} characters on {} pages from {} bytes", text.length(), pages.size(), documentBytes.length);
        return new ExtractedDocument(text, pages);
    }
}
