package io.docgraph.processing.service.metrics;

import io.docgraph.processing.dto.text.NormalizedText;

/**
 * Document-level readability index; higher means easier to read.
 */
public interface ReadabilityScorer {

    double score(NormalizedText text);
}
