package io.docgraph.processing.service.metrics;

/**
 * Document-level sentiment polarity in [-1, 1].
 */
public interface SentimentScorer {

    double score(String text);
}
