package io.docgraph.processing.service.metrics;

/**
 * Document-level subjectivity in [0, 1]; 0 reads as purely factual.
 */
public interface SubjectivityScorer {

    double score(String text);
}
