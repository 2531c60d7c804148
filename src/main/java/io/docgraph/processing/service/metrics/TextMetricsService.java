package io.docgraph.processing.service.metrics;

import io.docgraph.processing.dto.analysis.DocumentMetrics;
import io.docgraph.processing.dto.text.NormalizedText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.function.DoubleSupplier;

/**
 * Raw counts plus the pluggable sentiment, subjectivity and readability scores.
 * A failing scorer leaves its metric null instead of failing the run.
 */
@Service
public class TextMetricsService {

    private static final Logger logger = LoggerFactory.getLogger(TextMetricsService.class);

    private final SentimentScorer sentimentScorer;
    private final SubjectivityScorer subjectivityScorer;
    private final ReadabilityScorer readabilityScorer;

    public TextMetricsService(SentimentScorer sentimentScorer, SubjectivityScorer subjectivityScorer,
                              ReadabilityScorer readabilityScorer) {
        this.sentimentScorer = sentimentScorer;
        this.subjectivityScorer = subjectivityScorer;
        this.readabilityScorer = readabilityScorer;
    }

    public DocumentMetrics compute(NormalizedText text) {
        String[] words = text.text().trim().split("\\s+");
        double averageWordLength = Arrays.stream(words).mapToInt(String::length).average().orElse(0.0);

        return new DocumentMetrics(
                words.length,
                text.text().length(),
                text.sentenceCount(),
                averageWordLength,
                scoreOrNull("Sentiment", () -> sentimentScorer.score(text.text())),
                scoreOrNull("Subjectivity", () -> subjectivityScorer.score(text.text())),
                scoreOrNull("Readability", () -> readabilityScorer.score(text))
        );
    }

    private Double scoreOrNull(String metric, DoubleSupplier scorer) {
        try {
            return scorer.getAsDouble();
        } catch (RuntimeException e) {
            logger.error("{} scoring failed: {}", metric, e.getMessage(), e);
            return null;
        }
    }
}
