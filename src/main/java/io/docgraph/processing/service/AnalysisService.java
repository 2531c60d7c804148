package io.docgraph.processing.service;

import io.docgraph.processing.config.ProcessingConfig;
import io.docgraph.processing.dto.analysis.AnalysisResult;
import io.docgraph.processing.dto.text.ExtractedDocument;
import io.docgraph.processing.exception.DocumentTooLargeException;
import io.docgraph.processing.exception.KnowledgeGraphException;
import io.docgraph.processing.service.document.DocumentTextExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point for callers: applies the input-size budget, tags the run with a correlation id
 * and hands the text to the pipeline.
 */
@Service
public class AnalysisService {

    private static final Logger logger = LoggerFactory.getLogger(AnalysisService.class);

    private final KnowledgeGraphPipeline pipeline;
    private final DocumentTextExtractor textExtractor;
    private final ProcessingConfig config;

    public AnalysisService(KnowledgeGraphPipeline pipeline,
                           DocumentTextExtractor textExtractor,
                           ProcessingConfig config) {
        this.pipeline = pipeline;
        this.textExtractor = textExtractor;
        this.config = config;
    }

    public AnalysisResult analyze(String text) {
        String correlationId = "analysis-" + UUID.randomUUID().toString().substring(0, 8);
        MDC.put("correlationId", correlationId);

        try {
            int maxLength = config.performance().maxTextLength();
            if (text != null && text.length() > maxLength) {
                logger.warn("Rejecting document of {} characters (limit {})", text.length(), maxLength);
                throw new DocumentTooLargeException(text.length(), maxLength);
            }

            logger.info("Starting analysis of {} characters", text == null ? 0 : text.length());
            return pipeline.analyze(text);

        } finally {
            MDC.clear();
        }
    }

    public AnalysisResult analyzeDocument(byte[] documentBytes) {
        ExtractedDocument document = textExtractor.extract(documentBytes);

        logger.debug("Document text extracted: {} characters on {} pages",
                document.text().length(), document.pages().size());

        return analyze(document.text());
    }

    /**
     * Runs {@link #analyze} on the analysis executor. Runs share no mutable state, only the read-only NLP pipelines.
     */
    @Async("analysisExecutor")
    public CompletableFuture<AnalysisResult> analyzeAsync(String text) {
        try {
            return CompletableFuture.completedFuture(analyze(text));
        } catch (KnowledgeGraphException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
