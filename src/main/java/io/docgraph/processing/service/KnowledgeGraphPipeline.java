package io.docgraph.processing.service;

import io.docgraph.processing.dto.analysis.AnalysisResult;
import io.docgraph.processing.dto.analysis.DocumentMetrics;
import io.docgraph.processing.dto.analysis.PipelineStage;
import io.docgraph.processing.dto.graph.KnowledgeGraph;
import io.docgraph.processing.dto.nlp.EntityExtractionResult;
import io.docgraph.processing.dto.nlp.Keyword;
import io.docgraph.processing.dto.nlp.RelationExtractionResult;
import io.docgraph.processing.dto.text.NormalizedText;
import io.docgraph.processing.exception.ExtractionFailureException;
import io.docgraph.processing.service.graph.GraphBuilder;
import io.docgraph.processing.service.keyword.KeywordScorer;
import io.docgraph.processing.service.metrics.TextMetricsService;
import io.docgraph.processing.service.nlp.EntityExtractor;
import io.docgraph.processing.service.relation.RelationExtractor;
import io.docgraph.processing.service.text.TextNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Single synchronous run from raw text to {@link AnalysisResult}. Stages run in order and never re-enter.
 * <p>
 * Empty input and consistency violations abort the run. A stage whose collaborator fails yields an
 * empty output instead, and the result is flagged as a partial success.
 */
@Service
public class KnowledgeGraphPipeline {

    private static final Logger logger = LoggerFactory.getLogger(KnowledgeGraphPipeline.class);

    private final TextNormalizer normalizer;
    private final EntityExtractor entityExtractor;
    private final KeywordScorer keywordScorer;
    private final RelationExtractor relationExtractor;
    private final GraphBuilder graphBuilder;
    private final TextMetricsService metricsService;
    private final AnalysisAggregator aggregator;

    public KnowledgeGraphPipeline(TextNormalizer normalizer,
                                  EntityExtractor entityExtractor,
                                  KeywordScorer keywordScorer,
                                  RelationExtractor relationExtractor,
                                  GraphBuilder graphBuilder,
                                  TextMetricsService metricsService,
                                  AnalysisAggregator aggregator) {
        this.normalizer = normalizer;
        this.entityExtractor = entityExtractor;
        this.keywordScorer = keywordScorer;
        this.relationExtractor = relationExtractor;
        this.graphBuilder = graphBuilder;
        this.metricsService = metricsService;
        this.aggregator = aggregator;
    }

    public AnalysisResult analyze(String rawText) {
        long startTime = System.currentTimeMillis();

        NormalizedText text = normalizer.normalize(rawText);
        Set<PipelineStage> degraded = EnumSet.noneOf(PipelineStage.class);

        EntityExtractionResult entities = runStage(PipelineStage.ENTITIES,
                () -> entityExtractor.extract(text), EntityExtractionResult::empty, degraded);
        logger.debug("Entity summary: {}", entities.getSummary());

        List<Keyword> keywords = runStage(PipelineStage.KEYWORDS,
                () -> keywordScorer.score(text, entities.entities()), List::of, degraded);

        RelationExtractionResult relations = runStage(PipelineStage.RELATIONS,
                () -> relationExtractor.extract(text, entities), RelationExtractionResult::empty, degraded);

        KnowledgeGraph graph = graphBuilder.build(entities.entities(), relations.triples());

        DocumentMetrics metrics = metricsService.compute(text);
        if (!metrics.isComplete()) {
            degraded.add(PipelineStage.METRICS);
        }

        AnalysisResult result = aggregator.aggregate(text, entities, keywords, relations.triples(),
                graph, metrics, degraded);

        logger.info("Analyzed document in {}ms: {} sentences, {} entities, {} keywords, {} relations, graph {}/{}{}",
                System.currentTimeMillis() - startTime, text.sentenceCount(), result.entities().size(),
                result.keywords().size(), result.relations().size(),
                graph.statistics().nodeCount(), graph.statistics().edgeCount(),
                result.partialSuccess() ? " (degraded: " + degraded + ")" : "");

        return result;
    }

    private <T> T runStage(PipelineStage stage, Supplier<T> body, Supplier<T> fallback, Set<PipelineStage> degraded) {
        try {
            return body.get();
        } catch (ExtractionFailureException e) {
            logger.error("Stage {} failed, continuing with empty output: {}", stage, e.getMessage(), e);
            degraded.add(stage);
            return fallback.get();
        }
    }
}
