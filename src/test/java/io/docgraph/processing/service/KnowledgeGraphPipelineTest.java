package io.docgraph.processing.service;

import io.docgraph.processing.config.ProcessingConfig;
import io.docgraph.processing.dto.analysis.AnalysisResult;
import io.docgraph.processing.dto.analysis.PipelineStage;
import io.docgraph.processing.dto.graph.GraphEdge;
import io.docgraph.processing.dto.graph.GraphNode;
import io.docgraph.processing.dto.graph.GraphStatistics;
import io.docgraph.processing.dto.graph.KnowledgeGraph;
import io.docgraph.processing.dto.nlp.CanonicalEntity;
import io.docgraph.processing.dto.nlp.ClauseCandidate;
import io.docgraph.processing.dto.nlp.EntityType;
import io.docgraph.processing.dto.nlp.Keyword;
import io.docgraph.processing.dto.nlp.RelationTriple;
import io.docgraph.processing.dto.text.NormalizedText;
import io.docgraph.processing.dto.text.TextSpan;
import io.docgraph.processing.exception.ConsistencyException;
import io.docgraph.processing.exception.EmptyInputException;
import io.docgraph.processing.exception.ExtractionFailureException;
import io.docgraph.processing.service.graph.GraphBuilder;
import io.docgraph.processing.service.keyword.KeywordScorer;
import io.docgraph.processing.service.keyword.StopWords;
import io.docgraph.processing.service.metrics.FleschReadabilityScorer;
import io.docgraph.processing.service.metrics.LexiconSentimentScorer;
import io.docgraph.processing.service.metrics.LexiconSubjectivityScorer;
import io.docgraph.processing.service.metrics.SentimentScorer;
import io.docgraph.processing.service.metrics.TextMetricsService;
import io.docgraph.processing.service.nlp.DependencyParser;
import io.docgraph.processing.service.nlp.EntityExtractor;
import io.docgraph.processing.service.nlp.NerTagger;
import io.docgraph.processing.service.relation.PredicateNormalizer;
import io.docgraph.processing.service.relation.RelationExtractor;
import io.docgraph.processing.service.text.TextNormalizer;
import io.docgraph.processing.support.DictionaryNerTagger;
import io.docgraph.processing.support.PatternDependencyParser;
import io.docgraph.processing.support.TestConfigs;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;

class KnowledgeGraphPipelineTest {

    private static final String SCENARIO = "Alice works at Acme. Bob met Alice yesterday.";

    private final ProcessingConfig config = TestConfigs.defaults();
    private final StopWords stopWords = new StopWords();

    @Test
    @DisplayName("Should build the entity graph for a simple document")
    void shouldBuildTheEntityGraphForASimpleDocument() {
        AnalysisResult result = pipeline(people(), verbs()).analyze(SCENARIO);

        assertThat(result.entities()).extracting(CanonicalEntity::label).containsExactly("Alice", "Acme", "Bob");
        assertThat(result.relations()).extracting(RelationTriple::subjectId, RelationTriple::predicate,
                        RelationTriple::objectId)
                .containsExactly(tuple("e1", "work_at", "e2"), tuple("e3", "meet", "e1"));

        KnowledgeGraph graph = result.graph();
        assertThat(graph.nodes()).hasSize(3);
        assertThat(graph.edges()).hasSize(2).allSatisfy(edge -> assertThat(edge.weight()).isEqualTo(1));
        assertThat(graph.edge("e1", "e2")).isPresent();
        assertThat(graph.edge("e1", "e3")).isPresent();

        assertThat(result.keywords()).extracting(Keyword::term)
                .contains("works", "yesterday")
                .doesNotContain("alice", "acme");
        assertThat(result.metrics().sentenceCount()).isEqualTo(2);
        assertThat(result.partialSuccess()).isFalse();
    }

    @Test
    @DisplayName("Should produce no edges when sentences carry no relations")
    void shouldProduceNoEdgesWhenSentencesCarryNoRelations() {
        AnalysisResult result = pipeline(people(), verbs()).analyze("Alice. Bob. Acme.");

        assertThat(result.entities()).hasSize(3);
        assertThat(result.relations()).isEmpty();
        assertThat(result.graph().edges()).isEmpty();
        assertThat(result.partialSuccess()).isFalse();
    }

    @Test
    @DisplayName("Should produce identical results for identical input")
    void shouldProduceIdenticalResultsForIdenticalInput() {
        KnowledgeGraphPipeline pipeline = pipeline(people(), verbs());

        assertThat(pipeline.analyze(SCENARIO)).isEqualTo(pipeline.analyze(SCENARIO));
    }

    @Test
    @DisplayName("Should keep every graph reference resolvable")
    void shouldKeepEveryGraphReferenceResolvable() {
        AnalysisResult result = pipeline(people(), verbs()).analyze(SCENARIO);

        Set<String> entityIds = result.entities().stream().map(CanonicalEntity::id)
                .collect(Collectors.toSet());
        assertThat(result.relations()).allSatisfy(triple -> {
            assertThat(entityIds).contains(triple.subjectId(), triple.objectId());
            assertThat(triple.subjectId()).isNotEqualTo(triple.objectId());
        });
        assertThat(result.graph().nodes()).extracting(GraphNode::id).allMatch(entityIds::contains);
        for (GraphEdge edge : result.graph().edges()) {
            assertThat(result.graph().node(edge.source())).isPresent();
            assertThat(result.graph().node(edge.target())).isPresent();
        }
    }

    @Test
    @DisplayName("Should lemmatize predicates when the parser reports no lemma")
    void shouldLemmatizePredicatesWhenTheParserReportsNoLemma() {
        NerTagger companies = new DictionaryNerTagger()
                .with("Acme", EntityType.ORGANIZATION)
                .with("Beta", EntityType.ORGANIZATION);

        AnalysisResult result = pipeline(companies, new PatternDependencyParser("acquired"))
                .analyze("Acme acquired Beta.");

        assertThat(result.relations()).extracting(RelationTriple::predicate).containsExactly("acquire");
        assertThat(result.graph().edges()).singleElement()
                .satisfies(edge -> assertThat(edge.predicates()).containsExactly("acquire"));
    }

    @Test
    @DisplayName("Should drop parser candidates without a verb instead of failing the run")
    void shouldDropParserCandidatesWithoutAVerb() {
        NerTagger companies = new DictionaryNerTagger()
                .with("Acme", EntityType.ORGANIZATION)
                .with("Beta", EntityType.ORGANIZATION);
        DependencyParser verbless = sentence -> List.of(
                ClauseCandidate.direct(new TextSpan(0, 4), null, null, new TextSpan(14, 18)));

        AnalysisResult result = pipeline(companies, verbless).analyze("Acme acquired Beta.");

        assertThat(result.relations()).isEmpty();
        assertThat(result.entities()).hasSize(2);
        assertThat(result.partialSuccess()).isFalse();
    }

    @Test
    @DisplayName("Should reject empty input")
    void shouldRejectEmptyInput() {
        KnowledgeGraphPipeline pipeline = pipeline(people(), verbs());

        assertThatThrownBy(() -> pipeline.analyze("   \n  "))
                .isInstanceOf(EmptyInputException.class);
    }

    @Test
    @DisplayName("Should degrade relations when the parser fails")
    void shouldDegradeRelationsWhenTheParserFails() {
        DependencyParser broken = sentence -> {
            throw new IllegalStateException("parser unavailable");
        };

        AnalysisResult result = pipeline(people(), broken).analyze(SCENARIO);

        assertThat(result.partialSuccess()).isTrue();
        assertThat(result.degradedStages()).containsExactly(PipelineStage.RELATIONS);
        assertThat(result.entities()).hasSize(3);
        assertThat(result.relations()).isEmpty();
        assertThat(result.keywords()).isNotEmpty();
        // only Alice is mentioned often enough to stand alone
        assertThat(result.graph().nodes()).extracting(GraphNode::label).containsExactly("Alice");
    }

    @Test
    @DisplayName("Should degrade entities and everything downstream when the tagger fails")
    void shouldDegradeEntitiesWhenTheTaggerFails() {
        NerTagger broken = text -> {
            throw new IllegalStateException("models missing");
        };

        AnalysisResult result = pipeline(broken, verbs()).analyze(SCENARIO);

        assertThat(result.degradedStages()).containsExactly(PipelineStage.ENTITIES);
        assertThat(result.entities()).isEmpty();
        assertThat(result.relations()).isEmpty();
        assertThat(result.graph().nodes()).isEmpty();
        assertThat(result.keywords()).extracting(Keyword::term).contains("alice");
    }

    @Test
    @DisplayName("Should mark metrics degraded when a scorer fails")
    void shouldMarkMetricsDegradedWhenAScorerFails() {
        SentimentScorer broken = text -> {
            throw new IllegalStateException("lexicon gone");
        };
        KnowledgeGraphPipeline pipeline = new KnowledgeGraphPipeline(
                new TextNormalizer(),
                new EntityExtractor(people(), config),
                new KeywordScorer(config, stopWords),
                new RelationExtractor(verbs(), new PredicateNormalizer()),
                new GraphBuilder(config),
                new TextMetricsService(broken, new LexiconSubjectivityScorer(config), new FleschReadabilityScorer()),
                new AnalysisAggregator());

        AnalysisResult result = pipeline.analyze(SCENARIO);

        assertThat(result.degradedStages()).containsExactly(PipelineStage.METRICS);
        assertThat(result.metrics().sentiment()).isNull();
        assertThat(result.metrics().readability()).isNotNull();
        assertThat(result.graph().edges()).hasSize(2);
    }

    @Test
    @DisplayName("Should degrade keywords and keep the graph when keyword scoring fails")
    void shouldDegradeKeywordsWhenKeywordScoringFails() {
        KeywordScorer failing = new KeywordScorer(config, stopWords) {
            @Override
            public List<Keyword> score(NormalizedText text, Collection<CanonicalEntity> entities) {
                throw new ExtractionFailureException(PipelineStage.KEYWORDS, "term statistics unavailable",
                        new IllegalStateException("empty vocabulary"));
            }
        };
        KnowledgeGraphPipeline pipeline = new KnowledgeGraphPipeline(
                new TextNormalizer(),
                new EntityExtractor(people(), config),
                failing,
                new RelationExtractor(verbs(), new PredicateNormalizer()),
                new GraphBuilder(config),
                metrics(),
                new AnalysisAggregator());

        AnalysisResult result = pipeline.analyze(SCENARIO);

        assertThat(result.degradedStages()).containsExactly(PipelineStage.KEYWORDS);
        assertThat(result.keywords()).isEmpty();
        assertThat(result.graph().edges()).hasSize(2);
    }

    @Test
    @DisplayName("Should fail the run on an inconsistent graph")
    void shouldFailTheRunOnAnInconsistentGraph() {
        GraphBuilder rogue = new GraphBuilder(config) {
            @Override
            public KnowledgeGraph build(List<CanonicalEntity> entities, List<RelationTriple> triples) {
                GraphNode ghost = new GraphNode("e99", "Ghost", EntityType.PERSON, 1, 0, 0.0);
                return new KnowledgeGraph(false, List.of(ghost), List.of(),
                        new GraphStatistics(1, 0, 0.0, 0.0, 1, 1, false));
            }
        };
        KnowledgeGraphPipeline pipeline = new KnowledgeGraphPipeline(
                new TextNormalizer(),
                new EntityExtractor(people(), config),
                new KeywordScorer(config, stopWords),
                new RelationExtractor(verbs(), new PredicateNormalizer()),
                rogue,
                metrics(),
                new AnalysisAggregator());

        assertThatThrownBy(() -> pipeline.analyze(SCENARIO))
                .isInstanceOf(ConsistencyException.class)
                .hasMessageContaining("e99");
    }

    private KnowledgeGraphPipeline pipeline(NerTagger tagger, DependencyParser parser) {
        return new KnowledgeGraphPipeline(
                new TextNormalizer(),
                new EntityExtractor(tagger, config),
                new KeywordScorer(config, stopWords),
                new RelationExtractor(parser, new PredicateNormalizer()),
                new GraphBuilder(config),
                metrics(),
                new AnalysisAggregator());
    }

    private TextMetricsService metrics() {
        return new TextMetricsService(new LexiconSentimentScorer(config), new LexiconSubjectivityScorer(config),
                new FleschReadabilityScorer());
    }

    private NerTagger people() {
        return new DictionaryNerTagger()
                .with("Alice", EntityType.PERSON)
                .with("Bob", EntityType.PERSON)
                .with("Acme", EntityType.ORGANIZATION);
    }

    private DependencyParser verbs() {
        return new PatternDependencyParser("works", "met");
    }
}
