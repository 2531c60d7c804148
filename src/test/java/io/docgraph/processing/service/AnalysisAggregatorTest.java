package io.docgraph.processing.service;

import io.docgraph.processing.dto.analysis.AnalysisResult;
import io.docgraph.processing.dto.analysis.DocumentMetrics;
import io.docgraph.processing.dto.analysis.PipelineStage;
import io.docgraph.processing.dto.graph.GraphEdge;
import io.docgraph.processing.dto.graph.GraphNode;
import io.docgraph.processing.dto.graph.GraphStatistics;
import io.docgraph.processing.dto.graph.KnowledgeGraph;
import io.docgraph.processing.dto.nlp.CanonicalEntity;
import io.docgraph.processing.dto.nlp.EntityExtractionResult;
import io.docgraph.processing.dto.nlp.EntityMention;
import io.docgraph.processing.dto.nlp.EntityType;
import io.docgraph.processing.dto.nlp.RelationConfidence;
import io.docgraph.processing.dto.nlp.RelationTriple;
import io.docgraph.processing.dto.text.NormalizedText;
import io.docgraph.processing.dto.text.TextSpan;
import io.docgraph.processing.exception.ConsistencyException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class AnalysisAggregatorTest {

    private static final NormalizedText TEXT = new NormalizedText("Alice hired Bob.", List.of(new TextSpan(0, 16)));
    private static final DocumentMetrics METRICS = new DocumentMetrics(3, 16, 1, 4.67, 0.0, 0.0, 90.0);

    private final AnalysisAggregator aggregator = new AnalysisAggregator();

    private final CanonicalEntity alice = new CanonicalEntity("e1", "Alice", EntityType.PERSON,
            List.of(new TextSpan(0, 5)), Set.of("Alice"));
    private final CanonicalEntity bob = new CanonicalEntity("e2", "Bob", EntityType.PERSON,
            List.of(new TextSpan(12, 15)), Set.of("Bob"));
    private final EntityExtractionResult entities = new EntityExtractionResult(
            List.of(alice, bob),
            List.of(new EntityMention("Alice", new TextSpan(0, 5), EntityType.PERSON),
                    new EntityMention("Bob", new TextSpan(12, 15), EntityType.PERSON)),
            List.of("e1", "e2"),
            List.of(),
            1);

    @Test
    @DisplayName("Should package consistent stage outputs")
    void shouldPackageConsistentStageOutputs() {
        List<RelationTriple> triples = List.of(hire("e1", "e2"));

        AnalysisResult result = aggregator.aggregate(TEXT, entities, List.of(), triples,
                graph(List.of("e1", "e2"), List.of(GraphEdge.of("e1", "e2", 1, Set.of("hire")))),
                METRICS, Set.of());

        assertThat(result.entities()).containsExactly(alice, bob);
        assertThat(result.mentions()).hasSize(2);
        assertThat(result.relations()).isEqualTo(triples);
        assertThat(result.partialSuccess()).isFalse();
    }

    @Test
    @DisplayName("Should flag partial success when a stage degraded")
    void shouldFlagPartialSuccessWhenAStageDegraded() {
        AnalysisResult result = aggregator.aggregate(TEXT, entities, List.of(), List.of(),
                KnowledgeGraph.empty(false), METRICS, Set.of(PipelineStage.RELATIONS));

        assertThat(result.partialSuccess()).isTrue();
        assertThat(result.degradedStages()).containsExactly(PipelineStage.RELATIONS);
    }

    @Test
    @DisplayName("Should reject relations that reference unknown entities")
    void shouldRejectRelationsThatReferenceUnknownEntities() {
        List<RelationTriple> triples = List.of(hire("e1", "e9"));

        assertThatThrownBy(() -> aggregator.aggregate(TEXT, entities, List.of(), triples,
                KnowledgeGraph.empty(false), METRICS, Set.of()))
                .isInstanceOf(ConsistencyException.class)
                .hasMessageContaining("e9");
    }

    @Test
    @DisplayName("Should reject graph nodes without an entity")
    void shouldRejectGraphNodesWithoutAnEntity() {
        assertThatThrownBy(() -> aggregator.aggregate(TEXT, entities, List.of(), List.of(),
                graph(List.of("e1", "e7"), List.of()), METRICS, Set.of()))
                .isInstanceOf(ConsistencyException.class)
                .hasMessageContaining("e7");
    }

    @Test
    @DisplayName("Should reject edges whose endpoints are not nodes")
    void shouldRejectEdgesWhoseEndpointsAreNotNodes() {
        KnowledgeGraph graph = graph(List.of("e1"), List.of(GraphEdge.of("e1", "e2", 1, Set.of("hire"))));

        assertThatThrownBy(() -> aggregator.aggregate(TEXT, entities, List.of(), List.of(hire("e1", "e2")),
                graph, METRICS, Set.of()))
                .isInstanceOf(ConsistencyException.class)
                .hasMessageContaining("outside the graph");
    }

    @Test
    @DisplayName("Should reject duplicate entity ids")
    void shouldRejectDuplicateEntityIds() {
        CanonicalEntity impostor = new CanonicalEntity("e1", "Carol", EntityType.PERSON,
                List.of(new TextSpan(6, 11)), Set.of("Carol"));
        EntityExtractionResult duplicated = new EntityExtractionResult(
                List.of(alice, impostor), List.of(), List.of(), List.of(), 0);

        assertThatThrownBy(() -> aggregator.aggregate(TEXT, duplicated, List.of(), List.of(),
                KnowledgeGraph.empty(false), METRICS, Set.of()))
                .isInstanceOf(ConsistencyException.class);
    }

    private static RelationTriple hire(String subject, String object) {
        return new RelationTriple(subject, "hire", object, new TextSpan(0, 16), RelationConfidence.HIGH);
    }

    private static KnowledgeGraph graph(List<String> nodeIds, List<GraphEdge> edges) {
        List<GraphNode> nodes = nodeIds.stream()
                .map(id -> new GraphNode(id, id, EntityType.PERSON, 1, 0, 0.0))
                .toList();
        return new KnowledgeGraph(false, nodes, edges,
                new GraphStatistics(nodes.size(), edges.size(), 0.0, 0.0, 1, 0, false));
    }
}
