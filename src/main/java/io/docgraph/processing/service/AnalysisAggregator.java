package io.docgraph.processing.service;

import io.docgraph.processing.dto.analysis.AnalysisResult;
import io.docgraph.processing.dto.analysis.DocumentMetrics;
import io.docgraph.processing.dto.analysis.PipelineStage;
import io.docgraph.processing.dto.graph.GraphEdge;
import io.docgraph.processing.dto.graph.GraphNode;
import io.docgraph.processing.dto.graph.KnowledgeGraph;
import io.docgraph.processing.dto.nlp.CanonicalEntity;
import io.docgraph.processing.dto.nlp.EntityExtractionResult;
import io.docgraph.processing.dto.nlp.Keyword;
import io.docgraph.processing.dto.nlp.RelationTriple;
import io.docgraph.processing.dto.text.NormalizedText;
import io.docgraph.processing.exception.ConsistencyException;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Packages stage outputs into one {@link AnalysisResult} after checking that every id
 * referenced by mentions, triples, nodes and edges exists.
 */
@Component
public class AnalysisAggregator {

    public AnalysisResult aggregate(NormalizedText text,
                                    EntityExtractionResult entities,
                                    List<Keyword> keywords,
                                    List<RelationTriple> relations,
                                    KnowledgeGraph graph,
                                    DocumentMetrics metrics,
                                    Set<PipelineStage> degradedStages) {

        Set<String> entityIds = new HashSet<>();
        for (CanonicalEntity entity : entities.entities()) {
            if (!entityIds.add(entity.id())) {
                throw new ConsistencyException("Duplicate entity id " + entity.id());
            }
        }

        for (String mentionEntityId : entities.mentionEntityIds()) {
            requireEntity(entityIds, mentionEntityId, "mention");
        }

        for (RelationTriple triple : relations) {
            requireEntity(entityIds, triple.subjectId(), "relation subject");
            requireEntity(entityIds, triple.objectId(), "relation object");
        }

        Set<String> nodeIds = new HashSet<>();
        for (GraphNode node : graph.nodes()) {
            requireEntity(entityIds, node.id(), "graph node");
            if (!nodeIds.add(node.id())) {
                throw new ConsistencyException("Duplicate graph node " + node.id());
            }
        }

        for (GraphEdge edge : graph.edges()) {
            if (!nodeIds.contains(edge.source()) || !nodeIds.contains(edge.target())) {
                throw new ConsistencyException("Edge " + edge.source() + " -> " + edge.target()
                        + " references a node outside the graph");
            }
            if (edge.source().equals(edge.target())) {
                throw new ConsistencyException("Self-loop edge on " + edge.source());
            }
        }

        return new AnalysisResult(
                text,
                entities.entities(),
                entities.mentions(),
                keywords,
                relations,
                graph,
                metrics,
                degradedStages
        );
    }

    private void requireEntity(Set<String> entityIds, String id, String referrer) {
        if (!entityIds.contains(id)) {
            throw new ConsistencyException("Unknown entity id '" + id + "' referenced by " + referrer);
        }
    }
}
