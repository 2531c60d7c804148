package io.docgraph.processing.dto.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.docgraph.processing.dto.graph.KnowledgeGraph;
import io.docgraph.processing.dto.nlp.CanonicalEntity;
import io.docgraph.processing.dto.nlp.EntityMention;
import io.docgraph.processing.dto.nlp.Keyword;
import io.docgraph.processing.dto.nlp.RelationTriple;
import io.docgraph.processing.dto.text.NormalizedText;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Everything one pipeline run produced for a single document. Immutable; downstream layers only read it.
 */
public record AnalysisResult(
        @JsonProperty("text") NormalizedText text,
        @JsonProperty("entities") List<CanonicalEntity> entities,
        @JsonProperty("mentions") List<EntityMention> mentions,
        @JsonProperty("keywords") List<Keyword> keywords,
        @JsonProperty("relations") List<RelationTriple> relations,
        @JsonProperty("graph") KnowledgeGraph graph,
        @JsonProperty("metrics") DocumentMetrics metrics,
        @JsonProperty("degradedStages") Set<PipelineStage> degradedStages
) {
    public AnalysisResult {
        entities = List.copyOf(entities);
        mentions = List.copyOf(mentions);
        keywords = List.copyOf(keywords);
        relations = List.copyOf(relations);
        degradedStages = degradedStages.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(degradedStages));
    }

    @JsonProperty("partialSuccess")
    public boolean partialSuccess() {
        return !degradedStages.isEmpty();
    }
}
