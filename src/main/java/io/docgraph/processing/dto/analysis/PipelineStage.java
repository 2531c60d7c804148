package io.docgraph.processing.dto.analysis;

public enum PipelineStage {
    ENTITIES,
    KEYWORDS,
    RELATIONS,
    METRICS
}
