package io.docgraph.processing.exception;

import io.docgraph.processing.dto.analysis.PipelineStage;

/**
 * A collaborator call failed inside one pipeline stage. The pipeline degrades that
 * stage's output to empty instead of aborting the run.
 */
public class ExtractionFailureException extends KnowledgeGraphException {

    private final PipelineStage stage;

    public ExtractionFailureException(PipelineStage stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    public PipelineStage getStage() {
        return stage;
    }
}
