package io.docgraph.processing.exception;

/**
 * Base type for every failure surfaced by the analysis pipeline.
 */
public abstract class KnowledgeGraphException extends RuntimeException {

    protected KnowledgeGraphException(String message) {
        super(message);
    }

    protected KnowledgeGraphException(String message, Throwable cause) {
        super(message, cause);
    }
}
