package io.docgraph.processing.exception;

/**
 * An internal invariant was violated, e.g. an edge references an unknown entity id.
 * Indicates a bug upstream and is never recovered from.
 */
public class ConsistencyException extends KnowledgeGraphException {

    public ConsistencyException(String message) {
        super(message);
    }
}
