package io.docgraph.processing.exception;

/**
 * The cleaned text has no non-whitespace characters. Terminal for the run.
 */
public class EmptyInputException extends KnowledgeGraphException {

    public EmptyInputException() {
        super("Document contains no usable text");
    }
}
