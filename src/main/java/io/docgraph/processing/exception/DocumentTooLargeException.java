package io.docgraph.processing.exception;

public class DocumentTooLargeException extends KnowledgeGraphException {

    private final int length;
    private final int maxLength;

    public DocumentTooLargeException(int length, int maxLength) {
        super("Document text has " + length + " characters, limit is " + maxLength);
        this.length = length;
        this.maxLength = maxLength;
    }

    public int getLength() {
        return length;
    }

    public int getMaxLength() {
        return maxLength;
    }
}
