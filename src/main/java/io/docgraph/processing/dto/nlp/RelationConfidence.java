package io.docgraph.processing.dto.nlp;

public enum RelationConfidence {
    /** Subject and object both attach directly to the verb. */
    HIGH,
    /** A participant is reached through a longer chain, e.g. a preposition. */
    LOW
}
