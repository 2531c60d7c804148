package io.docgraph.processing.config;

public record GraphConfig(
        boolean directed,
        int isolatedNodeMinMentions,
        int maxNodes,
        int maxEdges
) {}
