package io.docgraph.processing.config;

public record KeywordConfig(
        int topN,
        int minTokenLength,
        boolean excludeEntityTerms
) {}
