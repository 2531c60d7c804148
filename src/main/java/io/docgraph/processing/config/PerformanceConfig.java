package io.docgraph.processing.config;

public record PerformanceConfig(
        int threadPoolSize,
        int queueCapacity,
        int maxTextLength
) {}
