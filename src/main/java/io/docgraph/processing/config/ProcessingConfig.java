package io.docgraph.processing.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "processing")
public record ProcessingConfig(
        NlpConfig nlp,
        KeywordConfig keywords,
        GraphConfig graph,
        PerformanceConfig performance
) {}
