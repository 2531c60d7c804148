package io.docgraph.processing.api;

import io.docgraph.processing.service.keyword.StopWords;
import io.docgraph.processing.service.nlp.CoreNlpPipelineProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/processing")
public class HealthController {

    @Value("${spring.application.name}")
    private String serviceName;

    private final CoreNlpPipelineProvider pipelineProvider;
    private final StopWords stopWords;

    public HealthController(CoreNlpPipelineProvider pipelineProvider, StopWords stopWords) {
        this.pipelineProvider = pipelineProvider;
        this.stopWords = stopWords;
    }

    // Models load on first use, so "not loaded yet" is still healthy
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        boolean resourcesReady = stopWords.size() > 0;

        var healthInfo = Map.of(
                "status", resourcesReady ? "UP" : "DOWN",
                "service", serviceName,
                "timestamp", LocalDateTime.now(),
                "version", "1.0.0",
                "processing", Map.of(
                        "nlpModelsLoaded", pipelineProvider.isReady(),
                        "stopWords", stopWords.size()
                )
        );

        return resourcesReady ?
                ResponseEntity.ok(healthInfo) :
                ResponseEntity.status(503).body(healthInfo);
    }
}
