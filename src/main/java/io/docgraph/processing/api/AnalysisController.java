package io.docgraph.processing.api;

import io.docgraph.processing.config.ProcessingConfig;
import io.docgraph.processing.dto.analysis.AnalysisResult;
import io.docgraph.processing.service.AnalysisService;
import io.docgraph.processing.service.nlp.CoreNlpPipelineProvider;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/analysis")
public class AnalysisController {

    private final AnalysisService analysisService;
    private final CoreNlpPipelineProvider pipelineProvider;
    private final ProcessingConfig config;

    public AnalysisController(AnalysisService analysisService,
                              CoreNlpPipelineProvider pipelineProvider,
                              ProcessingConfig config) {
        this.analysisService = analysisService;
        this.pipelineProvider = pipelineProvider;
        this.config = config;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<AnalysisResult> analyze(@RequestBody Map<String, String> request) {
        AnalysisResult result = analysisService.analyze(request.get("text"));
        return ResponseEntity.ok(result);
    }

    @PostMapping(value = "/document",
            consumes = {MediaType.APPLICATION_OCTET_STREAM_VALUE, MediaType.TEXT_PLAIN_VALUE})
    public ResponseEntity<AnalysisResult> analyzeDocument(@RequestBody byte[] document) {
        return ResponseEntity.ok(analysisService.analyzeDocument(document));
    }

    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status() {
        var entities = config.nlp().entities();

        return ResponseEntity.ok(Map.of(
                "nlpModelsLoaded", pipelineProvider.isReady(),
                "service", "Stanford CoreNLP",
                "configuration", Map.of(
                        "acronymMatching", entities.acronymMatching(),
                        "partialNameMatching", entities.partialNameMatching(),
                        "aliases", entities.aliases().size(),
                        "prepositionalObjects", config.nlp().relations().includePrepositionalObjects(),
                        "keywordTopN", config.keywords().topN(),
                        "directedGraph", config.graph().directed(),
                        "maxTextLength", config.performance().maxTextLength()
                )
        ));
    }
}
