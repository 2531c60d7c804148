package io.docgraph.processing.api;

import io.docgraph.processing.exception.ConsistencyException;
import io.docgraph.processing.exception.DocumentTooLargeException;
import io.docgraph.processing.exception.EmptyInputException;
import io.docgraph.processing.exception.KnowledgeGraphException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps pipeline failures to HTTP statuses with a {@code {error, message}} body.
 */
@RestControllerAdvice
public class AnalysisExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(AnalysisExceptionHandler.class);

    @ExceptionHandler(EmptyInputException.class)
    public ResponseEntity<Map<String, Object>> handleEmptyInput(EmptyInputException e) {
        return error(HttpStatus.BAD_REQUEST, "EMPTY_INPUT", e.getMessage());
    }

    @ExceptionHandler(DocumentTooLargeException.class)
    public ResponseEntity<Map<String, Object>> handleTooLarge(DocumentTooLargeException e) {
        return error(HttpStatus.PAYLOAD_TOO_LARGE, "DOCUMENT_TOO_LARGE", e.getMessage());
    }

    @ExceptionHandler(ConsistencyException.class)
    public ResponseEntity<Map<String, Object>> handleConsistency(ConsistencyException e) {
        logger.error("Analysis produced an inconsistent result: {}", e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "CONSISTENCY_ERROR", e.getMessage());
    }

    @ExceptionHandler(KnowledgeGraphException.class)
    public ResponseEntity<Map<String, Object>> handleOther(KnowledgeGraphException e) {
        logger.error("Analysis failed: {}", e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "ANALYSIS_FAILED", e.getMessage());
    }

    private ResponseEntity<Map<String, Object>> error(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status).body(Map.of(
                "error", error,
                "message", message == null ? "" : message
        ));
    }
}
