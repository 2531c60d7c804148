package io.docgraph.processing.service.nlp;

import io.docgraph.processing.dto.nlp.ClauseCandidate;

import java.util.List;

/**
 * Dependency-parse collaborator. Returns subject-verb-object candidates for a single sentence,
 * with spans relative to that sentence.
 */
public interface DependencyParser {

    List<ClauseCandidate> parse(String sentence);
}
