package io.docgraph.processing.dto.nlp;

import io.docgraph.processing.dto.text.TextSpan;

/**
 * Subject-verb-object candidate reported by a dependency-parse collaborator for one sentence.
 * Spans are relative to the sentence text.
 *
 * @param verb        surface form of the governing verb, possibly with its auxiliaries ("has joined")
 * @param verbLemma   lemma when the parser supplies one, otherwise null
 * @param preposition preposition linking an indirect object, null for a direct object
 */
public record ClauseCandidate(
        TextSpan subjectSpan,
        String verb,
        String verbLemma,
        TextSpan objectSpan,
        String preposition
) {
    public static ClauseCandidate direct(TextSpan subjectSpan, String verb, String verbLemma, TextSpan objectSpan) {
        return new ClauseCandidate(subjectSpan, verb, verbLemma, objectSpan, null);
    }

    public static ClauseCandidate prepositional(TextSpan subjectSpan, String verb, String verbLemma,
                                                String preposition, TextSpan objectSpan) {
        return new ClauseCandidate(subjectSpan, verb, verbLemma, objectSpan, preposition);
    }

    public boolean isDirect() {
        return preposition == null;
    }
}
