package io.docgraph.processing.service.relation;

import edu.stanford.nlp.process.Morphology;
import io.docgraph.processing.dto.nlp.ClauseCandidate;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Turns a clause's verb into a predicate label: auxiliaries and modals removed, verb lemmatized,
 * lower-cased, and the preposition appended for indirect objects ("works at" -> "work_at").
 */
@Component
public class PredicateNormalizer {

    private static final Set<String> AUXILIARIES = Set.of(
            "be", "am", "is", "are", "was", "were", "been", "being",
            "have", "has", "had", "having", "do", "does", "did",
            "will", "would", "shall", "should", "can", "could", "may", "might", "must",
            "'s", "'ve", "'ll", "'d", "'re"
    );

    public String normalize(ClauseCandidate candidate) {
        String lemma = verbLemma(candidate);
        if (candidate.isDirect() || candidate.preposition().isBlank()) {
            return lemma;
        }
        String preposition = candidate.preposition().trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", "_");
        return lemma + "_" + preposition;
    }

    private String verbLemma(ClauseCandidate candidate) {
        List<String> tokens = Arrays.asList(candidate.verb().trim().toLowerCase(Locale.ROOT).split("\\s+"));
        boolean phrase = tokens.size() > 1;

        if (!phrase && candidate.verbLemma() != null && !candidate.verbLemma().isBlank()) {
            return candidate.verbLemma().trim().toLowerCase(Locale.ROOT);
        }

        List<String> content = tokens.stream().filter(token -> !AUXILIARIES.contains(token)).toList();
        String head = content.isEmpty() ? tokens.get(tokens.size() - 1) : content.get(content.size() - 1);
        return lemmatize(head);
    }

    /**
     * Lemma for parsers that report none. The POS tag is guessed from the inflection, which is all
     * CoreNLP's finite-state morphology needs; no model is loaded.
     */
    String lemmatize(String verb) {
        return Morphology.lemmaStatic(verb, verbTag(verb), true);
    }

    private String verbTag(String verb) {
        if (verb.endsWith("ing")) {
            return "VBG";
        }
        if (verb.endsWith("ed")) {
            return "VBD";
        }
        if (verb.endsWith("s") && !verb.endsWith("ss")) {
            return "VBZ";
        }
        return "VBD";
    }
}
