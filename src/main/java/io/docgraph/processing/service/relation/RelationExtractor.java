package io.docgraph.processing.service.relation;

import io.docgraph.processing.dto.analysis.PipelineStage;
import io.docgraph.processing.dto.nlp.ClauseCandidate;
import io.docgraph.processing.dto.nlp.EntityExtractionResult;
import io.docgraph.processing.dto.nlp.RelationConfidence;
import io.docgraph.processing.dto.nlp.RelationExtractionResult;
import io.docgraph.processing.dto.nlp.RelationTriple;
import io.docgraph.processing.dto.text.NormalizedText;
import io.docgraph.processing.dto.text.TextSpan;
import io.docgraph.processing.exception.ExtractionFailureException;
import io.docgraph.processing.service.nlp.DependencyParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Emits subject-predicate-object triples between known entities, one sentence at a time.
 * Candidates whose subject or object overlaps no entity mention are discarded, and so are
 * candidates whose subject and object resolve to the same entity.
 */
@Service
public class RelationExtractor {

    private static final Logger logger = LoggerFactory.getLogger(RelationExtractor.class);

    private final DependencyParser parser;
    private final PredicateNormalizer predicateNormalizer;

    public RelationExtractor(DependencyParser parser, PredicateNormalizer predicateNormalizer) {
        this.parser = parser;
        this.predicateNormalizer = predicateNormalizer;
    }

    public RelationExtractionResult extract(NormalizedText text, EntityExtractionResult entities) {
        if (entities.entities().size() < 2) {
            logger.debug("Fewer than two entities, skipping relation extraction");
            return RelationExtractionResult.empty();
        }

        MentionIndex index = new MentionIndex(entities.mentions(), entities.mentionEntityIds());
        Set<RelationTriple> triples = new LinkedHashSet<>();
        int candidates = 0;
        int unresolved = 0;
        int selfLoops = 0;

        for (TextSpan sentenceSpan : text.sentences()) {
            for (ClauseCandidate candidate : parseSentence(text.slice(sentenceSpan))) {
                candidates++;
                if (!isUsable(candidate)) {
                    unresolved++;
                    continue;
                }

                Optional<String> subject = resolve(index, candidate.subjectSpan(), sentenceSpan);
                Optional<String> object = resolve(index, candidate.objectSpan(), sentenceSpan);
                if (subject.isEmpty() || object.isEmpty()) {
                    unresolved++;
                    continue;
                }
                if (subject.get().equals(object.get())) {
                    selfLoops++;
                    continue;
                }

                triples.add(new RelationTriple(
                        subject.get(),
                        predicateNormalizer.normalize(candidate),
                        object.get(),
                        sentenceSpan,
                        candidate.isDirect() ? RelationConfidence.HIGH : RelationConfidence.LOW
                ));
            }
        }

        logger.debug("Extracted {} relation triples from {} candidates ({} unresolved, {} self-loops dropped)",
                triples.size(), candidates, unresolved, selfLoops);

        return new RelationExtractionResult(new ArrayList<>(triples), candidates, unresolved, selfLoops);
    }

    private List<ClauseCandidate> parseSentence(String sentence) {
        try {
            List<ClauseCandidate> candidates = parser.parse(sentence);
            return candidates == null ? List.of() : candidates;
        } catch (RuntimeException e) {
            throw new ExtractionFailureException(PipelineStage.RELATIONS,
                    "Dependency parse failed: " + e.getMessage(), e);
        }
    }

    /**
     * Parser output is not trusted: candidates without a verb cannot become a predicate.
     */
    private boolean isUsable(ClauseCandidate candidate) {
        return candidate != null && candidate.verb() != null && !candidate.verb().isBlank();
    }

    private Optional<String> resolve(MentionIndex index, TextSpan relativeSpan, TextSpan sentenceSpan) {
        if (relativeSpan == null || relativeSpan.end() > sentenceSpan.length()) {
            return Optional.empty();
        }
        return index.resolve(relativeSpan.shift(sentenceSpan.begin()));
    }
}
