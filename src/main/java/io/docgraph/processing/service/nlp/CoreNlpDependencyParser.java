package io.docgraph.processing.service.nlp;

import edu.stanford.nlp.ling.IndexedWord;
import edu.stanford.nlp.pipeline.CoreDocument;
import edu.stanford.nlp.pipeline.CoreSentence;
import edu.stanford.nlp.semgraph.SemanticGraph;
import edu.stanford.nlp.semgraph.SemanticGraphEdge;
import io.docgraph.processing.config.ProcessingConfig;
import io.docgraph.processing.dto.nlp.ClauseCandidate;
import io.docgraph.processing.dto.text.TextSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Reads subject-verb-object candidates off the CoreNLP universal dependency graph.
 */
@Component
public class CoreNlpDependencyParser implements DependencyParser {

    private static final Logger logger = LoggerFactory.getLogger(CoreNlpDependencyParser.class);

    private static final Set<String> SUBJECT_RELATIONS = Set.of("nsubj");
    private static final Set<String> DIRECT_OBJECT_RELATIONS = Set.of("obj", "dobj");
    private static final Set<String> OBLIQUE_RELATIONS = Set.of("obl", "nmod");
    private static final Set<String> NAME_PART_RELATIONS = Set.of("compound", "flat", "name");

    private final CoreNlpPipelineProvider pipelineProvider;
    private final boolean includePrepositionalObjects;

    public CoreNlpDependencyParser(CoreNlpPipelineProvider pipelineProvider, ProcessingConfig config) {
        this.pipelineProvider = pipelineProvider;
        this.includePrepositionalObjects = config.nlp().relations().includePrepositionalObjects();
    }

    @Override
    public List<ClauseCandidate> parse(String sentence) {
        CoreDocument document = new CoreDocument(sentence);
        pipelineProvider.parsePipeline().annotate(document);

        List<ClauseCandidate> candidates = new ArrayList<>();
        for (CoreSentence coreSentence : document.sentences()) {
            SemanticGraph graph = coreSentence.dependencyParse();
            if (graph != null) {
                candidates.addAll(clauses(graph));
            }
        }

        logger.debug("Parsed {} clause candidates from sentence of {} characters", candidates.size(), sentence.length());
        return candidates;
    }

    /**
     * Clause candidates for every verb of one dependency graph, in word order.
     */
    List<ClauseCandidate> clauses(SemanticGraph graph) {
        List<ClauseCandidate> candidates = new ArrayList<>();
        for (IndexedWord verb : graph.vertexListSorted()) {
            if (verb.tag() != null && verb.tag().startsWith("VB")) {
                collectClauses(graph, verb, candidates);
            }
        }
        return candidates;
    }

    private void collectClauses(SemanticGraph graph, IndexedWord verb, List<ClauseCandidate> candidates) {
        List<IndexedWord> subjects = new ArrayList<>();
        List<IndexedWord> directObjects = new ArrayList<>();
        List<SemanticGraphEdge> obliques = new ArrayList<>();

        for (SemanticGraphEdge edge : graph.outgoingEdgeIterable(verb)) {
            String relation = edge.getRelation().getShortName();
            if (SUBJECT_RELATIONS.contains(relation)) {
                subjects.add(edge.getDependent());
            } else if (DIRECT_OBJECT_RELATIONS.contains(relation)) {
                directObjects.add(edge.getDependent());
            } else if (OBLIQUE_RELATIONS.contains(relation)) {
                obliques.add(edge);
            }
        }

        for (IndexedWord subject : subjects) {
            TextSpan subjectSpan = phraseSpan(graph, subject);
            for (IndexedWord object : directObjects) {
                candidates.add(ClauseCandidate.direct(subjectSpan, verb.word(), verb.lemma(),
                        phraseSpan(graph, object)));
            }
            if (!includePrepositionalObjects) {
                continue;
            }
            for (SemanticGraphEdge oblique : obliques) {
                String preposition = preposition(graph, oblique);
                if (preposition == null) {
                    continue; // temporal or bare nominal modifier, e.g. "yesterday"
                }
                candidates.add(ClauseCandidate.prepositional(subjectSpan, verb.word(), verb.lemma(),
                        preposition, phraseSpan(graph, oblique.getDependent())));
            }
        }
    }

    private String preposition(SemanticGraph graph, SemanticGraphEdge oblique) {
        String specific = oblique.getRelation().getSpecific();
        if (specific != null && !specific.isBlank() && !"tmod".equals(specific) && !"npmod".equals(specific)) {
            return specific.replace('_', ' ');
        }
        for (SemanticGraphEdge edge : graph.outgoingEdgeIterable(oblique.getDependent())) {
            if ("case".equals(edge.getRelation().getShortName())) {
                return edge.getDependent().word();
            }
        }
        return null;
    }

    /**
     * Head word widened to its compound and flat name parts, e.g. "Gates" -> "Bill Gates".
     */
    private TextSpan phraseSpan(SemanticGraph graph, IndexedWord head) {
        int begin = head.beginPosition();
        int end = head.endPosition();
        for (SemanticGraphEdge edge : graph.outgoingEdgeIterable(head)) {
            if (NAME_PART_RELATIONS.contains(edge.getRelation().getShortName())) {
                begin = Math.min(begin, edge.getDependent().beginPosition());
                end = Math.max(end, edge.getDependent().endPosition());
            }
        }
        return new TextSpan(begin, end);
    }
}
