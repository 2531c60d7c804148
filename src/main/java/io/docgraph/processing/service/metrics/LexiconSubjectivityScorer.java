package io.docgraph.processing.service.metrics;

import io.docgraph.processing.config.ProcessingConfig;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Share of the document's words that carry sentiment in the lexicon.
 */
@Component
public class LexiconSubjectivityScorer implements SubjectivityScorer {

    private final SentimentLexicon lexicon;

    public LexiconSubjectivityScorer(ProcessingConfig config) {
        this.lexicon = SentimentLexicon.load(config.nlp().sentiment().lexicon());
    }

    @Override
    public double score(String text) {
        List<String> tokens = SentimentLexicon.tokenize(text);
        if (tokens.isEmpty()) {
            return 0.0;
        }
        long opinionated = tokens.stream().filter(token -> lexicon.polarity(token) != null).count();
        return (double) opinionated / tokens.size();
    }
}
