package io.docgraph.processing.service.metrics;

import io.docgraph.processing.config.ProcessingConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

/**
 * Rule-based polarity: the mean lexicon score of the sentiment words found, where a word preceded
 * by a negator within two tokens counts at half strength with the opposite sign.
 */
@Component
public class LexiconSentimentScorer implements SentimentScorer {

    private static final Logger logger = LoggerFactory.getLogger(LexiconSentimentScorer.class);

    private static final Set<String> NEGATORS = Set.of("not", "no", "never", "none", "nobody", "nothing",
            "neither", "nor", "without", "isn't", "wasn't", "aren't", "don't", "doesn't", "didn't", "can't", "won't");
    private static final double NEGATION_FACTOR = -0.5;

    private final SentimentLexicon lexicon;

    public LexiconSentimentScorer(ProcessingConfig config) {
        this.lexicon = SentimentLexicon.load(config.nlp().sentiment().lexicon());
        logger.debug("Loaded sentiment lexicon with {} entries", lexicon.size());
    }

    @Override
    public double score(String text) {
        List<String> tokens = SentimentLexicon.tokenize(text);

        double total = 0.0;
        int matched = 0;
        for (int i = 0; i < tokens.size(); i++) {
            Double value = lexicon.polarity(tokens.get(i));
            if (value == null) {
                continue;
            }
            if (isNegated(tokens, i)) {
                value *= NEGATION_FACTOR;
            }
            total += value;
            matched++;
        }

        if (matched == 0) {
            return 0.0;
        }
        return Math.max(-1.0, Math.min(1.0, total / matched));
    }

    private boolean isNegated(List<String> tokens, int index) {
        for (int i = Math.max(0, index - 2); i < index; i++) {
            if (NEGATORS.contains(tokens.get(i))) {
                return true;
            }
        }
        return false;
    }
}
