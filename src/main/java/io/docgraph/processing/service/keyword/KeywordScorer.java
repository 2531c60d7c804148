package io.docgraph.processing.service.keyword;

import io.docgraph.processing.config.KeywordConfig;
import io.docgraph.processing.config.ProcessingConfig;
import io.docgraph.processing.dto.nlp.CanonicalEntity;
import io.docgraph.processing.dto.nlp.Keyword;
import io.docgraph.processing.dto.text.NormalizedText;
import io.docgraph.processing.service.nlp.EntityMerger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * TF-IDF keyword ranking with the document's own sentences as the corpus.
 * <p>
 * score = (count / total tokens) * (ln((1 + sentences) / (1 + sentences containing the term)) + 1)
 */
@Service
public class KeywordScorer {

    private static final Logger logger = LoggerFactory.getLogger(KeywordScorer.class);

    private static final Pattern TOKEN = Pattern.compile("[\\p{L}\\p{N}]+(?:['’]\\p{L}+)?");

    private final KeywordConfig settings;
    private final StopWords stopWords;

    public KeywordScorer(ProcessingConfig config, StopWords stopWords) {
        this.settings = config.keywords();
        this.stopWords = stopWords;
    }

    public List<Keyword> score(NormalizedText text, Collection<CanonicalEntity> entities) {
        Set<String> excluded = settings.excludeEntityTerms() ? entityTerms(entities) : Set.of();

        Map<String, Integer> frequencies = new HashMap<>();
        Map<String, Integer> sentenceFrequencies = new HashMap<>();
        int totalTokens = 0;

        for (String sentence : text.sentenceTexts()) {
            Set<String> seenInSentence = new HashSet<>();
            for (String token : tokenize(sentence)) {
                if (!isCandidate(token, excluded)) {
                    continue;
                }
                totalTokens++;
                frequencies.merge(token, 1, Integer::sum);
                if (seenInSentence.add(token)) {
                    sentenceFrequencies.merge(token, 1, Integer::sum);
                }
            }
        }

        if (totalTokens == 0) {
            logger.debug("No keyword candidates in {} sentences", text.sentenceCount());
            return List.of();
        }

        int sentenceCount = Math.max(1, text.sentenceCount());
        List<Keyword> keywords = new ArrayList<>(frequencies.size());
        for (Map.Entry<String, Integer> entry : frequencies.entrySet()) {
            int documentFrequency = sentenceFrequencies.get(entry.getKey());
            double tf = (double) entry.getValue() / totalTokens;
            double idf = Math.log((1.0 + sentenceCount) / (1.0 + documentFrequency)) + 1.0;
            keywords.add(new Keyword(entry.getKey(), tf * idf, entry.getValue(), documentFrequency));
        }

        keywords.sort(Keyword.RANKING);
        List<Keyword> top = keywords.size() > settings.topN() ? keywords.subList(0, settings.topN()) : keywords;

        logger.debug("Scored {} keyword candidates from {} tokens, keeping {}",
                keywords.size(), totalTokens, top.size());
        return List.copyOf(top);
    }

    List<String> tokenize(String sentence) {
        List<String> tokens = new ArrayList<>();
        Matcher matcher = TOKEN.matcher(sentence.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            tokens.add(matcher.group());
        }
        return tokens;
    }

    private boolean isCandidate(String token, Set<String> excluded) {
        return token.length() >= settings.minTokenLength()
                && token.chars().anyMatch(Character::isLetter)
                && !stopWords.contains(token)
                && !excluded.contains(token);
    }

    private Set<String> entityTerms(Collection<CanonicalEntity> entities) {
        Set<String> terms = new HashSet<>();
        for (CanonicalEntity entity : entities) {
            for (String surface : entity.surfaceForms()) {
                for (String token : tokenize(EntityMerger.normalize(surface))) {
                    terms.add(token);
                }
            }
        }
        return terms;
    }
}
