package io.docgraph.processing.service.metrics;

import io.docgraph.processing.dto.text.NormalizedText;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Flesch reading ease: 206.835 - 1.015 * (words / sentences) - 84.6 * (syllables / words).
 * Syllables are estimated from vowel groups; sentences are the normalizer's, so abbreviations
 * such as "Dr." do not end one.
 */
@Component
public class FleschReadabilityScorer implements ReadabilityScorer {

    private static final Pattern WORD = Pattern.compile("\\p{L}+");
    private static final Pattern VOWEL_GROUP = Pattern.compile("[aeiouy]+");

    @Override
    public double score(NormalizedText text) {
        int words = 0;
        int syllables = 0;
        Matcher matcher = WORD.matcher(text.text());
        while (matcher.find()) {
            words++;
            syllables += syllables(matcher.group().toLowerCase(Locale.ROOT));
        }
        if (words == 0) {
            return 0.0;
        }

        int sentences = Math.max(1, text.sentenceCount());

        return 206.835 - 1.015 * ((double) words / sentences) - 84.6 * ((double) syllables / words);
    }

    int syllables(String word) {
        int count = 0;
        Matcher matcher = VOWEL_GROUP.matcher(word);
        while (matcher.find()) {
            count++;
        }
        // silent trailing e, but not in "-le" endings like "table"
        if (count > 1 && word.endsWith("e") && !word.endsWith("le")) {
            count--;
        }
        return Math.max(1, count);
    }
}
