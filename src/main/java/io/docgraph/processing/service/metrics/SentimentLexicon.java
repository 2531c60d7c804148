package io.docgraph.processing.service.metrics;

import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Word polarities read from a tab-separated {@code word score} resource, plus the tokenizer both
 * lexicon scorers share.
 */
final class SentimentLexicon {

    private static final Pattern WORD = Pattern.compile("\\p{L}+(?:'\\p{L}+)?");

    private final Map<String, Double> polarities;

    private SentimentLexicon(Map<String, Double> polarities) {
        this.polarities = polarities;
    }

    static SentimentLexicon load(String location) {
        Map<String, Double> entries = new HashMap<>();
        Resource resource = new DefaultResourceLoader().getResource(location);
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank() || line.startsWith("#")) {
                    continue;
                }
                String[] parts = line.trim().split("\\s+");
                if (parts.length != 2) {
                    throw new IllegalStateException("Malformed sentiment lexicon line: " + line);
                }
                entries.put(parts[0].toLowerCase(Locale.ROOT), Double.parseDouble(parts[1]));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read sentiment lexicon from " + location, e);
        }
        return new SentimentLexicon(Map.copyOf(entries));
    }

    /**
     * @return the polarity of a lower-cased word, or null when the word carries no sentiment
     */
    Double polarity(String word) {
        return polarities.get(word);
    }

    int size() {
        return polarities.size();
    }

    static List<String> tokenize(String text) {
        Matcher matcher = WORD.matcher(text.toLowerCase(Locale.ROOT).replace('’', '\''));
        List<String> tokens = new ArrayList<>();
        while (matcher.find()) {
            tokens.add(matcher.group());
        }
        return tokens;
    }
}
