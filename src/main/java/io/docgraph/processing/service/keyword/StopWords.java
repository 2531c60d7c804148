package io.docgraph.processing.service.keyword;

import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * English stop-word list loaded from {@code stopwords.txt} on the classpath.
 */
@Component
public class StopWords {

    private static final String RESOURCE = "stopwords.txt";

    private final Set<String> words;

    public StopWords() {
        this.words = Set.copyOf(load());
    }

    public boolean contains(String token) {
        return words.contains(token.toLowerCase(Locale.ROOT));
    }

    public int size() {
        return words.size();
    }

    private static Set<String> load() {
        Set<String> loaded = new HashSet<>();
        ClassPathResource resource = new ClassPathResource(RESOURCE);
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                String word = line.trim();
                if (!word.isEmpty() && !word.startsWith("#")) {
                    loaded.add(word.toLowerCase(Locale.ROOT));
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read stop words from " + RESOURCE, e);
        }
        return loaded;
    }
}
