package io.docgraph.processing.config;

import java.util.List;
import java.util.Map;

public record NlpConfig(
        Stanford stanford,
        Entities entities,
        Relations relations,
        Sentiment sentiment
) {
    public record Stanford(
            List<String> nerAnnotators,
            List<String> parseAnnotators,
            boolean useSuTime,
            int timeout
    ) {}

    public record Entities(
            int minSurfaceLength,
            int maxSurfaceLength,
            boolean acronymMatching,
            boolean partialNameMatching,
            Map<String, String> aliases // alias -> full name, e.g. WHO -> World Health Organization
    ) {
        public Entities {
            aliases = aliases == null ? Map.of() : Map.copyOf(aliases);
        }
    }

    public record Relations(
            boolean includePrepositionalObjects
    ) {}

    public record Sentiment(
            String lexicon
    ) {}
}
