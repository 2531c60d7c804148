package io.docgraph.processing.service.nlp;

import io.docgraph.processing.dto.nlp.EntityMention;
import io.docgraph.processing.dto.nlp.EntityType;
import io.docgraph.processing.dto.text.TextSpan;
import io.docgraph.processing.support.TestConfigs;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class EntityMergerTest {

    @Test
    @DisplayName("Should normalize case, punctuation and whitespace")
    void shouldNormalizeCasePunctuationAndWhitespace() {
        assertThat(EntityMerger.normalize("  Acme,   Corp. ")).isEqualTo("acme corp");
        assertThat(EntityMerger.normalize("U.S.A.")).isEqualTo("usa");
    }

    @Test
    @DisplayName("Should fall back to the lower-cased surface when only punctuation remains")
    void shouldFallBackWhenOnlyPunctuationRemains() {
        assertThat(EntityMerger.normalize("&")).isEqualTo("&");
        assertThat(EntityMerger.normalize("...")).isEqualTo("...");
    }

    @Test
    @DisplayName("Should recognise initials-only acronyms")
    void shouldRecogniseInitialsOnlyAcronyms() {
        assertThat(EntityMerger.isAcronymOf("IBM", "International Business Machines")).isTrue();
        assertThat(EntityMerger.isAcronymOf("U.N.", "United Nations")).isTrue();
        assertThat(EntityMerger.isAcronymOf("BoA", "Bank of America")).isTrue();
        assertThat(EntityMerger.isAcronymOf("WHO", "World Health Organization")).isTrue();
    }

    @Test
    @DisplayName("Should reject strings that are not acronyms of the phrase")
    void shouldRejectNonAcronyms() {
        assertThat(EntityMerger.isAcronymOf("IBM", "Intel Business")).isFalse();
        assertThat(EntityMerger.isAcronymOf("Acme", "Alpha Company Media Enterprises")).isFalse();
        assertThat(EntityMerger.isAcronymOf("W", "World")).isFalse();
        assertThat(EntityMerger.isAcronymOf("AB", "Alphabet")).isFalse();
    }

    @Test
    @DisplayName("Should pick the most frequent type and ignore UNKNOWN")
    void shouldPickTheMostFrequentTypeAndIgnoreUnknown() {
        Map<EntityType, Integer> counts = new EnumMap<>(EntityType.class);
        counts.put(EntityType.UNKNOWN, 5);
        counts.put(EntityType.LOCATION, 2);
        counts.put(EntityType.ORGANIZATION, 1);

        assertThat(EntityMerger.dominantType(counts)).isEqualTo(EntityType.LOCATION);
    }

    @Test
    @DisplayName("Should break type ties by declaration order")
    void shouldBreakTypeTiesByDeclarationOrder() {
        Map<EntityType, Integer> counts = new EnumMap<>(EntityType.class);
        counts.put(EntityType.ORGANIZATION, 1);
        counts.put(EntityType.PERSON, 1);

        assertThat(EntityMerger.dominantType(counts)).isEqualTo(EntityType.PERSON);
        assertThat(EntityMerger.dominantType(Map.of(EntityType.UNKNOWN, 3))).isEqualTo(EntityType.UNKNOWN);
    }

    @Test
    @DisplayName("Should group mentions in first-occurrence order")
    void shouldGroupMentionsInFirstOccurrenceOrder() {
        EntityMerger merger = new EntityMerger(TestConfigs.defaults().nlp().entities());
        List<EntityMention> mentions = List.of(
                mention("Alice", 0, EntityType.PERSON),
                mention("Acme", 10, EntityType.ORGANIZATION),
                mention("ALICE", 20, EntityType.PERSON),
                mention("Bob", 30, EntityType.PERSON)
        );

        assertThat(merger.group(mentions)).containsExactly(List.of(0, 2), List.of(1), List.of(3));
    }

    @Test
    @DisplayName("Should never merge different normalized forms without a rule")
    void shouldNeverMergeDifferentFormsWithoutARule() {
        EntityMerger merger = new EntityMerger(TestConfigs.defaults().nlp().entities());
        List<EntityMention> mentions = List.of(
                mention("John Smith", 0, EntityType.PERSON),
                mention("Smith", 20, EntityType.PERSON),
                mention("JS", 30, EntityType.PERSON)
        );

        assertThat(merger.group(mentions)).hasSize(3);
    }

    private EntityMention mention(String text, int begin, EntityType type) {
        return new EntityMention(text, new TextSpan(begin, begin + text.length()), type);
    }
}
