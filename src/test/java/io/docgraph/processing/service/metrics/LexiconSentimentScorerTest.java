package io.docgraph.processing.service.metrics;

import io.docgraph.processing.support.TestConfigs;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.UncheckedIOException;

import static org.assertj.core.api.Assertions.*;

class LexiconSentimentScorerTest {

    private LexiconSentimentScorer scorer;

    @BeforeEach
    void setUp() {
        scorer = new LexiconSentimentScorer(TestConfigs.defaults());
    }

    @Test
    @DisplayName("Should average the polarity of matched words")
    void shouldAverageThePolarityOfMatchedWords() {
        assertThat(scorer.score("This is a good and excellent product.")).isCloseTo(0.85, within(1e-9));
    }

    @Test
    @DisplayName("Should weaken and flip negated words")
    void shouldWeakenAndFlipNegatedWords() {
        assertThat(scorer.score("The service was not good.")).isCloseTo(-0.35, within(1e-9));
        assertThat(scorer.score("The service wasn’t bad.")).isCloseTo(0.35, within(1e-9));
    }

    @Test
    @DisplayName("Should return neutral when no sentiment word occurs")
    void shouldReturnNeutralWhenNoSentimentWordOccurs() {
        assertThat(scorer.score("Alice works at Acme.")).isZero();
        assertThat(scorer.score("")).isZero();
    }

    @Test
    @DisplayName("Should stay within the polarity range")
    void shouldStayWithinThePolarityRange() {
        assertThat(scorer.score("Terrible, terrible, terrible war and disaster."))
                .isBetween(-1.0, 1.0);
    }

    @Test
    @DisplayName("Should fail fast when the lexicon cannot be read")
    void shouldFailFastWhenTheLexiconCannotBeRead() {
        assertThatThrownBy(() -> new LexiconSentimentScorer(
                TestConfigs.builder().lexicon("classpath:no-such-lexicon.txt").build()))
                .isInstanceOf(UncheckedIOException.class)
                .hasMessageContaining("no-such-lexicon.txt");
    }
}
