package org.calista.arasaka.reasoning.text;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TextsTest {

    @Test
    void tokenizerKeepsInnerJoiners() {
        assertThat(SimpleTokenizer.INSTANCE.tokenize("COVID-19 isn't over, right?"))
                .containsExactly("covid-19", "isn't", "over", "right");
    }

    @Test
    void phraseContainmentRespectsTokenBoundaries() {
        assertThat(Texts.containsPhrase("game physics engine", "physics")).isTrue();
        assertThat(Texts.containsPhrase("astrophysics", "physics")).isFalse();
        assertThat(Texts.containsPhrase("the vs match", "vs")).isTrue();
        assertThat(Texts.containsPhrase("canvas", "vs")).isFalse();
    }

    @Test
    void meaningfulWordsDropStopWordsAndShortTokens() {
        assertThat(Texts.meaningfulWords("What is the role of the sun in photosynthesis", 3))
                .containsExactly("role", "photosynthesis");
    }

    @Test
    void sentencesAndTruncation() {
        assertThat(Texts.sentences("One. Two! Three?\nFour")).containsExactly("One.", "Two!", "Three?", "Four");
        assertThat(Texts.truncate("abcdef", 3)).isEqualTo("abc...");
        assertThat(Texts.truncate("abc", 3)).isEqualTo("abc");
        assertThat(Texts.head("abcdef", 2)).isEqualTo("ab");
    }

    @Test
    void clampHandlesNaN() {
        assertThat(Texts.clamp01(Double.NaN)).isZero();
        assertThat(Texts.clamp01(-1)).isZero();
        assertThat(Texts.clamp01(2)).isEqualTo(1.0);
    }
}
