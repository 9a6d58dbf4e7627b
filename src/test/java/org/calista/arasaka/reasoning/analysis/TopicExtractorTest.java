package org.calista.arasaka.reasoning.analysis;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TopicExtractorTest {

    @Test
    void compoundTermsCoverTheirWords() {
        assertThat(TopicExtractor.topics("How does climate change affect agriculture?"))
                .containsExactly("climate change", "agriculture");
    }

    @Test
    void relationVerbsNeverBecomeTopics() {
        assertThat(TopicExtractor.topics("Does inflation influence unemployment?"))
                .containsExactly("inflation", "unemployment");
    }

    @Test
    void entitiesFromCapitalizedRunsAndCodes() {
        assertThat(TopicExtractor.entities("Does COVID-19 affect New York City?"))
                .contains("COVID-19", "New York City")
                .doesNotContain("Does");
    }

    @Test
    void blankInput() {
        assertThat(TopicExtractor.topics(" ")).isEmpty();
        assertThat(TopicExtractor.entities(null)).isEmpty();
    }
}
