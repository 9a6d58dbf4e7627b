package org.calista.arasaka.reasoning.analysis;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class QueryDecomposerTest {

    @Test
    void splitsOnConjunctions() {
        assertThat(QueryDecomposer.decompose("What is inflation and how does it affect savings?"))
                .containsExactly("What is inflation", "how does it affect savings?");
    }

    @Test
    void splitsSeveralQuestions() {
        assertThat(QueryDecomposer.decompose("What is a black hole? Where do black holes form?"))
                .containsExactly("What is a black hole?", "Where do black holes form?");
    }

    @Test
    void shortPartsDoNotCount() {
        assertThat(QueryDecomposer.decompose("cats and dogs")).isEmpty();
        assertThat(QueryDecomposer.decompose("")).isEmpty();
    }
}
