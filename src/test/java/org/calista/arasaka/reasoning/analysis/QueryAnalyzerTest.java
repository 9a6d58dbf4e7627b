package org.calista.arasaka.reasoning.analysis;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class QueryAnalyzerTest {

    private final QueryAnalyzer analyzer = new QueryAnalyzer();

    @Test
    void causalMultiTopicQuery() {
        QueryAnalysis a = analyzer.analyze("How does climate change affect agriculture?");

        assertThat(a.reasoningType).isEqualTo(ReasoningType.CAUSAL);
        assertThat(a.topics).containsExactly("climate change", "agriculture");
        assertThat(a.requiresMultiTopic).isTrue();
        assertThat(a.intent).isEqualTo(QueryIntent.EXPLANATION);
        assertThat(a.keyPhrases).contains("how does");
        assertThat(a.primaryDomain()).isEqualTo(Domain.ENVIRONMENT);
        assertThat(a.arithmetic()).isEmpty();
    }

    @Test
    void arithmeticQueryIsMathematical() {
        QueryAnalysis a = analyzer.analyze("What is 5 + 3?");

        assertThat(a.reasoningType).isEqualTo(ReasoningType.MATHEMATICAL);
        assertThat(a.arithmetic()).isPresent();
        ArithmeticExpression e = a.arithmetic().get();
        assertThat(e.numbers).containsExactly("5", "3");
        assertThat(e.operators).containsExactly("+");
        assertThat(e.formattedValue()).contains("8");
    }

    @Test
    void biographicalIntentKeepsEntityCase() {
        QueryAnalysis a = analyzer.analyze("Who is Albert Einstein?");

        assertThat(a.intent).isEqualTo(QueryIntent.BIOGRAPHICAL);
        assertThat(a.intentEntity).isEqualTo("Albert Einstein");
        assertThat(a.entities).contains("Albert Einstein");
    }

    @Test
    void definitionAndPhilosophicalIntents() {
        QueryAnalysis def = analyzer.analyze("What is photosynthesis?");
        assertThat(def.intent).isEqualTo(QueryIntent.DEFINITION);
        assertThat(def.intentEntity()).contains("photosynthesis");

        assertThat(analyzer.analyze("What is life?").intent).isEqualTo(QueryIntent.PHILOSOPHICAL);
    }

    @Test
    void emptyQueryGivesDegenerateAnalysis() {
        for (String q : new String[]{null, "", "   "}) {
            QueryAnalysis a = analyzer.analyze(q);
            assertThat(a.intent).isEqualTo(QueryIntent.GENERAL);
            assertThat(a.reasoningType).isEqualTo(ReasoningType.GENERAL);
            assertThat(a.domains).containsExactly(Domain.GENERAL);
            assertThat(a.topics).isEmpty();
            assertThat(a.complexity).isZero();
        }
    }

    @Test
    void contextMakesFollowUp() {
        QueryAnalysis a = analyzer.analyze("What about its effects on agriculture?",
                List.of("Tell me about climate change effects on agriculture"));

        assertThat(a.contextRelevance).isEqualTo(1.0);
        assertThat(a.implicitIntents).contains("follow_up");

        QueryAnalysis fresh = analyzer.analyze("What about its effects on agriculture?");
        assertThat(fresh.contextRelevance).isZero();
        assertThat(fresh.implicitIntents).doesNotContain("follow_up");
    }

    @Test
    void secondaryTemporalAndSpatialIndicators() {
        QueryAnalysis a = analyzer.analyze("What are the advantages and disadvantages of solar power in the city?");
        assertThat(a.secondaryIntents).containsExactly("advantages", "disadvantages");
        assertThat(a.spatialIndicators).contains("city");

        QueryAnalysis t = analyzer.analyze("What happened before the war?");
        assertThat(t.temporalIndicators).contains("before");
    }

    @Test
    void complexityStaysInRange() {
        assertThat(QueryAnalyzer.complexity("Hi")).isCloseTo(0.35, within(1e-9));
        assertThat(QueryAnalyzer.complexity("What is the difference between cats and dogs?")).isCloseTo(1.0, within(1e-9));

        String longQuery = "why ".repeat(40) + "? ? and or but between";
        assertThat(QueryAnalyzer.complexity(longQuery)).isBetween(0.0, 1.0);
        assertThat(QueryAnalyzer.complexityLevel(longQuery)).isBetween(1, 5);
        assertThat(QueryAnalyzer.complexityLevel("Hi")).isEqualTo(1);
    }

    @Test
    void expansionAndVariations() {
        List<String> expanded = analyzer.expandQuery("How does pollution affect health?");
        assertThat(expanded.get(0)).isEqualTo("How does pollution affect health?");
        assertThat(expanded).contains("How does pollution influence health?", "How does pollution impact health?");

        assertThat(analyzer.queryVariations("climate change")).containsExactly(
                "climate change", "climate change?", "What is climate change?", "How does climate change work?");
    }
}
