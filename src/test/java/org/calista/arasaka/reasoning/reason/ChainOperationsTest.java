package org.calista.arasaka.reasoning.reason;

import org.calista.arasaka.reasoning.analysis.ReasoningType;
import org.calista.arasaka.reasoning.relation.Relationship;
import org.calista.arasaka.reasoning.relation.RelationshipType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ChainOperationsTest {

    private static ReasoningStep step(int n, String reasoning, double conf, Integer... deps) {
        return new ReasoningStep(n, "Step " + n, reasoning, conf, List.of(deps));
    }

    private static ReasoningChain chain(String conclusion, double conf, boolean verified, ReasoningStep... steps) {
        return ReasoningChain.builder("q", ReasoningType.GENERAL)
                .steps(List.of(steps))
                .conclusion(conclusion)
                .confidence(conf)
                .qualityScore(conf)
                .verificationResult(verified)
                .build();
    }

    @Test
    void verifyNeedsReasoningConfidenceAndConclusion() {
        List<ReasoningStep> ok = List.of(step(1, "a", 0.8), step(2, "b", 0.7, 1));

        assertThat(ChainOperations.verify(ok, "a long enough conclusion", 0.6)).isTrue();
        assertThat(ChainOperations.verify(ok, "too short", 0.6)).isFalse();
        assertThat(ChainOperations.verify(ok, "a long enough conclusion", 0.75)).isFalse();
        assertThat(ChainOperations.verify(List.of(step(1, "", 0.9)), "a long enough conclusion", 0.6)).isFalse();
        assertThat(ChainOperations.verify(List.of(), "a long enough conclusion", 0.6)).isFalse();
    }

    @Test
    void qualityWeighsVerificationLengthAndConfidence() {
        List<ReasoningStep> steps = List.of(step(1, "a", 0.8), step(2, "b", 0.8), step(3, "c", 0.8), step(4, "d", 0.8));

        // 0.5 + 4/10 * 0.2 + 0.8 * 0.3
        assertThat(ChainOperations.quality(steps, true, 10)).isCloseTo(0.82, within(1e-9));
        assertThat(ChainOperations.quality(steps, false, 10)).isCloseTo(0.52, within(1e-9));
        assertThat(ChainOperations.quality(List.of(), true, 10)).isZero();
    }

    @Test
    void conclusionJoinsInsightsAndAtMostThreeRelationships() {
        List<ReasoningStep> steps = List.of(step(1, "First insight", 0.8), step(2, "", 0.8), step(3, "Second insight", 0.8));
        List<Relationship> rels = List.of(
                new Relationship("a", "b", RelationshipType.CAUSAL, 0.9, 0.7, ""),
                new Relationship("b", "c", RelationshipType.CAUSAL, 0.8, 0.7, ""),
                new Relationship("c", "d", RelationshipType.CAUSAL, 0.7, 0.7, ""),
                new Relationship("d", "e", RelationshipType.CAUSAL, 0.6, 0.7, ""));

        assertThat(ChainOperations.conclude(ReasoningType.ANALYTICAL, steps, rels)).isEqualTo(
                "Analysis conclusion: First insight. Second insight. Relationships: a causal b, b causal c, c causal d");
        assertThat(ChainOperations.conclude(ReasoningType.GENERAL, List.of(), rels)).isEqualTo(ChainOperations.NO_ANSWER);
    }

    @Test
    void weakDependencyDragsConfidenceDown() {
        ReasoningStep s1 = step(1, "a", 0.5);
        ReasoningStep s2 = step(2, "b", 0.8, 1);
        ChainOperations.adjustConfidenceByDependencies(List.of(s1, s2));

        assertThat(s1.confidence).isEqualTo(0.5);
        // 0.8 * 0.5 - 0.1
        assertThat(s2.confidence).isCloseTo(0.3, within(1e-9));
    }

    @Test
    void unresolvableDependenciesCascade() {
        List<ReasoningStep> kept = ChainOperations.resolveDependencies(List.of(
                step(1, "a", 0.8), step(2, "b", 0.8, 5), step(3, "c", 0.8, 2)));

        assertThat(kept).extracting(s -> s.stepNumber).containsExactly(1);
    }

    @Test
    void topologicalSortPutsDependenciesFirst() {
        List<ReasoningStep> sorted = ChainOperations.topologicalSort(List.of(
                step(2, "b", 0.8, 3), step(3, "c", 0.8), step(1, "a", 0.8)));

        assertThat(sorted).extracting(s -> s.stepNumber).containsExactly(3, 2, 1);
    }

    @Test
    void renumberRemapsDependencies() {
        List<ReasoningStep> out = ChainOperations.renumber(List.of(step(3, "a", 0.8), step(7, "b", 0.8, 3)));

        assertThat(out).extracting(s -> s.stepNumber).containsExactly(1, 2);
        assertThat(out.get(1).dependencies).containsExactly(1);
    }

    @Test
    void mergeDeduplicatesStepsAndAveragesScores() {
        ReasoningChain a = chain("First.", 0.8, true, step(1, "Shared reasoning", 0.8), step(2, "Only in a", 0.8, 1));
        ReasoningChain b = chain("Second.", 0.6, false, step(1, "shared reasoning", 0.7), step(2, "Only in b", 0.6, 1));

        ReasoningChain m = ChainOperations.merge(List.of(a, b));

        assertThat(m.steps).extracting(s -> s.reasoning).containsExactly("Shared reasoning", "Only in a", "Only in b");
        assertThat(m.steps.get(2).dependencies).containsExactly(1);
        assertThat(m.conclusion).isEqualTo("First. Second.");
        assertThat(m.confidence).isCloseTo(0.7, within(1e-9));
        assertThat(m.verificationResult).isFalse();
        assertThatThrownBy(() -> ChainOperations.merge(List.of())).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void optimizeDropsRepeatedReasoning() {
        ReasoningChain c = chain("A conclusion that is long enough.", 0.8, true,
                step(1, "Same", 0.8), step(2, "same", 0.8, 1), step(3, "Different", 0.8, 2));

        ReasoningChain o = ChainOperations.optimize(c, 0.6, 10);

        assertThat(o.steps).extracting(s -> s.reasoning).containsExactly("Same", "Different");
        assertThat(o.steps).extracting(s -> s.stepNumber).containsExactly(1, 2);
        assertThat(o.verificationResult).isTrue();
    }

    @Test
    void validateAndFixRepairsNumbersAndConfidence() {
        ReasoningChain broken = chain("A conclusion that is long enough.", 0.8, false,
                step(2, "a", 1.5), step(5, "b", Double.NaN, 2));

        ReasoningChain fixed = ChainOperations.validateAndFix(broken, 0.4, 10);

        assertThat(fixed.steps).extracting(s -> s.stepNumber).containsExactly(1, 2);
        assertThat(fixed.steps).extracting(s -> s.confidence).containsExactly(1.0, 0.0);
        assertThat(ChainValidator.isValid(fixed)).isTrue();
        assertThat(fixed.verificationResult).isTrue();
    }
}
