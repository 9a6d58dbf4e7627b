package org.calista.arasaka.reasoning.reason;

import org.calista.arasaka.reasoning.analysis.ReasoningType;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ChainStatisticsTest {

    private static ReasoningChain chain(ReasoningType type, int steps, double conf, boolean verified) {
        ReasoningChain.Builder b = ReasoningChain.builder("q", type).confidence(conf).qualityScore(conf).verificationResult(verified);
        ArrayList<ReasoningStep> l = new ArrayList<>();
        for (int i = 1; i <= steps; i++) l.add(new ReasoningStep(i, "s" + i, conf, List.of()));
        return b.steps(l).processingTimeMs(10).build();
    }

    @Test
    void aggregatesOverChains() {
        ChainStatistics s = ChainStatistics.of(List.of(
                chain(ReasoningType.CAUSAL, 6, 0.8, true),
                chain(ReasoningType.MATHEMATICAL, 3, 0.6, false),
                chain(ReasoningType.CAUSAL, 4, 0.7, true)));

        assertThat(s.totalChains).isEqualTo(3);
        assertThat(s.avgConfidence).isCloseTo(0.7, within(1e-9));
        assertThat(s.verificationRate).isCloseTo(2.0 / 3, within(1e-9));
        assertThat(s.minSteps).isEqualTo(3);
        assertThat(s.maxSteps).isEqualTo(6);
        assertThat(s.totalProcessingMs).isEqualTo(30);
        assertThat(s.typeDistribution).containsEntry(ReasoningType.CAUSAL, 2).containsEntry(ReasoningType.MATHEMATICAL, 1);

        assertThat(s.format())
                .startsWith("Reasoning Statistics\n====================\nTotal Queries: 3\n")
                .contains("Verification Rate: 66.67%")
                .contains("Average Steps per Chain: 4.33");
    }

    @Test
    void emptyInput() {
        ChainStatistics s = ChainStatistics.of(List.of());
        assertThat(s.totalChains).isZero();
        assertThat(s.typeDistribution).isEmpty();
    }
}
