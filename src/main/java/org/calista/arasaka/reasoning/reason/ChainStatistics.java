package org.calista.arasaka.reasoning.reason;

import org.calista.arasaka.reasoning.analysis.ReasoningType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Aggregate over a batch of chains.
 */
public final class ChainStatistics {

    public final int totalChains;
    public final double avgConfidence;
    public final double avgQualityScore;
    public final double verificationRate;
    public final double avgStepsPerChain;
    public final int minSteps;
    public final int maxSteps;
    public final long totalProcessingMs;
    public final Map<ReasoningType, Integer> typeDistribution;

    private ChainStatistics(int totalChains, double avgConfidence, double avgQualityScore, double verificationRate,
                            double avgStepsPerChain, int minSteps, int maxSteps, long totalProcessingMs,
                            Map<ReasoningType, Integer> typeDistribution) {
        this.totalChains = totalChains;
        this.avgConfidence = avgConfidence;
        this.avgQualityScore = avgQualityScore;
        this.verificationRate = verificationRate;
        this.avgStepsPerChain = avgStepsPerChain;
        this.minSteps = minSteps;
        this.maxSteps = maxSteps;
        this.totalProcessingMs = totalProcessingMs;
        this.typeDistribution = Collections.unmodifiableMap(typeDistribution);
    }

    public static ChainStatistics of(List<ReasoningChain> chains) {
        EnumMap<ReasoningType, Integer> dist = new EnumMap<>(ReasoningType.class);
        if (chains == null || chains.isEmpty()) {
            return new ChainStatistics(0, 0.0, 0.0, 0.0, 0.0, 0, 0, 0L, dist);
        }

        double conf = 0.0, quality = 0.0;
        int verified = 0;
        long steps = 0, time = 0;
        int min = Integer.MAX_VALUE, max = 0;
        for (ReasoningChain c : chains) {
            conf += c.confidence;
            quality += c.qualityScore;
            if (c.verificationResult) verified++;
            int n = c.steps.size();
            steps += n;
            min = Math.min(min, n);
            max = Math.max(max, n);
            time += c.processingTimeMs;
            dist.merge(c.reasoningType, 1, Integer::sum);
        }
        int total = chains.size();
        return new ChainStatistics(total, conf / total, quality / total, (double) verified / total,
                (double) steps / total, min, max, time, dist);
    }

    /** Multi-line summary in the console runner's style. */
    public String format() {
        StringBuilder sb = new StringBuilder(256);
        sb.append("Reasoning Statistics\n");
        sb.append("====================\n");
        sb.append("Total Queries: ").append(totalChains).append('\n');
        sb.append(String.format(Locale.ROOT, "Average Confidence: %.2f\n", avgConfidence));
        sb.append(String.format(Locale.ROOT, "Average Quality Score: %.2f\n", avgQualityScore));
        sb.append(String.format(Locale.ROOT, "Verification Rate: %.2f%%\n", verificationRate * 100.0));
        sb.append(String.format(Locale.ROOT, "Average Steps per Chain: %.2f\n", avgStepsPerChain));
        sb.append("Reasoning Type Distribution:");
        for (Map.Entry<ReasoningType, Integer> e : typeDistribution.entrySet()) {
            sb.append("\n  - ").append(e.getKey().displayName()).append(": ").append(e.getValue());
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "ChainStatistics{chains=" + totalChains + ", verificationRate=" + verificationRate + "}";
    }
}
