package org.calista.arasaka.reasoning.reason;

/**
 * Point-in-time view of a {@link ReasoningEngine}'s running counters.
 */
public final class EngineStatistics {

    /** Chains built (cache hits excluded). */
    public final long chains;
    public final long totalSteps;
    public final double avgConfidence;
    public final double avgQualityScore;
    public final double avgProcessingMs;
    public final long cacheHits;
    public final long cacheMisses;
    public final int cacheSize;

    public EngineStatistics(long chains, long totalSteps, double avgConfidence, double avgQualityScore,
                            double avgProcessingMs, long cacheHits, long cacheMisses, int cacheSize) {
        this.chains = chains;
        this.totalSteps = totalSteps;
        this.avgConfidence = avgConfidence;
        this.avgQualityScore = avgQualityScore;
        this.avgProcessingMs = avgProcessingMs;
        this.cacheHits = cacheHits;
        this.cacheMisses = cacheMisses;
        this.cacheSize = cacheSize;
    }

    public double cacheHitRate() {
        long total = cacheHits + cacheMisses;
        return total == 0 ? 0.0 : (double) cacheHits / total;
    }

    @Override
    public String toString() {
        return "EngineStatistics{chains=" + chains + ", steps=" + totalSteps
                + ", avgConfidence=" + avgConfidence + ", avgQuality=" + avgQualityScore
                + ", cacheHits=" + cacheHits + ", cacheMisses=" + cacheMisses + "}";
    }
}
