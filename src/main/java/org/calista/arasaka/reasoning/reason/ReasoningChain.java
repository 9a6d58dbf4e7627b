package org.calista.arasaka.reasoning.reason;

import org.calista.arasaka.reasoning.analysis.Domain;
import org.calista.arasaka.reasoning.analysis.ReasoningType;
import org.calista.arasaka.reasoning.relation.Relationship;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Finished chain of reasoning steps with conclusion and calibrated scores.
 */
public final class ReasoningChain {

    public final String query;
    public final ReasoningType reasoningType;
    public final List<ReasoningStep> steps;
    public final String conclusion;
    public final double confidence;
    public final boolean verificationResult;
    public final double qualityScore;
    public final List<String> topicsInvolved;
    public final List<Relationship> relationships;
    public final List<Domain> domains;
    public final long processingTimeMs;

    private ReasoningChain(Builder b) {
        this.query = b.query == null ? "" : b.query;
        this.reasoningType = Objects.requireNonNull(b.reasoningType, "reasoningType");
        this.steps = List.copyOf(b.steps);
        this.conclusion = b.conclusion == null ? "" : b.conclusion;
        this.confidence = b.confidence;
        this.verificationResult = b.verificationResult;
        this.qualityScore = b.qualityScore;
        this.topicsInvolved = List.copyOf(b.topicsInvolved);
        this.relationships = List.copyOf(b.relationships);
        this.domains = List.copyOf(b.domains);
        this.processingTimeMs = b.processingTimeMs;
    }

    public static Builder builder(String query, ReasoningType type) {
        return new Builder(query, type);
    }

    public Builder toBuilder() {
        Builder b = new Builder(query, reasoningType);
        b.steps.addAll(steps);
        b.conclusion = conclusion;
        b.confidence = confidence;
        b.verificationResult = verificationResult;
        b.qualityScore = qualityScore;
        b.topicsInvolved.addAll(topicsInvolved);
        b.relationships.addAll(relationships);
        b.domains.addAll(domains);
        b.processingTimeMs = processingTimeMs;
        return b;
    }

    /** Copy with copied steps; edits to one never show through the other. */
    public ReasoningChain copy() {
        Builder b = toBuilder();
        b.steps.replaceAll(ReasoningStep::copy);
        return b.build();
    }

    public double meanStepConfidence() {
        return ChainOperations.meanConfidence(steps);
    }

    @Override
    public String toString() {
        return "ReasoningChain{type=" + reasoningType.label() + ", steps=" + steps.size()
                + ", confidence=" + confidence + ", verified=" + verificationResult + "}";
    }

    public static final class Builder {
        private final String query;
        private ReasoningType reasoningType;
        private final ArrayList<ReasoningStep> steps = new ArrayList<>();
        private String conclusion = "";
        private double confidence;
        private boolean verificationResult;
        private double qualityScore;
        private final ArrayList<String> topicsInvolved = new ArrayList<>();
        private final ArrayList<Relationship> relationships = new ArrayList<>();
        private final ArrayList<Domain> domains = new ArrayList<>();
        private long processingTimeMs;

        private Builder(String query, ReasoningType type) {
            this.query = query;
            this.reasoningType = type;
        }

        public Builder reasoningType(ReasoningType v) { this.reasoningType = v; return this; }
        public Builder steps(List<ReasoningStep> v) { steps.clear(); if (v != null) steps.addAll(v); return this; }
        public Builder conclusion(String v) { this.conclusion = v; return this; }
        public Builder confidence(double v) { this.confidence = v; return this; }
        public Builder verificationResult(boolean v) { this.verificationResult = v; return this; }
        public Builder qualityScore(double v) { this.qualityScore = v; return this; }
        public Builder topicsInvolved(List<String> v) { topicsInvolved.clear(); if (v != null) topicsInvolved.addAll(v); return this; }
        public Builder relationships(List<Relationship> v) { relationships.clear(); if (v != null) relationships.addAll(v); return this; }
        public Builder domains(List<Domain> v) { domains.clear(); if (v != null) domains.addAll(v); return this; }
        public Builder processingTimeMs(long v) { this.processingTimeMs = v; return this; }

        public ReasoningChain build() {
            return new ReasoningChain(this);
        }
    }
}
