package org.calista.arasaka.reasoning.synthesis;

import org.calista.arasaka.reasoning.relation.Relationship;

import java.util.List;

public final class SynthesisResult {
    public final String synthesizedContext;
    public final List<Relationship> relationships;
    public final List<Conflict> conflicts;
    public final double qualityScore;
    public final List<String> topicsCovered;
    public final int totalItems;

    public SynthesisResult(String synthesizedContext, List<Relationship> relationships, List<Conflict> conflicts,
                           double qualityScore, List<String> topicsCovered, int totalItems) {
        this.synthesizedContext = synthesizedContext == null ? "" : synthesizedContext;
        this.relationships = List.copyOf(relationships);
        this.conflicts = List.copyOf(conflicts);
        this.qualityScore = qualityScore;
        this.topicsCovered = List.copyOf(topicsCovered);
        this.totalItems = totalItems;
    }

    public static SynthesisResult empty() {
        return new SynthesisResult("", List.of(), List.of(), 0.0, List.of(), 0);
    }

    public boolean isEmpty() {
        return totalItems == 0 && synthesizedContext.isEmpty();
    }
}
