package org.calista.arasaka.reasoning.reason;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * One step of a reasoning chain.
 *
 * <p>Number, description and dependencies are fixed at construction; reasoning, confidence,
 * evidence and knowledge are filled in place by the engine while the chain is built.</p>
 */
public final class ReasoningStep {

    public final int stepNumber;
    public final String description;
    /** Step numbers this step builds on. */
    public final List<Integer> dependencies;

    public String reasoning;
    public double confidence;
    public final List<String> evidence = new ArrayList<>();
    public final List<String> knowledgeUsed = new ArrayList<>();
    public final List<ReasoningStep> subSteps = new ArrayList<>();
    public long executionTimeMs;

    public ReasoningStep(int stepNumber, String description, double confidence, List<Integer> dependencies) {
        this(stepNumber, description, "", confidence, dependencies);
    }

    public ReasoningStep(int stepNumber, String description, String reasoning, double confidence, List<Integer> dependencies) {
        if (stepNumber < 1) throw new IllegalArgumentException("stepNumber must be >= 1: " + stepNumber);
        List<Integer> deps = dependencies == null ? List.of() : List.copyOf(dependencies);
        if (deps.contains(stepNumber)) {
            throw new IllegalArgumentException("step " + stepNumber + " depends on itself");
        }
        this.stepNumber = stepNumber;
        this.description = Objects.requireNonNull(description, "description");
        this.reasoning = reasoning == null ? "" : reasoning;
        this.confidence = confidence;
        this.dependencies = deps;
    }

    public boolean hasReasoning() {
        return reasoning != null && !reasoning.isBlank();
    }

    /** Deep copy under a new number and dependency list. Sub-steps are copied as they are. */
    public ReasoningStep renumbered(int newNumber, List<Integer> newDependencies) {
        ReasoningStep s = new ReasoningStep(newNumber, description, reasoning, confidence, newDependencies);
        s.evidence.addAll(evidence);
        s.knowledgeUsed.addAll(knowledgeUsed);
        for (ReasoningStep sub : subSteps) s.subSteps.add(sub.copy());
        s.executionTimeMs = executionTimeMs;
        return s;
    }

    public ReasoningStep copy() {
        return renumbered(stepNumber, dependencies);
    }

    @Override
    public String toString() {
        return "Step " + stepNumber + ": " + description + " (" + String.format(Locale.ROOT, "%.2f", confidence) + ")";
    }
}
