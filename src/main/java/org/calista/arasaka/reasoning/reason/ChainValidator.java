package org.calista.arasaka.reasoning.reason;

import java.util.ArrayList;
import java.util.List;

/**
 * Structural checks. An empty list means valid.
 */
public final class ChainValidator {

    private ChainValidator() {}

    public static List<String> validateStep(ReasoningStep step) {
        ArrayList<String> errors = new ArrayList<>();
        if (step == null) {
            errors.add("Missing step");
            return errors;
        }
        if (step.stepNumber <= 0) errors.add("Invalid step number");
        if (step.description == null || step.description.isBlank()) errors.add("Empty step description");
        if (!(step.confidence >= 0.0 && step.confidence <= 1.0)) errors.add("Confidence out of range");
        for (int dep : step.dependencies) {
            if (dep >= step.stepNumber) {
                errors.add("Invalid dependency: step " + step.stepNumber + " depends on step " + dep);
            }
        }
        return errors;
    }

    public static List<String> validateChain(ReasoningChain chain) {
        ArrayList<String> errors = new ArrayList<>();
        if (chain == null) {
            errors.add("Missing chain");
            return errors;
        }
        if (chain.query.isEmpty()) errors.add("Empty query");
        if (chain.steps.isEmpty()) errors.add("No reasoning steps");
        for (ReasoningStep s : chain.steps) errors.addAll(validateStep(s));
        if (chain.conclusion.isEmpty()) errors.add("Empty conclusion");
        if (!(chain.confidence >= 0.0 && chain.confidence <= 1.0)) errors.add("Confidence out of range");

        for (int i = 0; i < chain.steps.size(); i++) {
            if (chain.steps.get(i).stepNumber != i + 1) {
                errors.add("Step numbers not sequential");
                break;
            }
        }
        return errors;
    }

    public static boolean isValid(ReasoningChain chain) {
        return validateChain(chain).isEmpty();
    }
}
