package org.calista.arasaka.reasoning.analysis;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Cognitive strategy a query needs; selects the decomposition template.
 */
public enum ReasoningType {
    DEDUCTIVE,
    INDUCTIVE,
    ABDUCTIVE,
    ANALOGICAL,
    CAUSAL,
    TEMPORAL,
    SPATIAL,
    MATHEMATICAL,
    LOGICAL,
    COMPARATIVE,
    ANALYTICAL,
    GENERAL;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** "Causal", "Mathematical", ... */
    public String displayName() {
        String n = label();
        return Character.toUpperCase(n.charAt(0)) + n.substring(1);
    }
}
