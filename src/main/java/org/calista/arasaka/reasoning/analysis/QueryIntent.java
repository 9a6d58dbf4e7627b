package org.calista.arasaka.reasoning.analysis;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum QueryIntent {
    PHILOSOPHICAL,
    BIOGRAPHICAL,
    DEFINITION,
    RECIPE,
    HOW_TO,
    COMPARISON,
    PROGRAMMING,
    CAUSAL_EXPLANATION,
    EXPLANATION,
    GENERAL;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
