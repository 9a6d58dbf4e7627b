package org.calista.arasaka.reasoning.relation;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;

public enum RelationshipType {
    CAUSAL(false, List.of("cause", "effect", "impact", "influence", "result")),
    HIERARCHICAL(false, List.of("type", "kind", "part", "contains", "includes")),
    ASSOCIATIVE(true, List.of("related", "associated", "connected", "linked")),
    COMPARATIVE(true, List.of("versus", "compared", "different", "similar")),
    TEMPORAL(true, List.of("before", "after", "during", "follows"));

    private final boolean symmetric;
    private final List<String> indicators;

    RelationshipType(boolean symmetric, List<String> indicators) {
        this.symmetric = symmetric;
        this.indicators = indicators;
    }

    /** Symmetric types get a mirrored edge in the relationship graph. */
    public boolean symmetric() {
        return symmetric;
    }

    /** Word stems that strengthen a detected relationship of this type. */
    public List<String> indicators() {
        return indicators;
    }

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
