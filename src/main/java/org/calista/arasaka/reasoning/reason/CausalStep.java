package org.calista.arasaka.reasoning.reason;

import java.util.Objects;

/**
 * One cause → effect hop of a causal chain.
 */
public final class CausalStep {

    public final String cause;
    public final String effect;
    public final double confidence;
    /** Evidence sentence of the graph edge; empty for an assumed hop. */
    public final String mechanism;
    /** True when no causal edge backed this hop and the topic order was assumed. */
    public final boolean assumed;

    public CausalStep(String cause, String effect, double confidence, String mechanism, boolean assumed) {
        this.cause = Objects.requireNonNull(cause, "cause");
        this.effect = Objects.requireNonNull(effect, "effect");
        if (cause.equalsIgnoreCase(effect)) throw new IllegalArgumentException("cause and effect are the same: " + cause);
        this.confidence = confidence;
        this.mechanism = mechanism == null ? "" : mechanism;
        this.assumed = assumed;
    }

    public String describe() {
        return cause + " → " + effect;
    }

    @Override
    public String toString() {
        return "CausalStep{" + describe() + ", confidence=" + confidence + (assumed ? ", assumed" : "") + "}";
    }
}
