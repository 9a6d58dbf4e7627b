package org.calista.arasaka.reasoning.retrieve;

import java.util.Comparator;
import java.util.Objects;

/**
 * Small immutable scored wrapper.
 */
public final class Scored<T> {
    public final T item;
    public final double score;

    public Scored(T item, double score) {
        this.item = item;
        this.score = score;
    }

    public static <T> Scored<T> of(T item, double score) {
        return new Scored<>(item, score);
    }

    /**
     * Descending score only. Combined with {@link java.util.List#sort} (stable) equal scores keep
     * their input order.
     */
    public static <T> Comparator<Scored<T>> byScoreDesc() {
        return (a, b) -> Double.compare(b.score, a.score);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof Scored<?> s)) return false;
        return Double.doubleToLongBits(score) == Double.doubleToLongBits(s.score)
                && Objects.equals(item, s.item);
    }

    @Override
    public int hashCode() {
        return Objects.hash(item, Double.doubleToLongBits(score));
    }

    @Override
    public String toString() {
        return "Scored{score=" + score + ", item=" + item + '}';
    }
}
