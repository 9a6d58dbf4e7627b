package org.calista.arasaka.reasoning.relation;

import java.util.List;
import java.util.Optional;

/**
 * Relationship store contract: at most one relationship per unordered topic pair and type,
 * always the strongest one seen.
 */
public interface RelationshipStore {

    enum Upsert {
        INSERTED,
        /** an existing weaker relationship was replaced */
        UPDATED,
        /** an equal or stronger relationship was already stored */
        DUPLICATE
    }

    Upsert upsert(Relationship r);

    default Upsert upsert(String topic1, String topic2, RelationshipType type,
                          double strength, double confidence, String evidence) {
        return upsert(new Relationship(topic1, topic2, type, strength, confidence, evidence));
    }

    /**
     * Relationships touching {@code topic}, strongest first.
     *
     * @param type optional filter, null for all types
     */
    List<Relationship> get(String topic, RelationshipType type);

    /** Topics reachable from {@code topic} within {@code maxDepth} hops over any type, nearest first. */
    List<String> findRelated(String topic, int maxDepth);

    /** Shortest chain of causal edges from cause to effect, if any within {@code maxDepth} hops. */
    Optional<List<Relationship>> findCausalPath(String from, String to, int maxDepth);

    List<Relationship> all();

    int size();
}
