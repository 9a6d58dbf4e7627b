package org.calista.arasaka.reasoning.relation;

import org.calista.arasaka.reasoning.text.Texts;

import java.util.Locale;
import java.util.Objects;

/**
 * Link between two topics. Topics are stored lowercase and trimmed.
 * For directional types topic1 is the cause/part/earlier side.
 */
public final class Relationship {

    public final String topic1;
    public final String topic2;
    public final RelationshipType type;
    public final double strength;
    public final double confidence;
    public final String evidence;
    public final String source;

    public Relationship(String topic1, String topic2, RelationshipType type,
                        double strength, double confidence, String evidence, String source) {
        this.topic1 = normTopic(topic1, "topic1");
        this.topic2 = normTopic(topic2, "topic2");
        if (this.topic1.equals(this.topic2)) {
            throw new IllegalArgumentException("Relationship needs two distinct topics: " + this.topic1);
        }
        this.type = Objects.requireNonNull(type, "type");
        this.strength = Texts.clamp01(strength);
        this.confidence = Texts.clamp01(confidence);
        this.evidence = evidence == null ? "" : evidence;
        this.source = source == null || source.isBlank() ? "unknown" : source;
    }

    public Relationship(String topic1, String topic2, RelationshipType type, double strength, double confidence, String evidence) {
        this(topic1, topic2, type, strength, confidence, evidence, "unknown");
    }

    /** Same relationship seen from topic2. */
    public Relationship mirrored() {
        return new Relationship(topic2, topic1, type, strength, confidence, evidence, source);
    }

    /** Unordered pair + type. */
    public Key key() {
        return new Key(topic1, topic2, type);
    }

    public boolean involves(String topic) {
        String t = Texts.lower(topic).trim();
        return topic1.equals(t) || topic2.equals(t);
    }

    /** The side that is not {@code topic}, or null when the topic is not part of this relationship. */
    public String other(String topic) {
        String t = Texts.lower(topic).trim();
        if (topic1.equals(t)) return topic2;
        if (topic2.equals(t)) return topic1;
        return null;
    }

    /** "climate change causal economic policy" */
    public String describe() {
        return topic1 + " " + type.label() + " " + topic2;
    }

    private static String normTopic(String t, String name) {
        if (t == null || t.isBlank()) throw new IllegalArgumentException(name + " is required");
        return t.trim().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return "Relationship{" + describe() + ", strength=" + strength + '}';
    }

    /** Dedup key: order of the two topics does not matter. */
    public static final class Key {
        public final String a;
        public final String b;
        public final RelationshipType type;

        public Key(String t1, String t2, RelationshipType type) {
            String x = Texts.lower(t1).trim();
            String y = Texts.lower(t2).trim();
            if (x.compareTo(y) <= 0) {
                this.a = x;
                this.b = y;
            } else {
                this.a = y;
                this.b = x;
            }
            this.type = type;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Key k)) return false;
            return a.equals(k.a) && b.equals(k.b) && type == k.type;
        }

        @Override
        public int hashCode() {
            return Objects.hash(a, b, type);
        }

        @Override
        public String toString() {
            return "(" + a + ", " + b + ", " + type.label() + ")";
        }
    }
}
