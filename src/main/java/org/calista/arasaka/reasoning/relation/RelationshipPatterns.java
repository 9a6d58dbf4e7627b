package org.calista.arasaka.reasoning.relation;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Pattern table for relationship extraction. Each pattern runs over one lowercase sentence and
 * captures the phrase before and after the connective.
 */
final class RelationshipPatterns {

    enum Direction {
        /** group1 -> group2 */
        FORWARD,
        /** group2 -> group1 */
        BACKWARD,
        BIDIRECTIONAL
    }

    static final class Entry {
        final RelationshipType type;
        final Pattern pattern;
        final Direction direction;

        Entry(RelationshipType type, String connective, Direction direction) {
            this.type = type;
            this.pattern = Pattern.compile("^(.+?)\\s+(?:" + connective + ")\\s+(.+)$");
            this.direction = direction;
        }
    }

    static final List<Entry> TABLE = List.of(
            new Entry(RelationshipType.CAUSAL, "causes?|leads? to|results? in|brings? about", Direction.FORWARD),
            new Entry(RelationshipType.CAUSAL, "is caused by|is due to|results from|stems from", Direction.BACKWARD),
            new Entry(RelationshipType.CAUSAL, "affects?|impacts?|influences?|drives?|shapes?", Direction.FORWARD),
            new Entry(RelationshipType.CAUSAL, "because of|due to|as a result of", Direction.BACKWARD),

            new Entry(RelationshipType.HIERARCHICAL, "is a type of|is a kind of|is a form of|is a category of", Direction.FORWARD),
            new Entry(RelationshipType.HIERARCHICAL, "is part of|belongs to|is included in", Direction.FORWARD),
            new Entry(RelationshipType.HIERARCHICAL, "contains?|includes?|consists? of|comprises?", Direction.BACKWARD),
            new Entry(RelationshipType.HIERARCHICAL, "is an example of|is an instance of", Direction.FORWARD),

            new Entry(RelationshipType.ASSOCIATIVE, "is related to|is associated with|is connected to|is linked to", Direction.BIDIRECTIONAL),
            new Entry(RelationshipType.ASSOCIATIVE, "similar to|like|analogous to|comparable to", Direction.BIDIRECTIONAL),
            new Entry(RelationshipType.ASSOCIATIVE, "and|with|alongside", Direction.BIDIRECTIONAL),

            new Entry(RelationshipType.COMPARATIVE, "versus|vs|compared to|in contrast to|unlike", Direction.BIDIRECTIONAL),
            new Entry(RelationshipType.COMPARATIVE, "better than|worse than|more than|less than", Direction.FORWARD),

            new Entry(RelationshipType.TEMPORAL, "before|precedes?|comes before", Direction.FORWARD),
            new Entry(RelationshipType.TEMPORAL, "after|follows?|comes after", Direction.BACKWARD),
            new Entry(RelationshipType.TEMPORAL, "during|while|at the same time as", Direction.BIDIRECTIONAL)
    );

    private RelationshipPatterns() {}
}
