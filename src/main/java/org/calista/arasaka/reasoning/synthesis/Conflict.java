package org.calista.arasaka.reasoning.synthesis;

import org.calista.arasaka.reasoning.knowledge.KnowledgeItem;

import java.util.Objects;

/**
 * Two items about the same (topic, title) where one negates what the other asserts.
 */
public final class Conflict {

    public enum Severity { LOW, MEDIUM, HIGH }

    public final KnowledgeItem item1;
    public final KnowledgeItem item2;
    public final String type;
    public final Severity severity;

    public Conflict(KnowledgeItem item1, KnowledgeItem item2, String type, Severity severity) {
        this.item1 = Objects.requireNonNull(item1, "item1");
        this.item2 = Objects.requireNonNull(item2, "item2");
        this.type = type == null ? "contradiction" : type;
        this.severity = severity == null ? Severity.MEDIUM : severity;
    }

    @Override
    public String toString() {
        return "Conflict{" + type + ", " + severity + ", ids=" + item1.id + "/" + item2.id + '}';
    }
}
