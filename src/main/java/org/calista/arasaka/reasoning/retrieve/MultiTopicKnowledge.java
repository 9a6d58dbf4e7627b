package org.calista.arasaka.reasoning.retrieve;

import org.calista.arasaka.reasoning.analysis.Domain;
import org.calista.arasaka.reasoning.knowledge.KnowledgeItem;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Topics of a query plus the knowledge retrieved for each.
 */
public final class MultiTopicKnowledge {
    public final String query;
    public final List<TopicInfo> topics;
    /** topic -> items, best first. Insertion order follows {@link #topics}. */
    public final Map<String, List<KnowledgeItem>> knowledgeByTopic;
    public final int totalItems;
    public final List<Domain> domains;

    public MultiTopicKnowledge(String query, List<TopicInfo> topics, Map<String, List<KnowledgeItem>> knowledgeByTopic) {
        this.query = query;
        this.topics = List.copyOf(topics);
        LinkedHashMap<String, List<KnowledgeItem>> m = new LinkedHashMap<>();
        int total = 0;
        for (Map.Entry<String, List<KnowledgeItem>> e : knowledgeByTopic.entrySet()) {
            List<KnowledgeItem> l = e.getValue() == null ? List.of() : List.copyOf(e.getValue());
            m.put(e.getKey(), l);
            total += l.size();
        }
        this.knowledgeByTopic = Collections.unmodifiableMap(m);
        this.totalItems = total;

        LinkedHashSet<Domain> d = new LinkedHashSet<>();
        for (TopicInfo t : topics) d.add(t.domain);
        this.domains = List.copyOf(d);
    }
}
