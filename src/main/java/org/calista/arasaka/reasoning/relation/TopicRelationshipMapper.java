package org.calista.arasaka.reasoning.relation;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.arasaka.reasoning.knowledge.KnowledgeItem;
import org.calista.arasaka.reasoning.text.Texts;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;

/**
 * Extracts topic relationships from knowledge content with the {@link RelationshipPatterns} table
 * and keeps a relationship graph in a {@link RelationshipStore}.
 */
public final class TopicRelationshipMapper {

    private static final Logger log = LogManager.getLogger(TopicRelationshipMapper.class);

    public static final class Config {
        public double baseStrength = 0.5;
        /** both topics mentioned more than once in the text */
        public double repeatBonus = 0.2;
        public double indicatorStep = 0.1;
        public double indicatorCap = 0.3;
        public double baseConfidence = 0.7;
        /** captures longer than this are cut before topic resolution */
        public int maxCaptureChars = 200;

        public Config validate() {
            baseStrength = Texts.clamp01(baseStrength);
            repeatBonus = Texts.clamp01(repeatBonus);
            indicatorStep = Texts.clamp01(indicatorStep);
            indicatorCap = Texts.clamp01(indicatorCap);
            baseConfidence = Texts.clamp01(baseConfidence);
            if (maxCaptureChars < 16) maxCaptureChars = 16;
            return this;
        }
    }

    private final Config cfg;
    private final RelationshipStore store;

    public TopicRelationshipMapper(RelationshipStore store) {
        this(store, new Config());
    }

    public TopicRelationshipMapper(RelationshipStore store, Config cfg) {
        this.store = Objects.requireNonNull(store, "store");
        this.cfg = (cfg == null ? new Config() : cfg).validate();
    }

    public RelationshipStore store() {
        return store;
    }

    /**
     * Relationships between {@code topics} asserted by the items' text. Deduplicated by unordered
     * pair and type, strongest kept. Never throws on malformed content.
     */
    public List<Relationship> extractRelationships(Collection<KnowledgeItem> items, Collection<String> topics) {
        if (items == null || items.isEmpty() || topics == null || topics.size() < 2) return List.of();

        LinkedHashSet<String> topicSet = new LinkedHashSet<>();
        for (String t : topics) {
            if (t != null && !t.isBlank()) topicSet.add(Texts.lower(t).trim());
        }
        if (topicSet.size() < 2) return List.of();

        LinkedHashMap<Relationship.Key, Relationship> best = new LinkedHashMap<>();
        for (KnowledgeItem item : items) {
            if (item == null) continue;
            try {
                extractFrom(item, topicSet, best);
            } catch (RuntimeException e) {
                log.warn("relationship extraction failed for item {}: {}", item.id, e.toString());
            }
        }
        return new ArrayList<>(best.values());
    }

    private void extractFrom(KnowledgeItem item, Set<String> topics, Map<Relationship.Key, Relationship> best) {
        String text = Texts.lower(item.fullText());
        if (text.isBlank()) return;

        for (String sentence : Texts.sentences(text)) {
            String s = stripTerminal(sentence);
            for (RelationshipPatterns.Entry e : RelationshipPatterns.TABLE) {
                Matcher m = e.pattern.matcher(s);
                if (!m.find()) continue;

                String left = Texts.head(m.group(1).trim(), cfg.maxCaptureChars);
                String right = Texts.head(m.group(2).trim(), cfg.maxCaptureChars);
                String t1 = resolve(left, topics, true);
                String t2 = resolve(right, topics, false);
                if (t1 == null || t2 == null || t1.equals(t2)) continue;

                if (e.direction == RelationshipPatterns.Direction.BACKWARD) {
                    String tmp = t1;
                    t1 = t2;
                    t2 = tmp;
                }
                double strength = strength(t1, t2, e.type, text);
                Relationship r = new Relationship(t1, t2, e.type, strength, cfg.baseConfidence, m.group(0), item.source);
                best.merge(r.key(), r, (a, b) -> b.strength > a.strength ? b : a);
            }
        }
    }

    /**
     * Topic named by a captured phrase: exact match, then the topic mentioned nearest to the
     * connective, then the captured phrase inside a topic, then shared words.
     */
    static String resolve(String phrase, Set<String> topics, boolean nearEnd) {
        if (phrase == null || phrase.isBlank()) return null;
        String p = phrase.trim();
        if (topics.contains(p)) return p;

        String chosen = null;
        int chosenPos = nearEnd ? -1 : Integer.MAX_VALUE;
        for (String t : topics) {
            int pos = nearEnd ? lastPhraseIndex(p, t) : firstPhraseIndex(p, t);
            if (pos < 0) continue;
            if (nearEnd ? pos > chosenPos : pos < chosenPos) {
                chosen = t;
                chosenPos = pos;
            }
        }
        if (chosen != null) return chosen;

        if (p.length() >= 4) {
            for (String t : topics) {
                if (Texts.containsPhrase(t, p)) return t;
            }
        }

        Set<String> pw = Texts.wordSet(p);
        for (String t : topics) {
            Set<String> tw = Texts.wordSet(t);
            int shared = 0;
            for (String w : tw) if (pw.contains(w)) shared++;
            if (!tw.isEmpty() && shared >= Math.min(tw.size(), 2)) return t;
        }
        return null;
    }

    double strength(String t1, String t2, RelationshipType type, String textLower) {
        double s = cfg.baseStrength;
        if (occurrences(textLower, t1) > 1 && occurrences(textLower, t2) > 1) s += cfg.repeatBonus;

        int indicators = 0;
        for (String stem : type.indicators()) {
            if (textLower.contains(stem)) indicators++;
        }
        if (indicators > 0) s += Math.min(indicators * cfg.indicatorStep, cfg.indicatorCap);
        return Math.min(1.0, s);
    }

    /**
     * Extracts relationships over all items of all topics, persists them, and returns the graph
     * topic -> outgoing relationships. Symmetric types also get the mirrored edge.
     */
    public Map<String, List<Relationship>> buildRelationshipGraph(Collection<String> topics,
                                                                 Map<String, List<KnowledgeItem>> knowledgeByTopic) {
        ArrayList<KnowledgeItem> all = new ArrayList<>();
        if (knowledgeByTopic != null) {
            for (List<KnowledgeItem> l : knowledgeByTopic.values()) {
                if (l != null) all.addAll(l);
            }
        }
        List<Relationship> rels = extractRelationships(all, topics);

        int stored = 0;
        LinkedHashMap<String, List<Relationship>> graph = new LinkedHashMap<>();
        for (Relationship r : rels) {
            if (store.upsert(r) != RelationshipStore.Upsert.DUPLICATE) stored++;
            graph.computeIfAbsent(r.topic1, k -> new ArrayList<>()).add(r);
            if (r.type.symmetric()) graph.computeIfAbsent(r.topic2, k -> new ArrayList<>()).add(r.mirrored());
        }
        if (log.isDebugEnabled()) {
            log.debug("relationship graph: topics={} relationships={} stored={}", topics, rels.size(), stored);
        }
        return graph;
    }

    /** Related topics from the store, optionally restricted to one type. */
    public List<String> findRelatedTopics(String topic, RelationshipType type, int maxResults) {
        ArrayList<String> out = new ArrayList<>();
        for (Relationship r : store.get(topic, type)) {
            if (maxResults > 0 && out.size() >= maxResults) break;
            String o = r.other(topic);
            if (o != null && !out.contains(o)) out.add(o);
        }
        return out;
    }

    public Optional<List<Relationship>> findCausalPath(String from, String to) {
        return store.findCausalPath(from, to, 4);
    }

    // -----------------------------------------------------------------------------------------

    private static String stripTerminal(String s) {
        String x = s.trim();
        while (!x.isEmpty() && ".!?;:".indexOf(x.charAt(x.length() - 1)) >= 0) x = x.substring(0, x.length() - 1);
        return x;
    }

    private static int firstPhraseIndex(String hay, String phrase) {
        int from = 0;
        while (true) {
            int idx = hay.indexOf(phrase, from);
            if (idx < 0) return -1;
            if (boundary(hay, idx, phrase.length())) return idx;
            from = idx + 1;
        }
    }

    private static int lastPhraseIndex(String hay, String phrase) {
        int from = hay.length();
        while (from >= 0) {
            int idx = hay.lastIndexOf(phrase, from);
            if (idx < 0) return -1;
            if (boundary(hay, idx, phrase.length())) return idx;
            from = idx - 1;
        }
        return -1;
    }

    private static boolean boundary(String hay, int idx, int len) {
        boolean left = idx == 0 || !Character.isLetterOrDigit(hay.charAt(idx - 1));
        int end = idx + len;
        boolean right = end >= hay.length() || !Character.isLetterOrDigit(hay.charAt(end));
        return left && right;
    }

    private static int occurrences(String hay, String needle) {
        if (needle.isEmpty()) return 0;
        int n = 0;
        int from = 0;
        while (true) {
            int idx = hay.indexOf(needle, from);
            if (idx < 0) return n;
            n++;
            from = idx + needle.length();
        }
    }
}
