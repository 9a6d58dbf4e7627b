package org.calista.arasaka.reasoning.synthesis;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.arasaka.reasoning.knowledge.KnowledgeItem;
import org.calista.arasaka.reasoning.relation.Relationship;
import org.calista.arasaka.reasoning.relation.RelationshipType;
import org.calista.arasaka.reasoning.relation.TopicRelationshipMapper;
import org.calista.arasaka.reasoning.text.SimpleTokenizer;
import org.calista.arasaka.reasoning.text.Texts;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Merges per-topic knowledge into one context block with relationship and conflict metadata.
 *
 * <p>Pure with respect to the stores: relationships found here are not persisted.</p>
 */
public final class KnowledgeSynthesizer {

    private static final Logger log = LogManager.getLogger(KnowledgeSynthesizer.class);

    public static final class Config {
        public int itemsPerTopic = 3;
        public int maxCharsPerItem = 300;
        public int maxRelationships = 5;
        /** items per topic the pairwise relationship detector looks at */
        public int relationshipItemsPerTopic = 3;
        /** shared words among the first 20 tokens for two items to be "about the same thing" */
        public int conflictMinSharedWords = 3;

        public Config validate() {
            if (itemsPerTopic < 1) itemsPerTopic = 1;
            if (maxCharsPerItem < 20) maxCharsPerItem = 20;
            if (maxRelationships < 0) maxRelationships = 0;
            if (relationshipItemsPerTopic < 1) relationshipItemsPerTopic = 1;
            if (conflictMinSharedWords < 1) conflictMinSharedWords = 1;
            return this;
        }
    }

    static final Set<String> NEGATION = Set.of("not", "no", "never", "none", "cannot", "doesn't", "don't", "isn't", "aren't");
    static final Set<String> POSITIVE = Set.of("is", "are", "has", "have", "can", "will", "does");

    private final Config cfg;
    private final TopicRelationshipMapper mapper;

    public KnowledgeSynthesizer(TopicRelationshipMapper mapper) {
        this(mapper, new Config());
    }

    public KnowledgeSynthesizer(TopicRelationshipMapper mapper, Config cfg) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.cfg = (cfg == null ? new Config() : cfg).validate();
    }

    public SynthesisResult synthesize(Map<String, List<KnowledgeItem>> knowledgeByTopic, String query) {
        return synthesize(knowledgeByTopic, query, null);
    }

    /**
     * @param previousContext optional text from earlier reasoning steps, placed first in the context
     */
    public SynthesisResult synthesize(Map<String, List<KnowledgeItem>> knowledgeByTopic, String query, String previousContext) {
        if (knowledgeByTopic == null || knowledgeByTopic.isEmpty()) return SynthesisResult.empty();

        ArrayList<KnowledgeItem> all = new ArrayList<>();
        for (List<KnowledgeItem> l : knowledgeByTopic.values()) if (l != null) all.addAll(l);

        List<Relationship> relationships = detectRelationships(knowledgeByTopic);
        List<Conflict> conflicts = identifyConflicts(all);
        String context = merge(knowledgeByTopic, relationships, previousContext);
        double quality = quality(context, relationships.size(), conflicts.size(), all.size());

        if (log.isDebugEnabled()) {
            log.debug("synthesis: topics={} items={} relationships={} conflicts={} quality={}",
                    knowledgeByTopic.size(), all.size(), relationships.size(), conflicts.size(),
                    String.format(Locale.ROOT, "%.2f", quality));
        }
        return new SynthesisResult(context, relationships, conflicts, quality,
                new ArrayList<>(knowledgeByTopic.keySet()), all.size());
    }

    /**
     * Context for one reasoning step: topics named in the step, or items sharing at least two words
     * with it.
     */
    public String createStepContext(String stepDescription, Map<String, List<KnowledgeItem>> knowledgeByTopic,
                                    List<String> previousSteps) {
        if (knowledgeByTopic == null || knowledgeByTopic.isEmpty()) return "";
        String step = Texts.lower(stepDescription);
        Set<String> stepWords = Texts.wordSet(step);

        LinkedHashMap<String, List<KnowledgeItem>> relevant = new LinkedHashMap<>();
        for (Map.Entry<String, List<KnowledgeItem>> e : knowledgeByTopic.entrySet()) {
            List<KnowledgeItem> items = e.getValue() == null ? List.of() : e.getValue();
            if (step.contains(Texts.lower(e.getKey()))) {
                relevant.put(e.getKey(), items);
                continue;
            }
            ArrayList<KnowledgeItem> hits = new ArrayList<>();
            for (KnowledgeItem k : items) {
                Set<String> cw = Texts.wordSet(k.content);
                int overlap = 0;
                for (String w : stepWords) if (cw.contains(w)) overlap++;
                if (overlap >= 2) hits.add(k);
            }
            if (!hits.isEmpty()) relevant.put(e.getKey(), hits);
        }

        String prev = previousSteps == null || previousSteps.isEmpty() ? null : String.join("\n", previousSteps);
        return synthesize(relevant, stepDescription, prev).synthesizedContext;
    }

    // -----------------------------------------------------------------------------------------

    List<Relationship> detectRelationships(Map<String, List<KnowledgeItem>> byTopic) {
        ArrayList<String> topics = new ArrayList<>(byTopic.keySet());
        ArrayList<Relationship> out = new ArrayList<>();
        Set<Relationship.Key> seen = new HashSet<>();

        for (int i = 0; i < topics.size(); i++) {
            for (int j = i + 1; j < topics.size(); j++) {
                String a = topics.get(i);
                String b = topics.get(j);
                if (Texts.lower(a).trim().equals(Texts.lower(b).trim())) continue;
                List<KnowledgeItem> ia = head(byTopic.get(a));
                List<KnowledgeItem> ib = head(byTopic.get(b));

                ArrayList<KnowledgeItem> pool = new ArrayList<>(ia);
                pool.addAll(ib);
                List<Relationship> found = mapper.extractRelationships(pool, List.of(a, b));
                if (found.isEmpty()) {
                    Relationship co = coMention(a, ia, b, ib);
                    if (co != null) found = List.of(co);
                }
                for (Relationship r : found) {
                    if (seen.add(r.key())) out.add(r);
                }
            }
        }
        out.sort((x, y) -> Double.compare(y.strength, x.strength));
        return out;
    }

    // one topic named inside the other's knowledge
    private static Relationship coMention(String a, List<KnowledgeItem> ia, String b, List<KnowledgeItem> ib) {
        String ca = joinedContent(ia);
        String cb = joinedContent(ib);
        if (Texts.containsPhrase(cb, Texts.lower(a))) {
            return new Relationship(a, b, RelationshipType.ASSOCIATIVE, 0.5, 0.5, "'" + a + "' mentioned in '" + b + "' knowledge");
        }
        if (Texts.containsPhrase(ca, Texts.lower(b))) {
            return new Relationship(a, b, RelationshipType.ASSOCIATIVE, 0.5, 0.5, "'" + b + "' mentioned in '" + a + "' knowledge");
        }
        return null;
    }

    List<Conflict> identifyConflicts(List<KnowledgeItem> all) {
        LinkedHashMap<String, List<KnowledgeItem>> groups = new LinkedHashMap<>();
        for (KnowledgeItem k : all) {
            String key = Texts.lower(k.topic) + ":" + Texts.lower(k.title);
            groups.computeIfAbsent(key, x -> new ArrayList<>()).add(k);
        }

        ArrayList<Conflict> out = new ArrayList<>();
        for (List<KnowledgeItem> g : groups.values()) {
            if (g.size() < 2) continue;
            for (int i = 0; i < g.size(); i++) {
                for (int j = i + 1; j < g.size(); j++) {
                    if (contradicts(g.get(i), g.get(j))) {
                        out.add(new Conflict(g.get(i), g.get(j), "contradiction", Conflict.Severity.MEDIUM));
                    }
                }
            }
        }
        return out;
    }

    private boolean contradicts(KnowledgeItem x, KnowledgeItem y) {
        Set<String> wx = Texts.wordSet(x.content);
        Set<String> wy = Texts.wordSet(y.content);
        boolean negX = intersects(wx, NEGATION);
        boolean negY = intersects(wy, NEGATION);
        boolean posX = intersects(wx, POSITIVE);
        boolean posY = intersects(wy, POSITIVE);
        if (!((negX && posY) || (negY && posX))) return false;

        Set<String> hx = firstWords(x.content, 20);
        Set<String> hy = firstWords(y.content, 20);
        int shared = 0;
        for (String w : hx) if (hy.contains(w)) shared++;
        return shared >= cfg.conflictMinSharedWords;
    }

    String merge(Map<String, List<KnowledgeItem>> byTopic, List<Relationship> relationships, String previousContext) {
        ArrayList<String> parts = new ArrayList<>();
        if (previousContext != null && !previousContext.isBlank()) {
            parts.add("Previous context: " + previousContext);
            parts.add("");
        }

        for (Map.Entry<String, List<KnowledgeItem>> e : byTopic.entrySet()) {
            List<KnowledgeItem> items = e.getValue();
            if (items == null || items.isEmpty()) continue;
            parts.add("Knowledge about '" + e.getKey() + "':");
            int n = 0;
            for (KnowledgeItem k : items) {
                if (n >= cfg.itemsPerTopic) break;
                if (k.content == null || k.content.isBlank()) continue;
                parts.add("  [" + k.source + "] " + (k.title == null ? "" : k.title) + ": "
                        + Texts.truncate(k.content, cfg.maxCharsPerItem));
                n++;
            }
            parts.add("");
        }

        if (!relationships.isEmpty() && cfg.maxRelationships > 0) {
            parts.add("Relationships between topics:");
            for (int i = 0; i < relationships.size() && i < cfg.maxRelationships; i++) {
                parts.add("  - " + relationships.get(i).describe());
            }
            parts.add("");
        }
        return String.join("\n", parts);
    }

    /**
     * 0.3 for a 200..2000 char context (0.2 when longer), + min(0.1 per relationship, 0.3),
     * - min(0.1 per conflict, 0.3), + 0.2 for three or more items (0.1 for one); within [0, 1].
     */
    static double quality(String context, int relationships, int conflicts, int totalItems) {
        int len = context == null ? 0 : context.length();
        double s = 0.0;
        if (len >= 200 && len <= 2000) s += 0.3;
        else if (len > 200) s += 0.2;

        if (relationships > 0) s += Math.min(relationships * 0.1, 0.3);
        if (conflicts > 0) s -= Math.min(conflicts * 0.1, 0.3);

        if (totalItems >= 3) s += 0.2;
        else if (totalItems >= 1) s += 0.1;
        return Texts.clamp01(s);
    }

    // -----------------------------------------------------------------------------------------

    private List<KnowledgeItem> head(List<KnowledgeItem> l) {
        if (l == null || l.isEmpty()) return List.of();
        return l.size() <= cfg.relationshipItemsPerTopic ? l : l.subList(0, cfg.relationshipItemsPerTopic);
    }

    private static String joinedContent(List<KnowledgeItem> items) {
        StringBuilder sb = new StringBuilder();
        for (KnowledgeItem k : items) {
            if (k.content == null) continue;
            if (sb.length() > 0) sb.append(' ');
            sb.append(Texts.lower(k.content));
        }
        return sb.toString();
    }

    private static Set<String> firstWords(String text, int n) {
        List<String> toks = SimpleTokenizer.INSTANCE.tokenize(text);
        return new HashSet<>(toks.size() <= n ? toks : toks.subList(0, n));
    }

    private static boolean intersects(Set<String> a, Set<String> b) {
        for (String x : b) if (a.contains(x)) return true;
        return false;
    }
}
