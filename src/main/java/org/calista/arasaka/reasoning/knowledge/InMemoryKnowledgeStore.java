package org.calista.arasaka.reasoning.knowledge;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.arasaka.reasoning.text.Texts;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory {@link KnowledgeStore}.
 *
 * <p>Dedup is a {@code putIfAbsent} on the content hash, so two concurrent inserts of the same
 * content resolve without a lock: one wins, the other gets {@link AddResult#duplicate}.</p>
 *
 * <p>Search: case-insensitive substring of the whole query over topic/title/content. When the whole
 * phrase hits nothing, items containing every meaningful query word are returned instead.</p>
 */
public final class InMemoryKnowledgeStore implements KnowledgeStore {

    private static final Logger log = LogManager.getLogger(InMemoryKnowledgeStore.class);

    static final Comparator<KnowledgeItem> SEARCH_ORDER = Comparator
            .comparingDouble((KnowledgeItem k) -> k.confidence).reversed()
            .thenComparing(Comparator.comparingDouble((KnowledgeItem k) -> k.qualityScore).reversed())
            .thenComparingLong(k -> k.id);

    private final Map<Long, KnowledgeItem> byId = new ConcurrentHashMap<>();
    private final Map<String, Long> idByHash = new ConcurrentHashMap<>();
    private final AtomicLong seq = new AtomicLong();

    @Override
    public AddResult add(KnowledgeItem item) {
        Objects.requireNonNull(item, "item");
        KnowledgeItem k = item.copy().validate();
        if (!k.hasQualityScore()) k.qualityScore = KnowledgeQuality.qualityScore(k.content, k.title, k.source);

        long id = seq.incrementAndGet();
        Long prev = idByHash.putIfAbsent(k.contentHash, id);
        if (prev != null) {
            log.trace("duplicate content, existing id={}", prev);
            return AddResult.duplicate(prev);
        }
        k.id = id;
        byId.put(id, k);
        return AddResult.added(id);
    }

    @Override
    public List<KnowledgeItem> search(String query, String topic, int limit, double minConfidence) {
        String q = Texts.lower(query).trim();
        String t = Texts.lower(topic).trim();

        ArrayList<KnowledgeItem> hits = new ArrayList<>();
        for (KnowledgeItem k : byId.values()) {
            if (!accept(k, t, minConfidence)) continue;
            if (q.isEmpty() || containsPhrase(k, q)) hits.add(k);
        }

        if (hits.isEmpty() && !q.isEmpty()) {
            List<String> words = Texts.meaningfulWords(q, 2);
            if (words.size() > 1) {
                for (KnowledgeItem k : byId.values()) {
                    if (accept(k, t, minConfidence) && containsAllWords(k, words)) hits.add(k);
                }
            }
        }

        hits.sort(SEARCH_ORDER);
        if (limit > 0 && hits.size() > limit) return new ArrayList<>(hits.subList(0, limit));
        return hits;
    }

    @Override
    public Optional<KnowledgeItem> get(long id) {
        return Optional.ofNullable(byId.get(id));
    }

    @Override
    public List<KnowledgeItem> snapshotSorted() {
        ArrayList<KnowledgeItem> out = new ArrayList<>(byId.values());
        out.sort(Comparator.comparingLong(k -> k.id));
        return out;
    }

    @Override
    public int size() {
        return byId.size();
    }

    private static boolean accept(KnowledgeItem k, String topicLower, double minConfidence) {
        if (k.confidence < minConfidence) return false;
        return topicLower.isEmpty() || Texts.lower(k.topic).contains(topicLower);
    }

    private static boolean containsPhrase(KnowledgeItem k, String q) {
        return Texts.lower(k.topic).contains(q)
                || Texts.lower(k.title).contains(q)
                || Texts.lower(k.content).contains(q);
    }

    private static boolean containsAllWords(KnowledgeItem k, List<String> words) {
        String all = Texts.lower(k.topic) + " " + Texts.lower(k.title) + " " + Texts.lower(k.content);
        for (String w : words) {
            if (!all.contains(w)) return false;
        }
        return true;
    }
}
