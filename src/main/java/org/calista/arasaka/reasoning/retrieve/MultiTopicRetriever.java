package org.calista.arasaka.reasoning.retrieve;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.arasaka.reasoning.analysis.Domain;
import org.calista.arasaka.reasoning.analysis.QueryAnalysis;
import org.calista.arasaka.reasoning.analysis.QueryAnalyzer;
import org.calista.arasaka.reasoning.knowledge.KnowledgeItem;
import org.calista.arasaka.reasoning.knowledge.KnowledgeQuality;
import org.calista.arasaka.reasoning.knowledge.KnowledgeStore;
import org.calista.arasaka.reasoning.retrieve.scorer.RelevanceScorer;
import org.calista.arasaka.reasoning.text.Texts;
import org.calista.arasaka.reasoning.util.Pools;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * MultiTopicRetriever: topic identification and per-topic knowledge fan-out.
 *
 * <p>Each topic is looked up in the {@link KnowledgeStore}, filtered by the quality gate, re-scored
 * against the original query and cut to the top N. In parallel mode lookups run on an owned bounded
 * pool (at most {@code maxParallelism} threads, so a call uses min(#topics, maxParallelism)). Every
 * lookup has its own timeout capped by the batch deadline; a failed or timed out lookup yields an
 * empty list for that topic only.</p>
 */
public final class MultiTopicRetriever implements AutoCloseable {

    private static final Logger log = LogManager.getLogger(MultiTopicRetriever.class);

    private final Config cfg;
    private final KnowledgeStore store;
    private final QueryAnalyzer analyzer;
    private final RelevanceScorer scorer;
    private final KnowledgeQuality quality;
    private final ResearchSource research; // nullable

    private final ExecutorService pool;
    private final boolean ownsPool;

    private final AtomicLong lookups = new AtomicLong();
    private final AtomicLong failedLookups = new AtomicLong();
    private final AtomicLong researchCalls = new AtomicLong();

    private MultiTopicRetriever(Builder b) {
        this.cfg = b.config.validate();
        this.store = Objects.requireNonNull(b.store, "store");
        this.analyzer = b.analyzer != null ? b.analyzer : new QueryAnalyzer();
        this.scorer = Objects.requireNonNull(b.scorer, "scorer");
        this.quality = b.quality != null ? b.quality : new KnowledgeQuality(new KnowledgeQuality.Config());
        this.research = b.research;

        this.ownsPool = (b.pool == null);
        this.pool = ownsPool
                ? Pools.newBoundedPool(cfg.threadNamePrefix, cfg.maxParallelism, cfg.queueCapacity)
                : b.pool;
    }

    public static Builder builder(KnowledgeStore store, RelevanceScorer scorer) {
        return new Builder(store, scorer);
    }

    public Config config() {
        return cfg;
    }

    // ---------------------------------------------------------------------
    // Topic identification
    // ---------------------------------------------------------------------

    public List<TopicInfo> identifyTopics(String query, int maxTopics) {
        return identifyTopics(query, analyzer.analyze(query), maxTopics);
    }

    /**
     * Analyzer topics then entities (longer than 3 chars), deduplicated case-insensitively, scored by
     * {@link #topicRelevance}, best first, at most {@code maxTopics}.
     */
    public List<TopicInfo> identifyTopics(String query, QueryAnalysis analysis, int maxTopics) {
        if (query == null || query.isBlank()) return List.of();
        QueryAnalysis a = analysis != null ? analysis : analyzer.analyze(query);

        Domain queryDomain = Domain.classify(query);
        Set<String> seen = new HashSet<>();
        ArrayList<TopicInfo> out = new ArrayList<>();

        for (String t : a.topics) {
            if (!seen.add(t.toLowerCase(Locale.ROOT))) continue;
            out.add(new TopicInfo(t, topicDomain(t, query), topicRelevance(t, query, queryDomain), TopicInfo.Origin.TOPIC_EXTRACTION));
        }
        for (String e : a.entities) {
            if (e.length() <= 3 || !seen.add(e.toLowerCase(Locale.ROOT))) continue;
            out.add(new TopicInfo(e, topicDomain(e, query), topicRelevance(e, query, queryDomain), TopicInfo.Origin.ENTITY_EXTRACTION));
        }

        out.sort((x, y) -> Double.compare(y.relevanceScore, x.relevanceScore));
        int cap = maxTopics > 0 ? maxTopics : cfg.maxTopics;
        return out.size() > cap ? List.copyOf(out.subList(0, cap)) : List.copyOf(out);
    }

    /** Domain of the topic text; the query is consulted only when the topic alone says nothing. */
    static Domain topicDomain(String topic, String query) {
        Domain d = Domain.classify(topic);
        if (d != Domain.GENERAL) return d;
        return Domain.classify(topic + " " + query);
    }

    /**
     * +0.5 substring of the query, + word overlap / query words * 0.3, +0.2 for 2-4 words,
     * +0.1 when the topic's domain is the query's (non-general) domain; capped at 1.
     */
    static double topicRelevance(String topic, String query, Domain queryDomain) {
        String t = Texts.lower(topic).trim();
        String q = Texts.lower(query).trim();
        double s = 0.0;
        if (q.contains(t) || t.contains(q)) s += 0.5;

        Set<String> tw = Texts.wordSet(t);
        Set<String> qw = Texts.wordSet(q);
        if (!qw.isEmpty()) {
            int overlap = 0;
            for (String w : tw) if (qw.contains(w)) overlap++;
            s += (overlap / (double) qw.size()) * 0.3;
        }
        if (tw.size() >= 2 && tw.size() <= 4) s += 0.2;

        Domain td = Domain.classify(topic);
        if (td == queryDomain && td != Domain.GENERAL) s += 0.1;
        return Math.min(1.0, s);
    }

    // ---------------------------------------------------------------------
    // Retrieval
    // ---------------------------------------------------------------------

    /** Topics identified from the query, then retrieved with config defaults. */
    public MultiTopicKnowledge retrieveForQuery(String query) {
        QueryAnalysis a = analyzer.analyze(query);
        List<TopicInfo> topics = identifyTopics(query, a, cfg.maxTopics);
        Map<String, List<KnowledgeItem>> byTopic = retrieve(query, a, topics, cfg.maxPerTopic, cfg.parallel);
        return new MultiTopicKnowledge(query, topics, byTopic);
    }

    public Map<String, List<KnowledgeItem>> retrieve(String query, List<TopicInfo> topics, int maxPerTopic, boolean parallel) {
        return retrieve(query, analyzer.analyze(query), topics, maxPerTopic, parallel);
    }

    /**
     * @return topic -> best items for the original query; every requested topic is present,
     * possibly with an empty list. Never throws for lookup failures.
     */
    public Map<String, List<KnowledgeItem>> retrieve(String query, QueryAnalysis analysis, List<TopicInfo> topics,
                                                     int maxPerTopic, boolean parallel) {
        LinkedHashMap<String, List<KnowledgeItem>> out = new LinkedHashMap<>();
        if (topics == null || topics.isEmpty()) return out;
        int perTopic = maxPerTopic > 0 ? maxPerTopic : cfg.maxPerTopic;

        if (!parallel || topics.size() == 1) {
            for (TopicInfo t : topics) out.put(t.topic, retrieveIsolated(t.topic, query, analysis, perTopic));
            return out;
        }

        long start = System.nanoTime();
        long batchDeadline = start + TimeUnit.MILLISECONDS.toNanos(cfg.batchTimeoutMs);

        ArrayList<Future<List<KnowledgeItem>>> futures = new ArrayList<>(topics.size());
        for (TopicInfo t : topics) {
            futures.add(pool.submit(() -> retrieveTopic(t.topic, query, analysis, perTopic)));
        }

        for (int i = 0; i < topics.size(); i++) {
            String topic = topics.get(i).topic;
            Future<List<KnowledgeItem>> f = futures.get(i);
            long topicDeadline = start + TimeUnit.MILLISECONDS.toNanos(cfg.perTopicTimeoutMs);
            long waitNs = Math.max(0L, Math.min(topicDeadline, batchDeadline) - System.nanoTime());
            try {
                out.put(topic, f.get(waitNs, TimeUnit.NANOSECONDS));
            } catch (TimeoutException e) {
                f.cancel(true);
                failedLookups.incrementAndGet();
                log.warn("topic lookup timed out: '{}' after {} ms", topic, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
                out.put(topic, List.of());
            } catch (ExecutionException e) {
                failedLookups.incrementAndGet();
                log.warn("topic lookup failed: '{}': {}", topic, String.valueOf(e.getCause()));
                out.put(topic, List.of());
            } catch (CancellationException e) {
                failedLookups.incrementAndGet();
                log.warn("topic lookup cancelled: '{}'", topic);
                out.put(topic, List.of());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                for (int j = i; j < futures.size(); j++) {
                    futures.get(j).cancel(true);
                    out.putIfAbsent(topics.get(j).topic, List.of());
                }
                log.warn("multi-topic retrieval interrupted; remaining topics left empty");
                return out;
            }
        }

        if (log.isDebugEnabled()) {
            log.debug("multi-topic retrieval: topics={} items={} in {} ms", out.keySet(),
                    out.values().stream().mapToInt(List::size).sum(),
                    TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
        }
        return out;
    }

    private List<KnowledgeItem> retrieveIsolated(String topic, String query, QueryAnalysis analysis, int perTopic) {
        try {
            return retrieveTopic(topic, query, analysis, perTopic);
        } catch (RuntimeException e) {
            failedLookups.incrementAndGet();
            log.warn("topic lookup failed: '{}': {}", topic, e.toString());
            return List.of();
        }
    }

    /**
     * One topic: store lookup, quality gate, optional research top-up, relevance against the
     * original query. Items the scorer rejects (score 0) are dropped.
     */
    List<KnowledgeItem> retrieveTopic(String topic, String query, QueryAnalysis analysis, int perTopic) {
        lookups.incrementAndGet();
        List<KnowledgeItem> raw = store.search(topic, null, perTopic * cfg.fetchMultiplier, cfg.minConfidence);

        ArrayList<KnowledgeItem> candidates = new ArrayList<>(quality.filter(raw));
        if (research != null && candidates.size() < cfg.researchWhenBelow) {
            candidates.addAll(learn(topic, candidates));
        }

        List<Scored<KnowledgeItem>> scored = scorer.filterByRelevance(query, candidates, analysis, cfg.minRelevance);
        ArrayList<KnowledgeItem> out = new ArrayList<>(Math.min(perTopic, scored.size()));
        for (Scored<KnowledgeItem> s : scored) {
            if (s.score <= 0.0) continue;
            out.add(s.item);
            if (out.size() >= perTopic) break;
        }
        return out;
    }

    private List<KnowledgeItem> learn(String topic, List<KnowledgeItem> have) {
        researchCalls.incrementAndGet();
        List<KnowledgeItem> found;
        try {
            found = research.searchAndLearn(topic);
        } catch (RuntimeException e) {
            log.warn("research source failed for '{}': {}", topic, e.toString());
            return List.of();
        }
        if (found == null || found.isEmpty()) return List.of();

        LinkedHashSet<String> known = new LinkedHashSet<>();
        for (KnowledgeItem k : have) if (k.contentHash != null) known.add(k.contentHash);

        ArrayList<KnowledgeItem> out = new ArrayList<>();
        int learned = 0;
        for (KnowledgeItem k : found) {
            if (k == null || k.content == null || k.content.isBlank()) continue;
            KnowledgeStore.AddResult r = store.add(k);
            if (!r.duplicate) learned++;
            KnowledgeItem stored = store.get(r.id).orElse(null);
            if (stored == null || !quality.passes(stored) || !known.add(stored.contentHash)) continue;
            out.add(stored);
        }
        if (log.isDebugEnabled()) log.debug("research '{}': found={} learned={}", topic, found.size(), learned);
        return out;
    }

    // ---------------------------------------------------------------------
    // Lifecycle / stats
    // ---------------------------------------------------------------------

    public long lookups() {
        return lookups.get();
    }

    public long failedLookups() {
        return failedLookups.get();
    }

    public long researchCalls() {
        return researchCalls.get();
    }

    @Override
    public void close() {
        if (ownsPool) {
            Pools.shutdown(pool, cfg.shutdownTimeoutMs, "topic retrieval pool");
        } else {
            log.debug("MultiTopicRetriever.close(): pool is externally owned; skipping shutdown");
        }
    }

    // ---------------------------------------------------------------------
    // Builder / Config
    // ---------------------------------------------------------------------

    public static final class Builder {
        private final KnowledgeStore store;
        private final RelevanceScorer scorer;
        private QueryAnalyzer analyzer;
        private KnowledgeQuality quality;
        private ResearchSource research;
        private ExecutorService pool;
        private Config config = new Config();

        private Builder(KnowledgeStore store, RelevanceScorer scorer) {
            this.store = Objects.requireNonNull(store, "store");
            this.scorer = Objects.requireNonNull(scorer, "scorer");
        }

        public Builder config(Config cfg) {
            this.config = Objects.requireNonNull(cfg, "config");
            return this;
        }

        public Builder analyzer(QueryAnalyzer analyzer) {
            this.analyzer = Objects.requireNonNull(analyzer, "analyzer");
            return this;
        }

        public Builder quality(KnowledgeQuality quality) {
            this.quality = Objects.requireNonNull(quality, "quality");
            return this;
        }

        /** Optional; null disables research top-up. */
        public Builder research(ResearchSource research) {
            this.research = research;
            return this;
        }

        /** External pool; the retriever will not shut it down. */
        public Builder pool(ExecutorService pool) {
            this.pool = Objects.requireNonNull(pool, "pool");
            return this;
        }

        public MultiTopicRetriever build() {
            return new MultiTopicRetriever(this);
        }
    }

    public static final class Config {
        public int maxTopics = 5;
        public int maxPerTopic = 5;
        public boolean parallel = true;
        public int maxParallelism = 5;
        public long perTopicTimeoutMs = 3_000;
        public long batchTimeoutMs = 8_000;

        /** store candidates fetched per topic = maxPerTopic * fetchMultiplier */
        public int fetchMultiplier = 4;
        public double minConfidence = 0.0;
        /** on top of the scorer's own rejections */
        public double minRelevance = 0.0;
        /** research source is asked when fewer candidates than this survive the quality gate */
        public int researchWhenBelow = 1;

        public int queueCapacity = 64;
        public long shutdownTimeoutMs = 2_500;
        public String threadNamePrefix = "topic-retrieval-";

        public Config validate() {
            if (maxTopics < 1) maxTopics = 1;
            if (maxPerTopic < 1) maxPerTopic = 1;
            if (maxParallelism < 1) maxParallelism = 1;
            if (perTopicTimeoutMs < 1) perTopicTimeoutMs = 1;
            if (batchTimeoutMs < perTopicTimeoutMs) batchTimeoutMs = perTopicTimeoutMs;
            if (fetchMultiplier < 1) fetchMultiplier = 1;
            minConfidence = Texts.clamp01(minConfidence);
            minRelevance = Texts.clamp01(minRelevance);
            if (researchWhenBelow < 0) researchWhenBelow = 0;
            if (queueCapacity < 1) queueCapacity = 1;
            if (shutdownTimeoutMs < 250) shutdownTimeoutMs = 250;
            if (threadNamePrefix == null || threadNamePrefix.isBlank()) threadNamePrefix = "topic-retrieval-";
            return this;
        }
    }
}
