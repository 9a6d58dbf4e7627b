package org.calista.arasaka.reasoning.reason;

import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.calista.arasaka.reasoning.analysis.Domain;
import org.calista.arasaka.reasoning.analysis.QueryAnalysis;
import org.calista.arasaka.reasoning.analysis.QueryAnalyzer;
import org.calista.arasaka.reasoning.analysis.ReasoningType;
import org.calista.arasaka.reasoning.cache.Cache;
import org.calista.arasaka.reasoning.cache.CacheStats;
import org.calista.arasaka.reasoning.cache.TtlCache;
import org.calista.arasaka.reasoning.knowledge.KnowledgeItem;
import org.calista.arasaka.reasoning.relation.Relationship;
import org.calista.arasaka.reasoning.relation.TopicRelationshipMapper;
import org.calista.arasaka.reasoning.retrieve.MultiTopicRetriever;
import org.calista.arasaka.reasoning.retrieve.TopicInfo;
import org.calista.arasaka.reasoning.synthesis.KnowledgeSynthesizer;
import org.calista.arasaka.reasoning.synthesis.SynthesisResult;
import org.calista.arasaka.reasoning.text.Texts;
import org.calista.arasaka.reasoning.util.Pools;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * ReasoningEngine: chain-of-thought orchestrator.
 *
 * <p>One call walks {@link ChainState.Phase} in order:
 * cache check, analysis, decomposition into template steps, the step loop (strictly sequential,
 * every step sees what the earlier ones accumulated), conclusion, verification, quality score and
 * cache store. A cache hit returns immediately and touches no retrieval.</p>
 *
 * <p>Collaborators are optional: without a retriever the engine reasons over the knowledge the
 * caller passes; without a synthesizer relationships come from the mapper, if any.</p>
 *
 * <p>Ownership: the engine owns its batch pool unless one is injected.</p>
 */
public final class ReasoningEngine implements AutoCloseable {

    private static final Logger log = LogManager.getLogger(ReasoningEngine.class);

    /** Bucket for caller-supplied knowledge without a topic. */
    static final String SUPPLIED_TOPIC = "general";

    private final Config cfg;
    private final QueryAnalyzer analyzer;
    private final MultiTopicRetriever retriever;       // nullable
    private final KnowledgeSynthesizer synthesizer;    // nullable
    private final TopicRelationshipMapper mapper;       // nullable
    private final Cache<String, ReasoningChain> cache;
    private final LongSupplier clock;

    private final ExecutorService pool;
    private final boolean ownsPool;

    private final AtomicLong requestSeq = new AtomicLong();
    private final AtomicLong cacheHits = new AtomicLong();
    private final AtomicLong cacheMisses = new AtomicLong();

    // running averages; guarded by "this"
    private long chains;
    private long totalSteps;
    private double sumConfidence;
    private double sumQuality;
    private long sumProcessingMs;

    private ReasoningEngine(Builder b) {
        this.cfg = b.config.validate();
        this.analyzer = b.analyzer != null ? b.analyzer : new QueryAnalyzer();
        this.retriever = b.retriever;
        this.synthesizer = b.synthesizer;
        this.mapper = b.mapper;
        this.clock = b.clock != null ? b.clock : System::currentTimeMillis;
        this.cache = b.cache != null
                ? b.cache
                : TtlCache.<String, ReasoningChain>builder()
                .name("reasoning-chains")
                .ttl(Duration.ofSeconds(cfg.cacheTtlSeconds))
                .maxSize(cfg.cacheMaxSize)
                .clock(clock)
                .build();

        this.ownsPool = (b.pool == null);
        this.pool = ownsPool
                ? Pools.newBoundedPool(cfg.threadNamePrefix, cfg.batchParallelism, cfg.queueCapacity)
                : b.pool;

        log.info("ReasoningEngine created: maxSteps={} cacheTtl={}s cacheMax={} iterative={} retriever={} synthesizer={} mapper={}",
                cfg.maxSteps, cfg.cacheTtlSeconds, cfg.cacheMaxSize, cfg.iterative,
                retriever != null, synthesizer != null, mapper != null);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Config config() {
        return cfg;
    }

    public QueryAnalyzer analyzer() {
        return analyzer;
    }

    // ---------------------------------------------------------------------
    // Main entry points
    // ---------------------------------------------------------------------

    public ReasoningChain generateReasoningChain(String query) {
        return generateReasoningChain(query, null, null, null, cfg.iterative);
    }

    public ReasoningChain generateReasoningChain(String query, List<String> context, List<KnowledgeItem> knowledge) {
        return generateReasoningChain(query, context, knowledge, null, cfg.iterative);
    }

    /**
     * Builds (or returns the cached) chain for {@code query}. Never fails for a non-null query:
     * degraded inputs only lower the scores.
     *
     * @param context             previous conversation turns, nullable
     * @param knowledge           flat caller knowledge, nullable
     * @param multiTopicKnowledge caller knowledge per topic, nullable; disables retrieval when non-empty
     * @param iterative           retrieve fresh knowledge for every step
     */
    public ReasoningChain generateReasoningChain(String query, List<String> context, List<KnowledgeItem> knowledge,
                                                 Map<String, List<KnowledgeItem>> multiTopicKnowledge, boolean iterative) {
        Objects.requireNonNull(query, "query");
        final String reqId = "r" + Long.toString(requestSeq.incrementAndGet(), 36);
        try (final CloseableThreadContext.Instance ctc = CloseableThreadContext.put("req", reqId)) {
            ChainState st = new ChainState(query, cacheKey(query), context, knowledge, multiTopicKnowledge,
                    iterative, System.nanoTime());
            run(st);
            return st.result;
        }
    }

    static String cacheKey(String query) {
        return KnowledgeItem.hashContent(query);
    }

    private void run(ChainState st) {
        while (st.phase != ChainState.Phase.RETURN) {
            switch (st.phase) {
                case CACHE_CHECK -> cacheCheck(st);
                case ANALYZE -> analyze(st);
                case DECOMPOSE -> decompose(st);
                case STEP_LOOP -> stepLoop(st);
                case SYNTHESIZE -> synthesize(st);
                case VERIFY -> verify(st);
                case SCORE -> score(st);
                case CACHE_STORE -> cacheStore(st);
                default -> throw new IllegalStateException("unexpected phase " + st.phase);
            }
        }
    }

    // ---------------------------------------------------------------------
    // Phases
    // ---------------------------------------------------------------------

    private void cacheCheck(ChainState st) {
        if (cfg.cacheEnabled) {
            ReasoningChain hit = cache.get(st.cacheKey).orElse(null);
            if (hit != null) {
                cacheHits.incrementAndGet();
                st.result = hit.copy();
                st.fromCache = true;
                log.debug("chain cache hit type={} steps={}", hit.reasoningType.label(), hit.steps.size());
                st.phase = ChainState.Phase.RETURN;
                return;
            }
            cacheMisses.incrementAndGet();
        }
        st.phase = ChainState.Phase.ANALYZE;
    }

    private void analyze(ChainState st) {
        st.analysis = analyzer.analyze(st.query, st.context);
        if (log.isDebugEnabled()) {
            log.debug("analysis type={} intent={} complexity={} topics={} multiTopic={}",
                    st.analysis.reasoningType.label(), st.analysis.intent.label(),
                    fmt2(st.analysis.complexity), st.analysis.topics, st.analysis.requiresMultiTopic);
        }
        st.phase = ChainState.Phase.DECOMPOSE;
    }

    private void decompose(ChainState st) {
        List<ReasoningStep> steps = StepTemplates.decompose(st.analysis.reasoningType, st.query, st.analysis.arithmetic());
        if (steps.size() > cfg.maxSteps) steps = new ArrayList<>(steps.subList(0, cfg.maxSteps));
        st.steps = ChainOperations.topologicalSort(ChainOperations.resolveDependencies(steps));

        for (String t : st.analysis.topics) addTopic(st, t);
        seedKnowledge(st);

        log.debug("decomposed into {} steps", st.steps.size());
        st.phase = ChainState.Phase.STEP_LOOP;
    }

    /** Caller knowledge first; otherwise one retrieval for the whole query unless iterative. */
    private void seedKnowledge(ChainState st) {
        if (st.suppliedByTopic != null && !st.suppliedByTopic.isEmpty()) {
            for (Map.Entry<String, List<KnowledgeItem>> e : st.suppliedByTopic.entrySet()) {
                mergeKnowledge(st, e.getKey(), e.getValue());
            }
        }
        for (KnowledgeItem k : st.suppliedKnowledge) {
            if (k == null) continue;
            String topic = k.topic == null || k.topic.isBlank() ? SUPPLIED_TOPIC : k.topic;
            mergeKnowledge(st, topic, List.of(k));
        }
        if (!st.accumulated.isEmpty() || retriever == null || st.iterative) return;
        if (st.analysis.arithmetic().isPresent()) return;
        retrieveInto(st, st.query, st.analysis);
    }

    private void stepLoop(ChainState st) {
        ReasoningStep previous = null;
        int knowledgeSeenByDetector = -1;

        for (ReasoningStep step : st.steps) {
            long t0 = System.nanoTime();

            // (a) step knowledge
            if (st.iterative && retriever != null && !hasSuppliedKnowledge(st)) {
                String stepQuery = st.query + " " + step.description;
                retrieveInto(st, stepQuery, null);
            }
            List<KnowledgeItem> stepItems = rankForStep(st, step);

            if (!step.hasReasoning()) {
                // (b) evidence
                step.evidence.addAll(collectEvidence(st.query, stepItems));
                for (KnowledgeItem k : stepItems) step.knowledgeUsed.add(label(k));

                // (c) reasoning text
                String snippet = stepItems.isEmpty() ? null : stepItems.get(0).content;
                step.reasoning = StepPhrases.compose(st.query, step.description,
                        previous == null ? null : previous.reasoning, snippet,
                        cfg.previousChars, cfg.knowledgeChars);

                // (d) confidence
                double base = assessConfidence(step, stepItems.size());
                step.confidence = calibrateConfidence(base, step.evidence.size(), stepItems.size(),
                        stepVerified(step, st.steps));
            }

            // (e) relationships over what we know so far
            int known = st.accumulatedItems();
            if (st.accumulated.size() >= 2 && known != knowledgeSeenByDetector) {
                detectRelationships(st, step, previous);
                knowledgeSeenByDetector = known;
            }

            // (f) rolling context
            st.rollingContext.add(step.reasoning);
            step.executionTimeMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0);
            previous = step;

            if (log.isDebugEnabled()) {
                log.debug("step {} '{}' conf={} evidence={} knowledge={}", step.stepNumber, step.description,
                        fmt2(step.confidence), step.evidence.size(), step.knowledgeUsed.size());
            }
        }
        st.phase = ChainState.Phase.SYNTHESIZE;
    }

    private void synthesize(ChainState st) {
        st.conclusion = ChainOperations.conclude(st.analysis.reasoningType, st.steps, new ArrayList<>(st.relationships.values()));
        st.phase = ChainState.Phase.VERIFY;
    }

    private void verify(ChainState st) {
        st.verified = ChainOperations.verify(st.steps, st.conclusion, cfg.minConfidenceThreshold);
        if (!st.verified && log.isDebugEnabled()) {
            log.debug("chain failed verification: {}", ChainValidator.validateChain(buildChain(st)));
        }
        st.phase = ChainState.Phase.SCORE;
    }

    private void score(ChainState st) {
        st.quality = ChainOperations.quality(st.steps, st.verified, cfg.maxSteps);
        st.phase = ChainState.Phase.CACHE_STORE;
    }

    private void cacheStore(ChainState st) {
        ReasoningChain chain = buildChain(st);
        // the caller's steps are mutable, the cache keeps its own
        if (cfg.cacheEnabled) cache.put(st.cacheKey, chain.copy());
        record(chain);
        st.result = chain;

        log.debug("chain done type={} steps={} conf={} quality={} verified={} retrievals={} in {} ms",
                chain.reasoningType.label(), chain.steps.size(), fmt2(chain.confidence), fmt2(chain.qualityScore),
                chain.verificationResult, st.retrievals, chain.processingTimeMs);
        st.phase = ChainState.Phase.RETURN;
    }

    private ReasoningChain buildChain(ChainState st) {
        LinkedHashSet<Domain> domains = new LinkedHashSet<>(st.analysis.domains);
        return ReasoningChain.builder(st.query, st.analysis.reasoningType)
                .steps(st.steps)
                .conclusion(st.conclusion)
                .confidence(Texts.clamp01(ChainOperations.meanConfidence(st.steps)))
                .verificationResult(st.verified)
                .qualityScore(st.quality)
                .topicsInvolved(st.topics)
                .relationships(new ArrayList<>(st.relationships.values()))
                .domains(new ArrayList<>(domains))
                .processingTimeMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - st.startNanos))
                .build();
    }

    // ---------------------------------------------------------------------
    // Step helpers
    // ---------------------------------------------------------------------

    private static boolean hasSuppliedKnowledge(ChainState st) {
        return (st.suppliedByTopic != null && !st.suppliedByTopic.isEmpty()) || !st.suppliedKnowledge.isEmpty();
    }

    private void retrieveInto(ChainState st, String query, QueryAnalysis analysis) {
        try {
            MultiTopicRetriever.Config rc = retriever.config();
            List<TopicInfo> topics = analysis != null
                    ? retriever.identifyTopics(query, analysis, rc.maxTopics)
                    : retriever.identifyTopics(query, rc.maxTopics);
            if (topics.isEmpty()) return;
            st.retrievals++;
            Map<String, List<KnowledgeItem>> found = analysis != null
                    ? retriever.retrieve(query, analysis, topics, rc.maxPerTopic, rc.parallel)
                    : retriever.retrieve(query, topics, rc.maxPerTopic, rc.parallel);
            for (Map.Entry<String, List<KnowledgeItem>> e : found.entrySet()) mergeKnowledge(st, e.getKey(), e.getValue());
        } catch (RuntimeException e) {
            log.warn("retrieval for '{}' failed, continuing without it: {}", Texts.truncate(query, 80), e.toString());
        }
    }

    private static void mergeKnowledge(ChainState st, String topic, List<KnowledgeItem> items) {
        if (topic == null || topic.isBlank()) topic = SUPPLIED_TOPIC;
        List<KnowledgeItem> bucket = st.accumulated.computeIfAbsent(topic, k -> new ArrayList<>());
        addTopic(st, topic);
        if (items == null) return;

        Set<String> have = new HashSet<>();
        for (List<KnowledgeItem> l : st.accumulated.values()) for (KnowledgeItem k : l) have.add(identity(k));
        for (KnowledgeItem k : items) {
            if (k == null || k.content == null || k.content.isBlank()) continue;
            if (have.add(identity(k))) bucket.add(k);
        }
    }

    private static void addTopic(ChainState st, String topic) {
        if (topic == null || topic.isBlank() || SUPPLIED_TOPIC.equals(topic)) return;
        String lower = topic.toLowerCase(Locale.ROOT);
        for (String t : st.topics) if (t.toLowerCase(Locale.ROOT).equals(lower)) return;
        st.topics.add(topic);
    }

    private static String identity(KnowledgeItem k) {
        return k.contentHash != null ? k.contentHash : "c:" + k.content.trim();
    }

    /** Accumulated items ordered by word overlap with query + step description; ties keep arrival order. */
    private List<KnowledgeItem> rankForStep(ChainState st, ReasoningStep step) {
        if (st.accumulated.isEmpty()) return List.of();
        Set<String> want = Texts.meaningfulWordSet(st.query + " " + step.description, 2);

        ArrayList<KnowledgeItem> all = new ArrayList<>();
        ArrayList<Integer> overlaps = new ArrayList<>();
        for (List<KnowledgeItem> l : st.accumulated.values()) {
            for (KnowledgeItem k : l) {
                Set<String> words = Texts.meaningfulWordSet(k.fullText(), 2);
                int o = 0;
                for (String w : want) if (words.contains(w)) o++;
                all.add(k);
                overlaps.add(o);
            }
        }
        ArrayList<Integer> idx = new ArrayList<>(all.size());
        for (int i = 0; i < all.size(); i++) idx.add(i);
        idx.sort((a, b) -> Integer.compare(overlaps.get(b), overlaps.get(a)));

        int n = Math.min(cfg.itemsPerStep, idx.size());
        ArrayList<KnowledgeItem> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) out.add(all.get(idx.get(i)));
        return out;
    }

    private static String label(KnowledgeItem k) {
        String t = k.title != null && !k.title.isBlank() ? k.title : Texts.truncate(k.content, 60);
        return (k.topic == null || k.topic.isBlank()) ? t : k.topic + ": " + t;
    }

    private void detectRelationships(ChainState st, ReasoningStep step, ReasoningStep previous) {
        try {
            List<Relationship> found;
            if (synthesizer != null) {
                SynthesisResult r = synthesizer.synthesize(st.accumulated, st.query + " " + step.description,
                        previous == null ? null : previous.reasoning);
                found = r.relationships;
            } else if (mapper != null) {
                ArrayList<KnowledgeItem> items = new ArrayList<>();
                for (List<KnowledgeItem> l : st.accumulated.values()) items.addAll(l);
                found = mapper.extractRelationships(items, st.accumulated.keySet());
            } else {
                return;
            }
            for (Relationship r : found) {
                st.relationships.merge(r.key(), r, (a, b) -> b.strength > a.strength ? b : a);
            }
        } catch (RuntimeException e) {
            log.warn("relationship detection failed at step {}: {}", step.stepNumber, e.toString());
        }
    }

    /** 0.7 + 0.1 evidence + 0.1 sub-steps + 0.1 knowledge, capped at 1. */
    static double assessConfidence(ReasoningStep step, int knowledgeCount) {
        double c = 0.7;
        if (!step.evidence.isEmpty()) c += 0.1;
        if (!step.subSteps.isEmpty()) c += 0.1;
        if (knowledgeCount > 0) c += 0.1;
        return Math.min(c, 1.0);
    }

    static double calibrateConfidence(double base, int evidenceCount, int knowledgeCount, boolean verified) {
        double c = base + Math.min(evidenceCount * 0.05, 0.2);
        if (knowledgeCount >= 3) c += 0.15;
        else if (knowledgeCount >= 1) c += 0.1;
        if (verified) c += 0.1;
        return Texts.clamp01(c);
    }

    /** Step-level check used by calibration: reasoning present and dependencies point backwards to known steps. */
    static boolean stepVerified(ReasoningStep step, List<ReasoningStep> steps) {
        if (!step.hasReasoning()) return false;
        for (int dep : step.dependencies) {
            if (dep >= step.stepNumber) return false;
            boolean found = false;
            for (ReasoningStep s : steps) {
                if (s.stepNumber == dep) {
                    found = true;
                    break;
                }
            }
            if (!found) return false;
        }
        return true;
    }

    /**
     * Sentences sharing at least two meaningful words with the query (one when the query has only
     * one), unique, at most 10.
     */
    public static List<String> collectEvidence(String query, Collection<KnowledgeItem> items) {
        if (query == null || items == null || items.isEmpty()) return List.of();
        Set<String> qWords = Texts.meaningfulWordSet(query, 3);
        if (qWords.isEmpty()) return List.of();
        int need = Math.min(2, qWords.size());

        LinkedHashSet<String> out = new LinkedHashSet<>();
        for (KnowledgeItem k : items) {
            if (k == null || k.content == null) continue;
            for (String sentence : Texts.sentences(k.content)) {
                Set<String> sw = Texts.meaningfulWordSet(sentence, 3);
                int shared = 0;
                for (String w : qWords) if (sw.contains(w)) shared++;
                if (shared >= need) out.add(sentence);
                if (out.size() >= 10) return new ArrayList<>(out);
            }
        }
        return new ArrayList<>(out);
    }

    // ---------------------------------------------------------------------
    // Alternatives / chain operations
    // ---------------------------------------------------------------------

    static List<ReasoningType> alternativeTypes(ReasoningType main) {
        return switch (main) {
            case CAUSAL -> List.of(ReasoningType.ANALYTICAL, ReasoningType.COMPARATIVE);
            case COMPARATIVE -> List.of(ReasoningType.ANALYTICAL, ReasoningType.CAUSAL);
            case ANALYTICAL -> List.of(ReasoningType.CAUSAL, ReasoningType.COMPARATIVE);
            default -> List.of(ReasoningType.CAUSAL, ReasoningType.ANALYTICAL);
        };
    }

    /**
     * The same query rebuilt under other reasoning types, without knowledge, for comparison. Not
     * cached.
     */
    public List<ReasoningChain> generateAlternativePaths(String query, ReasoningChain main) {
        Objects.requireNonNull(query, "query");
        Objects.requireNonNull(main, "main");
        ArrayList<ReasoningChain> out = new ArrayList<>(2);
        for (ReasoningType type : alternativeTypes(main.reasoningType)) {
            long t0 = System.nanoTime();
            List<ReasoningStep> steps = StepTemplates.decompose(type, query, Optional.empty());
            ReasoningStep previous = null;
            for (ReasoningStep s : steps) {
                s.reasoning = StepPhrases.compose(query, s.description,
                        previous == null ? null : previous.reasoning, null, cfg.previousChars, cfg.knowledgeChars);
                s.confidence = assessConfidence(s, 0);
                previous = s;
            }
            String conclusion = ChainOperations.conclude(type, steps, List.of());
            boolean verified = ChainOperations.verify(steps, conclusion, cfg.minConfidenceThreshold);
            out.add(ReasoningChain.builder(query, type)
                    .steps(steps)
                    .conclusion(conclusion)
                    .confidence(ChainOperations.meanConfidence(steps))
                    .verificationResult(verified)
                    .qualityScore(ChainOperations.quality(steps, verified, cfg.maxSteps))
                    .topicsInvolved(main.topicsInvolved)
                    .domains(main.domains)
                    .processingTimeMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0))
                    .build());
        }
        return out;
    }

    public ReasoningChain mergeReasoningChains(List<ReasoningChain> chains) {
        return ChainOperations.merge(chains);
    }

    public ReasoningChain optimizeReasoningChain(ReasoningChain chain) {
        return ChainOperations.optimize(chain, cfg.minConfidenceThreshold, cfg.maxSteps);
    }

    public ReasoningChain validateAndFixChain(ReasoningChain chain) {
        return ChainOperations.validateAndFix(chain, cfg.minConfidenceThreshold, cfg.maxSteps);
    }

    public List<String> validateStep(ReasoningStep step) {
        return ChainValidator.validateStep(step);
    }

    public List<String> validateChain(ReasoningChain chain) {
        return ChainValidator.validateChain(chain);
    }

    // ---------------------------------------------------------------------
    // Batch
    // ---------------------------------------------------------------------

    public List<ReasoningChain> generateBatch(List<String> queries) {
        if (queries == null || queries.isEmpty()) return List.of();
        ArrayList<ReasoningChain> out = new ArrayList<>(queries.size());
        for (String q : queries) out.add(generateReasoningChain(q == null ? "" : q));
        return out;
    }

    /**
     * Chains built concurrently on the engine pool, one task per query; the steps of one chain
     * always run on one thread. Output order matches input order. A failed or timed out query
     * yields an unverified chain with a single zero-confidence step.
     */
    public List<ReasoningChain> generateBatchParallel(List<String> queries) {
        if (queries == null || queries.isEmpty()) return List.of();
        if (queries.size() == 1) return generateBatch(queries);

        final Map<String, String> mdc = ThreadContext.getImmutableContext();
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(cfg.batchTimeoutMs);

        ArrayList<Future<ReasoningChain>> futures = new ArrayList<>(queries.size());
        for (String q : queries) {
            final String query = q == null ? "" : q;
            futures.add(pool.submit(() -> {
                if (mdc != null && !mdc.isEmpty()) ThreadContext.putAll(mdc);
                try {
                    return generateReasoningChain(query);
                } finally {
                    if (mdc != null && !mdc.isEmpty()) ThreadContext.clearMap();
                }
            }));
        }

        ArrayList<ReasoningChain> out = new ArrayList<>(queries.size());
        for (int i = 0; i < futures.size(); i++) {
            String query = queries.get(i) == null ? "" : queries.get(i);
            Future<ReasoningChain> f = futures.get(i);
            try {
                out.add(f.get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS));
            } catch (TimeoutException e) {
                f.cancel(true);
                log.warn("batch chain timed out: '{}'", Texts.truncate(query, 80));
                out.add(unanswered(query));
            } catch (ExecutionException | CancellationException e) {
                log.warn("batch chain failed: '{}': {}", Texts.truncate(query, 80), String.valueOf(e.getCause()));
                out.add(unanswered(query));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                for (int j = i; j < futures.size(); j++) {
                    futures.get(j).cancel(true);
                    out.add(unanswered(queries.get(j) == null ? "" : queries.get(j)));
                }
                log.warn("batch interrupted; {} chains left unanswered", futures.size() - i);
                return out;
            }
        }
        return out;
    }

    private static ReasoningChain unanswered(String query) {
        ReasoningStep step = new ReasoningStep(1, "Answer the query", ChainOperations.NO_ANSWER, 0.0, List.of());
        return ReasoningChain.builder(query, ReasoningType.GENERAL)
                .steps(List.of(step))
                .conclusion(ChainOperations.NO_ANSWER)
                .verificationResult(false)
                .build();
    }

    // ---------------------------------------------------------------------
    // Stats / cache / lifecycle
    // ---------------------------------------------------------------------

    private synchronized void record(ReasoningChain chain) {
        chains++;
        totalSteps += chain.steps.size();
        sumConfidence += chain.confidence;
        sumQuality += chain.qualityScore;
        sumProcessingMs += chain.processingTimeMs;
    }

    public synchronized EngineStatistics statistics() {
        double n = Math.max(1, chains);
        return new EngineStatistics(chains, totalSteps,
                chains == 0 ? 0.0 : sumConfidence / n,
                chains == 0 ? 0.0 : sumQuality / n,
                chains == 0 ? 0.0 : sumProcessingMs / n,
                cacheHits.get(), cacheMisses.get(), cache.size());
    }

    public void clearCache() {
        cache.clear();
        log.debug("reasoning cache cleared");
    }

    public CacheStats cacheStats() {
        return cache.stats();
    }

    @Override
    public void close() {
        if (ownsPool) Pools.shutdown(pool, cfg.shutdownTimeoutMs, "reasoning batch pool");
    }

    private static String fmt2(double v) {
        return String.format(Locale.ROOT, "%.2f", v);
    }

    // ---------------------------------------------------------------------
    // Builder / Config
    // ---------------------------------------------------------------------

    public static final class Builder {
        private Config config = new Config();
        private QueryAnalyzer analyzer;
        private MultiTopicRetriever retriever;
        private KnowledgeSynthesizer synthesizer;
        private TopicRelationshipMapper mapper;
        private Cache<String, ReasoningChain> cache;
        private ExecutorService pool;
        private LongSupplier clock;

        private Builder() {}

        public Builder config(Config cfg) {
            this.config = Objects.requireNonNull(cfg, "config");
            return this;
        }

        public Builder analyzer(QueryAnalyzer analyzer) {
            this.analyzer = analyzer;
            return this;
        }

        public Builder retriever(MultiTopicRetriever retriever) {
            this.retriever = retriever;
            return this;
        }

        public Builder synthesizer(KnowledgeSynthesizer synthesizer) {
            this.synthesizer = synthesizer;
            return this;
        }

        public Builder mapper(TopicRelationshipMapper mapper) {
            this.mapper = mapper;
            return this;
        }

        /** Replaces the default TTL cache. */
        public Builder cache(Cache<String, ReasoningChain> cache) {
            this.cache = cache;
            return this;
        }

        /** External batch pool; the engine will not shut it down. */
        public Builder pool(ExecutorService pool) {
            this.pool = pool;
            return this;
        }

        /** Millisecond clock for the default cache. */
        public Builder clock(LongSupplier clock) {
            this.clock = clock;
            return this;
        }

        public ReasoningEngine build() {
            return new ReasoningEngine(this);
        }
    }

    public static final class Config {
        public int maxSteps = 10;
        public boolean cacheEnabled = true;
        public long cacheTtlSeconds = 3600;
        public int cacheMaxSize = 1000;
        public boolean iterative = false;
        public double minConfidenceThreshold = 0.6;

        /** Knowledge items considered per step. */
        public int itemsPerStep = 3;
        public int knowledgeChars = 200;
        public int previousChars = 150;

        public int batchParallelism = 4;
        public int queueCapacity = 64;
        public long batchTimeoutMs = 30_000;
        public long shutdownTimeoutMs = 2_500;
        public String threadNamePrefix = "reasoning-batch-";

        public Config validate() {
            if (maxSteps < 1) maxSteps = 1;
            if (cacheTtlSeconds < 1) cacheTtlSeconds = 1;
            if (cacheMaxSize < 0) cacheMaxSize = 0;
            if (!Double.isFinite(minConfidenceThreshold)) minConfidenceThreshold = 0.6;
            minConfidenceThreshold = Texts.clamp01(minConfidenceThreshold);
            if (itemsPerStep < 1) itemsPerStep = 1;
            if (knowledgeChars < 0) knowledgeChars = 0;
            if (previousChars < 0) previousChars = 0;
            if (batchParallelism < 1) batchParallelism = 1;
            if (queueCapacity < 1) queueCapacity = 1;
            if (batchTimeoutMs < 1) batchTimeoutMs = 1;
            if (shutdownTimeoutMs < 0) shutdownTimeoutMs = 0;
            if (threadNamePrefix == null || threadNamePrefix.isBlank()) threadNamePrefix = "reasoning-batch-";
            return this;
        }
    }
}
