package org.calista.arasaka.reasoning.reason;

import org.calista.arasaka.reasoning.analysis.QueryAnalysis;
import org.calista.arasaka.reasoning.knowledge.KnowledgeItem;
import org.calista.arasaka.reasoning.relation.Relationship;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * ChainState: mutable per-request state of one {@link ReasoningEngine} run.
 *
 * <p>Lives for a single call on a single thread; never shared, never cached. The engine moves it
 * through {@link Phase} in order and only the step loop writes the accumulated knowledge.</p>
 */
public final class ChainState {

    public enum Phase {
        CACHE_CHECK,
        ANALYZE,
        DECOMPOSE,
        STEP_LOOP,
        SYNTHESIZE,
        VERIFY,
        SCORE,
        CACHE_STORE,
        RETURN
    }

    // -------------------- Request --------------------

    public final String query;
    public final String cacheKey;
    public final long startNanos;

    /** Previous conversation turns, oldest first. */
    public final List<String> context;
    /** Flat knowledge supplied by the caller. */
    public final List<KnowledgeItem> suppliedKnowledge;
    /** Per-topic knowledge supplied by the caller; when present, no retrieval happens. */
    public final Map<String, List<KnowledgeItem>> suppliedByTopic;
    public final boolean iterative;

    public Phase phase = Phase.CACHE_CHECK;

    // -------------------- Pipeline products --------------------

    public QueryAnalysis analysis;
    public List<ReasoningStep> steps = List.of();

    /** Knowledge seen so far, per topic, in arrival order. */
    public final Map<String, List<KnowledgeItem>> accumulated = new LinkedHashMap<>();
    /** Reasoning of every finished step, in order. */
    public final List<String> rollingContext = new ArrayList<>();
    public final Map<Relationship.Key, Relationship> relationships = new LinkedHashMap<>();
    public final List<String> topics = new ArrayList<>();

    public String conclusion = "";
    public boolean verified;
    public double quality;
    public int retrievals;

    public ReasoningChain result;
    public boolean fromCache;

    ChainState(String query, String cacheKey, List<String> context, List<KnowledgeItem> suppliedKnowledge,
               Map<String, List<KnowledgeItem>> suppliedByTopic, boolean iterative, long startNanos) {
        this.query = query;
        this.cacheKey = cacheKey;
        this.context = context == null ? List.of() : List.copyOf(context);
        this.suppliedKnowledge = suppliedKnowledge == null ? List.of() : List.copyOf(suppliedKnowledge);
        this.suppliedByTopic = suppliedByTopic;
        this.iterative = iterative;
        this.startNanos = startNanos;
    }

    public int accumulatedItems() {
        int n = 0;
        for (List<KnowledgeItem> l : accumulated.values()) n += l.size();
        return n;
    }
}
