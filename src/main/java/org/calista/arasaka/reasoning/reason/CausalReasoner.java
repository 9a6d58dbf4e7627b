package org.calista.arasaka.reasoning.reason;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.arasaka.reasoning.analysis.Domain;
import org.calista.arasaka.reasoning.analysis.ReasoningType;
import org.calista.arasaka.reasoning.knowledge.KnowledgeItem;
import org.calista.arasaka.reasoning.relation.Relationship;
import org.calista.arasaka.reasoning.relation.RelationshipType;
import org.calista.arasaka.reasoning.relation.TopicRelationshipMapper;
import org.calista.arasaka.reasoning.retrieve.MultiTopicRetriever;
import org.calista.arasaka.reasoning.retrieve.TopicInfo;
import org.calista.arasaka.reasoning.text.Texts;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Multi-topic cause → effect analysis over the relationship graph.
 *
 * <p>Fewer than two topics: the query goes to the {@link ReasoningEngine} unchanged. Otherwise every
 * ordered topic pair backed by a causal edge becomes a step (confidence = edge strength); with no
 * such edge the topics are assumed to chain in their identified order.</p>
 */
public final class CausalReasoner {

    private static final Logger log = LogManager.getLogger(CausalReasoner.class);

    static final String LEAD_IN = "Based on the causal analysis: ";

    private final ReasoningEngine engine;
    private final MultiTopicRetriever retriever;
    private final TopicRelationshipMapper mapper;
    private final Config cfg;

    public CausalReasoner(ReasoningEngine engine, MultiTopicRetriever retriever, TopicRelationshipMapper mapper) {
        this(engine, retriever, mapper, new Config());
    }

    public CausalReasoner(ReasoningEngine engine, MultiTopicRetriever retriever, TopicRelationshipMapper mapper, Config cfg) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.retriever = Objects.requireNonNull(retriever, "retriever");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.cfg = Objects.requireNonNull(cfg, "cfg").validate();
    }

    public ReasoningChain reason(String query) {
        return reason(query, null);
    }

    /**
     * @param knowledgeByTopic caller knowledge; when null or empty it is retrieved per topic
     */
    public ReasoningChain reason(String query, Map<String, List<KnowledgeItem>> knowledgeByTopic) {
        Objects.requireNonNull(query, "query");
        long t0 = System.nanoTime();

        List<TopicInfo> topicInfos = retriever.identifyTopics(query, cfg.maxTopics);
        if (topicInfos.size() < 2) {
            log.debug("causal: {} topic(s), delegating to engine", topicInfos.size());
            return engine.generateReasoningChain(query, null, null, knowledgeByTopic, engine.config().iterative);
        }

        ArrayList<String> topics = new ArrayList<>(topicInfos.size());
        LinkedHashSet<Domain> domains = new LinkedHashSet<>();
        for (TopicInfo t : topicInfos) {
            topics.add(t.topic);
            domains.add(t.domain);
        }

        Map<String, List<KnowledgeItem>> knowledge = knowledgeByTopic != null && !knowledgeByTopic.isEmpty()
                ? knowledgeByTopic
                : retriever.retrieve(query, topicInfos, retriever.config().maxPerTopic, retriever.config().parallel);

        Map<String, List<Relationship>> graph;
        try {
            graph = mapper.buildRelationshipGraph(topics, knowledge);
        } catch (RuntimeException e) {
            log.warn("causal: relationship graph failed, assuming topic order: {}", e.toString());
            graph = Map.of();
        }

        List<CausalStep> causal = decompose(topics, graph);
        List<ReasoningStep> steps = toReasoningSteps(query, causal, graph, knowledge);

        String conclusion = conclude(steps);
        double threshold = engine.config().minConfidenceThreshold;
        boolean verified = ChainOperations.verify(steps, conclusion, threshold);

        ReasoningChain chain = ReasoningChain.builder(query, ReasoningType.CAUSAL)
                .steps(steps)
                .conclusion(conclusion)
                .confidence(Texts.clamp01(ChainOperations.meanConfidence(steps)))
                .verificationResult(verified)
                .qualityScore(ChainOperations.quality(steps, verified, engine.config().maxSteps))
                .topicsInvolved(topics)
                .relationships(causalEdges(graph))
                .domains(new ArrayList<>(domains))
                .processingTimeMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0))
                .build();

        if (log.isDebugEnabled()) {
            log.debug("causal chain: topics={} steps={} assumed={} verified={}", topics, steps.size(),
                    causal.stream().filter(c -> c.assumed).count(), verified);
        }
        return chain;
    }

    /**
     * Causal edges between ordered topic pairs, strongest first; without any, the assumed chain
     * topic[i] → topic[i+1].
     */
    public List<CausalStep> decompose(List<String> topics, Map<String, List<Relationship>> graph) {
        ArrayList<CausalStep> out = new ArrayList<>();
        if (topics == null || topics.size() < 2) return out;

        for (String cause : topics) {
            List<Relationship> edges = graph == null ? null : graph.get(cause.toLowerCase(Locale.ROOT));
            if (edges == null) continue;
            for (String effect : topics) {
                if (cause.equalsIgnoreCase(effect)) continue;
                Relationship best = null;
                for (Relationship r : edges) {
                    if (r.type != RelationshipType.CAUSAL) continue;
                    if (!r.topic2.equals(effect.toLowerCase(Locale.ROOT))) continue;
                    if (best == null || r.strength > best.strength) best = r;
                }
                if (best != null) out.add(new CausalStep(cause, effect, best.strength, best.evidence, false));
            }
        }

        if (out.isEmpty()) {
            double conf = topics.size() == 2 ? cfg.assumedTwoTopicConfidence : cfg.assumedConfidence;
            for (int i = 0; i + 1 < topics.size(); i++) {
                out.add(new CausalStep(topics.get(i), topics.get(i + 1), conf, "", true));
            }
        } else {
            out.sort((a, b) -> Double.compare(b.confidence, a.confidence));
        }

        int cap = engine.config().maxSteps;
        return out.size() > cap ? new ArrayList<>(out.subList(0, cap)) : out;
    }

    private List<ReasoningStep> toReasoningSteps(String query, List<CausalStep> causal, Map<String, List<Relationship>> graph,
                                                 Map<String, List<KnowledgeItem>> knowledge) {
        ArrayList<ReasoningStep> steps = new ArrayList<>(causal.size());
        ReasoningStep previous = null;

        for (int i = 0; i < causal.size(); i++) {
            CausalStep c = causal.get(i);
            int n = i + 1;
            ReasoningStep step = new ReasoningStep(n, "Analyze causal relationship: " + c.describe(),
                    Texts.clamp01(c.confidence), n == 1 ? List.of() : List.of(n - 1));

            List<KnowledgeItem> items = itemsFor(knowledge, c.cause, c.effect);
            ArrayList<String> parts = new ArrayList<>(5);
            parts.add("Step " + n + ": Analyzing how '" + c.cause + "' affects '" + c.effect + "'");
            if (!items.isEmpty()) parts.add("Knowledge: " + Texts.truncate(items.get(0).content.trim(), cfg.knowledgeChars));
            if (!c.mechanism.isBlank()) parts.add("Mechanism: " + Texts.truncate(c.mechanism.trim(), cfg.knowledgeChars));

            List<String> related = relatedTo(graph, c);
            if (!related.isEmpty()) parts.add("Relationships: " + String.join(", ", related));
            if (previous != null) {
                parts.add("Building on previous analysis: " + Texts.truncate(previous.reasoning, cfg.previousChars));
            }
            step.reasoning = String.join(". ", parts);

            step.evidence.addAll(ReasoningEngine.collectEvidence(query, items));
            for (KnowledgeItem k : items) {
                step.knowledgeUsed.add(k.title != null && !k.title.isBlank() ? k.title : Texts.truncate(k.content, 60));
            }
            steps.add(step);
            previous = step;
        }
        return steps;
    }

    private List<KnowledgeItem> itemsFor(Map<String, List<KnowledgeItem>> knowledge, String cause, String effect) {
        ArrayList<KnowledgeItem> out = new ArrayList<>();
        if (knowledge == null) return out;
        for (Map.Entry<String, List<KnowledgeItem>> e : knowledge.entrySet()) {
            if (e.getValue() == null) continue;
            if (e.getKey().equalsIgnoreCase(cause) || e.getKey().equalsIgnoreCase(effect)) {
                for (KnowledgeItem k : e.getValue()) {
                    if (k != null && k.content != null && !k.content.isBlank()) out.add(k);
                    if (out.size() >= cfg.itemsPerStep) return out;
                }
            }
        }
        return out;
    }

    private List<String> relatedTo(Map<String, List<Relationship>> graph, CausalStep c) {
        ArrayList<String> out = new ArrayList<>(cfg.relationshipsPerStep);
        if (graph == null) return out;
        List<Relationship> edges = graph.get(c.cause.toLowerCase(Locale.ROOT));
        if (edges == null) return out;
        String effect = c.effect.toLowerCase(Locale.ROOT);
        for (Relationship r : edges) {
            if (r.type == RelationshipType.CAUSAL && r.topic2.equals(effect)) continue;
            out.add(r.describe());
            if (out.size() >= cfg.relationshipsPerStep) break;
        }
        return out;
    }

    /** Lead-in plus the first clause of every step. */
    static String conclude(List<ReasoningStep> steps) {
        if (steps.isEmpty()) return ChainOperations.NO_ANSWER;
        ArrayList<String> leads = new ArrayList<>(steps.size());
        for (ReasoningStep s : steps) {
            String r = s.reasoning == null ? "" : s.reasoning.trim();
            int dot = r.indexOf(". ");
            String first = dot >= 0 ? r.substring(0, dot) : r;
            leads.add(Texts.truncate(first, 100));
        }
        return LEAD_IN + String.join(". ", leads);
    }

    private static List<Relationship> causalEdges(Map<String, List<Relationship>> graph) {
        LinkedHashMap<Relationship.Key, Relationship> out = new LinkedHashMap<>();
        if (graph == null) return new ArrayList<>();
        for (List<Relationship> l : graph.values()) {
            for (Relationship r : l) {
                if (r.type == RelationshipType.CAUSAL) out.putIfAbsent(r.key(), r);
            }
        }
        return new ArrayList<>(out.values());
    }

    public static final class Config {
        public int maxTopics = 5;
        public double assumedConfidence = 0.5;
        public double assumedTwoTopicConfidence = 0.6;
        public int itemsPerStep = 3;
        public int relationshipsPerStep = 2;
        public int knowledgeChars = 200;
        public int previousChars = 150;

        public Config validate() {
            if (maxTopics < 2) maxTopics = 2;
            assumedConfidence = Texts.clamp01(assumedConfidence);
            assumedTwoTopicConfidence = Texts.clamp01(assumedTwoTopicConfidence);
            if (itemsPerStep < 1) itemsPerStep = 1;
            if (relationshipsPerStep < 0) relationshipsPerStep = 0;
            if (knowledgeChars < 0) knowledgeChars = 0;
            if (previousChars < 0) previousChars = 0;
            return this;
        }
    }
}
