package org.calista.arasaka.reasoning.core;

import org.calista.arasaka.reasoning.analysis.QueryAnalyzer;
import org.calista.arasaka.reasoning.format.LogBox;
import org.calista.arasaka.reasoning.knowledge.KnowledgeQuality;
import org.calista.arasaka.reasoning.reason.CausalReasoner;
import org.calista.arasaka.reasoning.reason.ReasoningEngine;
import org.calista.arasaka.reasoning.relation.TopicRelationshipMapper;
import org.calista.arasaka.reasoning.retrieve.MultiTopicRetriever;
import org.calista.arasaka.reasoning.retrieve.ResearchSource;
import org.calista.arasaka.reasoning.retrieve.scorer.RelevanceScorer;
import org.calista.arasaka.reasoning.retrieve.scorer.impl.SemanticRelevanceScorer;
import org.calista.arasaka.reasoning.synthesis.KnowledgeSynthesizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Objects;

/**
 * Wires the reasoning pipeline from a kernel: every component gets its nested Config from the
 * matching JSON section. The returned {@link Pipeline} owns the retrieval and batch pools.
 */
public final class ReasoningComposer {

    private static final Logger log = LoggerFactory.getLogger(ReasoningComposer.class);

    private final ResearchSource research; // nullable

    public ReasoningComposer() {
        this(null);
    }

    /** @param research optional top-up source for thin topics */
    public ReasoningComposer(ResearchSource research) {
        this.research = research;
    }

    public Pipeline compose(ReasoningKernel kernel) {
        Objects.requireNonNull(kernel, "kernel");
        ReasoningConfig cfg = kernel.config();

        QueryAnalyzer analyzer = new QueryAnalyzer();
        RelevanceScorer scorer = new SemanticRelevanceScorer(cfg.relevance.weights);

        KnowledgeQuality.Config qc = new KnowledgeQuality.Config();
        qc.minWordCount = cfg.knowledge.minWordCount;
        LinkedHashSet<String> low = new LinkedHashSet<>();
        for (String s : cfg.knowledge.lowQualitySources) {
            if (s != null && !s.isBlank()) low.add(s.trim().toLowerCase(Locale.ROOT));
        }
        qc.lowQualitySources = low;

        MultiTopicRetriever.Config rc = new MultiTopicRetriever.Config();
        rc.maxTopics = cfg.retrieval.maxTopics;
        rc.maxPerTopic = cfg.retrieval.maxPerTopic;
        rc.parallel = cfg.retrieval.parallel;
        rc.maxParallelism = cfg.retrieval.maxParallelism;
        rc.perTopicTimeoutMs = cfg.retrieval.perTopicTimeoutMs;
        rc.batchTimeoutMs = cfg.retrieval.batchTimeoutMs;
        rc.researchWhenBelow = cfg.retrieval.researchWhenBelow;
        rc.minConfidence = cfg.knowledge.minConfidence;
        rc.minRelevance = cfg.relevance.minScore;

        MultiTopicRetriever retriever = MultiTopicRetriever.builder(kernel.knowledge(), scorer)
                .config(rc)
                .analyzer(analyzer)
                .quality(new KnowledgeQuality(qc))
                .research(research)
                .build();

        TopicRelationshipMapper mapper = new TopicRelationshipMapper(kernel.relationships());

        KnowledgeSynthesizer.Config sc = new KnowledgeSynthesizer.Config();
        sc.itemsPerTopic = cfg.synthesis.itemsPerTopic;
        sc.maxCharsPerItem = cfg.synthesis.maxCharsPerItem;
        sc.maxRelationships = cfg.synthesis.maxRelationships;
        KnowledgeSynthesizer synthesizer = new KnowledgeSynthesizer(mapper, sc);

        ReasoningEngine.Config ec = new ReasoningEngine.Config();
        ec.maxSteps = cfg.reasoning.maxSteps;
        ec.cacheEnabled = cfg.reasoning.cacheEnabled;
        ec.cacheTtlSeconds = cfg.reasoning.cacheTtlSeconds;
        ec.cacheMaxSize = cfg.reasoning.cacheMaxSize;
        ec.iterative = cfg.reasoning.iterative;
        ec.minConfidenceThreshold = cfg.reasoning.minConfidenceThreshold;
        ec.batchParallelism = cfg.reasoning.batchParallelism;
        ec.batchTimeoutMs = cfg.reasoning.batchTimeoutMs;

        ReasoningEngine engine = ReasoningEngine.builder()
                .config(ec)
                .analyzer(analyzer)
                .retriever(retriever)
                .synthesizer(synthesizer)
                .mapper(mapper)
                .build();

        CausalReasoner.Config cc = new CausalReasoner.Config();
        cc.maxTopics = cfg.retrieval.maxTopics;
        CausalReasoner causal = new CausalReasoner(engine, retriever, mapper, cc);

        if (log.isInfoEnabled()) {
            log.info("\n{}", LogBox.box("Reasoning pipeline wired", l -> l
                    .kv("scorer", scorer.getClass().getSimpleName())
                    .kv("research", research != null)
                    .kv("retrieval.maxTopics", rc.maxTopics)
                    .kv("retrieval.parallel", rc.parallel)
                    .kv("relevance.minScore", rc.minRelevance)
                    .sep()
                    .kv("reasoning.maxSteps", ec.maxSteps)
                    .kv("reasoning.iterative", ec.iterative)
                    .kv("reasoning.cacheTtlSeconds", ec.cacheTtlSeconds)));
        }
        return new Pipeline(analyzer, retriever, mapper, synthesizer, engine, causal);
    }

    /**
     * The wired components. Close it to release the retrieval and batch pools.
     */
    public static final class Pipeline implements AutoCloseable {
        public final QueryAnalyzer analyzer;
        public final MultiTopicRetriever retriever;
        public final TopicRelationshipMapper mapper;
        public final KnowledgeSynthesizer synthesizer;
        public final ReasoningEngine engine;
        public final CausalReasoner causal;

        Pipeline(QueryAnalyzer analyzer, MultiTopicRetriever retriever, TopicRelationshipMapper mapper,
                 KnowledgeSynthesizer synthesizer, ReasoningEngine engine, CausalReasoner causal) {
            this.analyzer = analyzer;
            this.retriever = retriever;
            this.mapper = mapper;
            this.synthesizer = synthesizer;
            this.engine = engine;
            this.causal = causal;
        }

        @Override
        public void close() {
            try {
                engine.close();
            } finally {
                retriever.close();
            }
        }
    }
}
