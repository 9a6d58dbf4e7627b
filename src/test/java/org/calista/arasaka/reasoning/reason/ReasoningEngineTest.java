package org.calista.arasaka.reasoning.reason;

import org.calista.arasaka.reasoning.analysis.ReasoningType;
import org.calista.arasaka.reasoning.knowledge.InMemoryKnowledgeStore;
import org.calista.arasaka.reasoning.knowledge.KnowledgeItem;
import org.calista.arasaka.reasoning.knowledge.KnowledgeStore;
import org.calista.arasaka.reasoning.relation.InMemoryRelationshipStore;
import org.calista.arasaka.reasoning.relation.RelationshipType;
import org.calista.arasaka.reasoning.relation.TopicRelationshipMapper;
import org.calista.arasaka.reasoning.retrieve.MultiTopicRetriever;
import org.calista.arasaka.reasoning.retrieve.scorer.impl.SemanticRelevanceScorer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

class ReasoningEngineTest {

    private static final String CLIMATE_QUERY = "How does climate change affect economic policy?";
    private static final String FARM_QUERY = "How does climate change affect agriculture?";
    private static final String FARM_TEXT = "Climate change affects agriculture through droughts and floods. "
            + "Shifting growing seasons change which crops can be grown in many regions of the world, "
            + "and farmers adapt slowly to the new conditions.";

    private final List<AutoCloseable> closeables = new ArrayList<>();

    @AfterEach
    void tearDown() throws Exception {
        for (AutoCloseable c : closeables) c.close();
    }

    private ReasoningEngine engine(ReasoningEngine.Builder b) {
        ReasoningEngine e = b.build();
        closeables.add(e);
        return e;
    }

    private MultiTopicRetriever retriever(KnowledgeStore store) {
        MultiTopicRetriever r = MultiTopicRetriever.builder(store, new SemanticRelevanceScorer()).build();
        closeables.add(r);
        return r;
    }

    private static void assertWellFormed(ReasoningChain chain) {
        assertThat(chain.confidence).isBetween(0.0, 1.0);
        assertThat(chain.qualityScore).isBetween(0.0, 1.0);
        for (ReasoningStep s : chain.steps) {
            assertThat(s.confidence).isBetween(0.0, 1.0);
            assertThat(s.dependencies).allMatch(d -> d < s.stepNumber);
        }
        assertThat(ChainValidator.validateChain(chain)).isEmpty();
    }

    @Test
    void twoTopicCausalQueryBuildsSixStepChain() {
        ReasoningChain chain = engine(ReasoningEngine.builder()).generateReasoningChain(CLIMATE_QUERY);

        assertThat(chain.reasoningType).isEqualTo(ReasoningType.CAUSAL);
        assertThat(chain.steps).hasSize(6).allMatch(ReasoningStep::hasReasoning);
        assertThat(chain.steps.get(0).reasoning).startsWith("To answer '" + CLIMATE_QUERY + "'");
        assertThat(chain.steps.get(1).reasoning).contains("Building on: ");
        assertThat(chain.conclusion).startsWith("The most likely cause is: ");
        assertThat(chain.verificationResult).isTrue();
        assertThat(chain.topicsInvolved).isNotEmpty();
        assertWellFormed(chain);
    }

    @Test
    void arithmeticQueryConcludesWithTheValue() {
        ReasoningChain chain = engine(ReasoningEngine.builder()).generateReasoningChain("What is 5 + 3?");

        assertThat(chain.reasoningType).isEqualTo(ReasoningType.MATHEMATICAL);
        assertThat(chain.steps).hasSize(3);
        assertThat(chain.steps.get(1).reasoning).isEqualTo("Numbers: 5, 3");
        // pre-filled steps keep their preset confidence
        assertThat(chain.steps).extracting(s -> s.confidence).containsExactly(0.9, 0.9, 0.8);
        assertThat(chain.conclusion).startsWith("Based on the mathematical analysis: ").contains("8");
        assertWellFormed(chain);
    }

    @Test
    void suppliedKnowledgeBecomesEvidence() {
        KnowledgeItem k = KnowledgeItem.of("climate change", "Climate impacts", FARM_TEXT, "wikipedia", 0.9);

        ReasoningChain chain = engine(ReasoningEngine.builder()).generateReasoningChain(FARM_QUERY, null, List.of(k));

        ReasoningStep first = chain.steps.get(0);
        assertThat(first.evidence).containsExactly("Climate change affects agriculture through droughts and floods.");
        assertThat(first.knowledgeUsed).containsExactly("climate change: Climate impacts");
        assertThat(first.reasoning).contains(" Knowledge: Climate change affects agriculture");
        assertThat(first.confidence).isEqualTo(1.0);
        assertThat(chain.topicsInvolved).contains("climate change");
        assertWellFormed(chain);
    }

    @Test
    void relationshipsBetweenSuppliedTopicsReachTheConclusion() {
        LinkedHashMap<String, List<KnowledgeItem>> byTopic = new LinkedHashMap<>();
        byTopic.put("deforestation", List.of(KnowledgeItem.of("deforestation", "Forests",
                "Deforestation causes soil erosion in tropical regions.", "wikipedia", 0.8)));
        byTopic.put("soil erosion", List.of(KnowledgeItem.of("soil erosion", "Erosion",
                "Soil erosion reduces farmland.", "wikipedia", 0.8)));
        ReasoningEngine e = engine(ReasoningEngine.builder()
                .mapper(new TopicRelationshipMapper(new InMemoryRelationshipStore())));

        ReasoningChain chain = e.generateReasoningChain("Why does deforestation cause soil erosion?", null, null, byTopic, false);

        assertThat(chain.relationships).singleElement()
                .satisfies(r -> assertThat(r.type).isEqualTo(RelationshipType.CAUSAL));
        assertThat(chain.conclusion).contains("Relationships: deforestation causal soil erosion");
        assertThat(chain.topicsInvolved).contains("deforestation", "soil erosion");
    }

    @Test
    void repeatedQueryIsServedFromCacheWithoutRetrieval() {
        InMemoryKnowledgeStore store = new InMemoryKnowledgeStore();
        store.add(KnowledgeItem.of("climate change", "Climate change and farming", FARM_TEXT, "wikipedia", 0.9));
        MultiTopicRetriever r = retriever(store);
        ReasoningEngine e = engine(ReasoningEngine.builder().retriever(r));

        ReasoningChain first = e.generateReasoningChain(FARM_QUERY);
        long lookups = r.lookups();
        ReasoningChain second = e.generateReasoningChain(FARM_QUERY);

        assertThat(lookups).isPositive();
        assertThat(second).isNotSameAs(first).usingRecursiveComparison().isEqualTo(first);
        assertThat(r.lookups()).isEqualTo(lookups);
        EngineStatistics stats = e.statistics();
        assertThat(stats.chains).isEqualTo(1);
        assertThat(stats.cacheHits).isEqualTo(1);
        assertThat(stats.cacheMisses).isEqualTo(1);
        assertThat(stats.cacheHitRate()).isEqualTo(0.5);
    }

    @Test
    void editingReturnedStepsLeavesCachedChainIntact() {
        ReasoningEngine e = engine(ReasoningEngine.builder());
        ReasoningChain first = e.generateReasoningChain("What is 5 + 3?");
        first.steps.get(0).reasoning = "edited";
        first.steps.get(0).confidence = 7.0;
        first.steps.get(0).evidence.add("noise");

        ReasoningChain second = e.generateReasoningChain("What is 5 + 3?");

        assertThat(e.statistics().cacheHits).isEqualTo(1);
        assertThat(second.steps.get(0).reasoning).isEqualTo("Found operation: +");
        assertThat(second.steps.get(0).confidence).isEqualTo(0.9);
        assertThat(second.steps.get(0).evidence).doesNotContain("noise");
        assertWellFormed(second);

        // and a hit handed out earlier does not leak into later ones
        second.steps.get(1).reasoning = "edited again";
        assertThat(e.generateReasoningChain("What is 5 + 3?").steps.get(1).reasoning).isEqualTo("Numbers: 5, 3");
    }

    @Test
    void arithmeticSkipsRetrieval() {
        MultiTopicRetriever r = retriever(new InMemoryKnowledgeStore());
        engine(ReasoningEngine.builder().retriever(r)).generateReasoningChain("What is 5 + 3?");

        assertThat(r.lookups()).isZero();
    }

    @Test
    void iterativeModeRetrievesPerStep() {
        InMemoryKnowledgeStore store = new InMemoryKnowledgeStore();
        store.add(KnowledgeItem.of("climate change", "Climate change and farming", FARM_TEXT, "wikipedia", 0.9));
        MultiTopicRetriever plain = retriever(store);
        MultiTopicRetriever stepwise = retriever(store);

        engine(ReasoningEngine.builder().retriever(plain)).generateReasoningChain(FARM_QUERY, null, null, null, false);
        engine(ReasoningEngine.builder().retriever(stepwise)).generateReasoningChain(FARM_QUERY, null, null, null, true);

        assertThat(stepwise.lookups()).isGreaterThan(plain.lookups());
    }

    @Test
    void cachedChainExpiresAfterTtl() {
        AtomicLong now = new AtomicLong(1_000_000L);
        ReasoningEngine.Config cfg = new ReasoningEngine.Config();
        cfg.cacheTtlSeconds = 1;
        ReasoningEngine e = engine(ReasoningEngine.builder().config(cfg).clock(now::get));

        e.generateReasoningChain(CLIMATE_QUERY);
        now.addAndGet(1_000);
        e.generateReasoningChain(CLIMATE_QUERY);
        assertThat(e.statistics().cacheHits).isEqualTo(1);
        now.addAndGet(1);
        e.generateReasoningChain(CLIMATE_QUERY);
        assertThat(e.cacheStats().expirations).isEqualTo(1);
        assertThat(e.statistics().chains).isEqualTo(2);
    }

    @Test
    void disabledCacheStillGivesIdenticalChains() {
        ReasoningEngine.Config cfg = new ReasoningEngine.Config();
        cfg.cacheEnabled = false;
        ReasoningEngine e = engine(ReasoningEngine.builder().config(cfg));

        ReasoningChain a = e.generateReasoningChain(CLIMATE_QUERY);
        ReasoningChain b = e.generateReasoningChain(CLIMATE_QUERY);

        assertThat(b).isNotSameAs(a);
        assertThat(b.conclusion).isEqualTo(a.conclusion);
        assertThat(b.steps).extracting(s -> s.reasoning).isEqualTo(a.steps.stream().map(s -> s.reasoning).toList());
        assertThat(e.statistics().chains).isEqualTo(2);
    }

    @Test
    void clearCacheForcesRebuild() {
        ReasoningEngine e = engine(ReasoningEngine.builder());
        ReasoningChain first = e.generateReasoningChain("What is 5 + 3?");

        e.clearCache();

        assertThat(e.cacheStats().size).isZero();
        assertThat(e.generateReasoningChain("What is 5 + 3?")).isNotSameAs(first);
    }

    @Test
    void parallelBatchKeepsInputOrder() {
        List<String> queries = List.of("What is 5 + 3?", CLIMATE_QUERY, "What is 2 * 4?", "Compare tea and coffee");

        List<ReasoningChain> out = engine(ReasoningEngine.builder()).generateBatchParallel(queries);

        assertThat(out).extracting(c -> c.query).containsExactlyElementsOf(queries);
        assertThat(out.get(0).reasoningType).isEqualTo(ReasoningType.MATHEMATICAL);
        assertThat(out.get(2).conclusion).contains("8");
        out.forEach(ReasoningEngineTest::assertWellFormed);
    }

    @Test
    void timedOutBatchQueryGetsSingleStepFallback() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        MultiTopicRetriever r = retriever(new StallingStore(release));
        ReasoningEngine.Config cfg = new ReasoningEngine.Config();
        cfg.batchTimeoutMs = 100;
        ReasoningEngine e = engine(ReasoningEngine.builder().config(cfg).retriever(r));

        List<ReasoningChain> out;
        try {
            out = e.generateBatchParallel(List.of(CLIMATE_QUERY, FARM_QUERY));
        } finally {
            release.countDown();
        }

        assertThat(out).extracting(c -> c.query).containsExactly(CLIMATE_QUERY, FARM_QUERY);
        for (ReasoningChain c : out) {
            assertThat(c.verificationResult).isFalse();
            assertThat(c.conclusion).isEqualTo(ChainOperations.NO_ANSWER);
            assertThat(c.steps).singleElement().satisfies(s -> {
                assertThat(s.stepNumber).isEqualTo(1);
                assertThat(s.reasoning).isEqualTo(ChainOperations.NO_ANSWER);
                assertThat(s.confidence).isZero();
            });
            assertThat(ChainValidator.validateChain(c)).isEmpty();
        }
    }

    @Test
    void alternativePathsUseOtherTypes() {
        ReasoningEngine e = engine(ReasoningEngine.builder());
        ReasoningChain main = e.generateReasoningChain(CLIMATE_QUERY);

        List<ReasoningChain> alts = e.generateAlternativePaths(CLIMATE_QUERY, main);

        assertThat(alts).extracting(c -> c.reasoningType)
                .containsExactly(ReasoningType.ANALYTICAL, ReasoningType.COMPARATIVE);
        for (ReasoningChain c : alts) {
            assertThat(c.steps).hasSize(4);
            assertThat(c.topicsInvolved).isEqualTo(main.topicsInvolved);
            assertWellFormed(c);
        }
    }

    @Test
    void evidenceNeedsTwoSharedWords() {
        KnowledgeItem k = KnowledgeItem.of("x", "x",
                "Climate shapes everything. Climate change is measurable. Agriculture feeds people.", "wikipedia", 0.5);

        assertThat(ReasoningEngine.collectEvidence(FARM_QUERY, List.of(k)))
                .containsExactly("Climate change is measurable.");
        assertThat(ReasoningEngine.collectEvidence("agriculture", List.of(k)))
                .containsExactly("Agriculture feeds people.");
    }

    @Test
    void statisticsAverageOverBuiltChains() {
        ReasoningEngine e = engine(ReasoningEngine.builder());
        e.generateReasoningChain("What is 5 + 3?");
        e.generateReasoningChain(CLIMATE_QUERY);

        EngineStatistics s = e.statistics();
        assertThat(s.chains).isEqualTo(2);
        assertThat(s.totalSteps).isEqualTo(9);
        assertThat(s.avgConfidence).isBetween(0.0, 1.0);
        assertThat(s.cacheSize).isEqualTo(2);
        assertThat(s.cacheHits).isZero();
    }

    /** Every search blocks until released (or interrupted). */
    private static final class StallingStore implements KnowledgeStore {
        private final InMemoryKnowledgeStore delegate = new InMemoryKnowledgeStore();
        private final CountDownLatch release;

        StallingStore(CountDownLatch release) {
            this.release = release;
        }

        @Override
        public List<KnowledgeItem> search(String query, String topic, int limit, double minConfidence) {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return delegate.search(query, topic, limit, minConfidence);
        }

        @Override
        public AddResult add(KnowledgeItem item) {
            return delegate.add(item);
        }

        @Override
        public Optional<KnowledgeItem> get(long id) {
            return delegate.get(id);
        }

        @Override
        public List<KnowledgeItem> snapshotSorted() {
            return delegate.snapshotSorted();
        }

        @Override
        public int size() {
            return delegate.size();
        }
    }
}
