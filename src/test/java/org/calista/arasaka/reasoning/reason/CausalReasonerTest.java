package org.calista.arasaka.reasoning.reason;

import org.calista.arasaka.reasoning.analysis.ReasoningType;
import org.calista.arasaka.reasoning.knowledge.InMemoryKnowledgeStore;
import org.calista.arasaka.reasoning.knowledge.KnowledgeItem;
import org.calista.arasaka.reasoning.relation.InMemoryRelationshipStore;
import org.calista.arasaka.reasoning.relation.Relationship;
import org.calista.arasaka.reasoning.relation.RelationshipType;
import org.calista.arasaka.reasoning.relation.TopicRelationshipMapper;
import org.calista.arasaka.reasoning.retrieve.MultiTopicRetriever;
import org.calista.arasaka.reasoning.retrieve.scorer.impl.SemanticRelevanceScorer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class CausalReasonerTest {

    private final InMemoryRelationshipStore relationships = new InMemoryRelationshipStore();
    private ReasoningEngine engine;
    private MultiTopicRetriever retriever;
    private CausalReasoner reasoner;

    @BeforeEach
    void setUp() {
        engine = ReasoningEngine.builder().build();
        retriever = MultiTopicRetriever.builder(new InMemoryKnowledgeStore(), new SemanticRelevanceScorer()).build();
        reasoner = new CausalReasoner(engine, retriever, new TopicRelationshipMapper(relationships));
    }

    @AfterEach
    void tearDown() {
        retriever.close();
        engine.close();
    }

    @Test
    void withoutCausalEdgesTopicOrderIsAssumed() {
        List<CausalStep> two = reasoner.decompose(List.of("drought", "famine"), Map.of());
        assertThat(two).singleElement().satisfies(c -> {
            assertThat(c.assumed).isTrue();
            assertThat(c.confidence).isEqualTo(0.6);
            assertThat(c.describe()).isEqualTo("drought → famine");
        });

        List<CausalStep> three = reasoner.decompose(List.of("a", "b", "c"), null);
        assertThat(three).extracting(c -> c.confidence).containsExactly(0.5, 0.5);
        assertThat(reasoner.decompose(List.of("a"), Map.of())).isEmpty();
    }

    @Test
    void causalEdgesBecomeStepsStrongestFirst() {
        Map<String, List<Relationship>> graph = Map.of(
                "a", List.of(new Relationship("a", "c", RelationshipType.CAUSAL, 0.6, 0.7, "a causes c"),
                        new Relationship("a", "b", RelationshipType.ASSOCIATIVE, 0.9, 0.7, "")),
                "b", List.of(new Relationship("b", "c", RelationshipType.CAUSAL, 0.8, 0.7, "b causes c")));

        List<CausalStep> steps = reasoner.decompose(List.of("a", "b", "c"), graph);

        assertThat(steps).extracting(CausalStep::describe).containsExactly("b → c", "a → c");
        assertThat(steps).noneMatch(c -> c.assumed);
        assertThat(steps.get(0).mechanism).isEqualTo("b causes c");
    }

    @Test
    void reasonsOverSuppliedKnowledgeAndPersistsTheGraph() {
        LinkedHashMap<String, List<KnowledgeItem>> byTopic = new LinkedHashMap<>();
        byTopic.put("climate change", List.of(KnowledgeItem.of("climate change", "Climate",
                "Climate change causes droughts that reduce agriculture yields.", "wikipedia", 0.8)));
        byTopic.put("agriculture", List.of(KnowledgeItem.of("agriculture", "Farming",
                "Agriculture depends on stable rainfall.", "wikipedia", 0.8)));

        ReasoningChain chain = reasoner.reason("How does climate change affect agriculture?", byTopic);

        assertThat(chain.reasoningType).isEqualTo(ReasoningType.CAUSAL);
        assertThat(chain.steps).singleElement().satisfies(s -> {
            assertThat(s.description).isEqualTo("Analyze causal relationship: climate change → agriculture");
            assertThat(s.reasoning).startsWith("Step 1: Analyzing how 'climate change' affects 'agriculture'")
                    .contains("Knowledge: Climate change causes droughts")
                    .contains("Mechanism: ");
            // base 0.5 plus one causal indicator
            assertThat(s.confidence).isCloseTo(0.6, within(1e-9));
        });
        assertThat(chain.conclusion).startsWith(CausalReasoner.LEAD_IN + "Step 1: Analyzing how");
        assertThat(chain.relationships).extracting(Relationship::describe)
                .containsExactly("climate change causal agriculture");
        assertThat(relationships.size()).isEqualTo(1);
    }

    @Test
    void twoTopicsWithoutKnowledgeFallBackToAssumedHop() {
        ReasoningChain chain = reasoner.reason("How does climate change affect agriculture?");

        assertThat(chain.steps).singleElement()
                .satisfies(s -> assertThat(s.confidence).isEqualTo(0.6));
        assertThat(chain.topicsInvolved).containsExactly("climate change", "agriculture");
    }

    @Test
    void singleTopicDelegatesToEngine() {
        ReasoningChain chain = reasoner.reason("What is photosynthesis?");

        assertThat(chain.conclusion).doesNotStartWith(CausalReasoner.LEAD_IN);
        assertThat(chain.steps).isNotEmpty();
    }
}
