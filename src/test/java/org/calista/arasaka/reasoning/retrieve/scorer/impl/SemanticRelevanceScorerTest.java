package org.calista.arasaka.reasoning.retrieve.scorer.impl;

import org.calista.arasaka.reasoning.analysis.QueryAnalysis;
import org.calista.arasaka.reasoning.analysis.QueryIntent;
import org.calista.arasaka.reasoning.knowledge.KnowledgeItem;
import org.calista.arasaka.reasoning.retrieve.Scored;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SemanticRelevanceScorerTest {

    private final SemanticRelevanceScorer scorer = new SemanticRelevanceScorer();

    private static KnowledgeItem item(String title, String content) {
        return KnowledgeItem.of("t", title, content, "wikipedia", 0.8);
    }

    @Test
    void generalConceptIsNotAnsweredByQualifiedNamesake() {
        KnowledgeItem game = item("Game physics",
                "Game physics is the simulation of physics inside a physics engine for interactive games.");

        assertThat(scorer.score("What is physics?", game)).isZero();
        // the query itself asks for games
        assertThat(scorer.score("What is physics in video games?", game)).isPositive();
    }

    @Test
    void mediaContentIsRejectedUnlessAskedFor() {
        KnowledgeItem song = item("Photosynthesis Song - Official Music Video",
                "A catchy tune about how plants make their food from sunlight.");

        assertThat(scorer.score("What is photosynthesis?", song)).isZero();
        assertThat(scorer.score("photosynthesis song", song)).isPositive();
    }

    @Test
    void promotionalCopyIsRejected() {
        KnowledgeItem promo = item("Photosynthesis",
                "Learn everything you need to know about photosynthesis in our premium course.");

        assertThat(scorer.score("photosynthesis", promo)).isZero();
    }

    @Test
    void titleMatchOutranksPassingMention() {
        KnowledgeItem direct = item("Photosynthesis",
                "Photosynthesis is the process by which plants convert light into chemical energy.");
        KnowledgeItem passing = item("Plants",
                "Plants grow in soil and need water. Light matters for photosynthesis too.");
        KnowledgeItem unrelated = item("Volcanoes", "Volcanoes erupt molten rock.");

        double d = scorer.score("What is photosynthesis?", direct);
        double p = scorer.score("What is photosynthesis?", passing);
        assertThat(d).isGreaterThan(p).isLessThanOrEqualTo(1.0);
        assertThat(p).isPositive();

        List<Scored<KnowledgeItem>> ranked = scorer.filterByRelevance("What is photosynthesis?",
                List.of(unrelated, passing, direct), null, 0.01);
        assertThat(ranked).extracting(s -> s.item).containsExactly(direct, passing);
    }

    @Test
    void definitionWithoutEntityUpFrontIsPenalized() {
        KnowledgeItem late = item("Leaves",
                "Leaves are green. ".repeat(8) + "Chlorophyll drives photosynthesis.");
        QueryAnalysis definition = QueryAnalysis.builder()
                .originalQuery("What is photosynthesis?")
                .intent(QueryIntent.DEFINITION)
                .intentEntity("photosynthesis")
                .build();

        // content word 0.05 + position anywhere 0.02; the penalty halves the overlap part only
        assertThat(scorer.score("What is photosynthesis?", late)).isCloseTo(0.07, within(1e-9));
        assertThat(scorer.score("What is photosynthesis?", late, definition)).isCloseTo(0.045, within(1e-9));
    }

    @Test
    void blankInputScoresZero() {
        assertThat(scorer.score(" ", item("x", "y"))).isZero();
        assertThat(scorer.score("query", null)).isZero();
    }

    // -----------------------------------------------------------------------------------------
    // intent adjustments, isolated from the title phrase and position bonuses
    // -----------------------------------------------------------------------------------------

    private static SemanticRelevanceScorer overlapOnly() {
        SemanticRelevanceScorer.Config cfg = new SemanticRelevanceScorer.Config();
        cfg.titlePhraseMatch = 0.0;
        cfg.positionInTitle = 0.0;
        cfg.positionEarly = 0.0;
        cfg.positionAnywhere = 0.0;
        return new SemanticRelevanceScorer(cfg);
    }

    private static QueryAnalysis intent(String query, QueryIntent intent, String entity) {
        return QueryAnalysis.builder().originalQuery(query).intent(intent).intentEntity(entity).build();
    }

    @Test
    void biographicalProfileOfSomeoneElseIsDemoted() {
        SemanticRelevanceScorer s = overlapOnly();
        String q = "Who is Marie Curie?";
        KnowledgeItem other = item("Marie Dupont", "Marie Dupont is a French chemist known for work on polymers.");

        // title word 0.15 + content word 0.05, surname missing keeps 30%
        assertThat(s.score(q, other)).isCloseTo(0.2, within(1e-9));
        assertThat(s.score(q, other, intent(q, QueryIntent.BIOGRAPHICAL, "Marie Curie"))).isCloseTo(0.06, within(1e-9));
    }

    @Test
    void biographicalIdentityOutranksTrivia() {
        SemanticRelevanceScorer s = overlapOnly();
        String q = "Who is Marie Curie?";
        QueryAnalysis bio = intent(q, QueryIntent.BIOGRAPHICAL, "Marie Curie");
        KnowledgeItem identity = item("Marie Curie",
                "Marie Curie was a Polish physicist and chemist known for her research on radioactivity.");
        KnowledgeItem trivia = item("Marie Curie", "Marie Curie once failed an exam before becoming a scientist.");

        // overlap 0.4 + name 0.3 + identity marker 0.2
        assertThat(s.score(q, identity, bio)).isCloseTo(0.9, within(1e-9));
        // same, then the anecdote up front keeps 40%
        assertThat(s.score(q, trivia, bio)).isCloseTo(0.36, within(1e-9));

        List<Scored<KnowledgeItem>> ranked = s.filterByRelevance(q, List.of(trivia, identity), bio, 0.1);
        assertThat(ranked).extracting(x -> x.item).containsExactly(identity, trivia);
    }

    @Test
    void philosophicalQueryNeedsTopicVocabulary() {
        SemanticRelevanceScorer s = overlapOnly();
        String q = "What is the meaning of life?";
        QueryAnalysis philosophical = intent(q, QueryIntent.PHILOSOPHICAL, null);
        KnowledgeItem onTopic = item("Meaning of life",
                "The meaning of life is a question about existence and purpose.");
        KnowledgeItem offTopic = item("Life insurance", "Insurance policies pay out to beneficiaries after a claim.");

        // category 0.3 + title words 0.3 + content words 0.1 + vocabulary 0.3
        assertThat(s.score(q, onTopic, philosophical)).isCloseTo(1.0, within(1e-9));
        // category 0.3 + title word 0.15, no vocabulary keeps 10%
        assertThat(s.score(q, offTopic)).isCloseTo(0.45, within(1e-9));
        assertThat(s.score(q, offTopic, philosophical)).isCloseTo(0.045, within(1e-9));
    }

    @Test
    void raisingMinScoreOnlyRemovesItemsAndKeepsOrder() {
        String q = "What is photosynthesis?";
        List<KnowledgeItem> items = List.of(
                item("Volcanoes", "Volcanoes erupt molten rock."),
                item("Plants", "Plants grow in soil and need water. Light matters for photosynthesis too."),
                item("Photosynthesis", "Photosynthesis is the process by which plants convert light into chemical energy."),
                item("Leaves", "Leaves are green. ".repeat(8) + "Chlorophyll drives photosynthesis."),
                item("Chlorophyll and photosynthesis", "Chlorophyll absorbs light for photosynthesis in leaves."));

        List<KnowledgeItem> previous = null;
        for (double min : new double[]{0.0, 0.05, 0.1, 0.3, 0.5, 0.8, 1.0}) {
            List<Scored<KnowledgeItem>> ranked = scorer.filterByRelevance(q, items, null, min);

            for (int i = 1; i < ranked.size(); i++) {
                assertThat(ranked.get(i).score).isLessThanOrEqualTo(ranked.get(i - 1).score);
            }
            assertThat(ranked).allSatisfy(x -> assertThat(x.score).isGreaterThanOrEqualTo(min));

            List<KnowledgeItem> kept = ranked.stream().map(x -> x.item).toList();
            if (previous != null) assertThat(previous).containsAll(kept);
            previous = kept;
        }
        assertThat(scorer.filterByRelevance(q, items, null, 0.0)).hasSize(items.size());
    }
}
