package org.calista.arasaka.reasoning.knowledge;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryKnowledgeStoreTest {

    private final InMemoryKnowledgeStore store = new InMemoryKnowledgeStore();

    @Test
    void addAssignsIdHashAndQuality() {
        KnowledgeStore.AddResult r = store.add(KnowledgeItem.of("Photosynthesis", "Photosynthesis",
                "Plants convert light into chemical energy. It happens in chloroplasts.", "wikipedia", 0.9));

        assertThat(r.duplicate).isFalse();
        KnowledgeItem k = store.get(r.id).orElseThrow();
        assertThat(k.id).isEqualTo(r.id);
        assertThat(k.contentHash).isEqualTo(KnowledgeItem.hashContent(k.content)).hasSize(64);
        assertThat(k.wordCount).isEqualTo(10);
        assertThat(k.qualityScore).isBetween(0.0, 1.0);
    }

    @Test
    void identicalContentIsReportedAsDuplicate() {
        KnowledgeStore.AddResult first = store.add(KnowledgeItem.of("a", "A", "Same content.", "google", 0.5));
        KnowledgeStore.AddResult second = store.add(KnowledgeItem.of("b", "B", "  Same content.  ", "bing", 0.9));

        assertThat(second.duplicate).isTrue();
        assertThat(second.id).isEqualTo(first.id);
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void itemWithoutContentIsRejected() {
        assertThatThrownBy(() -> store.add(KnowledgeItem.of("t", "t", " ", "google", 0.5)))
                .isInstanceOf(IllegalArgumentException.class);

        KnowledgeStore.BatchReport rep = store.addAll(List.of(
                KnowledgeItem.of("t", "t", "first", "google", 0.5),
                KnowledgeItem.of("t", "t", "first", "google", 0.5),
                KnowledgeItem.of("t", "t", "", "google", 0.5)));
        assertThat(rep.added).isEqualTo(1);
        assertThat(rep.duplicates).isEqualTo(1);
        assertThat(rep.invalid).isEqualTo(1);
    }

    @Test
    void searchOrdersByConfidenceThenQualityThenId() {
        KnowledgeItem low = KnowledgeItem.of("solar", "Solar A", "solar panels convert sunlight", "google", 0.4);
        KnowledgeItem high = KnowledgeItem.of("solar", "Solar B", "solar power is renewable", "google", 0.9);
        KnowledgeItem q1 = KnowledgeItem.of("solar", "Solar C", "solar farms are large", "google", 0.7);
        q1.qualityScore = 0.2;
        KnowledgeItem q2 = KnowledgeItem.of("solar", "Solar D", "solar cells use silicon", "google", 0.7);
        q2.qualityScore = 0.8;
        store.addAll(List.of(low, high, q1, q2));

        List<KnowledgeItem> hits = store.search("solar", 10);
        assertThat(hits).extracting(k -> k.title).containsExactly("Solar B", "Solar D", "Solar C", "Solar A");

        assertThat(store.search("solar", null, 10, 0.5)).hasSize(3);
        assertThat(store.search("solar", 2)).hasSize(2);
    }

    @Test
    void searchFallsBackToAllWordsWhenPhraseMisses() {
        store.add(KnowledgeItem.of("energy", "Energy", "Wind turbines produce clean energy.", "google", 0.5));

        assertThat(store.search("turbines clean", 5)).hasSize(1);
        assertThat(store.search("turbines dirty", 5)).isEmpty();
    }

    @Test
    void topicFilterAndSnapshotOrder() {
        store.add(KnowledgeItem.of("economics", "Inflation", "Prices rise over time.", "google", 0.5));
        store.add(KnowledgeItem.of("biology", "Cells", "Cells divide over time.", "google", 0.5));

        assertThat(store.search("over time", "biology", 0, 0.0)).extracting(k -> k.title).containsExactly("Cells");
        assertThat(store.snapshotSorted()).extracting(k -> k.title).containsExactly("Inflation", "Cells");
    }
}
