package org.calista.arasaka.reasoning.retrieve.scorer;

import org.calista.arasaka.reasoning.analysis.QueryAnalysis;
import org.calista.arasaka.reasoning.knowledge.KnowledgeItem;
import org.calista.arasaka.reasoning.retrieve.Scored;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Estimates how well a {@link KnowledgeItem} answers a query.
 *
 * Contract:
 *  - deterministic, side-effect free
 *  - result in [0, 1]; 0 means rejected
 */
public interface RelevanceScorer {

    /**
     * @param analysis optional; when present its intent and entity drive intent-specific adjustments
     */
    double score(String query, KnowledgeItem item, QueryAnalysis analysis);

    default double score(String query, KnowledgeItem item) {
        return score(query, item, null);
    }

    /**
     * Items scoring at least {@code minScore}, best first; equal scores keep input order.
     */
    default List<Scored<KnowledgeItem>> filterByRelevance(String query, Collection<KnowledgeItem> items,
                                                         QueryAnalysis analysis, double minScore) {
        ArrayList<Scored<KnowledgeItem>> out = new ArrayList<>();
        if (items == null || items.isEmpty()) return out;
        for (KnowledgeItem k : items) {
            if (k == null) continue;
            double s = score(query, k, analysis);
            if (s >= minScore) out.add(Scored.of(k, s));
        }
        out.sort(Scored.byScoreDesc());
        return out;
    }
}
