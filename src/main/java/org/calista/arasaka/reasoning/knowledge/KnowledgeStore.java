package org.calista.arasaka.reasoning.knowledge;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Knowledge store contract.
 *
 * <p>Search is a case-insensitive substring match over topic, title and content. Writes are
 * guarded by content-hash uniqueness: a losing insert reports a duplicate, it is not an error.</p>
 */
public interface KnowledgeStore {

    /**
     * @param query         substring to look for; blank matches everything
     * @param topic         optional topic filter (case-insensitive substring of the item topic)
     * @param limit         max results; non-positive means no limit
     * @param minConfidence items below are skipped
     * @return confidence desc, quality desc, id asc
     */
    List<KnowledgeItem> search(String query, String topic, int limit, double minConfidence);

    AddResult add(KnowledgeItem item);

    Optional<KnowledgeItem> get(long id);

    /** All items ordered by id. */
    List<KnowledgeItem> snapshotSorted();

    int size();

    default List<KnowledgeItem> search(String query, int limit) {
        return search(query, null, limit, 0.0);
    }

    default BatchReport addAll(Collection<KnowledgeItem> items) {
        int added = 0;
        int dup = 0;
        int bad = 0;
        if (items != null) {
            for (KnowledgeItem k : items) {
                if (k == null) continue;
                try {
                    if (add(k).duplicate) dup++;
                    else added++;
                } catch (IllegalArgumentException e) {
                    bad++;
                }
            }
        }
        return new BatchReport(added, dup, bad);
    }

    // -----------------------------------------------------------------------------------------

    final class AddResult {
        public final long id;
        /** true when an item with identical content was already stored; {@link #id} is then its id. */
        public final boolean duplicate;

        private AddResult(long id, boolean duplicate) {
            this.id = id;
            this.duplicate = duplicate;
        }

        public static AddResult added(long id) {
            return new AddResult(id, false);
        }

        public static AddResult duplicate(long existingId) {
            return new AddResult(existingId, true);
        }

        @Override
        public String toString() {
            return duplicate ? "DUPLICATE(" + id + ")" : "ADDED(" + id + ")";
        }
    }

    final class BatchReport {
        public final int added;
        public final int duplicates;
        public final int invalid;

        public BatchReport(int added, int duplicates, int invalid) {
            this.added = added;
            this.duplicates = duplicates;
            this.invalid = invalid;
        }

        @Override
        public String toString() {
            return "BatchReport{added=" + added + ", duplicates=" + duplicates + ", invalid=" + invalid + '}';
        }
    }
}
