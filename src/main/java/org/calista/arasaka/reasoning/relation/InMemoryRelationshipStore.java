package org.calista.arasaka.reasoning.relation;

import org.calista.arasaka.reasoning.text.Texts;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory {@link RelationshipStore}. Max-strength-wins is applied atomically per key with
 * {@link ConcurrentHashMap#compute}.
 */
public final class InMemoryRelationshipStore implements RelationshipStore {

    static final Comparator<Relationship> BY_STRENGTH = Comparator
            .comparingDouble((Relationship r) -> r.strength).reversed()
            .thenComparing(r -> r.topic1)
            .thenComparing(r -> r.topic2);

    private final ConcurrentHashMap<Relationship.Key, Relationship> byKey = new ConcurrentHashMap<>();

    @Override
    public Upsert upsert(Relationship r) {
        Objects.requireNonNull(r, "relationship");
        Upsert[] outcome = new Upsert[1];
        byKey.compute(r.key(), (k, existing) -> {
            if (existing == null) {
                outcome[0] = Upsert.INSERTED;
                return r;
            }
            if (r.strength > existing.strength) {
                outcome[0] = Upsert.UPDATED;
                return r;
            }
            outcome[0] = Upsert.DUPLICATE;
            return existing;
        });
        return outcome[0];
    }

    @Override
    public List<Relationship> get(String topic, RelationshipType type) {
        String t = Texts.lower(topic).trim();
        ArrayList<Relationship> out = new ArrayList<>();
        for (Relationship r : byKey.values()) {
            if (type != null && r.type != type) continue;
            if (r.involves(t)) out.add(r);
        }
        out.sort(BY_STRENGTH);
        return out;
    }

    @Override
    public List<String> findRelated(String topic, int maxDepth) {
        String start = Texts.lower(topic).trim();
        if (start.isEmpty() || maxDepth <= 0) return List.of();

        Map<String, List<String>> adj = adjacency(null, false);
        LinkedHashSet<String> seen = new LinkedHashSet<>();
        seen.add(start);
        ArrayDeque<String> frontier = new ArrayDeque<>();
        frontier.add(start);

        for (int depth = 0; depth < maxDepth && !frontier.isEmpty(); depth++) {
            ArrayDeque<String> next = new ArrayDeque<>();
            for (String cur : frontier) {
                for (String n : adj.getOrDefault(cur, List.of())) {
                    if (seen.add(n)) next.add(n);
                }
            }
            frontier = next;
        }
        seen.remove(start);
        return new ArrayList<>(seen);
    }

    @Override
    public Optional<List<Relationship>> findCausalPath(String from, String to, int maxDepth) {
        String a = Texts.lower(from).trim();
        String b = Texts.lower(to).trim();
        if (a.isEmpty() || b.isEmpty() || a.equals(b) || maxDepth <= 0) return Optional.empty();

        HashMap<String, List<Relationship>> out = new HashMap<>();
        for (Relationship r : byKey.values()) {
            if (r.type == RelationshipType.CAUSAL) out.computeIfAbsent(r.topic1, k -> new ArrayList<>()).add(r);
        }
        for (List<Relationship> l : out.values()) l.sort(BY_STRENGTH);

        // BFS keeps the shortest path; parent edge per visited topic
        HashMap<String, Relationship> via = new HashMap<>();
        ArrayDeque<String> frontier = new ArrayDeque<>();
        frontier.add(a);
        LinkedHashSet<String> seen = new LinkedHashSet<>();
        seen.add(a);

        for (int depth = 0; depth < maxDepth && !frontier.isEmpty(); depth++) {
            ArrayDeque<String> next = new ArrayDeque<>();
            for (String cur : frontier) {
                for (Relationship r : out.getOrDefault(cur, List.of())) {
                    if (!seen.add(r.topic2)) continue;
                    via.put(r.topic2, r);
                    if (r.topic2.equals(b)) return Optional.of(unwind(via, a, b));
                    next.add(r.topic2);
                }
            }
            frontier = next;
        }
        return Optional.empty();
    }

    @Override
    public List<Relationship> all() {
        ArrayList<Relationship> out = new ArrayList<>(byKey.values());
        out.sort(BY_STRENGTH);
        return out;
    }

    @Override
    public int size() {
        return byKey.size();
    }

    private Map<String, List<String>> adjacency(RelationshipType type, boolean directed) {
        HashMap<String, List<String>> adj = new HashMap<>();
        for (Relationship r : all()) {
            if (type != null && r.type != type) continue;
            adj.computeIfAbsent(r.topic1, k -> new ArrayList<>()).add(r.topic2);
            if (!directed) adj.computeIfAbsent(r.topic2, k -> new ArrayList<>()).add(r.topic1);
        }
        return adj;
    }

    private static List<Relationship> unwind(Map<String, Relationship> via, String from, String to) {
        ArrayList<Relationship> path = new ArrayList<>();
        String cur = to;
        while (!cur.equals(from)) {
            Relationship r = via.get(cur);
            path.add(r);
            cur = r.topic1;
        }
        Collections.reverse(path);
        return path;
    }
}
