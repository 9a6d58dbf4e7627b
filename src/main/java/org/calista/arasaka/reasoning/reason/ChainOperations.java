package org.calista.arasaka.reasoning.reason;

import org.calista.arasaka.reasoning.analysis.Domain;
import org.calista.arasaka.reasoning.analysis.ReasoningType;
import org.calista.arasaka.reasoning.relation.Relationship;
import org.calista.arasaka.reasoning.text.Texts;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Pure operations over steps and chains: dependency resolution, ordering, renumbering, metrics,
 * merge/optimize/repair. Nothing here touches a store or the cache.
 */
public final class ChainOperations {

    public static final String NO_ANSWER = "I cannot provide a definitive answer based on the available information.";

    /** Reasoning prefix length used to detect duplicate steps. */
    static final int DEDUP_PREFIX = 100;

    private ChainOperations() {}

    // ---------------------------------------------------------------------
    // Metrics
    // ---------------------------------------------------------------------

    public static double meanConfidence(List<ReasoningStep> steps) {
        if (steps == null || steps.isEmpty()) return 0.0;
        double sum = 0.0;
        for (ReasoningStep s : steps) sum += s.confidence;
        return sum / steps.size();
    }

    /**
     * Valid iff every step has reasoning, mean confidence is above the threshold and the conclusion
     * is longer than 10 chars.
     */
    public static boolean verify(List<ReasoningStep> steps, String conclusion, double minConfidence) {
        if (steps == null || steps.isEmpty()) return false;
        for (ReasoningStep s : steps) {
            if (!s.hasReasoning()) return false;
        }
        if (!(meanConfidence(steps) > minConfidence)) return false;
        return conclusion != null && conclusion.trim().length() > 10;
    }

    public static double quality(List<ReasoningStep> steps, boolean verified, int maxSteps) {
        if (steps == null || steps.isEmpty()) return 0.0;
        double score = verified ? 0.5 : 0.2;
        score += Math.min((double) steps.size() / Math.max(1, maxSteps), 1.0) * 0.2;
        score += meanConfidence(steps) * 0.3;
        return Texts.clamp01(score);
    }

    /** Lead-in of the type, the step insights joined by ". ", then at most 3 relationships. */
    public static String conclude(ReasoningType type, List<ReasoningStep> steps, List<Relationship> relationships) {
        if (steps == null || steps.isEmpty()) return NO_ANSWER;

        ArrayList<String> insights = new ArrayList<>(steps.size());
        for (ReasoningStep s : steps) {
            if (s.hasReasoning()) insights.add(s.reasoning.trim());
        }
        StringBuilder sb = new StringBuilder(StepTemplates.leadIn(type)).append(String.join(". ", insights));

        if (relationships != null && !relationships.isEmpty()) {
            ArrayList<String> rels = new ArrayList<>(3);
            for (Relationship r : relationships) {
                rels.add(r.describe());
                if (rels.size() == 3) break;
            }
            sb.append(". Relationships: ").append(String.join(", ", rels));
        }
        return sb.toString();
    }

    /**
     * base * mean(dependency confidence), minus 0.1 when that mean is below 0.6. Applied in step
     * order so a weak early step drags down what builds on it.
     *
     * <p>The engine does not call this: its step confidences are already calibrated. Callers that
     * post-process a chain (merge, optimize, hand-built steps) apply it on their own copy.</p>
     */
    public static void adjustConfidenceByDependencies(List<ReasoningStep> steps) {
        if (steps == null || steps.isEmpty()) return;
        Map<Integer, ReasoningStep> byNumber = index(steps);
        for (ReasoningStep s : steps) {
            double sum = 0.0;
            int n = 0;
            for (int dep : s.dependencies) {
                ReasoningStep d = byNumber.get(dep);
                if (d == null) continue;
                sum += d.confidence;
                n++;
            }
            double depConf = n == 0 ? 1.0 : sum / n;
            double penalty = depConf < 0.6 ? 0.1 : 0.0;
            s.confidence = Texts.clamp01(s.confidence * depConf - penalty);
        }
    }

    // ---------------------------------------------------------------------
    // Dependencies / ordering
    // ---------------------------------------------------------------------

    /**
     * Drops steps whose dependency is missing or not strictly earlier. Repeats until stable, since
     * dropping a step can orphan the steps that depend on it.
     */
    public static List<ReasoningStep> resolveDependencies(List<ReasoningStep> steps) {
        if (steps == null || steps.isEmpty()) return List.of();
        List<ReasoningStep> cur = new ArrayList<>(steps);
        while (true) {
            Map<Integer, ReasoningStep> byNumber = index(cur);
            ArrayList<ReasoningStep> kept = new ArrayList<>(cur.size());
            for (ReasoningStep s : cur) {
                boolean ok = true;
                for (int dep : s.dependencies) {
                    if (dep >= s.stepNumber || !byNumber.containsKey(dep)) {
                        ok = false;
                        break;
                    }
                }
                if (ok) kept.add(s);
            }
            if (kept.size() == cur.size()) return kept;
            cur = kept;
        }
    }

    /**
     * Dependencies first, otherwise input order. Missing dependencies are ignored; a cycle is cut at
     * the step that closes it.
     */
    public static List<ReasoningStep> topologicalSort(List<ReasoningStep> steps) {
        if (steps == null || steps.isEmpty()) return List.of();
        Map<Integer, ReasoningStep> byNumber = index(steps);
        Set<Integer> done = new HashSet<>();
        Set<Integer> inProgress = new HashSet<>();
        ArrayList<ReasoningStep> out = new ArrayList<>(steps.size());
        for (ReasoningStep s : steps) visit(s, byNumber, done, inProgress, out);
        return out;
    }

    private static void visit(ReasoningStep s, Map<Integer, ReasoningStep> byNumber,
                              Set<Integer> done, Set<Integer> inProgress, List<ReasoningStep> out) {
        if (done.contains(s.stepNumber) || !inProgress.add(s.stepNumber)) return;
        for (int dep : s.dependencies) {
            ReasoningStep d = byNumber.get(dep);
            if (d != null) visit(d, byNumber, done, inProgress, out);
        }
        inProgress.remove(s.stepNumber);
        done.add(s.stepNumber);
        out.add(s);
    }

    /**
     * Copies numbered 1..n in list order. Dependencies are remapped; those that vanish or stop
     * pointing backwards are dropped.
     */
    public static List<ReasoningStep> renumber(List<ReasoningStep> steps) {
        if (steps == null || steps.isEmpty()) return List.of();
        HashMap<Integer, Integer> remap = new HashMap<>();
        for (int i = 0; i < steps.size(); i++) remap.putIfAbsent(steps.get(i).stepNumber, i + 1);

        ArrayList<ReasoningStep> out = new ArrayList<>(steps.size());
        for (int i = 0; i < steps.size(); i++) {
            ReasoningStep s = steps.get(i);
            int n = i + 1;
            out.add(s.renumbered(n, remapDependencies(s.dependencies, remap, n)));
        }
        return out;
    }

    private static List<Integer> remapDependencies(List<Integer> deps, Map<Integer, Integer> remap, int newNumber) {
        LinkedHashSet<Integer> out = new LinkedHashSet<>();
        for (int d : deps) {
            Integer m = remap.get(d);
            if (m != null && m < newNumber) out.add(m);
        }
        return new ArrayList<>(out);
    }

    private static Map<Integer, ReasoningStep> index(List<ReasoningStep> steps) {
        HashMap<Integer, ReasoningStep> m = new HashMap<>(steps.size() * 2);
        for (ReasoningStep s : steps) m.putIfAbsent(s.stepNumber, s);
        return m;
    }

    // ---------------------------------------------------------------------
    // Chain-level transforms
    // ---------------------------------------------------------------------

    static String reasoningKey(ReasoningStep s) {
        String r = Texts.lower(s.reasoning == null ? "" : s.reasoning.trim());
        return r.length() > DEDUP_PREFIX ? r.substring(0, DEDUP_PREFIX) : r;
    }

    /**
     * Steps of all chains deduplicated by reasoning prefix and renumbered; conclusions joined,
     * confidence and quality averaged, verified only if every input was.
     */
    public static ReasoningChain merge(List<ReasoningChain> chains) {
        Objects.requireNonNull(chains, "chains");
        if (chains.isEmpty()) throw new IllegalArgumentException("nothing to merge");
        if (chains.size() == 1) return chains.get(0);

        ReasoningChain first = chains.get(0);
        LinkedHashMap<String, Integer> seen = new LinkedHashMap<>();
        ArrayList<ReasoningStep> merged = new ArrayList<>();
        LinkedHashSet<String> topics = new LinkedHashSet<>();
        LinkedHashMap<Relationship.Key, Relationship> rels = new LinkedHashMap<>();
        LinkedHashSet<Domain> domains = new LinkedHashSet<>();
        ArrayList<String> conclusions = new ArrayList<>();
        double conf = 0.0;
        double quality = 0.0;
        boolean verified = true;
        long time = 0L;

        for (ReasoningChain c : chains) {
            HashMap<Integer, Integer> remap = new HashMap<>();
            for (ReasoningStep s : c.steps) {
                String key = reasoningKey(s);
                Integer existing = key.isEmpty() ? null : seen.get(key);
                if (existing != null) {
                    remap.put(s.stepNumber, existing);
                    continue;
                }
                int n = merged.size() + 1;
                remap.put(s.stepNumber, n);
                merged.add(s.renumbered(n, remapDependencies(s.dependencies, remap, n)));
                if (!key.isEmpty()) seen.put(key, n);
            }
            topics.addAll(c.topicsInvolved);
            for (Relationship r : c.relationships) {
                rels.merge(r.key(), r, (a, b) -> b.strength > a.strength ? b : a);
            }
            domains.addAll(c.domains);
            if (!c.conclusion.isBlank()) conclusions.add(c.conclusion.trim());
            conf += c.confidence;
            quality += c.qualityScore;
            verified &= c.verificationResult;
            time += c.processingTimeMs;
        }

        int n = chains.size();
        return ReasoningChain.builder(first.query, first.reasoningType)
                .steps(merged)
                .conclusion(String.join(" ", conclusions))
                .confidence(Texts.clamp01(conf / n))
                .qualityScore(Texts.clamp01(quality / n))
                .verificationResult(verified)
                .topicsInvolved(new ArrayList<>(topics))
                .relationships(new ArrayList<>(rels.values()))
                .domains(new ArrayList<>(domains))
                .processingTimeMs(time)
                .build();
    }

    /** Drops steps repeating an earlier step's reasoning, renumbers, recomputes the metrics. */
    public static ReasoningChain optimize(ReasoningChain chain, double minConfidence, int maxSteps) {
        Objects.requireNonNull(chain, "chain");
        Set<String> seen = new HashSet<>();
        ArrayList<ReasoningStep> kept = new ArrayList<>(chain.steps.size());
        for (ReasoningStep s : chain.steps) {
            String key = reasoningKey(s);
            if (!key.isEmpty() && !seen.add(key)) continue;
            kept.add(s);
        }
        if (kept.size() == chain.steps.size()) return chain;
        return recompute(chain, renumber(kept), minConfidence, maxSteps);
    }

    /**
     * Repairs numbering gaps and out-of-range confidences, then recomputes the metrics. Empty
     * reasoning is left empty, so such a chain still fails verification.
     */
    public static ReasoningChain validateAndFix(ReasoningChain chain, double minConfidence, int maxSteps) {
        Objects.requireNonNull(chain, "chain");
        List<ReasoningStep> fixed = renumber(topologicalSort(chain.steps));
        for (ReasoningStep s : fixed) {
            if (!Double.isFinite(s.confidence)) s.confidence = 0.0;
            s.confidence = Texts.clamp01(s.confidence);
        }
        return recompute(chain, fixed, minConfidence, maxSteps);
    }

    static ReasoningChain recompute(ReasoningChain chain, List<ReasoningStep> steps, double minConfidence, int maxSteps) {
        String conclusion = chain.conclusion.isBlank()
                ? conclude(chain.reasoningType, steps, chain.relationships)
                : chain.conclusion;
        boolean verified = verify(steps, conclusion, minConfidence);
        return chain.toBuilder()
                .steps(steps)
                .conclusion(conclusion)
                .confidence(Texts.clamp01(meanConfidence(steps)))
                .verificationResult(verified)
                .qualityScore(quality(steps, verified, maxSteps))
                .build();
    }
}
