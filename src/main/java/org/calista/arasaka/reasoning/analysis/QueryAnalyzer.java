package org.calista.arasaka.reasoning.analysis;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.arasaka.reasoning.text.Texts;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Query analysis: intent, reasoning type, complexity, domains, topics, decomposition.
 *
 * <p>Stateless apart from its config; safe to share between threads. Never throws on any string
 * input: empty or failing input produces {@link QueryAnalysis#empty(String)}.</p>
 */
public final class QueryAnalyzer {

    private static final Logger log = LogManager.getLogger(QueryAnalyzer.class);

    public static final class Config {
        /** Previous turns considered by context-aware analysis. */
        public int contextWindow = 5;
        /** contextRelevance above this marks the query as a follow-up. */
        public double followUpThreshold = 0.3;

        public Config validate() {
            if (contextWindow < 0) contextWindow = 0;
            followUpThreshold = Texts.clamp01(followUpThreshold);
            return this;
        }
    }

    static final List<String> KEY_PHRASES = List.of(
            "how does", "how do", "why does", "what causes", "what is", "what are", "compare",
            "difference between", "relationship between", "effect of", "impact of");

    static final List<String> RELATIONAL = List.of(
            "and", "or", "but", "between", "versus", "relationship", "connection", "compared to");

    static final List<String> MULTI_TOPIC_CUES = List.of(
            "affect", "affects", "impact", "impacts", "influence", "influences",
            "relationship between", "connection between", "compare", "versus", "difference between");

    static final List<String> TEMPORAL_WORDS = List.of(
            "before", "after", "during", "when", "then", "now", "past", "future", "history",
            "historical", "recent", "ancient", "modern", "today", "yesterday", "tomorrow",
            "century", "decade", "year");

    static final List<String> SPATIAL_WORDS = List.of(
            "where", "location", "near", "far", "above", "below", "inside", "outside", "between",
            "around", "region", "country", "city", "area");

    static final List<String> CLARIFICATION = List.of(
            "what do you mean", "clarify", "i mean", "in other words", "more detail", "elaborate");

    static final Map<String, List<String>> SECONDARY;

    static {
        LinkedHashMap<String, List<String>> m = new LinkedHashMap<>();
        m.put("examples", List.of("example", "examples", "application", "applications", "use case", "use cases"));
        m.put("prerequisites", List.of("prerequisite", "prerequisites", "requirement", "requirements", "before learning"));
        m.put("alternatives", List.of("alternative", "alternatives", "instead of", "other options"));
        m.put("advantages", List.of("advantage", "advantages", "benefit", "benefits", "pros"));
        m.put("disadvantages", List.of("disadvantage", "disadvantages", "drawback", "drawbacks", "cons", "limitations"));
        SECONDARY = m;
    }

    private final Config cfg;

    public QueryAnalyzer() {
        this(new Config());
    }

    public QueryAnalyzer(Config cfg) {
        this.cfg = (cfg == null ? new Config() : cfg).validate();
    }

    public QueryAnalysis analyze(String query) {
        return analyze(query, List.of());
    }

    /**
     * @param context previous conversation turns, oldest first; may be null
     */
    public QueryAnalysis analyze(String query, List<String> context) {
        if (query == null || query.isBlank()) return QueryAnalysis.empty(query);
        try {
            QueryAnalysis a = analyzeInternal(query.trim(), context == null ? List.of() : context);
            if (log.isDebugEnabled()) log.debug("analyze '{}' -> {}", Texts.truncate(query, 80), a);
            return a;
        } catch (RuntimeException e) {
            log.warn("query analysis failed, using degenerate analysis: {}", e.toString());
            return QueryAnalysis.empty(query);
        }
    }

    private QueryAnalysis analyzeInternal(String q, List<String> context) {
        String lower = Texts.lower(q);

        IntentClassifier.Match intent = IntentClassifier.classify(q);
        List<String> topics = TopicExtractor.topics(q);

        LinkedHashSet<String> entities = new LinkedHashSet<>();
        if (intent.intent == QueryIntent.BIOGRAPHICAL && intent.entity != null) entities.add(intent.entity);
        entities.addAll(TopicExtractor.entities(q));

        double ctxRel = contextRelevance(q, context);
        ArrayList<String> implicit = new ArrayList<>(2);
        if (ctxRel > cfg.followUpThreshold) implicit.add("follow_up");
        if (Texts.containsAnyPhrase(lower, CLARIFICATION)) implicit.add("clarification");

        return QueryAnalysis.builder()
                .originalQuery(q)
                .intent(intent.intent)
                .intentEntity(intent.entity)
                .reasoningType(ReasoningTypeClassifier.classify(q))
                .complexity(complexity(q))
                .complexityLevel(complexityLevel(q))
                .domains(Domain.rank(q))
                .topics(topics)
                .entities(new ArrayList<>(entities))
                .keyPhrases(matched(lower, KEY_PHRASES))
                .requiresMultiTopic(topics.size() >= 2 || Texts.containsAnyPhrase(lower, MULTI_TOPIC_CUES))
                .decomposedQueries(QueryDecomposer.decompose(q))
                .secondaryIntents(secondaryIntents(lower))
                .temporalIndicators(matched(lower, TEMPORAL_WORDS))
                .spatialIndicators(matched(lower, SPATIAL_WORDS))
                .implicitIntents(implicit)
                .contextRelevance(ctxRel)
                .arithmetic(ArithmeticExpression.find(q).orElse(null))
                .build();
    }

    // -----------------------------------------------------------------------------------------
    // complexity
    // -----------------------------------------------------------------------------------------

    /** clamp(0.3 + min(words/20, 0.4) + 0.2*question + 0.1*relational, 0, 1); 0 for empty input. */
    public static double complexity(String query) {
        if (query == null || query.isBlank()) return 0.0;
        int wc = Texts.wordCount(query);
        double c = 0.3 + Math.min(wc / 20.0, 0.4);
        if (query.indexOf('?') >= 0) c += 0.2;
        if (Texts.containsAnyPhrase(Texts.lower(query), RELATIONAL)) c += 0.1;
        return Texts.clamp01(c);
    }

    /**
     * Base level from complexity (1 / 2 above 0.6 / 3 above 0.8), +1 above 10 words or +2 above 20,
     * +1 for several questions or many relational words; within [1, 5].
     */
    public static int complexityLevel(String query) {
        if (query == null || query.isBlank()) return 1;
        double c = complexity(query);
        int level = c > 0.8 ? 3 : (c > 0.6 ? 2 : 1);

        int wc = Texts.wordCount(query);
        if (wc > 20) level += 2;
        else if (wc > 10) level += 1;

        int questions = 0;
        for (int i = 0; i < query.length(); i++) if (query.charAt(i) == '?') questions++;
        int relational = Texts.countPhrases(Texts.lower(query), RELATIONAL);
        if (questions > 1 || relational > 2) level += 1;

        return Math.max(1, Math.min(5, level));
    }

    // -----------------------------------------------------------------------------------------

    public List<String> expandQuery(String query) {
        return QueryExpander.expand(query);
    }

    public List<String> queryVariations(String query) {
        return QueryExpander.variations(query);
    }

    double contextRelevance(String q, List<String> context) {
        if (context.isEmpty() || cfg.contextWindow == 0) return 0.0;
        Set<String> qw = Texts.meaningfulWordSet(q, 2);
        if (qw.isEmpty()) return 0.0;

        LinkedHashSet<String> cw = new LinkedHashSet<>();
        int from = Math.max(0, context.size() - cfg.contextWindow);
        for (int i = from; i < context.size(); i++) cw.addAll(Texts.meaningfulWordSet(context.get(i), 2));

        int overlap = 0;
        for (String w : qw) if (cw.contains(w)) overlap++;
        return overlap / (double) qw.size();
    }

    private static List<String> secondaryIntents(String lower) {
        ArrayList<String> out = new ArrayList<>(2);
        for (Map.Entry<String, List<String>> e : SECONDARY.entrySet()) {
            if (Texts.containsAnyPhrase(lower, e.getValue())) out.add(e.getKey());
        }
        return out;
    }

    private static List<String> matched(String lower, List<String> phrases) {
        ArrayList<String> out = new ArrayList<>(4);
        for (String p : phrases) if (Texts.containsPhrase(lower, p)) out.add(p);
        return out;
    }
}
