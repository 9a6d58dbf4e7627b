package org.calista.arasaka.reasoning.analysis;

import org.calista.arasaka.reasoning.text.Texts;

import java.util.List;
import java.util.function.Predicate;

/**
 * Priority-ordered cue-word classifier for {@link ReasoningType}.
 *
 * <p>Order: mathematical, comparative, causal, deductive, logical, temporal, spatial, inductive,
 * abductive, analogical, analytical; {@link ReasoningType#GENERAL} when none match. Causal comes
 * before abductive because "why ... because" phrasing carries both cues.</p>
 */
public final class ReasoningTypeClassifier {

    static final List<String> MATHEMATICAL = List.of(
            "calculate", "compute", "solve", "equation", "arithmetic", "plus", "minus",
            "multiply", "multiplied", "divide", "divided", "sum of", "square root", "percent of");
    static final List<String> COMPARATIVE = List.of(
            "compare", "comparison", "versus", "vs", "difference between", "differences between",
            "similarities between", "contrast", "better than", "worse than", "pros and cons");
    static final List<String> CAUSAL = List.of(
            "cause", "causes", "caused", "causing", "effect", "effects", "affect", "affects",
            "affected", "impact", "impacts", "influence", "influences", "leads to", "lead to",
            "results in", "result in", "because", "due to", "consequence", "consequences");
    static final List<String> DEDUCTIVE = List.of(
            "therefore", "must be", "necessarily", "it follows", "all of", "deduce", "conclude");
    static final List<String> LOGICAL = List.of(
            "logic", "logical", "premise", "premises", "implies", "imply", "syllogism",
            "valid", "validity", "contradiction", "true or false", "if");
    static final List<String> TEMPORAL = List.of(
            "before", "after", "during", "timeline", "chronology", "chronological", "sequence",
            "when did", "how long", "history of", "evolution of");
    static final List<String> SPATIAL = List.of(
            "where", "location", "located", "position", "distance", "direction", "near", "far from");
    static final List<String> INDUCTIVE = List.of(
            "pattern", "patterns", "trend", "trends", "generally", "usually", "typically",
            "often", "generalize", "in general");
    static final List<String> ABDUCTIVE = List.of(
            "why", "explain", "explanation", "likely", "probably", "best explanation", "reason for");
    static final List<String> ANALOGICAL = List.of(
            "similar", "similar to", "analogous", "analogy", "metaphor", "resembles", "is like",
            "compared to");
    static final List<String> ANALYTICAL = List.of(
            "analyze", "analyse", "analysis", "examine", "evaluate", "assess", "break down", "what makes");

    private static final FirstMatch<String, ReasoningType> RULES = FirstMatch.<String, ReasoningType>builder()
            .rule("mathematical", q -> ArithmeticExpression.find(q).isPresent() || any(MATHEMATICAL).test(q),
                    ReasoningType.MATHEMATICAL)
            .rule("comparative", any(COMPARATIVE), ReasoningType.COMPARATIVE)
            .rule("causal", any(CAUSAL), ReasoningType.CAUSAL)
            .rule("deductive", any(DEDUCTIVE).or(ReasoningTypeClassifier::ifThen), ReasoningType.DEDUCTIVE)
            .rule("logical", any(LOGICAL), ReasoningType.LOGICAL)
            .rule("temporal", any(TEMPORAL), ReasoningType.TEMPORAL)
            .rule("spatial", any(SPATIAL), ReasoningType.SPATIAL)
            .rule("inductive", any(INDUCTIVE), ReasoningType.INDUCTIVE)
            .rule("abductive", any(ABDUCTIVE), ReasoningType.ABDUCTIVE)
            .rule("analogical", any(ANALOGICAL), ReasoningType.ANALOGICAL)
            .rule("analytical", any(ANALYTICAL), ReasoningType.ANALYTICAL)
            .build();

    private ReasoningTypeClassifier() {}

    public static ReasoningType classify(String query) {
        if (query == null || query.isBlank()) return ReasoningType.GENERAL;
        return RULES.evaluate(query).orElse(ReasoningType.GENERAL);
    }

    /** Rule order, for diagnostics and tests. */
    public static List<String> ruleOrder() {
        return RULES.names();
    }

    private static Predicate<String> any(List<String> cues) {
        return q -> Texts.containsAnyPhrase(Texts.lower(q), cues);
    }

    private static boolean ifThen(String q) {
        String l = Texts.lower(q);
        return Texts.containsPhrase(l, "if") && Texts.containsPhrase(l, "then");
    }
}
