package org.calista.arasaka.reasoning.reason;

import org.calista.arasaka.reasoning.analysis.ArithmeticExpression;
import org.calista.arasaka.reasoning.analysis.ReasoningType;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Decomposition table: every reasoning type maps to a conclusion lead-in and a fixed list of
 * steps (description, preset confidence). Steps are chained: step i depends on step i-1.
 *
 * <p>Two types branch on the query: CAUSAL picks a 6-step template when two topics are joined by
 * a causal verb ("how does X affect Y"), MATHEMATICAL picks a 3-step template with the first two
 * steps pre-filled when the query carries an arithmetic expression.</p>
 */
public final class StepTemplates {

    static final class StepSpec {
        final String description;
        final double confidence;

        StepSpec(String description, double confidence) {
            this.description = description;
            this.confidence = confidence;
        }
    }

    static final class Template {
        final String leadIn;
        final List<StepSpec> steps;

        Template(String leadIn, List<StepSpec> steps) {
            this.leadIn = leadIn;
            this.steps = List.copyOf(steps);
        }
    }

    private static StepSpec s(String d, double c) {
        return new StepSpec(d, c);
    }

    static final List<StepSpec> CAUSAL_MULTI_TOPIC = List.of(
            s("Identify the initial cause or factor", 0.7),
            s("Identify the affected domain or outcome", 0.7),
            s("Retrieve knowledge about the causal mechanism", 0.8),
            s("Evaluate the causal relationship between domains", 0.7),
            s("Assess evidence and strength of causal link", 0.8),
            s("Determine the complete causal chain", 0.7)
    );

    // "how does X affect Y", "why does X cause Y", "what is the impact of X on Y", ...
    private static final List<Pattern> BI_TOPIC_CAUSAL = List.of(
            Pattern.compile("\\b(?:how|why)\\s+(?:does|do|did|would|could|can|might)\\s+.+?\\s+(?:affect|impact|influence|cause|drive)\\s+\\S+"),
            Pattern.compile("\\b(?:effect|impact|influence)\\s+of\\s+.+?\\s+on\\s+\\S+"),
            Pattern.compile("\\b(?:relationship|link|connection)\\s+between\\s+.+?\\s+and\\s+\\S+")
    );

    private static final Map<ReasoningType, Template> TABLE = new EnumMap<>(ReasoningType.class);

    static {
        TABLE.put(ReasoningType.CAUSAL, new Template("The most likely cause is: ", List.of(
                s("Identify potential causes", 0.7),
                s("Evaluate causal relationships", 0.7),
                s("Assess evidence strength", 0.8),
                s("Determine most likely cause", 0.7))));
        TABLE.put(ReasoningType.LOGICAL, new Template("Logically following the premises: ", List.of(
                s("Identify the logical premises", 0.8),
                s("Determine the logical relationship", 0.8),
                s("Apply logical rules", 0.7),
                s("Draw logical conclusion", 0.8))));
        TABLE.put(ReasoningType.MATHEMATICAL, new Template("Based on the mathematical analysis: ", List.of(
                s("Understand the mathematical problem", 0.8),
                s("Identify the appropriate mathematical approach", 0.8),
                s("Apply the mathematical method", 0.7),
                s("Verify the result", 0.8))));
        TABLE.put(ReasoningType.COMPARATIVE, new Template("After comparing all aspects: ", List.of(
                s("Identify items to compare", 0.9),
                s("Determine comparison criteria", 0.8),
                s("Evaluate each criterion", 0.7),
                s("Synthesize comparison results", 0.8))));
        TABLE.put(ReasoningType.ANALYTICAL, new Template("Analysis conclusion: ", List.of(
                s("Break down the subject into components", 0.8),
                s("Analyze each component", 0.7),
                s("Identify patterns and relationships", 0.7),
                s("Synthesize findings", 0.8))));
        TABLE.put(ReasoningType.TEMPORAL, new Template("Temporal analysis shows: ", List.of(
                s("Identify the events and their time frame", 0.8),
                s("Determine the chronological order", 0.8),
                s("Analyze changes over time", 0.7),
                s("Synthesize the temporal pattern", 0.8))));
        TABLE.put(ReasoningType.SPATIAL, new Template("Spatial analysis indicates: ", List.of(
                s("Identify the locations and entities involved", 0.8),
                s("Determine spatial relationships", 0.8),
                s("Analyze the geographic context", 0.7),
                s("Synthesize the spatial picture", 0.8))));
        TABLE.put(ReasoningType.INDUCTIVE, new Template("Inductive reasoning suggests: ", List.of(
                s("Identify the specific observations", 0.8),
                s("Analyze recurring patterns", 0.7),
                s("Determine the general rule", 0.7),
                s("Synthesize the generalization", 0.7))));
        TABLE.put(ReasoningType.DEDUCTIVE, new Template("Deductive reasoning concludes: ", List.of(
                s("Identify the general premises", 0.8),
                s("Determine which premises apply", 0.8),
                s("Apply the premises to the specific case", 0.7),
                s("Draw the deductive conclusion", 0.8))));
        TABLE.put(ReasoningType.ABDUCTIVE, new Template("The best explanation is: ", List.of(
                s("Identify the phenomenon to explain", 0.8),
                s("Evaluate candidate explanations", 0.7),
                s("Assess which explanation fits the evidence", 0.7),
                s("Determine the best explanation", 0.7))));
        TABLE.put(ReasoningType.ANALOGICAL, new Template("By analogy: ", List.of(
                s("Identify the source and target domains", 0.8),
                s("Analyze shared structure", 0.7),
                s("Apply the mapping to the target", 0.7),
                s("Synthesize the analogy", 0.7))));
        TABLE.put(ReasoningType.GENERAL, new Template("Based on the analysis: ", List.of(
                s("Understand the query requirements", 0.8),
                s("Gather relevant information", 0.7),
                s("Process and analyze information", 0.7),
                s("Formulate response", 0.8))));
    }

    private StepTemplates() {}

    static Template template(ReasoningType type) {
        Template t = TABLE.get(type);
        return t != null ? t : TABLE.get(ReasoningType.GENERAL);
    }

    public static String leadIn(ReasoningType type) {
        return template(type).leadIn;
    }

    public static boolean isMultiTopicCausal(String query) {
        if (query == null || query.isBlank()) return false;
        String q = query.toLowerCase(Locale.ROOT);
        for (Pattern p : BI_TOPIC_CAUSAL) {
            if (p.matcher(q).find()) return true;
        }
        return false;
    }

    /**
     * Fresh, unfilled steps for the query.
     *
     * @param arithmetic expression found in the query, used by MATHEMATICAL only
     */
    public static List<ReasoningStep> decompose(ReasoningType type, String query, Optional<ArithmeticExpression> arithmetic) {
        if (type == ReasoningType.MATHEMATICAL && arithmetic != null && arithmetic.isPresent()) {
            return arithmeticSteps(arithmetic.get());
        }
        if (type == ReasoningType.CAUSAL && isMultiTopicCausal(query)) {
            return chained(CAUSAL_MULTI_TOPIC);
        }
        return chained(template(type).steps);
    }

    static List<ReasoningStep> chained(List<StepSpec> specs) {
        ArrayList<ReasoningStep> out = new ArrayList<>(specs.size());
        for (int i = 0; i < specs.size(); i++) {
            StepSpec sp = specs.get(i);
            int n = i + 1;
            out.add(new ReasoningStep(n, sp.description, sp.confidence, n == 1 ? List.of() : List.of(n - 1)));
        }
        return out;
    }

    static List<ReasoningStep> arithmeticSteps(ArithmeticExpression expr) {
        String ops = expr.operators.isEmpty() ? "none" : String.join(", ", expr.operators);
        ArrayList<ReasoningStep> out = new ArrayList<>(3);
        out.add(new ReasoningStep(1, "Identify the mathematical operation", "Found operation: " + ops, 0.9, List.of()));
        out.add(new ReasoningStep(2, "Extract numbers involved", "Numbers: " + String.join(", ", expr.numbers), 0.9, List.of(1)));
        out.add(new ReasoningStep(3, "Perform the calculation", expr.describeCalculation(), 0.8, List.of(2)));
        return out;
    }
}
