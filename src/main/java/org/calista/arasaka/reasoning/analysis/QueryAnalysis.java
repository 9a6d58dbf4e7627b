package org.calista.arasaka.reasoning.analysis;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable result of {@link QueryAnalyzer#analyze(String, List)}.
 */
public final class QueryAnalysis {

    public final String originalQuery;
    public final QueryIntent intent;
    /** Entity captured by the intent pattern, e.g. the person in "who is ...". May be null. */
    public final String intentEntity;
    public final ReasoningType reasoningType;
    public final double complexity;
    public final int complexityLevel;
    /** Ordered by match score; never empty ({@link Domain#GENERAL} when nothing matched). */
    public final List<Domain> domains;
    public final List<String> topics;
    public final List<String> entities;
    public final List<String> keyPhrases;
    public final boolean requiresMultiTopic;
    public final List<String> decomposedQueries;
    public final List<String> secondaryIntents;
    public final List<String> temporalIndicators;
    public final List<String> spatialIndicators;
    public final List<String> implicitIntents;
    public final double contextRelevance;
    private final ArithmeticExpression arithmetic;

    private QueryAnalysis(Builder b) {
        this.originalQuery = b.originalQuery == null ? "" : b.originalQuery;
        this.intent = b.intent == null ? QueryIntent.GENERAL : b.intent;
        this.intentEntity = b.intentEntity;
        this.reasoningType = b.reasoningType == null ? ReasoningType.GENERAL : b.reasoningType;
        this.complexity = b.complexity;
        this.complexityLevel = b.complexityLevel;
        this.domains = b.domains == null || b.domains.isEmpty() ? List.of(Domain.GENERAL) : List.copyOf(b.domains);
        this.topics = copy(b.topics);
        this.entities = copy(b.entities);
        this.keyPhrases = copy(b.keyPhrases);
        this.requiresMultiTopic = b.requiresMultiTopic;
        this.decomposedQueries = copy(b.decomposedQueries);
        this.secondaryIntents = copy(b.secondaryIntents);
        this.temporalIndicators = copy(b.temporalIndicators);
        this.spatialIndicators = copy(b.spatialIndicators);
        this.implicitIntents = copy(b.implicitIntents);
        this.contextRelevance = b.contextRelevance;
        this.arithmetic = b.arithmetic;
    }

    /** Degenerate analysis for empty input. */
    public static QueryAnalysis empty(String query) {
        return builder().originalQuery(query == null ? "" : query).complexity(0.0).complexityLevel(1).build();
    }

    public Optional<ArithmeticExpression> arithmetic() {
        return Optional.ofNullable(arithmetic);
    }

    public Domain primaryDomain() {
        return domains.get(0);
    }

    public Optional<String> intentEntity() {
        return Optional.ofNullable(intentEntity);
    }

    private static List<String> copy(List<String> in) {
        return in == null ? List.of() : List.copyOf(in);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "QueryAnalysis{intent=" + intent.label()
                + ", type=" + reasoningType.label()
                + ", complexity=" + String.format(java.util.Locale.ROOT, "%.2f", complexity)
                + ", level=" + complexityLevel
                + ", topics=" + topics
                + ", multi=" + requiresMultiTopic + "}";
    }

    public static final class Builder {
        private String originalQuery;
        private QueryIntent intent;
        private String intentEntity;
        private ReasoningType reasoningType;
        private double complexity;
        private int complexityLevel = 1;
        private List<Domain> domains;
        private List<String> topics;
        private List<String> entities;
        private List<String> keyPhrases;
        private boolean requiresMultiTopic;
        private List<String> decomposedQueries;
        private List<String> secondaryIntents;
        private List<String> temporalIndicators;
        private List<String> spatialIndicators;
        private List<String> implicitIntents;
        private double contextRelevance;
        private ArithmeticExpression arithmetic;

        public Builder originalQuery(String v) { this.originalQuery = v; return this; }
        public Builder intent(QueryIntent v) { this.intent = v; return this; }
        public Builder intentEntity(String v) { this.intentEntity = v; return this; }
        public Builder reasoningType(ReasoningType v) { this.reasoningType = Objects.requireNonNull(v, "reasoningType"); return this; }
        public Builder complexity(double v) { this.complexity = v; return this; }
        public Builder complexityLevel(int v) { this.complexityLevel = v; return this; }
        public Builder domains(List<Domain> v) { this.domains = v; return this; }
        public Builder topics(List<String> v) { this.topics = v; return this; }
        public Builder entities(List<String> v) { this.entities = v; return this; }
        public Builder keyPhrases(List<String> v) { this.keyPhrases = v; return this; }
        public Builder requiresMultiTopic(boolean v) { this.requiresMultiTopic = v; return this; }
        public Builder decomposedQueries(List<String> v) { this.decomposedQueries = v; return this; }
        public Builder secondaryIntents(List<String> v) { this.secondaryIntents = v; return this; }
        public Builder temporalIndicators(List<String> v) { this.temporalIndicators = v; return this; }
        public Builder spatialIndicators(List<String> v) { this.spatialIndicators = v; return this; }
        public Builder implicitIntents(List<String> v) { this.implicitIntents = v; return this; }
        public Builder contextRelevance(double v) { this.contextRelevance = v; return this; }
        public Builder arithmetic(ArithmeticExpression v) { this.arithmetic = v; return this; }

        public QueryAnalysis build() {
            return new QueryAnalysis(this);
        }
    }
}
