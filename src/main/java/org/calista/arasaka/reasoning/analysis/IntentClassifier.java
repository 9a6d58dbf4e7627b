package org.calista.arasaka.reasoning.analysis;

import org.calista.arasaka.reasoning.text.Texts;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * First-match intent classification with entity capture.
 *
 * <p>Order: philosophical, biographical, definition, recipe, how_to, comparison, programming,
 * causal_explanation, explanation; {@link QueryIntent#GENERAL} otherwise.</p>
 */
public final class IntentClassifier {

    /** Matched intent plus the captured entity (may be null). */
    public static final class Match {
        public final QueryIntent intent;
        public final String entity;

        Match(QueryIntent intent, String entity) {
            this.intent = intent;
            this.entity = entity;
        }

        public Optional<String> entity() {
            return Optional.ofNullable(entity);
        }
    }

    static final List<String> PHILOSOPHICAL_PHRASES = List.of(
            "what is life", "meaning of life", "purpose of life", "what is existence",
            "what is reality", "what is consciousness", "what is happiness", "what is love",
            "what is truth", "why do we exist");

    private static final Set<String> PRONOUNS = Set.of(
            "he", "she", "it", "they", "you", "i", "we", "this", "that", "him", "her", "them");

    private static final Pattern WHO = Pattern.compile("^\\s*who\\s+(?:is|was|were|are)\\s+(.+?)\\s*[?.!]*\\s*$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern DEFINITION = Pattern.compile(
            "^\\s*(?:what\\s+(?:is|are)|what's|whats|define|definition\\s+of|meaning\\s+of)\\s+"
                    + "((?:[a-z][a-z'-]*)(?:\\s+[a-z][a-z'-]*){0,5})\\s*[?.!]*\\s*$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern WHAT_DOES_MEAN = Pattern.compile(
            "^\\s*what\\s+does\\s+(.+?)\\s+mean\\s*[?.!]*\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern RECIPE = Pattern.compile(
            "(?:how\\s+to\\s+(?:make|cook|prepare|bake|fry|grill)|recipe\\s+for|ingredients\\s+for|"
                    + "how\\s+do\\s+(?:you|i)\\s+(?:make|cook|bake))\\s+(?:a\\s+|an\\s+|the\\s+)?(.+?)\\s*[?.!]*\\s*$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern HOW_TO = Pattern.compile(
            "(?:how\\s+to|how\\s+do\\s+(?:you|i)|how\\s+can\\s+(?:you|i)|steps\\s+to)\\s+(.+?)\\s*[?.!]*\\s*$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern COMPARISON = Pattern.compile(
            "(?:difference\\s+between|compare)\\s+(.+?)\\s+(?:and|with|to)\\s+(.+?)\\s*[?.!]*\\s*$"
                    + "|^\\s*(.+?)\\s+(?:vs\\.?|versus)\\s+(.+?)\\s*[?.!]*\\s*$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern PROGRAMMING = Pattern.compile(
            "(\\w+)\\s+(?:function|class|method|variable|array|object|syntax|programming|code)\\b"
                    + "|\\bin\\s+(javascript|python|java|typescript|rust|golang|c\\+\\+)\\b",
            Pattern.CASE_INSENSITIVE);

    private static final FirstMatch<String, Match> RULES = FirstMatch.<String, Match>builder()
            .rule("philosophical", IntentClassifier::isPhilosophical,
                    q -> new Match(QueryIntent.PHILOSOPHICAL, null))
            .rule("biographical", IntentClassifier::isBiographical,
                    q -> new Match(QueryIntent.BIOGRAPHICAL, capture(WHO, q, 1)))
            .rule("definition", q -> DEFINITION.matcher(q).find() || WHAT_DOES_MEAN.matcher(q).find(),
                    q -> new Match(QueryIntent.DEFINITION, definitionEntity(q)))
            .rule("recipe", q -> RECIPE.matcher(q).find(),
                    q -> new Match(QueryIntent.RECIPE, capture(RECIPE, q, 1)))
            .rule("how_to", q -> HOW_TO.matcher(q).find(),
                    q -> new Match(QueryIntent.HOW_TO, capture(HOW_TO, q, 1)))
            .rule("comparison", q -> COMPARISON.matcher(q).find(),
                    q -> new Match(QueryIntent.COMPARISON, comparisonEntity(q)))
            .rule("programming", q -> PROGRAMMING.matcher(q).find(),
                    q -> new Match(QueryIntent.PROGRAMMING, null))
            .rule("causal_explanation", q -> {
                        String l = Texts.lower(q).trim();
                        return l.startsWith("why ") || Texts.containsPhrase(l, "what causes");
                    },
                    q -> new Match(QueryIntent.CAUSAL_EXPLANATION, null))
            .rule("explanation", q -> {
                        String l = Texts.lower(q).trim();
                        return Texts.containsPhrase(l, "explain") || l.startsWith("how does ") || l.startsWith("how do ");
                    },
                    q -> new Match(QueryIntent.EXPLANATION, null))
            .build();

    private IntentClassifier() {}

    public static Match classify(String query) {
        if (query == null || query.isBlank()) return new Match(QueryIntent.GENERAL, null);
        return RULES.evaluate(query).orElseGet(() -> new Match(QueryIntent.GENERAL, null));
    }

    public static List<String> ruleOrder() {
        return RULES.names();
    }

    // -----------------------------------------------------------------------------------------

    private static boolean isPhilosophical(String q) {
        String l = Texts.lower(q).trim();
        if (Texts.containsAnyPhrase(l, PHILOSOPHICAL_PHRASES)) return true;
        // "what is life?" style, short and without qualifiers ("life in the ocean")
        Set<String> words = Texts.wordSet(l);
        return words.contains("what") && words.contains("life") && words.size() <= 4
                && !words.contains("in") && !words.contains("of") && !words.contains("for")
                && !words.contains("with") && !words.contains("about");
    }

    private static boolean isBiographical(String q) {
        Matcher m = WHO.matcher(q);
        if (!m.find()) return false;
        String name = m.group(1).trim();
        if (name.isEmpty()) return false;
        return !PRONOUNS.contains(name.toLowerCase(Locale.ROOT));
    }

    private static String definitionEntity(String q) {
        Matcher m = DEFINITION.matcher(q);
        String e = m.find() ? m.group(1) : capture(WHAT_DOES_MEAN, q, 1);
        return e == null ? null : stripArticle(e.trim());
    }

    private static String comparisonEntity(String q) {
        Matcher m = COMPARISON.matcher(q);
        if (!m.find()) return null;
        String a = m.group(1) != null ? m.group(1) : m.group(3);
        String b = m.group(2) != null ? m.group(2) : m.group(4);
        return a.trim() + " vs " + b.trim();
    }

    private static String capture(Pattern p, String q, int group) {
        Matcher m = p.matcher(q);
        if (!m.find()) return null;
        String g = m.group(group);
        return g == null ? null : g.trim();
    }

    static String stripArticle(String s) {
        String l = s.toLowerCase(Locale.ROOT);
        for (String a : List.of("the ", "a ", "an ")) {
            if (l.startsWith(a)) return s.substring(a.length()).trim();
        }
        return s;
    }
}
