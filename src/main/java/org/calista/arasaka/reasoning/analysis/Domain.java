package org.calista.arasaka.reasoning.analysis;

import org.calista.arasaka.reasoning.text.Texts;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Knowledge domains with their keyword tables.
 *
 * <p>Score of a domain = matched keywords / keywords in its table. Ties are broken by declaration
 * order (first max wins), so the order of constants is part of the contract.</p>
 */
public enum Domain {
    SCIENCE(Set.of("science", "scientific", "physics", "chemistry", "biology", "research",
            "experiment", "theory", "hypothesis", "discovery", "study")),
    ECONOMICS(Set.of("economics", "economic", "economy", "market", "markets", "trade", "finance",
            "financial", "policy", "inflation", "gdp", "recession", "growth")),
    TECHNOLOGY(Set.of("technology", "tech", "computer", "software", "hardware", "digital",
            "internet", "network", "system", "platform", "application")),
    ENVIRONMENT(Set.of("climate", "environment", "environmental", "pollution", "carbon", "emission",
            "emissions", "green", "sustainable", "renewable", "ecosystem")),
    POLITICS(Set.of("politics", "political", "government", "policy", "law", "legislation",
            "democracy", "election", "vote", "senate", "congress")),
    HEALTH(Set.of("health", "medical", "medicine", "disease", "treatment", "patient", "doctor",
            "hospital", "symptom", "diagnosis", "therapy")),
    EDUCATION(Set.of("education", "learning", "teaching", "school", "university", "student",
            "teacher", "curriculum", "academic")),
    HISTORY(Set.of("history", "historical", "war", "battle", "empire", "ancient", "medieval",
            "revolution", "civilization", "culture")),
    PHILOSOPHY(Set.of("philosophy", "philosophical", "ethics", "moral", "existence", "reality",
            "consciousness", "truth", "meaning", "wisdom")),
    GENERAL(Set.of());

    private final Set<String> keywords;

    Domain(Set<String> keywords) {
        this.keywords = keywords;
    }

    public Set<String> keywords() {
        return keywords;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Dominant domain of a text, {@link #GENERAL} when nothing matches. */
    public static Domain classify(String text) {
        List<Domain> ranked = rank(text);
        return ranked.get(0);
    }

    /**
     * All matching domains ordered by score desc (declaration order on ties);
     * a single {@link #GENERAL} when none match.
     */
    public static List<Domain> rank(String text) {
        Map<Domain, Double> scores = scores(text);
        ArrayList<Domain> out = new ArrayList<>(scores.keySet());
        // stable sort keeps declaration order for equal scores
        out.sort((a, b) -> Double.compare(scores.get(b), scores.get(a)));
        if (out.isEmpty()) out.add(GENERAL);
        return out;
    }

    /** Non-zero scores only, in declaration order. */
    public static Map<Domain, Double> scores(String text) {
        EnumMap<Domain, Double> out = new EnumMap<>(Domain.class);
        if (text == null || text.isBlank()) return out;

        Set<String> words = Texts.wordSet(text);
        for (Domain d : values()) {
            if (d.keywords.isEmpty()) continue;
            int matches = 0;
            for (String k : d.keywords) {
                if (words.contains(k)) matches++;
            }
            if (matches > 0) out.put(d, matches / (double) d.keywords.size());
        }
        return out;
    }
}
