package org.calista.arasaka.reasoning.retrieve.scorer;

import org.calista.arasaka.reasoning.text.Texts;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Coarse topic categories used for category overlap and the disjoint-topic rejection.
 */
public final class TopicCategories {

    static final Map<String, List<String>> TABLE;

    static {
        LinkedHashMap<String, List<String>> m = new LinkedHashMap<>();
        m.put("philosophy", List.of("life", "existence", "reality", "consciousness", "meaning", "purpose",
                "truth", "ethics", "morality", "philosophy", "wisdom", "enlightenment"));
        m.put("programming", List.of("code", "function", "class", "variable", "syntax", "programming",
                "javascript", "python", "java", "typescript", "algorithm", "software"));
        m.put("cooking", List.of("recipe", "cook", "ingredient", "dish", "food", "bake", "fry", "grill",
                "kitchen", "cuisine", "meal", "taste", "flavor"));
        m.put("science", List.of("science", "research", "experiment", "hypothesis", "theory", "discovery",
                "physics", "chemistry", "biology", "mathematics"));
        m.put("learning", List.of("learning", "education", "study", "knowledge", "teach", "lesson",
                "course", "tutorial", "learn", "student"));
        TABLE = m;
    }

    private TopicCategories() {}

    /** Up to three categories by number of keyword hits, table order on ties. */
    public static List<String> classify(String text) {
        String t = Texts.lower(text);
        ArrayList<Map.Entry<String, Integer>> hits = new ArrayList<>();
        for (Map.Entry<String, List<String>> e : TABLE.entrySet()) {
            int n = Texts.countPhrases(t, e.getValue());
            if (n > 0) hits.add(Map.entry(e.getKey(), n));
        }
        hits.sort((a, b) -> Integer.compare(b.getValue(), a.getValue()));

        ArrayList<String> out = new ArrayList<>(3);
        for (int i = 0; i < hits.size() && i < 3; i++) out.add(hits.get(i).getKey());
        return out;
    }
}
