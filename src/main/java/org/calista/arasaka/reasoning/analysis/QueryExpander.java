package org.calista.arasaka.reasoning.analysis;

import org.calista.arasaka.reasoning.text.Texts;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Synonym expansion and phrasing variations for a query.
 */
public final class QueryExpander {

    static final Map<String, List<String>> SYNONYMS;

    static {
        LinkedHashMap<String, List<String>> m = new LinkedHashMap<>();
        m.put("affect", List.of("influence", "impact", "change", "modify"));
        m.put("cause", List.of("lead to", "result in", "produce", "create"));
        m.put("compare", List.of("contrast", "differentiate", "distinguish"));
        m.put("analyze", List.of("examine", "study", "investigate", "evaluate"));
        m.put("explain", List.of("describe", "clarify", "elucidate"));
        SYNONYMS = Map.copyOf(m);
    }

    private static final List<String> ORDER = List.of("affect", "cause", "compare", "analyze", "explain");

    private QueryExpander() {}

    /** Original query first, then one variant per synonym of each matched key word. */
    public static List<String> expand(String query) {
        if (query == null || query.isBlank()) return List.of();
        LinkedHashSet<String> out = new LinkedHashSet<>();
        out.add(query);

        String lower = Texts.lower(query);
        for (String key : ORDER) {
            if (!Texts.containsPhrase(lower, key)) continue;
            Pattern p = Pattern.compile("\\b" + key + "\\b", Pattern.CASE_INSENSITIVE);
            for (String syn : SYNONYMS.get(key)) {
                out.add(p.matcher(query).replaceAll(syn));
            }
        }
        return new ArrayList<>(out);
    }

    /** Question-form variations: '?' suffix, "What is ...", "How does ... work?". */
    public static List<String> variations(String query) {
        if (query == null || query.isBlank()) return List.of();
        String q = query.trim();
        LinkedHashSet<String> out = new LinkedHashSet<>();
        out.add(q);

        String bare = q.endsWith("?") ? q.substring(0, q.length() - 1).trim() : q;
        if (!q.endsWith("?")) out.add(q + "?");

        String lower = Texts.lower(bare);
        if (!lower.startsWith("what ")) out.add("What is " + bare + "?");
        if (!lower.startsWith("how ")) out.add("How does " + bare + " work?");
        return new ArrayList<>(out);
    }
}
