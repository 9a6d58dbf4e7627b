package org.calista.arasaka.reasoning.analysis;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits compound queries into sub-queries.
 *
 * <p>Strategies run in order: conjunctions/semicolons, several question clauses, list markers.
 * A strategy wins only when it yields at least two parts longer than 10 chars.</p>
 */
public final class QueryDecomposer {

    static final int MIN_PART_LENGTH = 10;

    private static final Pattern CONJUNCTIONS = Pattern.compile(
            "\\s+(?:and|or|but|however|therefore|so|thus|hence)\\s+|;", Pattern.CASE_INSENSITIVE);
    private static final Pattern QUESTIONS = Pattern.compile("[^.!?]*[?!]");
    private static final Pattern LIST_ITEMS = Pattern.compile("(?:^|\\s)(?:\\d+[.)]|[*\\-•])\\s*([^\\n.!?;]+)");

    private QueryDecomposer() {}

    public static List<String> decompose(String query) {
        if (query == null || query.isBlank()) return List.of();

        List<String> parts = accept(List.of(CONJUNCTIONS.split(query)));
        if (!parts.isEmpty()) return parts;

        parts = accept(all(QUESTIONS, query, 0));
        if (!parts.isEmpty()) return parts;

        parts = accept(all(LIST_ITEMS, query, 1));
        return parts;
    }

    private static List<String> all(Pattern p, String text, int group) {
        ArrayList<String> out = new ArrayList<>();
        Matcher m = p.matcher(text);
        while (m.find()) out.add(m.group(group));
        return out;
    }

    private static List<String> accept(List<String> raw) {
        ArrayList<String> out = new ArrayList<>(raw.size());
        for (String r : raw) {
            String s = r == null ? "" : r.trim();
            if (s.length() > MIN_PART_LENGTH) out.add(s);
        }
        return out.size() >= 2 ? List.copyOf(out) : List.of();
    }
}
