package org.calista.arasaka.reasoning.analysis;

import org.calista.arasaka.reasoning.text.Texts;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Topic and entity extraction from a raw query.
 *
 * <ul>
 *   <li>topics: known compound terms, adjacent meaningful bigrams, then single meaningful words
 *   not already covered by a chosen multi-word topic;</li>
 *   <li>entities: runs of capitalized words and tokens with digits/hyphens that carry a capitalized
 *   segment ("COVID-19", "GPT-4").</li>
 * </ul>
 */
public final class TopicExtractor {

    /** Compound terms recognised as one topic. Lowercase. */
    public static final List<String> COMPOUND_TERMS = List.of(
            "climate change", "global warming", "greenhouse gas", "carbon emissions",
            "renewable energy", "fossil fuels", "machine learning", "deep learning",
            "artificial intelligence", "neural network", "neural networks", "computer science",
            "data science", "quantum physics", "quantum mechanics", "economic policy",
            "monetary policy", "fiscal policy", "interest rates", "supply chain",
            "public health", "mental health", "social media", "natural selection",
            "human rights", "civil rights", "world war", "cold war", "foreign policy",
            "stock market", "minimum wage", "income inequality"
    );

    /** Relational verbs never form a topic on their own nor inside a bigram. */
    static final Set<String> RELATION_WORDS = Set.of(
            "affect", "affects", "affected", "affecting", "cause", "causes", "caused", "causing",
            "impact", "impacts", "influence", "influences", "lead", "leads", "result", "results",
            "compare", "compared", "versus", "between", "work", "works", "relate", "relates",
            "relationship", "difference", "differences", "mean", "means", "make", "makes"
    );

    private static final String STRIP = ".,!?;:()[]{}\"'`";

    private TopicExtractor() {}

    public static List<String> topics(String query) {
        if (query == null || query.isBlank()) return List.of();
        String q = Texts.lower(query);

        LinkedHashSet<String> out = new LinkedHashSet<>();
        for (String c : COMPOUND_TERMS) {
            if (Texts.containsPhrase(q, c)) out.add(c);
        }

        List<String> words = cleanWords(query);
        ArrayList<String> lower = new ArrayList<>(words.size());
        for (String w : words) lower.add(w.toLowerCase(Locale.ROOT));

        for (int i = 0; i + 1 < lower.size(); i++) {
            String a = lower.get(i);
            String b = lower.get(i + 1);
            if (isTopicWord(a) && isTopicWord(b)) {
                String bigram = a + " " + b;
                if (!coveredBy(bigram, out)) out.add(bigram);
            }
        }

        for (String w : lower) {
            if (!isTopicWord(w)) continue;
            if (coveredWord(w, out)) continue;
            out.add(w);
        }
        return new ArrayList<>(out);
    }

    public static List<String> entities(String query) {
        if (query == null || query.isBlank()) return List.of();
        List<String> words = cleanWords(query);

        LinkedHashSet<String> out = new LinkedHashSet<>();
        StringBuilder run = new StringBuilder();
        for (int i = 0; i < words.size(); i++) {
            String w = words.get(i);
            if (isCodeLike(w)) {
                flushRun(run, out);
                out.add(w);
                continue;
            }
            if (isCapitalized(w) && !Texts.isStopWord(w.toLowerCase(Locale.ROOT))) {
                if (run.length() > 0) run.append(' ');
                run.append(w);
            } else {
                flushRun(run, out);
            }
        }
        flushRun(run, out);
        return new ArrayList<>(out);
    }

    /** Meaningful word for topic purposes: longer than 3 chars, not a stop word, not a relation verb. */
    static boolean isTopicWord(String lower) {
        return lower.length() > 3
                && !Texts.isStopWord(lower)
                && !RELATION_WORDS.contains(lower)
                && Character.isLetter(lower.charAt(0));
    }

    static List<String> cleanWords(String query) {
        String[] raw = query.trim().split("\\s+");
        ArrayList<String> out = new ArrayList<>(raw.length);
        for (String r : raw) {
            String w = strip(r);
            if (!w.isEmpty()) out.add(w);
        }
        return out;
    }

    private static String strip(String w) {
        int a = 0;
        int b = w.length();
        while (a < b && STRIP.indexOf(w.charAt(a)) >= 0) a++;
        while (b > a && STRIP.indexOf(w.charAt(b - 1)) >= 0) b--;
        String s = w.substring(a, b);
        if (s.endsWith("'s")) s = s.substring(0, s.length() - 2);
        return s;
    }

    private static boolean coveredBy(String bigram, Set<String> chosen) {
        for (String c : chosen) {
            if (c.contains(bigram) || bigram.contains(c)) return true;
        }
        return false;
    }

    private static boolean coveredWord(String w, Set<String> chosen) {
        for (String c : chosen) {
            if (c.indexOf(' ') > 0 && Texts.containsPhrase(c, w)) return true;
        }
        return false;
    }

    private static boolean isCapitalized(String w) {
        return w.length() > 1 && Character.isUpperCase(w.charAt(0)) && Character.isLetter(w.charAt(0));
    }

    // digits or hyphens plus at least one uppercase segment
    private static boolean isCodeLike(String w) {
        boolean digitOrHyphen = false;
        boolean upper = false;
        for (int i = 0; i < w.length(); i++) {
            char c = w.charAt(i);
            if (Character.isDigit(c) || c == '-') digitOrHyphen = true;
            if (Character.isUpperCase(c)) upper = true;
        }
        return digitOrHyphen && upper && w.length() > 1;
    }

    private static void flushRun(StringBuilder run, Set<String> out) {
        if (run.length() == 0) return;
        out.add(run.toString());
        run.setLength(0);
    }
}
