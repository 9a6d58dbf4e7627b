package org.calista.arasaka.reasoning.text;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Shared text helpers: stop words, meaningful words, sentence split, truncation.
 */
public final class Texts {

    private Texts() {}

    public static final Set<String> STOP_WORDS = Set.of(
            "a", "an", "the", "is", "are", "was", "were", "be", "been", "being",
            "have", "has", "had", "do", "does", "did", "will", "would", "could",
            "should", "may", "might", "can", "this", "that", "these", "those",
            "i", "you", "he", "she", "it", "we", "they", "me", "him", "her",
            "us", "them", "my", "your", "his", "its", "our", "their",
            "who", "what", "where", "when", "why", "how", "which", "whose",
            "and", "or", "but", "if", "then", "else", "for", "with", "from",
            "to", "of", "in", "on", "at", "by", "about", "into", "through",
            "up", "down", "out", "off", "over", "under", "again", "further",
            "tell", "explain", "help", "show", "give", "there", "here", "than",
            "some", "any", "all", "each", "very", "just", "also", "more", "most",
            "such", "not", "no", "yes", "please", "whats"
    );

    private static final Pattern SENTENCE_SPLIT = Pattern.compile("(?<=[.!?])\\s+|[\\r\\n]+");

    public static String lower(String s) {
        return s == null ? "" : s.toLowerCase(Locale.ROOT);
    }

    public static boolean isStopWord(String w) {
        return w != null && STOP_WORDS.contains(w);
    }

    /** Tokens longer than {@code minLen} chars that are not stop words, in input order (duplicates kept). */
    public static List<String> meaningfulWords(String text, int minLen) {
        List<String> toks = SimpleTokenizer.INSTANCE.tokenize(text);
        ArrayList<String> out = new ArrayList<>(toks.size());
        for (String t : toks) {
            if (t.length() > minLen && !STOP_WORDS.contains(t)) out.add(t);
        }
        return out;
    }

    public static Set<String> meaningfulWordSet(String text, int minLen) {
        return new LinkedHashSet<>(meaningfulWords(text, minLen));
    }

    /** Whole-token set, lowercase. */
    public static Set<String> wordSet(String text) {
        return new LinkedHashSet<>(SimpleTokenizer.INSTANCE.tokenize(text));
    }

    public static int wordCount(String text) {
        if (text == null || text.isBlank()) return 0;
        return text.trim().split("\\s+").length;
    }

    public static List<String> sentences(String text) {
        if (text == null || text.isBlank()) return List.of();
        String[] parts = SENTENCE_SPLIT.split(text.trim());
        ArrayList<String> out = new ArrayList<>(parts.length);
        for (String p : parts) {
            String s = p.trim();
            if (!s.isEmpty()) out.add(s);
        }
        return out;
    }

    /** Prefix of at most {@code max} chars; appends "..." when cut. */
    public static String truncate(String s, int max) {
        if (s == null) return "";
        if (max <= 0) return "";
        if (s.length() <= max) return s;
        return s.substring(0, max) + "...";
    }

    /** Plain prefix, no ellipsis. */
    public static String head(String s, int max) {
        if (s == null) return "";
        return s.length() <= max ? s : s.substring(0, Math.max(0, max));
    }

    /**
     * Phrase containment on token boundaries: "physics" matches "game physics" but not "astrophysics".
     */
    public static boolean containsPhrase(String haystackLower, String phraseLower) {
        if (haystackLower == null || phraseLower == null || phraseLower.isEmpty()) return false;
        int from = 0;
        int plen = phraseLower.length();
        while (true) {
            int idx = haystackLower.indexOf(phraseLower, from);
            if (idx < 0) return false;
            boolean leftOk = idx == 0 || !Character.isLetterOrDigit(haystackLower.charAt(idx - 1));
            int end = idx + plen;
            boolean rightOk = end >= haystackLower.length() || !Character.isLetterOrDigit(haystackLower.charAt(end));
            if (leftOk && rightOk) return true;
            from = idx + 1;
        }
    }

    public static boolean containsAnyPhrase(String haystackLower, Iterable<String> phrases) {
        for (String p : phrases) {
            if (containsPhrase(haystackLower, p)) return true;
        }
        return false;
    }

    public static int countPhrases(String haystackLower, Iterable<String> phrases) {
        int n = 0;
        for (String p : phrases) {
            if (containsPhrase(haystackLower, p)) n++;
        }
        return n;
    }

    public static double clamp01(double x) {
        if (Double.isNaN(x)) return 0.0;
        if (x < 0.0) return 0.0;
        if (x > 1.0) return 1.0;
        return x;
    }
}
