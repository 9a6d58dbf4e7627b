package org.calista.arasaka.reasoning.knowledge;

import org.calista.arasaka.reasoning.analysis.Domain;
import org.calista.arasaka.reasoning.text.Texts;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Knowledge quality: intrinsic score on insert, the low-quality gate, and quality ranking.
 */
public final class KnowledgeQuality {

    public static final class Config {
        /** Items shorter than this from a low-quality source are dropped. */
        public int minWordCount = 20;
        public Set<String> lowQualitySources = Set.of("unknown", "forum", "social", "comment", "user");

        public Config validate() {
            if (minWordCount < 0) minWordCount = 0;
            if (lowQualitySources == null) lowQualitySources = Set.of();
            return this;
        }
    }

    private static final Map<String, Double> SOURCE_SCORE = Map.of(
            "wikipedia", 0.3,
            "google", 0.25,
            "brave", 0.25,
            "duckduckgo", 0.2,
            "bing", 0.2,
            "structured", 0.15);

    private final Config cfg;

    public KnowledgeQuality(Config cfg) {
        this.cfg = (cfg == null ? new Config() : cfg).validate();
    }

    /**
     * length (>=100 words 0.3, >=50 0.2, >=20 0.1) + source + 0.2 title longer than 5 chars
     * + 0.1 terminal punctuation + 0.1 several sentences; capped at 1.
     */
    public static double qualityScore(String content, String title, String source) {
        String c = content == null ? "" : content.trim();
        double q = 0.0;

        int words = Texts.wordCount(c);
        if (words >= 100) q += 0.3;
        else if (words >= 50) q += 0.2;
        else if (words >= 20) q += 0.1;

        String src = source == null ? "" : source.toLowerCase(Locale.ROOT);
        q += SOURCE_SCORE.getOrDefault(src, 0.1);

        if (title != null && title.trim().length() > 5) q += 0.2;

        if (!c.isEmpty()) {
            char last = c.charAt(c.length() - 1);
            if (last == '.' || last == '!' || last == '?') q += 0.1;
        }
        if (Texts.sentences(c).size() > 1) q += 0.1;

        return Math.min(1.0, q);
    }

    /** false for short items from a low-quality source, however well they match a query. */
    public boolean passes(KnowledgeItem k) {
        if (k == null || k.content == null || k.content.isBlank()) return false;
        int wc = k.wordCount > 0 ? k.wordCount : Texts.wordCount(k.content);
        String src = k.source == null ? "unknown" : k.source.toLowerCase(Locale.ROOT);
        return !(wc < cfg.minWordCount && cfg.lowQualitySources.contains(src));
    }

    public List<KnowledgeItem> filter(Collection<KnowledgeItem> items) {
        ArrayList<KnowledgeItem> out = new ArrayList<>(items == null ? 0 : items.size());
        if (items == null) return out;
        for (KnowledgeItem k : items) if (passes(k)) out.add(k);
        return out;
    }

    /**
     * length (100..1000 chars 0.3, >100 0.2, else 0.1) + confidence*0.4
     * + source (wikipedia 0.2, structured 0.15, else 0.1) + 0.1 for a topic in a known domain.
     */
    public static double rankScore(KnowledgeItem k) {
        int len = k.content == null ? 0 : k.content.length();
        double s;
        if (len >= 100 && len <= 1000) s = 0.3;
        else if (len > 100) s = 0.2;
        else s = 0.1;

        s += k.confidence * 0.4;

        String src = k.source == null ? "" : k.source.toLowerCase(Locale.ROOT);
        if ("wikipedia".equals(src)) s += 0.2;
        else if ("structured".equals(src)) s += 0.15;
        else s += 0.1;

        if (k.topic != null && Domain.classify(k.topic) != Domain.GENERAL) s += 0.1;
        return s;
    }

    /** Stable: equal scores keep input order. */
    public static List<KnowledgeItem> rankByQuality(Collection<KnowledgeItem> items) {
        ArrayList<KnowledgeItem> out = new ArrayList<>(items == null ? List.of() : items);
        out.sort(Comparator.comparingDouble(KnowledgeQuality::rankScore).reversed());
        return out;
    }
}
