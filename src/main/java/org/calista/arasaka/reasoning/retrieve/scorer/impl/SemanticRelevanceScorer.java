package org.calista.arasaka.reasoning.retrieve.scorer.impl;

import org.calista.arasaka.reasoning.analysis.QueryAnalysis;
import org.calista.arasaka.reasoning.analysis.QueryIntent;
import org.calista.arasaka.reasoning.knowledge.KnowledgeItem;
import org.calista.arasaka.reasoning.retrieve.scorer.MediaIndicators;
import org.calista.arasaka.reasoning.retrieve.scorer.RelevanceScorer;
import org.calista.arasaka.reasoning.retrieve.scorer.TopicCategories;
import org.calista.arasaka.reasoning.text.Texts;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * SemanticRelevanceScorer:
 *  - additive signals: title phrase, category overlap, word overlap, intent bonus, position bonus
 *  - multiplicative penalties for intent mismatches
 *  - hard rejections (score 0): media content for a non-media query, promotional copy,
 *    ambiguous-term collisions, disjoint categories on longer queries
 *
 * All multipliers and bonuses are named in {@link Config}.
 */
public final class SemanticRelevanceScorer implements RelevanceScorer {

    public static final class Config {
        // additive
        public double titlePhraseMatch = 0.5;
        public double categoryOverlap = 0.3;
        public double titleWordMatch = 0.15;
        public double contentWordMatch = 0.05;

        // biographical
        public double bioNamePresent = 0.3;
        public double bioIdentityMarker = 0.2;
        public double bioNameMissingPenalty = 0.3;
        public double bioTriviaPenalty = 0.4;

        // definition
        public double definitionEntityPresent = 0.2;
        public double definitionEntityMissingPenalty = 0.5;

        // philosophical
        public double philosophicalVocabulary = 0.3;
        public double philosophicalOffTopicPenalty = 0.1;

        // position
        public double positionInTitle = 0.1;
        public double positionEarly = 0.05;
        public double positionAnywhere = 0.02;
        public int positionWords = 3;

        // windows (chars)
        public int categoryWindow = 200;
        public int wrongMatchCategoryWindow = 300;
        public int contentWordWindow = 500;

        // media filter
        public int mediaTitleThreshold = 2;
        public int mediaContentThreshold = 3;

        /** disjoint categories reject only queries with at least this many words */
        public int disjointMinQueryWords = 4;

        public Config validate() {
            if (positionWords < 0) positionWords = 0;
            if (categoryWindow < 0) categoryWindow = 0;
            if (wrongMatchCategoryWindow < 0) wrongMatchCategoryWindow = 0;
            if (contentWordWindow < 0) contentWordWindow = 0;
            if (mediaTitleThreshold < 1) mediaTitleThreshold = 1;
            if (mediaContentThreshold < 1) mediaContentThreshold = 1;
            if (disjointMinQueryWords < 1) disjointMinQueryWords = 1;
            return this;
        }
    }

    /** A general concept that has narrowly qualified namesakes ("physics" vs "game physics"). */
    static final class AmbiguousTerm {
        final String term;
        final List<String> qualifiedVariants;
        final List<String> allowedWhenQueryMentions;

        AmbiguousTerm(String term, List<String> qualifiedVariants, List<String> allowedWhenQueryMentions) {
            this.term = term;
            this.qualifiedVariants = qualifiedVariants;
            this.allowedWhenQueryMentions = allowedWhenQueryMentions;
        }
    }

    static final List<AmbiguousTerm> AMBIGUOUS_TERMS = List.of(
            new AmbiguousTerm("physics",
                    List.of("game physics", "physics engine", "physics simulation"),
                    List.of("game", "games", "simulation", "engine", "video", "computer")),
            new AmbiguousTerm("learning",
                    List.of("machine learning", "deep learning", "reinforcement learning"),
                    List.of("machine", "deep", "reinforcement", "neural", "model", "models", "ai"))
    );

    private static final List<Pattern> IDENTITY = List.of(
            Pattern.compile("\\b(is|was)\\s+(an?\\s+)?(indian|american|british|\\w+)\\s+"),
            Pattern.compile("\\b(actor|actress|cricketer|player|singer|politician|scientist|writer|musician|director)"),
            Pattern.compile("\\bborn\\s+\\d"),
            Pattern.compile("\\bknown\\s+for\\b"),
            Pattern.compile("\\bfamous\\s+for\\b"));

    private static final List<Pattern> TRIVIA = List.of(
            Pattern.compile("\\b(once|anecdote|story|revealed|shared|failed|exam)\\b"),
            Pattern.compile("\\bdid\\s+you\\s+know\\b"),
            Pattern.compile("\\binteresting\\s+fact\\b"));

    static final List<String> PHILOSOPHY_VOCABULARY = List.of(
            "life", "existence", "meaning", "purpose", "reality", "consciousness", "truth");
    static final List<String> LEARNING_VOCABULARY = List.of(
            "learning", "education", "study", "teach", "student");

    private final Config cfg;

    public SemanticRelevanceScorer() {
        this(new Config());
    }

    public SemanticRelevanceScorer(Config cfg) {
        this.cfg = (cfg == null ? new Config() : cfg).validate();
    }

    public Config config() {
        return cfg;
    }

    @Override
    public double score(String query, KnowledgeItem item, QueryAnalysis analysis) {
        if (query == null || query.isBlank() || item == null) return 0.0;
        String title = Texts.lower(item.title).trim();
        String content = Texts.lower(item.content);
        if (title.isEmpty() && content.isBlank()) return 0.0;
        String q = Texts.lower(query).trim();

        if (isMediaContent(q, title, content)) return 0.0;
        if (isWrongMatch(q, title, content)) return 0.0;

        double score = 0.0;

        // 1. phrase match with the title
        String qBare = stripPunctuation(q);
        if (!title.isEmpty() && (title.contains(qBare) || qBare.contains(title))) score += cfg.titlePhraseMatch;

        // 2. category overlap
        List<String> qc = TopicCategories.classify(q);
        List<String> kc = TopicCategories.classify(title + " " + Texts.head(content, cfg.categoryWindow));
        if (intersects(qc, kc)) score += cfg.categoryOverlap;

        // 3. word overlap
        Set<String> qw = Texts.meaningfulWordSet(q, 2);
        Set<String> tw = Texts.meaningfulWordSet(title, 2);
        Set<String> cw = Texts.meaningfulWordSet(Texts.head(content, cfg.contentWordWindow), 2);
        int titleHits = 0;
        int contentHits = 0;
        for (String w : qw) {
            if (tw.contains(w)) titleHits++;
            if (cw.contains(w)) contentHits++;
        }
        score += titleHits * cfg.titleWordMatch;
        score += contentHits * cfg.contentWordMatch;

        // 4. intent
        if (analysis != null) score = applyIntent(score, analysis, title, content);

        // 5. position
        score += positionBonus(q, title, content);

        return Texts.clamp01(score);
    }

    // -----------------------------------------------------------------------------------------
    // intent-specific adjustments
    // -----------------------------------------------------------------------------------------

    private double applyIntent(double score, QueryAnalysis a, String title, String content) {
        QueryIntent intent = a.intent;
        String entity = a.intentEntity == null ? "" : Texts.lower(a.intentEntity).trim();

        if (intent == QueryIntent.BIOGRAPHICAL) {
            if (entity.isEmpty()) return score;
            String[] parts = entity.split("\\s+");
            String surname = parts[parts.length - 1];
            if (!(title.contains(surname) || Texts.head(content, 100).contains(surname))) {
                return score * cfg.bioNameMissingPenalty;
            }
            score += cfg.bioNamePresent;
            String head300 = Texts.head(content, 300);
            for (Pattern p : IDENTITY) {
                if (p.matcher(head300).find()) {
                    score += cfg.bioIdentityMarker;
                    break;
                }
            }
            // biographical answers are identity-first: anecdotes near the start are demoted
            String head200 = Texts.head(content, 200);
            for (Pattern p : TRIVIA) {
                if (p.matcher(head200).find()) {
                    score *= cfg.bioTriviaPenalty;
                    break;
                }
            }
            return score;
        }

        if (intent == QueryIntent.DEFINITION && !entity.isEmpty()) {
            if (title.contains(entity) || Texts.head(content, 100).contains(entity)) {
                return score + cfg.definitionEntityPresent;
            }
            return score * cfg.definitionEntityMissingPenalty;
        }

        if (intent == QueryIntent.PHILOSOPHICAL) {
            if (Texts.containsAnyPhrase(Texts.head(content, 200), PHILOSOPHY_VOCABULARY)) {
                return score + cfg.philosophicalVocabulary;
            }
            return score * cfg.philosophicalOffTopicPenalty;
        }
        return score;
    }

    private double positionBonus(String q, String title, String content) {
        LinkedHashSet<String> words = new LinkedHashSet<>(Texts.meaningfulWords(q, 3));
        double bonus = 0.0;
        int n = 0;
        String early = Texts.head(content, 100);
        for (String w : words) {
            if (n++ >= cfg.positionWords) break;
            if (Texts.containsPhrase(title, w)) bonus += cfg.positionInTitle;
            else if (Texts.containsPhrase(early, w)) bonus += cfg.positionEarly;
            else if (Texts.containsPhrase(content, w)) bonus += cfg.positionAnywhere;
        }
        return bonus;
    }

    // -----------------------------------------------------------------------------------------
    // rejections
    // -----------------------------------------------------------------------------------------

    boolean isWrongMatch(String q, String title, String content) {
        // promotional copy up front
        if (Texts.containsAnyPhrase(Texts.head(content, 100), MediaIndicators.PROMOTIONAL)) return true;

        int queryWords = Texts.wordCount(q);
        Set<String> qTokens = Texts.wordSet(q);

        // general concept query answered by a narrowly qualified namesake
        if (qTokens.contains("what") && queryWords <= 4) {
            for (AmbiguousTerm t : AMBIGUOUS_TERMS) {
                if (!qTokens.contains(t.term)) continue;
                if (!Texts.containsAnyPhrase(content, t.qualifiedVariants)) continue;
                if (!Texts.containsAnyPhrase(q, t.allowedWhenQueryMentions)) return true;
            }
        }

        // "life" question answered by study/education material
        if (qTokens.contains("life")
                && !Texts.containsPhrase(title, "life")
                && !Texts.containsPhrase(Texts.head(content, 200), "life")
                && Texts.containsAnyPhrase(Texts.head(content, 200), LEARNING_VOCABULARY)
                && !Texts.containsPhrase(Texts.head(content, 500), "life")) {
            return true;
        }

        // unrelated categories
        if (queryWords >= cfg.disjointMinQueryWords) {
            List<String> qc = TopicCategories.classify(q);
            List<String> kc = TopicCategories.classify(title + " " + Texts.head(content, cfg.wrongMatchCategoryWindow));
            if (!qc.isEmpty() && !kc.isEmpty() && !intersects(qc, kc)) return true;
        }
        return false;
    }

    /**
     * Music/video/entertainment content for a query that does not ask for it. Indicators are
     * counted over the title and three content windows (start, middle, end).
     */
    boolean isMediaContent(String q, String title, String content) {
        if (Texts.containsAnyPhrase(q, MediaIndicators.QUERY_INTENT)) return false;

        ArrayList<String> sections = new ArrayList<>(4);
        sections.add(Texts.head(content, 200));
        if (content.length() > 200) sections.add(content.substring(200, Math.min(500, content.length())));
        sections.add(content.length() > 200 ? content.substring(content.length() - 200) : content);
        sections.add(title);

        int music = 0;
        int video = 0;
        for (String s : sections) {
            if (s.isEmpty()) continue;
            music += Texts.countPhrases(s, MediaIndicators.MUSIC);
            video += Texts.countPhrases(s, MediaIndicators.VIDEO);
        }
        int titleMusic = Texts.countPhrases(title, MediaIndicators.MUSIC);
        int titleVideo = Texts.countPhrases(title, MediaIndicators.VIDEO);

        boolean isMusic = titleMusic >= cfg.mediaTitleThreshold || music >= cfg.mediaContentThreshold;
        boolean isVideo = titleVideo >= cfg.mediaTitleThreshold || video >= cfg.mediaContentThreshold;
        return isMusic || isVideo;
    }

    private static boolean intersects(List<String> a, List<String> b) {
        if (a.isEmpty() || b.isEmpty()) return false;
        HashSet<String> s = new HashSet<>(a);
        for (String x : b) if (s.contains(x)) return true;
        return false;
    }

    private static String stripPunctuation(String q) {
        String s = q.trim();
        while (!s.isEmpty() && ".!?;:,".indexOf(s.charAt(s.length() - 1)) >= 0) s = s.substring(0, s.length() - 1).trim();
        return s;
    }
}
