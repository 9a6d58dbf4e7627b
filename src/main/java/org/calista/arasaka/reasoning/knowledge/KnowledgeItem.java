package org.calista.arasaka.reasoning.knowledge;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.calista.arasaka.reasoning.text.Texts;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Objects;

/**
 * KnowledgeItem: a knowledge snippet (title/content/source record).
 *
 * <p>Public fields for Jackson. Once handed out by a {@link KnowledgeStore} the item is treated as
 * an immutable value: callers copy before changing anything.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class KnowledgeItem {

    /** Store-assigned id; 0 until stored. */
    public long id;

    public String topic;
    public String title;
    public String content;

    /** wikipedia|google|brave|structured|forum|unknown|... */
    public String source = "unknown";
    public String url;

    /** 0..1 */
    public double confidence = 0.5;

    /** 0..1; negative means "not set" and is computed by the store on add. */
    public double qualityScore = -1.0;

    public long createdAtEpochMs;

    // ---- derived on validate() ----

    public int wordCount;

    /** SHA-256 of content (hex). Identity for deduplication. */
    public String contentHash;

    public static KnowledgeItem of(String topic, String title, String content, String source, double confidence) {
        KnowledgeItem k = new KnowledgeItem();
        k.topic = topic;
        k.title = title;
        k.content = content;
        k.source = source;
        k.confidence = confidence;
        return k;
    }

    // ---------------------------------------------------------------------
    // Validation / normalization
    // ---------------------------------------------------------------------

    /**
     * Normalizes fields in place. Content is the only required field.
     *
     * @throws IllegalArgumentException when content is missing
     */
    public KnowledgeItem validate() {
        if (content == null || content.isBlank()) throw new IllegalArgumentException("KnowledgeItem.content is required");
        content = content.trim();

        if (topic == null) topic = "";
        topic = topic.trim();
        if (title == null || title.isBlank()) title = topic;
        title = title.trim();

        if (source == null || source.isBlank()) source = "unknown";
        source = source.trim().toLowerCase(Locale.ROOT);

        if (!Double.isFinite(confidence)) confidence = 0.5;
        confidence = Texts.clamp01(confidence);

        if (!Double.isFinite(qualityScore)) qualityScore = -1.0;
        if (qualityScore > 1.0) qualityScore = 1.0;

        if (createdAtEpochMs <= 0L) createdAtEpochMs = System.currentTimeMillis();

        wordCount = Texts.wordCount(content);
        contentHash = hashContent(content);
        return this;
    }

    public boolean hasQualityScore() {
        return qualityScore >= 0.0;
    }

    /** Title and content joined, the text relationship patterns run over. */
    public String fullText() {
        String t = title == null ? "" : title;
        String c = content == null ? "" : content;
        return t.isEmpty() ? c : t + ". " + c;
    }

    public KnowledgeItem copy() {
        KnowledgeItem k = new KnowledgeItem();
        k.id = id;
        k.topic = topic;
        k.title = title;
        k.content = content;
        k.source = source;
        k.url = url;
        k.confidence = confidence;
        k.qualityScore = qualityScore;
        k.createdAtEpochMs = createdAtEpochMs;
        k.wordCount = wordCount;
        k.contentHash = contentHash;
        return k;
    }

    public KnowledgeItem withTopic(String newTopic) {
        KnowledgeItem k = copy();
        k.topic = newTopic;
        return k;
    }

    public static String hashContent(String content) {
        Objects.requireNonNull(content, "content");
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(content.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // SHA-256 is mandatory on every JVM
            throw new IllegalStateException(e);
        }
    }

    @Override
    public String toString() {
        return "KnowledgeItem{id=" + id + ", topic='" + topic + "', title='" + Texts.truncate(title, 40)
                + "', source=" + source + ", conf=" + confidence + "}";
    }
}
