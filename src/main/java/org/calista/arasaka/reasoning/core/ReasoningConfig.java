package org.calista.arasaka.reasoning.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.arasaka.io.FileIO;
import org.calista.arasaka.reasoning.retrieve.scorer.impl.SemanticRelevanceScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * ReasoningConfig: POJO конфиг пайплайна:
 * - дефолты в полях
 * - loadOrCreate() создаёт файл, если его нет
 * - validate() нормализует значения
 *
 * Компоненты получают свои вложенные Config из этих секций (см. {@link ReasoningComposer}).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ReasoningConfig {

    private static final Logger log = LoggerFactory.getLogger(ReasoningConfig.class);

    public String baseDir = "data";
    public Corpora corpora = new Corpora();
    public Knowledge knowledge = new Knowledge();
    public Events events = new Events();
    public Retrieval retrieval = new Retrieval();
    public Relevance relevance = new Relevance();
    public Reasoning reasoning = new Reasoning();
    public Synthesis synthesis = new Synthesis();

    // -------------------- Sections --------------------

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Corpora {
        public String dir = "corpora";
        public List<String> bootstrap = List.of("base.jsonl");
        public boolean failFast = false;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Knowledge {
        public String snapshotFile = "knowledge.snapshot.jsonl";
        public boolean loadSnapshotOnBootstrap = true;

        // quality gate
        public int minWordCount = 20;
        public List<String> lowQualitySources = List.of("unknown", "forum", "social", "comment", "user");
        public double minConfidence = 0.0;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Events {
        public boolean enabled = true;
        public String logFile = "events.jsonl";
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Retrieval {
        public int maxTopics = 5;
        public int maxPerTopic = 5;
        public boolean parallel = true;
        public int maxParallelism = 5;
        public long perTopicTimeoutMs = 3_000;
        public long batchTimeoutMs = 8_000;
        public int researchWhenBelow = 1;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Relevance {
        /** items scoring below are dropped by the retriever */
        public double minScore = 0.3;
        public SemanticRelevanceScorer.Config weights = new SemanticRelevanceScorer.Config();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Reasoning {
        public int maxSteps = 10;
        public boolean cacheEnabled = true;
        public long cacheTtlSeconds = 3600;
        public int cacheMaxSize = 1000;
        public boolean iterative = false;
        public double minConfidenceThreshold = 0.6;

        public int batchParallelism = 4;
        public long batchTimeoutMs = 30_000;

        /** text|json|markdown|html, used by the console runner */
        public String outputFormat = "text";
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Synthesis {
        public int itemsPerTopic = 3;
        public int maxCharsPerItem = 300;
        public int maxRelationships = 5;
    }

    // -------------------- Load / Create --------------------

    /**
     * Загружает конфиг. Если файла нет (или он пустой), создаёт дефолтный и пишет на диск.
     */
    public static ReasoningConfig loadOrCreate(FileIO io, Path configFile, ObjectMapper mapper) throws IOException {
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(mapper, "mapper");

        String json;
        try {
            json = io.readString(configFile);
        } catch (NoSuchFileException e) {
            ReasoningConfig created = new ReasoningConfig();
            created.validate();
            writePretty(io, configFile, mapper, created);
            log.info("Config file not found. Created default config at {}", configFile);
            return created;
        }

        if (json == null || json.isBlank()) {
            ReasoningConfig created = new ReasoningConfig();
            created.validate();
            writePretty(io, configFile, mapper, created);
            log.warn("Config file {} is empty. Recreated defaults.", configFile);
            return created;
        }

        ReasoningConfig cfg = mapper.readValue(json, ReasoningConfig.class);
        if (cfg == null) cfg = new ReasoningConfig();

        cfg.validate();
        return cfg;
    }

    /**
     * Перезаписывает конфиг на диск (pretty JSON).
     */
    public static void save(FileIO io, Path configFile, ObjectMapper mapper, ReasoningConfig cfg) throws IOException {
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(mapper, "mapper");
        Objects.requireNonNull(cfg, "cfg");

        cfg.validate();
        writePretty(io, configFile, mapper, cfg);
    }

    private static void writePretty(FileIO io, Path configFile, ObjectMapper mapper, ReasoningConfig cfg) throws IOException {
        String out = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(cfg);
        io.writeString(configFile, out + System.lineSeparator());
    }

    // -------------------- Validation / Normalization --------------------

    public ReasoningConfig validate() {
        if (baseDir == null || baseDir.isBlank()) baseDir = "data";

        if (corpora == null) corpora = new Corpora();
        if (corpora.dir == null || corpora.dir.isBlank()) corpora.dir = "corpora";
        if (corpora.bootstrap == null) corpora.bootstrap = List.of();

        if (knowledge == null) knowledge = new Knowledge();
        if (knowledge.snapshotFile == null || knowledge.snapshotFile.isBlank())
            knowledge.snapshotFile = "knowledge.snapshot.jsonl";
        if (knowledge.minWordCount < 0) knowledge.minWordCount = 0;
        if (knowledge.lowQualitySources == null) knowledge.lowQualitySources = List.of();
        knowledge.minConfidence = clamp01(knowledge.minConfidence, 0.0);

        if (events == null) events = new Events();
        if (events.logFile == null || events.logFile.isBlank()) events.logFile = "events.jsonl";

        if (retrieval == null) retrieval = new Retrieval();
        if (retrieval.maxTopics < 1) retrieval.maxTopics = 1;
        if (retrieval.maxPerTopic < 1) retrieval.maxPerTopic = 1;
        if (retrieval.maxParallelism < 1) retrieval.maxParallelism = 1;
        if (retrieval.perTopicTimeoutMs < 1) retrieval.perTopicTimeoutMs = 1;
        if (retrieval.batchTimeoutMs < retrieval.perTopicTimeoutMs) retrieval.batchTimeoutMs = retrieval.perTopicTimeoutMs;
        if (retrieval.researchWhenBelow < 0) retrieval.researchWhenBelow = 0;

        if (relevance == null) relevance = new Relevance();
        relevance.minScore = clamp01(relevance.minScore, 0.3);
        if (relevance.weights == null) relevance.weights = new SemanticRelevanceScorer.Config();
        relevance.weights.validate();

        if (reasoning == null) reasoning = new Reasoning();
        if (reasoning.maxSteps < 1) reasoning.maxSteps = 1;
        if (reasoning.cacheTtlSeconds < 1) reasoning.cacheTtlSeconds = 1;
        if (reasoning.cacheMaxSize < 0) reasoning.cacheMaxSize = 0;
        reasoning.minConfidenceThreshold = clamp01(reasoning.minConfidenceThreshold, 0.6);
        if (reasoning.batchParallelism < 1) reasoning.batchParallelism = 1;
        if (reasoning.batchTimeoutMs < 1) reasoning.batchTimeoutMs = 1;
        if (reasoning.outputFormat == null || reasoning.outputFormat.isBlank()) reasoning.outputFormat = "text";

        if (synthesis == null) synthesis = new Synthesis();
        if (synthesis.itemsPerTopic < 1) synthesis.itemsPerTopic = 1;
        if (synthesis.maxCharsPerItem < 1) synthesis.maxCharsPerItem = 300;
        if (synthesis.maxRelationships < 0) synthesis.maxRelationships = 0;
        return this;
    }

    private static double clamp01(double v, double fallback) {
        if (!Double.isFinite(v)) return fallback;
        return v < 0.0 ? 0.0 : Math.min(1.0, v);
    }
}
