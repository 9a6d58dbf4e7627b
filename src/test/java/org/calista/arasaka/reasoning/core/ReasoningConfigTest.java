package org.calista.arasaka.reasoning.core;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.arasaka.io.FileIO;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class ReasoningConfigTest {

    @TempDir
    Path dir;

    private final ObjectMapper om = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    @Test
    void missingFileIsCreatedWithDefaults() throws Exception {
        FileIO io = new FileIO(dir);
        Path file = io.resolve("reasoning.json");

        ReasoningConfig cfg = ReasoningConfig.loadOrCreate(io, file, om);

        assertThat(Files.exists(file)).isTrue();
        assertThat(cfg.reasoning.maxSteps).isEqualTo(10);
        assertThat(cfg.reasoning.cacheTtlSeconds).isEqualTo(3600);
        assertThat(cfg.relevance.minScore).isEqualTo(0.3);
        assertThat(cfg.knowledge.lowQualitySources).contains("forum");
        assertThat(io.readString(file)).contains("\"baseDir\"", "\"retrieval\"", "\"weights\"");
    }

    @Test
    void blankFileIsRecreated() throws Exception {
        FileIO io = new FileIO(dir);
        Path file = io.resolve("reasoning.json");
        Files.writeString(file, "  ");

        ReasoningConfig cfg = ReasoningConfig.loadOrCreate(io, file, om);

        assertThat(cfg.baseDir).isEqualTo("data");
        assertThat(io.readString(file)).contains("\"corpora\"");
    }

    @Test
    void loadedValuesAreNormalized() throws Exception {
        FileIO io = new FileIO(dir);
        Path file = io.resolve("reasoning.json");
        Files.writeString(file, "{\"baseDir\":\"\",\"unknownKey\":1,"
                + "\"reasoning\":{\"maxSteps\":0,\"outputFormat\":\"\",\"iterative\":true},"
                + "\"retrieval\":{\"perTopicTimeoutMs\":500,\"batchTimeoutMs\":100},"
                + "\"relevance\":{\"minScore\":5.0},"
                + "\"synthesis\":null}");

        ReasoningConfig cfg = ReasoningConfig.loadOrCreate(io, file, om);

        assertThat(cfg.baseDir).isEqualTo("data");
        assertThat(cfg.reasoning.maxSteps).isEqualTo(1);
        assertThat(cfg.reasoning.outputFormat).isEqualTo("text");
        assertThat(cfg.reasoning.iterative).isTrue();
        assertThat(cfg.retrieval.batchTimeoutMs).isEqualTo(500);
        assertThat(cfg.relevance.minScore).isEqualTo(1.0);
        assertThat(cfg.synthesis).isNotNull();
        assertThat(cfg.synthesis.itemsPerTopic).isEqualTo(3);
    }

    @Test
    void saveThenLoadKeepsChanges() throws Exception {
        FileIO io = new FileIO(dir);
        Path file = io.resolve("reasoning.json");

        ReasoningConfig cfg = new ReasoningConfig();
        cfg.reasoning.outputFormat = "markdown";
        cfg.retrieval.maxTopics = 3;
        cfg.relevance.weights.titlePhraseMatch = 0.7;
        ReasoningConfig.save(io, file, om, cfg);

        ReasoningConfig back = ReasoningConfig.loadOrCreate(io, file, om);
        assertThat(back.reasoning.outputFormat).isEqualTo("markdown");
        assertThat(back.retrieval.maxTopics).isEqualTo(3);
        assertThat(back.relevance.weights.titlePhraseMatch).isEqualTo(0.7);
    }
}
