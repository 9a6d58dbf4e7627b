package org.calista.arasaka.reasoning.bootstrap;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.arasaka.io.FileIO;
import org.calista.arasaka.reasoning.knowledge.KnowledgeItem;
import org.calista.arasaka.reasoning.knowledge.KnowledgeStore;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Loads a JSONL corpus (one {@link KnowledgeItem} per line) into a knowledge store.
 * Duplicates are counted, not failed.
 */
public final class CorpusBootstrapper {
    private static final Logger log = LogManager.getLogger(CorpusBootstrapper.class);

    private final FileIO io;
    private final ObjectMapper mapper;

    public CorpusBootstrapper(FileIO io, ObjectMapper mapper) {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * @param failFast rethrow the first bad line as {@link IOException} instead of skipping it
     */
    public Report loadInto(KnowledgeStore store, Path jsonlFile, boolean failFast) throws IOException {
        int ok = 0, dup = 0, bad = 0;

        if (!io.exists(jsonlFile)) {
            log.warn("Corpus not found: {}", jsonlFile);
            return new Report(jsonlFile, 0, 0, 0);
        }

        List<String> lines = io.readJsonl(jsonlFile);
        for (String line : lines) {
            try {
                KnowledgeItem k = mapper.readValue(line, KnowledgeItem.class);
                if (k == null) throw new IllegalArgumentException("null row");
                k.id = 0L;
                if (store.add(k).duplicate) dup++;
                else ok++;
            } catch (IOException | RuntimeException e) {
                bad++;
                log.warn("Bad corpus line in {}: {}", jsonlFile, e.toString());
                if (failFast) throw new IOException("Bad corpus line in " + jsonlFile + ": " + e, e);
            }
        }

        log.info("Corpus loaded: {} (ok={}, duplicates={}, bad={})", jsonlFile, ok, dup, bad);
        return new Report(jsonlFile, ok, dup, bad);
    }

    public static final class Report {
        public final Path file;
        public final int ok;
        public final int duplicates;
        public final int bad;

        public Report(Path file, int ok, int duplicates, int bad) {
            this.file = file;
            this.ok = ok;
            this.duplicates = duplicates;
            this.bad = bad;
        }

        @Override
        public String toString() {
            return "Report{" + file + ", ok=" + ok + ", duplicates=" + duplicates + ", bad=" + bad + "}";
        }
    }
}
