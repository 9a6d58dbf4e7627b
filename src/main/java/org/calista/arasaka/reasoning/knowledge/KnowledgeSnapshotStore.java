package org.calista.arasaka.reasoning.knowledge;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.arasaka.io.FileIO;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Stream;

/**
 * KnowledgeSnapshotStore: persist/load knowledge snapshots.
 *
 * <p>Формат: JSONL, один KnowledgeItem на строку, запись атомарно через FileIO.
 * Первая строка {"_schema":"kb-jsonl-v1"}; при чтении она пропускается, битые строки не валят загрузку.</p>
 */
public final class KnowledgeSnapshotStore {

    private static final Logger log = LogManager.getLogger(KnowledgeSnapshotStore.class);

    static final String SCHEMA_LINE = "{\"_schema\":\"kb-jsonl-v1\"}";

    private final ObjectMapper mapper;
    private final FileIO io;
    private final Path snapshotFile;

    public KnowledgeSnapshotStore(FileIO io, ObjectMapper mapper, Path snapshotFile) {
        this.io = io;
        this.mapper = mapper;
        this.snapshotFile = snapshotFile;
    }

    public Path file() {
        return snapshotFile;
    }

    public int save(KnowledgeStore store) throws IOException {
        List<KnowledgeItem> items = store.snapshotSorted();

        FileIO.WriterHandle h = io.openWriter(snapshotFile);
        try {
            h.writer.write(SCHEMA_LINE);
            h.writer.newLine();
            for (KnowledgeItem k : items) {
                h.writer.write(mapper.writeValueAsString(k));
                h.writer.newLine();
            }
            io.commit(h);
        } catch (IOException e) {
            io.rollback(h);
            throw e;
        } catch (RuntimeException e) {
            io.rollback(h);
            throw new IOException("Failed to save snapshot: " + snapshotFile, e);
        }
        log.info("snapshot saved: {} items -> {}", items.size(), snapshotFile);
        return items.size();
    }

    /**
     * Loads the snapshot into the store; duplicates are skipped by the store itself.
     *
     * @return items newly added
     */
    public int load(KnowledgeStore store) throws IOException {
        if (!io.exists(snapshotFile)) return 0;
        int loaded = 0;
        int skipped = 0;

        try (Stream<String> lines = io.jsonlStream(snapshotFile)) {
            Iterator<String> it = lines.iterator();
            while (it.hasNext()) {
                String line = it.next();
                if (line.contains("\"_schema\"")) continue;
                try {
                    KnowledgeItem k = mapper.readValue(line, KnowledgeItem.class);
                    if (k == null) continue;
                    k.id = 0L;
                    if (!store.add(k).duplicate) loaded++;
                } catch (IOException | IllegalArgumentException rowErr) {
                    skipped++;
                    log.warn("snapshot: skip broken row: {}", rowErr.getMessage());
                }
            }
        }
        log.info("snapshot loaded: {} items ({} skipped) from {}", loaded, skipped, snapshotFile);
        return loaded;
    }
}
