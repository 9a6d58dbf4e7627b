package org.calista.arasaka.reasoning.core;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.arasaka.io.FileIO;
import org.calista.arasaka.reasoning.bootstrap.CorpusBootstrapper;
import org.calista.arasaka.reasoning.events.EventStore;
import org.calista.arasaka.reasoning.format.LogBox;
import org.calista.arasaka.reasoning.knowledge.InMemoryKnowledgeStore;
import org.calista.arasaka.reasoning.knowledge.KnowledgeSnapshotStore;
import org.calista.arasaka.reasoning.knowledge.KnowledgeStore;
import org.calista.arasaka.reasoning.relation.InMemoryRelationshipStore;
import org.calista.arasaka.reasoning.relation.RelationshipStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Objects;

/**
 * ReasoningKernel: instance-owned runtime container.
 *
 * Lifecycle:
 *   1) build(config)  -> loadOrCreate config + init IO and stores (NO bootstrap)
 *   2) bootstrap()    -> snapshot + corpora into the knowledge store
 *   3) use            -> {@link ReasoningComposer} wires the pipeline from here
 *   4) close()
 *
 * No static singletons: lifecycle is explicit.
 */
public final class ReasoningKernel implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ReasoningKernel.class);

    private final FileIO io;
    private final ObjectMapper mapper;
    private final ReasoningConfig cfg;
    private final Path configFile;

    private final KnowledgeStore knowledge;
    private final RelationshipStore relationships;
    private final EventStore events;
    private final KnowledgeSnapshotStore snapshots;

    // bootstrap state
    private volatile boolean bootstrapped = false;

    private ReasoningKernel(FileIO io,
                            ObjectMapper mapper,
                            ReasoningConfig cfg,
                            Path configFile,
                            KnowledgeStore knowledge,
                            RelationshipStore relationships,
                            EventStore events,
                            KnowledgeSnapshotStore snapshots) {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.configFile = Objects.requireNonNull(configFile, "configFile");
        this.knowledge = Objects.requireNonNull(knowledge, "knowledge");
        this.relationships = Objects.requireNonNull(relationships, "relationships");
        this.events = Objects.requireNonNull(events, "events");
        this.snapshots = Objects.requireNonNull(snapshots, "snapshots");
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private Charset charset = StandardCharsets.UTF_8;

        /**
         * Root directory where config lives.
         * Config is read BEFORE baseDir is known (baseDir is inside config).
         */
        private Path configRoot = Path.of(".");

        private ObjectMapper mapper;
        private KnowledgeStore knowledgeStore;
        private RelationshipStore relationshipStore;

        public Builder charset(Charset charset) {
            this.charset = Objects.requireNonNull(charset, "charset");
            return this;
        }

        public Builder configRoot(Path configRoot) {
            this.configRoot = Objects.requireNonNull(configRoot, "configRoot");
            return this;
        }

        public Builder mapper(ObjectMapper mapper) {
            this.mapper = Objects.requireNonNull(mapper, "mapper");
            return this;
        }

        public Builder knowledgeStore(KnowledgeStore store) {
            this.knowledgeStore = Objects.requireNonNull(store, "knowledgeStore");
            return this;
        }

        public Builder relationshipStore(RelationshipStore store) {
            this.relationshipStore = Objects.requireNonNull(store, "relationshipStore");
            return this;
        }

        /**
         * Creates kernel container: loads/creates config, initializes IO and stores.
         * Does NOT bootstrap corpora.
         */
        public ReasoningKernel build(Path configFile) throws IOException {
            Objects.requireNonNull(configFile, "configFile");

            ObjectMapper om = (this.mapper != null) ? this.mapper : defaultMapper();

            // Config IO (outside baseDir)
            FileIO external = new FileIO(configRoot, charset, true);
            Path cfgPath = configFile.isAbsolute() ? configFile : external.baseDir().resolve(configFile);

            ReasoningConfig cfg = ReasoningConfig.loadOrCreate(external, cfgPath, om);

            // relative baseDir is taken against configRoot
            Path base = Path.of(cfg.baseDir);
            if (!base.isAbsolute()) base = external.baseDir().resolve(base);
            FileIO io = new FileIO(base, charset, true);

            KnowledgeStore ks = (this.knowledgeStore != null) ? this.knowledgeStore : new InMemoryKnowledgeStore();
            RelationshipStore rs = (this.relationshipStore != null) ? this.relationshipStore : new InMemoryRelationshipStore();

            EventStore events = new EventStore(io, om, io.resolve(cfg.events.logFile));
            KnowledgeSnapshotStore snapshots = new KnowledgeSnapshotStore(io, om, io.resolve(cfg.knowledge.snapshotFile));

            ReasoningKernel k = new ReasoningKernel(io, om, cfg, cfgPath, ks, rs, events, snapshots);
            k.logCreated();
            return k;
        }

        static ObjectMapper defaultMapper() {
            ObjectMapper om = new ObjectMapper();
            om.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            return om;
        }
    }

    // ---------------------------------------------------------------------
    // Bootstrap (explicit)
    // ---------------------------------------------------------------------

    /**
     * Loads the last snapshot (if enabled) and then the configured corpora.
     * Can be called once; repeated calls become no-op.
     */
    public synchronized void bootstrap() throws IOException {
        if (bootstrapped) return;

        int fromSnapshot = 0;
        if (cfg.knowledge.loadSnapshotOnBootstrap) fromSnapshot = snapshots.load(knowledge);

        Path corporaDir = corporaDir();
        CorpusBootstrapper bs = new CorpusBootstrapper(io, mapper);

        int files = 0, ok = 0, bad = 0;
        for (String name : cfg.corpora.bootstrap) {
            if (name == null || name.isBlank()) continue;
            CorpusBootstrapper.Report r = bs.loadInto(knowledge, corporaDir.resolve(name), cfg.corpora.failFast);
            files++;
            ok += r.ok;
            bad += r.bad;
        }

        bootstrapped = true;
        if (log.isInfoEnabled()) {
            final int snap = fromSnapshot, nFiles = files, nOk = ok, nBad = bad;
            log.info("\n{}", LogBox.box("ReasoningKernel bootstrap done", l -> l
                    .kv("corporaDir", corporaDir)
                    .kv("filesLoaded", nFiles)
                    .kv("items.ok", nOk)
                    .kv("items.bad", nBad)
                    .kv("fromSnapshot", snap)
                    .sep()
                    .kv("knowledge.size", knowledge.size())
                    .kv("failFast", cfg.corpora.failFast)));
        }
    }

    /**
     * Bootstrap only if not bootstrapped.
     */
    public void bootstrapIfNeeded() throws IOException {
        if (!bootstrapped) bootstrap();
    }

    public boolean isBootstrapped() {
        return bootstrapped;
    }

    /** Corpora dir: absolute as configured, otherwise inside baseDir. */
    public Path corporaDir() {
        Path p = Path.of(cfg.corpora.dir);
        return p.isAbsolute() ? io.resolveExternal(p) : io.resolve(cfg.corpora.dir);
    }

    public int saveSnapshot() throws IOException {
        return snapshots.save(knowledge);
    }

    // ---------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------

    public FileIO io() { return io; }
    public ObjectMapper mapper() { return mapper; }
    public ReasoningConfig config() { return cfg; }
    public Path configFile() { return configFile; }
    public KnowledgeStore knowledge() { return knowledge; }
    public RelationshipStore relationships() { return relationships; }
    public EventStore eventStore() { return events; }
    public KnowledgeSnapshotStore snapshotStore() { return snapshots; }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    @Override
    public void close() {
        // stores are in-memory; pools belong to the composer's components
        log.debug("ReasoningKernel closed: knowledge.size={}, relationships.size={}", knowledge.size(), relationships.size());
    }

    private void logCreated() {
        if (!log.isInfoEnabled()) return;
        log.info("ReasoningKernel created (no bootstrap yet): config={}, baseDir={}", configFile, io.baseDir());
    }
}
