package org.calista.arasaka.io;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * FileIO: единая точка I/O для конфигов, корпусов, снапшотов и журналов событий.
 *
 * <p>
 * - все относительные пути резолвятся внутри baseDir (защита от "..")
 * - атомарная запись: tmp-файл рядом с целевым + move
 * - JSONL helpers (trim + skip empty)
 * </p>
 */
public final class FileIO {
    private static final Logger log = LogManager.getLogger(FileIO.class);

    private final Path baseDir;
    private final Charset charset;
    private final boolean atomicWrites;

    public FileIO(Path baseDir) {
        this(baseDir, StandardCharsets.UTF_8, true);
    }

    public FileIO(Path baseDir, Charset charset, boolean atomicWrites) {
        this.baseDir = Objects.requireNonNull(baseDir, "baseDir").toAbsolutePath().normalize();
        this.charset = Objects.requireNonNull(charset, "charset");
        this.atomicWrites = atomicWrites;
        try {
            ensureBaseDir();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to ensure base directory exists: " + this.baseDir, e);
        }
        log.debug("FileIO init: baseDir={}, charset={}, atomicWrites={}", this.baseDir, charset, atomicWrites);
    }

    // ----------------------------
    // Base dir / Resolve
    // ----------------------------

    public Path baseDir() {
        return baseDir;
    }

    public Charset charset() {
        return charset;
    }

    public void ensureBaseDir() throws IOException {
        Files.createDirectories(baseDir);
    }

    /**
     * Resolves a relative path inside baseDir. Absolute paths and traversal outside baseDir are rejected.
     */
    public Path resolve(String relative) {
        Objects.requireNonNull(relative, "relative");
        Path rel = Paths.get(relative.replace('\\', '/'));
        if (rel.isAbsolute()) throw new IllegalArgumentException("resolve(relative) does not accept absolute paths: " + relative);

        Path p = baseDir.resolve(rel).normalize().toAbsolutePath();
        if (!p.startsWith(baseDir)) throw new IllegalArgumentException("Path traversal detected: " + relative);
        return p;
    }

    /** Для внешних путей (корпуса вне sandbox): только нормализация. */
    public Path resolveExternal(Path anyPath) {
        Objects.requireNonNull(anyPath, "anyPath");
        return anyPath.toAbsolutePath().normalize();
    }

    public boolean exists(Path file) {
        return file != null && Files.exists(file);
    }

    // ----------------------------
    // Text
    // ----------------------------

    /**
     * @throws NoSuchFileException when the file does not exist (callers use it to create defaults)
     */
    public String readString(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        return Files.readString(file, charset);
    }

    public void writeString(Path file, String content) throws IOException {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(content, "content");
        ensureParentDir(file);

        if (!atomicWrites) {
            Files.writeString(file, content, charset, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
            return;
        }

        Path tmp = tempSibling(file);
        Files.writeString(tmp, content, charset, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        atomicCommit(tmp, file);
    }

    // ----------------------------
    // JSONL
    // ----------------------------

    public synchronized void appendJsonl(Path file, String jsonLine) throws IOException {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(jsonLine, "jsonLine");
        String s = jsonLine.trim();
        if (s.isEmpty()) return;

        ensureParentDir(file);
        Files.writeString(file, s + System.lineSeparator(), charset,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
    }

    /** Small JSONL files only; use {@link #jsonlStream(Path)} for large corpora. */
    public List<String> readJsonl(Path file) throws IOException {
        try (Stream<String> s = jsonlStream(file)) {
            List<String> out = s.collect(Collectors.toList());
            log.debug("readJsonl: {} ({} records)", file, out.size());
            return out;
        }
    }

    /** Stream of trimmed, non-empty lines. The stream must be closed. */
    public Stream<String> jsonlStream(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        return Files.lines(file, charset)
                .map(x -> x == null ? "" : x.trim())
                .filter(x -> !x.isEmpty());
    }

    // ----------------------------
    // Writer API (atomic snapshots)
    // ----------------------------

    public WriterHandle openWriter(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        ensureParentDir(file);

        if (!atomicWrites) {
            BufferedWriter w = Files.newBufferedWriter(file, charset,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
            return new WriterHandle(file, null, w);
        }

        Path tmp = tempSibling(file);
        BufferedWriter w = Files.newBufferedWriter(tmp, charset,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        return new WriterHandle(file, tmp, w);
    }

    public void commit(WriterHandle h) throws IOException {
        Objects.requireNonNull(h, "handle");
        h.writer.close();
        if (h.tmpFile != null) atomicCommit(h.tmpFile, h.targetFile);
    }

    public void rollback(WriterHandle h) {
        if (h == null) return;
        try {
            h.writer.close();
        } catch (IOException e) {
            log.debug("rollback: close failed for {}: {}", h.targetFile, e.toString());
        }
        if (h.tmpFile != null) {
            try {
                Files.deleteIfExists(h.tmpFile);
            } catch (IOException e) {
                log.warn("rollback: failed to delete tmp {}", h.tmpFile, e);
            }
        }
    }

    public static final class WriterHandle {
        public final Path targetFile;
        public final Path tmpFile; // null если не atomicWrites
        public final BufferedWriter writer;

        private WriterHandle(Path targetFile, Path tmpFile, BufferedWriter writer) {
            this.targetFile = targetFile;
            this.tmpFile = tmpFile;
            this.writer = writer;
        }
    }

    // ----------------------------
    // Internals
    // ----------------------------

    private void ensureParentDir(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
    }

    private static Path tempSibling(Path target) {
        return target.resolveSibling(target.getFileName().toString() + ".tmp");
    }

    private static void atomicCommit(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.trace("atomicCommit: {} -> {} (ATOMIC)", tmp, target);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            log.trace("atomicCommit: {} -> {} (NON-ATOMIC fallback)", tmp, target);
        }
    }
}
