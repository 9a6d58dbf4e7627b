package org.calista.arasaka.io;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileIOTest {

    @TempDir
    Path dir;

    @Test
    void resolveStaysInsideBaseDir() {
        FileIO io = new FileIO(dir);
        assertThat(io.resolve("a/b.json")).isEqualTo(dir.toAbsolutePath().normalize().resolve("a/b.json"));
        assertThatThrownBy(() -> io.resolve("../escape.json")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> io.resolve(dir.toAbsolutePath().toString())).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void writeStringIsAtomicAndLeavesNoTmp() throws IOException {
        FileIO io = new FileIO(dir);
        Path f = io.resolve("nested/cfg.json");

        io.writeString(f, "{\"a\":1}");
        io.writeString(f, "{\"a\":2}");

        assertThat(io.readString(f)).isEqualTo("{\"a\":2}");
        assertThat(Files.exists(f.resolveSibling("cfg.json.tmp"))).isFalse();
    }

    @Test
    void readingMissingFileThrowsNoSuchFile() {
        FileIO io = new FileIO(dir);
        assertThatThrownBy(() -> io.readString(io.resolve("missing.json"))).isInstanceOf(NoSuchFileException.class);
    }

    @Test
    void jsonlAppendSkipsBlankAndReadTrims() throws IOException {
        FileIO io = new FileIO(dir);
        Path f = io.resolve("events.jsonl");

        io.appendJsonl(f, "  {\"n\":1}  ");
        io.appendJsonl(f, "   ");
        io.appendJsonl(f, "{\"n\":2}");

        assertThat(io.readJsonl(f)).containsExactly("{\"n\":1}", "{\"n\":2}");
    }

    @Test
    void rollbackDropsTmpAndKeepsTarget() throws IOException {
        FileIO io = new FileIO(dir);
        Path f = io.resolve("snap.jsonl");
        io.writeString(f, "old");

        FileIO.WriterHandle h = io.openWriter(f);
        h.writer.write("new");
        io.rollback(h);

        assertThat(io.readString(f)).isEqualTo("old");
        assertThat(Files.exists(h.tmpFile)).isFalse();

        FileIO.WriterHandle h2 = io.openWriter(f);
        h2.writer.write("new");
        io.commit(h2);
        assertThat(io.readString(f)).isEqualTo("new");
    }
}
