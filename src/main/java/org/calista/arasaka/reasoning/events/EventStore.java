package org.calista.arasaka.reasoning.events;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.arasaka.io.FileIO;
import org.calista.arasaka.reasoning.reason.ReasoningChain;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Append-only JSONL journal of console sessions.
 */
public final class EventStore {
    private final FileIO io;
    private final ObjectMapper mapper;
    private final Path file;

    public EventStore(FileIO io, ObjectMapper mapper, Path file) {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.file = Objects.requireNonNull(file, "file");
    }

    public Path file() {
        return file;
    }

    public void append(ReasoningEvent e) throws IOException {
        String line = mapper.writeValueAsString(e);
        io.appendJsonl(file, line);
    }

    public void appendChain(String sessionId, ReasoningChain chain, long tsEpochMs) throws IOException {
        ReasoningEvent e = ReasoningEvent.of(ReasoningEvent.CHAIN, sessionId, chain.conclusion, tsEpochMs);
        e.reasoningType = chain.reasoningType.label();
        e.confidence = chain.confidence;
        e.verified = chain.verificationResult;
        append(e);
    }

    public List<String> readAllRawLines() throws IOException {
        if (!io.exists(file)) return List.of();
        return io.readJsonl(file);
    }

    public List<ReasoningEvent> readAll() throws IOException {
        List<String> lines = readAllRawLines();
        ArrayList<ReasoningEvent> out = new ArrayList<>(lines.size());
        for (String line : lines) out.add(mapper.readValue(line, ReasoningEvent.class));
        return out;
    }
}
