package org.calista.arasaka.reasoning.events;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.arasaka.io.FileIO;
import org.calista.arasaka.reasoning.analysis.ReasoningType;
import org.calista.arasaka.reasoning.reason.ReasoningChain;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EventStoreTest {

    @TempDir
    Path dir;

    @Test
    void appendedEventsReadBackInOrder() throws Exception {
        FileIO io = new FileIO(dir);
        EventStore store = new EventStore(io, new ObjectMapper(), io.resolve("events.jsonl"));

        store.append(ReasoningEvent.of(ReasoningEvent.QUERY, "s1", "Why do crops fail?", 10L));
        ReasoningChain chain = ReasoningChain.builder("Why do crops fail?", ReasoningType.CAUSAL)
                .conclusion("Drought matters.")
                .confidence(0.8)
                .verificationResult(true)
                .build();
        store.appendChain("s1", chain, 20L);

        List<ReasoningEvent> all = store.readAll();
        assertThat(all).hasSize(2);
        assertThat(all.get(0).type).isEqualTo(ReasoningEvent.QUERY);
        assertThat(all.get(0).text).isEqualTo("Why do crops fail?");

        ReasoningEvent c = all.get(1);
        assertThat(c.type).isEqualTo(ReasoningEvent.CHAIN);
        assertThat(c.text).isEqualTo("Drought matters.");
        assertThat(c.reasoningType).isEqualTo(ReasoningType.CAUSAL.label());
        assertThat(c.confidence).isEqualTo(0.8);
        assertThat(c.verified).isTrue();
        assertThat(c.tsEpochMs).isEqualTo(20L);
    }

    @Test
    void missingJournalReadsEmpty() throws Exception {
        FileIO io = new FileIO(dir);
        EventStore store = new EventStore(io, new ObjectMapper(), io.resolve("none.jsonl"));
        assertThat(store.readAll()).isEmpty();
        assertThat(store.readAllRawLines()).isEmpty();
    }
}
