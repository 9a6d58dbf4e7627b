package org.calista.arasaka.reasoning.core;

import org.calista.arasaka.reasoning.analysis.ReasoningType;
import org.calista.arasaka.reasoning.knowledge.KnowledgeItem;
import org.calista.arasaka.reasoning.reason.ReasoningChain;
import org.calista.arasaka.reasoning.retrieve.ResearchSource;
import org.calista.arasaka.reasoning.retrieve.TopicInfo;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class ReasoningComposerTest {

    @TempDir
    Path dir;

    @Test
    void composedPipelineSharesTheKernelStores() throws Exception {
        try (ReasoningKernel k = ReasoningKernel.builder().configRoot(dir).build(Path.of("reasoning.json"))) {
            ReasoningKernelTest.writeCorpus(k.corporaDir());
            k.bootstrap();

            try (ReasoningComposer.Pipeline p = new ReasoningComposer().compose(k)) {
                assertThat(p.engine).isNotNull();
                assertThat(p.causal).isNotNull();

                ReasoningChain math = p.engine.generateReasoningChain("What is 5 + 3?");
                assertThat(math.reasoningType).isEqualTo(ReasoningType.MATHEMATICAL);
                assertThat(math.conclusion).contains("8");

                assertThat(p.mapper.store()).isSameAs(k.relationships());
            }
        }
    }

    @Test
    void researchSourceIsConsultedForThinTopics() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        ResearchSource research = topic -> {
            calls.incrementAndGet();
            return List.of(KnowledgeItem.of(topic, "Volcano basics",
                    "A volcano is an opening in the crust where magma, ash and gases escape from below the surface of a planet.",
                    "wikipedia", 0.9));
        };

        try (ReasoningKernel k = ReasoningKernel.builder().configRoot(dir).build(Path.of("reasoning.json"));
             ReasoningComposer.Pipeline p = new ReasoningComposer(research).compose(k)) {
            p.retriever.retrieve("volcano", List.of(TopicInfo.of("volcano")), 3, false);
            assertThat(calls.get()).isEqualTo(1);
            // learned items land in the kernel store
            assertThat(k.knowledge().size()).isEqualTo(1);
        }
    }
}
