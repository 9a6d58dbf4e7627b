package org.calista.arasaka.reasoning.reason;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReasoningStepTest {

    @Test
    void rejectsSelfDependencyAndNonPositiveNumber() {
        assertThatThrownBy(() -> new ReasoningStep(2, "x", 0.5, List.of(2)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ReasoningStep(0, "x", 0.5, List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void renumberedIsADeepCopy() {
        ReasoningStep s = new ReasoningStep(3, "Assess evidence", "Evidence looks solid.", 0.8, List.of(1, 2));
        s.evidence.add("a sentence");
        s.knowledgeUsed.add("topic: title");

        ReasoningStep c = s.renumbered(1, List.of());
        s.evidence.add("added later");

        assertThat(c.stepNumber).isEqualTo(1);
        assertThat(c.dependencies).isEmpty();
        assertThat(c.reasoning).isEqualTo("Evidence looks solid.");
        assertThat(c.evidence).containsExactly("a sentence");
        assertThat(c.knowledgeUsed).containsExactly("topic: title");
    }

    @Test
    void blankReasoningDoesNotCount() {
        assertThat(new ReasoningStep(1, "x", 0.5, null).hasReasoning()).isFalse();
        assertThat(new ReasoningStep(1, "x", "  ", 0.5, null).hasReasoning()).isFalse();
    }
}
