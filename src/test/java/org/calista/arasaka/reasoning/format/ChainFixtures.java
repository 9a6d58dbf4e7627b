package org.calista.arasaka.reasoning.format;

import org.calista.arasaka.reasoning.analysis.Domain;
import org.calista.arasaka.reasoning.analysis.ReasoningType;
import org.calista.arasaka.reasoning.reason.ReasoningChain;
import org.calista.arasaka.reasoning.reason.ReasoningStep;
import org.calista.arasaka.reasoning.relation.Relationship;
import org.calista.arasaka.reasoning.relation.RelationshipType;

import java.util.List;

final class ChainFixtures {

    private ChainFixtures() {}

    static ReasoningChain causal() {
        ReasoningStep s1 = new ReasoningStep(1, "Identify potential causes", "Drought <and> heat matter.", 0.8, List.of());
        s1.evidence.add("Droughts reduce yields.");
        s1.knowledgeUsed.add("drought: Yields");
        ReasoningStep s2 = new ReasoningStep(2, "Determine most likely cause", "Drought is the main cause.", 0.75, List.of(1));

        return ReasoningChain.builder("Why do crops fail?", ReasoningType.CAUSAL)
                .steps(List.of(s1, s2))
                .conclusion("The most likely cause is: drought")
                .confidence(0.775)
                .qualityScore(0.7)
                .verificationResult(true)
                .topicsInvolved(List.of("drought", "crops"))
                .relationships(List.of(new Relationship("drought", "crops", RelationshipType.CAUSAL, 0.6, 0.7, "drought affects crops")))
                .domains(List.of(Domain.ENVIRONMENT))
                .processingTimeMs(12)
                .build();
    }
}
