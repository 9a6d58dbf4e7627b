package org.calista.arasaka.reasoning.format;

import org.calista.arasaka.reasoning.reason.ReasoningChain;
import org.calista.arasaka.reasoning.reason.ReasoningStep;
import org.calista.arasaka.reasoning.relation.Relationship;

import java.util.Locale;

/**
 * Plain-text report: header, steps with evidence, conclusion, metrics, relationships.
 */
public final class TextChainFormatter implements ChainFormatter {

    @Override
    public String name() {
        return "text";
    }

    @Override
    public String format(ReasoningChain chain) {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Reasoning Chain Analysis\n");
        sb.append("=======================\n");
        sb.append("Query: ").append(chain.query).append('\n');
        sb.append("Reasoning Type: ").append(chain.reasoningType.displayName()).append('\n');

        for (ReasoningStep s : chain.steps) {
            sb.append('\n');
            sb.append("Step ").append(s.stepNumber).append(": ").append(s.description).append('\n');
            sb.append("Reasoning: ").append(s.reasoning).append('\n');
            sb.append("Confidence: ").append(f2(s.confidence));
            if (!s.evidence.isEmpty()) sb.append("\nEvidence: ").append(String.join("; ", s.evidence));
            if (!s.knowledgeUsed.isEmpty()) sb.append("\nKnowledge Items Used: ").append(s.knowledgeUsed.size());
            sb.append('\n');
        }

        sb.append("\nConclusion: ").append(chain.conclusion).append('\n');
        sb.append("\nMetrics:\n");
        sb.append("- Overall Confidence: ").append(f2(chain.confidence)).append('\n');
        sb.append("- Quality Score: ").append(f2(chain.qualityScore)).append('\n');
        sb.append("- Verification: ").append(chain.verificationResult ? "Passed" : "Failed").append('\n');
        sb.append("- Topics Involved: ").append(String.join(", ", chain.topicsInvolved));

        if (!chain.relationships.isEmpty()) {
            sb.append("\n\nRelationships:");
            for (Relationship r : chain.relationships) {
                sb.append("\n  - ").append(r.describe()).append(" (strength: ").append(f2(r.strength)).append(')');
            }
        }
        return sb.toString();
    }

    static String f2(double v) {
        return String.format(Locale.ROOT, "%.2f", v);
    }
}
