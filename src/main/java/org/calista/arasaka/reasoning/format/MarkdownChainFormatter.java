package org.calista.arasaka.reasoning.format;

import org.calista.arasaka.reasoning.reason.ReasoningChain;
import org.calista.arasaka.reasoning.reason.ReasoningStep;
import org.calista.arasaka.reasoning.relation.Relationship;

public final class MarkdownChainFormatter implements ChainFormatter {

    @Override
    public String name() {
        return "markdown";
    }

    @Override
    public String format(ReasoningChain chain) {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("# Reasoning Analysis\n\n");
        sb.append("**Query:** ").append(chain.query).append("\n\n");
        sb.append("**Reasoning Type:** ").append(chain.reasoningType.displayName()).append("\n\n");

        sb.append("## Reasoning Steps\n\n");
        for (ReasoningStep s : chain.steps) {
            sb.append("### Step ").append(s.stepNumber).append(": ").append(s.description).append("\n\n");
            sb.append(s.reasoning).append("\n\n");
            for (String e : s.evidence) sb.append("> ").append(e).append('\n');
            if (!s.evidence.isEmpty()) sb.append('\n');
            sb.append("*Confidence: ").append(TextChainFormatter.f2(s.confidence)).append("*\n\n");
        }

        sb.append("## Conclusion\n\n").append(chain.conclusion).append("\n\n");

        if (!chain.relationships.isEmpty()) {
            sb.append("## Relationships\n\n");
            for (Relationship r : chain.relationships) {
                sb.append("- ").append(r.describe()).append(" (strength: ").append(TextChainFormatter.f2(r.strength)).append(")\n");
            }
            sb.append('\n');
        }

        sb.append("## Metrics\n\n");
        sb.append("- **Confidence:** ").append(TextChainFormatter.f2(chain.confidence)).append('\n');
        sb.append("- **Quality Score:** ").append(TextChainFormatter.f2(chain.qualityScore)).append('\n');
        sb.append("- **Verification:** ").append(chain.verificationResult ? "Passed" : "Failed").append('\n');
        if (!chain.topicsInvolved.isEmpty()) {
            sb.append("- **Topics:** ").append(String.join(", ", chain.topicsInvolved)).append('\n');
        }
        return sb.toString();
    }
}
