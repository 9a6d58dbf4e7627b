package org.calista.arasaka.reasoning.format;

import org.calista.arasaka.reasoning.reason.ReasoningChain;
import org.calista.arasaka.reasoning.reason.ReasoningStep;
import org.calista.arasaka.reasoning.relation.Relationship;

/**
 * Standalone HTML page. Every piece of chain text is escaped.
 */
public final class HtmlChainFormatter implements ChainFormatter {

    @Override
    public String name() {
        return "html";
    }

    @Override
    public String format(ReasoningChain chain) {
        StringBuilder sb = new StringBuilder(2048);
        sb.append("<!DOCTYPE html>\n<html>\n<head><meta charset=\"utf-8\"><title>Reasoning Analysis</title></head>\n<body>\n");
        sb.append("<h1>Reasoning Analysis</h1>\n");
        sb.append("<p><strong>Query:</strong> ").append(escape(chain.query)).append("</p>\n");
        sb.append("<p><strong>Reasoning Type:</strong> ").append(escape(chain.reasoningType.displayName())).append("</p>\n");

        sb.append("<h2>Reasoning Steps</h2>\n");
        for (ReasoningStep s : chain.steps) {
            sb.append("<div class=\"step\">\n");
            sb.append("<h3>Step ").append(s.stepNumber).append(": ").append(escape(s.description)).append("</h3>\n");
            sb.append("<p>").append(escape(s.reasoning)).append("</p>\n");
            if (!s.evidence.isEmpty()) {
                sb.append("<ul class=\"evidence\">\n");
                for (String e : s.evidence) sb.append("<li>").append(escape(e)).append("</li>\n");
                sb.append("</ul>\n");
            }
            sb.append("<p><em>Confidence: ").append(TextChainFormatter.f2(s.confidence)).append("</em></p>\n");
            sb.append("</div>\n");
        }

        sb.append("<h2>Conclusion</h2>\n<p>").append(escape(chain.conclusion)).append("</p>\n");

        if (!chain.relationships.isEmpty()) {
            sb.append("<h2>Relationships</h2>\n<ul>\n");
            for (Relationship r : chain.relationships) {
                sb.append("<li>").append(escape(r.describe())).append(" (strength: ")
                        .append(TextChainFormatter.f2(r.strength)).append(")</li>\n");
            }
            sb.append("</ul>\n");
        }

        sb.append("<h2>Metrics</h2>\n<ul>\n");
        sb.append("<li>Confidence: ").append(TextChainFormatter.f2(chain.confidence)).append("</li>\n");
        sb.append("<li>Quality Score: ").append(TextChainFormatter.f2(chain.qualityScore)).append("</li>\n");
        sb.append("<li>Verification: ").append(chain.verificationResult ? "Passed" : "Failed").append("</li>\n");
        sb.append("</ul>\n</body>\n</html>\n");
        return sb.toString();
    }

    static String escape(String s) {
        if (s == null || s.isEmpty()) return "";
        StringBuilder b = new StringBuilder(s.length() + 16);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '&' -> b.append("&amp;");
                case '<' -> b.append("&lt;");
                case '>' -> b.append("&gt;");
                case '"' -> b.append("&quot;");
                case '\'' -> b.append("&#39;");
                default -> b.append(c);
            }
        }
        return b.toString();
    }
}
