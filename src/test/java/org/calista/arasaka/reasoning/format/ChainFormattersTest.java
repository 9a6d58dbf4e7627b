package org.calista.arasaka.reasoning.format;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.arasaka.reasoning.reason.ReasoningChain;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ChainFormattersTest {

    private final ObjectMapper om = new ObjectMapper();
    private final ReasoningChain chain = ChainFixtures.causal();

    @Test
    void lookupByNameFallsBackToText() {
        assertThat(ChainFormatters.forName("JSON", om).name()).isEqualTo("json");
        assertThat(ChainFormatters.forName("md", om).name()).isEqualTo("markdown");
        assertThat(ChainFormatters.forName("html", om).name()).isEqualTo("html");
        assertThat(ChainFormatters.forName("yaml", om).name()).isEqualTo("text");
        assertThat(ChainFormatters.forName(null, om).name()).isEqualTo("text");
        assertThat(ChainFormatters.all(om)).extracting(ChainFormatter::name)
                .containsExactly("text", "json", "markdown", "html");
    }

    @Test
    void textReport() {
        String out = new TextChainFormatter().format(chain);

        assertThat(out).startsWith("Reasoning Chain Analysis\n=======================\nQuery: Why do crops fail?\nReasoning Type: Causal\n");
        assertThat(out).contains("\nStep 1: Identify potential causes\nReasoning: Drought <and> heat matter.\nConfidence: 0.80"
                + "\nEvidence: Droughts reduce yields.\nKnowledge Items Used: 1\n");
        assertThat(out).contains("\nStep 2: Determine most likely cause\nReasoning: Drought is the main cause.\nConfidence: 0.75\n");
        assertThat(out).contains("- Overall Confidence: 0.78\n- Quality Score: 0.70\n- Verification: Passed\n- Topics Involved: drought, crops");
        assertThat(out).endsWith("\n\nRelationships:\n  - drought causal crops (strength: 0.60)");
    }

    @Test
    void markdownReport() {
        String out = new MarkdownChainFormatter().format(chain);

        assertThat(out).startsWith("# Reasoning Analysis\n\n**Query:** Why do crops fail?\n\n**Reasoning Type:** Causal\n\n");
        assertThat(out).contains("### Step 1: Identify potential causes\n\n", "> Droughts reduce yields.\n", "*Confidence: 0.80*");
        assertThat(out).contains("## Conclusion\n\nThe most likely cause is: drought\n\n");
        assertThat(out).contains("## Relationships\n\n- drought causal crops (strength: 0.60)\n");
        assertThat(out).contains("- **Verification:** Passed\n", "- **Topics:** drought, crops\n");
    }

    @Test
    void htmlReportEscapesText() {
        String out = new HtmlChainFormatter().format(chain);

        assertThat(out).startsWith("<!DOCTYPE html>");
        assertThat(out).contains("<p>Drought &lt;and&gt; heat matter.</p>");
        assertThat(out).contains("<ul class=\"evidence\">\n<li>Droughts reduce yields.</li>\n</ul>");
        assertThat(out).doesNotContain("<and>");
        assertThat(HtmlChainFormatter.escape("a & 'b' \"c\"")).isEqualTo("a &amp; &#39;b&#39; &quot;c&quot;");
    }

    @Test
    void jsonReportUsesSnakeCaseKeys() throws Exception {
        String out = new JsonChainFormatter(om).format(chain);
        JsonNode root = om.readTree(out);

        assertThat(root.get("query").asText()).isEqualTo("Why do crops fail?");
        assertThat(root.get("reasoning_type").asText()).isEqualTo("causal");
        assertThat(root.get("steps")).hasSize(2);
        JsonNode step = root.get("steps").get(1);
        assertThat(step.get("step_number").asInt()).isEqualTo(2);
        assertThat(step.get("dependencies").get(0).asInt()).isEqualTo(1);
        assertThat(root.get("steps").get(0).get("knowledge_used").asInt()).isEqualTo(1);
        assertThat(root.get("verification_result").asBoolean()).isTrue();
        assertThat(root.get("quality").asDouble()).isEqualTo(0.7);
        assertThat(root.get("domains").get(0).asText()).isEqualTo("environment");
        assertThat(root.get("relationships").get(0).get("type").asText()).isEqualTo("causal");
        assertThat(root.get("processing_time_ms").asLong()).isEqualTo(12);

        assertThat(new JsonChainFormatter(om, true).format(chain)).contains("\n");
    }
}
