package org.calista.arasaka.reasoning.format;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.calista.arasaka.reasoning.analysis.Domain;
import org.calista.arasaka.reasoning.reason.ReasoningChain;
import org.calista.arasaka.reasoning.reason.ReasoningStep;
import org.calista.arasaka.reasoning.relation.Relationship;

import java.io.UncheckedIOException;
import java.util.Objects;

/**
 * Jackson tree with snake_case keys, stable field order.
 */
public final class JsonChainFormatter implements ChainFormatter {

    private final ObjectMapper om;
    private final boolean pretty;

    public JsonChainFormatter(ObjectMapper om) {
        this(om, false);
    }

    public JsonChainFormatter(ObjectMapper om, boolean pretty) {
        this.om = Objects.requireNonNull(om, "om");
        this.pretty = pretty;
    }

    @Override
    public String name() {
        return "json";
    }

    @Override
    public String format(ReasoningChain chain) {
        ObjectNode root = toTree(chain);
        try {
            return pretty ? om.writerWithDefaultPrettyPrinter().writeValueAsString(root) : om.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize reasoning chain", e);
        }
    }

    public ObjectNode toTree(ReasoningChain chain) {
        ObjectNode root = om.createObjectNode();
        root.put("query", chain.query);
        root.put("reasoning_type", chain.reasoningType.label());

        ArrayNode steps = root.putArray("steps");
        for (ReasoningStep s : chain.steps) {
            ObjectNode n = steps.addObject();
            n.put("step_number", s.stepNumber);
            n.put("description", s.description);
            n.put("reasoning", s.reasoning);
            n.put("confidence", s.confidence);
            ArrayNode deps = n.putArray("dependencies");
            for (int d : s.dependencies) deps.add(d);
            ArrayNode ev = n.putArray("evidence");
            for (String e : s.evidence) ev.add(e);
            n.put("knowledge_used", s.knowledgeUsed.size());
        }

        root.put("conclusion", chain.conclusion);
        root.put("confidence", chain.confidence);
        root.put("verification_result", chain.verificationResult);
        root.put("quality", chain.qualityScore);

        ArrayNode topics = root.putArray("topics");
        for (String t : chain.topicsInvolved) topics.add(t);
        ArrayNode domains = root.putArray("domains");
        for (Domain d : chain.domains) domains.add(d.label());

        ArrayNode rels = root.putArray("relationships");
        for (Relationship r : chain.relationships) {
            ObjectNode n = rels.addObject();
            n.put("topic1", r.topic1);
            n.put("topic2", r.topic2);
            n.put("type", r.type.label());
            n.put("strength", r.strength);
            n.put("confidence", r.confidence);
        }
        root.put("processing_time_ms", chain.processingTimeMs);
        return root;
    }
}
