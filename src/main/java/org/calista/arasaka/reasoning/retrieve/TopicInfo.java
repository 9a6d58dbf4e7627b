package org.calista.arasaka.reasoning.retrieve;

import org.calista.arasaka.reasoning.analysis.Domain;

import java.util.Objects;

/**
 * A topic found in a query, with its domain and relevance to that query.
 */
public final class TopicInfo {

    public enum Origin { TOPIC_EXTRACTION, ENTITY_EXTRACTION, CALLER }

    public final String topic;
    public final Domain domain;
    public final double relevanceScore;
    public final Origin origin;

    public TopicInfo(String topic, Domain domain, double relevanceScore, Origin origin) {
        this.topic = Objects.requireNonNull(topic, "topic");
        this.domain = domain == null ? Domain.GENERAL : domain;
        this.relevanceScore = relevanceScore;
        this.origin = origin == null ? Origin.CALLER : origin;
    }

    public static TopicInfo of(String topic) {
        return new TopicInfo(topic, Domain.classify(topic), 1.0, Origin.CALLER);
    }

    @Override
    public String toString() {
        return "TopicInfo{" + topic + ", " + domain.label() + ", " + String.format(java.util.Locale.ROOT, "%.2f", relevanceScore) + '}';
    }
}
