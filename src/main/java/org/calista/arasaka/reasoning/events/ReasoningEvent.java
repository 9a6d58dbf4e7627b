package org.calista.arasaka.reasoning.events;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public final class ReasoningEvent {

    public static final String QUERY = "QUERY";
    public static final String CHAIN = "CHAIN";
    public static final String SNAPSHOT = "SNAPSHOT";

    public String type;        // QUERY, CHAIN, SNAPSHOT
    public long tsEpochMs;
    public String sessionId;
    public String text;        // payload (query / conclusion / snapshot note)

    // CHAIN only
    public String reasoningType;
    public double confidence;
    public boolean verified;

    public static ReasoningEvent of(String type, String sessionId, String text, long tsEpochMs) {
        ReasoningEvent e = new ReasoningEvent();
        e.type = type;
        e.sessionId = sessionId;
        e.text = text;
        e.tsEpochMs = tsEpochMs;
        return e;
    }
}
