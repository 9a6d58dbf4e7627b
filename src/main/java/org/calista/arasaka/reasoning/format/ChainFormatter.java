package org.calista.arasaka.reasoning.format;

import org.calista.arasaka.reasoning.reason.ReasoningChain;

/**
 * Pure serializer of a finished chain. Implementations must not alter the chain.
 */
public interface ChainFormatter {

    /** Short name used in configuration: text, json, markdown, html. */
    String name();

    String format(ReasoningChain chain);
}
