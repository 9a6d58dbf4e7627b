package org.calista.arasaka.reasoning.text;

import java.util.List;

/**
 * Splits free text into lowercase word tokens.
 */
public interface Tokenizer {
    List<String> tokenize(String text);
}
