package org.calista.arasaka.reasoning.text;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Letters/digits tokenizer. Inner '-' and '\'' survive when surrounded by letters or digits,
 * so "covid-19" and "don't" stay single tokens.
 */
public final class SimpleTokenizer implements Tokenizer {

    public static final SimpleTokenizer INSTANCE = new SimpleTokenizer();

    @Override
    public List<String> tokenize(String text) {
        if (text == null || text.isBlank()) return List.of();
        String s = text.toLowerCase(Locale.ROOT);

        ArrayList<String> out = new ArrayList<>(Math.max(8, s.length() / 5));
        StringBuilder tok = new StringBuilder(24);
        int n = s.length();
        for (int i = 0; i < n; i++) {
            char c = s.charAt(i);
            if (Character.isLetterOrDigit(c)) {
                tok.append(c);
                continue;
            }
            boolean joiner = (c == '-' || c == '\'');
            if (joiner && tok.length() > 0 && i + 1 < n && Character.isLetterOrDigit(s.charAt(i + 1))) {
                tok.append(c);
                continue;
            }
            flush(tok, out);
        }
        flush(tok, out);
        return out;
    }

    private static void flush(StringBuilder tok, List<String> out) {
        if (tok.length() == 0) return;
        out.add(tok.toString());
        tok.setLength(0);
    }
}
