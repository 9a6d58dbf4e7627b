package org.calista.arasaka.reasoning.format;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

public final class ChainFormatters {

    private ChainFormatters() {}

    public static List<ChainFormatter> all(ObjectMapper om) {
        return List.of(new TextChainFormatter(), new JsonChainFormatter(om, true), new MarkdownChainFormatter(), new HtmlChainFormatter());
    }

    /** Formatter by name ("md" is accepted for markdown); unknown names fall back to text. */
    public static ChainFormatter forName(String name, ObjectMapper om) {
        Objects.requireNonNull(om, "om");
        String n = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
        return switch (n) {
            case "json" -> new JsonChainFormatter(om, true);
            case "markdown", "md" -> new MarkdownChainFormatter();
            case "html" -> new HtmlChainFormatter();
            default -> new TextChainFormatter();
        };
    }
}
