package org.calista.arasaka.reasoning.format;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * LogBox: рамка для многострочных lifecycle-логов (kernel built, pipeline wired).
 */
public final class LogBox {

    private static final String SEP = "\u0000sep";
    private static final int MIN_WIDTH = 24;
    private static final int MAX_LINE = 160;

    private LogBox() {}

    public static String box(String title, Consumer<Lines> fill) {
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(fill, "fill");
        Lines l = new Lines();
        fill.accept(l);
        return render(title, l.lines);
    }

    public static final class Lines {
        private final List<String> lines = new ArrayList<>(16);

        public Lines kv(String key, Object value) {
            String v = value instanceof Double ? String.format(Locale.ROOT, "%.3f", (Double) value) : String.valueOf(value);
            lines.add(clip((key == null ? "" : key) + ": " + v));
            return this;
        }

        public Lines line(String text) {
            lines.add(clip(text == null ? "" : text));
            return this;
        }

        public Lines sep() {
            lines.add(SEP);
            return this;
        }

        private static String clip(String s) {
            return s.length() > MAX_LINE ? s.substring(0, MAX_LINE - 3) + "..." : s;
        }
    }

    static String render(String title, List<String> lines) {
        int content = title.length();
        for (String l : lines) if (!SEP.equals(l)) content = Math.max(content, l.length());
        int w = Math.max(MIN_WIDTH, content + 2);

        StringBuilder out = new StringBuilder((lines.size() + 4) * (w + 4));
        out.append('┌').append("─".repeat(w)).append("┐\n");
        out.append("│ ").append(pad(title, w - 1)).append("│\n");
        out.append('├').append("─".repeat(w)).append("┤\n");
        for (String l : lines) {
            if (SEP.equals(l)) {
                out.append('├').append("─".repeat(w)).append("┤\n");
            } else {
                out.append("│ ").append(pad(l, w - 1)).append("│\n");
            }
        }
        out.append('└').append("─".repeat(w)).append('┘');
        return out.toString();
    }

    private static String pad(String s, int width) {
        return s.length() >= width ? s : s + " ".repeat(width - s.length());
    }
}
