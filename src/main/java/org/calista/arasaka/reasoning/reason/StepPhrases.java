package org.calista.arasaka.reasoning.reason;

import org.calista.arasaka.reasoning.analysis.FirstMatch;
import org.calista.arasaka.reasoning.text.Texts;

import java.util.function.Predicate;

/**
 * Templated reasoning text for a step, picked by the first keyword found in its description.
 */
final class StepPhrases {

    /** Input of one phrase rule. */
    static final class Input {
        final String query;
        final String description;
        final String descriptionLower;

        Input(String query, String description) {
            this.query = query == null ? "" : query;
            this.description = description;
            this.descriptionLower = Texts.lower(description);
        }
    }

    private static Predicate<Input> mentions(String... words) {
        return in -> {
            for (String w : words) if (in.descriptionLower.contains(w)) return true;
            return false;
        };
    }

    static final FirstMatch<Input, String> PHRASES = FirstMatch.<Input, String>builder()
            .rule("identify", mentions("identify"),
                    in -> "To answer '" + in.query + "', I need to first " + in.descriptionLower + ".")
            .rule("evaluate", mentions("evaluate", "analyze"),
                    in -> "For this step, I " + in.descriptionLower + " by considering relevant factors and evidence.")
            .rule("apply", mentions("apply"),
                    in -> "I " + in.descriptionLower + " the appropriate method based on the problem requirements.")
            .rule("determine", mentions("determine"),
                    in -> "Based on the analysis so far, I can " + in.descriptionLower + ".")
            .rule("synthesize", mentions("synthesize", "conclusion"),
                    in -> "I " + in.descriptionLower + " by combining insights from all previous steps.")
            .build();

    private StepPhrases() {}

    /**
     * @param previous reasoning of the step just before, or null
     * @param knowledge snippet of step knowledge, or null
     */
    static String compose(String query, String description, String previous, String knowledge,
                          int previousChars, int knowledgeChars) {
        Input in = new Input(query, description);
        StringBuilder sb = new StringBuilder(PHRASES.evaluate(in)
                .orElseGet(() -> "This step involves " + in.descriptionLower + " to progress toward the answer."));
        if (previous != null && !previous.isBlank()) {
            sb.append(" Building on: ").append(Texts.truncate(previous.trim(), previousChars));
        }
        if (knowledge != null && !knowledge.isBlank()) {
            sb.append(" Knowledge: ").append(Texts.truncate(knowledge.trim(), knowledgeChars));
        }
        return sb.toString();
    }
}
