package org.calista.arasaka.reasoning.analysis;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Ordered list of (predicate, handler) rules. Rules are evaluated in insertion order and the
 * first rule whose predicate accepts the input produces the result; later rules are not consulted.
 *
 * <p>Precedence is therefore the list order and nothing else. {@link #names()} exposes it for tests
 * and logs.</p>
 */
public final class FirstMatch<I, R> {

    private final List<Rule<I, R>> rules;

    private FirstMatch(List<Rule<I, R>> rules) {
        this.rules = List.copyOf(rules);
    }

    public static <I, R> Builder<I, R> builder() {
        return new Builder<>();
    }

    public Optional<R> evaluate(I input) {
        for (Rule<I, R> r : rules) {
            if (r.predicate.test(input)) return Optional.ofNullable(r.handler.apply(input));
        }
        return Optional.empty();
    }

    /** Name of the first matching rule, for diagnostics. */
    public Optional<String> firstMatchingRule(I input) {
        for (Rule<I, R> r : rules) {
            if (r.predicate.test(input)) return Optional.of(r.name);
        }
        return Optional.empty();
    }

    public List<String> names() {
        ArrayList<String> out = new ArrayList<>(rules.size());
        for (Rule<I, R> r : rules) out.add(r.name);
        return out;
    }

    public int size() {
        return rules.size();
    }

    public static final class Rule<I, R> {
        public final String name;
        final Predicate<I> predicate;
        final Function<I, R> handler;

        Rule(String name, Predicate<I> predicate, Function<I, R> handler) {
            this.name = Objects.requireNonNull(name, "name");
            this.predicate = Objects.requireNonNull(predicate, "predicate");
            this.handler = Objects.requireNonNull(handler, "handler");
        }
    }

    public static final class Builder<I, R> {
        private final List<Rule<I, R>> rules = new ArrayList<>();

        public Builder<I, R> rule(String name, Predicate<I> predicate, Function<I, R> handler) {
            rules.add(new Rule<>(name, predicate, handler));
            return this;
        }

        /** Constant-result rule. */
        public Builder<I, R> rule(String name, Predicate<I> predicate, R result) {
            return rule(name, predicate, in -> result);
        }

        public FirstMatch<I, R> build() {
            return new FirstMatch<>(rules);
        }
    }
}
