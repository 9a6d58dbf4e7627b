package org.calista.arasaka.reasoning.analysis;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A simple arithmetic expression found inside a query ("What is 5 + 3?").
 *
 * <p>Supported: decimal numbers, + - * / x × ÷ ^ and parentheses. Evaluation is a small recursive
 * descent parser over {@link BigDecimal}; anything it cannot parse yields no result.</p>
 */
public final class ArithmeticExpression {

    // candidate run: digits, operators, dots, parens and spaces; must contain number-operator-number
    private static final Pattern RUN = Pattern.compile("[\\d.()+\\-*/×÷^x\\s]+");
    private static final Pattern HAS_BINARY = Pattern.compile("\\d(?:\\.\\d+)?\\s*\\)?\\s*[+\\-*/×÷^x]\\s*\\(?\\s*[-+]?\\d");
    private static final Pattern NUMBER = Pattern.compile("\\d+(?:\\.\\d+)?");
    private static final Pattern OPERATOR = Pattern.compile("(?<=[\\d)\\s])[+\\-*/×÷^x](?=[\\s(\\d\\-+])");

    private static final MathContext MC = MathContext.DECIMAL64;

    public final String expression;
    public final List<String> numbers;
    public final List<String> operators;

    private ArithmeticExpression(String expression, List<String> numbers, List<String> operators) {
        this.expression = expression;
        this.numbers = List.copyOf(numbers);
        this.operators = List.copyOf(operators);
    }

    /** First expression in the text that contains at least one binary operation and parses. */
    public static Optional<ArithmeticExpression> find(String text) {
        if (text == null || text.isBlank()) return Optional.empty();

        Matcher m = RUN.matcher(text);
        while (m.find()) {
            String run = trimRun(m.group());
            if (run.isEmpty() || !HAS_BINARY.matcher(run).find()) continue;
            // a stray 'x' glued to letters ("max 5") never reaches here because letters break the run
            if (evaluate(run).isEmpty()) continue;

            ArrayList<String> nums = new ArrayList<>();
            Matcher nm = NUMBER.matcher(run);
            while (nm.find()) nums.add(nm.group());

            ArrayList<String> ops = new ArrayList<>();
            Matcher om = OPERATOR.matcher(run);
            while (om.find()) ops.add(om.group());

            return Optional.of(new ArithmeticExpression(run, nums, ops));
        }
        return Optional.empty();
    }

    /** Evaluated value; empty on division by zero or unparsable input. */
    public Optional<BigDecimal> value() {
        return evaluate(expression);
    }

    /** Plain string of the value without trailing zeros ("8", "2.5"). */
    public Optional<String> formattedValue() {
        return value().map(ArithmeticExpression::format);
    }

    /** "5 + 3 = 8" or the bare expression when it cannot be evaluated. */
    public String describeCalculation() {
        Optional<String> v = formattedValue();
        return v.map(s -> expression + " = " + s).orElse(expression);
    }

    public static String format(BigDecimal v) {
        BigDecimal s = v.stripTrailingZeros();
        if (s.scale() > 10) s = s.setScale(10, RoundingMode.HALF_UP).stripTrailingZeros();
        return s.toPlainString();
    }

    public static Optional<BigDecimal> evaluate(String expr) {
        Objects.requireNonNull(expr, "expr");
        try {
            Parser p = new Parser(expr);
            BigDecimal v = p.parseExpression();
            p.skipSpaces();
            if (!p.atEnd()) return Optional.empty();
            return Optional.of(v);
        } catch (ArithmeticException | NumberFormatException | IllegalStateException e) {
            return Optional.empty();
        }
    }

    private static String trimRun(String run) {
        String s = run.trim();
        // drop dangling operators/dots at the edges ("5 + 3 ." / "- 2")
        while (!s.isEmpty() && "+-*/×÷^x.".indexOf(s.charAt(s.length() - 1)) >= 0) {
            s = s.substring(0, s.length() - 1).trim();
        }
        while (!s.isEmpty() && "*/×÷^x.)".indexOf(s.charAt(0)) >= 0) {
            s = s.substring(1).trim();
        }
        return s;
    }

    @Override
    public String toString() {
        return "ArithmeticExpression{" + expression + "}";
    }

    // -----------------------------------------------------------------------------------------
    // recursive descent: expr := term (('+'|'-') term)* ; term := factor (('*'|'/') factor)* ;
    // factor := unary ('^' factor)? ; unary := ('-'|'+')? primary ; primary := number | '(' expr ')'
    // -----------------------------------------------------------------------------------------

    private static final class Parser {
        private final String s;
        private int pos;

        Parser(String s) {
            this.s = s;
        }

        BigDecimal parseExpression() {
            BigDecimal v = parseTerm();
            while (true) {
                skipSpaces();
                if (eat('+')) v = v.add(parseTerm(), MC);
                else if (eat('-')) v = v.subtract(parseTerm(), MC);
                else return v;
            }
        }

        BigDecimal parseTerm() {
            BigDecimal v = parseFactor();
            while (true) {
                skipSpaces();
                if (eat('*') || eat('x') || eat('×')) {
                    v = v.multiply(parseFactor(), MC);
                } else if (eat('/') || eat('÷')) {
                    BigDecimal d = parseFactor();
                    if (d.signum() == 0) throw new ArithmeticException("division by zero");
                    v = v.divide(d, MC);
                } else {
                    return v;
                }
            }
        }

        BigDecimal parseFactor() {
            BigDecimal base = parseUnary();
            skipSpaces();
            if (eat('^')) {
                BigDecimal exp = parseFactor();
                return power(base, exp);
            }
            return base;
        }

        BigDecimal parseUnary() {
            skipSpaces();
            if (eat('-')) return parseUnary().negate();
            if (eat('+')) return parseUnary();
            return parsePrimary();
        }

        BigDecimal parsePrimary() {
            skipSpaces();
            if (eat('(')) {
                BigDecimal v = parseExpression();
                skipSpaces();
                if (!eat(')')) throw new IllegalStateException("missing ')' at " + pos);
                return v;
            }
            int start = pos;
            while (pos < s.length() && (Character.isDigit(s.charAt(pos)) || s.charAt(pos) == '.')) pos++;
            if (start == pos) throw new IllegalStateException("number expected at " + pos);
            return new BigDecimal(s.substring(start, pos));
        }

        private static BigDecimal power(BigDecimal base, BigDecimal exp) {
            BigDecimal e = exp.stripTrailingZeros();
            if (e.scale() <= 0 && e.abs().compareTo(BigDecimal.valueOf(999)) <= 0) {
                int n = e.intValueExact();
                if (n >= 0) return base.pow(n, MC);
                if (base.signum() == 0) throw new ArithmeticException("division by zero");
                return BigDecimal.ONE.divide(base.pow(-n, MC), MC);
            }
            double d = Math.pow(base.doubleValue(), exp.doubleValue());
            if (Double.isNaN(d) || Double.isInfinite(d)) throw new ArithmeticException("power out of range");
            return new BigDecimal(d, MC);
        }

        void skipSpaces() {
            while (pos < s.length() && Character.isWhitespace(s.charAt(pos))) pos++;
        }

        boolean eat(char c) {
            if (pos < s.length() && s.charAt(pos) == c) {
                pos++;
                return true;
            }
            return false;
        }

        boolean atEnd() {
            return pos >= s.length();
        }
    }
}
