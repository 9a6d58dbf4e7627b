package org.calista.arasaka.reasoning.analysis;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class ArithmeticExpressionTest {

    @Test
    void findsExpressionInsideText() {
        ArithmeticExpression e = ArithmeticExpression.find("Compute (2 + 3) * 4 please").orElseThrow();
        assertThat(e.expression).isEqualTo("(2 + 3) * 4");
        assertThat(e.formattedValue()).contains("20");
        assertThat(e.describeCalculation()).isEqualTo("(2 + 3) * 4 = 20");
    }

    @Test
    void precedenceAndPowers() {
        assertThat(ArithmeticExpression.evaluate("2 + 3 * 4")).contains(new BigDecimal("14"));
        assertThat(ArithmeticExpression.find("2 ^ 3").flatMap(ArithmeticExpression::formattedValue)).contains("8");
        assertThat(ArithmeticExpression.find("7 / 2").flatMap(ArithmeticExpression::formattedValue)).contains("3.5");
    }

    @Test
    void divisionByZeroHasNoValue() {
        assertThat(ArithmeticExpression.evaluate("10 / 0")).isEmpty();
        assertThat(ArithmeticExpression.find("10 / 0")).isEmpty();
    }

    @Test
    void textWithoutBinaryOperationIsIgnored() {
        assertThat(ArithmeticExpression.find("no math here")).isEmpty();
        assertThat(ArithmeticExpression.find("max 5")).isEmpty();
        assertThat(ArithmeticExpression.find("the year 2024")).isEmpty();
        assertThat(ArithmeticExpression.find(null)).isEmpty();
    }
}
