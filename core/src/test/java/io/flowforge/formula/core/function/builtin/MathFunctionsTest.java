package io.flowforge.formula.core.function.builtin;

import static io.flowforge.formula.core.function.builtin.Formulas.assertEvaluates;
import static io.flowforge.formula.core.function.builtin.Formulas.error;
import static io.flowforge.formula.core.function.builtin.Formulas.value;
import static org.assertj.core.api.Assertions.assertThat;

import io.flowforge.formula.core.eval.EvaluationError;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("Math functions")
class MathFunctionsTest {

    @ParameterizedTest(name = "{0} = {1}")
    @CsvSource(
            delimiter = '|',
            quoteCharacter = '`',
            value = {
                "SUM(1, 2, 3)                | 6",
                "SUM([1, 2], 3, [])          | 6",
                "SUM(1, null, 2)             | 3",
                "SUM([])                     | 0",
                "AVERAGE(1, 2, 3, 4)         | 2.5",
                "AVERAGE([])                 | 0",
                "MIN(5, [2, 8])              | 2",
                "MAX(5, [2, 8], -1)          | 8",
                "MIN([])                     | null",
                "ABS(-5.5)                   | 5.5",
                "ROUND(3.14159, 2)           | 3.14",
                "ROUND(2.5)                  | 3",
                "ROUND(-2.5)                 | -3",
                "ROUND(1234.5, -2)           | 1200",
                "ROUND(1.005, 2)             | 1.01",
                "FLOOR(-3.2)                 | -4",
                "CEIL(3.2)                   | 4",
                "POWER(2, 10)                | 1024",
                "POWER(4, 0.5)               | 2",
                "SQRT(16)                    | 4",
                "MOD(10, 3)                  | 1",
                "MOD(-10, 3)                 | -1",
            })
    void computes(String source, String expected) {
        assertEvaluates(source, expected);
    }

    @Test
    @DisplayName("Non-numeric elements inside aggregated arrays are rejected")
    void sumRejectsText() {
        EvaluationError error = error("SUM(1, ['a'])");

        assertThat(error.message()).isEqualTo("SUM: argument 2 expected numbers but got string");
        assertThat(error.argumentIndex()).isEqualTo(1);
        assertThat(error.position()).isEqualTo(7);
    }

    @Test
    @DisplayName("SUM requires at least one argument")
    void sumArity() {
        assertThat(error("SUM()").message()).isEqualTo("SUM expects at least 1 argument but got 0");
    }

    @Test
    @DisplayName("MOD by zero and SQRT of a negative are domain errors")
    void domainErrors() {
        assertThat(error("MOD(1, 0)").message()).isEqualTo("MOD: argument 2 division by zero");
        assertThat(error("SQRT(-1)").argumentIndex()).isZero();
    }

    @Test
    @DisplayName("POWER overflow is reported as a non-finite result")
    void powerOverflow() {
        assertThat(error("POWER(10, 400)").message()).isEqualTo("POWER produced a non-finite number");
    }

    @Test
    @DisplayName("ROUND digits must be a whole number")
    void roundDigits() {
        assertThat(error("ROUND(1, 1.5)").message()).isEqualTo("ROUND: argument 2 expected a whole number but got 1.5");
    }

    @Test
    @Timeout(5)
    @DisplayName("ROUND with an extreme digit count returns promptly")
    void roundExtremeDigits() {
        assertThat(value("ROUND(1.5, 2000000000)").doubleValue()).isEqualTo(1.5);
        assertThat(value("ROUND(1.5, 20000000)").doubleValue()).isEqualTo(1.5);
        assertThat(value("ROUND(123.4, -2000000000)").doubleValue()).isZero();
        assertThat(value("ROUND(1.23456, 340)").doubleValue()).isEqualTo(1.23456);
    }

    @RepeatedTest(20)
    @DisplayName("RANDOM stays within its bounds")
    void randomBounds() {
        double unit = value("RANDOM()").doubleValue();
        double ranged = value("RANDOM(5, 10)").doubleValue();

        assertThat(unit).isGreaterThanOrEqualTo(0).isLessThan(1);
        assertThat(ranged).isGreaterThanOrEqualTo(5).isLessThan(10);
    }

    @Test
    @DisplayName("RANDOM rejects an upper bound below the lower bound")
    void randomInvertedBounds() {
        assertThat(error("RANDOM(10, 1)").message()).isEqualTo("RANDOM: argument 2 must not be less than min");
    }
}
