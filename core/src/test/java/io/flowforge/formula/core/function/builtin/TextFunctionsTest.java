package io.flowforge.formula.core.function.builtin;

import static io.flowforge.formula.core.function.builtin.Formulas.assertEvaluates;
import static io.flowforge.formula.core.function.builtin.Formulas.error;
import static org.assertj.core.api.Assertions.assertThat;

import io.flowforge.formula.core.eval.EvaluationContext;
import io.flowforge.formula.core.eval.EvaluationError;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("Text functions")
class TextFunctionsTest {

    @Nested
    @DisplayName("Case, trimming and joining")
    class Basics {

        @ParameterizedTest(name = "{0} = {1}")
        @CsvSource(
                delimiter = '|',
                quoteCharacter = '`',
                value = {
                    "CONCAT('a', 1, true, null)            | \"a1true\"",
                    "CONCAT()                              | \"\"",
                    "CONCATENATE('x', [1, 2])              | \"x[1,2]\"",
                    "UPPER('straße')                       | \"STRASSE\"",
                    "LOWER('ÀB')                           | \"àb\"",
                    "TRIM(' \\t hi \\n ')                 | \"hi\"",
                    "PROPER('hello WORLD of café')         | \"Hello World Of Café\"",
                    "JOIN(['a', 1, null], '-')             | \"a-1-\"",
                    "JOIN(['a', 'b'])                      | \"a,b\"",
                    "UPPER(missing)                        | \"\"",
                })
        void computes(String source, String expected) {
            assertEvaluates(source, expected);
        }
    }

    @Nested
    @DisplayName("Slicing and searching")
    class Slicing {

        @ParameterizedTest(name = "{0} = {1}")
        @CsvSource(
                delimiter = '|',
                quoteCharacter = '`',
                value = {
                    "LEFT('Hello', 2)                      | \"He\"",
                    "LEFT('Hi', 10)                        | \"Hi\"",
                    "RIGHT('Hello', 3)                     | \"llo\"",
                    "RIGHT('Hello', 0)                     | \"\"",
                    "MID('Hello World', 7, 5)              | \"World\"",
                    "MID('Hello', 4, 100)                  | \"lo\"",
                    "MID('Hello', 10, 2)                   | \"\"",
                    "LEN('Hello')                          | 5",
                    "LEN('')                               | 0",
                    "LEN('a🎉b')                           | 3",
                    "LEFT('🎉🎉x', 2)                      | \"🎉🎉\"",
                    "FIND('World', 'Hello World')          | 7",
                    "FIND('l', 'Hello')                    | 3",
                    "FIND('l', 'Hello', 4)                 | 4",
                    "FIND('x', 'Hello')                    | 0",
                    "FIND('b', '🎉ab')                     | 3",
                    "FIND('', 'abc')                       | 1",
                })
        void computes(String source, String expected) {
            assertEvaluates(source, expected);
        }

        @Test
        @DisplayName("Negative counts and start positions are rejected")
        void negativeArguments() {
            assertThat(error("LEFT('abc', -1)").message()).isEqualTo("LEFT: argument 2 must not be negative");
            assertThat(error("MID('abc', 0, 1)").message()).isEqualTo("MID: argument 2 must be at least 1");
            assertThat(error("FIND('a', 'abc', 5)").message()).isEqualTo("FIND: argument 3 must be between 1 and 4");
        }

        @Test
        @DisplayName("Non-text argument is a type error positioned at the argument")
        void typeError() {
            EvaluationError error = error("UPPER(42)");

            assertThat(error.message()).isEqualTo("UPPER: argument 1 ('text') expected string but got number");
            assertThat(error.position()).isEqualTo(6);
        }
    }

    @Nested
    @DisplayName("Replace and split")
    class ReplaceAndSplit {

        @ParameterizedTest(name = "{0} = {1}")
        @CsvSource(
                delimiter = '|',
                quoteCharacter = '`',
                value = {
                    "REPLACE('a-b-c', '-', '/')            | \"a/b/c\"",
                    "REPLACE('a.b', '.', '')               | \"ab\"",
                    "REPLACE('$1 $1', '$1', 'x')           | \"x x\"",
                    "SPLIT('a,b,,c', ',')                  | [\"a\", \"b\", \"\", \"c\"]",
                    "SPLIT('a.b', '.')                     | [\"a\", \"b\"]",
                    "SPLIT('ab🎉', '')                     | [\"a\", \"b\", \"🎉\"]",
                    "SPLIT('', ',')                        | [\"\"]",
                })
        void computes(String source, String expected) {
            assertEvaluates(source, expected);
        }

        @Test
        @DisplayName("Empty search text is rejected")
        void emptySearch() {
            assertThat(error("REPLACE('abc', '', 'x')").message()).isEqualTo("REPLACE: argument 2 must not be empty");
        }
    }

    @Nested
    @DisplayName("TEXT formatting")
    class Format {

        @ParameterizedTest(name = "{0} = {1}")
        @CsvSource(
                delimiter = '|',
                quoteCharacter = '`',
                value = {
                    "TEXT(1234.5, '#,##0.00')                       | \"1,234.50\"",
                    "TEXT(0.125, '0.00')                            | \"0.13\"",
                    "TEXT(42, '000')                                | \"042\"",
                    "TEXT('2024-01-15', 'DD/MM/YYYY')               | \"15/01/2024\"",
                    "TEXT('2024-01-15T09:05:30Z', 'YYYY-MM-DD HH:mm:ss') | \"2024-01-15 09:05:30\"",
                    "TEXT('not a date', 'YYYY')                     | \"not a date\"",
                    "TEXT(true, 'x')                                | \"true\"",
                })
        void computes(String source, String expected) {
            assertEvaluates(source, expected);
        }

        @Test
        @DisplayName("Field values format the same as literals")
        void fromField() {
            EvaluationContext ctx = EvaluationContext.builder().field("amount", 9876.543).build();

            assertEvaluates("TEXT(amount, '#,##0.0')", "\"9,876.5\"", ctx);
        }
    }
}
