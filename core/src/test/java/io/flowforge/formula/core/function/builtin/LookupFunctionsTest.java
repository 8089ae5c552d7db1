package io.flowforge.formula.core.function.builtin;

import static io.flowforge.formula.core.function.builtin.Formulas.assertEvaluates;
import static io.flowforge.formula.core.function.builtin.Formulas.error;
import static io.flowforge.formula.core.function.builtin.Formulas.json;
import static io.flowforge.formula.core.function.builtin.Formulas.value;
import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.flowforge.formula.core.eval.EvaluationContext;
import io.flowforge.formula.core.eval.EvaluationError;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("Lookup functions")
class LookupFunctionsTest {

    @Nested
    @DisplayName("LOOKUP")
    class Lookup {

        private final EvaluationContext ctx = EvaluationContext.builder()
                .field("managerId", 2)
                .dataset("employees", List.of(
                        (ObjectNode) json("{\"id\": 1, \"name\": \"Alice\", \"dept\": \"Eng\"}"),
                        (ObjectNode) json("{\"id\": 2, \"name\": \"Bob\"}"),
                        (ObjectNode) json("{\"id\": 2, \"name\": \"Bobby\"}")))
                .build();

        @Test
        @DisplayName("Returns the requested field of the matching record")
        void finds() {
            assertThat(value("LOOKUP('employees', 'id', 1, 'name')", ctx).textValue()).isEqualTo("Alice");
        }

        @Test
        @DisplayName("First match wins; key may come from a field")
        void firstMatch() {
            assertThat(value("LOOKUP('employees', 'id', managerId, 'name')", ctx).textValue()).isEqualTo("Bob");
        }

        @ParameterizedTest(name = "{0} = null")
        @CsvSource(
                quoteCharacter = '`',
                value = {
                    "`LOOKUP('employees', 'id', 99, 'name')`",
                    "`LOOKUP('employees', 'id', '1', 'name')`",
                    "`LOOKUP('employees', 'id', 2, 'dept')`",
                })
        void nullWhenAbsent(String source) {
            assertEvaluates(source, "null", ctx);
        }

        @Test
        @DisplayName("Unknown dataset is an error on the first argument")
        void unknownDataset() {
            EvaluationError error = error("LOOKUP('staff', 'id', 1, 'name')", ctx);

            assertThat(error.message()).isEqualTo("LOOKUP: argument 1 dataset 'staff' not found");
            assertThat(error.argumentIndex()).isZero();
            assertThat(error.position()).isEqualTo(7);
        }
    }

    @Nested
    @DisplayName("VLOOKUP")
    class VLookup {

        @ParameterizedTest(name = "{0} = {1}")
        @CsvSource(
                delimiter = '|',
                quoteCharacter = '`',
                value = {
                    "VLOOKUP(2, [[1, 'one'], [2, 'two']], 2)                   | \"two\"",
                    "VLOOKUP(2, [[1, 'one'], [2, 'two']], 1)                   | 2",
                    "VLOOKUP(3, [[1, 'one'], [2, 'two']], 2)                   | null",
                    "VLOOKUP(2, [[1, 'one'], [2, 'two']], 5)                   | null",
                    "VLOOKUP('2', [[1, 'one'], [2, 'two']], 2)                 | null",
                    "VLOOKUP('2', [[1, 'one'], [2, 'two']], 2, false)          | \"two\"",
                    "VLOOKUP('B', [['a', 1], ['b', 2]], 2, false)              | 2",
                    "VLOOKUP(1, ['junk', [], [1, 'x']], 2)                     | \"x\"",
                })
        void computes(String source, String expected) {
            assertEvaluates(source, expected);
        }

        @Test
        @DisplayName("Column is 1-indexed")
        void columnFromOne() {
            assertThat(error("VLOOKUP(1, [[1]], 0)").message()).isEqualTo("VLOOKUP: argument 3 must be at least 1");
        }
    }
}
