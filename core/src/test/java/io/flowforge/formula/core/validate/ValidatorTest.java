package io.flowforge.formula.core.validate;

import static org.assertj.core.api.Assertions.assertThat;

import io.flowforge.formula.core.function.FunctionRegistry;
import io.flowforge.formula.core.parser.Parser;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Validator")
class ValidatorTest {

    private final Validator validator = new Validator(new Parser(), FunctionRegistry.standard());

    @Nested
    @DisplayName("Syntax")
    class Syntax {

        @Test
        @DisplayName("Valid formula → no errors, references collected")
        void valid() {
            ValidationResult result = validator.validate("ROUND(price * quantity, 2) + sum(items.total)");

            assertThat(result.valid()).isTrue();
            assertThat(result.errors()).isEmpty();
            assertThat(result.referencedFields()).containsExactly("price", "quantity", "items");
            assertThat(result.referencedFunctions()).containsExactly("ROUND", "SUM");
        }

        @Test
        @DisplayName("Parse failure → single SYNTAX error with a one-character span")
        void syntaxError() {
            ValidationResult result = validator.validate("1 + * 2");

            assertThat(result.valid()).isFalse();
            assertThat(result.errors()).singleElement().satisfies(e -> {
                assertThat(e.type()).isEqualTo(ValidationError.Type.SYNTAX);
                assertThat(e.message()).isEqualTo("Unexpected token '*'");
                assertThat(e.start()).isEqualTo(4);
                assertThat(e.end()).isEqualTo(5);
            });
            assertThat(result.referencedFields()).isEmpty();
        }

        @Test
        @DisplayName("Lexical errors are reported as SYNTAX too")
        void lexError() {
            assertThat(validator.validate("'open").errors())
                    .extracting(ValidationError::type)
                    .containsExactly(ValidationError.Type.SYNTAX);
        }

        @Test
        @DisplayName("Null and empty formulas are invalid")
        void emptyFormula() {
            assertThat(validator.validate(null).errors()).extracting(ValidationError::message).containsExactly("Empty formula");
            assertThat(validator.validate("").valid()).isFalse();
        }
    }

    @Nested
    @DisplayName("Functions")
    class Functions {

        @Test
        @DisplayName("Unknown function reported with its spelling and callee span")
        void unknownFunction() {
            ValidationResult result = validator.validate("1 + FOOBAR(2)");

            assertThat(result.errors()).singleElement().satisfies(e -> {
                assertThat(e.type()).isEqualTo(ValidationError.Type.UNKNOWN_FUNCTION);
                assertThat(e.message()).isEqualTo("Unknown function 'FOOBAR'");
                assertThat(e.start()).isEqualTo(4);
                assertThat(e.end()).isEqualTo(10);
            });
            assertThat(result.referencedFunctions()).containsExactly("FOOBAR");
        }

        @Test
        @DisplayName("Arity errors span the whole call")
        void arity() {
            ValidationResult result = validator.validate("UPPER('a', 'b')");

            assertThat(result.errors()).singleElement().satisfies(e -> {
                assertThat(e.type()).isEqualTo(ValidationError.Type.ARITY);
                assertThat(e.message()).isEqualTo("UPPER expects at most 1 argument but got 2");
                assertThat(e.start()).isZero();
                assertThat(e.end()).isEqualTo(15);
            });
        }

        @Test
        @DisplayName("Arguments of an unknown function are still checked")
        void nestedProblems() {
            ValidationResult result = validator.validate("NOPE(ROUND(), other)", Set.of());

            assertThat(result.errors())
                    .extracting(ValidationError::type)
                    .containsExactly(
                            ValidationError.Type.UNKNOWN_FUNCTION,
                            ValidationError.Type.ARITY,
                            ValidationError.Type.UNKNOWN_FIELD);
        }

        @Test
        @DisplayName("Validation does not evaluate: runtime errors are not reported")
        void noEvaluation() {
            assertThat(validator.validate("1 / 0 + SQRT(-1)").valid()).isTrue();
        }
    }

    @Nested
    @DisplayName("Fields")
    class Fields {

        @Test
        @DisplayName("Without a field list, field names are not checked")
        void noFieldList() {
            assertThat(validator.validate("anything.at.all + more").valid()).isTrue();
        }

        @Test
        @DisplayName("Unknown root field reported once, known ones pass")
        void unknownField() {
            ValidationResult result = validator.validate("price * qty + qty", Set.of("price", "quantity"));

            assertThat(result.errors()).singleElement().satisfies(e -> {
                assertThat(e.type()).isEqualTo(ValidationError.Type.UNKNOWN_FIELD);
                assertThat(e.message()).isEqualTo("Unknown field 'qty'");
                assertThat(e.start()).isEqualTo(8);
                assertThat(e.end()).isEqualTo(11);
            });
            assertThat(result.referencedFields()).containsExactly("price", "qty");
        }

        @Test
        @DisplayName("A known root covers any path below it")
        void knownRoot() {
            assertThat(validator.validate("order.customer.name", Set.of("order")).valid()).isTrue();
        }

        @Test
        @DisplayName("A dotted path may be declared instead of its root")
        void dottedPath() {
            assertThat(validator.validate("order.total - order.discount", Set.of("order.total", "order.discount"))
                            .valid())
                    .isTrue();
            ValidationResult result = validator.validate("order.tax", Set.of("order.total"));
            assertThat(result.errors()).extracting(ValidationError::message).containsExactly("Unknown field 'order.tax'");
            assertThat(result.errors().get(0).end()).isEqualTo(9);
        }

        @Test
        @DisplayName("Computed keys end the path and are validated themselves")
        void computedKeys() {
            ValidationResult result = validator.validate("rates[region].value", Set.of("rates"));

            assertThat(result.errors()).extracting(ValidationError::message).containsExactly("Unknown field 'region'");
            assertThat(result.referencedFields()).containsExactly("rates", "region");
        }

        @Test
        @DisplayName("Variables are never fields")
        void variables() {
            ValidationResult result = validator.validate("$today & $now.length", Set.of());

            assertThat(result.valid()).isTrue();
            assertThat(result.referencedFields()).isEmpty();
        }

        @Test
        @DisplayName("Literal containers and function names are not fields")
        void notFields() {
            ValidationResult result = validator.validate("{a: 1}.a + [SUM(1)][0]", Set.of());

            assertThat(result.valid()).isTrue();
            assertThat(result.referencedFields()).isEmpty();
        }
    }
}
