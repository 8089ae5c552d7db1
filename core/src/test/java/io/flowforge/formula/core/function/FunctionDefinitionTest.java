package io.flowforge.formula.core.function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import io.flowforge.formula.core.error.FormulaEvalException;
import io.flowforge.formula.core.eval.EvaluationContext;
import io.flowforge.formula.core.value.ValueType;
import io.flowforge.formula.core.value.Values;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("FunctionDefinition")
class FunctionDefinitionTest {

    private static FunctionDefinition.Builder sample(String name) {
        return FunctionDefinition.builder(name, FunctionCategory.TEXT)
                .example(name + "()", "null")
                .implementation(args -> Values.nullValue());
    }

    @Nested
    @DisplayName("Signature rules")
    class SignatureRules {

        @Test
        @DisplayName("Builder upper-cases the name")
        void upperCasesName() {
            assertThat(sample("pad_left").build().name()).isEqualTo("PAD_LEFT");
        }

        @Test
        @DisplayName("Names must be identifier-like")
        void invalidName() {
            assertThatThrownBy(() -> new FunctionDefinition(
                            "bad name", FunctionCategory.TEXT, "", List.of(), ValueType.ANY,
                            List.of(new FunctionExample("x", "y")), args -> Values.nullValue()))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("upper-case");
        }

        @Test
        @DisplayName("At least one example is required")
        void exampleRequired() {
            assertThatThrownBy(() -> FunctionDefinition.builder("NOEX", FunctionCategory.TEXT)
                            .implementation(args -> Values.nullValue())
                            .build())
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("function NOEX must document at least one example");
        }

        @Test
        @DisplayName("Required parameters cannot follow optional ones")
        void requiredAfterOptional() {
            assertThatThrownBy(() -> sample("ORDER")
                            .optional("a", ValueType.ANY, "")
                            .param("b", ValueType.ANY, "")
                            .build())
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("required parameter 'b' follows an optional parameter");
        }

        @Test
        @DisplayName("Variadic parameter must be last")
        void variadicLast() {
            assertThatThrownBy(() -> sample("VAR")
                            .variadic("rest", ValueType.ANY, "")
                            .optional("tail", ValueType.ANY, "")
                            .build())
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("variadic parameter 'rest' must be the last parameter");
        }
    }

    @Nested
    @DisplayName("Arity")
    class Arity {

        private final FunctionDefinition fixed = sample("FIXED")
                .param("a", ValueType.NUMBER, "")
                .optional("b", ValueType.NUMBER, "")
                .build();
        private final FunctionDefinition variadic = sample("MANY")
                .param("first", ValueType.STRING, "")
                .variadic("rest", ValueType.NUMBER, "")
                .build();

        @Test
        @DisplayName("Min and max arity follow required, optional and variadic parameters")
        void bounds() {
            assertThat(fixed.minArity()).isEqualTo(1);
            assertThat(fixed.maxArity()).isEqualTo(2);
            assertThat(variadic.minArity()).isEqualTo(2);
            assertThat(variadic.maxArity()).isEqualTo(Integer.MAX_VALUE);
            assertThat(variadic.isVariadic()).isTrue();
        }

        @Test
        @DisplayName("Arity messages use singular and plural correctly")
        void messages() {
            assertThat(fixed.arityProblem(0)).isEqualTo("FIXED expects at least 1 argument but got 0");
            assertThat(fixed.arityProblem(3)).isEqualTo("FIXED expects at most 2 arguments but got 3");
            assertThat(fixed.arityProblem(2)).isNull();
            assertThat(variadic.arityProblem(1)).isEqualTo("MANY expects at least 2 arguments but got 1");
            assertThat(variadic.arityProblem(40)).isNull();
        }

        @Test
        @DisplayName("Signature renders optional and variadic parameters")
        void signature() {
            assertThat(fixed.signature()).isEqualTo("FIXED(a, [b])");
            assertThat(variadic.signature()).isEqualTo("MANY(first, rest...)");
            assertThat(sample("NONE").build().signature()).isEqualTo("NONE()");
        }

        @Test
        @DisplayName("Variadic arguments are checked against the last parameter")
        void parameterAt() {
            assertThat(variadic.parameterAt(0).name()).isEqualTo("first");
            assertThat(variadic.parameterAt(7).name()).isEqualTo("rest");
        }
    }

    @Nested
    @DisplayName("Invocation")
    class Invocation {

        private final FunctionDefinition twice = FunctionDefinition.builder("TWICE", FunctionCategory.MATH)
                .param("n", ValueType.NUMBER, "")
                .optional("label", ValueType.STRING, "")
                .example("TWICE(2)", "4")
                .implementation(args -> Values.number(args.number(0) * 2))
                .build();

        private JsonNode invoke(FunctionDefinition fn, JsonNode... args) {
            return fn.invoke(List.of(args), EvaluationContext.empty());
        }

        @Test
        @DisplayName("Valid call runs the implementation")
        void runs() {
            assertThat(invoke(twice, Values.number(21)).intValue()).isEqualTo(42);
        }

        @Test
        @DisplayName("Type mismatch names the argument, the parameter and both types")
        void typeMismatch() {
            assertThatThrownBy(() -> invoke(twice, Values.text("x")))
                    .isInstanceOf(FormulaEvalException.class)
                    .hasMessage("TWICE: argument 1 ('n') expected number but got string")
                    .satisfies(e -> {
                        FormulaEvalException fe = (FormulaEvalException) e;
                        assertThat(fe.position()).isEqualTo(-1);
                        assertThat(fe.functionName()).isEqualTo("TWICE");
                        assertThat(fe.argumentIndex()).isZero();
                    });
        }

        @Test
        @DisplayName("Null is accepted for optional parameters but not for required numbers")
        void nullHandling() {
            assertThat(invoke(twice, Values.number(1), Values.nullValue()).intValue()).isEqualTo(2);
            assertThatThrownBy(() -> invoke(twice, Values.nullValue()))
                    .isInstanceOf(FormulaEvalException.class)
                    .hasMessageContaining("expected number but got null");
        }

        @Test
        @DisplayName("Implementation returning Java null yields JSON null")
        void javaNull() {
            FunctionDefinition nothing = sample("NOTHING").implementation(args -> null).build();

            assertThat(invoke(nothing).isNull()).isTrue();
        }

        @Test
        @DisplayName("Arity is re-checked on direct invocation")
        void directArity() {
            assertThatThrownBy(() -> invoke(twice))
                    .isInstanceOf(FormulaEvalException.class)
                    .hasMessage("TWICE expects at least 1 argument but got 0");
        }
    }
}
