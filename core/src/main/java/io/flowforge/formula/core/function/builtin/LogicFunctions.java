package io.flowforge.formula.core.function.builtin;

import static io.flowforge.formula.core.value.ValueType.ANY;
import static io.flowforge.formula.core.value.ValueType.BOOLEAN;

import com.fasterxml.jackson.databind.JsonNode;
import io.flowforge.formula.core.function.FunctionCategory;
import io.flowforge.formula.core.function.FunctionDefinition;
import io.flowforge.formula.core.value.Values;
import java.util.List;

/**
 * Conditional and boolean built-ins. Conditions use formula truthiness: null, false, 0 and ""
 * are false. The evaluator evaluates only the selected branch of {@code IF} and {@code IFS}.
 */
public final class LogicFunctions {

    private LogicFunctions() {}

    public static List<FunctionDefinition> definitions() {
        return List.of(
                FunctionDefinition.builder("IF", FunctionCategory.LOGIC)
                        .description("Returns one value when the condition is truthy and another otherwise")
                        .param("condition", ANY, "Condition to test")
                        .param("then", ANY, "Value when truthy")
                        .optional("else", ANY, "Value when falsy (default null)")
                        .returns(ANY)
                        .example("IF(score >= 50, \"pass\", \"fail\")", "\"pass\"")
                        .implementation(args -> Values.isTruthy(args.get(0)) ? args.get(1) : args.get(2))
                        .build(),
                FunctionDefinition.builder("IFS", FunctionCategory.LOGIC)
                        .description("Returns the value paired with the first truthy condition, or null")
                        .variadic("pairs", ANY, "condition, value, condition, value, ...")
                        .returns(ANY)
                        .example("IFS(score >= 90, \"A\", score >= 80, \"B\", true, \"C\")", "\"B\"")
                        .implementation(args -> {
                            if (args.size() % 2 != 0) {
                                throw args.fail("expects condition/value pairs but got " + args.size() + " arguments");
                            }
                            for (int i = 0; i < args.size(); i += 2) {
                                if (Values.isTruthy(args.get(i))) {
                                    return args.get(i + 1);
                                }
                            }
                            return Values.nullValue();
                        })
                        .build(),
                FunctionDefinition.builder("SWITCH", FunctionCategory.LOGIC)
                        .description("Matches a value against cases; a trailing unpaired argument is the default")
                        .param("value", ANY, "Value to match")
                        .variadic("cases", ANY, "case, result, case, result, ..., [default]")
                        .returns(ANY)
                        .example("SWITCH(status, \"A\", \"Active\", \"I\", \"Inactive\", \"Unknown\")", "\"Active\"")
                        .implementation(args -> {
                            JsonNode value = args.get(0);
                            int cases = args.size() - 1;
                            for (int i = 1; i + 1 < args.size(); i += 2) {
                                if (Values.strictEquals(value, args.get(i))) {
                                    return args.get(i + 1);
                                }
                            }
                            return cases % 2 == 1 ? args.get(args.size() - 1) : Values.nullValue();
                        })
                        .build(),
                FunctionDefinition.builder("AND", FunctionCategory.LOGIC)
                        .description("Returns true if every argument is truthy")
                        .variadic("values", ANY, "Conditions")
                        .returns(BOOLEAN)
                        .example("AND(true, 1, \"x\")", "true")
                        .implementation(args -> Values.bool(args.all().stream().allMatch(Values::isTruthy)))
                        .build(),
                FunctionDefinition.builder("OR", FunctionCategory.LOGIC)
                        .description("Returns true if any argument is truthy")
                        .variadic("values", ANY, "Conditions")
                        .returns(BOOLEAN)
                        .example("OR(false, 0, \"x\")", "true")
                        .implementation(args -> Values.bool(args.all().stream().anyMatch(Values::isTruthy)))
                        .build(),
                FunctionDefinition.builder("NOT", FunctionCategory.LOGIC)
                        .description("Returns the boolean opposite of a value's truthiness")
                        .param("value", ANY, "Value to negate")
                        .returns(BOOLEAN)
                        .example("NOT(true)", "false")
                        .implementation(args -> Values.bool(!Values.isTruthy(args.get(0))))
                        .build(),
                FunctionDefinition.builder("ISBLANK", FunctionCategory.LOGIC)
                        .description("Returns true for null and the empty string")
                        .param("value", ANY, "Value to test")
                        .returns(BOOLEAN)
                        .example("ISBLANK(\"\")", "true")
                        .example("ISBLANK(0)", "false")
                        .implementation(args -> {
                            JsonNode value = args.get(0);
                            return Values.bool(Values.isNull(value) || (value.isTextual() && value.textValue().isEmpty()));
                        })
                        .build(),
                FunctionDefinition.builder("COALESCE", FunctionCategory.LOGIC)
                        .description("Returns the first argument that is not null")
                        .variadic("values", ANY, "Candidates in order of preference")
                        .returns(ANY)
                        .example("COALESCE(nickname, firstName, \"Guest\")", "\"Guest\"")
                        .implementation(args -> args.all().stream()
                                .filter(v -> !Values.isNull(v))
                                .findFirst()
                                .orElse(Values.nullValue()))
                        .build());
    }
}
