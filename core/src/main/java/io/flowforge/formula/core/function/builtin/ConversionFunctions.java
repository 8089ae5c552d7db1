package io.flowforge.formula.core.function.builtin;

import static io.flowforge.formula.core.value.ValueType.ANY;
import static io.flowforge.formula.core.value.ValueType.BOOLEAN;
import static io.flowforge.formula.core.value.ValueType.NUMBER;
import static io.flowforge.formula.core.value.ValueType.STRING;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.flowforge.formula.core.function.Arguments;
import io.flowforge.formula.core.function.FunctionCategory;
import io.flowforge.formula.core.function.FunctionDefinition;
import io.flowforge.formula.core.value.Values;
import java.util.List;

/** Explicit conversions. Operators never coerce; these functions are the only way to. */
public final class ConversionFunctions {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ConversionFunctions() {}

    public static List<FunctionDefinition> definitions() {
        return List.of(
                FunctionDefinition.builder("NUMBER", FunctionCategory.CONVERSION)
                        .description("Converts numeric text or a boolean to a number; null stays null")
                        .param("value", ANY, "Value to convert")
                        .returns(NUMBER)
                        .example("NUMBER(\"42.5\")", "42.5")
                        .example("NUMBER(true)", "1")
                        .implementation(ConversionFunctions::toNumber)
                        .build(),
                FunctionDefinition.builder("STRING", FunctionCategory.CONVERSION)
                        .description("Converts a value to text; null becomes the empty string")
                        .param("value", ANY, "Value to convert")
                        .returns(STRING)
                        .example("STRING(42)", "\"42\"")
                        .implementation(args -> Values.text(Values.toText(args.get(0))))
                        .build(),
                FunctionDefinition.builder("BOOLEAN", FunctionCategory.CONVERSION)
                        .description("Converts a value to its truthiness")
                        .param("value", ANY, "Value to convert")
                        .returns(BOOLEAN)
                        .example("BOOLEAN(1)", "true")
                        .example("BOOLEAN(\"\")", "false")
                        .implementation(args -> Values.bool(Values.isTruthy(args.get(0))))
                        .build(),
                FunctionDefinition.builder("JSON_PARSE", FunctionCategory.CONVERSION)
                        .description("Parses JSON text into a value")
                        .param("text", STRING, "JSON text")
                        .returns(ANY)
                        .example("JSON_PARSE(\"{\\\"a\\\": 1}\")", "{\"a\": 1}")
                        .implementation(args -> {
                            try {
                                JsonNode parsed = MAPPER.readTree(args.text(0));
                                return parsed == null || parsed.isMissingNode() ? Values.nullValue() : parsed;
                            } catch (JsonProcessingException e) {
                                throw args.fail(0, "is not valid JSON: " + e.getOriginalMessage());
                            }
                        })
                        .build(),
                FunctionDefinition.builder("JSON_STRINGIFY", FunctionCategory.CONVERSION)
                        .description("Serialises a value as compact JSON text")
                        .param("value", ANY, "Value to serialise")
                        .returns(STRING)
                        .example("JSON_STRINGIFY([1, 2])", "\"[1,2]\"")
                        .implementation(args -> {
                            try {
                                return Values.text(MAPPER.writeValueAsString(args.get(0)));
                            } catch (JsonProcessingException e) {
                                throw args.fail(0, "cannot be serialised: " + e.getOriginalMessage());
                            }
                        })
                        .build());
    }

    private static JsonNode toNumber(Arguments args) {
        JsonNode value = args.get(0);
        if (Values.isNull(value) || value.isNumber()) {
            return value;
        }
        if (value.isBoolean()) {
            return Values.number(value.booleanValue() ? 1 : 0);
        }
        if (value.isTextual()) {
            String text = value.textValue().trim();
            try {
                double parsed = Double.parseDouble(text);
                if (Double.isFinite(parsed) && !text.isEmpty() && !text.endsWith("d") && !text.endsWith("f")
                        && !text.endsWith("D") && !text.endsWith("F")) {
                    return Values.number(parsed);
                }
            } catch (NumberFormatException ignored) {
                // fall through to the failure below
            }
            throw args.fail(0, "'" + value.textValue() + "' is not a number");
        }
        throw args.fail(0, "cannot convert " + Values.typeName(value) + " to a number");
    }
}
