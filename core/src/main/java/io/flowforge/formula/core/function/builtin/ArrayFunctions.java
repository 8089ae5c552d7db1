package io.flowforge.formula.core.function.builtin;

import static io.flowforge.formula.core.value.ValueType.ANY;
import static io.flowforge.formula.core.value.ValueType.ARRAY;
import static io.flowforge.formula.core.value.ValueType.BOOLEAN;
import static io.flowforge.formula.core.value.ValueType.NUMBER;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.flowforge.formula.core.function.Arguments;
import io.flowforge.formula.core.function.FunctionCategory;
import io.flowforge.formula.core.function.FunctionDefinition;
import io.flowforge.formula.core.value.ValueType;
import io.flowforge.formula.core.value.Values;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/** Array built-ins. Indexes are 0-based; element comparison is strict equality. */
public final class ArrayFunctions {

    private ArrayFunctions() {}

    public static List<FunctionDefinition> definitions() {
        return List.of(
                FunctionDefinition.builder("FIRST", FunctionCategory.ARRAY)
                        .description("Returns the first element, or null for an empty array")
                        .param("array", ARRAY, "Source array")
                        .returns(ANY)
                        .example("FIRST([1, 2, 3])", "1")
                        .implementation(args -> element(args.array(0), 0))
                        .build(),
                FunctionDefinition.builder("LAST", FunctionCategory.ARRAY)
                        .description("Returns the last element, or null for an empty array")
                        .param("array", ARRAY, "Source array")
                        .returns(ANY)
                        .example("LAST([1, 2, 3])", "3")
                        .implementation(args -> {
                            ArrayNode array = args.array(0);
                            return element(array, array.size() - 1);
                        })
                        .build(),
                FunctionDefinition.builder("INDEX", FunctionCategory.ARRAY)
                        .description("Returns the element at a 0-based index, or null when out of range")
                        .param("array", ARRAY, "Source array")
                        .param("index", NUMBER, "0-based position")
                        .returns(ANY)
                        .example("INDEX([1, 2, 3], 1)", "2")
                        .implementation(args -> element(args.array(0), args.integer(1)))
                        .build(),
                FunctionDefinition.builder("LENGTH", FunctionCategory.ARRAY)
                        .description("Returns the number of elements")
                        .param("array", ARRAY, "Source array")
                        .returns(NUMBER)
                        .example("LENGTH([1, 2, 3])", "3")
                        .implementation(args -> Values.number(args.array(0).size()))
                        .build(),
                FunctionDefinition.builder("CONTAINS", FunctionCategory.ARRAY)
                        .description("Returns true if any element strictly equals the value")
                        .param("array", ARRAY, "Source array")
                        .param("value", ANY, "Value to look for")
                        .returns(BOOLEAN)
                        .example("CONTAINS([\"urgent\", \"vip\"], \"vip\")", "true")
                        .implementation(args -> {
                            JsonNode target = args.get(1);
                            for (JsonNode element : args.array(0)) {
                                if (Values.strictEquals(element, target)) {
                                    return Values.bool(true);
                                }
                            }
                            return Values.bool(false);
                        })
                        .build(),
                FunctionDefinition.builder("UNIQUE", FunctionCategory.ARRAY)
                        .description("Removes duplicates, keeping the first occurrence of each value")
                        .param("array", ARRAY, "Source array")
                        .returns(ARRAY)
                        .example("UNIQUE([1, 2, 2, 3, 3, 3])", "[1, 2, 3]")
                        .implementation(args -> {
                            List<JsonNode> kept = new ArrayList<>();
                            for (JsonNode element : args.array(0)) {
                                if (kept.stream().noneMatch(k -> Values.strictEquals(k, element))) {
                                    kept.add(element);
                                }
                            }
                            return array(kept);
                        })
                        .build(),
                FunctionDefinition.builder("SORT", FunctionCategory.ARRAY)
                        .description("Sorts numbers or strings ascending (or descending); nulls go last")
                        .param("array", ARRAY, "Numbers or strings")
                        .optional("descending", BOOLEAN, "Sort descending (default false)")
                        .returns(ARRAY)
                        .example("SORT([3, 1, 2])", "[1, 2, 3]")
                        .example("SORT([\"b\", \"a\"], true)", "[\"b\", \"a\"]")
                        .implementation(ArrayFunctions::sort)
                        .build(),
                FunctionDefinition.builder("FILTER", FunctionCategory.ARRAY)
                        .description("Keeps the elements strictly equal to a value")
                        .param("array", ARRAY, "Source array")
                        .param("value", ANY, "Value to keep")
                        .returns(ARRAY)
                        .example("FILTER([1, 2, 1], 1)", "[1, 1]")
                        .implementation(args -> {
                            JsonNode target = args.get(1);
                            List<JsonNode> kept = new ArrayList<>();
                            args.array(0).forEach(e -> {
                                if (Values.strictEquals(e, target)) {
                                    kept.add(e);
                                }
                            });
                            return array(kept);
                        })
                        .build());
    }

    private static JsonNode sort(Arguments args) {
        ArrayNode source = args.array(0);
        boolean descending = args.boolOr(1, false);
        List<JsonNode> present = new ArrayList<>();
        List<JsonNode> nulls = new ArrayList<>();
        ValueType kind = null;
        for (JsonNode element : source) {
            if (Values.isNull(element)) {
                nulls.add(element);
                continue;
            }
            ValueType type = ValueType.of(element);
            if (type != ValueType.NUMBER && type != ValueType.STRING) {
                throw args.fail(0, "can only sort numbers or strings, found " + type.label());
            }
            if (kind != null && kind != type) {
                throw args.fail(0, "cannot sort a mix of " + kind.label() + " and " + type.label());
            }
            kind = type;
            present.add(element);
        }
        Comparator<JsonNode> order = kind == ValueType.STRING
                ? Comparator.comparing(JsonNode::textValue)
                : Comparator.comparingDouble(JsonNode::doubleValue);
        present.sort(descending ? order.reversed() : order);
        present.addAll(nulls);
        return array(present);
    }

    private static JsonNode element(ArrayNode array, int index) {
        return index >= 0 && index < array.size() ? array.get(index) : Values.nullValue();
    }

    private static ArrayNode array(List<JsonNode> elements) {
        ArrayNode out = JsonNodeFactory.instance.arrayNode(elements.size());
        elements.forEach(out::add);
        return out;
    }
}
