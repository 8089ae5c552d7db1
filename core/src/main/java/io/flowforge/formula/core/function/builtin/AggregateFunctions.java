package io.flowforge.formula.core.function.builtin;

import static io.flowforge.formula.core.value.ValueType.ANY;
import static io.flowforge.formula.core.value.ValueType.ARRAY;
import static io.flowforge.formula.core.value.ValueType.NUMBER;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import io.flowforge.formula.core.function.FunctionCategory;
import io.flowforge.formula.core.function.FunctionDefinition;
import io.flowforge.formula.core.value.Values;
import java.util.List;

/** Counting and conditional aggregation over arrays. */
public final class AggregateFunctions {

    private AggregateFunctions() {}

    public static List<FunctionDefinition> definitions() {
        return List.of(
                FunctionDefinition.builder("COUNT", FunctionCategory.AGGREGATE)
                        .description("Counts non-null values; arrays are flattened")
                        .optionalVariadic("values", ANY, "Values or arrays to count")
                        .returns(NUMBER)
                        .example("COUNT(1, null, 3)", "2")
                        .example("COUNT(lineItems)", "Number of line items")
                        .implementation(args -> Values.number(args.flattened(0).stream()
                                .filter(v -> !Values.isNull(v))
                                .count()))
                        .build(),
                FunctionDefinition.builder("COUNTIF", FunctionCategory.AGGREGATE)
                        .description("Counts array elements strictly equal to a value")
                        .param("array", ARRAY, "Values to scan")
                        .param("value", ANY, "Value to count")
                        .returns(NUMBER)
                        .example("COUNTIF([\"a\", \"b\", \"a\"], \"a\")", "2")
                        .implementation(args -> {
                            JsonNode target = args.get(1);
                            int count = 0;
                            for (JsonNode element : args.array(0)) {
                                if (Values.strictEquals(element, target)) {
                                    count++;
                                }
                            }
                            return Values.number(count);
                        })
                        .build(),
                FunctionDefinition.builder("SUMIF", FunctionCategory.AGGREGATE)
                        .description("Sums values whose corresponding condition equals the match value")
                        .param("values", ARRAY, "Numbers to sum")
                        .param("conditions", ARRAY, "Condition values, aligned by index with values")
                        .param("match", ANY, "Condition value to select")
                        .returns(NUMBER)
                        .example("SUMIF([10, 20, 30], [\"x\", \"y\", \"x\"], \"x\")", "40")
                        .implementation(args -> {
                            ArrayNode values = args.array(0);
                            ArrayNode conditions = args.array(1);
                            JsonNode match = args.get(2);
                            double sum = 0;
                            for (int i = 0; i < values.size() && i < conditions.size(); i++) {
                                if (!Values.strictEquals(conditions.get(i), match)) {
                                    continue;
                                }
                                JsonNode value = values.get(i);
                                if (Values.isNull(value)) {
                                    continue;
                                }
                                if (!value.isNumber()) {
                                    throw args.fail(0, "element " + i + " is " + Values.typeName(value) + ", not a number");
                                }
                                sum += value.doubleValue();
                            }
                            return Values.number(sum);
                        })
                        .build());
    }
}
