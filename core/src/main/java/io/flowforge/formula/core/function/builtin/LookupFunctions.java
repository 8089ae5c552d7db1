package io.flowforge.formula.core.function.builtin;

import static io.flowforge.formula.core.value.ValueType.ANY;
import static io.flowforge.formula.core.value.ValueType.ARRAY;
import static io.flowforge.formula.core.value.ValueType.BOOLEAN;
import static io.flowforge.formula.core.value.ValueType.NUMBER;
import static io.flowforge.formula.core.value.ValueType.STRING;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.flowforge.formula.core.function.Arguments;
import io.flowforge.formula.core.function.FunctionCategory;
import io.flowforge.formula.core.function.FunctionDefinition;
import io.flowforge.formula.core.value.Values;
import java.util.List;
import java.util.Locale;

/**
 * Table lookups.
 *
 * <p>
 * {@code LOOKUP} is the only built-in that reads the evaluation context: it scans the named
 * dataset from {@code context.datasets}. Plain identifiers never resolve against datasets.
 */
public final class LookupFunctions {

    private LookupFunctions() {}

    public static List<FunctionDefinition> definitions() {
        return List.of(
                FunctionDefinition.builder("LOOKUP", FunctionCategory.LOOKUP)
                        .description("Reads context datasets: returns returnField of the first record whose keyField "
                                + "equals keyValue, or null")
                        .param("dataset", STRING, "Name of a dataset in the evaluation context")
                        .param("keyField", STRING, "Field to match on")
                        .param("keyValue", ANY, "Value to match")
                        .param("returnField", STRING, "Field to return from the matching record")
                        .returns(ANY)
                        .example("LOOKUP(\"employees\", \"id\", 1, \"name\")", "\"Alice\"")
                        .implementation(LookupFunctions::lookup)
                        .build(),
                FunctionDefinition.builder("VLOOKUP", FunctionCategory.LOOKUP)
                        .description("Finds the first row whose first column matches and returns a column (1-indexed)")
                        .param("value", ANY, "Value to find in the first column")
                        .param("table", ARRAY, "Array of rows, each an array")
                        .param("column", NUMBER, "Column to return, from 1")
                        .optional("exact", BOOLEAN, "Strict match (default true); false compares loosely")
                        .returns(ANY)
                        .example("VLOOKUP(2, [[1, \"one\"], [2, \"two\"]], 2)", "\"two\"")
                        .implementation(LookupFunctions::vlookup)
                        .build());
    }

    private static JsonNode lookup(Arguments args) {
        String dataset = args.text(0);
        String keyField = args.text(1);
        JsonNode keyValue = args.get(2);
        String returnField = args.text(3);
        List<ObjectNode> records = args.context()
                .dataset(dataset)
                .orElseThrow(() -> args.fail(0, "dataset '" + dataset + "' not found"));
        for (ObjectNode record : records) {
            if (Values.strictEquals(record.get(keyField), keyValue)) {
                JsonNode result = record.get(returnField);
                return result == null ? Values.nullValue() : result;
            }
        }
        return Values.nullValue();
    }

    private static JsonNode vlookup(Arguments args) {
        JsonNode value = args.get(0);
        int column = args.integer(2);
        if (column < 1) {
            throw args.fail(2, "must be at least 1");
        }
        boolean exact = args.boolOr(3, true);
        for (JsonNode row : args.array(1)) {
            if (!row.isArray() || row.isEmpty()) {
                continue;
            }
            JsonNode first = row.get(0);
            boolean matches = exact ? Values.strictEquals(first, value) : looselyEquals(first, value);
            if (matches) {
                return column <= row.size() ? row.get(column - 1) : Values.nullValue();
            }
        }
        return Values.nullValue();
    }

    /** Loose match: numbers and numeric text compare numerically, text compares case-insensitively. */
    private static boolean looselyEquals(JsonNode a, JsonNode b) {
        if (Values.strictEquals(a, b)) {
            return true;
        }
        if (Values.isNull(a) || Values.isNull(b)) {
            return false;
        }
        String left = Values.toText(a).trim();
        String right = Values.toText(b).trim();
        try {
            return Double.parseDouble(left) == Double.parseDouble(right);
        } catch (NumberFormatException notNumeric) {
            return left.toLowerCase(Locale.ROOT).equals(right.toLowerCase(Locale.ROOT));
        }
    }
}
