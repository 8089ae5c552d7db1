package io.flowforge.formula.core.function;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import io.flowforge.formula.core.error.FormulaEvalException;
import io.flowforge.formula.core.value.Values;
import java.util.ArrayList;
import java.util.List;

/**
 * Evaluated arguments of one function call, with typed accessors. Accessors for required
 * parameters trust the arity and type check done by {@link FunctionDefinition#invoke}; the
 * {@code ...Or} accessors cover optional parameters, where an explicit {@code null} counts as
 * omitted.
 */
public final class Arguments {

    private final String functionName;
    private final List<JsonNode> values;
    private final FunctionContext context;

    Arguments(String functionName, List<JsonNode> values, FunctionContext context) {
        this.functionName = functionName;
        this.values = values;
        this.context = context;
    }

    public String functionName() {
        return functionName;
    }

    public int size() {
        return values.size();
    }

    /** The raw value at {@code index}; a JSON null if the argument was omitted. */
    public JsonNode get(int index) {
        return index < values.size() && values.get(index) != null ? values.get(index) : Values.nullValue();
    }

    /** {@code true} if an argument was supplied at {@code index} and is not null. */
    public boolean has(int index) {
        return !Values.isNull(get(index));
    }

    public List<JsonNode> all() {
        return values;
    }

    public double number(int index) {
        JsonNode value = get(index);
        if (!value.isNumber()) {
            throw fail(index, "expected a number but got " + Values.typeName(value));
        }
        return value.doubleValue();
    }

    /** Numeric argument that must be a whole number, e.g. a length or an index. */
    public int integer(int index) {
        double d = number(index);
        if (d != Math.rint(d) || Math.abs(d) > Integer.MAX_VALUE) {
            throw fail(index, "expected a whole number but got " + Values.formatNumber(d));
        }
        return (int) d;
    }

    public double numberOr(int index, double fallback) {
        return has(index) ? number(index) : fallback;
    }

    public int integerOr(int index, int fallback) {
        return has(index) ? integer(index) : fallback;
    }

    /** Text argument; a null (blank field) reads as the empty string. */
    public String text(int index) {
        JsonNode value = get(index);
        if (Values.isNull(value)) {
            return "";
        }
        if (!value.isTextual()) {
            throw fail(index, "expected a string but got " + Values.typeName(value));
        }
        return value.textValue();
    }

    public String textOr(int index, String fallback) {
        return has(index) ? text(index) : fallback;
    }

    public boolean bool(int index) {
        JsonNode value = get(index);
        if (!value.isBoolean()) {
            throw fail(index, "expected a boolean but got " + Values.typeName(value));
        }
        return value.booleanValue();
    }

    public boolean boolOr(int index, boolean fallback) {
        return has(index) ? bool(index) : fallback;
    }

    public ArrayNode array(int index) {
        JsonNode value = get(index);
        if (!value.isArray()) {
            throw fail(index, "expected an array but got " + Values.typeName(value));
        }
        return (ArrayNode) value;
    }

    /**
     * Values from {@code fromIndex} onwards with array arguments flattened one level, so that
     * {@code SUM(1, [2, 3])} and {@code SUM(items.price)} both see plain values.
     */
    public List<JsonNode> flattened(int fromIndex) {
        List<JsonNode> out = new ArrayList<>();
        for (int i = fromIndex; i < values.size(); i++) {
            JsonNode value = get(i);
            if (value.isArray()) {
                value.forEach(out::add);
            } else {
                out.add(value);
            }
        }
        return out;
    }

    /**
     * Numbers from {@code fromIndex} onwards, flattened like {@link #flattened(int)}. Nulls are
     * skipped so that blank form fields do not break aggregates; any other non-number fails.
     */
    public List<Double> numbers(int fromIndex) {
        List<Double> out = new ArrayList<>();
        for (int i = fromIndex; i < values.size(); i++) {
            JsonNode value = get(i);
            if (value.isArray()) {
                for (JsonNode element : value) {
                    addNumber(out, element, i);
                }
            } else {
                addNumber(out, value, i);
            }
        }
        return out;
    }

    private void addNumber(List<Double> out, JsonNode value, int index) {
        if (Values.isNull(value)) {
            return;
        }
        if (!value.isNumber()) {
            throw fail(index, "expected numbers but got " + Values.typeName(value));
        }
        out.add(value.doubleValue());
    }

    public FunctionContext context() {
        return context;
    }

    /** Creates a failure attributed to this call and the argument at {@code index}. */
    public FormulaEvalException fail(int index, String message) {
        return new FormulaEvalException(
                functionName + ": argument " + (index + 1) + " " + message, -1, functionName, index);
    }

    /** Creates a failure attributed to this call as a whole. */
    public FormulaEvalException fail(String message) {
        return new FormulaEvalException(functionName + ": " + message, -1, functionName, null);
    }
}
