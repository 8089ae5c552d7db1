package io.flowforge.formula.core.value;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import java.math.BigDecimal;
import java.util.Iterator;
import java.util.Map;

/**
 * Value helpers shared by the parser, evaluator and built-in functions.
 *
 * <p>All formula numbers are IEEE-754 doubles. Integral results are normalised to {@link IntNode}
 * or {@link LongNode} so that {@code 2 + 3} serialises as {@code 5}, not {@code 5.0}.
 *
 * <p>Thread-safe: stateless utility class.
 */
public final class Values {

    /** Largest integer a double represents exactly. */
    private static final double MAX_SAFE_INTEGER = 9_007_199_254_740_991d;

    private Values() {}

    public static JsonNode number(double value) {
        if (value == Math.rint(value) && Math.abs(value) <= MAX_SAFE_INTEGER) {
            long whole = (long) value;
            if (whole >= Integer.MIN_VALUE && whole <= Integer.MAX_VALUE) {
                return IntNode.valueOf((int) whole);
            }
            return LongNode.valueOf(whole);
        }
        return DoubleNode.valueOf(value);
    }

    /** Converts numeric literal text ({@code 42}, {@code .5}, {@code 2.5E-3}) into a number node. */
    public static JsonNode numberLiteral(String text) {
        return number(Double.parseDouble(text));
    }

    public static JsonNode text(String value) {
        return value == null ? NullNode.getInstance() : TextNode.valueOf(value);
    }

    public static JsonNode bool(boolean value) {
        return BooleanNode.valueOf(value);
    }

    public static JsonNode nullValue() {
        return NullNode.getInstance();
    }

    public static boolean isNull(JsonNode value) {
        return value == null || value.isNull() || value.isMissingNode();
    }

    /**
     * Formula truthiness.
     *
     * <ul>
     * <li>{@code null}, missing → falsy</li>
     * <li>{@code false} → falsy</li>
     * <li>{@code 0} and {@code NaN} → falsy</li>
     * <li>{@code ""} → falsy</li>
     * <li>any other value, including empty arrays and objects → truthy</li>
     * </ul>
     */
    public static boolean isTruthy(JsonNode value) {
        if (isNull(value)) {
            return false;
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        if (value.isNumber()) {
            double d = value.doubleValue();
            return d != 0 && !Double.isNaN(d);
        }
        if (value.isTextual()) {
            return !value.textValue().isEmpty();
        }
        return true;
    }

    /**
     * Text conversion used by {@code &}, {@code CONCAT} and {@code STRING}: null becomes the
     * empty string, numbers print without a trailing {@code .0}, arrays and objects print as JSON.
     */
    public static String toText(JsonNode value) {
        if (isNull(value)) {
            return "";
        }
        if (value.isTextual()) {
            return value.textValue();
        }
        if (value.isNumber()) {
            return formatNumber(value.doubleValue());
        }
        if (value.isBoolean()) {
            return Boolean.toString(value.booleanValue());
        }
        return value.toString();
    }

    public static String formatNumber(double d) {
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            return Double.toString(d);
        }
        if (d == Math.rint(d) && Math.abs(d) < 1e21) {
            return BigDecimal.valueOf(d).toBigInteger().toString();
        }
        return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
    }

    /**
     * Strict equality: both operands must be of the same kind. Numbers compare numerically, so
     * {@code 1 == 1.0}, while {@code 1 == "1"} is false. Arrays and objects compare structurally.
     */
    public static boolean strictEquals(JsonNode a, JsonNode b) {
        ValueType ta = ValueType.of(a);
        ValueType tb = ValueType.of(b);
        if (ta != tb) {
            return false;
        }
        return switch (ta) {
            case NULL -> true;
            case NUMBER -> a.doubleValue() == b.doubleValue();
            case STRING -> a.textValue().equals(b.textValue());
            case BOOLEAN -> a.booleanValue() == b.booleanValue();
            case ARRAY -> arraysEqual(a, b);
            case OBJECT -> objectsEqual(a, b);
            default -> a.equals(b);
        };
    }

    private static boolean arraysEqual(JsonNode a, JsonNode b) {
        if (a.size() != b.size()) {
            return false;
        }
        for (int i = 0; i < a.size(); i++) {
            if (!strictEquals(a.get(i), b.get(i))) {
                return false;
            }
        }
        return true;
    }

    private static boolean objectsEqual(JsonNode a, JsonNode b) {
        if (a.size() != b.size()) {
            return false;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = a.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!b.has(field.getKey()) || !strictEquals(field.getValue(), b.get(field.getKey()))) {
                return false;
            }
        }
        return true;
    }

    /** Lower-case kind name for error messages. */
    public static String typeName(JsonNode value) {
        return ValueType.of(value).label();
    }
}
