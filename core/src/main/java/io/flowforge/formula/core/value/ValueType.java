package io.flowforge.formula.core.value;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Runtime value kinds. {@link #DATE} and {@link #ANY} appear only in function signatures: a date
 * is carried as an ISO-8601 string (or epoch milliseconds) and {@code ANY} accepts every value.
 */
public enum ValueType {
    NUMBER,
    STRING,
    BOOLEAN,
    DATE,
    ARRAY,
    OBJECT,
    NULL,
    ANY;

    /** Classifies a runtime value. Never returns {@code DATE} or {@code ANY}. */
    public static ValueType of(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return NULL;
        }
        if (value.isNumber()) {
            return NUMBER;
        }
        if (value.isTextual()) {
            return STRING;
        }
        if (value.isBoolean()) {
            return BOOLEAN;
        }
        if (value.isArray()) {
            return ARRAY;
        }
        if (value.isObject()) {
            return OBJECT;
        }
        // binary and POJO nodes never come out of the engine
        return STRING;
    }

    /** Returns {@code true} if a value of this declared type may hold {@code value}. */
    public boolean accepts(JsonNode value) {
        ValueType actual = of(value);
        return switch (this) {
            case ANY -> true;
            case DATE -> actual == STRING || actual == NUMBER;
            default -> actual == this;
        };
    }

    /** Lower-case name used in messages and JSON output. */
    public String label() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }
}
