package io.flowforge.formula.core.eval;

import com.fasterxml.jackson.databind.JsonNode;
import io.flowforge.formula.core.value.ValueType;
import java.util.Objects;

/**
 * Outcome of evaluating a formula: a value with its runtime type, or an {@link EvaluationError}.
 * A successful evaluation may well produce JSON null.
 */
public final class EvaluationResult {

    private final JsonNode value;
    private final EvaluationError error;

    private EvaluationResult(JsonNode value, EvaluationError error) {
        this.value = value;
        this.error = error;
    }

    public static EvaluationResult success(JsonNode value) {
        Objects.requireNonNull(value, "value must not be null for success, use NullNode");
        return new EvaluationResult(value, null);
    }

    public static EvaluationResult failure(EvaluationError error) {
        Objects.requireNonNull(error, "error must not be null for failure");
        return new EvaluationResult(null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    /** The computed value. Only valid when {@link #isSuccess()}. */
    public JsonNode value() {
        return value;
    }

    /** Runtime type of the value, or {@code null} on failure. */
    public ValueType type() {
        return isSuccess() ? ValueType.of(value) : null;
    }

    /** The failure. Only valid when not {@link #isSuccess()}. */
    public EvaluationError error() {
        return error;
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "EvaluationResult[SUCCESS, value=" + value + "]"
                : "EvaluationResult[" + error.kind() + ": " + error.message() + "]";
    }
}
