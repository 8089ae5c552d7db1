package io.flowforge.formula.core.validate;

import java.util.Objects;

/**
 * One problem found by the {@link Validator}.
 *
 * @param type    problem class
 * @param message human-readable description
 * @param start   zero-based source offset where the problem starts
 * @param end     offset one past the end of the offending text
 */
public record ValidationError(Type type, String message, int start, int end) {

    /** Problem classes. */
    public enum Type {
        /** Lexical, syntax or size-limit failure while parsing. */
        SYNTAX,
        UNKNOWN_FIELD,
        UNKNOWN_FUNCTION,
        /** Call to a known function with too few or too many arguments. */
        ARITY
    }

    public ValidationError {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }
}
