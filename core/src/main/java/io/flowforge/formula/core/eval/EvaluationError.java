package io.flowforge.formula.core.eval;

import io.flowforge.formula.core.parser.ParseError;
import java.util.Objects;

/**
 * Why an evaluation failed.
 *
 * @param kind          {@link Kind#PARSE} when source text did not parse, {@link Kind#RUNTIME}
 *                      for errors in the formula, {@link Kind#LIMIT} for resource bounds,
 *                      {@link Kind#INTERNAL} for defects in a function implementation
 * @param message       human-readable description
 * @param position      zero-based source offset of the failing sub-expression, or {@code -1}
 * @param functionName  function being called, or {@code null}
 * @param argumentIndex zero-based index of the offending argument, or {@code null}
 */
public record EvaluationError(Kind kind, String message, int position, String functionName, Integer argumentIndex) {

    /** Classification of evaluation failures. */
    public enum Kind {
        PARSE,
        RUNTIME,
        LIMIT,
        INTERNAL
    }

    public EvaluationError {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    /** Converts a parse failure: size limits map to {@link Kind#LIMIT}, the rest to {@link Kind#PARSE}. */
    public static EvaluationError fromParse(ParseError error) {
        Kind kind = error.kind() == ParseError.Kind.LIMIT ? Kind.LIMIT : Kind.PARSE;
        return new EvaluationError(kind, error.message(), error.position(), null, null);
    }
}
