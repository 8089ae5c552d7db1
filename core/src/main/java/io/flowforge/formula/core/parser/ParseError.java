package io.flowforge.formula.core.parser;

import io.flowforge.formula.core.error.FormulaException;
import io.flowforge.formula.core.error.FormulaLexException;
import io.flowforge.formula.core.error.FormulaLimitException;
import java.util.Objects;

/**
 * A positioned parse failure.
 *
 * @param kind     lexical, syntactic, or a resource limit
 * @param message  human-readable description
 * @param position zero-based character offset
 * @param line     one-based line of {@code position}
 * @param column   one-based column of {@code position}
 * @param snippet  up to 20 characters either side of the error with a {@code →} marker
 */
public record ParseError(Kind kind, String message, int position, int line, int column, String snippet) {

    private static final int SNIPPET_RADIUS = 20;

    /** Classification of parse failures. */
    public enum Kind {
        LEX,
        SYNTAX,
        LIMIT
    }

    public ParseError {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    /** Builds a parse error from the exception raised while tokenizing or parsing {@code source}. */
    public static ParseError from(FormulaException e, String source) {
        Kind kind;
        if (e instanceof FormulaLexException) {
            kind = Kind.LEX;
        } else if (e instanceof FormulaLimitException) {
            kind = Kind.LIMIT;
        } else {
            kind = Kind.SYNTAX;
        }
        int position = Math.max(0, Math.min(e.position(), source.length()));
        int line = 1;
        int column = 1;
        for (int i = 0; i < position; i++) {
            if (source.charAt(i) == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
        }
        return new ParseError(kind, e.getMessage(), position, line, column, snippet(source, position));
    }

    static String snippet(String source, int position) {
        int from = Math.max(0, position - SNIPPET_RADIUS);
        int to = Math.min(source.length(), position + SNIPPET_RADIUS);
        return (from > 0 ? "..." : "")
                + source.substring(from, position)
                + "→"
                + source.substring(position, to)
                + (to < source.length() ? "..." : "");
    }
}
