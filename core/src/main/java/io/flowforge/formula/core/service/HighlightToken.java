package io.flowforge.formula.core.service;

/**
 * A token classified for syntax highlighting.
 *
 * @param category highlighting class
 * @param value    token text; for strings, the unescaped content
 * @param start    zero-based offset of the first character
 * @param end      offset one past the last character
 */
public record HighlightToken(Category category, String value, int start, int end) {

    /** Highlighting classes. */
    public enum Category {
        FUNCTION,
        FIELD,
        VARIABLE,
        OPERATOR,
        LITERAL,
        PUNCTUATION
    }
}
