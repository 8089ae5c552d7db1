package io.flowforge.formula.core.lexer;

/**
 * A lexical token.
 *
 * @param type     token kind
 * @param value    decoded value: number text, unescaped string contents, identifier name, or the
 *                 operator symbol
 * @param position zero-based offset of the first source character
 * @param end      zero-based offset one past the last source character
 */
public record Token(TokenType type, String value, int position, int end) {

    /** Returns {@code true} if this token is of the given type. */
    public boolean is(TokenType expected) {
        return type == expected;
    }

    /** Source length covered by this token. */
    public int length() {
        return end - position;
    }

    @Override
    public String toString() {
        return type + "(" + value + ")@" + position;
    }
}
