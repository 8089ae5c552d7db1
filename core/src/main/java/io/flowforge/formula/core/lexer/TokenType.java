package io.flowforge.formula.core.lexer;

/** Kinds of token produced by the {@link Tokenizer}. */
public enum TokenType {
    NUMBER,
    STRING,
    IDENTIFIER,

    PLUS("+"),
    MINUS("-"),
    STAR("*"),
    SLASH("/"),
    PERCENT("%"),
    STAR_STAR("**"),
    EQ("=="),
    NEQ("!="),
    LT("<"),
    GT(">"),
    LTE("<="),
    GTE(">="),
    AND_AND("&&"),
    OR_OR("||"),
    BANG("!"),
    AMPERSAND("&"),

    LPAREN("("),
    RPAREN(")"),
    LBRACKET("["),
    RBRACKET("]"),
    LBRACE("{"),
    RBRACE("}"),
    COMMA(","),
    DOT("."),
    COLON(":"),
    QUESTION("?"),

    END;

    private final String symbol;

    TokenType() {
        this(null);
    }

    TokenType(String symbol) {
        this.symbol = symbol;
    }

    /** The fixed source text of an operator or punctuation token, or {@code null}. */
    public String symbol() {
        return symbol;
    }

    /** {@code true} for arithmetic, comparison and logical operators. */
    public boolean isOperator() {
        return switch (this) {
            case PLUS, MINUS, STAR, SLASH, PERCENT, STAR_STAR, EQ, NEQ, LT, GT, LTE, GTE, AND_AND, OR_OR, BANG,
                    AMPERSAND, QUESTION, COLON -> true;
            default -> false;
        };
    }

    /** {@code true} for brackets, commas and the member-access dot. */
    public boolean isPunctuation() {
        return switch (this) {
            case LPAREN, RPAREN, LBRACKET, RBRACKET, LBRACE, RBRACE, COMMA, DOT -> true;
            default -> false;
        };
    }
}
