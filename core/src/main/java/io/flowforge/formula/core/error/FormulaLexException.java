package io.flowforge.formula.core.error;

/**
 * Thrown by the tokenizer on the first lexical error (unterminated string, unknown character,
 * malformed number). URN: {@code urn:flowforge:formula:lex-error}
 */
public final class FormulaLexException extends FormulaException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:flowforge:formula:lex-error";

    public FormulaLexException(String message, int position) {
        super(message, position, Phase.PARSE);
    }
}
