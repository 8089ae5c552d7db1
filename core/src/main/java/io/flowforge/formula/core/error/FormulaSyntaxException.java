package io.flowforge.formula.core.error;

/**
 * Thrown by the parser when the token stream does not match the grammar. URN: {@code
 * urn:flowforge:formula:syntax-error}
 */
public final class FormulaSyntaxException extends FormulaException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:flowforge:formula:syntax-error";

    public FormulaSyntaxException(String message, int position) {
        super(message, position, Phase.PARSE);
    }
}
