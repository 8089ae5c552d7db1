package io.flowforge.formula.core.error;

/**
 * Thrown when a formula exceeds a configured resource bound (source length, node count or
 * nesting depth). Raised while parsing and, for recursion depth, while evaluating. URN: {@code
 * urn:flowforge:formula:limit-exceeded}
 */
public final class FormulaLimitException extends FormulaException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:flowforge:formula:limit-exceeded";

    public FormulaLimitException(String message, int position, Phase phase) {
        super(message, position, phase);
    }
}
