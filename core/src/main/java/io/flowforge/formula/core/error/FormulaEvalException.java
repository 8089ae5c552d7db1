package io.flowforge.formula.core.error;

/**
 * Thrown when evaluation fails at runtime (type mismatch, division by zero, unknown function,
 * bad argument). Carries the offending function name and argument index when the failure
 * happened inside a function call. URN: {@code urn:flowforge:formula:eval-error}
 */
public final class FormulaEvalException extends FormulaException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:flowforge:formula:eval-error";

    private final String functionName;
    private final Integer argumentIndex;

    public FormulaEvalException(String message, int position) {
        this(message, position, null, null);
    }

    public FormulaEvalException(String message, int position, String functionName, Integer argumentIndex) {
        super(message, position, Phase.EVALUATION);
        this.functionName = functionName;
        this.argumentIndex = argumentIndex;
    }

    /** Name of the function whose call failed, or {@code null} outside a call. */
    public String functionName() {
        return functionName;
    }

    /** Zero-based index of the offending argument, or {@code null} if not argument-specific. */
    public Integer argumentIndex() {
        return argumentIndex;
    }

    /**
     * Returns this exception if it already carries a position, otherwise a copy positioned at
     * {@code fallbackPosition}. Function implementations raise errors without source positions;
     * the evaluator attaches them.
     */
    public FormulaEvalException positionedAt(int fallbackPosition) {
        if (position() >= 0) {
            return this;
        }
        return new FormulaEvalException(getMessage(), fallbackPosition, functionName, argumentIndex);
    }
}
