package io.flowforge.formula.core.error;

/**
 * Abstract base for all formula exceptions. Never thrown directly. Use the concrete subclasses.
 *
 * <p>Formula exceptions are internal control flow: every public entry point of the engine
 * catches them and converts them into a result object carrying a position.
 */
public abstract class FormulaException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        PARSE,
        EVALUATION
    }

    private final int position;
    private final Phase phase;

    protected FormulaException(String message, int position, Phase phase) {
        super(message);
        this.position = position;
        this.phase = phase;
    }

    protected FormulaException(String message, Throwable cause, int position, Phase phase) {
        super(message, cause);
        this.position = position;
        this.phase = phase;
    }

    /** Zero-based character offset into the formula source, or {@code -1} if unknown. */
    public int position() {
        return position;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
