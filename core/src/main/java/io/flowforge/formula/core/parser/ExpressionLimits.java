package io.flowforge.formula.core.parser;

/**
 * Resource bounds for formulas. Enforced by the parser, and by the evaluator for recursion depth,
 * so that hosts can accept untrusted formulas without risking runaway memory or stack use.
 *
 * <p>
 * Immutable and thread-safe.
 *
 * @param maxFormulaLength maximum source length in characters (default: 10 000)
 * @param maxNodeCount     maximum number of AST nodes (default: 2 000)
 * @param maxDepth         maximum AST depth, which is also the evaluator's recursion bound
 *                         (default: 200). Left-associative chains count too: {@code 1 + 1 + ...}
 *                         with n terms has depth n, so a flat sum is capped at this many terms.
 */
public record ExpressionLimits(int maxFormulaLength, int maxNodeCount, int maxDepth) {

    /** Default limits: 10 000 characters, 2 000 nodes, depth 200. */
    public static final ExpressionLimits DEFAULT = new ExpressionLimits(10_000, 2_000, 200);

    public ExpressionLimits {
        if (maxFormulaLength <= 0) {
            throw new IllegalArgumentException("maxFormulaLength must be positive, got: " + maxFormulaLength);
        }
        if (maxNodeCount <= 0) {
            throw new IllegalArgumentException("maxNodeCount must be positive, got: " + maxNodeCount);
        }
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive, got: " + maxDepth);
        }
    }
}
