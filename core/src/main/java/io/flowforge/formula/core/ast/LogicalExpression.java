package io.flowforge.formula.core.ast;

import java.util.Objects;

/** {@code a && b} or {@code a || b}; the right operand is evaluated only when needed. */
public record LogicalExpression(LogicalOperator operator, Node left, Node right, int start, int end)
        implements Node {

    public LogicalExpression {
        Objects.requireNonNull(operator, "operator must not be null");
        Objects.requireNonNull(left, "left must not be null");
        Objects.requireNonNull(right, "right must not be null");
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitLogical(this);
    }
}
