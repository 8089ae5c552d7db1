package io.flowforge.formula.core.ast;

import java.util.Objects;

/** A prefix operator applied to one operand. */
public record UnaryExpression(UnaryOperator operator, Node argument, int start, int end) implements Node {

    public UnaryExpression {
        Objects.requireNonNull(operator, "operator must not be null");
        Objects.requireNonNull(argument, "argument must not be null");
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitUnary(this);
    }
}
