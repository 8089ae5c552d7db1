package io.flowforge.formula.core.ast;

import java.util.Objects;

/** An infix operator whose operands are always both evaluated. */
public record BinaryExpression(BinaryOperator operator, Node left, Node right, int start, int end) implements Node {

    public BinaryExpression {
        Objects.requireNonNull(operator, "operator must not be null");
        Objects.requireNonNull(left, "left must not be null");
        Objects.requireNonNull(right, "right must not be null");
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitBinary(this);
    }
}
