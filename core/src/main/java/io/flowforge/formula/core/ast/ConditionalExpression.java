package io.flowforge.formula.core.ast;

import java.util.Objects;

/** {@code test ? consequent : alternate}. Only the selected branch is evaluated. */
public record ConditionalExpression(Node test, Node consequent, Node alternate, int start, int end)
        implements Node {

    public ConditionalExpression {
        Objects.requireNonNull(test, "test must not be null");
        Objects.requireNonNull(consequent, "consequent must not be null");
        Objects.requireNonNull(alternate, "alternate must not be null");
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitConditional(this);
    }
}
