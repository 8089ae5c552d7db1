package io.flowforge.formula.core.ast;

import java.util.Objects;

/**
 * Property access. {@code order.total} is non-computed with an {@link Identifier} property;
 * {@code items[0]} is computed with an arbitrary property expression.
 */
public record MemberExpression(Node object, Node property, boolean computed, int start, int end) implements Node {

    public MemberExpression {
        Objects.requireNonNull(object, "object must not be null");
        Objects.requireNonNull(property, "property must not be null");
        if (!computed && !(property instanceof Identifier)) {
            throw new IllegalArgumentException("non-computed member property must be an identifier");
        }
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitMember(this);
    }
}
