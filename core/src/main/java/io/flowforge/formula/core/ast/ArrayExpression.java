package io.flowforge.formula.core.ast;

import java.util.List;

/** An array literal {@code [a, b, c]}. */
public record ArrayExpression(List<Node> elements, int start, int end) implements Node {

    public ArrayExpression {
        elements = List.copyOf(elements);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitArray(this);
    }
}
