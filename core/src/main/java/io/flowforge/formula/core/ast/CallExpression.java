package io.flowforge.formula.core.ast;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A function call. The grammar accepts any callee expression, but only a bare
 * {@link Identifier} naming a registered function can be evaluated.
 */
public record CallExpression(Node callee, List<Node> arguments, int start, int end) implements Node {

    public CallExpression {
        Objects.requireNonNull(callee, "callee must not be null");
        arguments = List.copyOf(arguments);
    }

    /** The function name when the callee is a bare identifier. */
    public Optional<String> calleeName() {
        return callee instanceof Identifier id ? Optional.of(id.name()) : Optional.empty();
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitCall(this);
    }
}
