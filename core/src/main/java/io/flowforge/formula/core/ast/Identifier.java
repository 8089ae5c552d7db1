package io.flowforge.formula.core.ast;

import java.util.Objects;

/** A bare name: a field reference, a {@code $variable}, or the callee of a call. */
public record Identifier(String name, int start, int end) implements Node {

    public Identifier {
        Objects.requireNonNull(name, "name must not be null");
    }

    /** {@code true} for {@code $}-prefixed context variables. */
    public boolean isVariable() {
        return name.startsWith("$");
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitIdentifier(this);
    }
}
