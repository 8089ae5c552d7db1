package io.flowforge.formula.core.ast;

import java.util.List;
import java.util.Objects;

/**
 * An object literal {@code {key: value, "other key": value}}. Entries keep source order;
 * on duplicate keys the last entry wins at evaluation time.
 */
public record ObjectExpression(List<Entry> entries, int start, int end) implements Node {

    public ObjectExpression {
        entries = List.copyOf(entries);
    }

    /** One {@code key: value} pair. */
    public record Entry(String key, Node value) {
        public Entry {
            Objects.requireNonNull(key, "key must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitObject(this);
    }
}
