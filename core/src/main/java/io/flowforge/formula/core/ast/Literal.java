package io.flowforge.formula.core.ast;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;

/**
 * A number, string, boolean or null literal.
 *
 * @param value the literal value as a JSON node
 * @param raw   the literal's source text
 */
public record Literal(JsonNode value, String raw, int start, int end) implements Node {

    public Literal {
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(raw, "raw must not be null");
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitLiteral(this);
    }
}
