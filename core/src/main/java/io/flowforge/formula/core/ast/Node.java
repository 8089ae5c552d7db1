package io.flowforge.formula.core.ast;

/**
 * Immutable formula syntax tree node.
 *
 * <p>Every node records the half-open source span {@code [start, end)} it was parsed from.
 * Consumers dispatch through {@link #accept(NodeVisitor)}; adding a node kind breaks every
 * visitor at compile time.
 */
public sealed interface Node
        permits Literal,
                Identifier,
                MemberExpression,
                ArrayExpression,
                ObjectExpression,
                UnaryExpression,
                BinaryExpression,
                LogicalExpression,
                ConditionalExpression,
                CallExpression {

    /** Zero-based offset of the first source character of this node. */
    int start();

    /** Zero-based offset one past the last source character of this node. */
    int end();

    <R> R accept(NodeVisitor<R> visitor);
}
