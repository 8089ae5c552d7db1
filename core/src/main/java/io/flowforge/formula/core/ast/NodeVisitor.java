package io.flowforge.formula.core.ast;

/**
 * Visitor over every {@link Node} kind.
 *
 * @param <R> result type
 */
public interface NodeVisitor<R> {

    R visitLiteral(Literal node);

    R visitIdentifier(Identifier node);

    R visitMember(MemberExpression node);

    R visitArray(ArrayExpression node);

    R visitObject(ObjectExpression node);

    R visitUnary(UnaryExpression node);

    R visitBinary(BinaryExpression node);

    R visitLogical(LogicalExpression node);

    R visitConditional(ConditionalExpression node);

    R visitCall(CallExpression node);
}
