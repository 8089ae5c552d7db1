package io.flowforge.formula.core.ast;

import java.util.stream.Collectors;

/**
 * Renders a tree as fully parenthesised canonical source. Re-parsing the output yields a
 * structurally equal tree (ignoring source positions), so the form makes precedence and
 * associativity visible.
 *
 * <pre>{@code
 * 1 + 2 * 3        ->  (1 + (2 * 3))
 * -2 ** 2          ->  ((-2) ** 2)
 * a ? b : c ? d : e ->  (a ? b : (c ? d : e))
 * }</pre>
 */
public final class AstPrinter implements NodeVisitor<String> {

    private static final AstPrinter INSTANCE = new AstPrinter();

    private AstPrinter() {}

    public static String print(Node node) {
        return node.accept(INSTANCE);
    }

    @Override
    public String visitLiteral(Literal node) {
        if (node.value().isTextual()) {
            return quote(node.value().textValue());
        }
        return node.value().isNumber() ? node.raw() : node.value().toString();
    }

    @Override
    public String visitIdentifier(Identifier node) {
        return node.name();
    }

    @Override
    public String visitMember(MemberExpression node) {
        String object = node.object().accept(this);
        if (node.computed()) {
            return object + "[" + node.property().accept(this) + "]";
        }
        return object + "." + ((Identifier) node.property()).name();
    }

    @Override
    public String visitArray(ArrayExpression node) {
        return node.elements().stream().map(e -> e.accept(this)).collect(Collectors.joining(", ", "[", "]"));
    }

    @Override
    public String visitObject(ObjectExpression node) {
        return node.entries().stream()
                .map(e -> quote(e.key()) + ": " + e.value().accept(this))
                .collect(Collectors.joining(", ", "{", "}"));
    }

    @Override
    public String visitUnary(UnaryExpression node) {
        return "(" + node.operator().symbol() + node.argument().accept(this) + ")";
    }

    @Override
    public String visitBinary(BinaryExpression node) {
        return "(" + node.left().accept(this) + " " + node.operator().symbol() + " " + node.right().accept(this)
                + ")";
    }

    @Override
    public String visitLogical(LogicalExpression node) {
        return "(" + node.left().accept(this) + " " + node.operator().symbol() + " " + node.right().accept(this)
                + ")";
    }

    @Override
    public String visitConditional(ConditionalExpression node) {
        return "(" + node.test().accept(this) + " ? " + node.consequent().accept(this) + " : "
                + node.alternate().accept(this) + ")";
    }

    @Override
    public String visitCall(CallExpression node) {
        return node.callee().accept(this)
                + node.arguments().stream().map(a -> a.accept(this)).collect(Collectors.joining(", ", "(", ")"));
    }

    static String quote(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 2).append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.append('"').toString();
    }
}
