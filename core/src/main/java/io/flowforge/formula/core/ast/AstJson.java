package io.flowforge.formula.core.ast;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Renders a tree as JSON in the ESTree shape used by editor tooling:
 *
 * <pre>{@code
 * {"type": "BinaryExpression", "operator": "+", "left": {...}, "right": {...}, "start": 0, "end": 5}
 * }</pre>
 */
public final class AstJson implements NodeVisitor<ObjectNode> {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;
    private static final AstJson INSTANCE = new AstJson();

    private AstJson() {}

    public static ObjectNode toJson(Node node) {
        return node.accept(INSTANCE);
    }

    @Override
    public ObjectNode visitLiteral(Literal node) {
        ObjectNode json = base("Literal", node);
        json.set("value", node.value().deepCopy());
        json.put("raw", node.raw());
        return json;
    }

    @Override
    public ObjectNode visitIdentifier(Identifier node) {
        return base("Identifier", node).put("name", node.name());
    }

    @Override
    public ObjectNode visitMember(MemberExpression node) {
        ObjectNode json = base("MemberExpression", node);
        json.set("object", node.object().accept(this));
        json.set("property", node.property().accept(this));
        json.put("computed", node.computed());
        return json;
    }

    @Override
    public ObjectNode visitArray(ArrayExpression node) {
        ObjectNode json = base("ArrayExpression", node);
        ArrayNode elements = json.putArray("elements");
        node.elements().forEach(e -> elements.add(e.accept(this)));
        return json;
    }

    @Override
    public ObjectNode visitObject(ObjectExpression node) {
        ObjectNode json = base("ObjectExpression", node);
        ArrayNode properties = json.putArray("properties");
        for (ObjectExpression.Entry entry : node.entries()) {
            ObjectNode property = properties.addObject();
            property.put("key", entry.key());
            property.set("value", entry.value().accept(this));
        }
        return json;
    }

    @Override
    public ObjectNode visitUnary(UnaryExpression node) {
        ObjectNode json = base("UnaryExpression", node);
        json.put("operator", node.operator().symbol());
        json.set("argument", node.argument().accept(this));
        return json;
    }

    @Override
    public ObjectNode visitBinary(BinaryExpression node) {
        ObjectNode json = base("BinaryExpression", node);
        json.put("operator", node.operator().symbol());
        json.set("left", node.left().accept(this));
        json.set("right", node.right().accept(this));
        return json;
    }

    @Override
    public ObjectNode visitLogical(LogicalExpression node) {
        ObjectNode json = base("LogicalExpression", node);
        json.put("operator", node.operator().symbol());
        json.set("left", node.left().accept(this));
        json.set("right", node.right().accept(this));
        return json;
    }

    @Override
    public ObjectNode visitConditional(ConditionalExpression node) {
        ObjectNode json = base("ConditionalExpression", node);
        json.set("test", node.test().accept(this));
        json.set("consequent", node.consequent().accept(this));
        json.set("alternate", node.alternate().accept(this));
        return json;
    }

    @Override
    public ObjectNode visitCall(CallExpression node) {
        ObjectNode json = base("CallExpression", node);
        json.set("callee", node.callee().accept(this));
        ArrayNode arguments = json.putArray("arguments");
        node.arguments().forEach(a -> arguments.add(a.accept(this)));
        return json;
    }

    private static ObjectNode base(String type, Node node) {
        ObjectNode json = NODES.objectNode();
        json.put("type", type);
        json.put("start", node.start());
        json.put("end", node.end());
        return json;
    }
}
