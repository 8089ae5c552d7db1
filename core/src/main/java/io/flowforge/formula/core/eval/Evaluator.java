package io.flowforge.formula.core.eval;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.flowforge.formula.core.ast.ArrayExpression;
import io.flowforge.formula.core.ast.BinaryExpression;
import io.flowforge.formula.core.ast.BinaryOperator;
import io.flowforge.formula.core.ast.CallExpression;
import io.flowforge.formula.core.ast.ConditionalExpression;
import io.flowforge.formula.core.ast.Identifier;
import io.flowforge.formula.core.ast.Literal;
import io.flowforge.formula.core.ast.LogicalExpression;
import io.flowforge.formula.core.ast.MemberExpression;
import io.flowforge.formula.core.ast.Node;
import io.flowforge.formula.core.ast.NodeVisitor;
import io.flowforge.formula.core.ast.ObjectExpression;
import io.flowforge.formula.core.ast.UnaryExpression;
import io.flowforge.formula.core.error.FormulaEvalException;
import io.flowforge.formula.core.error.FormulaException;
import io.flowforge.formula.core.error.FormulaLimitException;
import io.flowforge.formula.core.function.FunctionDefinition;
import io.flowforge.formula.core.function.FunctionRegistry;
import io.flowforge.formula.core.parser.ExpressionLimits;
import io.flowforge.formula.core.value.Values;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tree-walking evaluator for parsed formulas.
 *
 * <p>{@link #evaluate(Node, EvaluationContext)} never throws for user errors: type mismatches,
 * division by zero, unknown functions and bad arguments come back as a failed
 * {@link EvaluationResult} carrying the source position of the failing sub-expression. An
 * unexpected exception thrown by a function implementation is reported as
 * {@link EvaluationError.Kind#INTERNAL} and logged at ERROR.
 *
 * <p>Semantics in brief:
 *
 * <ul>
 * <li>arithmetic ({@code - * / % **}) requires numbers; null operands are an error</li>
 * <li>{@code +} adds numbers and concatenates when either side is a string</li>
 * <li>{@code &} always concatenates the text forms of both sides</li>
 * <li>{@code ==} and {@code !=} are strict: values of different kinds are never equal</li>
 * <li>{@code < <= > >=} compare two numbers or two strings</li>
 * <li>{@code &&}, {@code ||}, {@code ?:}, {@code IF} and {@code IFS} evaluate lazily</li>
 * <li>unknown fields resolve to null; {@code a.b} on an array projects {@code b} from each
 * element</li>
 * <li>a result that is not a finite number (overflow, {@code 0/0}) is an error</li>
 * </ul>
 *
 * <p>Thread-safe: all per-evaluation state lives in a private visitor instance.
 */
public final class Evaluator {

    private static final Logger LOG = LoggerFactory.getLogger(Evaluator.class);

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final FunctionRegistry registry;
    private final ExpressionLimits limits;

    public Evaluator(FunctionRegistry registry) {
        this(registry, ExpressionLimits.DEFAULT);
    }

    public Evaluator(FunctionRegistry registry, ExpressionLimits limits) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.limits = Objects.requireNonNull(limits, "limits must not be null");
    }

    public FunctionRegistry registry() {
        return registry;
    }

    /**
     * Evaluates a parsed formula against a context.
     *
     * @param ast     root node produced by the parser
     * @param context fields, datasets and variables; {@code null} means empty
     * @return success with the computed value, or failure with a positioned error
     */
    public EvaluationResult evaluate(Node ast, EvaluationContext context) {
        Objects.requireNonNull(ast, "ast must not be null");
        EvaluationContext ctx = context != null ? context : EvaluationContext.empty();
        try {
            return EvaluationResult.success(new Walk(ctx).eval(ast));
        } catch (FormulaEvalException e) {
            LOG.debug("Evaluation failed: position={}, function={}, message={}",
                    e.position(), e.functionName(), e.getMessage());
            return EvaluationResult.failure(new EvaluationError(
                    EvaluationError.Kind.RUNTIME, e.getMessage(), e.position(), e.functionName(), e.argumentIndex()));
        } catch (FormulaLimitException e) {
            LOG.debug("Evaluation limit exceeded: position={}, message={}", e.position(), e.getMessage());
            return EvaluationResult.failure(
                    new EvaluationError(EvaluationError.Kind.LIMIT, e.getMessage(), e.position(), null, null));
        } catch (FunctionDefect e) {
            LOG.error("Function implementation failed: function={}, position={}",
                    e.functionName, e.position, e.getCause());
            return EvaluationResult.failure(new EvaluationError(
                    EvaluationError.Kind.INTERNAL,
                    "Internal error in function " + e.functionName + ": " + e.getCause().getMessage(),
                    e.position,
                    e.functionName,
                    null));
        }
    }

    /** Wraps an unexpected exception escaping a function implementation. */
    private static final class FunctionDefect extends RuntimeException {

        private static final long serialVersionUID = 1L;

        private final String functionName;
        private final int position;

        FunctionDefect(String functionName, int position, RuntimeException cause) {
            super(cause);
            this.functionName = functionName;
            this.position = position;
        }
    }

    private final class Walk implements NodeVisitor<JsonNode> {

        private final EvaluationContext ctx;
        private int depth;

        Walk(EvaluationContext ctx) {
            this.ctx = ctx;
        }

        JsonNode eval(Node node) {
            if (++depth > limits.maxDepth()) {
                throw new FormulaLimitException(
                        "Evaluation depth exceeds maximum of " + limits.maxDepth(),
                        node.start(),
                        FormulaException.Phase.EVALUATION);
            }
            try {
                return node.accept(this);
            } finally {
                depth--;
            }
        }

        @Override
        public JsonNode visitLiteral(Literal node) {
            return node.value();
        }

        @Override
        public JsonNode visitIdentifier(Identifier node) {
            if (!node.isVariable()) {
                return ctx.field(node.name());
            }
            Optional<JsonNode> value = ctx.variable(node.name());
            if (value.isPresent()) {
                return value.get();
            }
            return switch (node.name()) {
                case "$now" -> Values.text(Instant.now(ctx.clock()).truncatedTo(ChronoUnit.SECONDS).toString());
                case "$today" -> Values.text(LocalDate.now(ctx.clock()).toString());
                default -> throw new FormulaEvalException("Unknown variable '" + node.name() + "'", node.start());
            };
        }

        @Override
        public JsonNode visitMember(MemberExpression node) {
            JsonNode target = eval(node.object());
            if (Values.isNull(target)) {
                return Values.nullValue();
            }
            if (!node.computed()) {
                return property(target, ((Identifier) node.property()).name(), node);
            }
            JsonNode key = eval(node.property());
            if (target.isArray() || target.isTextual()) {
                if (!key.isNumber() || key.doubleValue() != Math.rint(key.doubleValue())) {
                    throw new FormulaEvalException(
                            "Index must be a whole number but got " + Values.typeName(key), node.property().start());
                }
                int index = key.intValue();
                if (target.isArray()) {
                    JsonNode element = index >= 0 ? target.get(index) : null;
                    return element != null ? element : Values.nullValue();
                }
                String text = target.textValue();
                int length = text.codePointCount(0, text.length());
                if (index < 0 || index >= length) {
                    return Values.nullValue();
                }
                int offset = text.offsetByCodePoints(0, index);
                return Values.text(new String(Character.toChars(text.codePointAt(offset))));
            }
            if (target.isObject()) {
                if (!key.isTextual() && !key.isNumber()) {
                    throw new FormulaEvalException(
                            "Property key must be a string but got " + Values.typeName(key), node.property().start());
                }
                JsonNode value = target.get(Values.toText(key));
                return value != null ? value : Values.nullValue();
            }
            throw new FormulaEvalException("Cannot index into " + Values.typeName(target), node.start());
        }

        private JsonNode property(JsonNode target, String name, MemberExpression node) {
            if (target.isObject()) {
                JsonNode value = target.get(name);
                return value != null ? value : Values.nullValue();
            }
            if (target.isArray()) {
                if ("length".equals(name)) {
                    return Values.number(target.size());
                }
                ArrayNode projected = NODES.arrayNode(target.size());
                for (JsonNode element : target) {
                    JsonNode value = element.isObject() ? element.get(name) : null;
                    projected.add(value != null ? value : Values.nullValue());
                }
                return projected;
            }
            if (target.isTextual() && "length".equals(name)) {
                String text = target.textValue();
                return Values.number(text.codePointCount(0, text.length()));
            }
            throw new FormulaEvalException(
                    "Cannot read property '" + name + "' of " + Values.typeName(target), node.property().start());
        }

        @Override
        public JsonNode visitArray(ArrayExpression node) {
            ArrayNode array = NODES.arrayNode(node.elements().size());
            for (Node element : node.elements()) {
                array.add(eval(element));
            }
            return array;
        }

        @Override
        public JsonNode visitObject(ObjectExpression node) {
            ObjectNode object = NODES.objectNode();
            for (ObjectExpression.Entry entry : node.entries()) {
                object.set(entry.key(), eval(entry.value()));
            }
            return object;
        }

        @Override
        public JsonNode visitUnary(UnaryExpression node) {
            JsonNode value = eval(node.argument());
            return switch (node.operator()) {
                case NOT -> Values.bool(!Values.isTruthy(value));
                case NEGATE -> {
                    if (!value.isNumber()) {
                        throw new FormulaEvalException(
                                "Operator '-' expects a number but got " + Values.typeName(value), node.start());
                    }
                    yield Values.number(-value.doubleValue());
                }
            };
        }

        @Override
        public JsonNode visitBinary(BinaryExpression node) {
            JsonNode left = eval(node.left());
            JsonNode right = eval(node.right());
            BinaryOperator op = node.operator();
            return switch (op) {
                case EQUAL -> Values.bool(Values.strictEquals(left, right));
                case NOT_EQUAL -> Values.bool(!Values.strictEquals(left, right));
                case CONCAT -> Values.text(Values.toText(left) + Values.toText(right));
                case ADD -> add(left, right, node);
                case LESS_THAN, GREATER_THAN, LESS_OR_EQUAL, GREATER_OR_EQUAL -> compare(op, left, right, node);
                default -> arithmetic(op, left, right, node);
            };
        }

        private JsonNode add(JsonNode left, JsonNode right, BinaryExpression node) {
            if (left.isNumber() && right.isNumber()) {
                return finite(left.doubleValue() + right.doubleValue(), node);
            }
            if (left.isTextual() || right.isTextual()) {
                return Values.text(Values.toText(left) + Values.toText(right));
            }
            throw mismatch(BinaryOperator.ADD, left, right, node);
        }

        private JsonNode arithmetic(BinaryOperator op, JsonNode left, JsonNode right, BinaryExpression node) {
            if (!left.isNumber() || !right.isNumber()) {
                throw mismatch(op, left, right, node);
            }
            double a = left.doubleValue();
            double b = right.doubleValue();
            double result = switch (op) {
                case SUBTRACT -> a - b;
                case MULTIPLY -> a * b;
                case DIVIDE -> {
                    if (b == 0) {
                        throw new FormulaEvalException("Division by zero", node.right().start());
                    }
                    yield a / b;
                }
                case MODULO -> {
                    if (b == 0) {
                        throw new FormulaEvalException("Modulo by zero", node.right().start());
                    }
                    yield a % b;
                }
                case POWER -> Math.pow(a, b);
                default -> throw new IllegalStateException("Not an arithmetic operator: " + op);
            };
            return finite(result, node);
        }

        private JsonNode compare(BinaryOperator op, JsonNode left, JsonNode right, BinaryExpression node) {
            int cmp;
            if (left.isNumber() && right.isNumber()) {
                cmp = Double.compare(left.doubleValue(), right.doubleValue());
            } else if (left.isTextual() && right.isTextual()) {
                cmp = left.textValue().compareTo(right.textValue());
            } else {
                throw new FormulaEvalException(
                        "Operator '" + op.symbol() + "' compares two numbers or two strings but got "
                                + Values.typeName(left) + " and " + Values.typeName(right),
                        node.start());
            }
            return Values.bool(switch (op) {
                case LESS_THAN -> cmp < 0;
                case GREATER_THAN -> cmp > 0;
                case LESS_OR_EQUAL -> cmp <= 0;
                default -> cmp >= 0;
            });
        }

        private FormulaEvalException mismatch(BinaryOperator op, JsonNode left, JsonNode right, BinaryExpression node) {
            return new FormulaEvalException(
                    "Operator '" + op.symbol() + "' expects numbers but got "
                            + Values.typeName(left) + " and " + Values.typeName(right),
                    node.start());
        }

        private JsonNode finite(double value, Node node) {
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                throw new FormulaEvalException("Result is not a finite number", node.start());
            }
            return Values.number(value);
        }

        @Override
        public JsonNode visitLogical(LogicalExpression node) {
            JsonNode left = eval(node.left());
            boolean truthy = Values.isTruthy(left);
            return switch (node.operator()) {
                case AND -> truthy ? Values.bool(Values.isTruthy(eval(node.right()))) : Values.bool(false);
                case OR -> truthy ? Values.bool(true) : Values.bool(Values.isTruthy(eval(node.right())));
            };
        }

        @Override
        public JsonNode visitConditional(ConditionalExpression node) {
            return Values.isTruthy(eval(node.test())) ? eval(node.consequent()) : eval(node.alternate());
        }

        @Override
        public JsonNode visitCall(CallExpression node) {
            String name = node.calleeName()
                    .orElseThrow(() -> new FormulaEvalException("Expression is not callable", node.callee().start()));
            FunctionDefinition function = registry.find(name)
                    .orElseThrow(() -> new FormulaEvalException(
                            "Unknown function '" + name + "'", node.callee().start(), name, null));
            List<Node> argNodes = node.arguments();
            String arity = function.arityProblem(argNodes.size());
            if (arity != null) {
                throw new FormulaEvalException(arity, node.start(), function.name(), null);
            }
            switch (function.name()) {
                case "IF":
                    return lazyIf(argNodes);
                case "IFS":
                    return lazyIfs(argNodes, node);
                default:
                    break;
            }
            List<JsonNode> args = new ArrayList<>(argNodes.size());
            for (Node arg : argNodes) {
                args.add(eval(arg));
            }
            JsonNode result;
            try {
                result = function.invoke(args, ctx);
            } catch (FormulaEvalException e) {
                Integer index = e.argumentIndex();
                int fallback = index != null && index < argNodes.size()
                        ? argNodes.get(index).start()
                        : node.start();
                throw e.positionedAt(fallback);
            } catch (FormulaException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new FunctionDefect(function.name(), node.start(), e);
            }
            if (result.isNumber() && !Double.isFinite(result.doubleValue())) {
                throw new FormulaEvalException(
                        function.name() + " produced a non-finite number", node.start(), function.name(), null);
            }
            return result;
        }

        private JsonNode lazyIf(List<Node> args) {
            if (Values.isTruthy(eval(args.get(0)))) {
                return eval(args.get(1));
            }
            return args.size() > 2 ? eval(args.get(2)) : Values.nullValue();
        }

        private JsonNode lazyIfs(List<Node> args, CallExpression node) {
            if (args.size() % 2 != 0) {
                throw new FormulaEvalException(
                        "IFS: expects condition/value pairs but got " + args.size() + " arguments",
                        node.start(), "IFS", null);
            }
            for (int i = 0; i < args.size(); i += 2) {
                if (Values.isTruthy(eval(args.get(i)))) {
                    return eval(args.get(i + 1));
                }
            }
            return Values.nullValue();
        }
    }
}
