package io.flowforge.formula.core.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.flowforge.formula.core.ast.ArrayExpression;
import io.flowforge.formula.core.ast.BinaryExpression;
import io.flowforge.formula.core.ast.BinaryOperator;
import io.flowforge.formula.core.ast.CallExpression;
import io.flowforge.formula.core.ast.ConditionalExpression;
import io.flowforge.formula.core.ast.Identifier;
import io.flowforge.formula.core.ast.Literal;
import io.flowforge.formula.core.ast.LogicalExpression;
import io.flowforge.formula.core.ast.LogicalOperator;
import io.flowforge.formula.core.ast.MemberExpression;
import io.flowforge.formula.core.ast.Node;
import io.flowforge.formula.core.ast.ObjectExpression;
import io.flowforge.formula.core.ast.UnaryExpression;
import io.flowforge.formula.core.ast.UnaryOperator;
import io.flowforge.formula.core.error.FormulaException;
import io.flowforge.formula.core.error.FormulaLimitException;
import io.flowforge.formula.core.error.FormulaSyntaxException;
import io.flowforge.formula.core.lexer.Token;
import io.flowforge.formula.core.lexer.TokenType;
import io.flowforge.formula.core.lexer.Tokenizer;
import io.flowforge.formula.core.value.Values;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Pratt parser for formulas.
 *
 * <p>
 * Binding powers, lowest first:
 *
 * <pre>
 *   ?:            3 / 2    right-associative
 *   ||            4 / 5
 *   &amp;&amp;            6 / 7
 *   == !=         8 / 9
 *   &lt; &gt; &lt;= &gt;=    10 / 11
 *   + - &amp;        12 / 13
 *   * / %        14 / 15
 *   **           17 / 16   right-associative
 *   prefix - !    18       binds tighter than **, so -2 ** 2 is (-2) ** 2
 *   . [] ()      postfix
 * </pre>
 *
 * <p>
 * The parser does not recover: the first error ends the parse. {@link #parse(String)} never
 * throws for user input; failures come back as a {@link ParseResult} carrying a
 * {@link ParseError}.
 *
 * <p>
 * Thread-safe: the instance holds only its immutable limits.
 */
public final class Parser {

    private static final int TERNARY_LEFT = 3;
    private static final int TERNARY_RIGHT = 2;
    private static final int PREFIX = 18;

    private final ExpressionLimits limits;

    public Parser() {
        this(ExpressionLimits.DEFAULT);
    }

    public Parser(ExpressionLimits limits) {
        this.limits = Objects.requireNonNull(limits, "limits must not be null");
    }

    public ExpressionLimits limits() {
        return limits;
    }

    /**
     * Parses a formula.
     *
     * @param source formula text, not null
     * @return the tree and its metrics, or the first error
     */
    public ParseResult parse(String source) {
        Objects.requireNonNull(source, "source must not be null");
        try {
            if (source.length() > limits.maxFormulaLength()) {
                throw new FormulaLimitException(
                        "Formula exceeds maximum length of " + limits.maxFormulaLength() + " characters",
                        limits.maxFormulaLength(),
                        FormulaException.Phase.PARSE);
            }
            if (source.isBlank()) {
                throw new FormulaSyntaxException("Empty formula", 0);
            }
            State state = new State(source, Tokenizer.tokenize(source), limits);
            Node ast = state.parseFormula();
            int depth = depthOf(ast);
            if (depth > limits.maxDepth()) {
                throw new FormulaLimitException(
                        "Formula is too long or too deeply nested (maximum depth " + limits.maxDepth() + ")",
                        ast.start(),
                        FormulaException.Phase.PARSE);
            }
            return ParseResult.success(ast, state.nodeCount, depth);
        } catch (FormulaException e) {
            return ParseResult.failure(ParseError.from(e, source));
        }
    }

    /** Depth of a tree; a single literal has depth 1. */
    static int depthOf(Node node) {
        int deepest = 0;
        for (Node child : children(node)) {
            deepest = Math.max(deepest, depthOf(child));
        }
        return deepest + 1;
    }

    private static List<Node> children(Node node) {
        if (node instanceof MemberExpression m) {
            return List.of(m.object(), m.property());
        } else if (node instanceof ArrayExpression a) {
            return a.elements();
        } else if (node instanceof ObjectExpression o) {
            return o.entries().stream().map(ObjectExpression.Entry::value).toList();
        } else if (node instanceof UnaryExpression u) {
            return List.of(u.argument());
        } else if (node instanceof BinaryExpression b) {
            return List.of(b.left(), b.right());
        } else if (node instanceof LogicalExpression l) {
            return List.of(l.left(), l.right());
        } else if (node instanceof ConditionalExpression c) {
            return List.of(c.test(), c.consequent(), c.alternate());
        } else if (node instanceof CallExpression c) {
            List<Node> all = new ArrayList<>(c.arguments().size() + 1);
            all.add(c.callee());
            all.addAll(c.arguments());
            return all;
        }
        return List.of();
    }

    /** Mutable cursor over one token list. Never shared between threads. */
    private static final class State {

        private final String source;
        private final List<Token> tokens;
        private final ExpressionLimits limits;
        private int index;
        private int nesting;
        private int nodeCount;

        State(String source, List<Token> tokens, ExpressionLimits limits) {
            this.source = source;
            this.tokens = tokens;
            this.limits = limits;
        }

        Node parseFormula() {
            Node expr = parseExpression(0);
            Token next = peek();
            if (!next.is(TokenType.END)) {
                throw unexpected(next);
            }
            return expr;
        }

        Node parseExpression(int minBindingPower) {
            enter();
            Node left = parsePrefix();
            while (true) {
                Token op = peek();
                int leftPower = leftBindingPower(op.type());
                if (leftPower < 0 || leftPower < minBindingPower) {
                    break;
                }
                advance();
                if (op.is(TokenType.QUESTION)) {
                    Node consequent = parseExpression(0);
                    expect(TokenType.COLON, "Expected ':' in conditional expression");
                    Node alternate = parseExpression(TERNARY_RIGHT);
                    left = count(new ConditionalExpression(left, consequent, alternate, left.start(), alternate.end()));
                    continue;
                }
                Node right = parseExpression(rightBindingPower(op.type()));
                left = count(infix(op, left, right));
            }
            nesting--;
            return left;
        }

        private Node parsePrefix() {
            Token token = peek();
            if (token.is(TokenType.MINUS) || token.is(TokenType.BANG)) {
                advance();
                Node operand = parseExpression(PREFIX);
                UnaryOperator operator = token.is(TokenType.MINUS) ? UnaryOperator.NEGATE : UnaryOperator.NOT;
                return count(new UnaryExpression(operator, operand, token.position(), operand.end()));
            }
            return parsePostfix(parsePrimary());
        }

        private Node parsePostfix(Node target) {
            Node node = target;
            while (true) {
                Token token = peek();
                if (token.is(TokenType.DOT)) {
                    advance();
                    Token name = peek();
                    if (!name.is(TokenType.IDENTIFIER)) {
                        throw new FormulaSyntaxException("Expected property name after '.'", name.position());
                    }
                    advance();
                    Identifier property = count(new Identifier(name.value(), name.position(), name.end()));
                    node = count(new MemberExpression(node, property, false, node.start(), name.end()));
                } else if (token.is(TokenType.LBRACKET)) {
                    advance();
                    Node property = parseExpression(0);
                    Token close = expect(TokenType.RBRACKET, "Expected ']' after index expression");
                    node = count(new MemberExpression(node, property, true, node.start(), close.end()));
                } else if (token.is(TokenType.LPAREN)) {
                    advance();
                    List<Node> args = parseList(TokenType.RPAREN, "function arguments");
                    Token close = previous();
                    node = count(new CallExpression(node, args, node.start(), close.end()));
                } else {
                    return node;
                }
            }
        }

        private Node parsePrimary() {
            Token token = peek();
            switch (token.type()) {
                case NUMBER -> {
                    advance();
                    JsonNode number = Values.numberLiteral(token.value());
                    if (!Double.isFinite(number.doubleValue())) {
                        throw new FormulaSyntaxException(
                                "Number out of range '" + token.value() + "'", token.position());
                    }
                    return count(new Literal(number, token.value(), token.position(), token.end()));
                }
                case STRING -> {
                    advance();
                    return count(new Literal(
                            TextNode.valueOf(token.value()),
                            source.substring(token.position(), token.end()),
                            token.position(),
                            token.end()));
                }
                case IDENTIFIER -> {
                    advance();
                    Node node = switch (token.value()) {
                        case "true" -> new Literal(BooleanNode.TRUE, "true", token.position(), token.end());
                        case "false" -> new Literal(BooleanNode.FALSE, "false", token.position(), token.end());
                        case "null" -> new Literal(NullNode.getInstance(), "null", token.position(), token.end());
                        default -> new Identifier(token.value(), token.position(), token.end());
                    };
                    return count(node);
                }
                case LPAREN -> {
                    advance();
                    Node inner = parseExpression(0);
                    expect(TokenType.RPAREN, "Expected ')'");
                    return inner;
                }
                case LBRACKET -> {
                    advance();
                    List<Node> elements = parseList(TokenType.RBRACKET, "array literal");
                    return count(new ArrayExpression(elements, token.position(), previous().end()));
                }
                case LBRACE -> {
                    return parseObject(token);
                }
                default -> throw unexpected(token);
            }
        }

        private Node parseObject(Token open) {
            advance();
            List<ObjectExpression.Entry> entries = new ArrayList<>();
            if (!peek().is(TokenType.RBRACE)) {
                do {
                    Token key = peek();
                    if (!key.is(TokenType.IDENTIFIER) && !key.is(TokenType.STRING)) {
                        throw new FormulaSyntaxException("Expected object key", key.position());
                    }
                    advance();
                    expect(TokenType.COLON, "Expected ':' after object key");
                    entries.add(new ObjectExpression.Entry(key.value(), parseExpression(0)));
                } while (match(TokenType.COMMA));
            }
            Token close = expect(TokenType.RBRACE, "Expected '}' to close object literal");
            return count(new ObjectExpression(entries, open.position(), close.end()));
        }

        /** Parses {@code a, b, c} up to and including {@code close}; the opener is already consumed. */
        private List<Node> parseList(TokenType close, String what) {
            List<Node> items = new ArrayList<>();
            if (!peek().is(close)) {
                do {
                    items.add(parseExpression(0));
                } while (match(TokenType.COMMA));
            }
            expect(close, "Expected '" + close.symbol() + "' to close " + what);
            return items;
        }

        private Node infix(Token op, Node left, Node right) {
            int start = left.start();
            int end = right.end();
            return switch (op.type()) {
                case OR_OR -> new LogicalExpression(LogicalOperator.OR, left, right, start, end);
                case AND_AND -> new LogicalExpression(LogicalOperator.AND, left, right, start, end);
                default -> new BinaryExpression(binaryOperator(op), left, right, start, end);
            };
        }

        private static BinaryOperator binaryOperator(Token op) {
            return switch (op.type()) {
                case PLUS -> BinaryOperator.ADD;
                case MINUS -> BinaryOperator.SUBTRACT;
                case STAR -> BinaryOperator.MULTIPLY;
                case SLASH -> BinaryOperator.DIVIDE;
                case PERCENT -> BinaryOperator.MODULO;
                case STAR_STAR -> BinaryOperator.POWER;
                case AMPERSAND -> BinaryOperator.CONCAT;
                case EQ -> BinaryOperator.EQUAL;
                case NEQ -> BinaryOperator.NOT_EQUAL;
                case LT -> BinaryOperator.LESS_THAN;
                case GT -> BinaryOperator.GREATER_THAN;
                case LTE -> BinaryOperator.LESS_OR_EQUAL;
                case GTE -> BinaryOperator.GREATER_OR_EQUAL;
                default -> throw new FormulaSyntaxException("Unexpected operator '" + op.value() + "'", op.position());
            };
        }

        private static int leftBindingPower(TokenType type) {
            return switch (type) {
                case QUESTION -> TERNARY_LEFT;
                case OR_OR -> 4;
                case AND_AND -> 6;
                case EQ, NEQ -> 8;
                case LT, GT, LTE, GTE -> 10;
                case PLUS, MINUS, AMPERSAND -> 12;
                case STAR, SLASH, PERCENT -> 14;
                case STAR_STAR -> 17;
                default -> -1;
            };
        }

        private static int rightBindingPower(TokenType type) {
            return switch (type) {
                case OR_OR -> 5;
                case AND_AND -> 7;
                case EQ, NEQ -> 9;
                case LT, GT, LTE, GTE -> 11;
                case PLUS, MINUS, AMPERSAND -> 13;
                case STAR, SLASH, PERCENT -> 15;
                case STAR_STAR -> 16;
                default -> throw new IllegalStateException("no right binding power for " + type);
            };
        }

        private void enter() {
            nesting++;
            if (nesting > limits.maxDepth()) {
                throw new FormulaLimitException(
                        "Formula exceeds maximum nesting depth of " + limits.maxDepth(),
                        peek().position(),
                        FormulaException.Phase.PARSE);
            }
        }

        private <T extends Node> T count(T node) {
            nodeCount++;
            if (nodeCount > limits.maxNodeCount()) {
                throw new FormulaLimitException(
                        "Formula exceeds maximum of " + limits.maxNodeCount() + " nodes",
                        node.start(),
                        FormulaException.Phase.PARSE);
            }
            return node;
        }

        private Token peek() {
            return tokens.get(index);
        }

        private Token previous() {
            return tokens.get(index - 1);
        }

        private void advance() {
            if (index < tokens.size() - 1) {
                index++;
            }
        }

        private boolean match(TokenType type) {
            if (peek().is(type)) {
                advance();
                return true;
            }
            return false;
        }

        private Token expect(TokenType type, String message) {
            Token token = peek();
            if (!token.is(type)) {
                if (token.is(TokenType.END)) {
                    throw new FormulaSyntaxException(message + " but reached end of formula", token.position());
                }
                throw new FormulaSyntaxException(message + " but found '" + token.value() + "'", token.position());
            }
            advance();
            return token;
        }

        private static FormulaSyntaxException unexpected(Token token) {
            if (token.is(TokenType.END)) {
                return new FormulaSyntaxException("Unexpected end of formula", token.position());
            }
            return new FormulaSyntaxException("Unexpected token '" + token.value() + "'", token.position());
        }
    }
}
