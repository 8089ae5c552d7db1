package io.flowforge.formula.core.validate;

import io.flowforge.formula.core.ast.ArrayExpression;
import io.flowforge.formula.core.ast.BinaryExpression;
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
import io.flowforge.formula.core.function.FunctionDefinition;
import io.flowforge.formula.core.function.FunctionRegistry;
import io.flowforge.formula.core.parser.ParseError;
import io.flowforge.formula.core.parser.ParseResult;
import io.flowforge.formula.core.parser.Parser;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Static checks over a formula: syntax, field references, function references and call arity.
 *
 * <p>Never evaluates anything. A bare identifier outside callee position is a field reference,
 * and so is the root of a member chain ({@code order} in {@code order.total}). {@code $}
 * variables are not fields. When known field names are supplied, a reference is accepted if
 * either its root or its dotted path ({@code order.total}) is known.
 *
 * <p>Thread-safe.
 */
public final class Validator {

    private static final Logger LOG = LoggerFactory.getLogger(Validator.class);

    private final Parser parser;
    private final FunctionRegistry registry;

    public Validator(Parser parser, FunctionRegistry registry) {
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    /** Validates syntax, functions and arity without checking field names. */
    public ValidationResult validate(String formula) {
        return validate(formula, null);
    }

    /**
     * Validates a formula.
     *
     * @param formula         source text
     * @param knownFieldNames field names the caller can supply, or {@code null} to skip field
     *                        checks
     */
    public ValidationResult validate(String formula, Set<String> knownFieldNames) {
        ParseResult parsed = parser.parse(formula == null ? "" : formula);
        if (!parsed.isSuccess()) {
            ParseError error = parsed.error();
            LOG.debug("Validation failed to parse: kind={}, position={}", error.kind(), error.position());
            return ValidationResult.of(
                    List.of(new ValidationError(
                            ValidationError.Type.SYNTAX, error.message(), error.position(), error.position() + 1)),
                    Set.of(),
                    Set.of());
        }
        return validate(parsed.ast(), knownFieldNames);
    }

    /** Validates an already parsed formula. */
    public ValidationResult validate(Node ast, Set<String> knownFieldNames) {
        References refs = new References(knownFieldNames);
        ast.accept(refs);
        ValidationResult result = ValidationResult.of(refs.errors, refs.fields, refs.functions);
        if (!result.valid()) {
            LOG.debug("Validation found problems: errors={}", result.errors().size());
        }
        return result;
    }

    /** Collects references and reports problems in source order. */
    private final class References implements NodeVisitor<Void> {

        private final Set<String> known;
        private final List<ValidationError> errors = new ArrayList<>();
        private final Set<String> fields = new LinkedHashSet<>();
        private final Set<String> functions = new LinkedHashSet<>();
        private final Set<String> reportedFields = new LinkedHashSet<>();

        References(Set<String> known) {
            this.known = known;
        }

        private void walk(Node node) {
            node.accept(this);
        }

        private void fieldReference(Identifier root, String path, int end) {
            fields.add(root.name());
            if (known == null || known.contains(root.name()) || known.contains(path)) {
                return;
            }
            if (reportedFields.add(path)) {
                errors.add(new ValidationError(
                        ValidationError.Type.UNKNOWN_FIELD, "Unknown field '" + path + "'", root.start(), end));
            }
        }

        @Override
        public Void visitLiteral(Literal node) {
            return null;
        }

        @Override
        public Void visitIdentifier(Identifier node) {
            if (!node.isVariable()) {
                fieldReference(node, node.name(), node.end());
            }
            return null;
        }

        @Override
        public Void visitMember(MemberExpression node) {
            // Unwind the chain down to its root, remembering computed keys to walk afterwards.
            Deque<MemberExpression> chain = new ArrayDeque<>();
            Node current = node;
            while (current instanceof MemberExpression member) {
                chain.push(member);
                current = member.object();
            }
            if (current instanceof Identifier root && !root.isVariable()) {
                StringBuilder path = new StringBuilder(root.name());
                int end = root.end();
                for (MemberExpression member : chain) {
                    if (member.computed()) {
                        break;
                    }
                    path.append('.').append(((Identifier) member.property()).name());
                    end = member.end();
                }
                fieldReference(root, path.toString(), end);
            } else {
                walk(current);
            }
            for (MemberExpression member : chain) {
                if (member.computed()) {
                    walk(member.property());
                }
            }
            return null;
        }

        @Override
        public Void visitArray(ArrayExpression node) {
            node.elements().forEach(this::walk);
            return null;
        }

        @Override
        public Void visitObject(ObjectExpression node) {
            node.entries().forEach(e -> walk(e.value()));
            return null;
        }

        @Override
        public Void visitUnary(UnaryExpression node) {
            walk(node.argument());
            return null;
        }

        @Override
        public Void visitBinary(BinaryExpression node) {
            walk(node.left());
            walk(node.right());
            return null;
        }

        @Override
        public Void visitLogical(LogicalExpression node) {
            walk(node.left());
            walk(node.right());
            return null;
        }

        @Override
        public Void visitConditional(ConditionalExpression node) {
            walk(node.test());
            walk(node.consequent());
            walk(node.alternate());
            return null;
        }

        @Override
        public Void visitCall(CallExpression node) {
            Optional<String> name = node.calleeName();
            if (name.isPresent()) {
                String upper = name.get().toUpperCase(Locale.ROOT);
                functions.add(upper);
                Optional<FunctionDefinition> function = registry.find(upper);
                if (function.isEmpty()) {
                    errors.add(new ValidationError(
                            ValidationError.Type.UNKNOWN_FUNCTION,
                            "Unknown function '" + name.get() + "'",
                            node.callee().start(),
                            node.callee().end()));
                } else {
                    String arity = function.get().arityProblem(node.arguments().size());
                    if (arity != null) {
                        errors.add(new ValidationError(
                                ValidationError.Type.ARITY, arity, node.start(), node.end()));
                    }
                }
            } else {
                walk(node.callee());
            }
            node.arguments().forEach(this::walk);
            return null;
        }
    }
}
