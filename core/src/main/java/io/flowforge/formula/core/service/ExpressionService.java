package io.flowforge.formula.core.service;

import io.flowforge.formula.core.ast.Node;
import io.flowforge.formula.core.calc.CalculatedField;
import io.flowforge.formula.core.calc.RecalculationResult;
import io.flowforge.formula.core.calc.Recalculator;
import io.flowforge.formula.core.error.FormulaException;
import io.flowforge.formula.core.error.FormulaLexException;
import io.flowforge.formula.core.error.FormulaLimitException;
import io.flowforge.formula.core.eval.EvaluationContext;
import io.flowforge.formula.core.eval.EvaluationError;
import io.flowforge.formula.core.eval.EvaluationResult;
import io.flowforge.formula.core.eval.Evaluator;
import io.flowforge.formula.core.function.FunctionCategory;
import io.flowforge.formula.core.function.FunctionDefinition;
import io.flowforge.formula.core.function.FunctionRegistry;
import io.flowforge.formula.core.lexer.Token;
import io.flowforge.formula.core.lexer.TokenType;
import io.flowforge.formula.core.lexer.Tokenizer;
import io.flowforge.formula.core.parser.ExpressionLimits;
import io.flowforge.formula.core.parser.ParseError;
import io.flowforge.formula.core.parser.ParseResult;
import io.flowforge.formula.core.parser.Parser;
import io.flowforge.formula.core.validate.ValidationResult;
import io.flowforge.formula.core.validate.Validator;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point to the formula engine. Hosts parse, evaluate and validate formulas through this
 * facade and never touch the parser or evaluator directly.
 *
 * <p>None of the operations throw on malformed user input: failures come back inside the
 * result objects. The service holds only immutable state and is safe to share between threads.
 */
public final class ExpressionService {

    private static final Logger LOG = LoggerFactory.getLogger(ExpressionService.class);

    private static final List<String> SYSTEM_VARIABLES = List.of("$now", "$today");

    private final FunctionRegistry registry;
    private final ExpressionLimits limits;
    private final Parser parser;
    private final Evaluator evaluator;
    private final Validator validator;
    private final Recalculator recalculator;

    /** Creates a service with the standard function library and default limits. */
    public ExpressionService() {
        this(FunctionRegistry.standard(), ExpressionLimits.DEFAULT);
    }

    public ExpressionService(FunctionRegistry registry, ExpressionLimits limits) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.limits = Objects.requireNonNull(limits, "limits must not be null");
        this.parser = new Parser(limits);
        this.evaluator = new Evaluator(registry, limits);
        this.validator = new Validator(parser, registry);
        this.recalculator = new Recalculator(parser, evaluator, validator);
    }

    public FunctionRegistry registry() {
        return registry;
    }

    public ExpressionLimits limits() {
        return limits;
    }

    public ParseResult parse(String source) {
        return parser.parse(source);
    }

    public EvaluationResult evaluate(String source) {
        return evaluate(source, EvaluationContext.empty());
    }

    /** Parses and evaluates; a parse failure is reported as a failed evaluation. */
    public EvaluationResult evaluate(String source, EvaluationContext context) {
        ParseResult parsed = parser.parse(source);
        if (!parsed.isSuccess()) {
            return EvaluationResult.failure(EvaluationError.fromParse(parsed.error()));
        }
        return evaluator.evaluate(parsed.ast(), context);
    }

    /** Evaluates a pre-parsed formula, for callers that cache ASTs. */
    public EvaluationResult evaluate(Node ast, EvaluationContext context) {
        return evaluator.evaluate(ast, context);
    }

    public ValidationResult validate(String source) {
        return validator.validate(source);
    }

    /**
     * Validates a formula against the fields the caller can supply.
     *
     * @param knownFieldNames allowed field names or dotted paths; {@code null} skips field checks
     */
    public ValidationResult validate(String source, Set<String> knownFieldNames) {
        return validator.validate(source, knownFieldNames);
    }

    public List<FunctionDefinition> listFunctions() {
        return registry.list();
    }

    public List<FunctionDefinition> functionsByCategory(FunctionCategory category) {
        return registry.byCategory(category);
    }

    public Optional<FunctionDefinition> function(String name) {
        return registry.find(name);
    }

    public Map<FunctionCategory, Integer> categories() {
        return registry.categories();
    }

    /**
     * Classifies tokens for syntax highlighting. An identifier followed by {@code (} is a
     * function, {@code $name} is a variable, {@code true}, {@code false} and {@code null} are
     * literals, any other identifier is a field.
     */
    public TokenizeResult tokenize(String source) {
        String text = source == null ? "" : source;
        List<Token> tokens;
        try {
            if (text.length() > limits.maxFormulaLength()) {
                throw new FormulaLimitException(
                        "Formula exceeds maximum length of " + limits.maxFormulaLength() + " characters",
                        limits.maxFormulaLength(),
                        FormulaException.Phase.PARSE);
            }
            tokens = Tokenizer.tokenize(text);
        } catch (FormulaLexException | FormulaLimitException e) {
            LOG.debug("Tokenize failed: position={}, message={}", e.position(), e.getMessage());
            return new TokenizeResult(List.of(), ParseError.from(e, text));
        }
        List<HighlightToken> highlighted = new ArrayList<>(tokens.size());
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.is(TokenType.END)) {
                break;
            }
            highlighted.add(new HighlightToken(categorize(token, tokens.get(i + 1)), token.value(), token.position(),
                    token.end()));
        }
        return new TokenizeResult(highlighted, null);
    }

    private static HighlightToken.Category categorize(Token token, Token next) {
        TokenType type = token.type();
        if (type == TokenType.NUMBER || type == TokenType.STRING) {
            return HighlightToken.Category.LITERAL;
        }
        if (type == TokenType.IDENTIFIER) {
            String name = token.value();
            if (name.equals("true") || name.equals("false") || name.equals("null")) {
                return HighlightToken.Category.LITERAL;
            }
            if (name.startsWith("$")) {
                return HighlightToken.Category.VARIABLE;
            }
            return next.is(TokenType.LPAREN) ? HighlightToken.Category.FUNCTION : HighlightToken.Category.FIELD;
        }
        return type.isOperator() ? HighlightToken.Category.OPERATOR : HighlightToken.Category.PUNCTUATION;
    }

    /**
     * Autocomplete candidates for the identifier being typed before {@code cursor}: functions,
     * then fields, then system variables, each matching the typed prefix case-insensitively.
     * With no prefix every candidate matches.
     */
    public List<Suggestion> suggestions(String source, int cursor, List<String> availableFields) {
        String text = source == null ? "" : source;
        int end = Math.max(0, Math.min(cursor, text.length()));
        int start = end;
        while (start > 0 && isWordChar(text.charAt(start - 1))) {
            start--;
        }
        String prefix = text.substring(start, end).toLowerCase(Locale.ROOT);

        List<Suggestion> result = new ArrayList<>();
        for (FunctionDefinition fn : registry.list()) {
            if (fn.name().toLowerCase(Locale.ROOT).startsWith(prefix)) {
                result.add(new Suggestion(Suggestion.Kind.FUNCTION, fn.name(), fn.description(),
                        fn.category().label(), fn.name() + "(", 1));
            }
        }
        if (availableFields != null) {
            for (String field : availableFields) {
                if (field.toLowerCase(Locale.ROOT).startsWith(prefix)) {
                    result.add(new Suggestion(Suggestion.Kind.FIELD, field, null, null, field, 0));
                }
            }
        }
        for (String variable : SYSTEM_VARIABLES) {
            if (variable.startsWith(prefix) || variable.substring(1).startsWith(prefix)) {
                result.add(new Suggestion(Suggestion.Kind.VARIABLE, variable, "System variable " + variable, null,
                        variable, 0));
            }
        }
        return result;
    }

    private static boolean isWordChar(char c) {
        return c == '_' || c == '$' || Character.isLetterOrDigit(c);
    }

    /**
     * Evaluates formulas in order. Each successful result becomes a field named after its formula
     * id for the formulas that follow; failures do not stop the batch.
     */
    public BatchResult evaluateBatch(List<NamedFormula> formulas, EvaluationContext context) {
        EvaluationContext current = context != null ? context : EvaluationContext.empty();
        Map<String, EvaluationResult> results = new LinkedHashMap<>();
        for (NamedFormula formula : formulas) {
            EvaluationResult result = evaluate(formula.formula(), current);
            results.put(formula.id(), result);
            if (result.isSuccess()) {
                current = current.withField(formula.id(), result.value());
            }
        }
        LOG.debug("Batch evaluated: formulas={}", formulas.size());
        return new BatchResult(results);
    }

    /** Recomputes calculated fields in dependency order. */
    public RecalculationResult recalculate(List<CalculatedField> fields, EvaluationContext context) {
        return recalculator.recalculate(fields, context);
    }
}
