package io.flowforge.formula.core.calc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.flowforge.formula.core.eval.EvaluationContext;
import io.flowforge.formula.core.eval.EvaluationError;
import io.flowforge.formula.core.eval.EvaluationResult;
import io.flowforge.formula.core.eval.Evaluator;
import io.flowforge.formula.core.parser.ParseResult;
import io.flowforge.formula.core.parser.Parser;
import io.flowforge.formula.core.validate.Validator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recomputes calculated fields in dependency order. Each result is added to the fields that
 * later formulas see, so {@code total = subtotal + tax} works when {@code subtotal} and
 * {@code tax} are themselves calculated.
 */
public final class Recalculator {

    private static final Logger LOG = LoggerFactory.getLogger(Recalculator.class);

    private final Parser parser;
    private final Evaluator evaluator;
    private final Validator validator;

    public Recalculator(Parser parser, Evaluator evaluator, Validator validator) {
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator must not be null");
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
    }

    public RecalculationResult recalculate(List<CalculatedField> fields, EvaluationContext context) {
        EvaluationContext current = context != null ? context : EvaluationContext.empty();
        DependencyGraph graph = DependencyGraph.build(fields, validator);
        Map<String, CalculatedField> byId = fields.stream()
                .collect(Collectors.toMap(CalculatedField::id, Function.identity(), (a, b) -> a, LinkedHashMap::new));

        ObjectNode values = JsonNodeFactory.instance.objectNode();
        Map<String, EvaluationError> errors = new LinkedHashMap<>();
        for (String id : graph.order()) {
            CalculatedField field = byId.get(id);
            EvaluationResult result = evaluate(field.formula(), current);
            JsonNode value;
            if (result.isSuccess()) {
                value = result.value();
            } else if (field.fallbackValue() != null) {
                LOG.debug("Calculated field failed, using fallback: field={}, error={}", id, result.error().message());
                value = field.fallbackValue();
            } else {
                errors.put(id, result.error());
                continue;
            }
            values.set(id, value);
            current = current.withField(id, value);
        }
        for (String id : graph.cyclicFields()) {
            CalculatedField field = byId.get(id);
            if (field.fallbackValue() != null) {
                values.set(id, field.fallbackValue());
            } else {
                errors.put(id, new EvaluationError(
                        EvaluationError.Kind.RUNTIME, "Circular dependency involving field '" + id + "'", -1, null, null));
            }
        }
        if (graph.hasCycles()) {
            LOG.warn("Circular calculated-field dependencies: fields={}", graph.cyclicFields());
        }
        return new RecalculationResult(values, errors);
    }

    private EvaluationResult evaluate(String formula, EvaluationContext context) {
        ParseResult parsed = parser.parse(formula);
        if (!parsed.isSuccess()) {
            return EvaluationResult.failure(EvaluationError.fromParse(parsed.error()));
        }
        return evaluator.evaluate(parsed.ast(), context);
    }
}
