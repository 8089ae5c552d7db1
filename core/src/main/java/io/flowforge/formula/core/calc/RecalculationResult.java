package io.flowforge.formula.core.calc;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.flowforge.formula.core.eval.EvaluationError;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Values of all calculated fields after a recalculation, plus the failures that had no
 * fallback value. Failed fields without a fallback are absent from {@code values}.
 */
public record RecalculationResult(ObjectNode values, Map<String, EvaluationError> errors) {

    public RecalculationResult {
        values = values.deepCopy();
        errors = Collections.unmodifiableMap(new LinkedHashMap<>(errors));
    }

    public boolean isSuccess() {
        return errors.isEmpty();
    }
}
