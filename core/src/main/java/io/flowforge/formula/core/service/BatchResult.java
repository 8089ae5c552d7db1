package io.flowforge.formula.core.service;

import io.flowforge.formula.core.eval.EvaluationResult;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Per-formula results of a batch evaluation, keyed by id in submission order. */
public record BatchResult(Map<String, EvaluationResult> results) {

    public BatchResult {
        results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
    }

    public EvaluationResult result(String id) {
        return results.get(id);
    }

    public boolean allSucceeded() {
        return results.values().stream().allMatch(EvaluationResult::isSuccess);
    }
}
