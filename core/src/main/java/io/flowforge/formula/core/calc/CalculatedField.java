package io.flowforge.formula.core.calc;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;

/**
 * A form field whose value is computed from a formula.
 *
 * @param id            field name; later formulas refer to the result by this name
 * @param formula       source text
 * @param fallbackValue value used when the formula fails, or {@code null} to report the failure
 */
public record CalculatedField(String id, String formula, JsonNode fallbackValue) {

    public CalculatedField {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(formula, "formula must not be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
    }

    public CalculatedField(String id, String formula) {
        this(id, formula, null);
    }
}
