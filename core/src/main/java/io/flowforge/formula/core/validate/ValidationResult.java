package io.flowforge.formula.core.validate;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Outcome of static validation. {@code referencedFields} holds root field names and
 * {@code referencedFunctions} upper-cased function names, both in first-occurrence order.
 * They are filled even when the formula has unknown references, and empty on syntax errors.
 */
public record ValidationResult(
        boolean valid, List<ValidationError> errors, Set<String> referencedFields, Set<String> referencedFunctions) {

    public ValidationResult {
        errors = List.copyOf(errors);
        referencedFields = Collections.unmodifiableSet(new LinkedHashSet<>(referencedFields));
        referencedFunctions = Collections.unmodifiableSet(new LinkedHashSet<>(referencedFunctions));
    }

    static ValidationResult of(List<ValidationError> errors, Set<String> fields, Set<String> functions) {
        return new ValidationResult(errors.isEmpty(), errors, fields, functions);
    }
}
