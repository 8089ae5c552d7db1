package io.flowforge.formula.core.service;

import java.util.Objects;

/** A formula with the id its result is published under in a batch. */
public record NamedFormula(String id, String formula) {

    public NamedFormula {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(formula, "formula must not be null");
    }
}
