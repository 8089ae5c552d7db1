package io.flowforge.formula.core.function;

import io.flowforge.formula.core.value.ValueType;
import java.util.Objects;

/**
 * One declared parameter of a {@link FunctionDefinition}.
 *
 * @param name        display name
 * @param type        accepted value type; {@link ValueType#ANY} also accepts null
 * @param required    whether the argument must be supplied
 * @param description one-line help text
 * @param variadic    whether this (last) parameter absorbs all remaining arguments
 */
public record FunctionParameter(String name, ValueType type, boolean required, String description, boolean variadic) {

    public FunctionParameter {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(description, "description must not be null");
    }
}
