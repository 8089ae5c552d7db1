package io.flowforge.formula.core.function;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Body of a built-in function. Arity and declared parameter types have already been checked
 * when it runs. Implementations must be pure apart from reading {@link Arguments#context()} and
 * report user-facing failures through {@link Arguments#fail(int, String)}.
 */
@FunctionalInterface
public interface FunctionImplementation {

    JsonNode apply(Arguments args);
}
