package io.flowforge.formula.core.function;

import java.util.Objects;

/**
 * A documented call and its expected result, shown in editor help.
 *
 * @param call     the formula text, e.g. {@code ROUND(3.14159, 2)}
 * @param expected the result as displayed, e.g. {@code 3.14}
 */
public record FunctionExample(String call, String expected) {

    public FunctionExample {
        Objects.requireNonNull(call, "call must not be null");
        Objects.requireNonNull(expected, "expected must not be null");
    }
}
