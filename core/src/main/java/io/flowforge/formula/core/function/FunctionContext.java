package io.flowforge.formula.core.function;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * The slice of the evaluation context that function implementations may read. Only {@code
 * LOOKUP} reads datasets, and only {@code NOW}/{@code TODAY} read the clock.
 */
public interface FunctionContext {

    /** Records of the named dataset, or empty if no such dataset is in scope. */
    Optional<List<ObjectNode>> dataset(String name);

    /** Clock used for the current date and time. */
    Clock clock();
}
