package io.flowforge.formula.core.function;

import java.util.Locale;
import java.util.Optional;

/** Grouping of built-in functions for documentation and editor palettes. */
public enum FunctionCategory {
    MATH,
    TEXT,
    DATE,
    LOGIC,
    AGGREGATE,
    ARRAY,
    LOOKUP,
    CONVERSION;

    /** Lower-case name used in JSON output and URLs. */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Case-insensitive lookup by name. */
    public static Optional<FunctionCategory> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        for (FunctionCategory category : values()) {
            if (category.name().equalsIgnoreCase(label.trim())) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }
}
