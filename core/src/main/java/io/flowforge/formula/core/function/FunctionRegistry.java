package io.flowforge.formula.core.function;

import io.flowforge.formula.core.function.builtin.AggregateFunctions;
import io.flowforge.formula.core.function.builtin.ArrayFunctions;
import io.flowforge.formula.core.function.builtin.ConversionFunctions;
import io.flowforge.formula.core.function.builtin.DateFunctions;
import io.flowforge.formula.core.function.builtin.LogicFunctions;
import io.flowforge.formula.core.function.builtin.LookupFunctions;
import io.flowforge.formula.core.function.builtin.MathFunctions;
import io.flowforge.formula.core.function.builtin.TextFunctions;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable catalogue of {@link FunctionDefinition}s, looked up case-insensitively by name.
 *
 * <p>
 * Built once through {@link #builder()} and never modified afterwards, so a single instance is
 * safely shared by every thread. {@link #standard()} returns the process-wide registry of
 * built-in functions.
 */
public final class FunctionRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(FunctionRegistry.class);

    private final Map<String, FunctionDefinition> functions;
    private final Map<FunctionCategory, List<FunctionDefinition>> byCategory;

    private FunctionRegistry(Map<String, FunctionDefinition> functions) {
        this.functions = Collections.unmodifiableMap(functions);
        Map<FunctionCategory, List<FunctionDefinition>> grouped = new EnumMap<>(FunctionCategory.class);
        for (FunctionDefinition fn : functions.values()) {
            grouped.computeIfAbsent(fn.category(), c -> new ArrayList<>()).add(fn);
        }
        grouped.replaceAll((c, list) -> List.copyOf(list));
        this.byCategory = Collections.unmodifiableMap(grouped);
    }

    /** The shared registry of built-in functions. */
    public static FunctionRegistry standard() {
        return StandardHolder.INSTANCE;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Looks up a function by name, ignoring case. */
    public Optional<FunctionDefinition> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(functions.get(name.toUpperCase(Locale.ROOT)));
    }

    public boolean contains(String name) {
        return find(name).isPresent();
    }

    /** All functions in registration order. */
    public List<FunctionDefinition> list() {
        return List.copyOf(functions.values());
    }

    /** Functions of one category in registration order; empty if the category has none. */
    public List<FunctionDefinition> byCategory(FunctionCategory category) {
        return byCategory.getOrDefault(category, List.of());
    }

    /** Function count per category, in enum order, omitting empty categories. */
    public Map<FunctionCategory, Integer> categories() {
        Map<FunctionCategory, Integer> counts = new LinkedHashMap<>();
        byCategory.forEach((category, list) -> counts.put(category, list.size()));
        return counts;
    }

    /** All registered names, upper-case. */
    public Collection<String> names() {
        return functions.keySet();
    }

    public int size() {
        return functions.size();
    }

    /** Collects definitions; duplicate names are rejected. */
    public static final class Builder {

        private final Map<String, FunctionDefinition> functions = new LinkedHashMap<>();

        Builder() {}

        /**
         * Adds a function definition.
         *
         * @throws IllegalArgumentException if a function with the same name is already present
         */
        public Builder register(FunctionDefinition definition) {
            String key = definition.name().toUpperCase(Locale.ROOT);
            if (functions.putIfAbsent(key, definition) != null) {
                throw new IllegalArgumentException("duplicate function name: " + key);
            }
            return this;
        }

        public Builder registerAll(Collection<FunctionDefinition> definitions) {
            definitions.forEach(this::register);
            return this;
        }

        public FunctionRegistry build() {
            return new FunctionRegistry(new LinkedHashMap<>(functions));
        }
    }

    private static final class StandardHolder {
        static final FunctionRegistry INSTANCE = createStandard();

        private static FunctionRegistry createStandard() {
            FunctionRegistry registry = builder()
                    .registerAll(MathFunctions.definitions())
                    .registerAll(TextFunctions.definitions())
                    .registerAll(DateFunctions.definitions())
                    .registerAll(LogicFunctions.definitions())
                    .registerAll(AggregateFunctions.definitions())
                    .registerAll(ArrayFunctions.definitions())
                    .registerAll(LookupFunctions.definitions())
                    .registerAll(ConversionFunctions.definitions())
                    .build();
            LOG.info(
                    "Function registry initialised: functions={}, categories={}",
                    registry.size(),
                    registry.categories().size());
            return registry;
        }
    }
}
