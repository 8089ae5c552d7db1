package io.flowforge.formula.core.function;

import com.fasterxml.jackson.databind.JsonNode;
import io.flowforge.formula.core.error.FormulaEvalException;
import io.flowforge.formula.core.value.ValueType;
import io.flowforge.formula.core.value.Values;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * A registered function: its documentation, its signature and its implementation.
 *
 * <p>
 * The canonical constructor enforces the signature rules: a non-empty example list, required
 * parameters before optional ones, and at most one variadic parameter, in last position.
 *
 * <p>
 * Immutable and thread-safe.
 */
public record FunctionDefinition(
        String name,
        FunctionCategory category,
        String description,
        List<FunctionParameter> parameters,
        ValueType returnType,
        List<FunctionExample> examples,
        FunctionImplementation implementation) {

    private static final Pattern NAME = Pattern.compile("[A-Z][A-Z0-9_]*");

    public FunctionDefinition {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(description, "description must not be null");
        Objects.requireNonNull(returnType, "returnType must not be null");
        Objects.requireNonNull(implementation, "implementation must not be null");
        parameters = List.copyOf(parameters);
        examples = List.copyOf(examples);
        if (!NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("function name must be upper-case, got: '" + name + "'");
        }
        if (examples.isEmpty()) {
            throw new IllegalArgumentException("function " + name + " must document at least one example");
        }
        boolean optionalSeen = false;
        for (int i = 0; i < parameters.size(); i++) {
            FunctionParameter p = parameters.get(i);
            if (p.variadic() && i != parameters.size() - 1) {
                throw new IllegalArgumentException("function " + name + ": variadic parameter '" + p.name()
                        + "' must be the last parameter");
            }
            if (p.required() && optionalSeen) {
                throw new IllegalArgumentException("function " + name + ": required parameter '" + p.name()
                        + "' follows an optional parameter");
            }
            optionalSeen |= !p.required();
        }
    }

    /** Starts a builder for a function definition. */
    public static Builder builder(String name, FunctionCategory category) {
        return new Builder(name, category);
    }

    public boolean isVariadic() {
        return !parameters.isEmpty() && parameters.get(parameters.size() - 1).variadic();
    }

    /** Fewest arguments a call may pass. A required variadic parameter needs one argument. */
    public int minArity() {
        return (int) parameters.stream().filter(FunctionParameter::required).count();
    }

    /** Most arguments a call may pass, {@link Integer#MAX_VALUE} for variadic functions. */
    public int maxArity() {
        return isVariadic() ? Integer.MAX_VALUE : parameters.size();
    }

    /** Returns the arity violation message for {@code count} arguments, or {@code null} if valid. */
    public String arityProblem(int count) {
        if (count < minArity()) {
            return name + " expects at least " + minArity() + " argument" + (minArity() == 1 ? "" : "s")
                    + " but got " + count;
        }
        if (count > maxArity()) {
            return name + " expects at most " + maxArity() + " argument" + (maxArity() == 1 ? "" : "s")
                    + " but got " + count;
        }
        return null;
    }

    /** Human-readable signature, e.g. {@code ROUND(number, [digits])}. */
    public String signature() {
        return parameters.stream()
                .map(p -> {
                    String label = p.variadic() ? p.name() + "..." : p.name();
                    return p.required() ? label : "[" + label + "]";
                })
                .collect(Collectors.joining(", ", name + "(", ")"));
    }

    /**
     * Checks arity and argument types, then runs the implementation.
     *
     * @throws FormulaEvalException if the call does not match the signature or the implementation
     *                              rejects its arguments; the exception carries no source position
     */
    public JsonNode invoke(List<JsonNode> args, FunctionContext context) {
        String arity = arityProblem(args.size());
        if (arity != null) {
            throw new FormulaEvalException(arity, -1, name, null);
        }
        for (int i = 0; i < args.size(); i++) {
            FunctionParameter param = parameterAt(i);
            JsonNode value = args.get(i);
            if (!accepts(param, value)) {
                throw new FormulaEvalException(
                        name + ": argument " + (i + 1) + " ('" + param.name() + "') expected "
                                + param.type().label() + " but got " + Values.typeName(value),
                        -1,
                        name,
                        i);
            }
        }
        JsonNode result = implementation.apply(new Arguments(name, args, context));
        return result == null ? Values.nullValue() : result;
    }

    /** The declared parameter governing the argument at {@code index}. */
    public FunctionParameter parameterAt(int index) {
        return index < parameters.size() ? parameters.get(index) : parameters.get(parameters.size() - 1);
    }

    private static boolean accepts(FunctionParameter param, JsonNode value) {
        if (param.type() == ValueType.ANY) {
            return true;
        }
        if (Values.isNull(value)) {
            // null is an omitted optional argument, a skipped aggregate value, or blank text
            return !param.required() || param.variadic() || param.type() == ValueType.STRING;
        }
        if (param.variadic() && value.isArray()) {
            return true;
        }
        return param.type().accepts(value);
    }

    /** Fluent builder; {@link #build()} applies the canonical constructor's checks. */
    public static final class Builder {
        private final String name;
        private final FunctionCategory category;
        private String description = "";
        private final List<FunctionParameter> parameters = new ArrayList<>();
        private ValueType returnType = ValueType.ANY;
        private final List<FunctionExample> examples = new ArrayList<>();
        private FunctionImplementation implementation;

        Builder(String name, FunctionCategory category) {
            this.name = name.toUpperCase(Locale.ROOT);
            this.category = category;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder param(String name, ValueType type, String description) {
            parameters.add(new FunctionParameter(name, type, true, description, false));
            return this;
        }

        public Builder optional(String name, ValueType type, String description) {
            parameters.add(new FunctionParameter(name, type, false, description, false));
            return this;
        }

        /** A trailing parameter taking one or more values. */
        public Builder variadic(String name, ValueType type, String description) {
            parameters.add(new FunctionParameter(name, type, true, description, true));
            return this;
        }

        /** A trailing parameter taking zero or more values. */
        public Builder optionalVariadic(String name, ValueType type, String description) {
            parameters.add(new FunctionParameter(name, type, false, description, true));
            return this;
        }

        public Builder returns(ValueType returnType) {
            this.returnType = returnType;
            return this;
        }

        public Builder example(String call, String expected) {
            examples.add(new FunctionExample(call, expected));
            return this;
        }

        public Builder implementation(FunctionImplementation implementation) {
            this.implementation = implementation;
            return this;
        }

        public FunctionDefinition build() {
            return new FunctionDefinition(
                    name, category, description, parameters, returnType, examples, implementation);
        }
    }
}
