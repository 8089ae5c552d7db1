package io.flowforge.formula.core.eval;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.flowforge.formula.core.function.FunctionContext;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only inputs of one evaluation.
 *
 * <ul>
 * <li>{@code fields}: named values that bare identifiers resolve against ({@code price},
 * {@code order.total})</li>
 * <li>{@code datasets}: named record lists, reachable only through {@code LOOKUP}</li>
 * <li>{@code variables}: values for {@code $name} references; {@code $now} and {@code $today}
 * default to the clock</li>
 * <li>{@code clock}: source of the current time for {@code NOW}, {@code TODAY} and the system
 * variables (default: system UTC)</li>
 * </ul>
 *
 * <p>The canonical constructor takes deep copies, so neither the caller nor the engine can
 * change a context once built. The engine never writes to it.
 */
public record EvaluationContext(
        ObjectNode fields, Map<String, List<ObjectNode>> datasets, ObjectNode variables, Clock clock)
        implements FunctionContext {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    /** Canonical constructor with defensive copies. */
    public EvaluationContext {
        fields = fields != null ? fields.deepCopy() : NODES.objectNode();
        variables = variables != null ? variables.deepCopy() : NODES.objectNode();
        clock = clock != null ? clock : Clock.systemUTC();
        if (datasets == null) {
            datasets = Map.of();
        } else {
            Map<String, List<ObjectNode>> copy = new LinkedHashMap<>();
            datasets.forEach((name, records) -> {
                List<ObjectNode> recordCopies = new ArrayList<>(records.size());
                records.forEach(r -> recordCopies.add(r.deepCopy()));
                copy.put(name, Collections.unmodifiableList(recordCopies));
            });
            datasets = Collections.unmodifiableMap(copy);
        }
    }

    /** Creates an empty context (no fields, datasets or variables; system UTC clock). */
    public static EvaluationContext empty() {
        return new EvaluationContext(null, null, null, null);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads a context from its JSON form:
     *
     * <pre>{@code
     * {"fields": {...}, "variables": {...}, "datasets": {"employees": [{...}, {...}]}}
     * }</pre>
     *
     * Non-object dataset entries are ignored.
     *
     * @throws IllegalArgumentException if a section has the wrong JSON type
     */
    public static EvaluationContext fromJson(JsonNode json) {
        Builder builder = builder();
        if (json == null || json.isNull() || json.isMissingNode()) {
            return builder.build();
        }
        if (!json.isObject()) {
            throw new IllegalArgumentException("context must be a JSON object");
        }
        JsonNode fields = json.path("fields");
        if (!fields.isMissingNode() && !fields.isNull()) {
            if (!fields.isObject()) {
                throw new IllegalArgumentException("context.fields must be a JSON object");
            }
            builder.fields((ObjectNode) fields);
        }
        JsonNode variables = json.path("variables");
        if (!variables.isMissingNode() && !variables.isNull()) {
            if (!variables.isObject()) {
                throw new IllegalArgumentException("context.variables must be a JSON object");
            }
            variables.fields().forEachRemaining(e -> builder.variable(e.getKey(), e.getValue()));
        }
        JsonNode datasets = json.path("datasets");
        if (!datasets.isMissingNode() && !datasets.isNull()) {
            if (!datasets.isObject()) {
                throw new IllegalArgumentException("context.datasets must be a JSON object");
            }
            Iterator<Map.Entry<String, JsonNode>> it = datasets.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                if (!entry.getValue().isArray()) {
                    throw new IllegalArgumentException("context.datasets." + entry.getKey() + " must be an array");
                }
                List<ObjectNode> records = new ArrayList<>();
                entry.getValue().forEach(r -> {
                    if (r.isObject()) {
                        records.add((ObjectNode) r);
                    }
                });
                builder.dataset(entry.getKey(), records);
            }
        }
        return builder.build();
    }

    /** The value of a field, or JSON null if absent. */
    public JsonNode field(String name) {
        JsonNode value = fields.get(name);
        return value != null ? value : NODES.nullNode();
    }

    /** A variable by name, with or without the leading {@code $}; empty if absent. */
    public Optional<JsonNode> variable(String name) {
        String key = name.startsWith("$") ? name.substring(1) : name;
        JsonNode value = variables.get(key);
        if (value == null) {
            value = variables.get("$" + key);
        }
        return Optional.ofNullable(value);
    }

    @Override
    public Optional<List<ObjectNode>> dataset(String name) {
        return Optional.ofNullable(datasets.get(name));
    }

    /** Returns a copy with one more field; used to chain results between formulas. */
    public EvaluationContext withField(String name, JsonNode value) {
        ObjectNode next = fields.deepCopy();
        next.set(name, value);
        return new EvaluationContext(next, datasets, variables, clock);
    }

    /** Incremental builder. */
    public static final class Builder {
        private final ObjectNode fields = NODES.objectNode();
        private final ObjectNode variables = NODES.objectNode();
        private final Map<String, List<ObjectNode>> datasets = new LinkedHashMap<>();
        private Clock clock;

        Builder() {}

        public Builder fields(ObjectNode values) {
            fields.setAll(Objects.requireNonNull(values, "values must not be null"));
            return this;
        }

        public Builder field(String name, JsonNode value) {
            fields.set(name, value);
            return this;
        }

        public Builder field(String name, String value) {
            fields.put(name, value);
            return this;
        }

        public Builder field(String name, double value) {
            fields.set(name, io.flowforge.formula.core.value.Values.number(value));
            return this;
        }

        public Builder field(String name, boolean value) {
            fields.put(name, value);
            return this;
        }

        public Builder variable(String name, JsonNode value) {
            variables.set(name.startsWith("$") ? name.substring(1) : name, value);
            return this;
        }

        public Builder dataset(String name, List<ObjectNode> records) {
            datasets.put(name, List.copyOf(records));
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public EvaluationContext build() {
            return new EvaluationContext(fields, datasets, variables, clock);
        }
    }
}
