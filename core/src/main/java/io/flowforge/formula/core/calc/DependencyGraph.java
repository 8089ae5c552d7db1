package io.flowforge.formula.core.calc;

import io.flowforge.formula.core.validate.Validator;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Evaluation order for a set of calculated fields.
 *
 * <p>A field depends on every other calculated field its formula references. {@link #order()}
 * lists the fields so that each comes after its dependencies (Kahn's algorithm, ties broken by
 * declaration order). Fields on a dependency cycle, or depending on one, cannot be ordered and
 * are listed in {@link #cyclicFields()} instead.
 */
public final class DependencyGraph {

    private final Map<String, Set<String>> dependencies;
    private final List<String> order;
    private final Set<String> cyclicFields;

    private DependencyGraph(Map<String, Set<String>> dependencies, List<String> order, Set<String> cyclicFields) {
        this.dependencies = dependencies;
        this.order = order;
        this.cyclicFields = cyclicFields;
    }

    /**
     * Builds the graph. Formulas that do not parse have no dependencies; their error surfaces
     * when they are evaluated.
     *
     * @throws IllegalArgumentException if two fields share an id
     */
    public static DependencyGraph build(List<CalculatedField> fields, Validator validator) {
        Map<String, CalculatedField> byId = new LinkedHashMap<>();
        for (CalculatedField field : fields) {
            if (byId.put(field.id(), field) != null) {
                throw new IllegalArgumentException("Duplicate calculated field: " + field.id());
            }
        }
        Map<String, Set<String>> deps = new LinkedHashMap<>();
        for (CalculatedField field : fields) {
            Set<String> refs = new LinkedHashSet<>(validator.validate(field.formula()).referencedFields());
            refs.retainAll(byId.keySet());
            deps.put(field.id(), Collections.unmodifiableSet(refs));
        }

        Map<String, Integer> pending = new LinkedHashMap<>();
        Map<String, List<String>> dependents = new LinkedHashMap<>();
        deps.forEach((id, refs) -> {
            pending.put(id, refs.size());
            refs.forEach(ref -> dependents.computeIfAbsent(ref, k -> new ArrayList<>()).add(id));
        });
        Deque<String> ready = new ArrayDeque<>();
        pending.forEach((id, count) -> {
            if (count == 0) {
                ready.add(id);
            }
        });
        List<String> order = new ArrayList<>();
        while (!ready.isEmpty()) {
            String id = ready.poll();
            order.add(id);
            for (String dependent : dependents.getOrDefault(id, List.of())) {
                if (pending.merge(dependent, -1, Integer::sum) == 0) {
                    ready.add(dependent);
                }
            }
        }
        Set<String> cyclic = new LinkedHashSet<>(deps.keySet());
        order.forEach(cyclic::remove);
        return new DependencyGraph(
                Collections.unmodifiableMap(deps),
                List.copyOf(order),
                Collections.unmodifiableSet(cyclic));
    }

    /** Calculated fields each field depends on directly. */
    public Map<String, Set<String>> dependencies() {
        return dependencies;
    }

    /** Fields in evaluation order, excluding cyclic ones. */
    public List<String> order() {
        return order;
    }

    /** Fields that cannot be ordered because of a cycle. */
    public Set<String> cyclicFields() {
        return cyclicFields;
    }

    public boolean hasCycles() {
        return !cyclicFields.isEmpty();
    }
}
