package io.vtascan.analysis;

import io.vtascan.graph.Node;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * An immutable mapping from flow graph nodes to the types that can reach them.
 */
public final class TypeSets {

    private final Map<Node, Set<PropType>> types;

    TypeSets(Map<Node, ? extends Set<PropType>> types) {
        Map<Node, Set<PropType>> copy = new LinkedHashMap<>();
        types.forEach((node, set) -> {
            if (!set.isEmpty()) {
                copy.put(node, Collections.unmodifiableSet(new LinkedHashSet<>(set)));
            }
        });
        this.types = Collections.unmodifiableMap(copy);
    }

    public static TypeSets empty() {
        return new TypeSets(Map.of());
    }

    /**
     * Returns the types reaching {@code node}, empty for nodes without types or outside the graph.
     */
    public Set<PropType> get(Node node) {
        return types.getOrDefault(node, Set.of());
    }

    /**
     * Returns the nodes with a non-empty type set.
     */
    public Set<Node> nodes() {
        return types.keySet();
    }

    /**
     * Returns the number of (node, type) pairs.
     */
    public int size() {
        return types.values().stream().mapToInt(Set::size).sum();
    }

    /**
     * Reports whether every type of every node here is also present in {@code other}.
     */
    public boolean isSubsetOf(TypeSets other) {
        return types.entrySet().stream().allMatch(e -> other.get(e.getKey()).containsAll(e.getValue()));
    }

    /**
     * Renders one sorted line per node, {@code node: t_1, ..., t_n}.
     */
    public List<String> toLines() {
        return types.entrySet().stream()
                .map(e -> e.getKey() + ": " + String.join(", ", e.getValue().stream()
                        .map(PropType::toString)
                        .sorted()
                        .toList()))
                .sorted()
                .toList();
    }

    @Override
    public String toString() {
        return "TypeSets[" + types.size() + " nodes, " + size() + " types]";
    }
}
