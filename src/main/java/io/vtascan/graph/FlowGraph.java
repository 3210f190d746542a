package io.vtascan.graph;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiConsumer;

/**
 * A directed graph over {@link Node}s with deduplicated edges.
 * <p>
 * Edge insertion is safe under concurrent writers, so functions can be walked in parallel. Once
 * {@link #freeze()} is called the graph rejects further edges.
 */
public class FlowGraph {

    // source -> successors; only nodes with at least one outgoing edge are keys
    private final Map<Node, Set<Node>> successors = new ConcurrentHashMap<>();
    private final Set<Node> nodes = ConcurrentHashMap.newKeySet();
    private volatile boolean frozen;

    /**
     * Adds the edge {@code from -> to}.
     *
     * @return true if the edge was not present before
     */
    public boolean addEdge(Node from, Node to) {
        if (frozen) {
            throw new IllegalStateException("Flow graph is frozen, cannot add " + from + " -> " + to);
        }
        nodes.add(from);
        nodes.add(to);
        return successors.computeIfAbsent(from, k -> ConcurrentHashMap.newKeySet()).add(to);
    }

    /**
     * Returns the successors of a node, empty if it has none.
     */
    public Set<Node> successors(Node node) {
        Set<Node> succ = successors.get(node);
        return succ == null ? Set.of() : Collections.unmodifiableSet(succ);
    }

    public boolean hasEdge(Node from, Node to) {
        return successors(from).contains(to);
    }

    /**
     * Returns every node that is the source or target of an edge.
     */
    public Set<Node> nodes() {
        return Collections.unmodifiableSet(nodes);
    }

    /**
     * Returns the nodes with at least one successor.
     */
    public Set<Node> sources() {
        return Collections.unmodifiableSet(successors.keySet());
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return successors.values().stream().mapToInt(Set::size).sum();
    }

    public void forEachEdge(BiConsumer<Node, Node> action) {
        successors.forEach((from, succ) -> succ.forEach(to -> action.accept(from, to)));
    }

    /**
     * Renders one line per source node, {@code node -> succ_1, ..., succ_n}, with successors sorted
     * by their string form. Lines are sorted too.
     */
    public List<String> toLines() {
        return successors.entrySet().stream()
                .map(e -> e.getKey() + " -> " + String.join(", ", e.getValue().stream()
                        .map(Node::toString)
                        .sorted()
                        .toList()))
                .sorted()
                .toList();
    }

    public void freeze() {
        frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }
}
