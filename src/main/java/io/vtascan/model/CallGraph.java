package io.vtascan.model;

import io.vtascan.ir.CallInstruction;
import io.vtascan.ir.Function;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * A call graph: functions, and for each call site the functions it may call.
 * <p>
 * Instances are immutable; use {@link Builder} to create one.
 */
public final class CallGraph {

    private final Set<Function> functions;
    private final Map<Function, Set<CallEdge>> outgoingEdges;  // caller -> edges
    private final Map<Function, Set<CallEdge>> incomingEdges;  // callee -> edges
    private final Map<CallInstruction, Set<CallEdge>> siteEdges;

    private CallGraph(Set<Function> functions, Map<Function, Set<CallEdge>> outgoingEdges,
                      Map<Function, Set<CallEdge>> incomingEdges, Map<CallInstruction, Set<CallEdge>> siteEdges) {
        this.functions = Collections.unmodifiableSet(new LinkedHashSet<>(functions));
        this.outgoingEdges = deepCopyEdgeMap(outgoingEdges);
        this.incomingEdges = deepCopyEdgeMap(incomingEdges);
        this.siteEdges = deepCopyEdgeMap(siteEdges);
    }

    private static <K> Map<K, Set<CallEdge>> deepCopyEdgeMap(Map<K, Set<CallEdge>> map) {
        Map<K, Set<CallEdge>> copy = new LinkedHashMap<>();
        map.forEach((k, v) -> copy.put(k, Collections.unmodifiableSet(new LinkedHashSet<>(v))));
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Create an empty call graph.
     */
    public static CallGraph empty() {
        return new Builder().build();
    }

    /**
     * Get all edges leaving the given function.
     */
    public Set<CallEdge> callees(Function caller) {
        return outgoingEdges.getOrDefault(caller, Set.of());
    }

    /**
     * Get all edges entering the given function.
     */
    public Set<CallEdge> callers(Function callee) {
        return incomingEdges.getOrDefault(callee, Set.of());
    }

    /**
     * Get the functions a call site may call.
     */
    public Set<Function> calleesAt(CallInstruction site) {
        return siteEdges.getOrDefault(site, Set.of()).stream()
                .map(CallEdge::callee)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /**
     * Get all functions in the graph, including those without edges.
     */
    public Set<Function> functions() {
        return functions;
    }

    /**
     * Stream all edges.
     */
    public Stream<CallEdge> allEdges() {
        return outgoingEdges.values().stream().flatMap(Set::stream);
    }

    public int edgeCount() {
        return outgoingEdges.values().stream().mapToInt(Set::size).sum();
    }

    public int functionCount() {
        return functions.size();
    }

    /**
     * Get the functions nothing calls (entry points), in insertion order.
     */
    public List<Function> roots() {
        return functions.stream()
                .filter(f -> callers(f).stream().allMatch(e -> e.caller() == f))
                .toList();
    }

    /**
     * Check if every edge of {@code other} is also an edge of this graph.
     */
    public boolean containsAll(CallGraph other) {
        return other.allEdges().allMatch(e -> callees(e.caller()).contains(e))
                && functions.containsAll(other.functions);
    }

    /**
     * Get the distinct edges rendered as {@code caller -> callee}, sorted.
     */
    public List<String> edgeStrings() {
        return allEdges()
                .map(CallEdge::describe)
                .distinct()
                .sorted()
                .toList();
    }

    @Override
    public String toString() {
        return "CallGraph[" + functionCount() + " functions, " + edgeCount() + " edges]";
    }

    /**
     * Accumulates functions and edges. Duplicate edges are ignored.
     */
    public static final class Builder {

        private final Set<Function> functions = new LinkedHashSet<>();
        private final Map<Function, Set<CallEdge>> outgoing = new LinkedHashMap<>();
        private final Map<Function, Set<CallEdge>> incoming = new LinkedHashMap<>();
        private final Map<CallInstruction, Set<CallEdge>> bySite = new LinkedHashMap<>();

        public Builder addFunction(Function fn) {
            functions.add(fn);
            return this;
        }

        /**
         * Adds an edge from the function containing {@code site} to {@code callee}.
         */
        public Builder addEdge(CallInstruction site, Function callee) {
            return addEdge(new CallEdge(site.parent(), site, callee));
        }

        public Builder addEdge(CallEdge edge) {
            functions.add(edge.caller());
            functions.add(edge.callee());
            if (outgoing.computeIfAbsent(edge.caller(), k -> new LinkedHashSet<>()).add(edge)) {
                incoming.computeIfAbsent(edge.callee(), k -> new LinkedHashSet<>()).add(edge);
                bySite.computeIfAbsent(edge.site(), k -> new LinkedHashSet<>()).add(edge);
            }
            return this;
        }

        /**
         * Adds all functions and edges of another graph.
         */
        public Builder addAll(CallGraph graph) {
            functions.addAll(graph.functions());
            graph.allEdges().forEach(this::addEdge);
            return this;
        }

        public CallGraph build() {
            return new CallGraph(functions, outgoing, incoming, bySite);
        }
    }
}
