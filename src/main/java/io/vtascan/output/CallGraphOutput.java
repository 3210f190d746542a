package io.vtascan.output;

import io.vtascan.ir.Function;
import io.vtascan.model.CallEdge;
import io.vtascan.model.CallGraph;

import java.io.PrintStream;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Outputs call graph information in various formats.
 */
public class CallGraphOutput {
    private final CallGraph callGraph;
    private final CallGraph baseline;
    private final PrintStream out;
    private final boolean useColor;
    private final Predicate<Function> hidden;

    // Track how many times each function is called (for collapsing duplicate leaf nodes)
    private Map<Function, Integer> callCounts;
    // Track which functions have already been printed with their full subtree
    private Set<Function> printedFunctions;

    // ANSI color codes
    private static final String RESET = "\u001B[0m";
    private static final String CYAN = "\u001B[36m";
    private static final String GREEN = "\u001B[32m";
    private static final String YELLOW = "\u001B[33m";
    private static final String DIM = "\u001B[2m";

    /**
     * @param callGraph The graph to print
     * @param baseline  The graph the analysis started from, null if there is none
     * @param out       Destination stream
     * @param useColor  Whether to emit ANSI colors
     * @param hidden    Functions whose incoming edges are left out
     */
    public CallGraphOutput(CallGraph callGraph, CallGraph baseline, PrintStream out, boolean useColor,
                           Predicate<Function> hidden) {
        this.callGraph = callGraph;
        this.baseline = baseline;
        this.out = out;
        this.useColor = useColor;
        this.hidden = hidden;
    }

    /**
     * Print call graph summary statistics.
     */
    public void printSummary() {
        out.println("=== CALLGRAPH SUMMARY ===");
        out.println("Total edges: " + callGraph.edgeCount());
        out.println("Total functions: " + callGraph.functionCount());
        out.println("Root functions (entry points): " + callGraph.roots().size());
        if (baseline != null) {
            out.println("Baseline edges: " + baseline.edgeCount());
            out.println("Edges added by analysis: " + (callGraph.edgeCount() - baseline.edgeCount()));
        }
        long dynamic = visibleEdges().filter(e -> !e.isStatic()).count();
        out.println("Dynamic call edges: " + dynamic);
        out.println();
    }

    /**
     * Print one sorted {@code caller -> callee} line per distinct edge.
     */
    public void printEdges() {
        visibleEdges()
                .map(CallEdge::describe)
                .distinct()
                .sorted()
                .forEach(out::println);
    }

    /**
     * Print root functions (entry points).
     */
    public void printRoots() {
        out.println("=== ROOT FUNCTIONS (Entry Points) ===");
        callGraph.roots().stream()
                .filter(hidden.negate())
                .map(Function::qualifiedName)
                .sorted()
                .forEach(name -> out.println(color(CYAN, name)));
        out.println();
    }

    /**
     * Pre-compute how many times each function is called as a callee.
     * This is used to collapse duplicate leaf nodes in output.
     */
    private void computeCallCounts() {
        callCounts = new HashMap<>();
        visibleEdges().forEach(edge -> callCounts.merge(edge.callee(), 1, Integer::sum));
    }

    /**
     * Print call tree starting from root functions.
     */
    public void printCallTree() {
        out.println("=== CALL GRAPH ===");

        computeCallCounts();
        printedFunctions = new HashSet<>();

        List<Function> roots = callGraph.roots().stream()
                .filter(hidden.negate())
                .filter(this::hasOutgoingCalls)
                .sorted(Comparator.comparing(Function::name))
                .toList();

        for (Function root : roots) {
            out.println(color(GREEN, root.name()) + ":");
            printCallTreeRecursive(root, 2, new HashSet<>());
        }
        out.println();
    }

    private void printCallTreeRecursive(Function fn, int indent, Set<Function> visited) {
        if (!visited.add(fn)) {
            return;  // Already being visited in this path
        }

        List<CallEdge> sortedCallees = outgoing(fn).stream()
                .sorted(Comparator.comparing((CallEdge e) -> e.callee().name()).thenComparing(this::kind))
                .toList();

        Set<Function> seenCallees = new HashSet<>();
        for (CallEdge edge : sortedCallees) {
            Function callee = edge.callee();
            if (!seenCallees.add(callee)) {
                continue;
            }
            String label = color(YELLOW, kind(edge)) + " " + callee.name();

            int count = callCounts.getOrDefault(callee, 1);
            String countSuffix = count > 1 ? color(DIM, " (×" + count + ")") : "";

            if (visited.contains(callee)) {
                out.println(spaces(indent) + label + color(DIM, " (cycle)") + countSuffix);
            } else if (printedFunctions.contains(callee)) {
                // subtree already printed elsewhere
                out.println(spaces(indent) + label + countSuffix);
            } else if (hasOutgoingCalls(callee)) {
                printedFunctions.add(callee);
                out.println(spaces(indent) + label + ":" + countSuffix);
                printCallTreeRecursive(callee, indent + 2, visited);
            } else {
                out.println(spaces(indent) + label + countSuffix);
            }
        }

        visited.remove(fn);  // Backtrack for other paths
    }

    /**
     * Print full call graph output.
     */
    public void printFull() {
        printSummary();
        printRoots();
        printCallTree();
    }

    private String kind(CallEdge edge) {
        if (edge.isStatic()) {
            return "STATIC";
        }
        return edge.isInvoke() ? "INVOKE" : "DYNAMIC";
    }

    private List<CallEdge> outgoing(Function fn) {
        return callGraph.callees(fn).stream()
                .filter(e -> !hidden.test(e.callee()))
                .toList();
    }

    private Stream<CallEdge> visibleEdges() {
        return callGraph.allEdges()
                .filter(e -> !hidden.test(e.caller()) && !hidden.test(e.callee()));
    }

    private boolean hasOutgoingCalls(Function fn) {
        return !outgoing(fn).isEmpty();
    }

    private String spaces(int count) {
        return " ".repeat(count);
    }

    private String color(String code, String text) {
        if (useColor) {
            return code + text + RESET;
        }
        return text;
    }
}
