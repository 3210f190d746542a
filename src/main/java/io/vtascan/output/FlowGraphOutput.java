package io.vtascan.output;

import io.vtascan.analysis.TypeSets;
import io.vtascan.graph.FlowGraph;

import java.io.PrintStream;

/**
 * Prints the type flow graph and the propagated type sets, one sorted line per node.
 */
public class FlowGraphOutput {

    private static final String RESET = "\u001B[0m";
    private static final String CYAN = "\u001B[36m";
    private static final String DIM = "\u001B[2m";

    private final PrintStream out;
    private final boolean useColor;

    public FlowGraphOutput(PrintStream out, boolean useColor) {
        this.out = out;
        this.useColor = useColor;
    }

    /**
     * Print {@code node -> succ_1, ..., succ_n} lines.
     */
    public void printFlowGraph(FlowGraph graph) {
        out.println(color(DIM, "# " + graph.nodeCount() + " nodes, " + graph.edgeCount() + " edges"));
        for (String line : graph.toLines()) {
            out.println(highlight(line, " -> "));
        }
    }

    /**
     * Print {@code node: t_1, ..., t_n} lines.
     */
    public void printTypeSets(TypeSets types) {
        if (types.nodes().isEmpty()) {
            out.println("(no types propagated)");
            return;
        }
        out.println(color(DIM, "# " + types.nodes().size() + " nodes, " + types.size() + " types"));
        for (String line : types.toLines()) {
            out.println(highlight(line, ": "));
        }
    }

    private String highlight(String line, String separator) {
        int idx = line.indexOf(separator);
        if (!useColor || idx < 0) {
            return line;
        }
        return color(CYAN, line.substring(0, idx)) + line.substring(idx);
    }

    private String color(String code, String text) {
        if (useColor) {
            return code + text + RESET;
        }
        return text;
    }
}
