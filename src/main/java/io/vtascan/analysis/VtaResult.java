package io.vtascan.analysis;

import io.vtascan.graph.FlowGraph;
import io.vtascan.model.CallGraph;

/**
 * The outcome of one analysis run.
 *
 * @param flowGraph The type flow graph
 * @param types     The types reaching each flow graph node
 * @param baseline  The call graph the analysis started from
 * @param resolved  The edges derived from the type sets alone
 * @param callGraph The baseline graph extended with the resolved edges
 */
public record VtaResult(FlowGraph flowGraph, TypeSets types, CallGraph baseline, CallGraph resolved,
                        CallGraph callGraph) {

    /**
     * Returns the number of edges the analysis added on top of the baseline.
     */
    public int addedEdgeCount() {
        return callGraph.edgeCount() - baseline.edgeCount();
    }
}
