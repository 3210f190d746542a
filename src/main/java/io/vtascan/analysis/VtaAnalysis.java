package io.vtascan.analysis;

import io.vtascan.graph.FlowGraph;
import io.vtascan.ir.Function;
import io.vtascan.ir.Program;
import io.vtascan.model.CallGraph;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collection;

/**
 * Variable type analysis: builds a type flow graph over the program, propagates concrete types
 * through it and resolves dynamic call sites with the result.
 * <p>
 * The returned call graph always contains every edge of the baseline graph.
 *
 * <pre>{@code
 * Program program = ...;
 * CallGraph cha = new ChaCallGraphBuilder(program).build();
 * VtaResult result = new VtaAnalysis(program).analyze(program.functions(), cha);
 * }</pre>
 */
public class VtaAnalysis {

    private static final Logger logger = LogManager.getLogger(VtaAnalysis.class);

    private final Program program;
    private final int parallelism;
    private final TypePropagation.RoundObserver observer;

    public VtaAnalysis(Program program) {
        this(program, 1, null);
    }

    /**
     * @param program     The analyzed program
     * @param parallelism Threads used to build the flow graph
     * @param observer    Notified after each propagation round, may be null
     */
    public VtaAnalysis(Program program, int parallelism, TypePropagation.RoundObserver observer) {
        this.program = program;
        this.parallelism = parallelism;
        this.observer = observer;
    }

    /**
     * Analyzes all functions of the program against its class hierarchy call graph.
     */
    public VtaResult analyze() {
        return analyze(program.functions(), new ChaCallGraphBuilder(program).build());
    }

    /**
     * Analyzes {@code functions}, using {@code baseline} for the callees of call sites when
     * connecting arguments and results.
     */
    public VtaResult analyze(Collection<Function> functions, CallGraph baseline) {
        logger.debug("Analyzing {} functions, baseline has {} edges", functions.size(), baseline.edgeCount());

        FlowGraph flowGraph = new FlowGraphBuilder(baseline, parallelism).build(functions);
        TypeSets types = new TypePropagation(program, observer).propagate(flowGraph);
        CallGraph resolved = new CallResolver(program).resolve(functions, types);

        CallGraph callGraph = new CallGraph.Builder()
                .addAll(baseline)
                .addAll(resolved)
                .build();
        VtaResult result = new VtaResult(flowGraph, types, baseline, resolved, callGraph);
        logger.debug("Call graph has {} edges ({} added to baseline)", callGraph.edgeCount(), result.addedEdgeCount());
        return result;
    }
}
