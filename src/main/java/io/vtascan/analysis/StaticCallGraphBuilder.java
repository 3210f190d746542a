package io.vtascan.analysis;

import io.vtascan.ir.CallInstruction;
import io.vtascan.ir.Function;
import io.vtascan.ir.Program;
import io.vtascan.model.CallGraph;

/**
 * Builds a call graph containing only the edges of statically known callees.
 */
public class StaticCallGraphBuilder {

    private final Program program;

    public StaticCallGraphBuilder(Program program) {
        this.program = program;
    }

    public CallGraph build() {
        CallGraph.Builder builder = new CallGraph.Builder();
        for (Function fn : program.functions()) {
            builder.addFunction(fn);
            for (CallInstruction site : fn.callInstructions()) {
                Function callee = site.common().staticCallee();
                if (callee != null) {
                    builder.addEdge(site, callee);
                }
            }
        }
        return builder.build();
    }
}
