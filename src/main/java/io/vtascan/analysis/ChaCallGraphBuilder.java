package io.vtascan.analysis;

import io.vtascan.ir.Builtin;
import io.vtascan.ir.CallCommon;
import io.vtascan.ir.CallInstruction;
import io.vtascan.ir.Function;
import io.vtascan.ir.Program;
import io.vtascan.model.CallGraph;
import io.vtascan.types.InterfaceType;
import io.vtascan.types.Signature;
import io.vtascan.types.Type;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a call graph by class hierarchy analysis.
 * <p>
 * An interface invocation may call the method of every concrete type implementing the interface,
 * and a call through a function value may call every function without receiver whose signature is
 * identical to the value's type.
 */
public class ChaCallGraphBuilder {

    private static final Logger logger = LogManager.getLogger(ChaCallGraphBuilder.class);

    private final Program program;

    public ChaCallGraphBuilder(Program program) {
        this.program = program;
    }

    public CallGraph build() {
        Map<Signature, List<Function>> funcsBySig = new HashMap<>();
        for (Function fn : program.functions()) {
            if (!fn.isMethod()) {
                funcsBySig.computeIfAbsent(fn.signature(), k -> new ArrayList<>()).add(fn);
            }
        }
        List<Type> concreteTypes = program.concreteTypes();
        Map<InterfaceType, List<Type>> implementations = new HashMap<>();

        CallGraph.Builder builder = new CallGraph.Builder();
        for (Function fn : program.functions()) {
            builder.addFunction(fn);
            for (CallInstruction site : fn.callInstructions()) {
                CallCommon common = site.common();
                if (common.value() instanceof Builtin) {
                    continue;
                }
                Function staticCallee = common.staticCallee();
                if (staticCallee != null) {
                    builder.addEdge(site, staticCallee);
                } else if (common.isInvoke()) {
                    InterfaceType iface = (InterfaceType) common.value().type().underlying();
                    List<Type> impls = implementations.computeIfAbsent(iface, k -> concreteTypes.stream()
                            .filter(t -> program.implementsInterface(t, k))
                            .toList());
                    for (Type t : impls) {
                        Function method = program.lookupMethod(t, common.method().name());
                        if (method != null) {
                            builder.addEdge(site, method);
                        }
                    }
                } else {
                    for (Function callee : funcsBySig.getOrDefault(common.signature(), List.of())) {
                        builder.addEdge(site, callee);
                    }
                }
            }
        }
        CallGraph graph = builder.build();
        logger.debug("CHA call graph: {} functions, {} edges", graph.functionCount(), graph.edgeCount());
        return graph;
    }
}
