package io.vtascan.analysis;

import io.vtascan.graph.Node;
import io.vtascan.graph.Nodes;
import io.vtascan.ir.Builtin;
import io.vtascan.ir.CallCommon;
import io.vtascan.ir.CallInstruction;
import io.vtascan.ir.Function;
import io.vtascan.ir.Instruction;
import io.vtascan.ir.Program;
import io.vtascan.model.CallGraph;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Resolves call sites using propagated type sets.
 * <p>
 * Statically known callees resolve to themselves. An interface invocation resolves to the method
 * of each type reaching the receiver; a call through a function value resolves to each function
 * reaching the value. A dynamic site no type reaches resolves to nothing, leaving it to the
 * baseline graph.
 */
public class CallResolver {

    private static final Logger logger = LogManager.getLogger(CallResolver.class);

    private final Program program;

    public CallResolver(Program program) {
        this.program = program;
    }

    /**
     * Returns the graph of resolved edges of the call sites in {@code functions}.
     */
    public CallGraph resolve(Collection<Function> functions, TypeSets types) {
        CallGraph.Builder builder = new CallGraph.Builder();
        int dynamicSites = 0;
        for (Function fn : functions) {
            builder.addFunction(fn);
            for (Instruction instr : fn.instructions().toList()) {
                if (!(instr instanceof CallInstruction site)) {
                    continue;
                }
                CallCommon common = site.common();
                if (common.value() instanceof Builtin) {
                    continue;
                }
                if (common.staticCallee() == null) {
                    dynamicSites++;
                }
                for (Function callee : callees(instr, site, types)) {
                    builder.addEdge(site, callee);
                }
            }
        }
        CallGraph resolved = builder.build();
        logger.debug("Resolved {} edges ({} dynamic call sites) in {} functions",
                resolved.edgeCount(), dynamicSites, functions.size());
        return resolved;
    }

    /**
     * Returns the functions the call site may call according to {@code types}.
     */
    public Set<Function> callees(Instruction instr, CallInstruction site, TypeSets types) {
        CallCommon common = site.common();
        Set<Function> result = new LinkedHashSet<>();
        Function staticCallee = common.staticCallee();
        if (staticCallee != null) {
            result.add(staticCallee);
            return result;
        }
        Node operand = Nodes.of(common.value(), instr);
        for (PropType p : types.get(operand)) {
            Function callee;
            if (common.isInvoke()) {
                callee = program.lookupMethod(p.type(), common.method().name());
            } else {
                callee = p.function();
            }
            if (callee != null) {
                result.add(callee);
            }
        }
        if (logger.isTraceEnabled()) {
            logger.trace("{}: {} -> {}", site.location(), common, result);
        }
        return result;
    }
}
