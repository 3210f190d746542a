package io.vtascan.analysis;

import io.vtascan.graph.FlowGraph;
import io.vtascan.graph.Node;
import io.vtascan.graph.Nodes;
import io.vtascan.ir.Alloc;
import io.vtascan.ir.BinOp;
import io.vtascan.ir.Builtin;
import io.vtascan.ir.Call;
import io.vtascan.ir.CallCommon;
import io.vtascan.ir.CallInstruction;
import io.vtascan.ir.ChangeInterface;
import io.vtascan.ir.ChangeType;
import io.vtascan.ir.Convert;
import io.vtascan.ir.Defer;
import io.vtascan.ir.Extract;
import io.vtascan.ir.Field;
import io.vtascan.ir.FieldAddr;
import io.vtascan.ir.FreeVar;
import io.vtascan.ir.Function;
import io.vtascan.ir.Go;
import io.vtascan.ir.If;
import io.vtascan.ir.Index;
import io.vtascan.ir.IndexAddr;
import io.vtascan.ir.Instruction;
import io.vtascan.ir.InstructionVisitor;
import io.vtascan.ir.Jump;
import io.vtascan.ir.Lookup;
import io.vtascan.ir.MakeChan;
import io.vtascan.ir.MakeClosure;
import io.vtascan.ir.MakeInterface;
import io.vtascan.ir.MakeMap;
import io.vtascan.ir.MakeSlice;
import io.vtascan.ir.MalformedProgramException;
import io.vtascan.ir.MapUpdate;
import io.vtascan.ir.Next;
import io.vtascan.ir.Panic;
import io.vtascan.ir.Parameter;
import io.vtascan.ir.Phi;
import io.vtascan.ir.Range;
import io.vtascan.ir.Return;
import io.vtascan.ir.RunDefers;
import io.vtascan.ir.Select;
import io.vtascan.ir.Send;
import io.vtascan.ir.Slice;
import io.vtascan.ir.SliceToArrayPointer;
import io.vtascan.ir.Store;
import io.vtascan.ir.TypeAssert;
import io.vtascan.ir.UnOp;
import io.vtascan.ir.Value;
import io.vtascan.model.CallGraph;
import io.vtascan.types.ChanType;
import io.vtascan.types.MapType;
import io.vtascan.types.PointerType;
import io.vtascan.types.StructType;
import io.vtascan.types.TupleType;
import io.vtascan.types.Type;
import io.vtascan.types.Types;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Builds the type flow graph of a set of functions.
 * <p>
 * Each instruction contributes the edges along which a value of interesting type (an interface, a
 * function, or a pointer chain ending in either) may move. Interprocedural edges from arguments to
 * parameters and from results to call sites follow the callees of the baseline call graph.
 * <p>
 * Functions are walked independently, so the walk can be spread over several threads; the flow
 * graph tolerates concurrent edge insertion.
 */
public class FlowGraphBuilder {

    private static final Logger logger = LogManager.getLogger(FlowGraphBuilder.class);

    private final CallGraph baseline;
    private final int parallelism;

    public FlowGraphBuilder(CallGraph baseline) {
        this(baseline, 1);
    }

    /**
     * @param baseline    Call graph supplying the callees of each call site
     * @param parallelism Number of threads walking functions; 1 walks on the calling thread
     */
    public FlowGraphBuilder(CallGraph baseline, int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("Parallelism must be at least 1, got " + parallelism);
        }
        this.baseline = baseline;
        this.parallelism = parallelism;
    }

    /**
     * Builds and freezes the flow graph of the given functions.
     *
     * @throws MalformedProgramException if an instruction references a value or type that cannot
     *                                   be mapped to a node
     */
    public FlowGraph build(Collection<Function> functions) {
        FlowGraph graph = new FlowGraph();
        // any panicked value may be recovered anywhere
        graph.addEdge(Node.PANIC_ARG, Node.RECOVER_RETURN);

        if (parallelism == 1 || functions.size() < 2) {
            for (Function fn : functions) {
                walk(graph, fn);
            }
        } else {
            walkParallel(graph, functions);
        }

        graph.freeze();
        logger.debug("Built flow graph of {} functions: {} nodes, {} edges",
                functions.size(), graph.nodeCount(), graph.edgeCount());
        return graph;
    }

    private void walkParallel(FlowGraph graph, Collection<Function> functions) {
        ExecutorService executor = Executors.newFixedThreadPool(parallelism);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (Function fn : functions) {
                futures.add(executor.submit(() -> walk(graph, fn)));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw new IllegalStateException("Flow graph construction failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while building flow graph", e);
        } finally {
            executor.shutdownNow();
        }
    }

    private void walk(FlowGraph graph, Function fn) {
        Walker walker = new Walker(graph, fn);
        fn.instructions().forEach(walker::visit);
    }

    /**
     * Adds the edges of the instructions of one function.
     */
    private final class Walker implements InstructionVisitor {

        private final FlowGraph graph;
        private final Function fn;
        private Instruction current;

        Walker(FlowGraph graph, Function fn) {
            this.graph = graph;
            this.fn = fn;
        }

        void visit(Instruction instr) {
            current = instr;
            instr.accept(this);
        }

        private Node node(Value v) {
            return Nodes.of(v, current);
        }

        /**
         * Adds {@code s -> d} if values of interest can flow into {@code d}.
         */
        private void inFlow(Node s, Node d) {
            if (Nodes.hasInFlow(d)) {
                graph.addEdge(s, d);
            }
        }

        /**
         * Adds {@code r -> l}, and {@code l -> r} too when both denote shared storage.
         */
        private void aliasEdges(Node l, Node r) {
            inFlow(r, l);
            if (Nodes.canAlias(l, r)) {
                inFlow(l, r);
            }
        }

        private <T extends Type> T underlying(Value v, Class<T> kind) {
            Type u = v.type().underlying();
            if (!kind.isInstance(u)) {
                throw new MalformedProgramException(current, "expected " + kind.getSimpleName()
                        + " operand, " + v.name() + " has type " + v.type());
            }
            return kind.cast(u);
        }

        private TupleType tuple(Value v) {
            if (!(v.type() instanceof TupleType t)) {
                throw new MalformedProgramException(current, v.name() + " is not a tuple: " + v.type());
            }
            return t;
        }

        private Type sliceArrayElem(Value v) {
            Type elem = Types.sliceArrayElem(v.type());
            if (elem == null) {
                throw new MalformedProgramException(current, v.name() + " is not a slice or array: " + v.type());
            }
            return elem;
        }

        @Override
        public void visitStore(Store instr) {
            aliasEdges(node(instr.addr()), node(instr.val()));
        }

        @Override
        public void visitMakeInterface(MakeInterface instr) {
            inFlow(node(instr.x()), node(instr));
        }

        @Override
        public void visitMakeClosure(MakeClosure instr) {
            Function closure = instr.fn();
            inFlow(new Node.Function(closure), node(instr));
            List<FreeVar> freeVars = closure.freeVars();
            if (instr.bindings().size() != freeVars.size()) {
                throw new MalformedProgramException(current, closure.name() + " has " + freeVars.size()
                        + " free variables, got " + instr.bindings().size() + " bindings");
            }
            for (int i = 0; i < freeVars.size(); i++) {
                aliasEdges(node(freeVars.get(i)), node(instr.bindings().get(i)));
            }
        }

        @Override
        public void visitUnOp(UnOp instr) {
            switch (instr.op()) {
                case DEREF -> aliasEdges(node(instr), node(instr.x()));
                case RECV -> {
                    Type elem = underlying(instr.x(), ChanType.class).elem();
                    Node dst = instr.commaOk() ? new Node.IndexedLocal(instr, elem, 0) : node(instr);
                    aliasEdges(dst, new Node.ChannelElem(elem));
                }
                default -> {
                    // arithmetic yields basic values
                }
            }
        }

        @Override
        public void visitPhi(Phi instr) {
            Node phi = node(instr);
            for (Value edge : instr.edges()) {
                aliasEdges(phi, node(edge));
            }
        }

        @Override
        public void visitChangeInterface(ChangeInterface instr) {
            inFlow(node(instr.x()), node(instr));
        }

        @Override
        public void visitChangeType(ChangeType instr) {
            aliasEdges(node(instr), node(instr.x()));
        }

        @Override
        public void visitConvert(Convert instr) {
            aliasEdges(node(instr), node(instr.x()));
        }

        @Override
        public void visitTypeAssert(TypeAssert instr) {
            if (!instr.commaOk()) {
                inFlow(node(instr.x()), node(instr));
                return;
            }
            // (value, ok): the asserted value is component 0
            Type t = tuple(instr).at(0);
            inFlow(node(instr.x()), new Node.IndexedLocal(instr, t, 0));
        }

        @Override
        public void visitExtract(Extract instr) {
            TupleType t = tuple(instr.tuple());
            if (instr.index() < 0 || instr.index() >= t.size()) {
                throw new MalformedProgramException(current, "tuple " + instr.tuple().name()
                        + " has no component #" + instr.index());
            }
            aliasEdges(node(instr), new Node.IndexedLocal(instr.tuple(), t.at(instr.index()), instr.index()));
        }

        @Override
        public void visitField(Field instr) {
            inFlow(fieldNode(instr.x().type(), instr.index()), node(instr));
        }

        @Override
        public void visitFieldAddr(FieldAddr instr) {
            Type struct = underlying(instr.x(), PointerType.class).elem();
            Node field = fieldNode(struct, instr.index());
            Node addr = node(instr);
            inFlow(field, addr);
            inFlow(addr, field);
        }

        private Node fieldNode(Type structType, int index) {
            if (!(structType.underlying() instanceof StructType s) || index < 0 || index >= s.size()) {
                throw new MalformedProgramException(current, "no field #" + index + " in " + structType);
            }
            return new Node.Field(structType, index);
        }

        @Override
        public void visitSend(Send instr) {
            Type elem = underlying(instr.chan(), ChanType.class).elem();
            aliasEdges(new Node.ChannelElem(elem), node(instr.x()));
        }

        @Override
        public void visitSelect(Select instr) {
            int recvIndex = 0;
            for (Select.SelectState state : instr.states()) {
                Type elem = underlying(state.chan(), ChanType.class).elem();
                if (state.isSend()) {
                    aliasEdges(new Node.ChannelElem(elem), node(state.send()));
                } else {
                    // received values follow (index, recvOk) in the result tuple
                    Node entry = new Node.IndexedLocal(instr, elem, 2 + recvIndex);
                    aliasEdges(entry, new Node.ChannelElem(elem));
                    recvIndex++;
                }
            }
        }

        @Override
        public void visitIndex(Index instr) {
            aliasEdges(node(instr), new Node.SliceElem(sliceArrayElem(instr.x())));
        }

        @Override
        public void visitIndexAddr(IndexAddr instr) {
            Node elem = new Node.SliceElem(sliceArrayElem(instr.x()));
            Node addr = node(instr);
            inFlow(elem, addr);
            inFlow(addr, elem);
        }

        @Override
        public void visitLookup(Lookup instr) {
            if (!(instr.x().type().underlying() instanceof MapType map)) {
                // string index: bytes carry no interesting types
                return;
            }
            Node value = new Node.MapValue(map.value());
            if (!instr.commaOk()) {
                aliasEdges(node(instr), value);
            } else {
                aliasEdges(new Node.IndexedLocal(instr, map.value(), 0), value);
            }
        }

        @Override
        public void visitMapUpdate(MapUpdate instr) {
            MapType map = underlying(instr.map(), MapType.class);
            aliasEdges(new Node.MapKey(map.key()), node(instr.key()));
            aliasEdges(new Node.MapValue(map.value()), node(instr.value()));
        }

        @Override
        public void visitNext(Next instr) {
            if (instr.isString()) {
                return;
            }
            TupleType t = instr.type();
            Type kt = t.at(1);
            Type vt = t.at(2);
            aliasEdges(new Node.IndexedLocal(instr, kt, 1), new Node.MapKey(kt));
            aliasEdges(new Node.IndexedLocal(instr, vt, 2), new Node.MapValue(vt));
        }

        @Override
        public void visitPanic(Panic instr) {
            // strings and numbers cannot be interface receivers after recovery
            if (!Types.canHaveMethods(instr.x().type())) {
                return;
            }
            inFlow(node(instr.x()), Node.PANIC_ARG);
        }

        @Override
        public void visitCall(Call instr) {
            call(instr, instr);
        }

        @Override
        public void visitGo(Go instr) {
            call(instr, null);
        }

        @Override
        public void visitDefer(Defer instr) {
            call(instr, null);
        }

        /**
         * @param site The call instruction
         * @param result The register receiving the results, null for go and defer
         */
        private void call(CallInstruction site, Call result) {
            CallCommon common = site.common();
            if (common.value() instanceof Builtin builtin) {
                if (builtin.isRecover() && result != null) {
                    inFlow(Node.RECOVER_RETURN, node(result));
                }
                return;
            }
            for (Function callee : baseline.calleesAt(site)) {
                argumentFlows(common, callee);
                if (result == null) {
                    continue;
                }
                int results = callee.signature().results().size();
                if (results == 1) {
                    inFlow(new Node.Return(callee, 0), node(result));
                } else if (results > 1) {
                    TupleType t = tuple(result);
                    for (int i = 0; i < results; i++) {
                        inFlow(new Node.Return(callee, i), new Node.IndexedLocal(result, t.at(i), i));
                    }
                }
            }
        }

        private void argumentFlows(CallCommon common, Function callee) {
            List<Parameter> params = callee.params();
            if (params.isEmpty()) {
                return;
            }
            int offset = 0;
            if (common.isInvoke()) {
                // interface receivers only matter when the concrete receiver is a function type
                if (Types.isFunction(params.get(0).type())) {
                    inFlow(node(common.value()), node(params.get(0)));
                }
                offset = 1;
            }
            List<Value> args = common.args();
            for (int i = 0; i < args.size() && i + offset < params.size(); i++) {
                aliasEdges(node(params.get(i + offset)), node(args.get(i)));
            }
        }

        @Override
        public void visitReturn(Return instr) {
            List<Value> results = instr.results();
            if (results.size() != fn.signature().results().size()) {
                throw new MalformedProgramException(current, fn.name() + " returns "
                        + fn.signature().results().size() + " values");
            }
            for (int i = 0; i < results.size(); i++) {
                inFlow(node(results.get(i)), new Node.Return(fn, i));
            }
        }

        @Override
        public void visitAlloc(Alloc instr) {
            // no flow: the allocated pointer type seeds its own node
        }

        @Override
        public void visitBinOp(BinOp instr) {
            // no flow: operands and results are basic values
        }

        @Override
        public void visitSliceToArrayPointer(SliceToArrayPointer instr) {
            // no flow: operand and result share the element type
        }

        @Override
        public void visitSlice(Slice instr) {
            // no flow: a slice shares the element node of its operand
        }

        @Override
        public void visitMakeChan(MakeChan instr) {
            // no flow
        }

        @Override
        public void visitMakeMap(MakeMap instr) {
            // no flow
        }

        @Override
        public void visitMakeSlice(MakeSlice instr) {
            // no flow
        }

        @Override
        public void visitRange(Range instr) {
            // no flow: elements are reached through Next
        }

        @Override
        public void visitJump(Jump instr) {
            // control flow only
        }

        @Override
        public void visitIf(If instr) {
            // control flow only
        }

        @Override
        public void visitRunDefers(RunDefers instr) {
            // control flow only
        }
    }
}
