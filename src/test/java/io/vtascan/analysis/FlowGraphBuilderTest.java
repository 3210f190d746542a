package io.vtascan.analysis;

import io.vtascan.graph.FlowGraph;
import io.vtascan.graph.Node;
import io.vtascan.ir.Const;
import io.vtascan.ir.FunctionBuilder;
import io.vtascan.ir.MalformedProgramException;
import io.vtascan.ir.Program;
import io.vtascan.ir.ProgramBuilder;
import io.vtascan.ir.Return;
import io.vtascan.loader.ProgramFixtures;
import io.vtascan.model.CallGraph;
import io.vtascan.types.BasicType;
import io.vtascan.types.InterfaceType;
import io.vtascan.types.NamedType;
import io.vtascan.types.Signature;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FlowGraphBuilderTest {

    @Test
    void build_alwaysConnectsPanicToRecover() {
        FlowGraph graph = new FlowGraphBuilder(CallGraph.empty()).build(List.of());

        assertThat(graph.hasEdge(Node.PANIC_ARG, Node.RECOVER_RETURN)).isTrue();
        assertThat(graph.edgeCount()).isEqualTo(1);
    }

    @Test
    void build_freezesTheGraph() {
        Program program = ProgramFixtures.program("interfaces");

        FlowGraph graph = new FlowGraphBuilder(new ChaCallGraphBuilder(program).build()).build(program.functions());

        assertThat(graph.isFrozen()).isTrue();
    }

    @Test
    void build_inParallelMatchesSequentialBuild() {
        for (String name : ProgramFixtures.ALL) {
            Program program = ProgramFixtures.program(name);
            CallGraph cha = new ChaCallGraphBuilder(program).build();

            FlowGraph sequential = new FlowGraphBuilder(cha, 1).build(program.functions());
            FlowGraph parallel = new FlowGraphBuilder(cha, 4).build(program.functions());

            assertThat(parallel.toLines()).as(name).isEqualTo(sequential.toLines());
        }
    }

    @Test
    void build_sharesFieldAndMapNodesAcrossFunctions() {
        Program program = ProgramFixtures.program("shared");

        FlowGraph graph = new FlowGraphBuilder(new ChaCallGraphBuilder(program).build()).build(program.functions());

        List<Node> fields = graph.nodes().stream().filter(n -> n.toString().equals("Field(P.X:a)")).toList();
        List<Node> mapValues = graph.nodes().stream().filter(n -> n.toString().equals("MapValue(P.I)")).toList();
        assertThat(fields).hasSize(1);
        assertThat(mapValues).hasSize(1);
        assertThat(graph.successors(fields.get(0))).extracting(Node::toString)
                .containsExactlyInAnyOrder("Local(a1)", "Local(b1)", "Local(r0)");
        assertThat(graph.successors(mapValues.get(0))).extracting(Node::toString)
                .containsExactly("Local(r2)");
    }

    @Test
    void build_connectsNestedPointerLoadsAndStores() {
        Program program = ProgramFixtures.program("pointers");

        FlowGraph graph = new FlowGraphBuilder(new ChaCallGraphBuilder(program).build()).build(program.functions());

        assertThat(ProgramFixtures.edges(graph)).contains(
                "Local(s0) -> PtrInterface(P.I)",
                "PtrInterface(P.I) -> Local(s2)",
                "Local(i0) -> PtrFunction(func())",
                "PtrFunction(func()) -> Local(i1)");
        assertThat(ProgramFixtures.edges(graph)).doesNotContain("Local(s0) -> Local(s1)");
    }

    @Test
    void build_rejectsClosuresWithMissingBindings() {
        ProgramBuilder pb = new ProgramBuilder("P");
        FunctionBuilder main = pb.function("main", Signature.NO_ARGS);
        FunctionBuilder closure = main.closure(Signature.NO_ARGS);
        closure.freeVar("x", BasicType.INT);
        closure.ret();
        main.makeClosure(closure.function());
        main.ret();
        Program program = pb.build();
        FlowGraphBuilder builder = new FlowGraphBuilder(new StaticCallGraphBuilder(program).build());

        assertThatThrownBy(() -> builder.build(program.functions()))
                .isInstanceOf(MalformedProgramException.class)
                .hasMessageContaining("P.main: block 0, instruction 0")
                .hasMessageContaining("main$1 has 1 free variables, got 0 bindings");
    }

    @Test
    void build_skipsEdgesIntoUninterestingNodes() {
        ProgramBuilder pb = new ProgramBuilder("P");
        FunctionBuilder g = pb.function("g", new Signature(List.of(BasicType.INT), List.of()));
        g.param("n", BasicType.INT);
        FunctionBuilder f = pb.function("f", Signature.NO_ARGS);
        f.call(g.function(), new Const("1", BasicType.INT));
        f.ret();
        g.ret();
        Program program = pb.build();

        FlowGraph graph = new FlowGraphBuilder(new StaticCallGraphBuilder(program).build()).build(program.functions());

        assertThat(graph.toLines()).containsExactly("Panic -> Recover");
    }

    @Test
    void build_connectsArgumentsOfEveryBaselineCallee() {
        Program program = ProgramFixtures.program("static");
        CallGraph cha = new ChaCallGraphBuilder(program).build();

        FlowGraph graph = new FlowGraphBuilder(cha).build(program.functions());

        assertThat(ProgramFixtures.edges(graph)).contains("Local(t0) -> Local(i)");
    }

    @Test
    void build_connectsResultsToCallSites() {
        ProgramBuilder pb = new ProgramBuilder("P");
        NamedType i = pb.namedType("I", pb.types().parse("interface{f()}"));
        NamedType c = pb.namedType("C", BasicType.INT);
        pb.method(c, false, "f", Signature.NO_ARGS).ret();
        FunctionBuilder make = pb.function("make", new Signature(List.of(), List.of(i)));
        make.ret(make.makeInterface(i, new Const("0", c)));
        FunctionBuilder pair = pb.function("pair", new Signature(List.of(), List.of(i, i)));
        Const zero = new Const("0", c);
        pair.ret(pair.makeInterface(i, zero), pair.makeInterface(i, zero));
        FunctionBuilder main = pb.function("main", Signature.NO_ARGS);
        main.call(make.function());
        main.named("p").call(pair.function());
        main.ret();
        Program program = pb.build();

        FlowGraph graph = new FlowGraphBuilder(new StaticCallGraphBuilder(program).build()).build(program.functions());

        assertThat(ProgramFixtures.edges(graph)).contains(
                "Local(t0) -> Return(make[0])",
                "Return(make[0]) -> Local(t0)",
                "Local(t1) -> Return(pair[1])",
                "Return(pair[0]) -> Local(p[0])",
                "Return(pair[1]) -> Local(p[1])");
    }

    @Test
    void build_reportsMalformedInstructionsWithLocation() {
        ProgramBuilder pb = new ProgramBuilder("P");
        FunctionBuilder g = pb.function("g", new Signature(List.of(), List.of(InterfaceType.EMPTY)));
        g.add(new Return(List.of()));
        Program program = pb.build();

        assertThatThrownBy(() -> new FlowGraphBuilder(CallGraph.empty()).build(program.functions()))
                .isInstanceOf(MalformedProgramException.class)
                .hasMessageContaining("P.g: block 0, instruction 0")
                .satisfies(e -> assertThat(((MalformedProgramException) e).location())
                        .isEqualTo("P.g: block 0, instruction 0"));
    }

    @Test
    void build_reportsMalformedInstructionsFromWorkerThreads() {
        ProgramBuilder pb = new ProgramBuilder("P");
        pb.function("ok", Signature.NO_ARGS).ret();
        FunctionBuilder g = pb.function("g", new Signature(List.of(), List.of(InterfaceType.EMPTY)));
        g.add(new Return(List.of()));
        Program program = pb.build();

        assertThatThrownBy(() -> new FlowGraphBuilder(CallGraph.empty(), 2).build(program.functions()))
                .isInstanceOf(MalformedProgramException.class);
    }

    @Test
    void constructor_rejectsNonPositiveParallelism() {
        assertThatThrownBy(() -> new FlowGraphBuilder(CallGraph.empty(), 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("at least 1");
    }
}
