package io.vtascan.model;

import io.vtascan.ir.Call;
import io.vtascan.ir.Function;
import io.vtascan.ir.FunctionBuilder;
import io.vtascan.ir.ProgramBuilder;
import io.vtascan.types.Signature;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CallGraphTest {

    private Function main;
    private Function a;
    private Function b;
    private Function c;
    private Call mainToA;
    private Call aToB;
    private Call bToB;

    @BeforeEach
    void setUp() {
        ProgramBuilder pb = new ProgramBuilder("P");
        FunctionBuilder mainBuilder = pb.function("main", Signature.NO_ARGS);
        FunctionBuilder aBuilder = pb.function("a", Signature.NO_ARGS);
        FunctionBuilder bBuilder = pb.function("b", Signature.NO_ARGS);
        c = pb.function("c", Signature.NO_ARGS).function();
        main = mainBuilder.function();
        a = aBuilder.function();
        b = bBuilder.function();
        mainToA = mainBuilder.call(a);
        aToB = aBuilder.call(b);
        bToB = bBuilder.call(b);
    }

    private CallGraph graph() {
        return new CallGraph.Builder()
                .addFunction(c)
                .addEdge(mainToA, a)
                .addEdge(aToB, b)
                .addEdge(bToB, b)
                .build();
    }

    @Test
    void builder_indexesEdgesByCallerCalleeAndSite() {
        CallGraph graph = graph();

        assertThat(graph.callees(main)).extracting(CallEdge::callee).containsExactly(a);
        assertThat(graph.callers(b)).extracting(CallEdge::caller).containsExactlyInAnyOrder(a, b);
        assertThat(graph.calleesAt(aToB)).containsExactly(b);
        assertThat(graph.callees(c)).isEmpty();
        assertThat(graph.edgeCount()).isEqualTo(3);
        assertThat(graph.functionCount()).isEqualTo(4);
    }

    @Test
    void builder_ignoresDuplicateEdges() {
        CallGraph graph = new CallGraph.Builder()
                .addEdge(mainToA, a)
                .addEdge(mainToA, a)
                .addEdge(new CallEdge(main, mainToA, a))
                .build();

        assertThat(graph.edgeCount()).isEqualTo(1);
        assertThat(graph.callers(a)).hasSize(1);
    }

    @Test
    void roots_areFunctionsOnlyCalledByThemselves() {
        assertThat(graph().roots()).containsExactlyInAnyOrder(main, c);

        CallGraph selfOnly = new CallGraph.Builder().addEdge(bToB, b).build();
        assertThat(selfOnly.roots()).containsExactly(b);
    }

    @Test
    void edgeStrings_areSortedAndDistinct() {
        CallGraph graph = new CallGraph.Builder()
                .addAll(graph())
                .addEdge(mainToA, b)
                .build();

        assertThat(graph.edgeStrings()).containsExactly("a -> b", "b -> b", "main -> a", "main -> b");
    }

    @Test
    void containsAll_comparesEdgesAndFunctions() {
        CallGraph graph = graph();
        CallGraph smaller = new CallGraph.Builder().addEdge(aToB, b).build();

        assertThat(graph.containsAll(smaller)).isTrue();
        assertThat(smaller.containsAll(graph)).isFalse();
        assertThat(graph.containsAll(CallGraph.empty())).isTrue();
        assertThat(CallGraph.empty().containsAll(new CallGraph.Builder().addFunction(c).build())).isFalse();
    }

    @Test
    void graph_isImmutable() {
        CallGraph graph = graph();

        assertThatThrownBy(() -> graph.functions().add(main)).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> graph.callees(main).clear()).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void edge_rendering() {
        CallEdge edge = new CallEdge(main, mainToA, a);

        assertThat(edge.describe()).isEqualTo("main -> a");
        assertThat(edge).hasToString("main -> a @ P.main: block 0, instruction 0");
        assertThat(edge.isStatic()).isTrue();
        assertThat(edge.isInvoke()).isFalse();
        assertThat(graph()).hasToString("CallGraph[4 functions, 3 edges]");
    }

    @Test
    void edge_requiresAllParts() {
        assertThatThrownBy(() -> new CallEdge(main, null, a)).isInstanceOf(NullPointerException.class);
    }
}
