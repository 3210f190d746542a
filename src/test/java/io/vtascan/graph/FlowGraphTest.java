package io.vtascan.graph;

import io.vtascan.types.BasicType;
import io.vtascan.types.InterfaceType;
import io.vtascan.types.PointerType;
import io.vtascan.types.Signature;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FlowGraphTest {

    private final Node n1 = new Node.Constant(BasicType.INT);
    private final Node n2 = new Node.Pointer(new PointerType(BasicType.INT));
    private final Node n3 = new Node.NestedPtrFunction(Signature.NO_ARGS);
    private final Node n4 = new Node.NestedPtrInterface(InterfaceType.EMPTY);

    private FlowGraph graph;

    @BeforeEach
    void setUp() {
        graph = new FlowGraph();
        graph.addEdge(n1, n3);
        graph.addEdge(n2, n3);
        graph.addEdge(n2, n4);
        graph.addEdge(n3, n4);
    }

    @Test
    void successors_holdInsertedEdges() {
        assertThat(graph.successors(n1)).containsExactly(n3);
        assertThat(graph.successors(n2)).containsExactlyInAnyOrder(n3, n4);
        assertThat(graph.successors(n3)).containsExactly(n4);
        assertThat(graph.successors(n4)).isEmpty();
    }

    @Test
    void addEdge_isIdempotent() {
        assertThat(graph.addEdge(n1, n3)).isFalse();
        assertThat(graph.addEdge(n1, n3)).isFalse();

        assertThat(graph.successors(n1)).hasSize(1);
        assertThat(graph.edgeCount()).isEqualTo(4);
    }

    @Test
    void addEdge_distinctTargetsAccumulate() {
        FlowGraph g = new FlowGraph();
        Node src = new Node.MapKey(BasicType.INT);

        assertThat(g.addEdge(src, n1)).isTrue();
        assertThat(g.addEdge(src, n2)).isTrue();
        assertThat(g.addEdge(src, n3)).isTrue();

        assertThat(g.successors(src)).hasSize(3);
    }

    @Test
    void selfLoopIsRecordedOnce() {
        graph.addEdge(n4, n4);
        graph.addEdge(n4, n4);

        assertThat(graph.successors(n4)).containsExactly(n4);
    }

    @Test
    void enumeration() {
        assertThat(graph.nodes()).containsExactlyInAnyOrder(n1, n2, n3, n4);
        assertThat(graph.sources()).containsExactlyInAnyOrder(n1, n2, n3);
        assertThat(graph.nodeCount()).isEqualTo(4);
        assertThat(graph.hasEdge(n2, n4)).isTrue();
        assertThat(graph.hasEdge(n4, n2)).isFalse();

        List<String> edges = new ArrayList<>();
        graph.forEachEdge((from, to) -> edges.add(from + " -> " + to));
        assertThat(edges).hasSize(4).contains("Constant(int) -> PtrFunction(func())");
    }

    @Test
    void toLines_sortsLinesAndSuccessors() {
        assertThat(graph.toLines()).containsExactly(
                "Constant(int) -> PtrFunction(func())",
                "Pointer(*int) -> PtrFunction(func()), PtrInterface(interface{})",
                "PtrFunction(func()) -> PtrInterface(interface{})");
    }

    @Test
    void successors_cannotBeModified() {
        assertThatThrownBy(() -> graph.successors(n1).add(n2))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void freeze_rejectsFurtherEdges() {
        graph.freeze();

        assertThat(graph.isFrozen()).isTrue();
        assertThatThrownBy(() -> graph.addEdge(n4, n1))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("frozen");
    }

    @Test
    void addEdge_isSafeUnderConcurrentWriters() throws Exception {
        FlowGraph g = new FlowGraph();
        Node target = new Node.NestedPtrInterface(InterfaceType.EMPTY);
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 4; t++) {
                futures.add(executor.submit(() -> {
                    for (int k = 0; k < 500; k++) {
                        g.addEdge(new Node.Constant(new BasicType("T" + k)), target);
                        g.addEdge(target, new Node.MapKey(new BasicType("T" + k)));
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(g.edgeCount()).isEqualTo(1000);
        assertThat(g.successors(target)).hasSize(500);
        assertThat(g.nodeCount()).isEqualTo(1001);
    }
}
