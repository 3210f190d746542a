package io.vtascan.analysis;

import io.vtascan.graph.FlowGraph;
import io.vtascan.graph.Node;
import io.vtascan.ir.Program;
import io.vtascan.types.InterfaceType;
import io.vtascan.types.NamedType;
import io.vtascan.types.Signature;
import io.vtascan.types.Type;
import io.vtascan.types.Types;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Computes the set of concrete types that can reach each node of a flow graph.
 * <p>
 * Every non-sentinel node whose static type is not an interface is seeded with its own type. Types
 * then move along edges in rounds until a round adds nothing. A round reads the sets as they were
 * at the end of the previous round and only then publishes what it found, so each round sees a
 * consistent state. A type entering a node of interface type {@code I} is kept only if it
 * implements {@code I}.
 * <p>
 * A function value entering a node of named function type {@code F} is retagged with {@code F},
 * which is its dynamic type from then on.
 */
public class TypePropagation {

    private static final Logger logger = LogManager.getLogger(TypePropagation.class);

    /**
     * Receives the state after each round.
     */
    @FunctionalInterface
    public interface RoundObserver {
        void afterRound(int round, TypeSets snapshot);
    }

    private final Program program;
    private final RoundObserver observer;

    public TypePropagation(Program program) {
        this(program, null);
    }

    /**
     * @param program  Program answering interface satisfaction questions
     * @param observer Notified after every round, may be null
     */
    public TypePropagation(Program program, RoundObserver observer) {
        this.program = program;
        this.observer = observer;
    }

    /**
     * Propagates types to a fixpoint.
     *
     * @throws IllegalStateException if the number of rounds exceeds the number of nodes plus one,
     *                               which means type sets were not growing monotonically
     */
    public TypeSets propagate(FlowGraph graph) {
        Map<Node, Set<PropType>> types = new HashMap<>();
        Map<Node, Set<PropType>> delta = new HashMap<>();
        for (Node node : graph.nodes()) {
            PropType seed = seed(node);
            if (seed != null) {
                types.computeIfAbsent(node, k -> new HashSet<>()).add(seed);
                delta.computeIfAbsent(node, k -> new HashSet<>()).add(seed);
            }
        }

        int bound = graph.nodeCount() + 1;
        int round = 0;
        while (!delta.isEmpty()) {
            round++;
            if (round > bound) {
                throw new IllegalStateException("Type propagation did not converge after " + bound
                        + " rounds over " + graph.nodeCount() + " nodes");
            }
            Map<Node, Set<PropType>> next = new HashMap<>();
            for (Map.Entry<Node, Set<PropType>> entry : delta.entrySet()) {
                for (Node succ : graph.successors(entry.getKey())) {
                    Set<PropType> known = types.getOrDefault(succ, Set.of());
                    for (PropType t : entry.getValue()) {
                        PropType in = retag(succ, t);
                        if (!known.contains(in) && admits(succ, in)) {
                            next.computeIfAbsent(succ, k -> new HashSet<>()).add(in);
                        }
                    }
                }
            }
            // round barrier: publish what this round found
            next.forEach((node, found) -> types.computeIfAbsent(node, k -> new HashSet<>()).addAll(found));
            delta = next;
            if (observer != null) {
                observer.afterRound(round, new TypeSets(types));
            }
        }

        TypeSets result = new TypeSets(types);
        logger.debug("Propagated {} types over {} nodes in {} rounds", result.size(), graph.nodeCount(), round);
        return result;
    }

    private static PropType seed(Node node) {
        if (node.isSentinel()) {
            return null;
        }
        Type type = node.type();
        if (Types.isInterface(type)) {
            return null;
        }
        if (node instanceof Node.Function f) {
            return new PropType(type, f.function());
        }
        return PropType.of(type);
    }

    private static PropType retag(Node target, PropType t) {
        Type type = target.type();
        if (t.function() != null && type instanceof NamedType && type.underlying() instanceof Signature
                && !type.equals(t.type())) {
            return new PropType(type, t.function());
        }
        return t;
    }

    private boolean admits(Node target, PropType t) {
        Type type = target.type();
        if (type != null && type.underlying() instanceof InterfaceType iface) {
            return program.implementsInterface(t.type(), iface);
        }
        return true;
    }
}
