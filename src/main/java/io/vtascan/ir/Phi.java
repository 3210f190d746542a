package io.vtascan.ir;

import io.vtascan.types.Type;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Merges the values flowing in from the predecessor blocks. Edges may be added after creation,
 * because they can refer to registers defined later in the function.
 */
public final class Phi extends Register {

    private final List<Value> edges = new ArrayList<>();

    public Phi(String name, Type type) {
        super(name, type);
    }

    public List<Value> edges() {
        return Collections.unmodifiableList(edges);
    }

    public Phi addEdge(Value edge) {
        Objects.requireNonNull(edge, "edge");
        Function parent = parent();
        if (parent != null) {
            parent.checkOpen();
        }
        edges.add(edge);
        return this;
    }

    @Override
    public void accept(InstructionVisitor visitor) {
        visitor.visitPhi(this);
    }

    @Override
    protected String describe() {
        return "phi " + edges.stream().map(Value::name).collect(Collectors.joining(", ", "[", "]"));
    }
}
