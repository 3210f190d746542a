package io.vtascan.ir;

import io.vtascan.types.Type;

import java.util.Objects;

/**
 * Reads element {@code index} of an array value.
 */
public final class Index extends Register {

    private final Value x;
    private final Value index;

    public Index(String name, Value x, Value index, Type type) {
        super(name, type);
        this.x = Objects.requireNonNull(x, "x");
        this.index = Objects.requireNonNull(index, "index");
    }

    public Value x() {
        return x;
    }

    public Value index() {
        return index;
    }

    @Override
    public void accept(InstructionVisitor visitor) {
        visitor.visitIndex(this);
    }

    @Override
    protected String describe() {
        return x.name() + "[" + index.name() + "]";
    }
}
