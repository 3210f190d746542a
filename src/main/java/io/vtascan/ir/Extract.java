package io.vtascan.ir;

import io.vtascan.types.Type;

import java.util.Objects;

/**
 * Projects the component at {@code index} out of a tuple-typed value.
 */
public final class Extract extends Register {

    private final Value tuple;
    private final int index;

    public Extract(String name, Value tuple, int index, Type type) {
        super(name, type);
        this.tuple = Objects.requireNonNull(tuple, "tuple");
        this.index = index;
    }

    public Value tuple() {
        return tuple;
    }

    public int index() {
        return index;
    }

    @Override
    public void accept(InstructionVisitor visitor) {
        visitor.visitExtract(this);
    }

    @Override
    protected String describe() {
        return "extract " + tuple.name() + " #" + index;
    }
}
