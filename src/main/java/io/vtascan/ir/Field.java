package io.vtascan.ir;

import io.vtascan.types.Type;

import java.util.Objects;

/**
 * Reads field {@code index} of a struct value.
 */
public final class Field extends Register {

    private final Value x;
    private final int index;

    public Field(String name, Value x, int index, Type type) {
        super(name, type);
        this.x = Objects.requireNonNull(x, "x");
        this.index = index;
    }

    public Value x() {
        return x;
    }

    public int index() {
        return index;
    }

    @Override
    public void accept(InstructionVisitor visitor) {
        visitor.visitField(this);
    }

    @Override
    protected String describe() {
        return x.name() + ".[#" + index + "]";
    }
}
