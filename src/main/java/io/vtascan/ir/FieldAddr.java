package io.vtascan.ir;

import io.vtascan.types.Type;

import java.util.Objects;

/**
 * Yields the address of field {@code index} of the struct pointed to by {@code x}.
 */
public final class FieldAddr extends Register {

    private final Value x;
    private final int index;

    public FieldAddr(String name, Value x, int index, Type type) {
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
        visitor.visitFieldAddr(this);
    }

    @Override
    protected String describe() {
        return "&" + x.name() + ".[#" + index + "]";
    }
}
