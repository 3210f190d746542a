package io.vtascan.ir;

import io.vtascan.types.Type;

import java.util.Objects;

/**
 * Converts a slice to a pointer to an array of the same element type.
 */
public final class SliceToArrayPointer extends Register {

    private final Value x;

    public SliceToArrayPointer(String name, Value x, Type type) {
        super(name, type);
        this.x = Objects.requireNonNull(x, "x");
    }

    public Value x() {
        return x;
    }

    @Override
    public void accept(InstructionVisitor visitor) {
        visitor.visitSliceToArrayPointer(this);
    }

    @Override
    protected String describe() {
        return "slice to array pointer " + type() + " <- " + x.type() + " (" + x.name() + ")";
    }
}
