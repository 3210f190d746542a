package io.vtascan.ir;

import io.vtascan.types.Type;

import java.util.Objects;

/**
 * A value-changing conversion between basic types, or between strings and byte or rune slices.
 */
public final class Convert extends Register {

    private final Value x;

    public Convert(String name, Value x, Type type) {
        super(name, type);
        this.x = Objects.requireNonNull(x, "x");
    }

    public Value x() {
        return x;
    }

    @Override
    public void accept(InstructionVisitor visitor) {
        visitor.visitConvert(this);
    }

    @Override
    protected String describe() {
        return "convert " + type() + " <- " + x.type() + " (" + x.name() + ")";
    }
}
