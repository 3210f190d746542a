package io.vtascan.ir;

import io.vtascan.types.Type;

import java.util.Objects;

/**
 * Boxes a concrete value into an interface value.
 */
public final class MakeInterface extends Register {

    private final Value x;

    public MakeInterface(String name, Value x, Type type) {
        super(name, type);
        this.x = Objects.requireNonNull(x, "x");
    }

    public Value x() {
        return x;
    }

    @Override
    public void accept(InstructionVisitor visitor) {
        visitor.visitMakeInterface(this);
    }

    @Override
    protected String describe() {
        return "make " + type() + " <- " + x.type() + " (" + x.name() + ")";
    }
}
