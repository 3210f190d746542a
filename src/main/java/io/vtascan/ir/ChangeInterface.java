package io.vtascan.ir;

import io.vtascan.types.Type;

import java.util.Objects;

/**
 * Converts an interface value to another interface type.
 */
public final class ChangeInterface extends Register {

    private final Value x;

    public ChangeInterface(String name, Value x, Type type) {
        super(name, type);
        this.x = Objects.requireNonNull(x, "x");
    }

    public Value x() {
        return x;
    }

    @Override
    public void accept(InstructionVisitor visitor) {
        visitor.visitChangeInterface(this);
    }

    @Override
    protected String describe() {
        return "change interface " + type() + " <- " + x.type() + " (" + x.name() + ")";
    }
}
