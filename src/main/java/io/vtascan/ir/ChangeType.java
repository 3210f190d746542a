package io.vtascan.ir;

import io.vtascan.types.Type;

import java.util.Objects;

/**
 * Converts a value between types with identical underlying types, without changing its representation.
 */
public final class ChangeType extends Register {

    private final Value x;

    public ChangeType(String name, Value x, Type type) {
        super(name, type);
        this.x = Objects.requireNonNull(x, "x");
    }

    public Value x() {
        return x;
    }

    @Override
    public void accept(InstructionVisitor visitor) {
        visitor.visitChangeType(this);
    }

    @Override
    protected String describe() {
        return "changetype " + type() + " <- " + x.type() + " (" + x.name() + ")";
    }
}
