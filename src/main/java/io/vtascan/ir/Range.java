package io.vtascan.ir;

import io.vtascan.types.BasicType;

import java.util.Objects;

/**
 * Creates an iterator over a map or string, advanced by {@link Next}.
 */
public final class Range extends Register {

    public static final BasicType ITERATOR = new BasicType("iter");

    private final Value x;

    public Range(String name, Value x) {
        super(name, ITERATOR);
        this.x = Objects.requireNonNull(x, "x");
    }

    public Value x() {
        return x;
    }

    @Override
    public void accept(InstructionVisitor visitor) {
        visitor.visitRange(this);
    }

    @Override
    protected String describe() {
        return "range " + x.name();
    }
}
