package io.vtascan.ir;

import io.vtascan.types.TupleType;

import java.util.Objects;

/**
 * Advances a {@link Range} iterator, yielding the tuple {@code (ok bool, key, value)}.
 */
public final class Next extends Register {

    private final Value iter;
    private final boolean isString;

    public Next(String name, Value iter, boolean isString, TupleType type) {
        super(name, type);
        this.iter = Objects.requireNonNull(iter, "iter");
        this.isString = isString;
        if (type.size() != 3) {
            throw new IllegalArgumentException("next yields (ok, key, value), got " + type);
        }
    }

    public Value iter() {
        return iter;
    }

    /**
     * True when iterating over a string rather than a map.
     */
    public boolean isString() {
        return isString;
    }

    @Override
    public TupleType type() {
        return (TupleType) super.type();
    }

    @Override
    public void accept(InstructionVisitor visitor) {
        visitor.visitNext(this);
    }

    @Override
    protected String describe() {
        return "next " + iter.name();
    }
}
