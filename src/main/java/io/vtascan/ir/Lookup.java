package io.vtascan.ir;

import io.vtascan.types.Type;

import java.util.Objects;

/**
 * Looks up a map entry or a string byte; with {@code commaOk} the result is the tuple
 * {@code (value, ok bool)}.
 */
public final class Lookup extends Register {

    private final Value x;
    private final Value index;
    private final boolean commaOk;

    public Lookup(String name, Value x, Value index, boolean commaOk, Type type) {
        super(name, type);
        this.x = Objects.requireNonNull(x, "x");
        this.index = Objects.requireNonNull(index, "index");
        this.commaOk = commaOk;
    }

    public Value x() {
        return x;
    }

    public Value index() {
        return index;
    }

    public boolean commaOk() {
        return commaOk;
    }

    @Override
    public void accept(InstructionVisitor visitor) {
        visitor.visitLookup(this);
    }

    @Override
    protected String describe() {
        return x.name() + "[" + index.name() + "]" + (commaOk ? ",ok" : "");
    }
}
