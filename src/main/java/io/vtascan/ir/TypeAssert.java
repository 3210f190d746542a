package io.vtascan.ir;

import io.vtascan.types.Type;

import java.util.Objects;

/**
 * Asserts that the interface value {@code x} holds {@code assertedType}. With {@code commaOk} the
 * result is the tuple {@code (value, ok bool)}.
 */
public final class TypeAssert extends Register {

    private final Value x;
    private final Type assertedType;
    private final boolean commaOk;

    public TypeAssert(String name, Value x, Type assertedType, boolean commaOk, Type type) {
        super(name, type);
        this.x = Objects.requireNonNull(x, "x");
        this.assertedType = Objects.requireNonNull(assertedType, "assertedType");
        this.commaOk = commaOk;
    }

    public Value x() {
        return x;
    }

    public Type assertedType() {
        return assertedType;
    }

    public boolean commaOk() {
        return commaOk;
    }

    @Override
    public void accept(InstructionVisitor visitor) {
        visitor.visitTypeAssert(this);
    }

    @Override
    protected String describe() {
        return "typeassert" + (commaOk ? ",ok " : " ") + x.name() + ".(" + assertedType + ")";
    }
}
