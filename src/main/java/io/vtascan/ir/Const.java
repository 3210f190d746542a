package io.vtascan.ir;

import io.vtascan.types.Type;

import java.util.Objects;

/**
 * A constant operand, rendered as {@code literal:type} (e.g. {@code 0:pkg.C}, {@code nil:pkg.I}).
 */
public final class Const implements Value {

    private final String literal;
    private final Type type;

    public Const(String literal, Type type) {
        this.literal = Objects.requireNonNull(literal, "literal");
        this.type = Objects.requireNonNull(type, "type");
    }

    /**
     * Creates the constant {@code nil} of the given type.
     */
    public static Const nil(Type type) {
        return new Const("nil", type);
    }

    public String literal() {
        return literal;
    }

    @Override
    public String name() {
        return literal + ":" + type;
    }

    @Override
    public Type type() {
        return type;
    }

    @Override
    public String toString() {
        return name();
    }
}
