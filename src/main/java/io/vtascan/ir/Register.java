package io.vtascan.ir;

import io.vtascan.types.Type;

import java.util.Objects;

/**
 * An instruction that defines a value, rendered as {@code name = description}.
 */
public abstract class Register extends Instruction implements Value {

    private final String name;
    private final Type type;

    protected Register(String name, Type type) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Type type() {
        return type;
    }

    /**
     * Describes the right-hand side of the definition.
     */
    protected abstract String describe();

    @Override
    public String toString() {
        return name + " = " + describe();
    }
}
