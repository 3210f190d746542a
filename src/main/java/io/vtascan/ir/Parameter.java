package io.vtascan.ir;

import io.vtascan.types.Type;

import java.util.Objects;

/**
 * A formal parameter of a function. For methods, the receiver is the first parameter.
 */
public final class Parameter implements Value {

    private final String name;
    private final Type type;
    private final Function parent;

    Parameter(String name, Type type, Function parent) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
        this.parent = Objects.requireNonNull(parent, "parent");
    }

    public Function parent() {
        return parent;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Type type() {
        return type;
    }

    @Override
    public String toString() {
        return name;
    }
}
