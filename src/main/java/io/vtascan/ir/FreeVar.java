package io.vtascan.ir;

import io.vtascan.types.Type;

import java.util.Objects;

/**
 * A variable captured by a closure; bound by the {@link MakeClosure} that creates it.
 */
public final class FreeVar implements Value {

    private final String name;
    private final Type type;
    private final Function parent;

    FreeVar(String name, Type type, Function parent) {
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
