package io.vtascan.types;

import java.util.Objects;

/**
 * A map type {@code map[key]value}.
 */
public record MapType(Type key, Type value) implements Type {

    public MapType {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
    }

    @Override
    public String toString() {
        return "map[" + key + "]" + value;
    }
}
