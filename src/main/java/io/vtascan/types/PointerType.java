package io.vtascan.types;

import java.util.Objects;

/**
 * A pointer type {@code *elem}.
 */
public record PointerType(Type elem) implements Type {

    public PointerType {
        Objects.requireNonNull(elem, "elem");
    }

    @Override
    public String toString() {
        return "*" + elem;
    }
}
