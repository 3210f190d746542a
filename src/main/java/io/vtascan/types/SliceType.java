package io.vtascan.types;

import java.util.Objects;

/**
 * A slice type {@code []elem}.
 */
public record SliceType(Type elem) implements Type {

    public SliceType {
        Objects.requireNonNull(elem, "elem");
    }

    @Override
    public String toString() {
        return "[]" + elem;
    }
}
