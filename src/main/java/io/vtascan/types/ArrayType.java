package io.vtascan.types;

import java.util.Objects;

/**
 * An array type {@code [length]elem}.
 */
public record ArrayType(Type elem, long length) implements Type {

    public ArrayType {
        Objects.requireNonNull(elem, "elem");
        if (length < 0) {
            throw new IllegalArgumentException("Array length cannot be negative: " + length);
        }
    }

    @Override
    public String toString() {
        return "[" + length + "]" + elem;
    }
}
