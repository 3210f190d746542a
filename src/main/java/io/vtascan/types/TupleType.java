package io.vtascan.types;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The type of a multi-value register, e.g. the result of a call returning several values or
 * the {@code (value, ok)} pair of a comma-ok type assertion.
 */
public record TupleType(List<Type> elements) implements Type {

    public static final TupleType EMPTY = new TupleType(List.of());

    public TupleType {
        elements = List.copyOf(elements);
    }

    public static TupleType of(Type... elements) {
        return new TupleType(List.of(elements));
    }

    /**
     * Returns the element at the given index.
     *
     * @throws IndexOutOfBoundsException if the tuple has no such element
     */
    public Type at(int index) {
        return elements.get(index);
    }

    public int size() {
        return elements.size();
    }

    @Override
    public String toString() {
        return elements.stream()
                .map(Type::toString)
                .collect(Collectors.joining(", ", "(", ")"));
    }
}
