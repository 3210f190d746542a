package io.vtascan.types;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * An interface type: a set of method names with their signatures.
 * Methods are kept sorted by name, so method order does not affect identity.
 *
 * @param methods The complete method set, embedded interfaces flattened
 */
public record InterfaceType(List<Method> methods) implements Type {

    public static final InterfaceType EMPTY = new InterfaceType(List.of());

    /**
     * An interface method.
     */
    public record Method(String name, Signature signature) {
        public Method {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(signature, "signature");
        }

        @Override
        public String toString() {
            return name + signature.toString().substring("func".length());
        }
    }

    public InterfaceType {
        methods = methods.stream()
                .sorted(Comparator.comparing(Method::name))
                .toList();
        long distinct = methods.stream().map(Method::name).distinct().count();
        if (distinct != methods.size()) {
            throw new IllegalArgumentException("Duplicate method in interface: " + methods);
        }
    }

    public Optional<Method> method(String name) {
        return methods.stream()
                .filter(m -> m.name().equals(name))
                .findFirst();
    }

    public boolean isEmpty() {
        return methods.isEmpty();
    }

    @Override
    public String toString() {
        return methods.stream()
                .map(Method::toString)
                .collect(Collectors.joining("; ", "interface{", "}"));
    }
}
