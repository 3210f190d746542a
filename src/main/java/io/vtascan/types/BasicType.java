package io.vtascan.types;

import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * A predeclared basic type such as {@code int} or {@code string}.
 *
 * @param name The predeclared name
 */
public record BasicType(String name) implements Type {

    public static final BasicType BOOL = new BasicType("bool");
    public static final BasicType INT = new BasicType("int");
    public static final BasicType STRING = new BasicType("string");
    public static final BasicType BYTE = new BasicType("byte");
    public static final BasicType RUNE = new BasicType("rune");
    public static final BasicType FLOAT64 = new BasicType("float64");

    private static final Map<String, BasicType> PREDECLARED = Stream.of(
                    "bool", "string", "int", "int8", "int16", "int32", "int64",
                    "uint", "uint8", "uint16", "uint32", "uint64", "uintptr",
                    "float32", "float64", "complex64", "complex128", "byte", "rune")
            .map(BasicType::new)
            .collect(Collectors.toUnmodifiableMap(BasicType::name, Function.identity()));

    public BasicType {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Basic type name cannot be null or blank");
        }
    }

    /**
     * Looks up a predeclared basic type by name.
     */
    public static Optional<BasicType> predeclared(String name) {
        return Optional.ofNullable(PREDECLARED.get(name));
    }

    @Override
    public String toString() {
        return name;
    }
}
